package com.profilebundler.models;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One parsed INI file: its profiles in file order plus any foreign sections.
 */
public class ProfileDocument {

    private final Path path;
    private final List<Profile> profiles = new ArrayList<>();
    private final List<ForeignSection> foreignSections = new ArrayList<>();

    public ProfileDocument(Path path) {
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    public List<Profile> getProfiles() {
        return profiles;
    }

    public List<Profile> getProfiles(ProfileType type) {
        return profiles.stream()
            .filter(p -> p.getType() == type)
            .collect(Collectors.toList());
    }

    public List<ForeignSection> getForeignSections() {
        return foreignSections;
    }

    public void addProfile(Profile profile) {
        profiles.add(profile);
    }

    public void addForeignSection(ForeignSection section) {
        foreignSections.add(section);
    }

    public Profile findProfile(String qualifiedName) {
        if (qualifiedName == null) return null;
        for (Profile profile : profiles) {
            if (qualifiedName.equals(profile.getName())) {
                return profile;
            }
        }
        return null;
    }

    public boolean containsProfile(String qualifiedName) {
        return findProfile(qualifiedName) != null;
    }

    public boolean hasVendorSection() {
        return foreignSections.stream().anyMatch(ForeignSection::isVendor);
    }

    /**
     * True when nothing worth keeping on disk remains.
     */
    public boolean isEmpty() {
        return profiles.isEmpty() && foreignSections.isEmpty();
    }
}
