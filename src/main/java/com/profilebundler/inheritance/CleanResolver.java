package com.profilebundler.inheritance;

import com.profilebundler.models.Profile;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Computes what a profile inherits and which of its own properties are redundant.
 */
public final class CleanResolver {

    private CleanResolver() {
    }

    /**
     * Properties supplied by the ancestor chain. Nearer ancestors override farther
     * ones; {@code inherits} is never part of the closure.
     */
    public static Map<String, String> inheritedClosure(Profile profile, Collection<Profile> allProfiles) {
        return inheritedClosure(profile, allProfiles, new HashSet<>());
    }

    private static Map<String, String> inheritedClosure(Profile profile, Collection<Profile> allProfiles,
                                                        Set<String> visited) {
        Map<String, String> inherited = new HashMap<>();
        if (!visited.add(profile.getName())) {
            return inherited;
        }
        Profile parent = InheritanceGraph.findParent(profile, allProfiles);
        if (parent == null) {
            return inherited;
        }
        inherited.putAll(inheritedClosure(parent, allProfiles, visited));
        parent.getProperties().forEach((key, value) -> {
            if (!Profile.INHERITS.equals(key)) {
                inherited.put(key, value);
            }
        });
        return inherited;
    }

    /**
     * The profile's properties without those whose value is already inherited.
     * {@code inherits} is always kept.
     */
    public static TreeMap<String, String> clean(Profile profile, Collection<Profile> allProfiles) {
        Map<String, String> inherited = inheritedClosure(profile, allProfiles);
        TreeMap<String, String> cleaned = new TreeMap<>();
        profile.getProperties().forEach((key, value) -> {
            if (Profile.INHERITS.equals(key)
                || !inherited.containsKey(key)
                || !Objects.equals(inherited.get(key), value)) {
                cleaned.put(key, value);
            }
        });
        return cleaned;
    }
}
