package com.profilebundler.models;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A single named settings block read from (or destined for) an INI file.
 * Properties are kept sorted so serialized output is always alphabetized.
 */
public class Profile {

    public static final String INHERITS = "inherits";

    private Path sourceFile;
    private ProfileType type;
    private String name;
    private TreeMap<String, String> properties = new TreeMap<>();
    private List<String> rawLines = new ArrayList<>();
    private boolean implicit;

    public Profile() {
    }

    public Profile(Path sourceFile, ProfileType type, String name) {
        this.sourceFile = sourceFile;
        this.type = type;
        this.name = name;
    }

    /**
     * Copy with independent property and line collections.
     */
    public Profile copy() {
        Profile copy = new Profile(sourceFile, type, name);
        copy.setProperties(properties);
        copy.setRawLines(rawLines);
        copy.setImplicit(implicit);
        return copy;
    }

    public Path getSourceFile() {
        return sourceFile;
    }

    public void setSourceFile(Path sourceFile) {
        this.sourceFile = sourceFile;
    }

    public ProfileType getType() {
        return type;
    }

    public void setType(ProfileType type) {
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public TreeMap<String, String> getProperties() {
        return properties;
    }

    public void setProperties(Map<String, String> properties) {
        this.properties = properties != null ? new TreeMap<>(properties) : new TreeMap<>();
    }

    public String getProperty(String key) {
        return properties.get(key);
    }

    public void putProperty(String key, String value) {
        properties.put(key, value);
    }

    public String removeProperty(String key) {
        return properties.remove(key);
    }

    /**
     * Raw {@code inherits} value, or null when absent or blank.
     */
    public String getInherits() {
        String value = properties.get(INHERITS);
        return value == null || value.isEmpty() ? null : value;
    }

    public void setInherits(String parentName) {
        if (parentName == null || parentName.isEmpty()) {
            properties.remove(INHERITS);
        } else {
            properties.put(INHERITS, parentName);
        }
    }

    public List<String> getRawLines() {
        return rawLines;
    }

    public void setRawLines(List<String> rawLines) {
        this.rawLines = rawLines != null ? new ArrayList<>(rawLines) : new ArrayList<>();
    }

    /**
     * True for the default profile built from content that had no stanza header.
     */
    public boolean isImplicit() {
        return implicit;
    }

    public void setImplicit(boolean implicit) {
        this.implicit = implicit;
    }

    @Override
    public String toString() {
        return name + (sourceFile != null ? " (" + sourceFile.getFileName() + ")" : "");
    }
}
