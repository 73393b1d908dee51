package com.profilebundler.models;

import java.util.Locale;

/**
 * The two profile families the engine manages. Each carries its INI stanza
 * keyword and its own filter semantics (see {@code ProfileFilter}).
 */
public enum ProfileType {
    PRINT("print"),
    FILAMENT("filament");

    private final String keyword;

    ProfileType(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * Prefix used in qualified profile names, e.g. {@code "print: "}.
     */
    public String qualifiedPrefix() {
        return keyword + ": ";
    }

    public String qualify(String displayName) {
        return qualifiedPrefix() + displayName;
    }

    public static ProfileType fromKeyword(String keyword) {
        ProfileType type = fromKeywordOrNull(keyword);
        if (type == null) {
            throw new IllegalArgumentException("Unknown profile type: " + keyword);
        }
        return type;
    }

    public static ProfileType fromKeywordOrNull(String keyword) {
        if (keyword == null) {
            return null;
        }
        String normalized = keyword.trim().toLowerCase(Locale.ROOT);
        for (ProfileType type : values()) {
            if (type.keyword.equals(normalized)) {
                return type;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return keyword;
    }
}
