package com.profilebundler.ini;

import java.util.regex.Pattern;

/**
 * Line-level rules of the profile INI dialect.
 */
public final class IniLines {

    static final Pattern PROFILE_HEADER = Pattern.compile("^\\s*\\[(print|filament):(.*?)]\\s*$");
    static final Pattern ANY_HEADER = Pattern.compile("^\\s*\\[([^\\]]+)]\\s*$");
    static final Pattern PROPERTY = Pattern.compile("^\\s*(\\w+)\\s*=\\s*(.*)$");

    private IniLines() {
    }

    /**
     * Drops a trailing comment. A {@code #} opens a comment at the start of the
     * line, or after whitespace unless the last non-blank character before it is
     * {@code =} (hex colour values such as {@code #FF8000}).
     */
    public static String stripComment(String line) {
        if (line == null) return "";
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) != '#') {
                continue;
            }
            if (i == 0) {
                return "";
            }
            if (!Character.isWhitespace(line.charAt(i - 1))) {
                continue;
            }
            int j = i - 1;
            while (j >= 0 && Character.isWhitespace(line.charAt(j))) {
                j--;
            }
            if (j < 0 || line.charAt(j) != '=') {
                return line.substring(0, i);
            }
        }
        return line;
    }

    public static boolean isPropertyLine(String cleanLine) {
        return PROPERTY.matcher(cleanLine).matches();
    }

    public static boolean isHeaderLine(String cleanLine) {
        return ANY_HEADER.matcher(cleanLine).matches();
    }

    public static boolean isBlank(String line) {
        return line == null || line.trim().isEmpty();
    }
}
