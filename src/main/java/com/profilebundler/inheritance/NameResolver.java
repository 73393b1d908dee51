package com.profilebundler.inheritance;

import com.profilebundler.models.Profile;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Profile name handling: type prefixes, {@code @tag} tokens, privatization and
 * the matching rules used to decide whether an {@code inherits} value points at
 * a given profile.
 *
 * Two levels of matching exist:
 *   - {@link #inheritsFrom}: exact, trimmed, prefix-stripped, prefix-stripped and trimmed.
 *   - {@link #referencesByCoreName}: the above, or equal base names once tags are removed.
 */
public final class NameResolver {

    private static final Pattern TYPE_PREFIX = Pattern.compile("^(print|filament):\\s*");
    private static final Pattern TAG = Pattern.compile("@([^\\s*]+)");
    private static final Pattern UNSAFE_FILESYSTEM_CHARS = Pattern.compile("[<>:\"|?*\\\\/\\x00-\\x1f\\x7f]");
    private static final Pattern FILENAME_REPLACE = Pattern.compile("[^\\w\\s@.\\-()]+");

    private NameResolver() {
    }

    /**
     * Base name and tags of a profile name.
     */
    public record ProfileName(String baseName, List<String> tags) {
        public ProfileName {
            tags = List.copyOf(tags);
        }
    }

    public static ProfileName normalize(String name) {
        String namePart = stripTypePrefix(name);
        List<String> tags = new ArrayList<>();
        Matcher matcher = TAG.matcher(namePart);
        while (matcher.find()) {
            tags.add(matcher.group(1));
        }
        String baseName = TAG.matcher(namePart).replaceAll("").trim().replaceAll("\\s+", " ");
        return new ProfileName(baseName, tags);
    }

    public static String baseName(String name) {
        return normalize(name).baseName();
    }

    public static List<String> tags(String name) {
        return normalize(name).tags();
    }

    /**
     * Removes a leading {@code print:} or {@code filament:} prefix and the whitespace after it.
     */
    public static String stripTypePrefix(String name) {
        if (name == null) return "";
        return TYPE_PREFIX.matcher(name).replaceFirst("");
    }

    public static String displayName(Profile profile) {
        return stripTypePrefix(profile.getName());
    }

    public static boolean coreNameEquals(String a, String b) {
        if (a == null || b == null) return false;
        return baseName(a).equals(baseName(b));
    }

    /**
     * True if the child's {@code inherits} value names {@code parentName}, tolerating
     * surrounding whitespace and a missing or extra type prefix.
     */
    public static boolean inheritsFrom(Profile child, String parentName) {
        if (child == null || parentName == null) return false;
        String inherits = child.getInherits();
        if (inherits == null) return false;

        if (inherits.equals(parentName)) return true;
        if (inherits.trim().equals(parentName.trim())) return true;

        String inheritsWithoutPrefix = stripTypePrefix(inherits);
        String parentWithoutPrefix = stripTypePrefix(parentName);
        if (inheritsWithoutPrefix.equals(parentWithoutPrefix)) return true;
        return inheritsWithoutPrefix.trim().equals(parentWithoutPrefix.trim());
    }

    /**
     * Like {@link #inheritsFrom} but also accepts a reference that omits the parent's tags.
     */
    public static boolean referencesByCoreName(Profile child, String parentName) {
        if (inheritsFrom(child, parentName)) return true;
        String inherits = child != null ? child.getInherits() : null;
        return inherits != null && coreNameEquals(inherits, parentName);
    }

    public static boolean isPrivatized(String displayName) {
        if (displayName == null) return false;
        String trimmed = displayName.trim();
        return trimmed.length() >= 2 && trimmed.startsWith("*") && trimmed.endsWith("*");
    }

    /**
     * Wraps a display name in asterisks. Already privatized names come back unchanged.
     */
    public static String privatize(String displayName) {
        String name = stripTypePrefix(displayName);
        if (isPrivatized(name)) {
            return name;
        }
        return "*" + name + "*";
    }

    /**
     * Characters in {@code name} that NTFS or macOS refuse in file names, in first-seen order.
     */
    public static Set<String> unsafeFilesystemChars(String name) {
        Set<String> found = new LinkedHashSet<>();
        if (name == null) return found;
        Matcher matcher = UNSAFE_FILESYSTEM_CHARS.matcher(name);
        while (matcher.find()) {
            found.add(matcher.group());
        }
        return found;
    }

    public static boolean containsUnsafeFilesystemChars(String name) {
        return !unsafeFilesystemChars(name).isEmpty();
    }

    /**
     * File name (without extension) for a profile name: prefix removed, tags kept,
     * unusual characters replaced with {@code _}.
     */
    public static String sanitizeFilename(String name) {
        return FILENAME_REPLACE.matcher(stripTypePrefix(name)).replaceAll("_").trim();
    }
}
