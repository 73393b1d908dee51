package com.profilebundler;

import com.profilebundler.inheritance.NameResolver;
import com.profilebundler.models.Profile;
import com.profilebundler.models.ProfileType;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Selection criteria for a profile type. Blank criteria match everything.
 *
 * Filament profiles are filtered on {@code filament_type} and
 * {@code filament_vendor}; print profiles on a tag (from {@code land_fm_tags}
 * or {@code @tag}s in the name), the layer height and the nozzle diameter
 * found in {@code compatible_printers_condition}.
 */
public abstract class ProfileFilter {

    private static final Pattern NOZZLE_CONDITION = Pattern.compile("nozzle_diameter\\[0\\]==(\\d*\\.?\\d+)");
    private static final Pattern BARE_NUMBER = Pattern.compile("^\\d*\\.?\\d+$");

    public abstract ProfileType getType();

    public abstract boolean matches(Profile profile);

    /**
     * Active criteria as {@code name=value} strings, for logging.
     */
    public abstract List<String> describe();

    public static ProfileFilter print(String tag, String layerHeight, String nozzle) {
        return new PrintFilter(tag, layerHeight, nozzle);
    }

    public static ProfileFilter filament(String filamentType, String vendor) {
        return new FilamentFilter(filamentType, vendor);
    }

    public static ProfileFilter matchAll(ProfileType type) {
        return type == ProfileType.FILAMENT ? filament(null, null) : print(null, null, null);
    }

    /**
     * Compares values such as {@code 0.2} and {@code 0.2mm} as equal by appending the
     * default unit to bare numbers.
     */
    static String normalizeForComparison(String value, String defaultUnit) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith("mm") || normalized.endsWith("%")) {
            return normalized;
        }
        if (BARE_NUMBER.matcher(normalized).matches()) {
            return normalized + defaultUnit;
        }
        return normalized;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String lower(String value) {
        return value == null ? null : value.trim().toLowerCase(Locale.ROOT);
    }

    static final class PrintFilter extends ProfileFilter {
        private final String tag;
        private final String layerHeight;
        private final String nozzle;

        PrintFilter(String tag, String layerHeight, String nozzle) {
            this.tag = tag;
            this.layerHeight = layerHeight;
            this.nozzle = nozzle;
        }

        @Override
        public ProfileType getType() {
            return ProfileType.PRINT;
        }

        @Override
        public boolean matches(Profile profile) {
            if (!isBlank(tag) && !tags(profile).contains(lower(tag))) {
                return false;
            }
            if (!isBlank(layerHeight)) {
                String wanted = normalizeForComparison(layerHeight, "mm");
                String actual = normalizeForComparison(profile.getProperty("layer_height"), "mm");
                if (!wanted.equals(actual)) {
                    return false;
                }
            }
            if (!isBlank(nozzle)) {
                String wanted = normalizeForComparison(nozzle, "mm");
                String actual = normalizeForComparison(nozzleDiameter(profile), "mm");
                return wanted.equals(actual);
            }
            return true;
        }

        @Override
        public List<String> describe() {
            List<String> parts = new ArrayList<>();
            if (!isBlank(tag)) parts.add("tag=" + tag);
            if (!isBlank(layerHeight)) parts.add("layer_height=" + layerHeight);
            if (!isBlank(nozzle)) parts.add("nozzle=" + nozzle);
            return parts;
        }

        static Set<String> tags(Profile profile) {
            Set<String> tags = new LinkedHashSet<>();
            String property = profile.getProperty("land_fm_tags");
            if (property != null) {
                for (String tag : property.split(",")) {
                    if (!tag.isBlank()) {
                        tags.add(lower(tag));
                    }
                }
            }
            for (String tag : NameResolver.tags(profile.getName())) {
                tags.add(lower(tag));
            }
            return tags;
        }

        static String nozzleDiameter(Profile profile) {
            String condition = profile.getProperty("compatible_printers_condition");
            if (condition == null) {
                return null;
            }
            Matcher matcher = NOZZLE_CONDITION.matcher(condition);
            return matcher.find() ? matcher.group(1) + "mm" : null;
        }
    }

    static final class FilamentFilter extends ProfileFilter {
        private final String filamentType;
        private final String vendor;

        FilamentFilter(String filamentType, String vendor) {
            this.filamentType = filamentType;
            this.vendor = vendor;
        }

        @Override
        public ProfileType getType() {
            return ProfileType.FILAMENT;
        }

        @Override
        public boolean matches(Profile profile) {
            if (!isBlank(filamentType) && !lower(filamentType).equals(lower(profile.getProperty("filament_type")))) {
                return false;
            }
            return isBlank(vendor) || lower(vendor).equals(lower(profile.getProperty("filament_vendor")));
        }

        @Override
        public List<String> describe() {
            List<String> parts = new ArrayList<>();
            if (!isBlank(filamentType)) parts.add("type=" + filamentType);
            if (!isBlank(vendor)) parts.add("vendor=" + vendor);
            return parts;
        }
    }
}
