package com.profilebundler.inheritance;

import com.profilebundler.models.Profile;

import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Finds key/value pairs shared verbatim by every profile of a set.
 */
public class CommonPropertyExtractor {

    /**
     * Keys that stay with the profile that declares them: printer conditions,
     * vendor and model identifiers, and the inheritance pointer itself.
     */
    public static final List<String> DEFAULT_NEVER_HOIST_KEYS = List.of(
        "compatible_printers_condition",
        "compatible_printers",
        "filament_vendor",
        "printer_model",
        "nozzle_diameter",
        Profile.INHERITS
    );

    private final Set<String> neverHoistKeys;

    public CommonPropertyExtractor() {
        this(DEFAULT_NEVER_HOIST_KEYS);
    }

    public CommonPropertyExtractor(Collection<String> neverHoistKeys) {
        Set<String> keys = new LinkedHashSet<>();
        if (neverHoistKeys != null) {
            keys.addAll(neverHoistKeys);
        }
        keys.add(Profile.INHERITS);
        this.neverHoistKeys = keys;
    }

    public Set<String> getNeverHoistKeys() {
        return neverHoistKeys;
    }

    public boolean isHoistable(String key) {
        return !neverHoistKeys.contains(key);
    }

    /**
     * Properties identical across all profiles, minus never-hoist keys, sorted by key.
     * An empty input yields an empty map.
     */
    public TreeMap<String, String> commonProperties(List<Profile> profiles) {
        TreeMap<String, String> common = new TreeMap<>();
        if (profiles == null || profiles.isEmpty()) {
            return common;
        }
        common.putAll(profiles.get(0).getProperties());
        for (Profile profile : profiles.subList(1, profiles.size())) {
            Iterator<Map.Entry<String, String>> it = common.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, String> entry = it.next();
                if (!Objects.equals(profile.getProperty(entry.getKey()), entry.getValue())) {
                    it.remove();
                }
            }
        }
        common.keySet().removeAll(neverHoistKeys);
        return common;
    }
}
