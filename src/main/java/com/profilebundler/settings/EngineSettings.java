package com.profilebundler.settings;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.profilebundler.inheritance.CommonPropertyExtractor;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunables read from {@code profile-bundler.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineSettings {

    public static final int DEFAULT_RELATIVE_SCALE = 6;

    private List<String> neverHoistKeys = new ArrayList<>(CommonPropertyExtractor.DEFAULT_NEVER_HOIST_KEYS);
    private VendorSettings vendor = new VendorSettings();
    private int relativeScale = DEFAULT_RELATIVE_SCALE;
    private boolean preserveBundleChains = false;

    public static EngineSettings defaults() {
        return new EngineSettings();
    }

    public List<String> getNeverHoistKeys() {
        return neverHoistKeys;
    }

    public void setNeverHoistKeys(List<String> neverHoistKeys) {
        this.neverHoistKeys = neverHoistKeys != null ? new ArrayList<>(neverHoistKeys) : new ArrayList<>();
    }

    public VendorSettings getVendor() {
        return vendor;
    }

    public void setVendor(VendorSettings vendor) {
        this.vendor = vendor != null ? vendor : new VendorSettings();
    }

    /**
     * Fractional digits kept when a relative update produces a non-integral value.
     */
    public int getRelativeScale() {
        return relativeScale;
    }

    public void setRelativeScale(int relativeScale) {
        this.relativeScale = relativeScale;
    }

    /**
     * When set, a bundled profile whose parent is bundled too keeps inheriting from
     * that parent instead of being re-parented onto the bundle parent.
     */
    public boolean isPreserveBundleChains() {
        return preserveBundleChains;
    }

    public void setPreserveBundleChains(boolean preserveBundleChains) {
        this.preserveBundleChains = preserveBundleChains;
    }

    public CommonPropertyExtractor commonPropertyExtractor() {
        return new CommonPropertyExtractor(neverHoistKeys);
    }

    /**
     * Metadata written into the {@code [vendor]} stanza of new bundle files.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VendorSettings {
        private String repoId = "non-prusa-fff";
        private String configVersion = "2.1.0";

        public String getRepoId() {
            return repoId;
        }

        public void setRepoId(String repoId) {
            this.repoId = repoId;
        }

        public String getConfigVersion() {
            return configVersion;
        }

        public void setConfigVersion(String configVersion) {
            this.configVersion = configVersion;
        }
    }
}
