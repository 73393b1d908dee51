package com.profilebundler.settings;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.profilebundler.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads and saves {@link EngineSettings}. Missing or unreadable files fall back to defaults.
 */
public class EngineSettingsStore {

    public static final String DEFAULT_PATH = "profile-bundler.json";

    private final ObjectMapper mapper;
    private final Path path;

    public EngineSettingsStore(ObjectMapper mapper) {
        this(mapper, Paths.get(DEFAULT_PATH));
    }

    public EngineSettingsStore(ObjectMapper mapper, Path path) {
        this.mapper = mapper != null ? mapper : new ObjectMapper();
        this.path = path != null ? path : Paths.get(DEFAULT_PATH);
    }

    public Path getPath() {
        return path;
    }

    public EngineSettings loadOrDefault() {
        return loadOrDefault(EngineSettings.defaults());
    }

    public EngineSettings loadOrDefault(EngineSettings defaults) {
        EngineSettings base = defaults != null ? defaults : EngineSettings.defaults();
        if (!Files.exists(path)) {
            return base;
        }

        try {
            EngineSettings stored = mapper.readValue(path.toFile(), EngineSettings.class);
            log("Loaded settings from " + path);
            return merge(base, stored);
        } catch (Exception e) {
            logWarn("Failed to load settings, using defaults: " + e.getMessage());
            return base;
        }
    }

    public void save(EngineSettings settings) throws IOException {
        if (settings == null) return;
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), settings);
        log("Saved settings to " + path);
    }

    private EngineSettings merge(EngineSettings defaults, EngineSettings stored) {
        if (stored == null) {
            return defaults;
        }

        EngineSettings result = new EngineSettings();
        result.setNeverHoistKeys(copyListOrDefault(stored.getNeverHoistKeys(), defaults.getNeverHoistKeys()));
        result.setRelativeScale(stored.getRelativeScale() > 0 ? stored.getRelativeScale() : defaults.getRelativeScale());
        result.setPreserveBundleChains(stored.isPreserveBundleChains());

        EngineSettings.VendorSettings vendor = new EngineSettings.VendorSettings();
        EngineSettings.VendorSettings storedVendor = stored.getVendor();
        EngineSettings.VendorSettings defaultVendor = defaults.getVendor();
        vendor.setRepoId(nonBlankOr(storedVendor.getRepoId(), defaultVendor.getRepoId()));
        vendor.setConfigVersion(nonBlankOr(storedVendor.getConfigVersion(), defaultVendor.getConfigVersion()));
        result.setVendor(vendor);
        return result;
    }

    private List<String> copyListOrDefault(List<String> source, List<String> defaults) {
        if (source != null && !source.isEmpty()) {
            return new ArrayList<>(source);
        }
        return defaults != null ? new ArrayList<>(defaults) : new ArrayList<>();
    }

    private String nonBlankOr(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[EngineSettingsStore] " + message);
        }
    }

    private void logWarn(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[EngineSettingsStore] " + message);
        }
    }
}
