package com.profilebundler;

import com.profilebundler.inheritance.CommonPropertyExtractor;
import com.profilebundler.inheritance.NameResolver;
import com.profilebundler.ini.StanzaCodec;
import com.profilebundler.models.OperationResult;
import com.profilebundler.models.Profile;
import com.profilebundler.models.ProfileDocument;
import com.profilebundler.models.ProfileType;
import com.profilebundler.settings.EngineSettings;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Extracts the properties a selection has in common into a new headerless
 * parent file and makes every selected profile inherit from it.
 */
public class CombineService {

    private static final String OPERATION = "combine";

    private final ProfileStore store;
    private final CommonPropertyExtractor extractor;

    public CombineService(ProfileStore store, EngineSettings settings) {
        this.store = store;
        this.extractor = (settings != null ? settings : EngineSettings.defaults()).commonPropertyExtractor();
    }

    public OperationResult combine(List<Profile> selection, String parentName, ProfileType type) {
        if (parentName == null || parentName.isBlank()) {
            return OperationResult.failed(OPERATION, "Parent profile name is required");
        }
        if (selection == null || selection.isEmpty()) {
            return OperationResult.nothingToDo(OPERATION, "No profiles to combine");
        }
        String fileName = NameResolver.sanitizeFilename(parentName);
        if (fileName.isEmpty()) {
            return OperationResult.failed(OPERATION, "Parent profile name has no usable characters: " + parentName);
        }

        TreeMap<String, String> common = extractor.commonProperties(selection);
        if (common.isEmpty()) {
            log("No common properties found across " + selection.size() + " profile(s)");
            return OperationResult.nothingToDo(OPERATION, "No common properties found");
        }

        Path firstSource = selection.get(0).getSourceFile().toAbsolutePath().normalize();
        Path parentFile = firstSource.resolveSibling(fileName + StanzaCodec.INI_EXTENSION);
        if (store.exists(parentFile)) {
            return OperationResult.failed(OPERATION, "Parent file already exists: " + parentFile);
        }

        OperationResult result = new OperationResult(OPERATION);
        result.setCommonProperties(common.size());
        StanzaCodec codec = new StanzaCodec(type);

        Profile parent = new Profile(parentFile, type, type.qualify(fileName));
        parent.setImplicit(true);
        parent.setProperties(common);
        String sharedInherits = sharedInherits(selection);
        if (sharedInherits != null) {
            parent.setInherits(sharedInherits);
        }
        ProfileDocument parentDocument = new ProfileDocument(parentFile);
        parentDocument.addProfile(parent);

        try {
            store.write(parentDocument, codec, result);
        } catch (IOException e) {
            logError("Failed to write parent profile: " + e.getMessage());
            return result.fail("Failed to write parent profile " + parentFile + ": " + e.getMessage());
        }
        result.setOutputFile(parentFile.toString());
        log("Created parent profile " + parentFile.getFileName() + " with " + common.size() + " common properties");

        for (Map.Entry<Path, List<Profile>> entry : bySourceFile(selection).entrySet()) {
            Path file = entry.getKey();
            ProfileDocument document = store.load(file, codec);
            boolean changed = false;
            for (Profile selected : entry.getValue()) {
                Profile target = document.findProfile(selected.getName());
                if (target == null) {
                    result.addWarning("Profile no longer present in " + file.getFileName() + ": " + selected.getName());
                    continue;
                }
                int removed = 0;
                for (String key : common.keySet()) {
                    if (target.removeProperty(key) != null) {
                        removed++;
                    }
                }
                target.setInherits(fileName);
                result.addPropertiesRemoved(removed);
                result.incrementProfilesChanged();
                changed = true;
            }
            if (!changed) {
                continue;
            }
            try {
                store.write(document, codec, result);
            } catch (IOException e) {
                logWarn("Failed to update " + file + ": " + e.getMessage());
                result.addWarning("Failed to update " + file + ": " + e.getMessage());
            }
        }

        result.setMessage("Combined " + result.getProfilesChanged() + " profile(s) under " + fileName);
        log(result.getMessage());
        return result;
    }

    /**
     * The {@code inherits} value every profile of the selection carries, or null
     * when they differ or none is set.
     */
    private static String sharedInherits(List<Profile> selection) {
        Set<String> values = new HashSet<>();
        for (Profile profile : selection) {
            values.add(profile.getInherits());
        }
        return values.size() == 1 ? values.iterator().next() : null;
    }

    private static Map<Path, List<Profile>> bySourceFile(List<Profile> selection) {
        Map<Path, List<Profile>> grouped = new LinkedHashMap<>();
        for (Profile profile : selection) {
            Path file = profile.getSourceFile().toAbsolutePath().normalize();
            grouped.computeIfAbsent(file, k -> new ArrayList<>()).add(profile);
        }
        return grouped;
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[CombineService] " + message);
        }
    }

    private void logWarn(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[CombineService] " + message);
        }
    }

    private void logError(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.error("[CombineService] " + message);
        }
    }
}
