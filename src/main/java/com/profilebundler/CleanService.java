package com.profilebundler;

import com.profilebundler.inheritance.CleanResolver;
import com.profilebundler.inheritance.CommonPropertyExtractor;
import com.profilebundler.inheritance.InheritanceGraph;
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
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Removes properties that merely repeat an inherited value.
 *
 * Directory cleaning rewrites profile files only; bundle files contribute
 * ancestors but are never touched. Bundle cleaning additionally pulls
 * properties shared by every child of the bundle parent up into that parent.
 */
public class CleanService {

    private static final String CLEAN = "clean";
    private static final String CLEAN_BUNDLE = "clean-bundle";

    private final ProfileStore store;
    private final CommonPropertyExtractor extractor;

    public CleanService(ProfileStore store, EngineSettings settings) {
        this.store = store;
        this.extractor = (settings != null ? settings : EngineSettings.defaults()).commonPropertyExtractor();
    }

    // -------------------------------------------------------------------------
    // Profile directories
    // -------------------------------------------------------------------------

    /**
     * Cleans every {@code type} profile in {@code profileDir} against its ancestors,
     * which may live in {@code profileDir} or in any bundle of {@code vendorDir}.
     */
    public OperationResult cleanDirectory(ProfileType type, Path profileDir, Path vendorDir) {
        OperationResult result = new OperationResult(CLEAN);
        StanzaCodec codec = new StanzaCodec(type);

        List<ProfileDocument> targets = store.loadAll(profileDir, codec);
        List<Profile> corpus = new ArrayList<>();
        for (ProfileDocument document : targets) {
            corpus.addAll(document.getProfiles(type));
        }
        if (vendorDir != null) {
            corpus.addAll(store.loadProfiles(List.of(vendorDir), type));
        }
        result.setFilesProcessed(targets.size());
        log("Cleaning " + type + " profiles in " + targets.size() + " file(s), " + corpus.size() + " profile(s) in scope");

        // Resolve against the untouched corpus before mutating anything
        Map<Profile, TreeMap<String, String>> cleaned = new IdentityHashMap<>();
        for (ProfileDocument document : targets) {
            for (Profile profile : document.getProfiles(type)) {
                cleaned.put(profile, CleanResolver.clean(profile, corpus));
            }
        }

        for (ProfileDocument document : targets) {
            boolean changed = false;
            for (Profile profile : document.getProfiles(type)) {
                changed |= applyClean(profile, cleaned.get(profile), result);
            }
            if (changed) {
                writeOrWarn(document, codec, result);
            }
        }
        return finish(result, "profile(s)");
    }

    // -------------------------------------------------------------------------
    // Bundles
    // -------------------------------------------------------------------------

    /**
     * Cleans a bundle file in place, optimizes its parent, then cleans external
     * profiles that inherit from the bundle.
     *
     * @param profileDirs profile directory per type; types without an entry have no external profiles
     */
    public OperationResult cleanBundle(String bundleName, Path bundleDir, Map<ProfileType, Path> profileDirs) {
        if (bundleName == null || bundleName.isBlank()) {
            return OperationResult.failed(CLEAN_BUNDLE, "Bundle name is required");
        }
        Path bundleFile = BundleService.bundleFile(bundleDir, bundleName);
        if (!store.exists(bundleFile)) {
            return OperationResult.failed(CLEAN_BUNDLE, "Bundle file not found: " + bundleFile);
        }

        OperationResult result = new OperationResult(CLEAN_BUNDLE);
        result.setOutputFile(bundleFile.toString());
        StanzaCodec bundleCodec = new StanzaCodec(ProfileType.PRINT);
        ProfileDocument bundle = store.load(bundleFile, bundleCodec);
        result.setFilesProcessed(1);
        boolean bundleChanged = false;

        for (ProfileType type : ProfileType.values()) {
            List<Profile> group = bundle.getProfiles(type);
            if (group.isEmpty()) {
                continue;
            }
            StanzaCodec codec = new StanzaCodec(type);
            Path profileDir = profileDirs != null ? profileDirs.get(type) : null;
            List<ProfileDocument> externalDocuments = profileDir != null
                ? store.loadAll(profileDir, codec) : new ArrayList<>();

            List<Profile> corpus = new ArrayList<>(group);
            for (ProfileDocument document : externalDocuments) {
                corpus.addAll(document.getProfiles(type));
            }
            corpus.addAll(otherBundleProfiles(bundleDir, bundleFile, codec, type));
            log("Cleaning " + group.size() + " " + type + " profile(s) in " + bundleFile.getFileName());

            Map<Profile, TreeMap<String, String>> cleaned = new IdentityHashMap<>();
            for (Profile profile : group) {
                cleaned.put(profile, CleanResolver.clean(profile, corpus));
            }
            for (Profile profile : group) {
                bundleChanged |= applyClean(profile, cleaned.get(profile), result);
            }

            bundleChanged |= hoistIntoParent(bundle, bundleName, type, result);

            result.setFilesProcessed(result.getFilesProcessed() + externalDocuments.size());
            cleanExternalChildren(group, externalDocuments, corpus, codec, result);
        }

        if (bundleChanged) {
            writeOrWarn(bundle, bundleCodec, result);
        }
        return finish(result, "profile(s) in and around " + bundleFile.getFileName());
    }

    /**
     * Moves properties shared by all children of {@code *bundleName*} into it.
     * Needs at least two children.
     */
    private boolean hoistIntoParent(ProfileDocument bundle, String bundleName, ProfileType type,
                                    OperationResult result) {
        String parentName = type.qualify(NameResolver.privatize(bundleName));
        Profile parent = bundle.findProfile(parentName);
        if (parent == null) {
            return false;
        }
        List<Profile> children = new ArrayList<>();
        for (Profile child : InheritanceGraph.directChildren(bundle.getProfiles(type), parentName)) {
            if (child != parent) {
                children.add(child);
            }
        }
        if (children.size() < 2) {
            return false;
        }

        TreeMap<String, String> common = extractor.commonProperties(children);
        if (common.isEmpty()) {
            return false;
        }
        common.forEach(parent::putProperty);
        for (Profile child : children) {
            common.keySet().forEach(child::removeProperty);
            result.incrementProfilesChanged();
        }
        result.addPropertiesRemoved(common.size() * (children.size() - 1));
        log("Moved " + common.size() + " shared properties into " + parentName);
        return true;
    }

    /**
     * Cleans external profiles whose parent lives in the bundle.
     */
    private void cleanExternalChildren(List<Profile> group, List<ProfileDocument> externalDocuments,
                                       List<Profile> corpus, StanzaCodec codec, OperationResult result) {
        for (ProfileDocument document : externalDocuments) {
            boolean changed = false;
            for (Profile profile : document.getProfiles(codec.getDefaultType())) {
                if (!inheritsFromAny(profile, group)) {
                    continue;
                }
                changed |= applyClean(profile, CleanResolver.clean(profile, corpus), result);
            }
            if (changed) {
                writeOrWarn(document, codec, result);
            }
        }
    }

    private List<Profile> otherBundleProfiles(Path bundleDir, Path bundleFile, StanzaCodec codec, ProfileType type) {
        List<Profile> profiles = new ArrayList<>();
        for (Path file : store.listProfileFiles(bundleDir)) {
            if (!file.equals(bundleFile)) {
                profiles.addAll(store.load(file, codec).getProfiles(type));
            }
        }
        return profiles;
    }

    private static boolean inheritsFromAny(Profile profile, List<Profile> parents) {
        for (Profile parent : parents) {
            if (NameResolver.inheritsFrom(profile, parent.getName())) {
                return true;
            }
        }
        return false;
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private boolean applyClean(Profile profile, TreeMap<String, String> cleaned, OperationResult result) {
        int removed = profile.getProperties().size() - cleaned.size();
        if (removed <= 0) {
            return false;
        }
        profile.setProperties(cleaned);
        result.addPropertiesRemoved(removed);
        result.incrementProfilesChanged();
        logDebug("Removed " + removed + " redundant properties from " + profile.getName());
        return true;
    }

    private void writeOrWarn(ProfileDocument document, StanzaCodec codec, OperationResult result) {
        try {
            store.write(document, codec, result);
        } catch (IOException e) {
            logWarn("Failed to write " + document.getPath() + ": " + e.getMessage());
            result.addWarning("Failed to write " + document.getPath() + ": " + e.getMessage());
        }
    }

    private OperationResult finish(OperationResult result, String scope) {
        if (result.getProfilesChanged() == 0) {
            result.setStatus(OperationResult.Status.NOTHING_TO_DO);
            result.setMessage("No redundant properties found");
        } else {
            result.setMessage("Removed " + result.getPropertiesRemoved() + " redundant properties from "
                + result.getProfilesChanged() + " " + scope);
        }
        log(result.getMessage());
        return result;
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[CleanService] " + message);
        }
    }

    private void logDebug(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.debug("[CleanService] " + message);
        }
    }

    private void logWarn(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[CleanService] " + message);
        }
    }
}
