package com.profilebundler;

import com.profilebundler.inheritance.CommonPropertyExtractor;
import com.profilebundler.inheritance.LeafClassifier;
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
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Moves the internal profiles of a selection into a vendor bundle file.
 *
 * Internal profiles are privatized ({@code *Name*}) and removed from their
 * original files. A synthesized {@code *Bundle*} profile holds their common
 * properties and every bundled profile inherits from it. With
 * {@link EngineSettings#isPreserveBundleChains()} a bundled profile whose parent
 * is bundled too keeps inheriting from that parent instead. Every reference to a
 * privatized profile in the profile directory is repointed. Leaf profiles stay
 * where they are.
 *
 * Bundling the same selection twice leaves one entry per profile in the bundle.
 * A failure part-way is not rolled back.
 */
public class BundleService {

    private static final String OPERATION = "bundle";

    private final ProfileStore store;
    private final EngineSettings settings;
    private final CommonPropertyExtractor extractor;
    private final boolean preserveChains;

    public BundleService(ProfileStore store, EngineSettings settings) {
        this.store = store;
        this.settings = settings != null ? settings : EngineSettings.defaults();
        this.extractor = this.settings.commonPropertyExtractor();
        this.preserveChains = this.settings.isPreserveBundleChains();
    }

    public static Path bundleFile(Path bundleDir, String bundleName) {
        return bundleDir.resolve(bundleName + StanzaCodec.INI_EXTENSION).toAbsolutePath().normalize();
    }

    /**
     * @param selection  profiles chosen by the caller, all of {@code type}
     * @param bundleName bundle identifier; names the file and the synthesized parent
     * @param profileDir directory whose files are scanned for references and cleaned up
     * @param bundleDir  directory receiving {@code <bundleName>.ini}
     */
    public OperationResult bundle(List<Profile> selection, String bundleName, ProfileType type,
                                  Path profileDir, Path bundleDir) {
        if (bundleName == null || bundleName.isBlank()) {
            return OperationResult.failed(OPERATION, "Bundle name is required");
        }
        if (NameResolver.containsUnsafeFilesystemChars(bundleName)) {
            return OperationResult.failed(OPERATION, "Bundle name contains unsafe characters: "
                + String.join(", ", NameResolver.unsafeFilesystemChars(bundleName)));
        }
        if (selection == null || selection.isEmpty()) {
            return OperationResult.nothingToDo(OPERATION, "No profiles to bundle");
        }

        OperationResult result = new OperationResult(OPERATION);
        StanzaCodec codec = new StanzaCodec(type);
        Path bundleFile = bundleFile(bundleDir, bundleName);

        List<ProfileDocument> corpus = new ArrayList<>();
        for (ProfileDocument document : store.loadAll(profileDir, codec)) {
            if (!document.getPath().equals(bundleFile)) {
                corpus.add(document);
            }
        }
        log("Loaded " + countProfiles(corpus, type) + " " + type + " profile(s) from " + corpus.size() + " file(s)");

        LeafClassifier.Classification classification = LeafClassifier.classify(selection);
        for (Profile leaf : classification.leaves()) {
            result.getLeafProfiles().add(leaf.getName());
        }
        if (!classification.hasInternals()) {
            log("No parent profiles found in selection - nothing to move to bundle");
            OperationResult nothing = OperationResult.nothingToDo(OPERATION,
                "No parent profiles found in selection - nothing to move to bundle");
            nothing.setLeafProfiles(result.getLeafProfiles());
            return nothing;
        }
        List<Profile> internals = classification.internals();
        for (Profile internal : internals) {
            logDebug("Internal profile (moves to bundle): " + internal.getName());
        }

        TreeMap<String, String> common = extractor.commonProperties(internals);
        result.setCommonProperties(common.size());
        Map<Profile, Profile> bundledParents = preserveChains ? bundledParents(internals) : new IdentityHashMap<>();
        Set<String> inheritValues = new HashSet<>();
        for (Profile internal : internals) {
            if (!bundledParents.containsKey(internal)) {
                inheritValues.add(internal.getInherits());
            }
        }
        String sharedInherits = inheritValues.size() == 1 ? inheritValues.iterator().next() : null;

        Map<String, String> renames = buildRenames(internals);

        try {
            ProfileDocument bundle = loadBundle(bundleFile, bundleName, codec);
            String parentDisplayName = NameResolver.privatize(bundleName);
            String parentName = type.qualify(parentDisplayName);
            Map<String, String> hoisted = synthesizeParent(bundle, parentName, common, sharedInherits, renames, type);

            for (Profile internal : internals) {
                String displayName = NameResolver.displayName(internal);
                String privatizedName = type.qualify(renames.getOrDefault(displayName, displayName));
                if (bundle.containsProfile(privatizedName)) {
                    log("Skipping duplicate in bundle: " + privatizedName);
                    result.addWarning("Already bundled: " + privatizedName);
                    continue;
                }
                Profile moved = internal.copy();
                hoisted.keySet().forEach(moved::removeProperty);
                Profile bundledParent = bundledParents.get(internal);
                if (bundledParent == null) {
                    moved.setInherits(parentDisplayName);
                } else {
                    String parentDisplay = NameResolver.displayName(bundledParent);
                    moved.setInherits(renames.getOrDefault(parentDisplay, parentDisplay));
                }
                moved.setName(privatizedName);
                moved.setSourceFile(bundle.getPath());
                moved.setImplicit(false);
                bundle.addProfile(moved);
                result.getProfilesMoved().add(privatizedName);
                logDebug("Bundled profile: " + privatizedName + " (inherits from " + moved.getInherits() + ")");
            }

            store.write(bundle, codec, result);
            result.setOutputFile(bundleFile.toString());

            rewriteCorpus(corpus, internals, renames, type, codec, result);
        } catch (IOException e) {
            logError("Bundle operation failed: " + e.getMessage());
            return result.fail("Bundle operation failed: " + e.getMessage());
        }

        result.setMessage("Moved " + internals.size() + " profile(s) into " + bundleFile.getFileName());
        log("Bundle operation completed: " + result.getProfilesMoved().size() + " moved, "
            + result.getLeafProfiles().size() + " leaf profile(s) left in place, "
            + result.getReferencesRewritten() + " reference(s) updated, "
            + result.getFilesDeleted().size() + " empty file(s) deleted");
        return result;
    }

    /**
     * Internals whose parent is itself being bundled, mapped to that parent.
     */
    private static Map<Profile, Profile> bundledParents(List<Profile> internals) {
        Map<Profile, Profile> parents = new IdentityHashMap<>();
        for (Profile internal : internals) {
            if (internal.getInherits() == null) {
                continue;
            }
            for (Profile candidate : internals) {
                if (candidate != internal && NameResolver.referencesByCoreName(internal, candidate.getName())) {
                    parents.put(internal, candidate);
                    break;
                }
            }
        }
        return parents;
    }

    /**
     * Display name to privatized display name, for internals not already privatized.
     */
    private Map<String, String> buildRenames(List<Profile> internals) {
        Map<String, String> renames = new LinkedHashMap<>();
        for (Profile internal : internals) {
            String displayName = NameResolver.displayName(internal);
            if (NameResolver.isPrivatized(displayName)) {
                continue;
            }
            String privatized = NameResolver.privatize(displayName);
            renames.put(displayName, privatized);
            logDebug("Will privatize: " + displayName + " -> " + privatized);
        }
        return renames;
    }

    private ProfileDocument loadBundle(Path bundleFile, String bundleName, StanzaCodec codec) {
        ProfileDocument bundle;
        if (store.exists(bundleFile)) {
            log("Bundle file already exists: " + bundleFile.getFileName());
            bundle = store.load(bundleFile, codec);
            bundle.getProfiles().removeIf(p -> p.isImplicit() && p.getProperties().isEmpty());
        } else {
            log("Creating new bundle file: " + bundleFile.getFileName());
            bundle = new ProfileDocument(bundleFile);
        }
        if (!bundle.hasVendorSection()) {
            EngineSettings.VendorSettings vendor = settings.getVendor();
            bundle.getForeignSections().add(0,
                StanzaCodec.vendorStanza(bundleName, vendor.getRepoId(), vendor.getConfigVersion()));
        }
        return bundle;
    }

    /**
     * Creates the bundle parent, or reuses an existing one untouched.
     *
     * @return properties to strip from the profiles being bundled
     */
    private Map<String, String> synthesizeParent(ProfileDocument bundle, String parentName,
                                                 TreeMap<String, String> common, String sharedInherits,
                                                 Map<String, String> renames, ProfileType type) {
        Profile existing = bundle.findProfile(parentName);
        if (existing != null) {
            log("Bundle parent already exists: " + parentName);
            Map<String, String> hoisted = new TreeMap<>();
            common.forEach((key, value) -> {
                if (Objects.equals(existing.getProperty(key), value)) {
                    hoisted.put(key, value);
                }
            });
            return hoisted;
        }

        Profile parent = new Profile(bundle.getPath(), type, parentName);
        parent.setProperties(common);
        if (sharedInherits != null) {
            String rewritten = rewriteReference(sharedInherits, renames);
            parent.setInherits(rewritten != null ? rewritten : sharedInherits);
        }
        bundle.addProfile(parent);
        log("Created bundle parent: " + parentName + " with " + common.size() + " common properties");
        return common;
    }

    /**
     * Repoints references to privatized profiles and removes the relocated ones,
     * one file at a time. Files left with nothing in them are deleted.
     */
    private void rewriteCorpus(List<ProfileDocument> corpus, List<Profile> internals, Map<String, String> renames,
                               ProfileType type, StanzaCodec codec, OperationResult result) throws IOException {
        Set<String> relocated = new HashSet<>();
        for (Profile internal : internals) {
            relocated.add(key(internal));
        }

        for (ProfileDocument document : corpus) {
            boolean changed = false;
            int removed = 0;

            Iterator<Profile> it = document.getProfiles().iterator();
            while (it.hasNext()) {
                Profile profile = it.next();
                if (profile.getType() != type) {
                    continue;
                }
                if (relocated.contains(key(profile))) {
                    it.remove();
                    removed++;
                    continue;
                }
                String inherits = profile.getInherits();
                String rewritten = rewriteReference(inherits, renames);
                if (rewritten != null && !rewritten.equals(inherits)) {
                    profile.setInherits(rewritten);
                    result.incrementReferencesRewritten();
                    changed = true;
                    logDebug("Updated " + document.getPath().getFileName() + ": " + profile.getName()
                        + " inherits: " + inherits + " -> " + rewritten);
                }
            }

            if (removed > 0 && document.isEmpty()) {
                store.delete(document.getPath(), result);
                log("Deleted empty file: " + document.getPath().getFileName());
            } else if (changed || removed > 0) {
                store.write(document, codec, result);
                if (removed > 0) {
                    logDebug("Removed " + removed + " profile(s) from " + document.getPath().getFileName());
                }
            }
        }
    }

    /**
     * Privatized name an {@code inherits} value should now use, matching on the
     * prefix-free name or on the tag-free core name; null when it names none of the renamed profiles.
     */
    static String rewriteReference(String inherits, Map<String, String> renames) {
        if (inherits == null) {
            return null;
        }
        String inheritsName = NameResolver.stripTypePrefix(inherits).trim();
        String inheritsCore = NameResolver.baseName(inherits);
        for (Map.Entry<String, String> entry : renames.entrySet()) {
            String original = entry.getKey();
            if (inheritsName.equals(original.trim()) || inheritsCore.equals(NameResolver.baseName(original))) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static String key(Profile profile) {
        Path source = profile.getSourceFile();
        String file = source != null ? source.toAbsolutePath().normalize().toString() : "";
        return file + "|" + profile.getName();
    }

    private static int countProfiles(List<ProfileDocument> documents, ProfileType type) {
        int count = 0;
        for (ProfileDocument document : documents) {
            count += document.getProfiles(type).size();
        }
        return count;
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[BundleService] " + message);
        }
    }

    private void logDebug(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.debug("[BundleService] " + message);
        }
    }

    private void logError(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.error("[BundleService] " + message);
        }
    }
}
