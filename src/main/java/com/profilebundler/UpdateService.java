package com.profilebundler;

import com.profilebundler.ini.StanzaCodec;
import com.profilebundler.models.OperationResult;
import com.profilebundler.models.Profile;
import com.profilebundler.models.ProfileDocument;
import com.profilebundler.models.ProfileValue;
import com.profilebundler.models.ProfileValueException;
import com.profilebundler.models.UpdateExpression;
import com.profilebundler.settings.EngineSettings;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies property edits to every profile of a selection and rewrites the files
 * that changed. Relative edits that cannot be applied to a profile are skipped
 * for that profile and reported as warnings.
 */
public class UpdateService {

    private static final String OPERATION = "update";

    private final ProfileStore store;
    private final int relativeScale;

    public UpdateService(ProfileStore store, EngineSettings settings) {
        this.store = store;
        this.relativeScale = (settings != null ? settings : EngineSettings.defaults()).getRelativeScale();
    }

    public OperationResult apply(List<Profile> selection, List<UpdateExpression> expressions) {
        if (expressions == null || expressions.isEmpty()) {
            return OperationResult.failed(OPERATION, "No update expressions given");
        }
        if (selection == null || selection.isEmpty()) {
            return OperationResult.nothingToDo(OPERATION, "No profiles to update");
        }

        OperationResult result = new OperationResult(OPERATION);
        for (Map.Entry<Path, List<Profile>> entry : bySourceFile(selection).entrySet()) {
            Path file = entry.getKey();
            List<Profile> selected = entry.getValue();
            StanzaCodec codec = new StanzaCodec(selected.get(0).getType());
            ProfileDocument document = store.load(file, codec);
            result.setFilesProcessed(result.getFilesProcessed() + 1);

            boolean fileChanged = false;
            for (Profile profile : selected) {
                Profile target = document.findProfile(profile.getName());
                if (target == null) {
                    result.addWarning("Profile no longer present in " + file.getFileName() + ": " + profile.getName());
                    continue;
                }
                if (applyTo(target, expressions, result)) {
                    result.incrementProfilesChanged();
                    fileChanged = true;
                }
            }
            if (!fileChanged) {
                continue;
            }
            try {
                store.write(document, codec, result);
            } catch (IOException e) {
                logWarn("Failed to update " + file + ": " + e.getMessage());
                result.addWarning("Failed to update " + file + ": " + e.getMessage());
            }
        }

        if (result.getProfilesChanged() == 0) {
            result.setStatus(OperationResult.Status.NOTHING_TO_DO);
            result.setMessage("No profile needed changes");
        } else {
            result.setMessage("Updated " + result.getProfilesChanged() + " profile(s)");
        }
        log(result.getMessage());
        return result;
    }

    /**
     * @return true if any property of {@code profile} changed
     */
    private boolean applyTo(Profile profile, List<UpdateExpression> expressions, OperationResult result) {
        boolean changed = false;
        for (UpdateExpression expression : expressions) {
            String key = expression.getProperty();
            String current = profile.getProperty(key);
            String updated;
            if (expression.getKind() == UpdateExpression.Kind.ABSOLUTE) {
                updated = expression.getValue();
            } else {
                if (current == null) {
                    skip(result, profile, expression, "property not set");
                    continue;
                }
                try {
                    updated = adjust(current, expression);
                } catch (ProfileValueException e) {
                    skip(result, profile, expression, e.getMessage());
                    continue;
                }
            }
            if (!updated.equals(current)) {
                profile.putProperty(key, updated);
                changed = true;
                logDebug(profile.getName() + ": " + key + " " + (current != null ? current : "(not set)")
                    + " -> " + updated);
            }
        }
        return changed;
    }

    String adjust(String current, UpdateExpression expression) throws ProfileValueException {
        ProfileValue value = ProfileValue.parse(current);
        ProfileValue.Unit unit = expression.getUnit() != null ? expression.getUnit() : value.getUnit();
        return value.adjust(expression.getDelta(), unit).format(relativeScale);
    }

    private void skip(OperationResult result, Profile profile, UpdateExpression expression, String reason) {
        String warning = "Skipped " + expression + " for " + profile.getName() + ": " + reason;
        result.addWarning(warning);
        logWarn(warning);
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
            logger.info("[UpdateService] " + message);
        }
    }

    private void logDebug(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.debug("[UpdateService] " + message);
        }
    }

    private void logWarn(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[UpdateService] " + message);
        }
    }
}
