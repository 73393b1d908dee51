package com.profilebundler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.profilebundler.inheritance.NameResolver;
import com.profilebundler.models.OperationResult;
import com.profilebundler.models.Profile;
import com.profilebundler.models.ProfileType;
import com.profilebundler.models.ProfileValueException;
import com.profilebundler.models.UpdateExpression;
import com.profilebundler.settings.EngineSettings;
import com.profilebundler.settings.EngineSettingsStore;
import com.profilebundler.storage.ReportStorage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class Main {

    private static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            AppConfig config = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();
            System.exit(run(config));
        } catch (Exception e) {
            System.err.println("Failed to start Profile Bundler: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    /**
     * Runs one command and returns the process exit code.
     */
    static int run(AppConfig config) {
        initLogging(config);

        if (config.isHelp()) {
            printUsage();
            return 0;
        }
        if (!config.getErrors().isEmpty()) {
            config.getErrors().forEach(error -> logger.console("Error: " + error));
            printUsage();
            return 1;
        }
        String command = config.getCommand();
        if (command == null) {
            logger.console("Error: No command specified");
            printUsage();
            return 1;
        }

        EngineSettings settings = new EngineSettingsStore(objectMapper, config.getConfigPath()).loadOrDefault();
        ProfileStore store = new ProfileStore(config.isDryRun());
        if (store.isDryRun()) {
            logger.console("Dry run: no files will be changed");
        }

        List<OperationResult> results = new ArrayList<>();
        int exitCode;
        switch (command) {
            case "combine":
            case "bundle":
            case "update":
                exitCode = runProfileCommand(command, config, settings, store, results);
                break;
            case "clean":
                exitCode = runClean(config, settings, store, results);
                break;
            default:
                logger.console("Error: Invalid command '" + command + "'. Use 'combine', 'bundle', 'update', or 'clean'");
                printUsage();
                return 1;
        }

        for (OperationResult result : results) {
            printSummary(result);
        }
        if (config.getReportPath() != null && !results.isEmpty()) {
            try {
                ReportStorage.write(config.getReportPath(), results);
                logger.info("Report written to " + config.getReportPath());
            } catch (IOException e) {
                logger.error("Failed to write report: " + e.getMessage(), e);
                exitCode = 1;
            }
        }
        return exitCode;
    }

    private static void initLogging(AppConfig config) {
        if (AppLogger.get() == null) {
            try {
                AppLogger.initialize(config.getLogPath(), config.isVerbose());
            } catch (IOException e) {
                System.err.println("Log file unavailable, logging to console only: " + e.getMessage());
                try {
                    AppLogger.initialize(null, config.isVerbose());
                } catch (IOException fallback) {
                    throw new IllegalStateException("Console logging failed to start", fallback);
                }
            }
        }
        logger = AppLogger.get();
        logger.debug("Profile Bundler v" + VERSION + " in " + config.getWorkingDir());
    }

    // -------------------------------------------------------------------------
    // combine / bundle / update
    // -------------------------------------------------------------------------

    private static int runProfileCommand(String command, AppConfig config, EngineSettings settings,
                                         ProfileStore store, List<OperationResult> results) {
        List<String> arguments = config.getArguments();
        if (arguments.size() < 2) {
            logger.console("Error: No profile type specified");
            printUsage();
            return 1;
        }
        ProfileType type = ProfileType.fromKeywordOrNull(arguments.get(1));
        if (type == null) {
            logger.console("Error: Invalid profile type '" + arguments.get(1) + "'. Use 'print' or 'filament'");
            return 1;
        }

        String into = config.getInto();
        List<UpdateExpression> expressions = new ArrayList<>();
        if ("update".equals(command)) {
            if (arguments.size() < 3) {
                logger.console("Error: No update expressions provided for update mode");
                logger.console("Example: layer_height==+1 fill_overlap=40%");
                return 1;
            }
            for (String text : arguments.subList(2, arguments.size())) {
                try {
                    expressions.add(UpdateExpression.parse(text));
                } catch (ProfileValueException e) {
                    logger.console("Error: " + e.getMessage());
                    return 1;
                }
            }
        } else {
            if (into == null || into.isBlank()) {
                logger.console("Error: --into option is required for " + command + " mode");
                return 1;
            }
            if (NameResolver.containsUnsafeFilesystemChars(into)) {
                logger.console("Error: Name contains unsafe characters: "
                    + String.join(", ", NameResolver.unsafeFilesystemChars(into)));
                logger.console("Please avoid these characters: < > : \" | ? * \\ /");
                return 1;
            }
        }

        Path profileDir = config.getProfileDir(type);
        if (!Files.isDirectory(profileDir)) {
            logger.console("Directory '" + profileDir + "' does not exist.");
            return 1;
        }

        ProfileSelector selector = new ProfileSelector(store);
        List<Profile> selection = selector.select(profileDir, config.filterFor(type));
        if (selection.isEmpty()) {
            logger.console("No profiles match the specified filters in '" + profileDir + "'.");
            return 1;
        }
        if (config.isWithDescendants()) {
            selection = selector.withDescendants(selection, store.loadProfiles(List.of(profileDir), type));
        }
        printSelection(type, selection);

        OperationResult result;
        switch (command) {
            case "combine":
                result = new CombineService(store, settings).combine(selection, into, type);
                break;
            case "bundle":
                result = new BundleService(store, settings)
                    .bundle(selection, into, type, profileDir, config.getBundleDir());
                break;
            default:
                result = new UpdateService(store, settings).apply(selection, expressions);
                break;
        }
        results.add(result);
        return result.isSuccess() ? 0 : 1;
    }

    private static void printSelection(ProfileType type, List<Profile> selection) {
        logger.console("Matching " + type + " profiles:");
        for (Profile profile : selection) {
            List<String> tags = NameResolver.tags(profile.getName());
            String fileName = profile.getSourceFile() != null ? profile.getSourceFile().getFileName().toString() : "?";
            logger.console(fileName + ": " + NameResolver.displayName(profile)
                + (tags.isEmpty() ? "" : " (tags: " + String.join(", ", tags) + ")"));
        }
    }

    // -------------------------------------------------------------------------
    // clean
    // -------------------------------------------------------------------------

    private static int runClean(AppConfig config, EngineSettings settings, ProfileStore store,
                                List<OperationResult> results) {
        List<String> operands = config.getArguments().subList(1, config.getArguments().size());
        CleanService cleanService = new CleanService(store, settings);

        String bundleName = null;
        List<ProfileType> types = new ArrayList<>();
        if (operands.isEmpty()) {
            types.add(ProfileType.PRINT);
            types.add(ProfileType.FILAMENT);
        } else if (operands.size() == 1) {
            String operand = operands.get(0);
            ProfileType type = ProfileType.fromKeywordOrNull(operand);
            if (type != null) {
                types.add(type);
            } else if ("bundle".equals(operand)) {
                logger.console("Error: Bundle name is required for bundle cleaning");
                return 1;
            } else {
                bundleName = operand;
            }
        } else if (operands.size() == 2 && "bundle".equals(operands.get(0))) {
            bundleName = operands.get(1);
        } else {
            logger.console("Error: Invalid arguments for clean command");
            logger.console("Usage: clean [print|filament|bundle] [bundle_name]");
            return 1;
        }

        if (bundleName != null) {
            Map<ProfileType, Path> profileDirs = new EnumMap<>(ProfileType.class);
            for (ProfileType type : ProfileType.values()) {
                profileDirs.put(type, config.getProfileDir(type));
            }
            logger.console("Cleaning bundle: " + bundleName);
            OperationResult result = cleanService.cleanBundle(bundleName, config.getBundleDir(), profileDirs);
            results.add(result);
            return result.isSuccess() ? 0 : 1;
        }

        int exitCode = 0;
        for (ProfileType type : types) {
            logger.console("Cleaning " + type + " profiles...");
            OperationResult result = cleanService.cleanDirectory(type, config.getProfileDir(type), config.getBundleDir());
            results.add(result);
            if (!result.isSuccess()) {
                exitCode = 1;
            }
        }
        return exitCode;
    }

    // -------------------------------------------------------------------------
    // Output
    // -------------------------------------------------------------------------

    private static void printSummary(OperationResult result) {
        logger.console("");
        String mark = result.getStatus() == OperationResult.Status.FAILED ? "✗" : "✓";
        logger.console(mark + " " + result.getOperation() + ": "
            + (result.getMessage() != null ? result.getMessage() : result.getStatus()));
        if (result.getOutputFile() != null) {
            logger.console("  Output: " + result.getOutputFile());
        }
        if (!result.getProfilesMoved().isEmpty()) {
            logger.console("  Moved to bundle: " + String.join(", ", result.getProfilesMoved()));
        }
        if (!result.getLeafProfiles().isEmpty()) {
            logger.console("  Left in place: " + String.join(", ", result.getLeafProfiles()));
        }
        if (result.getReferencesRewritten() > 0) {
            logger.console("  Inheritance references updated: " + result.getReferencesRewritten());
        }
        for (String deleted : result.getFilesDeleted()) {
            logger.console("  Deleted: " + deleted);
        }
        for (String warning : result.getWarnings()) {
            logger.console("  Warning: " + warning);
        }
        for (String preview : result.getPreviews()) {
            logger.console(preview);
        }
    }

    private static void printUsage() {
        logger.console("Usage: profile-bundler <command> [arguments...] [options]");
        logger.console("");
        logger.console("Commands:");
        logger.console("  combine <profile_type> --into <name>   Combine matching profiles into a new parent profile");
        logger.console("  bundle <profile_type> --into <name>    Bundle matching profiles into a single file in the vendor folder");
        logger.console("  update <profile_type> [expressions]    Update properties in matching profiles");
        logger.console("  clean [print|filament|bundle] [name]   Remove redundant properties that match inherited values");
        logger.console("");
        logger.console("Update expressions:");
        logger.console("  key=value          Set a property");
        logger.console("  key==+N[%|mm]      Increase a numeric property (key==-N decreases)");
        logger.console("");
        logger.console("Options:");
        logger.console("  --tag TAG              Filter print profiles by tag (alias: --sub-profile)");
        logger.console("  --nozzle DIAMETER      Filter print profiles by nozzle diameter (e.g. 0.4 or 0.4mm)");
        logger.console("  --layer-height HEIGHT  Filter print profiles by layer height (e.g. 0.3 or 0.3mm)");
        logger.console("  --type TYPE            Filter filament profiles by type (e.g. ASA)");
        logger.console("  --vendor VENDOR        Filter filament profiles by vendor");
        logger.console("  --into NAME            Name of the combined parent or bundle");
        logger.console("  --with-descendants     Also select profiles inheriting from the matches");
        logger.console("  --profile-dir DIR      Profile directory (default: ./print or ./filament)");
        logger.console("  --bundle-dir DIR       Bundle directory (default: ./vendor)");
        logger.console("  --config FILE          Settings file (default: ./profile-bundler.json)");
        logger.console("  --report FILE          Write the operation results as JSON");
        logger.console("  --dry-run              Show diffs instead of changing files");
        logger.console("  --verbose, -v          Print debug output");
        logger.console("  --help, -h             Show this help message");
    }
}
