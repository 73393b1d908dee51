package com.profilebundler;

import com.profilebundler.models.ProfileType;
import com.profilebundler.settings.EngineSettingsStore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Command-line configuration: the command and its arguments, directories,
 * selection filters and run flags.
 */
public class AppConfig {

    private static final String APP_NAME = "Profile-Bundler";
    private static final String BUNDLE_DIR_NAME = "vendor";

    private final List<String> arguments;
    private final List<String> errors;
    private final Path workingDir;
    private final Path profileDir;
    private final Path bundleDir;
    private final Path configPath;
    private final Path logPath;
    private final Path reportPath;
    private final boolean dryRun;
    private final boolean verbose;
    private final boolean withDescendants;
    private final boolean help;
    private final String into;
    private final String tag;
    private final String nozzle;
    private final String layerHeight;
    private final String filamentType;
    private final String vendor;

    private AppConfig(Builder builder, Path workingDir, Path logPath) {
        this.arguments = Collections.unmodifiableList(new ArrayList<>(builder.arguments));
        this.errors = Collections.unmodifiableList(new ArrayList<>(builder.errors));
        this.workingDir = workingDir;
        this.profileDir = builder.profileDir;
        this.bundleDir = builder.bundleDir;
        this.configPath = builder.configPath != null ? builder.configPath : workingDir.resolve(EngineSettingsStore.DEFAULT_PATH);
        this.logPath = logPath;
        this.reportPath = builder.reportPath;
        this.dryRun = builder.dryRun;
        this.verbose = builder.verbose;
        this.withDescendants = builder.withDescendants;
        this.help = builder.help;
        this.into = builder.into;
        this.tag = builder.tag;
        this.nozzle = builder.nozzle;
        this.layerHeight = builder.layerHeight;
        this.filamentType = builder.filamentType;
        this.vendor = builder.vendor;
    }

    /**
     * Positional arguments: the command followed by its operands.
     */
    public List<String> getArguments() {
        return arguments;
    }

    public String getCommand() {
        return arguments.isEmpty() ? null : arguments.get(0);
    }

    /**
     * Problems found while parsing, such as unknown options or missing option values.
     */
    public List<String> getErrors() {
        return errors;
    }

    public Path getWorkingDir() {
        return workingDir;
    }

    /**
     * The {@code --profile-dir} override, or {@code <working dir>/<type>}.
     */
    public Path getProfileDir(ProfileType type) {
        return profileDir != null ? profileDir : workingDir.resolve(type.getKeyword());
    }

    public Path getBundleDir() {
        return bundleDir != null ? bundleDir : workingDir.resolve(BUNDLE_DIR_NAME);
    }

    public Path getConfigPath() {
        return configPath;
    }

    public Path getLogPath() {
        return logPath;
    }

    public Path getReportPath() {
        return reportPath;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isWithDescendants() {
        return withDescendants;
    }

    public boolean isHelp() {
        return help;
    }

    public String getInto() {
        return into;
    }

    public ProfileFilter filterFor(ProfileType type) {
        if (type == ProfileType.FILAMENT) {
            return ProfileFilter.filament(filamentType, vendor);
        }
        return ProfileFilter.print(tag, layerHeight, nozzle);
    }

    /**
     * Get the log directory path based on the operating system.
     * Windows: %APPDATA%\Profile-Bundler\logs
     * macOS: ~/Library/Logs/Profile-Bundler
     * Linux: ~/.local/share/Profile-Bundler/logs
     */
    public static Path getLogDirectory() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME, "logs");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Logs", APP_NAME);
        } else {
            return Paths.get(userHome, ".local", "share", APP_NAME, "logs");
        }
    }

    public static Path getLogFilePath() {
        return getLogDirectory().resolve("profile-bundler.log");
    }

    /**
     * Ensure the log directory exists and return the log file path.
     */
    public static Path ensureLogDirectory() throws IOException {
        Files.createDirectories(getLogDirectory());
        return getLogFilePath();
    }

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private final List<String> arguments = new ArrayList<>();
        private final List<String> errors = new ArrayList<>();
        private Path workingDir = null;
        private Path profileDir = null;
        private Path bundleDir = null;
        private Path configPath = null;
        private Path logPath = null;
        private Path reportPath = null;
        private boolean dryRun = false;
        private boolean verbose = false;
        private boolean withDescendants = false;
        private boolean help = false;
        private String into;
        private String tag;
        private String nozzle;
        private String layerHeight;
        private String filamentType;
        private String vendor;

        public Builder workingDir(Path path) {
            this.workingDir = path != null ? path.toAbsolutePath().normalize() : null;
            return this;
        }

        public Builder profileDir(String path) {
            this.profileDir = toPath(path);
            return this;
        }

        public Builder bundleDir(String path) {
            this.bundleDir = toPath(path);
            return this;
        }

        public Builder configPath(String path) {
            this.configPath = toPath(path);
            return this;
        }

        public Builder reportPath(String path) {
            this.reportPath = toPath(path);
            return this;
        }

        /**
         * Log file to use instead of the per-user default location.
         */
        public Builder logPath(Path path) {
            this.logPath = path;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                // Flags
                if ("--dry-run".equals(arg)) {
                    this.dryRun = true;
                } else if ("--verbose".equals(arg) || "-v".equals(arg)) {
                    this.verbose = true;
                } else if ("--with-descendants".equals(arg)) {
                    this.withDescendants = true;
                } else if ("--help".equals(arg) || "-h".equals(arg)) {
                    this.help = true;
                }

                // Handle --option=value or --option value
                else if (arg.startsWith("--")) {
                    int eq = arg.indexOf('=');
                    String option = eq >= 0 ? arg.substring(0, eq) : arg;
                    String value;
                    if (eq >= 0) {
                        value = arg.substring(eq + 1);
                    } else if (i + 1 < args.length) {
                        value = args[++i];
                    } else {
                        if (isValueOption(option)) {
                            errors.add("Missing value for " + option);
                        } else {
                            errors.add("Unknown option: " + option);
                        }
                        continue;
                    }
                    if (!applyOption(option, value)) {
                        errors.add("Unknown option: " + option);
                        if (eq < 0) {
                            i--;
                        }
                    }
                }

                else {
                    arguments.add(arg);
                }
            }
            return this;
        }

        private boolean isValueOption(String option) {
            switch (option) {
                case "--tag":
                case "--sub-profile":
                case "--nozzle":
                case "--layer-height":
                case "--type":
                case "--vendor":
                case "--into":
                case "--profile-dir":
                case "--bundle-dir":
                case "--config":
                case "--report":
                    return true;
                default:
                    return false;
            }
        }

        private boolean applyOption(String option, String value) {
            switch (option) {
                case "--tag":
                case "--sub-profile":
                    this.tag = value;
                    return true;
                case "--nozzle":
                    this.nozzle = value;
                    return true;
                case "--layer-height":
                    this.layerHeight = value;
                    return true;
                case "--type":
                    this.filamentType = value;
                    return true;
                case "--vendor":
                    this.vendor = value;
                    return true;
                case "--into":
                    this.into = value;
                    return true;
                case "--profile-dir":
                    profileDir(value);
                    return true;
                case "--bundle-dir":
                    bundleDir(value);
                    return true;
                case "--config":
                    configPath(value);
                    return true;
                case "--report":
                    reportPath(value);
                    return true;
                default:
                    return false;
            }
        }

        private Path toPath(String path) {
            if (path == null || path.isEmpty()) {
                return null;
            }
            Path resolved = Paths.get(path);
            if (!resolved.isAbsolute() && workingDir != null) {
                resolved = workingDir.resolve(resolved);
            }
            return resolved.toAbsolutePath().normalize();
        }

        public AppConfig build() throws IOException {
            Path cwd = workingDir != null ? workingDir : Paths.get("").toAbsolutePath().normalize();

            // Ensure log directory exists
            Path log = logPath != null ? logPath : ensureLogDirectory();

            return new AppConfig(this, cwd, log);
        }
    }
}
