package com.profilebundler;

import com.profilebundler.models.ProfileType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @TempDir
    Path tempDir;

    private AppConfig parse(String... args) throws Exception {
        return new AppConfig.Builder()
            .workingDir(tempDir)
            .logPath(tempDir.resolve("test.log"))
            .parseArgs(args)
            .build();
    }

    @Test
    void defaultsResolveAgainstWorkingDirectory() throws Exception {
        AppConfig config = parse("clean");

        assertEquals("clean", config.getCommand());
        assertTrue(config.getErrors().isEmpty());
        assertEquals(tempDir.resolve("print"), config.getProfileDir(ProfileType.PRINT));
        assertEquals(tempDir.resolve("filament"), config.getProfileDir(ProfileType.FILAMENT));
        assertEquals(tempDir.resolve("vendor"), config.getBundleDir());
        assertEquals(tempDir.resolve("profile-bundler.json"), config.getConfigPath());
        assertNull(config.getReportPath());
        assertFalse(config.isDryRun());
    }

    @Test
    void parsesOptionsInBothForms() throws Exception {
        AppConfig config = parse("bundle", "print", "--into", "My Bundle", "--tag=MK4",
            "--layer-height", "0.2", "--dry-run", "-v", "--with-descendants", "--report=out/report.json");

        assertEquals(List.of("bundle", "print"), config.getArguments());
        assertEquals("My Bundle", config.getInto());
        assertTrue(config.isDryRun());
        assertTrue(config.isVerbose());
        assertTrue(config.isWithDescendants());
        assertEquals(tempDir.resolve("out").resolve("report.json"), config.getReportPath());

        ProfileFilter filter = config.filterFor(ProfileType.PRINT);
        assertEquals(ProfileType.PRINT, filter.getType());
        assertEquals(List.of("tag=MK4", "layer_height=0.2"), filter.describe());
    }

    @Test
    void profileDirectoryOverrideAppliesToEveryType() throws Exception {
        AppConfig config = parse("clean", "--profile-dir", "profiles", "--bundle-dir", "/abs/bundles");

        assertEquals(tempDir.resolve("profiles"), config.getProfileDir(ProfileType.PRINT));
        assertEquals(tempDir.resolve("profiles"), config.getProfileDir(ProfileType.FILAMENT));
        assertEquals(Path.of("/abs/bundles").toAbsolutePath().normalize(), config.getBundleDir());
    }

    @Test
    void unknownOptionIsReportedWithoutSwallowingTheNextArgument() throws Exception {
        AppConfig config = parse("--frobnicate", "clean");

        assertEquals(List.of("Unknown option: --frobnicate"), config.getErrors());
        assertEquals("clean", config.getCommand());
    }

    @Test
    void missingOptionValueIsReported() throws Exception {
        AppConfig config = parse("combine", "print", "--into");

        assertEquals(List.of("Missing value for --into"), config.getErrors());
        assertNull(config.getInto());
    }

    @Test
    void helpFlag() throws Exception {
        assertTrue(parse("-h").isHelp());
        assertNull(parse().getCommand());
    }
}
