package com.profilebundler;

import com.profilebundler.inheritance.CleanResolver;
import com.profilebundler.ini.StanzaCodec;
import com.profilebundler.models.OperationResult;
import com.profilebundler.models.Profile;
import com.profilebundler.models.ProfileDocument;
import com.profilebundler.models.ProfileType;
import com.profilebundler.settings.EngineSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class BundleServiceTest {

    @TempDir
    Path tempDir;

    private Path printDir;
    private Path vendorDir;
    private ProfileStore store;
    private BundleService service;

    @BeforeEach
    void setUp() throws Exception {
        printDir = Files.createDirectories(tempDir.resolve("print"));
        vendorDir = tempDir.resolve("vendor");
        store = new ProfileStore();
        service = new BundleService(store, EngineSettings.defaults());
    }

    private void write(Path dir, String fileName, String content) throws Exception {
        Files.createDirectories(dir);
        Files.writeString(dir.resolve(fileName), content);
    }

    private List<Profile> all(Path dir, ProfileType type) {
        return store.loadProfiles(List.of(dir), type);
    }

    private Profile find(List<Profile> profiles, String name) {
        return profiles.stream().filter(p -> p.getName().equals(name)).findFirst().orElse(null);
    }

    private static int occurrences(String text, String needle) {
        int count = 0;
        for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + 1)) {
            count++;
        }
        return count;
    }

    @Test
    void bundlesParentAndRepointsChild() throws Exception {
        write(printDir, "parent.ini", "[print: Parent]\nlayer_height = 0.2\nfill_density = 20%\n");
        write(printDir, "child.ini", "[print: Child]\ninherits = Parent\nfirst_layer_height = 0.3\n");

        OperationResult result = service.bundle(all(printDir, ProfileType.PRINT), "B", ProfileType.PRINT, printDir, vendorDir);

        assertEquals(OperationResult.Status.OK, result.getStatus());
        assertEquals(List.of("print: *Parent*"), result.getProfilesMoved());
        assertEquals(List.of("print: Child"), result.getLeafProfiles());
        assertEquals(1, result.getReferencesRewritten());
        assertEquals(2, result.getCommonProperties());

        String bundle = Files.readString(vendorDir.resolve("B.ini"));
        assertTrue(bundle.startsWith("[vendor]\nrepo_id = non-prusa-fff\n"));
        assertTrue(bundle.contains("[print:*B*]\nfill_density = 20%\nlayer_height = 0.2\n"));
        assertTrue(bundle.contains("[print:*Parent*]\ninherits = *B*\n"));

        assertFalse(Files.exists(printDir.resolve("parent.ini")));
        assertTrue(result.getFilesDeleted().contains(printDir.resolve("parent.ini").toAbsolutePath().normalize().toString()));

        String child = Files.readString(printDir.resolve("child.ini"));
        assertEquals("[print: Child]\nfirst_layer_height = 0.3\ninherits = *Parent*\n", child);
    }

    @Test
    void bundlingKeepsEffectiveSettingsOfLeaves() throws Exception {
        write(printDir, "parent.ini", "[print: Parent]\nlayer_height = 0.2\nfill_density = 20%\n");
        write(printDir, "child.ini", "[print: Child]\ninherits = Parent\nfirst_layer_height = 0.3\n");

        service.bundle(all(printDir, ProfileType.PRINT), "B", ProfileType.PRINT, printDir, vendorDir);

        List<Profile> corpus = store.loadProfiles(List.of(printDir, vendorDir), ProfileType.PRINT);
        Profile child = find(corpus, "print: Child");
        Map<String, String> inherited = CleanResolver.inheritedClosure(child, corpus);
        assertEquals("0.2", inherited.get("layer_height"));
        assertEquals("20%", inherited.get("fill_density"));
    }

    @Test
    void taggedParentResolvesThroughCoreName() throws Exception {
        write(printDir, "parent.ini", "[print: Parent @test]\nlayer_height = 0.2\nfill_density = 30%\n");
        write(printDir, "child.ini", "[print: Child]\ninherits = Parent\n");

        OperationResult result = service.bundle(all(printDir, ProfileType.PRINT), "Tagged", ProfileType.PRINT, printDir, vendorDir);

        assertEquals(List.of("print: *Parent @test*"), result.getProfilesMoved());
        assertTrue(Files.readString(vendorDir.resolve("Tagged.ini")).contains("[print:*Parent @test*]"));
        assertTrue(Files.readString(printDir.resolve("child.ini")).contains("inherits = *Parent @test*"));
    }

    @Test
    void everyBundledProfileInheritsTheBundleParent() throws Exception {
        write(printDir, "a.ini", "[print: A]\nlayer_height = 0.2\n");
        write(printDir, "b.ini", "[print: B]\ninherits = A\nperimeters = 3\n");
        write(printDir, "c.ini", "[print: C]\ninherits = B\nspeed = 50\n");

        OperationResult result = service.bundle(all(printDir, ProfileType.PRINT), "Bun", ProfileType.PRINT, printDir, vendorDir);

        assertEquals(List.of("print: *A*", "print: *B*"), result.getProfilesMoved());
        String bundle = Files.readString(vendorDir.resolve("Bun.ini"));
        assertTrue(bundle.contains("[print:*A*]\ninherits = *Bun*\nlayer_height = 0.2\n"));
        assertTrue(bundle.contains("[print:*B*]\ninherits = *Bun*\nperimeters = 3\n"));
        assertTrue(bundle.contains("[print:*Bun*]\n\n[print:*A*]"));
        assertEquals("[print: C]\ninherits = *B*\nspeed = 50\n", Files.readString(printDir.resolve("c.ini")));
    }

    @Test
    void sharedInheritsIsTakenAcrossAllBundledProfiles() throws Exception {
        write(printDir, "grandparent.ini", "[print: GrandParent]\nlayer_height = 0.2\nfill_density = 20%\nperimeters = 2\n");
        write(printDir, "parent.ini", "[print: Parent]\ninherits = GrandParent\nlayer_height = 0.2\nfill_density = 25%\n");
        write(printDir, "child.ini", "[print: Child]\ninherits = Parent\ntop_solid_layers = 5\n");

        service.bundle(all(printDir, ProfileType.PRINT), "Chain", ProfileType.PRINT, printDir, vendorDir);

        List<Profile> bundled = all(vendorDir, ProfileType.PRINT);
        assertNull(find(bundled, "print: *Chain*").getInherits());
        assertEquals("0.2", find(bundled, "print: *Chain*").getProperty("layer_height"));
        assertEquals("*Chain*", find(bundled, "print: *GrandParent*").getInherits());
        assertEquals("*Chain*", find(bundled, "print: *Parent*").getInherits());
        assertEquals("25%", find(bundled, "print: *Parent*").getProperty("fill_density"));
    }

    @Test
    void chainInsideBundleIsPreservedWhenConfigured() throws Exception {
        write(printDir, "grandparent.ini", "[print: GrandParent]\nlayer_height = 0.2\nfill_density = 20%\nperimeters = 2\n");
        write(printDir, "parent.ini", "[print: Parent]\ninherits = GrandParent\nlayer_height = 0.2\nfill_density = 25%\n");
        write(printDir, "child.ini", "[print: Child]\ninherits = Parent\ntop_solid_layers = 5\n");
        EngineSettings settings = EngineSettings.defaults();
        settings.setPreserveBundleChains(true);

        OperationResult result = new BundleService(store, settings)
            .bundle(all(printDir, ProfileType.PRINT), "Chain", ProfileType.PRINT, printDir, vendorDir);

        assertEquals(2, result.getProfilesMoved().size());
        List<Profile> bundled = all(vendorDir, ProfileType.PRINT);
        assertEquals("*Chain*", find(bundled, "print: *GrandParent*").getInherits());
        assertEquals("*GrandParent*", find(bundled, "print: *Parent*").getInherits());
        assertEquals("0.2", find(bundled, "print: *Chain*").getProperty("layer_height"));

        List<Profile> corpus = store.loadProfiles(List.of(printDir, vendorDir), ProfileType.PRINT);
        Map<String, String> inherited = CleanResolver.inheritedClosure(find(corpus, "print: Child"), corpus);
        assertEquals("0.2", inherited.get("layer_height"));
        assertEquals("25%", inherited.get("fill_density"));
        assertEquals("2", inherited.get("perimeters"));
    }

    @Test
    void leadingCommentDoesNotKeepRelocatedFileAlive() throws Exception {
        write(printDir, "parent.ini", "# Shared base\n[print: Parent]\nlayer_height = 0.2\n");
        write(printDir, "child.ini", "[print: Child]\ninherits = Parent\n");
        List<Profile> selection = all(printDir, ProfileType.PRINT);

        OperationResult result = service.bundle(selection, "B", ProfileType.PRINT, printDir, vendorDir);

        assertEquals(2, selection.size());
        assertEquals(List.of("print: *Parent*"), result.getProfilesMoved());
        assertFalse(Files.exists(printDir.resolve("parent.ini")));
        assertTrue(Files.readString(vendorDir.resolve("B.ini")).contains("[print:*Parent*]\n# Shared base\ninherits = *B*\n"));
    }

    @Test
    void selectionWithoutParentsIsNothingToDo() throws Exception {
        write(printDir, "simple.ini", "[print: Simple]\nlayer_height = 0.2\n");

        OperationResult result = service.bundle(all(printDir, ProfileType.PRINT), "B", ProfileType.PRINT, printDir, vendorDir);

        assertEquals(OperationResult.Status.NOTHING_TO_DO, result.getStatus());
        assertEquals(List.of("print: Simple"), result.getLeafProfiles());
        assertFalse(Files.exists(vendorDir.resolve("B.ini")));
        assertEquals("[print: Simple]\nlayer_height = 0.2\n", Files.readString(printDir.resolve("simple.ini")));
    }

    @Test
    void externalParentIsLeftAloneAndInheritedByBundleParent() throws Exception {
        String external = "[print: ExternalParent]\nlayer_height = 0.2\n";
        write(printDir, "external_parent.ini", external);
        write(printDir, "parent.ini", "[print: Parent]\ninherits = ExternalParent\nfill_density = 30%\n");
        write(printDir, "child.ini", "[print: Child]\ninherits = Parent\n");
        List<Profile> selection = all(printDir, ProfileType.PRINT).stream()
            .filter(p -> !p.getName().equals("print: ExternalParent"))
            .collect(Collectors.toList());

        service.bundle(selection, "B", ProfileType.PRINT, printDir, vendorDir);

        assertEquals(external, Files.readString(printDir.resolve("external_parent.ini")));
        List<Profile> bundled = all(vendorDir, ProfileType.PRINT);
        assertEquals("ExternalParent", find(bundled, "print: *B*").getInherits());
        assertTrue(Files.readString(printDir.resolve("child.ini")).contains("inherits = *Parent*"));
    }

    @Test
    void bundlingTwiceDoesNotDuplicateProfiles() throws Exception {
        write(printDir, "parent.ini", "[print: DuplicateParent]\nlayer_height = 0.2\nfill_density = 20%\n");
        write(printDir, "child.ini", "[print: Child]\ninherits = DuplicateParent\n");
        List<Profile> selection = all(printDir, ProfileType.PRINT);

        service.bundle(selection, "B", ProfileType.PRINT, printDir, vendorDir);
        String first = Files.readString(vendorDir.resolve("B.ini"));
        OperationResult second = service.bundle(selection, "B", ProfileType.PRINT, printDir, vendorDir);
        String bundle = Files.readString(vendorDir.resolve("B.ini"));

        assertTrue(second.isSuccess());
        assertTrue(second.getProfilesMoved().isEmpty());
        assertEquals(first, bundle);
        assertEquals(1, occurrences(bundle, "[print:*DuplicateParent*]"));
        assertEquals(1, occurrences(bundle, "[print:*B*]"));
        assertEquals(1, occurrences(bundle, "[vendor]"));
        assertTrue(Files.readString(printDir.resolve("child.ini")).contains("inherits = *DuplicateParent*"));
    }

    @Test
    void secondBundleRunAppendsToExistingBundle() throws Exception {
        write(printDir, "first_parent.ini", "[print: FirstParent]\nlayer_height = 0.2\nfill_density = 20%\n");
        write(printDir, "first_child.ini", "[print: FirstChild]\ninherits = FirstParent\n");
        service.bundle(all(printDir, ProfileType.PRINT), "Shared", ProfileType.PRINT, printDir, vendorDir);

        write(printDir, "second_parent.ini", "[print: SecondParent]\nlayer_height = 0.2\nfill_density = 30%\n");
        write(printDir, "second_child.ini", "[print: SecondChild]\ninherits = SecondParent\n");
        List<Profile> selection = all(printDir, ProfileType.PRINT).stream()
            .filter(p -> p.getName().startsWith("print: Second"))
            .collect(Collectors.toList());
        service.bundle(selection, "Shared", ProfileType.PRINT, printDir, vendorDir);

        String bundle = Files.readString(vendorDir.resolve("Shared.ini"));
        assertEquals(1, occurrences(bundle, "[vendor]"));
        assertEquals(1, occurrences(bundle, "[print:*Shared*]"));
        assertTrue(bundle.contains("[print:*FirstParent*]"));
        assertTrue(bundle.contains("[print:*SecondParent*]\nfill_density = 30%\ninherits = *Shared*\n"));

        List<Profile> corpus = store.loadProfiles(List.of(printDir, vendorDir), ProfileType.PRINT);
        Map<String, String> first = CleanResolver.inheritedClosure(find(corpus, "print: FirstChild"), corpus);
        Map<String, String> second = CleanResolver.inheritedClosure(find(corpus, "print: SecondChild"), corpus);
        assertEquals("20%", first.get("fill_density"));
        assertEquals("30%", second.get("fill_density"));
    }

    @Test
    void filamentProfilesBundleTheSameWay() throws Exception {
        Path filamentDir = Files.createDirectories(tempDir.resolve("filament"));
        write(filamentDir, "base.ini", "[filament: BaseFilament]\nfilament_type = PLA\ntemperature = 215\n");
        write(filamentDir, "custom.ini", "[filament: Custom]\ninherits = BaseFilament\ntemperature = 220\n");

        OperationResult result = service.bundle(all(filamentDir, ProfileType.FILAMENT), "Filaments",
            ProfileType.FILAMENT, filamentDir, vendorDir);

        assertEquals(List.of("filament: *BaseFilament*"), result.getProfilesMoved());
        assertTrue(Files.readString(vendorDir.resolve("Filaments.ini")).contains("[filament:*BaseFilament*]"));
        assertTrue(Files.readString(filamentDir.resolve("custom.ini")).contains("inherits = *BaseFilament*"));
    }

    @Test
    void fileKeepsRemainingProfilesAfterRelocation() throws Exception {
        write(printDir, "mixed.ini", "[print: Parent]\nlayer_height = 0.2\n\n[print: Child]\ninherits = Parent\nperimeters = 3\n");

        OperationResult result = service.bundle(all(printDir, ProfileType.PRINT), "B", ProfileType.PRINT, printDir, vendorDir);

        assertTrue(result.getFilesDeleted().isEmpty());
        ProfileDocument document = new StanzaCodec(ProfileType.PRINT)
            .parse(Files.readString(printDir.resolve("mixed.ini")), printDir.resolve("mixed.ini"));
        assertEquals(1, document.getProfiles().size());
        assertEquals("*Parent*", document.findProfile("print: Child").getInherits());
    }

    @Test
    void unsafeBundleNameFails() {
        OperationResult result = service.bundle(List.of(), "bad/name", ProfileType.PRINT, printDir, vendorDir);
        assertEquals(OperationResult.Status.FAILED, result.getStatus());
        assertTrue(result.getMessage().contains("/"));
    }

    @Test
    void dryRunLeavesFilesUntouchedAndReportsDiffs() throws Exception {
        String parent = "[print: Parent]\nlayer_height = 0.2\n";
        write(printDir, "parent.ini", parent);
        write(printDir, "child.ini", "[print: Child]\ninherits = Parent\n");
        ProfileStore dryStore = new ProfileStore(true);

        OperationResult result = new BundleService(dryStore, EngineSettings.defaults())
            .bundle(dryStore.loadProfiles(List.of(printDir), ProfileType.PRINT), "B", ProfileType.PRINT, printDir, vendorDir);

        assertTrue(result.isSuccess());
        assertFalse(Files.exists(vendorDir.resolve("B.ini")));
        assertEquals(parent, Files.readString(printDir.resolve("parent.ini")));
        assertEquals(3, result.getPreviews().size());
        assertFalse(result.hasChanges());
    }
}
