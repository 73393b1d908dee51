package com.profilebundler;

import com.profilebundler.models.OperationResult;
import com.profilebundler.models.Profile;
import com.profilebundler.models.ProfileType;
import com.profilebundler.models.UpdateExpression;
import com.profilebundler.settings.EngineSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UpdateServiceTest {

    @TempDir
    Path tempDir;

    private ProfileStore store;
    private UpdateService service;

    @BeforeEach
    void setUp() {
        store = new ProfileStore();
        service = new UpdateService(store, EngineSettings.defaults());
    }

    private List<UpdateExpression> parse(String... expressions) throws Exception {
        List<UpdateExpression> parsed = new ArrayList<>();
        for (String expression : expressions) {
            parsed.add(UpdateExpression.parse(expression));
        }
        return parsed;
    }

    private List<Profile> selection() {
        return store.loadProfiles(List.of(tempDir), ProfileType.PRINT);
    }

    @Test
    void appliesAbsoluteAndRelativeUpdates() throws Exception {
        Files.writeString(tempDir.resolve("fast.ini"),
            "[print: Fast]\nfill_density = 15%\nlayer_height = 0.2\nperimeters = 2\n");

        OperationResult result = service.apply(selection(),
            parse("perimeters==+1", "fill_density==+5%", "layer_height==+0.05", "top_solid_layers=5"));

        assertEquals(OperationResult.Status.OK, result.getStatus());
        assertEquals(1, result.getProfilesChanged());
        assertTrue(result.getWarnings().isEmpty());
        assertEquals("[print: Fast]\nfill_density = 20%\nlayer_height = 0.25\nperimeters = 3\ntop_solid_layers = 5\n",
            Files.readString(tempDir.resolve("fast.ini")));
    }

    @Test
    void unitMismatchAndMissingPropertyAreSkippedWithWarnings() throws Exception {
        String content = "[print: Fast]\nfill_density = 15%\n";
        Files.writeString(tempDir.resolve("fast.ini"), content);

        OperationResult result = service.apply(selection(), parse("fill_density==+1mm", "bridge_speed==+5"));

        assertEquals(OperationResult.Status.NOTHING_TO_DO, result.getStatus());
        assertEquals(2, result.getWarnings().size());
        assertTrue(result.getWarnings().get(0).contains("Unit mismatch"));
        assertEquals(content, Files.readString(tempDir.resolve("fast.ini")));
    }

    @Test
    void decrementClampsAtZero() throws Exception {
        Files.writeString(tempDir.resolve("fast.ini"), "[print: Fast]\nperimeters = 2\n");

        service.apply(selection(), parse("perimeters==-5"));

        assertEquals("[print: Fast]\nperimeters = 0\n", Files.readString(tempDir.resolve("fast.ini")));
    }

    @Test
    void onlyChangedFilesAreRewritten() throws Exception {
        Files.writeString(tempDir.resolve("a.ini"), "[print: A]\nspeed = 50\n");
        Files.writeString(tempDir.resolve("b.ini"), "[print: B]\nspeed = 40\n");

        OperationResult result = service.apply(selection(), parse("speed=50"));

        assertEquals(1, result.getFilesWritten().size());
        assertTrue(result.getFilesWritten().get(0).endsWith("b.ini"));
        assertEquals(2, result.getFilesProcessed());
    }

    @Test
    void relativeScaleComesFromSettings() throws Exception {
        EngineSettings settings = EngineSettings.defaults();
        settings.setRelativeScale(2);
        Files.writeString(tempDir.resolve("fast.ini"), "[print: Fast]\nextrusion_multiplier = 0.95\n");

        new UpdateService(store, settings).apply(selection(), parse("extrusion_multiplier==+0.004"));

        assertEquals("[print: Fast]\nextrusion_multiplier = 0.95\n", Files.readString(tempDir.resolve("fast.ini")));
    }

    @Test
    void noExpressionsFails() {
        assertEquals(OperationResult.Status.FAILED, service.apply(List.of(), List.of()).getStatus());
    }
}
