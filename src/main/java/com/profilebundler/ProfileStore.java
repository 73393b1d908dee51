package com.profilebundler;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.profilebundler.ini.StanzaCodec;
import com.profilebundler.models.OperationResult;
import com.profilebundler.models.Profile;
import com.profilebundler.models.ProfileDocument;
import com.profilebundler.models.ProfileType;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * All filesystem access for profile files.
 *
 * Directory listings are sorted by path so that name resolution, which takes
 * the first match, is deterministic across platforms. In dry-run mode writes
 * and deletes are staged in memory and reported as unified diffs; later reads
 * in the same run see the staged content.
 */
public class ProfileStore {

    private final boolean dryRun;
    private final Map<Path, String> staged = new HashMap<>();

    public ProfileStore() {
        this(false);
    }

    public ProfileStore(boolean dryRun) {
        this.dryRun = dryRun;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    // -------------------------------------------------------------------------
    // Discovery
    // -------------------------------------------------------------------------

    /**
     * Lists {@code *.ini} files directly inside {@code dir}, sorted by path.
     * A missing directory yields an empty list.
     */
    public List<Path> listProfileFiles(Path dir) {
        List<Path> files = new ArrayList<>();
        if (dir == null || !Files.isDirectory(dir)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + StanzaCodec.INI_EXTENSION)) {
            for (Path entry : stream) {
                Path normalized = entry.toAbsolutePath().normalize();
                if (Files.isRegularFile(entry) && !isStagedDelete(normalized)) {
                    files.add(normalized);
                }
            }
        } catch (IOException e) {
            logError("Failed to list " + dir + ": " + e.getMessage());
        }
        for (Map.Entry<Path, String> entry : staged.entrySet()) {
            Path stagedPath = entry.getKey();
            if (entry.getValue() != null && dir.toAbsolutePath().normalize().equals(stagedPath.getParent())
                && !files.contains(stagedPath)) {
                files.add(stagedPath);
            }
        }
        files.sort(Comparator.comparing(Path::toString));
        return files;
    }

    public boolean exists(Path file) {
        Path normalized = file.toAbsolutePath().normalize();
        if (staged.containsKey(normalized)) {
            return staged.get(normalized) != null;
        }
        return Files.isRegularFile(normalized);
    }

    // -------------------------------------------------------------------------
    // Reading
    // -------------------------------------------------------------------------

    public String readText(Path file) throws IOException {
        Path normalized = file.toAbsolutePath().normalize();
        if (staged.containsKey(normalized)) {
            String content = staged.get(normalized);
            if (content == null) {
                throw new FileNotFoundException("File not found: " + file);
            }
            return content;
        }
        if (!Files.exists(normalized)) {
            throw new FileNotFoundException("File not found: " + file);
        }
        return new String(Files.readAllBytes(normalized), StandardCharsets.UTF_8);
    }

    /**
     * Parses one file. Read failures are logged and produce an empty document,
     * which callers treat as "nothing found".
     */
    public ProfileDocument load(Path file, StanzaCodec codec) {
        Path normalized = file.toAbsolutePath().normalize();
        try {
            return codec.parse(readText(normalized), normalized);
        } catch (IOException e) {
            logError("Failed to read " + file + ": " + e.getMessage());
            return new ProfileDocument(normalized);
        }
    }

    public List<ProfileDocument> loadAll(Path dir, StanzaCodec codec) {
        List<ProfileDocument> documents = new ArrayList<>();
        for (Path file : listProfileFiles(dir)) {
            documents.add(load(file, codec));
        }
        return documents;
    }

    /**
     * Every profile of {@code type} found in the given directories, in directory
     * order and then file order.
     */
    public List<Profile> loadProfiles(List<Path> dirs, ProfileType type) {
        StanzaCodec codec = new StanzaCodec(type);
        List<Profile> profiles = new ArrayList<>();
        for (Path dir : dirs) {
            if (dir == null) continue;
            for (ProfileDocument document : loadAll(dir, codec)) {
                profiles.addAll(document.getProfiles(type));
            }
        }
        return profiles;
    }

    // -------------------------------------------------------------------------
    // Writing
    // -------------------------------------------------------------------------

    public void write(ProfileDocument document, StanzaCodec codec, OperationResult result) throws IOException {
        writeText(document.getPath(), codec.render(document), result);
    }

    /**
     * Replaces a file's content, creating parent directories if needed.
     */
    public void writeText(Path file, String content, OperationResult result) throws IOException {
        Path normalized = file.toAbsolutePath().normalize();
        if (dryRun) {
            String before = exists(normalized) ? readText(normalized) : "";
            staged.put(normalized, content);
            addPreview(result, normalized, before, content);
            log("Dry run, would write: " + normalized);
            return;
        }
        if (normalized.getParent() != null) {
            Files.createDirectories(normalized.getParent());
        }
        Files.write(normalized, content.getBytes(StandardCharsets.UTF_8));
        if (result != null) {
            result.recordWritten(normalized);
        }
        log("Wrote file: " + normalized);
    }

    public void delete(Path file, OperationResult result) throws IOException {
        Path normalized = file.toAbsolutePath().normalize();
        if (dryRun) {
            String before = exists(normalized) ? readText(normalized) : "";
            staged.put(normalized, null);
            addPreview(result, normalized, before, "");
            log("Dry run, would delete: " + normalized);
            return;
        }
        Files.deleteIfExists(normalized);
        if (result != null) {
            result.recordDeleted(normalized);
        }
        log("Deleted file: " + normalized);
    }

    private boolean isStagedDelete(Path file) {
        return staged.containsKey(file) && staged.get(file) == null;
    }

    // -------------------------------------------------------------------------
    // Diffs
    // -------------------------------------------------------------------------

    private void addPreview(OperationResult result, Path file, String before, String after) {
        String diff = generateUnifiedDiff(file.toString(), before, after);
        if (result != null && !diff.isEmpty()) {
            result.addPreview(diff);
        }
    }

    static String generateUnifiedDiff(String filePath, String before, String after) {
        List<String> original = splitLines(before);
        List<String> revised = splitLines(after);
        var patch = DiffUtils.diff(original, revised);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }
        List<String> unified = UnifiedDiffUtils.generateUnifiedDiff(
            filePath,
            filePath,
            original,
            patch,
            3
        );
        return String.join("\n", unified);
    }

    private static List<String> splitLines(String content) {
        if (content == null || content.isEmpty()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(content.split("\\R")));
    }

    // -------------------------------------------------------------------------
    // Logging
    // -------------------------------------------------------------------------

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.debug("[ProfileStore] " + message);
        }
    }

    private void logError(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.error("[ProfileStore] " + message);
        }
    }
}
