package com.profilebundler.storage;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.profilebundler.models.OperationResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads and writes the JSON run report: one entry per operation performed.
 * Unset fields such as a missing output file are left out of the report.
 */
public final class ReportStorage {

    private static final ObjectMapper mapper = new ObjectMapper()
        .setSerializationInclusion(JsonInclude.Include.NON_NULL)
        .enable(SerializationFeature.INDENT_OUTPUT);

    private ReportStorage() {
    }

    public static List<OperationResult> read(Path reportFile) throws IOException {
        if (!Files.exists(reportFile)) {
            return new ArrayList<>();
        }
        OperationResult[] results = mapper.readValue(reportFile.toFile(), OperationResult[].class);
        return results != null ? new ArrayList<>(Arrays.asList(results)) : new ArrayList<>();
    }

    public static void write(Path reportFile, List<OperationResult> results) throws IOException {
        Path parent = reportFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(reportFile.toFile(), results != null ? results : new ArrayList<>());
    }
}
