package com.converge.core.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persists the resources a deployment produced, one JSON file per stage.
 */
public class ResultsRecorder {

    private static final Logger log = LoggerFactory.getLogger(ResultsRecorder.class);

    public static final String SCHEMA_VERSION = "2.0";
    public static final String BACKEND = "api";

    private final ObjectMapper objectMapper;

    public ResultsRecorder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static Path recordPath(Path projectDir, String stage) {
        return projectDir.resolve(".converge").resolve("deployed").resolve(stage + ".json");
    }

    /**
     * Writes the record for {@code stage}, replacing only that stage's file.
     */
    public Path record(List<Map<String, Object>> resourceValues, String stage, Path projectDir) {
        Path file = recordPath(projectDir, stage);
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("resources", resourceValues);
        document.put("schema_version", SCHEMA_VERSION);
        document.put("backend", BACKEND);
        try {
            Files.createDirectories(file.getParent());
            Path tmp = Files.createTempFile(file.getParent(), stage, ".json.tmp");
            objectMapper.writeValue(tmp.toFile(), document);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StateException("Unable to write deployed record " + file, e);
        }
        log.info("Recorded {} resources for stage {} in {}", resourceValues.size(), stage, file);
        return file;
    }
}
