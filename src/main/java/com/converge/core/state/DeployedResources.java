package com.converge.core.state;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resources recorded by the last successful deployment of a stage.
 * <p>
 * Each entry carries {@code name}, {@code resource_type} and the fields the
 * plan recorded for it. Entries keep the order they were recorded in, which
 * is creation order.
 */
public final class DeployedResources {

    private static final DeployedResources EMPTY = new DeployedResources(List.of());

    private final List<Map<String, Object>> resources;
    private final Map<String, Map<String, Object>> byName = new LinkedHashMap<>();

    public DeployedResources(List<Map<String, Object>> resources) {
        List<Map<String, Object>> copy = new ArrayList<>();
        for (Map<String, Object> resource : resources) {
            Map<String, Object> entry = Collections.unmodifiableMap(new LinkedHashMap<>(resource));
            copy.add(entry);
            byName.put(String.valueOf(entry.get("name")), entry);
        }
        this.resources = Collections.unmodifiableList(copy);
    }

    public static DeployedResources empty() {
        return EMPTY;
    }

    /**
     * Reads {@code <projectDir>/.converge/deployed/<stage>.json}; a missing file means nothing is deployed.
     */
    public static DeployedResources load(ObjectMapper objectMapper, Path projectDir, String stage) {
        Path file = ResultsRecorder.recordPath(projectDir, stage);
        if (!Files.isRegularFile(file)) {
            return empty();
        }
        try {
            Map<String, Object> document = objectMapper.readValue(file.toFile(), new TypeReference<>() {});
            Object resources = document.getOrDefault("resources", List.of());
            if (!(resources instanceof List<?> list)) {
                throw new StateException("Malformed deployed record " + file + ": 'resources' is not a list", null);
            }
            List<Map<String, Object>> entries = new ArrayList<>();
            for (Object item : list) {
                entries.add(objectMapper.convertValue(item, new TypeReference<Map<String, Object>>() {}));
            }
            return new DeployedResources(entries);
        } catch (IOException e) {
            throw new StateException("Unable to read deployed record " + file, e);
        }
    }

    public List<Map<String, Object>> resources() {
        return resources;
    }

    /** Resource names in recorded order. */
    public List<String> resourceNames() {
        return List.copyOf(byName.keySet());
    }

    public Optional<Map<String, Object>> resourceValues(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public boolean isEmpty() {
        return resources.isEmpty();
    }
}
