package com.microsoft.capacityadvisor.snapshot;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.capacityadvisor.domain.model.ResourceSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads resource snapshots exported by the inventory collaborator.
 *
 * Accepts either a bare JSON array of snapshots or an object carrying them
 * under {@code resources}. Field values are not validated here: a snapshot
 * with a bad capacity is still loaded and rejected per resource during
 * analysis, so one bad record does not discard the file.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SnapshotLoader {

    private static final TypeReference<List<ResourceSnapshot>> SNAPSHOT_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public List<ResourceSnapshot> load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new SnapshotLoadException("Snapshot file not found: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            return load(in, file.toString());
        } catch (IOException e) {
            throw new SnapshotLoadException("Failed to read snapshot file " + file, e);
        }
    }

    public List<ResourceSnapshot> load(InputStream in, String source) {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new SnapshotLoadException("Snapshot " + source + " is not valid JSON", e);
        }

        JsonNode resources = root != null && root.isObject() ? root.get("resources") : root;
        if (resources == null || !resources.isArray()) {
            throw new SnapshotLoadException(
                    "Snapshot " + source + " must be a JSON array or an object with a 'resources' array");
        }

        try {
            List<ResourceSnapshot> snapshots = objectMapper.readerFor(SNAPSHOT_LIST).readValue(resources);
            log.info("Loaded {} resource snapshot(s) from {}", snapshots.size(), source);
            return snapshots;
        } catch (IOException e) {
            throw new SnapshotLoadException("Snapshot " + source + " has malformed resource entries", e);
        }
    }
}
