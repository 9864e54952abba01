package com.modelcraft.metadata;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * The on-disk copy of the last metadata load, a single JSON file. Reading and writing it is best
 * effort: failures are logged and the engine falls back to the schema files.
 */
public class MetadataCacheStore {

    private static final Logger log = LoggerFactory.getLogger(MetadataCacheStore.class);

    private final ObjectMapper mapper;
    private final Path path;

    /**
     * @param path cache file; null disables the store
     */
    public MetadataCacheStore(ObjectMapper mapper, String path) {
        this.mapper = mapper;
        this.path = path != null && !path.isBlank() ? Path.of(path) : null;
    }

    public boolean isEnabled() {
        return path != null;
    }

    public Optional<Map<String, Object>> read() {
        if (path == null || !Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            Map<String, Object> blob = mapper.readValue(path.toFile(), new TypeReference<>() {});
            log.debug("Read metadata cache {}", path);
            return Optional.ofNullable(blob);
        } catch (IOException e) {
            log.warn("Ignoring unreadable metadata cache {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    public void write(Map<String, Object> blob) {
        if (path == null) {
            return;
        }
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), blob);
            log.debug("Wrote metadata cache {}", path);
        } catch (IOException e) {
            log.warn("Could not write metadata cache {}: {}", path, e.getMessage());
        }
    }

    public void delete() {
        if (path == null) {
            return;
        }
        try {
            if (Files.deleteIfExists(path)) {
                log.debug("Deleted metadata cache {}", path);
            }
        } catch (IOException e) {
            log.warn("Could not delete metadata cache {}: {}", path, e.getMessage());
        }
    }
}
