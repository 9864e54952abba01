package com.modelcraft.metadata;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelcraft.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Reads schema documents laid out one per subdirectory:
 * {@code <dir>/<name>/<name>_metadata.json}. Any file ending in {@code _metadata.json} inside a
 * subdirectory is read.
 */
public class SchemaSource {

    private static final Logger log = LoggerFactory.getLogger(SchemaSource.class);

    public static final String FILE_SUFFIX = "_metadata.json";

    private final ObjectMapper mapper;

    public SchemaSource(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** One parsed schema file. {@code name} is the document's own {@code name}, else the file stem. */
    public record SchemaDocument(String name, Path path, Map<String, Object> data) {
    }

    /**
     * Parse every schema file under {@code directory}. Unreadable files and documents that are not
     * JSON objects are logged and left out; so is a second document with an already seen name.
     *
     * @param kind "entity" or "relationship", for messages
     * @throws ConfigurationException when {@code directory} is not configured
     */
    public List<SchemaDocument> scan(String directory, String kind) {
        if (directory == null || directory.isBlank()) {
            log.error("No {} schema directory configured", kind);
            throw new ConfigurationException("No %s schema directory configured".formatted(kind), Map.of("kind", kind));
        }
        var root = Path.of(directory);
        if (!Files.isDirectory(root)) {
            log.warn("{} schema directory {} does not exist", kind, root.toAbsolutePath());
            return List.of();
        }

        var byName = new LinkedHashMap<String, SchemaDocument>();
        for (var file : schemaFiles(root, kind)) {
            var document = read(file, kind);
            if (document == null) {
                continue;
            }
            var existing = byName.putIfAbsent(document.name(), document);
            if (existing != null) {
                log.warn("Duplicate {} '{}' in {} ignored; already loaded from {}",
                    kind, document.name(), file, existing.path());
            }
        }
        log.debug("Read {} {} schemas from {}", byName.size(), kind, root);
        return List.copyOf(byName.values());
    }

    private List<Path> schemaFiles(Path root, String kind) {
        var files = new ArrayList<Path>();
        try (Stream<Path> dirs = Files.list(root)) {
            for (var dir : dirs.filter(Files::isDirectory).sorted().toList()) {
                try (Stream<Path> entries = Files.list(dir)) {
                    entries.filter(Files::isRegularFile)
                        .filter(p -> p.getFileName().toString().endsWith(FILE_SUFFIX))
                        .sorted(Comparator.comparing(Path::toString))
                        .forEach(files::add);
                }
            }
        } catch (IOException e) {
            throw new ConfigurationException("Cannot list %s schema directory %s".formatted(kind, root),
                Map.of("kind", kind, "directory", root.toString()), e);
        }
        return files;
    }

    private SchemaDocument read(Path file, String kind) {
        try {
            var tree = mapper.readTree(file.toFile());
            if (tree == null || !tree.isObject()) {
                log.warn("Skipping {} schema {}: not a JSON object", kind, file);
                return null;
            }
            Map<String, Object> data = mapper.convertValue(tree, new TypeReference<>() {});
            var name = data.get("name") != null ? String.valueOf(data.get("name")) : stem(file);
            return new SchemaDocument(name, file, data);
        } catch (IOException e) {
            log.warn("Skipping {} schema {}: {}", kind, file, e.getMessage());
            return null;
        }
    }

    private static String stem(Path file) {
        var fileName = file.getFileName().toString();
        return fileName.substring(0, fileName.length() - FILE_SUFFIX.length());
    }
}
