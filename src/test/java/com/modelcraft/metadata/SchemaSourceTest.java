package com.modelcraft.metadata;

import com.modelcraft.TestFixtureLoader;
import com.modelcraft.exception.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchemaSourceTest {

    private final SchemaSource source = new SchemaSource(TestFixtureLoader.MAPPER);

    @Test
    void scan_readsOneDocumentPerSubdirectory(@TempDir Path dir) throws IOException {
        write(dir, "tags", "tags_metadata.json", "{\"name\": \"Tags\"}");
        write(dir, "actors", "actors_metadata.json", "{\"name\": \"Actors\"}");

        var names = source.scan(dir.toString(), "entity").stream().map(SchemaSource.SchemaDocument::name).toList();

        assertEquals(List.of("Actors", "Tags"), names);
    }

    @Test
    void scan_nameFallsBackToFileStem(@TempDir Path dir) throws IOException {
        write(dir, "genres", "genres_metadata.json", "{\"fields\": {}}");

        assertEquals("genres", source.scan(dir.toString(), "entity").get(0).name());
    }

    @Test
    void scan_ignoresOtherFiles(@TempDir Path dir) throws IOException {
        write(dir, "tags", "tags_metadata.json", "{\"name\": \"Tags\"}");
        write(dir, "tags", "notes.json", "{\"name\": \"Notes\"}");
        Files.writeString(dir.resolve("loose_metadata.json"), "{\"name\": \"Loose\"}");

        assertEquals(1, source.scan(dir.toString(), "entity").size());
    }

    @Test
    void scan_skipsUnparseableAndNonObjectDocuments(@TempDir Path dir) throws IOException {
        write(dir, "a", "a_metadata.json", "{ broken");
        write(dir, "b", "b_metadata.json", "\"just a string\"");
        write(dir, "c", "c_metadata.json", "{\"name\": \"C\"}");

        var documents = source.scan(dir.toString(), "entity");

        assertEquals(1, documents.size());
        assertEquals("C", documents.get(0).name());
    }

    @Test
    void scan_duplicateNameKeepsFirst(@TempDir Path dir) throws IOException {
        write(dir, "a", "a_metadata.json", "{\"name\": \"Same\", \"table\": \"first\"}");
        write(dir, "b", "b_metadata.json", "{\"name\": \"Same\", \"table\": \"second\"}");

        var documents = source.scan(dir.toString(), "entity");

        assertEquals(1, documents.size());
        assertEquals("first", documents.get(0).data().get("table"));
    }

    @Test
    void scan_missingDirectoryIsEmpty(@TempDir Path dir) {
        assertTrue(source.scan(dir.resolve("absent").toString(), "relationship").isEmpty());
    }

    @Test
    void scan_blankDirectoryRejected() {
        assertThrows(ConfigurationException.class, () -> source.scan("", "entity"));
        assertThrows(ConfigurationException.class, () -> source.scan(null, "entity"));
    }

    private static void write(Path root, String folder, String file, String content) throws IOException {
        var directory = Files.createDirectories(root.resolve(folder));
        Files.writeString(directory.resolve(file), content);
    }
}
