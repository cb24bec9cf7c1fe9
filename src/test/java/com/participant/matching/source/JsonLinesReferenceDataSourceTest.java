package com.participant.matching.source;

import com.participant.matching.index.ReferenceIndexBuilder;
import com.participant.matching.rules.IdentityNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonLinesReferenceDataSourceTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should list .jsonl files as sorted collections")
    void listsCollections() throws IOException {
        Files.writeString(dir.resolve("MarionDemographic.jsonl"), "");
        Files.writeString(dir.resolve("FranklinResidential.jsonl"), "");
        Files.writeString(dir.resolve("notes.txt"), "ignored");

        var source = new JsonLinesReferenceDataSource(dir);

        assertTrue(source.isConnected());
        assertEquals(List.of("FranklinResidential", "MarionDemographic"), source.listCollections());
    }

    @Test
    @DisplayName("Should parse one document per line and skip blank lines")
    void readsDocuments() throws IOException {
        Files.writeString(dir.resolve("FranklinDemographic.jsonl"), """
                {"parcel_id": "1", "parcel_zip": 43065, "email": "jane@x.com"}

                {"parcel_id": "2", "parcel_zip": "43201"}
                """);
        var source = new JsonLinesReferenceDataSource(dir);

        List<Map<String, Object>> documents = new ArrayList<>();
        source.forEachDocument("FranklinDemographic", documents::add);

        assertEquals(2, documents.size());
        assertEquals(43065, documents.get(0).get("parcel_zip"));
        assertEquals("43201", documents.get(1).get("parcel_zip"));
    }

    @Test
    @DisplayName("A malformed line should fail with its line number")
    void malformedLine() throws IOException {
        Files.writeString(dir.resolve("FranklinDemographic.jsonl"), "{\"parcel_id\": \"1\"}\n{broken\n");
        var source = new JsonLinesReferenceDataSource(dir);

        var error = assertThrows(ReferenceSourceException.class,
                () -> source.forEachDocument("FranklinDemographic", d -> { }));
        assertTrue(error.getMessage().contains("line 2"));
    }

    @ParameterizedTest
    @DisplayName("A line that is not a JSON object should fail with its line number")
    @ValueSource(strings = {"null", "[1, 2]", "\"43065\"", "42"})
    void nonObjectLine(String line) throws IOException {
        Files.writeString(dir.resolve("FranklinCountyDemographic.jsonl"), "{\"parcel_id\": \"1\"}\n" + line + "\n");
        var source = new JsonLinesReferenceDataSource(dir);
        List<Map<String, Object>> seen = new ArrayList<>();

        var error = assertThrows(ReferenceSourceException.class,
                () -> source.forEachDocument("FranklinCountyDemographic", seen::add));
        assertTrue(error.getMessage().contains("line 2"));
        assertEquals(1, seen.size());
    }

    @Test
    @DisplayName("Index build should surface a non-object line as a source failure")
    void nonObjectLineDuringIndexBuild() throws IOException {
        Files.writeString(dir.resolve("FranklinCountyDemographic.jsonl"), "{\"parcel_id\": \"1\"}\nnull\n");
        var builder = new ReferenceIndexBuilder(IdentityNormalizer.defaults());

        assertThrows(ReferenceSourceException.class,
                () -> builder.load(new JsonLinesReferenceDataSource(dir)));
    }

    @Test
    @DisplayName("A missing directory should not be connected")
    void missingDirectory() {
        var source = new JsonLinesReferenceDataSource(dir.resolve("absent"));

        assertFalse(source.isConnected());
        assertThrows(ReferenceSourceException.class, source::listCollections);
    }
}
