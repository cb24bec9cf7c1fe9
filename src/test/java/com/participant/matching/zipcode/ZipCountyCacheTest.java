package com.participant.matching.zipcode;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ZipCountyCacheTest {

    @TempDir
    Path dir;

    private final ZipCountyMap map = new ZipCountyMap(
            Map.of("44903", "RichlandCounty", "43065", "FranklinCounty"),
            Map.of("44903", List.of("AthensCounty", "RichlandCounty")));

    @Test
    @DisplayName("Saved cache should load back unchanged")
    void saveAndLoad() {
        var cache = new ZipCountyCache(dir.resolve("data").resolve("zip-cache.json"));

        cache.save(map);

        assertEquals(map, cache.load().orElseThrow());
    }

    @Test
    @DisplayName("Cache file should be sorted and indented with both top-level keys")
    void fileLayout() throws IOException {
        Path path = dir.resolve("zip-cache.json");
        new ZipCountyCache(path).save(map);

        String json = Files.readString(path);
        assertTrue(json.indexOf("\"43065\"") < json.indexOf("\"44903\""));
        assertTrue(json.indexOf("zipcode_map") < json.indexOf("multi_county"));
        assertTrue(json.contains("\n  "));

        JsonNode root = new ObjectMapper().readTree(json);
        assertEquals("RichlandCounty", root.get("zipcode_map").get("44903").asText());
        assertEquals("AthensCounty", root.get("multi_county").get("44903").get(0).asText());
    }

    @Test
    @DisplayName("Overwriting should keep the previous file as .bak")
    void backup() throws IOException {
        Path path = dir.resolve("zip-cache.json");
        Files.writeString(path, "{\"zipcode_map\": {\"43065\": \"OldCounty\"}}");

        new ZipCountyCache(path).save(map);

        Path backup = dir.resolve("zip-cache.json.bak");
        assertTrue(Files.readString(backup).contains("OldCounty"));
        assertFalse(Files.readString(path).contains("OldCounty"));
    }

    @ParameterizedTest
    @DisplayName("Invalid caches should be treated as absent")
    @ValueSource(strings = {
            "{not json",
            "[]",
            "{\"multi_county\": {}}",
            "{\"zipcode_map\": {\"4306\": \"FranklinCounty\"}}",
            "{\"zipcode_map\": {\"43065\": \"  \"}}",
            "{\"zipcode_map\": {\"43065\": 7}}"
    })
    void invalidCache(String content) throws IOException {
        Path path = dir.resolve("zip-cache.json");
        Files.writeString(path, content);

        assertTrue(new ZipCountyCache(path).load().isEmpty());
    }

    @Test
    @DisplayName("loadOrRebuild should rebuild only when the cache is unusable")
    void loadOrRebuild() throws IOException {
        Path path = dir.resolve("zip-cache.json");
        Files.writeString(path, "{broken");
        var cache = new ZipCountyCache(path);
        var builds = new AtomicInteger();

        ZipCountyMap first = cache.loadOrRebuild(() -> {
            builds.incrementAndGet();
            return map;
        });
        ZipCountyMap second = cache.loadOrRebuild(() -> {
            builds.incrementAndGet();
            return ZipCountyMap.empty();
        });

        assertEquals(map, first);
        assertEquals(map, second);
        assertEquals(1, builds.get());
        assertTrue(Files.exists(dir.resolve("zip-cache.json.bak")));
    }

    @Test
    @DisplayName("An unwritable location should raise ZipCacheException")
    void unwritable() throws IOException {
        Path blocker = dir.resolve("blocker");
        Files.writeString(blocker, "file, not a directory");

        var cache = new ZipCountyCache(blocker.resolve("zip-cache.json"));

        assertThrows(ZipCacheException.class, () -> cache.save(map));
    }
}
