package com.participant.matching.zipcode;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * JSON file cache of the {@link ZipCountyMap}, so later runs skip the ZIP scan.
 *
 * <p>The file has two top-level keys, {@code zipcode_map} and {@code multi_county},
 * written with sorted keys and indentation. A cache that is missing, unreadable or
 * structurally wrong is treated as absent.</p>
 */
public class ZipCountyCache {
    private static final Logger log = LoggerFactory.getLogger(ZipCountyCache.class);
    private static final Pattern ZIP5 = Pattern.compile("\\d{5}");
    static final String BACKUP_SUFFIX = ".bak";

    private final Path path;
    private final ObjectMapper objectMapper;

    public ZipCountyCache(Path path) {
        this.path = path;
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public Path getPath() {
        return path;
    }

    /**
     * Reads the cache, or returns empty if it is absent or invalid.
     */
    public Optional<ZipCountyMap> load() {
        if (!Files.isRegularFile(path)) {
            log.info("zip.cache.missing path={}", path);
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(path.toFile());
            String problem = validate(root);
            if (problem != null) {
                log.warn("zip.cache.invalid path={} reason={}", path, problem);
                return Optional.empty();
            }
            ZipCountyMap map = objectMapper.treeToValue(root, ZipCountyMap.class);
            log.info("zip.cache.loaded path={} zips={} conflicts={}", path, map.size(), map.multiCounty().size());
            return Optional.of(map);
        } catch (IOException e) {
            log.warn("zip.cache.unreadable path={} error={}", path, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Writes the map, first moving any existing cache file to {@code <name>.bak}.
     *
     * @throws ZipCacheException if the file cannot be written
     */
    public void save(ZipCountyMap map) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (Files.exists(path)) {
                Path backup = path.resolveSibling(path.getFileName() + BACKUP_SUFFIX);
                Files.copy(path, backup, StandardCopyOption.REPLACE_EXISTING);
                log.info("zip.cache.backedUp backup={}", backup);
            }
            objectMapper.writeValue(path.toFile(), map);
            log.info("zip.cache.saved path={} zips={}", path, map.size());
        } catch (IOException e) {
            throw new ZipCacheException("Cannot write ZIP cache " + path, e);
        }
    }

    /**
     * Returns the cached map, or builds it with the supplier and writes it when the
     * cache cannot be used.
     */
    public ZipCountyMap loadOrRebuild(Supplier<ZipCountyMap> rebuild) {
        return load().orElseGet(() -> {
            log.info("zip.cache.rebuilding path={}", path);
            ZipCountyMap map = rebuild.get();
            save(map);
            return map;
        });
    }

    static String validate(JsonNode root) {
        if (root == null || !root.isObject()) {
            return "root is not an object";
        }
        JsonNode zipcodeMap = root.get("zipcode_map");
        if (zipcodeMap == null || !zipcodeMap.isObject()) {
            return "zipcode_map is missing";
        }
        Iterator<Map.Entry<String, JsonNode>> fields = zipcodeMap.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            if (!ZIP5.matcher(field.getKey()).matches()) {
                return "key " + field.getKey() + " is not a five-digit ZIP";
            }
            if (!field.getValue().isTextual() || field.getValue().asText().isBlank()) {
                return "ZIP " + field.getKey() + " has no county";
            }
        }
        JsonNode multiCounty = root.get("multi_county");
        if (multiCounty != null && !multiCounty.isNull() && !multiCounty.isObject()) {
            return "multi_county is not an object";
        }
        return null;
    }
}
