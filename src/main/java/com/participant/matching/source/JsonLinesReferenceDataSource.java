package com.participant.matching.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Reference store backed by a directory of JSON Lines exports.
 *
 * <p>Each collection is a file named {@code <collection>.jsonl} holding one JSON object per line:</p>
 * <pre>
 * FranklinCountyDemographic.jsonl
 *   {"parcel_id": "010-1", "email": "JANE@X.COM", "parcel_zip": 43201}
 * FranklinCountyResidential.jsonl
 *   {"parcel_id": "010-1", "address": "12 MAIN ST", "parcel_zip": 43201, "age": 1924}
 * </pre>
 *
 * <p>Blank lines are skipped. A line that is not a JSON object fails the read,
 * since dropping it would leave a hole in the index.</p>
 */
public class JsonLinesReferenceDataSource implements ReferenceDataSource {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesReferenceDataSource.class);
    private static final String EXTENSION = ".jsonl";
    private static final TypeReference<Map<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {};

    private final Path directory;
    private final ObjectMapper objectMapper;

    public JsonLinesReferenceDataSource(Path directory) {
        this(directory, new ObjectMapper());
    }

    public JsonLinesReferenceDataSource(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<String> listCollections() {
        requireDirectory();
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(EXTENSION))
                    .map(name -> name.substring(0, name.length() - EXTENSION.length()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new ReferenceSourceException("Cannot list reference directory " + directory, e);
        }
    }

    @Override
    public void forEachDocument(String collection, Consumer<Map<String, Object>> consumer) {
        Path file = directory.resolve(collection + EXTENSION);
        if (!Files.isRegularFile(file)) {
            throw new ReferenceSourceException("Collection not found: " + file);
        }
        long lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                JsonNode node = objectMapper.readTree(line);
                if (node == null || !node.isObject()) {
                    throw new ReferenceSourceException("Expected a JSON object in " + file.getFileName()
                            + " at line " + lineNumber + ", got " + (node == null ? "nothing" : node.getNodeType()));
                }
                consumer.accept(objectMapper.convertValue(node, DOCUMENT_TYPE));
            }
        } catch (JsonProcessingException e) {
            throw new ReferenceSourceException(
                    "Malformed document in " + file.getFileName() + " at line " + lineNumber, e);
        } catch (IOException e) {
            throw new ReferenceSourceException("Cannot read " + file, e);
        }
        log.debug("source.read collection={} lines={}", collection, lineNumber);
    }

    @Override
    public boolean isConnected() {
        return Files.isDirectory(directory) && Files.isReadable(directory);
    }

    @Override
    public String getName() {
        return "jsonl:" + directory;
    }

    @Override
    public void close() {
        // Nothing held open between calls
    }

    private void requireDirectory() {
        if (!isConnected()) {
            throw new ReferenceSourceException("Reference directory is not readable: " + directory);
        }
    }
}
