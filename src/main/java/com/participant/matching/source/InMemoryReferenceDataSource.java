package com.participant.matching.source;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Reference store held entirely in memory.
 * Useful for tests and for embedding callers that already hold the documents.
 */
public class InMemoryReferenceDataSource implements ReferenceDataSource {

    private final Map<String, List<Map<String, Object>>> collections = new LinkedHashMap<>();
    private volatile boolean connected = true;

    /**
     * Adds a document to a collection, creating the collection if needed.
     */
    public InMemoryReferenceDataSource add(String collection, Map<String, Object> document) {
        collections.computeIfAbsent(collection, k -> new ArrayList<>()).add(new LinkedHashMap<>(document));
        return this;
    }

    /**
     * Creates an empty collection.
     */
    public InMemoryReferenceDataSource createCollection(String collection) {
        collections.computeIfAbsent(collection, k -> new ArrayList<>());
        return this;
    }

    /**
     * Simulates losing the connection to the store.
     */
    public void setConnected(boolean connected) {
        this.connected = connected;
    }

    @Override
    public List<String> listCollections() {
        requireConnected();
        return List.copyOf(collections.keySet());
    }

    @Override
    public void forEachDocument(String collection, Consumer<Map<String, Object>> consumer) {
        requireConnected();
        List<Map<String, Object>> documents = collections.get(collection);
        if (documents == null) {
            throw new ReferenceSourceException("Collection not found: " + collection);
        }
        documents.forEach(consumer);
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public String getName() {
        return "in-memory";
    }

    @Override
    public void close() {
        connected = false;
    }

    private void requireConnected() {
        if (!connected) {
            throw new ReferenceSourceException("In-memory reference store is disconnected");
        }
    }
}
