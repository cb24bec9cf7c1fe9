package com.participant.matching.source;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Read-only access to the county reference store: one collection per county per
 * data type, named {@code {County}Demographic} and {@code {County}Residential}.
 *
 * <p>Documents are handed out as raw maps; {@link ReferenceRecordMapper} turns them
 * into typed records. Implementations report store failures as
 * {@link ReferenceSourceException}, which aborts the run.</p>
 */
public interface ReferenceDataSource extends AutoCloseable {

    /**
     * Lists all collection names in the store.
     */
    List<String> listCollections();

    /**
     * Streams every document of a collection to the consumer, in store order.
     *
     * @param collection the collection name
     * @param consumer   receives each document as a field map
     */
    void forEachDocument(String collection, Consumer<Map<String, Object>> consumer);

    /**
     * Returns the distinct non-null values of a field in a collection.
     * The default implementation scans the collection.
     */
    default Set<Object> distinctValues(String collection, String field) {
        Set<Object> values = new LinkedHashSet<>();
        forEachDocument(collection, document -> {
            Object value = document.get(field);
            if (value != null) {
                values.add(value);
            }
        });
        return values;
    }

    /**
     * Checks whether the store can currently be reached.
     */
    boolean isConnected();

    /**
     * Human-readable name of the store, used in log messages.
     */
    String getName();

    @Override
    void close();
}
