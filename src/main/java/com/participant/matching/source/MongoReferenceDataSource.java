package com.participant.matching.source;

import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.MongoDatabase;
import org.bson.BsonValue;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Reference store backed by a MongoDB database holding the county collections.
 *
 * <p>ZIP extraction uses the server-side {@code distinct} command; index builds
 * scan each collection once with a batched cursor.</p>
 */
public class MongoReferenceDataSource implements ReferenceDataSource {
    private static final Logger log = LoggerFactory.getLogger(MongoReferenceDataSource.class);
    private static final int BATCH_SIZE = 5_000;

    private final MongoClient mongoClient;
    private final MongoDatabase database;
    private final boolean ownsClient;

    /**
     * Creates a source over an existing client. The caller keeps ownership of the client.
     */
    public MongoReferenceDataSource(MongoClient mongoClient, String databaseName) {
        this(mongoClient, databaseName, false);
    }

    private MongoReferenceDataSource(MongoClient mongoClient, String databaseName, boolean ownsClient) {
        this.mongoClient = mongoClient;
        this.database = mongoClient.getDatabase(databaseName);
        this.ownsClient = ownsClient;
    }

    /**
     * Connects to the given URI. The returned source closes the client on {@link #close()}.
     */
    public static MongoReferenceDataSource connect(String connectionString, String databaseName) {
        log.info("source.connect uri={} database={}", redact(connectionString), databaseName);
        try {
            return new MongoReferenceDataSource(MongoClients.create(connectionString), databaseName, true);
        } catch (MongoException | IllegalArgumentException e) {
            throw new ReferenceSourceException("Cannot connect to reference store " + redact(connectionString), e);
        }
    }

    @Override
    public List<String> listCollections() {
        try {
            List<String> names = database.listCollectionNames().into(new ArrayList<>());
            names.sort(null);
            return names;
        } catch (MongoException e) {
            throw new ReferenceSourceException("Cannot list collections of " + database.getName(), e);
        }
    }

    @Override
    public void forEachDocument(String collection, Consumer<Map<String, Object>> consumer) {
        try (MongoCursor<Document> cursor = database.getCollection(collection)
                .find()
                .batchSize(BATCH_SIZE)
                .iterator()) {
            while (cursor.hasNext()) {
                consumer.accept(cursor.next());
            }
        } catch (MongoException e) {
            throw new ReferenceSourceException("Cannot read collection " + collection, e);
        }
    }

    @Override
    public Set<Object> distinctValues(String collection, String field) {
        Set<Object> values = new LinkedHashSet<>();
        try {
            for (BsonValue value : database.getCollection(collection).distinct(field, BsonValue.class)) {
                Object converted = fromBson(value);
                if (converted != null) {
                    values.add(converted);
                }
            }
        } catch (MongoException e) {
            throw new ReferenceSourceException("Cannot read distinct " + field + " of " + collection, e);
        }
        return values;
    }

    @Override
    public boolean isConnected() {
        try {
            database.runCommand(new Document("ping", 1));
            return true;
        } catch (MongoException e) {
            log.warn("source.ping.failed database={} error={}", database.getName(), e.getMessage());
            return false;
        }
    }

    @Override
    public String getName() {
        return "mongodb:" + database.getName();
    }

    @Override
    public void close() {
        if (ownsClient) {
            mongoClient.close();
        }
    }

    static Object fromBson(BsonValue value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isString()) {
            return value.asString().getValue();
        }
        if (value.isInt32()) {
            return value.asInt32().getValue();
        }
        if (value.isInt64()) {
            return value.asInt64().getValue();
        }
        if (value.isDouble()) {
            return value.asDouble().getValue();
        }
        if (value.isDecimal128()) {
            var decimal = value.asDecimal128().getValue();
            return decimal.isNaN() || decimal.isInfinite() ? null : decimal.bigDecimalValue();
        }
        return value.toString();
    }

    private static String redact(String connectionString) {
        if (connectionString == null) {
            return null;
        }
        return connectionString.replaceAll("//[^@/]*@", "//***@");
    }
}
