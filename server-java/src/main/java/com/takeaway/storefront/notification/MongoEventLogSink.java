package com.takeaway.storefront.notification;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.result.InsertOneResult;
import com.takeaway.storefront.config.SecretResolver;
import jakarta.annotation.PreDestroy;
import org.bson.BsonValue;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Writes event documents to MongoDB. The client is created on first use from the
 * {@code EVENT_LOG_MONGO_URI} secret; without that secret the sink reports itself disabled.
 */
@Component
public class MongoEventLogSink implements EventLogSink {

    private static final Logger logger = LoggerFactory.getLogger(MongoEventLogSink.class);
    private static final String RETRYABLE_WRITE_ERROR = "RetryableWriteError";

    private final SecretResolver secretResolver;
    private final String defaultDatabase;
    private final int timeoutSeconds;
    private MongoClient client;
    private String databaseName;

    public MongoEventLogSink(SecretResolver secretResolver,
                             @Value("${storefront.event-log.database:storefront}") String defaultDatabase,
                             @Value("${storefront.notification.timeout-seconds:10}") int timeoutSeconds) {
        this.secretResolver = secretResolver;
        this.defaultDatabase = defaultDatabase;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public boolean isEnabled() {
        return secretResolver.resolve(SecretResolver.EVENT_LOG_MONGO_URI).isPresent();
    }

    @Override
    public String append(String collection, Map<String, Object> document) {
        MongoClient mongo = client();
        try {
            InsertOneResult result = mongo.getDatabase(databaseName)
                    .getCollection(collection)
                    .insertOne(new Document(document));
            BsonValue id = result.getInsertedId();
            return id != null && id.isObjectId() ? id.asObjectId().getValue().toHexString() : String.valueOf(id);
        } catch (MongoException e) {
            throw new EventLogWriteException("Event log write to '" + collection + "' failed", e, isTransient(e));
        }
    }

    static boolean isTransient(MongoException e) {
        return e instanceof MongoSocketException
                || e instanceof MongoTimeoutException
                || e.hasErrorLabel(RETRYABLE_WRITE_ERROR);
    }

    private synchronized MongoClient client() {
        if (client != null) {
            return client;
        }
        Optional<String> uri = secretResolver.resolve(SecretResolver.EVENT_LOG_MONGO_URI);
        if (uri.isEmpty()) {
            throw new EventLogWriteException("Event log is not configured", null, false);
        }
        ConnectionString connectionString = new ConnectionString(uri.get());
        databaseName = connectionString.getDatabase() != null ? connectionString.getDatabase() : defaultDatabase;
        client = MongoClients.create(settings(connectionString));
        logger.info("Event log connected to MongoDB database '{}'", databaseName);
        return client;
    }

    /** Server selection, connect and read are each bounded by the notification timeout. */
    MongoClientSettings settings(ConnectionString connectionString) {
        return MongoClientSettings.builder()
                .applyConnectionString(connectionString)
                .applyToClusterSettings(cluster -> cluster.serverSelectionTimeout(timeoutSeconds, TimeUnit.SECONDS))
                .applyToSocketSettings(socket -> socket
                        .connectTimeout(timeoutSeconds, TimeUnit.SECONDS)
                        .readTimeout(timeoutSeconds, TimeUnit.SECONDS))
                .build();
    }

    @PreDestroy
    public synchronized void close() {
        if (client != null) {
            client.close();
            client = null;
        }
    }
}
