package de.bwaldvogel.oplog.driver;

import java.util.concurrent.TimeUnit;

import org.bson.RawBsonDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mongodb.CursorType;
import com.mongodb.MongoException;
import com.mongodb.MongoNamespace;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;

import de.bwaldvogel.oplog.exception.OplogDatabaseException;
import de.bwaldvogel.oplog.stream.RetryPolicy;
import de.bwaldvogel.oplog.stream.TailingOplogStream;

/**
 * Opens tailing streams over the replication oplog ({@code local.oplog.rs}) of a replica set member.
 */
public final class MongoOplog {

    private static final Logger log = LoggerFactory.getLogger(MongoOplog.class);

    public static final String DATABASE_NAME = "local";
    public static final String COLLECTION_NAME = "oplog.rs";

    private static final MongoNamespace NAMESPACE = new MongoNamespace(DATABASE_NAME, COLLECTION_NAME);

    private MongoOplog() {
    }

    public static TailingOplogStream open(MongoClient client) {
        return open(client, OplogCursorOptions.withDefaults(), RetryPolicy.withDefaults());
    }

    /**
     * @throws OplogDatabaseException if the tailing cursor cannot be opened
     */
    public static TailingOplogStream open(MongoClient client, OplogCursorOptions options, RetryPolicy retryPolicy) {
        MongoCursorOplogSource source = openSource(client, options);
        return new TailingOplogStream(source, retryPolicy);
    }

    public static MongoCursorOplogSource openSource(MongoClient client, OplogCursorOptions options) {
        try {
            MongoCollection<RawBsonDocument> collection = client.getDatabase(DATABASE_NAME)
                .getCollection(COLLECTION_NAME, RawBsonDocument.class);

            FindIterable<RawBsonDocument> findIterable = collection.find()
                .cursorType(CursorType.TailableAwait)
                .noCursorTimeout(true);
            if (options.getMaxAwaitTime().isPresent()) {
                findIterable = findIterable.maxAwaitTime(options.getMaxAwaitTime().get().toMillis(), TimeUnit.MILLISECONDS);
            }
            if (options.getBatchSize().isPresent()) {
                findIterable = findIterable.batchSize(options.getBatchSize().getAsInt());
            }

            MongoCursor<RawBsonDocument> cursor = findIterable.iterator();
            log.info("opened tailing cursor on {} with {}", NAMESPACE, options);
            return new MongoCursorOplogSource(cursor, NAMESPACE);
        } catch (MongoException e) {
            throw new OplogDatabaseException("Failed to open tailing cursor on " + NAMESPACE, e);
        }
    }

}
