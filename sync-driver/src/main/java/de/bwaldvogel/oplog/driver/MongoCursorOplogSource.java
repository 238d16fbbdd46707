package de.bwaldvogel.oplog.driver;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

import org.bson.RawBsonDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mongodb.MongoNamespace;
import com.mongodb.client.MongoCursor;

import de.bwaldvogel.oplog.bson.Document;
import de.bwaldvogel.oplog.stream.OplogSource;
import de.bwaldvogel.oplog.wire.BsonDecoder;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

/**
 * An {@link OplogSource} backed by a tailing cursor of the synchronous MongoDB driver.
 * <p>
 * Entries are fetched as raw BSON and decoded with {@link BsonDecoder}.
 */
public class MongoCursorOplogSource implements OplogSource {

    private static final Logger log = LoggerFactory.getLogger(MongoCursorOplogSource.class);

    private final MongoCursor<RawBsonDocument> cursor;
    private final MongoNamespace namespace;
    private final BsonDecoder bsonDecoder = new BsonDecoder();

    private boolean closed;

    public MongoCursorOplogSource(MongoCursor<RawBsonDocument> cursor, MongoNamespace namespace) {
        this.cursor = Objects.requireNonNull(cursor);
        this.namespace = Objects.requireNonNull(namespace);
    }

    @Override
    public Document tryNext() {
        if (closed) {
            throw new IllegalStateException(this + " is closed");
        }
        RawBsonDocument rawDocument = cursor.tryNext();
        if (rawDocument == null) {
            return null;
        }
        return toDocument(rawDocument);
    }

    Document toDocument(RawBsonDocument rawDocument) {
        // the driver hands out a little-endian view; the decoder reads UUID halves big-endian
        ByteBuffer nioBuffer = rawDocument.getByteBuffer().asNIO().order(ByteOrder.BIG_ENDIAN);
        ByteBuf buffer = Unpooled.wrappedBuffer(nioBuffer);
        try {
            return bsonDecoder.decodeBson(buffer);
        } finally {
            buffer.release();
        }
    }

    /**
     * The driver drops the server cursor once the server reports it dead. Documents of the last batch may still be
     * buffered client-side at that point.
     */
    @Override
    public boolean isExhausted() {
        return closed || (cursor.getServerCursor() == null && cursor.available() == 0);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        log.info("closing tailing cursor on {}", namespace);
        cursor.close();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + namespace + ")";
    }

}
