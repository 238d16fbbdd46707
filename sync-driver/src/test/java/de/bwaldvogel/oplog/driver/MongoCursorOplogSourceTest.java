package de.bwaldvogel.oplog.driver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.ByteBuffer;
import java.util.UUID;

import org.bson.BsonBinary;
import org.bson.BsonDocument;
import org.bson.BsonInt64;
import org.bson.BsonString;
import org.bson.BsonTimestamp;
import org.bson.RawBsonDocument;
import org.bson.codecs.BsonDocumentCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.mongodb.MongoNamespace;
import com.mongodb.MongoSocketReadException;
import com.mongodb.ServerAddress;
import com.mongodb.ServerCursor;
import com.mongodb.client.MongoCursor;

import de.bwaldvogel.oplog.bson.Document;

@ExtendWith(MockitoExtension.class)
class MongoCursorOplogSourceTest {

    @Mock
    private MongoCursor<RawBsonDocument> cursor;

    private MongoCursorOplogSource source;

    @BeforeEach
    void setUp() {
        source = new MongoCursorOplogSource(cursor, new MongoNamespace("local", "oplog.rs"));
    }

    @Test
    void testTryNextDecodesRawDocument() throws Exception {
        BsonDocument entry = new BsonDocument("ts", new BsonTimestamp(1479419535, 0))
            .append("h", new BsonInt64(-2135725856567446411L))
            .append("op", new BsonString("n"))
            .append("o", new BsonDocument("msg", new BsonString("initiating set")));
        when(cursor.tryNext()).thenReturn(new RawBsonDocument(entry, new BsonDocumentCodec()));

        Document document = source.tryNext();

        assertThat(document).isEqualTo(new Document("ts", new de.bwaldvogel.oplog.bson.BsonTimestamp(1479419535, 0))
            .append("h", -2135725856567446411L)
            .append("op", "n")
            .append("o", new Document("msg", "initiating set")));
    }

    @Test
    void testTryNextDecodesSliceOfLargerBuffer() throws Exception {
        UUID uuid = UUID.fromString("5b61c7b6-1f1e-4d3a-9c43-0a1b2c3d4e5f");
        BsonDocument entry = new BsonDocument("op", new BsonString("i"))
            .append("ui", new BsonBinary(uuid))
            .append("h", new BsonInt64(42L));
        ByteBuffer nioBuffer = new RawBsonDocument(entry, new BsonDocumentCodec()).getByteBuffer().asNIO();
        byte[] encoded = new byte[nioBuffer.remaining()];
        nioBuffer.get(encoded);
        byte[] padded = new byte[encoded.length + 7];
        System.arraycopy(encoded, 0, padded, 3, encoded.length);
        when(cursor.tryNext()).thenReturn(new RawBsonDocument(padded, 3, encoded.length));

        Document document = source.tryNext();

        assertThat(document).isEqualTo(new Document("op", "i").append("ui", uuid).append("h", 42L));
    }

    @Test
    void testTryNextWithoutDocument() throws Exception {
        when(cursor.tryNext()).thenReturn(null);

        assertThat(source.tryNext()).isNull();
    }

    @Test
    void testTryNextPropagatesFailure() throws Exception {
        MongoSocketReadException failure = new MongoSocketReadException("Prematurely reached end of stream", new ServerAddress());
        when(cursor.tryNext()).thenThrow(failure);

        assertThatExceptionOfType(MongoSocketReadException.class)
            .isThrownBy(() -> source.tryNext())
            .isSameAs(failure);
    }

    @Test
    void testIsNotExhaustedWhileServerCursorIsAlive() throws Exception {
        when(cursor.getServerCursor()).thenReturn(new ServerCursor(123L, new ServerAddress()));

        assertThat(source.isExhausted()).isFalse();
    }

    @Test
    void testIsNotExhaustedWhileDocumentsAreBuffered() throws Exception {
        when(cursor.getServerCursor()).thenReturn(null);
        when(cursor.available()).thenReturn(2);

        assertThat(source.isExhausted()).isFalse();
    }

    @Test
    void testIsExhaustedWhenServerCursorIsGone() throws Exception {
        when(cursor.getServerCursor()).thenReturn(null);
        when(cursor.available()).thenReturn(0);

        assertThat(source.isExhausted()).isTrue();
    }

    @Test
    void testClose() throws Exception {
        source.close();
        source.close();

        verify(cursor, times(1)).close();
        assertThat(source.isExhausted()).isTrue();
        assertThatExceptionOfType(IllegalStateException.class)
            .isThrownBy(() -> source.tryNext())
            .withMessage("MongoCursorOplogSource(local.oplog.rs) is closed");
    }

    @Test
    void testToString() throws Exception {
        assertThat(source).hasToString("MongoCursorOplogSource(local.oplog.rs)");
    }

}
