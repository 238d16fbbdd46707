package de.bwaldvogel.oplog.wire;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import de.bwaldvogel.oplog.bson.BinData;
import de.bwaldvogel.oplog.bson.BsonRegularExpression;
import de.bwaldvogel.oplog.bson.BsonTimestamp;
import de.bwaldvogel.oplog.bson.Decimal128;
import de.bwaldvogel.oplog.bson.Document;
import de.bwaldvogel.oplog.bson.MaxKey;
import de.bwaldvogel.oplog.bson.MinKey;
import de.bwaldvogel.oplog.bson.ObjectId;
import de.bwaldvogel.oplog.exception.BsonDecodeException;
import io.netty.buffer.ByteBuf;

/**
 * Decodes little-endian BSON (bsonspec.org) into {@link Document}s. Stateless and thread-safe.
 */
public class BsonDecoder {

    public Document decodeBson(ByteBuf buffer) {
        try {
            return decodeDocument(buffer);
        } catch (IndexOutOfBoundsException e) {
            throw new BsonDecodeException("Truncated BSON document", e);
        }
    }

    private Document decodeDocument(ByteBuf buffer) {
        int startIndex = buffer.readerIndex();
        int totalObjectLength = buffer.readIntLE();
        if (totalObjectLength < BsonConstants.MIN_BSON_OBJECT_SIZE) {
            throw new BsonDecodeException("Illegal BSON document length: " + totalObjectLength);
        }
        if (totalObjectLength > BsonConstants.MAX_BSON_OBJECT_SIZE) {
            throw new BsonDecodeException("BSON document too large: " + totalObjectLength + " bytes");
        }
        int endIndex = startIndex + totalObjectLength;
        if (endIndex > buffer.writerIndex()) {
            throw new BsonDecodeException("Truncated BSON document: expected " + totalObjectLength
                + " bytes but only " + (buffer.writerIndex() - startIndex) + " are available");
        }

        Document document = new Document();
        while (true) {
            byte type = buffer.readByte();
            if (type == BsonConstants.TERMINATING_BYTE) {
                break;
            }
            String key = decodeCString(buffer);
            document.put(key, decodeValue(type, key, buffer));
        }

        if (buffer.readerIndex() != endIndex) {
            throw new BsonDecodeException("BSON document length mismatch: declared " + totalObjectLength
                + " bytes but read " + (buffer.readerIndex() - startIndex));
        }
        return document;
    }

    private Object decodeValue(byte type, String key, ByteBuf buffer) {
        switch (type) {
            case BsonConstants.TYPE_DOUBLE:
                return Double.valueOf(Double.longBitsToDouble(buffer.readLongLE()));
            case BsonConstants.TYPE_UTF8_STRING:
                return decodeString(buffer);
            case BsonConstants.TYPE_EMBEDDED_DOCUMENT:
                return decodeDocument(buffer);
            case BsonConstants.TYPE_ARRAY:
                return decodeArray(buffer);
            case BsonConstants.TYPE_DATA:
                return decodeBinary(buffer);
            case BsonConstants.TYPE_UNDEFINED:
            case BsonConstants.TYPE_NULL:
                return null;
            case BsonConstants.TYPE_OBJECT_ID:
                byte[] objectId = new byte[BsonConstants.LENGTH_OBJECTID];
                buffer.readBytes(objectId);
                return new ObjectId(objectId);
            case BsonConstants.TYPE_BOOLEAN:
                return decodeBoolean(key, buffer);
            case BsonConstants.TYPE_UTC_DATETIME:
                return Instant.ofEpochMilli(buffer.readLongLE());
            case BsonConstants.TYPE_REGEX:
                String pattern = decodeCString(buffer);
                String options = decodeCString(buffer);
                return new BsonRegularExpression(pattern, options);
            case BsonConstants.TYPE_INT32:
                return Integer.valueOf(buffer.readIntLE());
            case BsonConstants.TYPE_TIMESTAMP:
                return new BsonTimestamp(buffer.readLongLE());
            case BsonConstants.TYPE_INT64:
                return Long.valueOf(buffer.readLongLE());
            case BsonConstants.TYPE_DECIMAL128:
                long low = buffer.readLongLE();
                long high = buffer.readLongLE();
                return new Decimal128(high, low);
            case BsonConstants.TYPE_MIN_KEY:
                return MinKey.getInstance();
            case BsonConstants.TYPE_MAX_KEY:
                return MaxKey.getInstance();
            case BsonConstants.TYPE_DBPOINTER:
            case BsonConstants.TYPE_JAVASCRIPT_CODE:
            case BsonConstants.TYPE_SYMBOL:
            case BsonConstants.TYPE_JAVASCRIPT_CODE_WITH_SCOPE:
                throw new BsonDecodeException(String.format("Unsupported BSON type 0x%02x for key '%s'", type, key));
            default:
                throw new BsonDecodeException(String.format("Unknown BSON type 0x%02x for key '%s'", type, key));
        }
    }

    private List<Object> decodeArray(ByteBuf buffer) {
        Document arrayDocument = decodeDocument(buffer);
        return new ArrayList<>(arrayDocument.values());
    }

    private Object decodeBinary(ByteBuf buffer) {
        int length = buffer.readIntLE();
        byte subtype = buffer.readByte();
        if (length < 0 || length > buffer.readableBytes()) {
            throw new BsonDecodeException("Illegal binary length: " + length);
        }
        if (subtype == BsonConstants.BINARY_SUBTYPE_UUID && length == BsonConstants.LENGTH_UUID) {
            return new UUID(buffer.readLong(), buffer.readLong());
        }
        if (subtype == BsonConstants.BINARY_SUBTYPE_OLD_BINARY) {
            int innerLength = buffer.readIntLE();
            if (innerLength != length - 4) {
                throw new BsonDecodeException("Illegal old binary length: " + innerLength);
            }
            length = innerLength;
        }
        byte[] data = new byte[length];
        buffer.readBytes(data);
        return new BinData(subtype, data);
    }

    private Boolean decodeBoolean(String key, ByteBuf buffer) {
        byte value = buffer.readByte();
        switch (value) {
            case BsonConstants.BOOLEAN_VALUE_FALSE:
                return Boolean.FALSE;
            case BsonConstants.BOOLEAN_VALUE_TRUE:
                return Boolean.TRUE;
            default:
                throw new BsonDecodeException("Illegal boolean value " + value + " for key '" + key + "'");
        }
    }

    private String decodeString(ByteBuf buffer) {
        int length = buffer.readIntLE();
        if (length <= 0 || length > buffer.readableBytes()) {
            throw new BsonDecodeException("Illegal string length: " + length);
        }
        String value = buffer.readCharSequence(length - 1, StandardCharsets.UTF_8).toString();
        byte terminator = buffer.readByte();
        if (terminator != BsonConstants.STRING_TERMINATION) {
            throw new BsonDecodeException("String is not null-terminated");
        }
        return value;
    }

    String decodeCString(ByteBuf buffer) {
        int length = buffer.bytesBefore(BsonConstants.STRING_TERMINATION);
        if (length < 0) {
            throw new BsonDecodeException("Unterminated cstring");
        }
        String value = buffer.readCharSequence(length, StandardCharsets.UTF_8).toString();
        buffer.skipBytes(1);
        return value;
    }

}
