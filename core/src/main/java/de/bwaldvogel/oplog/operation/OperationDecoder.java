package de.bwaldvogel.oplog.operation;

import de.bwaldvogel.oplog.bson.BsonTimestamp;
import de.bwaldvogel.oplog.bson.Document;
import de.bwaldvogel.oplog.exception.MissingFieldException;
import de.bwaldvogel.oplog.exception.OplogDecodeException;
import de.bwaldvogel.oplog.exception.UnknownOperationException;

/**
 * Turns raw entries of {@code local.oplog.rs} into {@link Operation}s.
 * <p>
 * Only no-ops ({@code "n"}) and inserts ({@code "i"}) are decoded. Every other operation code, including the
 * known ones for updates, deletes, commands and database operations, fails with an
 * {@link UnknownOperationException}. The decoder has no state and can be shared between threads.
 */
public class OperationDecoder {

    /**
     * @throws MissingFieldException if a required field is absent or has the wrong BSON type
     * @throws UnknownOperationException if the {@code op} field holds a code that is not decoded
     */
    public Operation decode(Document entry) throws OplogDecodeException {
        String code = entry.getString(OplogFields.OPERATION_TYPE);
        OperationType type = OperationType.fromCode(code)
            .filter(OperationType::isDecodable)
            .orElseThrow(() -> new UnknownOperationException(code));

        switch (type) {
            case NOOP:
                return decodeWithKind(entry, OperationKind.NOOP);
            case INSERT:
                String namespace = entry.getString(OplogFields.NAMESPACE);
                return decodeWithKind(entry, OperationKind.insert(namespace));
            default:
                throw new UnknownOperationException(code);
        }
    }

    private static Operation decodeWithKind(Document entry, OperationKind kind) {
        long id = entry.getLong(OplogFields.HASH);
        BsonTimestamp timestamp = entry.getTimestamp(OplogFields.TIMESTAMP);
        Document document = entry.getDocument(OplogFields.O);
        return new Operation(id, timestamp, document, kind);
    }

}
