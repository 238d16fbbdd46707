package de.bwaldvogel.oplog.operation;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import de.bwaldvogel.oplog.bson.BsonTimestamp;
import de.bwaldvogel.oplog.bson.Document;

/**
 * A decoded oplog entry.
 * <p>
 * {@link #getDocument()} is the {@code o} sub-document of the entry this operation was decoded from, not a copy.
 * Mutating either one is visible through the other.
 */
public final class Operation {

    private final long id;
    private final Instant timestamp;
    private final BsonTimestamp oplogTimestamp;
    private final Document document;
    private final OperationKind kind;

    public Operation(long id, BsonTimestamp oplogTimestamp, Document document, OperationKind kind) {
        this.id = id;
        this.oplogTimestamp = Objects.requireNonNull(oplogTimestamp);
        this.timestamp = OplogTimestamps.toInstant(oplogTimestamp);
        this.document = Objects.requireNonNull(document);
        this.kind = Objects.requireNonNull(kind);
    }

    public long getId() {
        return id;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public BsonTimestamp getOplogTimestamp() {
        return oplogTimestamp;
    }

    public Document getDocument() {
        return document;
    }

    public OperationKind getKind() {
        return kind;
    }

    public OperationType getType() {
        return kind.getType();
    }

    public Optional<String> getNamespace() {
        if (kind instanceof OperationKind.Insert) {
            return Optional.of(((OperationKind.Insert) kind).getNamespace());
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Operation other = (Operation) o;
        return id == other.id
            && oplogTimestamp.equals(other.oplogTimestamp)
            && document.equals(other.document)
            && kind.equals(other.kind);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, oplogTimestamp, document, kind);
    }

    @Override
    public String toString() {
        return "Operation[id=" + id
            + ", timestamp=" + timestamp
            + ", kind=" + kind
            + ", document=" + document
            + "]";
    }

}
