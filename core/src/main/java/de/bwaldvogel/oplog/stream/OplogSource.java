package de.bwaldvogel.oplog.stream;

import java.io.Closeable;

import de.bwaldvogel.oplog.bson.Document;

/**
 * A live, tailing cursor over the oplog collection.
 * <p>
 * Implementations are opened with "tail and await more data" semantics and without an idle timeout.
 */
public interface OplogSource extends Closeable {

    /**
     * Returns the next entry, or {@code null} if none is available right now.
     * Throws a {@link RuntimeException} if fetching from the underlying cursor failed.
     */
    Document tryNext();

    /**
     * Whether the underlying cursor is closed or dead, so that no further entries can show up.
     */
    boolean isExhausted();

    @Override
    void close();

}
