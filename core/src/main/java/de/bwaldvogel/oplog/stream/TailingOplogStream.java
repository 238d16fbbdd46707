package de.bwaldvogel.oplog.stream;

import java.io.Closeable;
import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.bwaldvogel.oplog.bson.Document;
import de.bwaldvogel.oplog.exception.OplogDatabaseException;
import de.bwaldvogel.oplog.operation.Operation;
import de.bwaldvogel.oplog.operation.OperationDecoder;

/**
 * A blocking, never-ending sequence of raw oplog entries.
 * <p>
 * Empty reads of the tailing cursor are absorbed, failing reads are retried according to the {@link RetryPolicy}.
 * Neither is visible to the caller. Iteration only ends once the {@link OplogSource} is exhausted, or fails with an
 * {@link OplogDatabaseException} once the retry policy gives up.
 * <p>
 * Instances are not thread-safe.
 */
public class TailingOplogStream implements Iterator<Document>, Closeable {

    private static final Logger log = LoggerFactory.getLogger(TailingOplogStream.class);

    private final OplogSource source;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    private Document nextDocument;
    private int consecutiveFailures;
    private boolean exhausted;

    public TailingOplogStream(OplogSource source) {
        this(source, RetryPolicy.withDefaults());
    }

    public TailingOplogStream(OplogSource source, RetryPolicy retryPolicy) {
        this(source, retryPolicy, Sleeper.SYSTEM);
    }

    TailingOplogStream(OplogSource source, RetryPolicy retryPolicy, Sleeper sleeper) {
        this.source = Objects.requireNonNull(source);
        this.retryPolicy = Objects.requireNonNull(retryPolicy);
        this.sleeper = Objects.requireNonNull(sleeper);
    }

    /**
     * Blocks until the next entry is available.
     *
     * @return {@code false} once the source is exhausted
     * @throws OplogDatabaseException if the retry policy gives up
     */
    @Override
    public boolean hasNext() {
        while (nextDocument == null) {
            if (exhausted || source.isExhausted()) {
                if (!exhausted) {
                    log.info("{} is exhausted", source);
                    exhausted = true;
                }
                return false;
            }

            Document document;
            try {
                document = source.tryNext();
            } catch (RuntimeException e) {
                handleFailure(e);
                continue;
            }

            consecutiveFailures = 0;
            if (document == null) {
                awaitMoreData();
            } else {
                nextDocument = document;
            }
        }
        return true;
    }

    @Override
    public Document next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Document document = nextDocument;
        nextDocument = null;
        return document;
    }

    public Stream<Document> stream() {
        Spliterator<Document> spliterator = Spliterators.spliteratorUnknownSize(this,
            Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(spliterator, false);
    }

    /**
     * Decodes every entry with the given decoder. The returned stream fails on the first entry that cannot be
     * decoded; callers that want to skip such entries should decode the elements of {@link #stream()} themselves.
     */
    public Stream<Operation> operations(OperationDecoder decoder) {
        Objects.requireNonNull(decoder);
        return stream().map(decoder::decode);
    }

    private void handleFailure(RuntimeException e) {
        consecutiveFailures++;
        if (retryPolicy.shouldGiveUp(consecutiveFailures)) {
            log.error("Giving up on {} after {} consecutive failures", source, consecutiveFailures, e);
            throw new OplogDatabaseException("Failed to read from the oplog " + consecutiveFailures + " times in a row", e);
        }
        Duration backoff = retryPolicy.getBackoff(consecutiveFailures);
        log.warn("Failed to read from {} (failure {}), retrying in {} ms: {}",
            source, consecutiveFailures, backoff.toMillis(), e.toString());
        log.debug("Read failure", e);
        sleep(backoff);
    }

    private void awaitMoreData() {
        Duration idlePollInterval = retryPolicy.getIdlePollInterval();
        if (!idlePollInterval.isZero()) {
            log.trace("No entry available, polling again in {} ms", idlePollInterval.toMillis());
            sleep(idlePollInterval);
        }
    }

    private void sleep(Duration duration) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OplogDatabaseException("Interrupted while tailing the oplog", e);
        }
    }

    @Override
    public void close() {
        log.debug("closing {}", source);
        source.close();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + source + ")";
    }

}
