package de.bwaldvogel.oplog.driver;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Tuning of the tailing cursor. Unset values fall back to the driver defaults.
 */
public final class OplogCursorOptions {

    private final Duration maxAwaitTime;
    private final Integer batchSize;

    private OplogCursorOptions(Duration maxAwaitTime, Integer batchSize) {
        this.maxAwaitTime = maxAwaitTime;
        this.batchSize = batchSize;
    }

    public static OplogCursorOptions withDefaults() {
        return new OplogCursorOptions(null, null);
    }

    /**
     * How long the server waits for new entries before answering a {@code getMore} with an empty batch.
     */
    public OplogCursorOptions withMaxAwaitTime(Duration maxAwaitTime) {
        Objects.requireNonNull(maxAwaitTime);
        if (maxAwaitTime.isNegative() || maxAwaitTime.isZero()) {
            throw new IllegalArgumentException("Illegal max await time: " + maxAwaitTime);
        }
        return new OplogCursorOptions(maxAwaitTime, batchSize);
    }

    public OplogCursorOptions withBatchSize(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Illegal batch size: " + batchSize);
        }
        return new OplogCursorOptions(maxAwaitTime, Integer.valueOf(batchSize));
    }

    public Optional<Duration> getMaxAwaitTime() {
        return Optional.ofNullable(maxAwaitTime);
    }

    public OptionalInt getBatchSize() {
        return batchSize != null ? OptionalInt.of(batchSize.intValue()) : OptionalInt.empty();
    }

    @Override
    public String toString() {
        return "OplogCursorOptions[maxAwaitTime=" + maxAwaitTime + ", batchSize=" + batchSize + "]";
    }

}
