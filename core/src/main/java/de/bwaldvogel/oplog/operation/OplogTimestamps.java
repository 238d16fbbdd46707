package de.bwaldvogel.oplog.operation;

import java.time.Instant;

import de.bwaldvogel.oplog.bson.BsonTimestamp;

public final class OplogTimestamps {

    private static final long ORDINAL_MASK = 0xFFFFFFFFL;
    private static final long ORDINAL_SCALE = 1_000_000L;

    private OplogTimestamps() {
    }

    /**
     * Converts the composite oplog timestamp into an instant.
     * <p>
     * The high half is taken as epoch seconds (sign preserving). The low half is an ordinal counter within
     * that second, but it is scaled as if it were milliseconds: {@code ordinal * 1_000_000} truncated to an
     * unsigned 32-bit nanosecond value. Consumers that compare with other readers of the same oplog rely on
     * this exact arithmetic. Nanosecond values of one second or more carry over into the seconds.
     */
    public static Instant toInstant(BsonTimestamp timestamp) {
        long raw = timestamp.getValue();
        long seconds = raw >> 32;
        int nanoseconds = (int) ((raw & ORDINAL_MASK) * ORDINAL_SCALE);
        return Instant.ofEpochSecond(seconds, Integer.toUnsignedLong(nanoseconds));
    }

}
