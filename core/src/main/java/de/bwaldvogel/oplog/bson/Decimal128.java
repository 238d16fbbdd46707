package de.bwaldvogel.oplog.bson;

import java.util.Objects;

/**
 * IEEE 754-2008 128-bit decimal, kept as its two raw 64-bit halves.
 */
public final class Decimal128 implements Bson {

    private static final long serialVersionUID = 1L;

    private final long high;
    private final long low;

    public Decimal128(long high, long low) {
        this.high = high;
        this.low = low;
    }

    public long getHigh() {
        return high;
    }

    public long getLow() {
        return low;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Decimal128 other = (Decimal128) o;
        return high == other.high && low == other.low;
    }

    @Override
    public int hashCode() {
        return Objects.hash(high, low);
    }

    @Override
    public String toString() {
        return "Decimal128[high=" + Long.toHexString(high) + ", low=" + Long.toHexString(low) + "]";
    }

}
