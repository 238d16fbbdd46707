package de.bwaldvogel.oplog.bson;

import java.util.Arrays;
import java.util.Objects;

public final class BinData implements Bson {

    private static final long serialVersionUID = 1L;

    private final byte subtype;
    private final byte[] data;

    public BinData(byte subtype, byte[] data) {
        this.subtype = subtype;
        this.data = Objects.requireNonNull(data);
    }

    public byte getSubtype() {
        return subtype;
    }

    public byte[] getData() {
        return data;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BinData binData = (BinData) o;
        return subtype == binData.subtype && Arrays.equals(data, binData.data);
    }

    @Override
    public int hashCode() {
        return 31 * Byte.hashCode(subtype) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "BinData[subtype=" + subtype + ", length=" + data.length + "]";
    }

}
