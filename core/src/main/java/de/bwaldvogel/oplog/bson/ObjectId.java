package de.bwaldvogel.oplog.bson;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;

import de.bwaldvogel.oplog.wire.BsonConstants;

public final class ObjectId implements Bson, Comparable<ObjectId> {

    private static final long serialVersionUID = 1L;

    private static final Pattern HEX_PATTERN = Pattern.compile("^[a-f0-9]{" + 2 * BsonConstants.LENGTH_OBJECTID + "}$");

    private final byte[] data;

    public ObjectId(String hexString) {
        this(parseHexString(hexString));
    }

    public ObjectId(byte[] data) {
        Objects.requireNonNull(data);
        if (data.length != BsonConstants.LENGTH_OBJECTID) {
            throw new IllegalArgumentException("Illegal ObjectId length: " + data.length);
        }
        this.data = data.clone();
    }

    private static byte[] parseHexString(String hexString) {
        if (hexString == null || !HEX_PATTERN.matcher(hexString).matches()) {
            throw new IllegalArgumentException("Failed to parse '" + hexString + "'");
        }
        byte[] bytes = new byte[BsonConstants.LENGTH_OBJECTID];
        for (int i = 0; i < bytes.length; i++) {
            bytes[i] = (byte) Integer.parseInt(hexString.substring(2 * i, 2 * i + 2), 16);
        }
        return bytes;
    }

    public byte[] toByteArray() {
        return data.clone();
    }

    public Instant getTimestamp() {
        return Instant.ofEpochSecond(Integer.toUnsignedLong(ByteBuffer.wrap(data).getInt()));
    }

    public String getHexData() {
        StringBuilder sb = new StringBuilder(2 * data.length);
        for (byte b : data) {
            sb.append(String.format("%02x", b & 0xFF));
        }
        return sb.toString();
    }

    @Override
    public int compareTo(ObjectId other) {
        return Arrays.compareUnsigned(data, other.data);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(data, ((ObjectId) o).data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "ObjectId[" + getHexData() + "]";
    }

}
