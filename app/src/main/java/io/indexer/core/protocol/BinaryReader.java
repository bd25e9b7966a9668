package io.indexer.core.protocol;

import java.math.BigInteger;
import java.nio.ByteBuffer;

/** Counterpart of {@link BinaryWriter}. Bounds violations raise {@link IllegalArgumentException}. */
public final class BinaryReader {
    private static final int MAX_FIELD = 64 * 1024 * 1024;

    private final ByteBuffer buf;

    public BinaryReader(byte[] bytes) {
        this.buf = ByteBuffer.wrap(bytes);
    }

    public long getLong() { return buf.getLong(); }
    public int getInt() { return buf.getInt(); }

    public boolean getBoolean() {
        byte b = buf.get();
        if (b != 0 && b != 1) {
            throw new IllegalArgumentException("bad boolean byte: " + b);
        }
        return b == 1;
    }

    public byte[] getBytes() {
        int len = buf.getInt();
        if (len < 0 || len > MAX_FIELD || len > buf.remaining()) {
            throw new IllegalArgumentException("Bad length: " + len + " (remaining=" + buf.remaining() + ")");
        }
        byte[] out = new byte[len];
        buf.get(out);
        return out;
    }

    public BigInteger getBigInteger() {
        byte[] raw = getBytes();
        return raw.length == 0 ? BigInteger.ZERO : new BigInteger(raw);
    }

    public BigInteger getOptionalBigInteger() {
        return getBoolean() ? getBigInteger() : null;
    }

    public Long getOptionalLong() {
        return getBoolean() ? buf.getLong() : null;
    }

    public Hash getHash() {
        byte[] b = new byte[Hash.LENGTH];
        buf.get(b);
        return new Hash(b);
    }

    public Address getAddress() {
        byte[] b = new byte[Address.LENGTH];
        buf.get(b);
        return new Address(b);
    }

    public Address getOptionalAddress() {
        return getBoolean() ? getAddress() : null;
    }

    /** Reads a list count and rejects values that cannot fit in the remaining input. */
    public int getCount(int minElementBytes) {
        int count = buf.getInt();
        if (count < 0 || (long) count * Math.max(1, minElementBytes) > buf.remaining()) {
            throw new IllegalArgumentException("bad element count: " + count);
        }
        return count;
    }

    public boolean hasRemaining() {
        return buf.hasRemaining();
    }
}
