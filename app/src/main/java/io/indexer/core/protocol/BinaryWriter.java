package io.indexer.core.protocol;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.ByteBuffer;

/**
 * Deterministic big-endian writer: fixed-width longs and ints, length-prefixed byte arrays,
 * a presence byte in front of optional values.
 */
public final class BinaryWriter {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream(256);
    private final ByteBuffer scratch = ByteBuffer.allocate(8);

    public BinaryWriter putLong(long v) {
        scratch.clear();
        scratch.putLong(v);
        out.write(scratch.array(), 0, 8);
        return this;
    }

    public BinaryWriter putInt(int v) {
        scratch.clear();
        scratch.putInt(v);
        out.write(scratch.array(), 0, 4);
        return this;
    }

    public BinaryWriter putBoolean(boolean v) {
        out.write(v ? 1 : 0);
        return this;
    }

    public BinaryWriter putBytes(byte[] v) {
        byte[] b = v == null ? new byte[0] : v;
        putInt(b.length);
        out.write(b, 0, b.length);
        return this;
    }

    public BinaryWriter putBigInteger(BigInteger v) {
        return putBytes(v.toByteArray());
    }

    public BinaryWriter putOptionalBigInteger(BigInteger v) {
        putBoolean(v != null);
        if (v != null) {
            putBigInteger(v);
        }
        return this;
    }

    public BinaryWriter putOptionalLong(Long v) {
        putBoolean(v != null);
        if (v != null) {
            putLong(v);
        }
        return this;
    }

    public BinaryWriter putHash(Hash h) {
        byte[] b = h.bytes();
        out.write(b, 0, b.length);
        return this;
    }

    public BinaryWriter putAddress(Address a) {
        byte[] b = a.bytes();
        out.write(b, 0, b.length);
        return this;
    }

    public BinaryWriter putOptionalAddress(Address a) {
        putBoolean(a != null);
        if (a != null) {
            putAddress(a);
        }
        return this;
    }

    public byte[] toByteArray() {
        return out.toByteArray();
    }
}
