package io.indexer.core.protocol;

import io.indexer.core.error.InvalidInputException;

import java.util.Arrays;

public final class Hash implements Comparable<Hash> {
    public static final int LENGTH = 32;
    public static final Hash ZERO = new Hash(new byte[LENGTH]);

    private final byte[] bytes;

    public Hash(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new InvalidInputException("Hash must be 32 bytes");
        }
        this.bytes = bytes.clone();
    }

    public static Hash fromHex(String hex) {
        byte[] raw = Hex.decode(hex);
        if (raw.length != LENGTH) {
            throw new InvalidInputException("invalid hash length " + raw.length + ": " + hex);
        }
        return new Hash(raw);
    }

    public byte[] bytes() { return bytes.clone(); }
    public String hex() { return Hex.encodePrefixed(bytes); }

    @Override
    public int compareTo(Hash o) {
        return Arrays.compareUnsigned(bytes, o.bytes);
    }

    @Override public boolean equals(Object o){ return o instanceof Hash && Arrays.equals(bytes, ((Hash)o).bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }
    @Override public String toString(){ return hex(); }
}
