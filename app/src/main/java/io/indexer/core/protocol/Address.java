package io.indexer.core.protocol;

import io.indexer.core.error.InvalidInputException;

import java.util.Arrays;

/** 20-byte account or contract address, rendered lower-case with a 0x prefix. */
public final class Address implements Comparable<Address> {
    public static final int LENGTH = 20;
    public static final Address ZERO = new Address(new byte[LENGTH]);

    private final byte[] bytes;

    public Address(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new InvalidInputException("Address must be 20 bytes");
        }
        this.bytes = bytes.clone();
    }

    public static Address fromHex(String hex) {
        byte[] raw = Hex.decode(hex);
        if (raw.length != LENGTH) {
            throw new InvalidInputException("invalid address length " + raw.length + ": " + hex);
        }
        return new Address(raw);
    }

    /** Right-most 20 bytes of a 32-byte word, the layout used for indexed address topics. */
    public static Address fromWord(byte[] word) {
        if (word == null || word.length != 32) {
            throw new InvalidInputException("address word must be 32 bytes");
        }
        return new Address(Arrays.copyOfRange(word, 12, 32));
    }

    public byte[] bytes() { return bytes.clone(); }
    public String hex() { return Hex.encodePrefixed(bytes); }

    @Override
    public int compareTo(Address o) {
        return Arrays.compareUnsigned(bytes, o.bytes);
    }

    @Override public boolean equals(Object o){ return o instanceof Address && Arrays.equals(bytes, ((Address)o).bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }
    @Override public String toString(){ return hex(); }
}
