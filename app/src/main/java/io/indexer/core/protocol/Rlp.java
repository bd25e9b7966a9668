package io.indexer.core.protocol;

import io.indexer.core.error.DecodeFailureException;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Recursive-length-prefix encoding, the subset needed for authorization digests and
 * consensus extra-data.
 */
public final class Rlp {
    private Rlp() {}

    public static byte[] encodeBytes(byte[] value) {
        if (value.length == 1 && (value[0] & 0xff) < 0x80) {
            return value.clone();
        }
        return concat(header(0x80, value.length), value);
    }

    /** Unsigned, minimal big-endian. Zero encodes as the empty string. */
    public static byte[] encodeLong(long value) {
        return encodeBigInteger(new BigInteger(Long.toUnsignedString(value)));
    }

    public static byte[] encodeBigInteger(BigInteger value) {
        if (value.signum() < 0) {
            throw new IllegalArgumentException("RLP integers are unsigned");
        }
        return encodeBytes(minimalBytes(value));
    }

    public static byte[] encodeList(byte[]... encodedItems) {
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        for (byte[] item : encodedItems) {
            body.writeBytes(item);
        }
        byte[] payload = body.toByteArray();
        return concat(header(0xc0, payload.length), payload);
    }

    public static byte[] encodeList(List<byte[]> encodedItems) {
        return encodeList(encodedItems.toArray(new byte[0][]));
    }

    public static Item decode(byte[] input) {
        if (input == null || input.length == 0) {
            throw new DecodeFailureException("empty RLP input");
        }
        int[] cursor = {0};
        Item item = decodeItem(input, cursor, input.length);
        if (cursor[0] != input.length) {
            throw new DecodeFailureException("trailing bytes after RLP item: " + (input.length - cursor[0]));
        }
        return item;
    }

    private static Item decodeItem(byte[] in, int[] cursor, int limit) {
        if (cursor[0] >= limit) {
            throw new DecodeFailureException("unexpected end of RLP input");
        }
        int prefix = in[cursor[0]] & 0xff;
        if (prefix < 0x80) {
            cursor[0]++;
            return Item.ofBytes(new byte[] {(byte) prefix});
        }
        if (prefix < 0xc0) {
            int length;
            int start;
            if (prefix <= 0xb7) {
                length = prefix - 0x80;
                start = cursor[0] + 1;
            } else {
                int lenOfLen = prefix - 0xb7;
                length = readLength(in, cursor[0] + 1, lenOfLen, limit);
                start = cursor[0] + 1 + lenOfLen;
            }
            checkBounds(start, length, limit);
            cursor[0] = start + length;
            return Item.ofBytes(Arrays.copyOfRange(in, start, start + length));
        }
        int length;
        int start;
        if (prefix <= 0xf7) {
            length = prefix - 0xc0;
            start = cursor[0] + 1;
        } else {
            int lenOfLen = prefix - 0xf7;
            length = readLength(in, cursor[0] + 1, lenOfLen, limit);
            start = cursor[0] + 1 + lenOfLen;
        }
        checkBounds(start, length, limit);
        int end = start + length;
        List<Item> children = new ArrayList<>();
        int[] inner = {start};
        while (inner[0] < end) {
            children.add(decodeItem(in, inner, end));
        }
        cursor[0] = end;
        return Item.ofList(children);
    }

    private static int readLength(byte[] in, int offset, int lenOfLen, int limit) {
        if (lenOfLen > 4 || offset + lenOfLen > limit) {
            throw new DecodeFailureException("bad RLP length prefix");
        }
        long length = 0;
        for (int i = 0; i < lenOfLen; i++) {
            length = (length << 8) | (in[offset + i] & 0xff);
        }
        if (length > Integer.MAX_VALUE) {
            throw new DecodeFailureException("RLP length too large: " + length);
        }
        return (int) length;
    }

    private static void checkBounds(int start, int length, int limit) {
        if (length < 0 || start + length > limit) {
            throw new DecodeFailureException("RLP item overruns input");
        }
    }

    private static byte[] header(int base, int length) {
        if (length <= 55) {
            return new byte[] {(byte) (base + length)};
        }
        byte[] len = minimalBytes(BigInteger.valueOf(length));
        byte[] out = new byte[len.length + 1];
        out[0] = (byte) (base + 55 + len.length);
        System.arraycopy(len, 0, out, 1, len.length);
        return out;
    }

    static byte[] minimalBytes(BigInteger value) {
        if (value.signum() == 0) {
            return new byte[0];
        }
        byte[] raw = value.toByteArray();
        return raw[0] == 0 ? Arrays.copyOfRange(raw, 1, raw.length) : raw;
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] out = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }

    /** A decoded node: either a byte string or a list of nodes. */
    public static final class Item {
        private final byte[] bytes;
        private final List<Item> items;

        private Item(byte[] bytes, List<Item> items) {
            this.bytes = bytes;
            this.items = items;
        }

        static Item ofBytes(byte[] bytes) {
            return new Item(bytes, null);
        }

        static Item ofList(List<Item> items) {
            return new Item(null, Collections.unmodifiableList(items));
        }

        public boolean isList() {
            return items != null;
        }

        public byte[] bytes() {
            if (bytes == null) {
                throw new DecodeFailureException("expected RLP string, found list");
            }
            return bytes.clone();
        }

        public List<Item> list() {
            if (items == null) {
                throw new DecodeFailureException("expected RLP list, found string");
            }
            return items;
        }

        public Item get(int index) {
            List<Item> l = list();
            if (index >= l.size()) {
                throw new DecodeFailureException("RLP list has " + l.size() + " items, wanted index " + index);
            }
            return l.get(index);
        }

        public BigInteger asBigInteger() {
            byte[] b = bytes();
            return b.length == 0 ? BigInteger.ZERO : new BigInteger(1, b);
        }

        public long asLong() {
            BigInteger v = asBigInteger();
            if (v.bitLength() > 64) {
                throw new DecodeFailureException("RLP integer exceeds 64 bits");
            }
            return v.longValue();
        }

        /** Empty list or empty string, which is how absent optional structs are encoded. */
        public boolean isEmpty() {
            return items != null ? items.isEmpty() : bytes.length == 0;
        }
    }
}
