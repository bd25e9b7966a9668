package io.indexer.core.storage;

import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Hash;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Key schema. Keys are '/'-joined ASCII segments; numbers are zero-padded so lexicographic
 * order equals numeric order, which is what range scans by (entity, height, position) rely on.
 *
 * <pre>
 * chain:  b/{height}                 block header
 *         bh/{blockHash}             height
 *         t/{height}/{txIndex}       transaction
 *         th/{txHash}                location
 *         r/{txHash}                 receipt
 *         l/{height}/{txIndex}/{logIndex}  log
 * meta:   wm/raw, wm/full            watermarks
 *         cnt/blocks, cnt/txs        aggregate counters
 *         raw/{height}               primary-indexed marker
 *         full/{height}              fully-indexed marker
 * </pre>
 */
public final class Keys {
    private Keys() {}

    public static final byte[] RAW_WATERMARK = bytes("wm/raw");
    public static final byte[] FULL_WATERMARK = bytes("wm/full");
    public static final byte[] BLOCK_COUNT = bytes("cnt/blocks");
    public static final byte[] TX_COUNT = bytes("cnt/txs");

    public static byte[] block(long height) { return key("b", num(height)); }
    public static byte[] blockPrefix() { return bytes("b/"); }
    public static byte[] blockHash(Hash hash) { return key("bh", hash.hex()); }
    public static byte[] transaction(long height, int txIndex) { return key("t", num(height), idx(txIndex)); }
    public static byte[] transactionPrefix(long height) { return key("t", num(height), ""); }
    public static byte[] txLocation(Hash txHash) { return key("th", txHash.hex()); }
    public static byte[] receipt(Hash txHash) { return key("r", txHash.hex()); }
    public static byte[] log(long height, int txIndex, int logIndex) { return key("l", num(height), idx(txIndex), idx(logIndex)); }
    public static byte[] logPrefix(long height) { return key("l", num(height), ""); }
    public static byte[] logsFrom(long height) { return key("l", num(height)); }
    public static byte[] rawMarker(long height) { return key("raw", num(height)); }
    public static byte[] fullMarker(long height) { return key("full", num(height)); }

    public static byte[] key(String... segments) {
        return bytes(String.join("/", segments));
    }

    public static String num(long v) {
        if (v < 0) {
            throw new IllegalArgumentException("negative key component: " + v);
        }
        return String.format("%020d", v);
    }

    public static String idx(int v) {
        if (v < 0) {
            throw new IllegalArgumentException("negative key component: " + v);
        }
        return String.format("%010d", v);
    }

    public static String addr(Address a) {
        return a.hex();
    }

    public static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }

    public static String string(byte[] key) {
        return new String(key, StandardCharsets.US_ASCII);
    }

    /** Last '/'-separated segment of a key. */
    public static String lastSegment(byte[] key) {
        String s = string(key);
        return s.substring(s.lastIndexOf('/') + 1);
    }

    public static String[] segments(byte[] key) {
        return string(key).split("/", -1);
    }

    /** Smallest key greater than every key with this prefix, or {@code null} when unbounded. */
    public static byte[] prefixEnd(byte[] prefix) {
        byte[] end = Arrays.copyOf(prefix, prefix.length);
        for (int i = end.length - 1; i >= 0; i--) {
            if ((end[i] & 0xff) != 0xff) {
                end[i]++;
                return Arrays.copyOf(end, i + 1);
            }
        }
        return null;
    }

    public static byte[] longToBytes(long v) {
        ByteBuffer b = ByteBuffer.allocate(8);
        b.putLong(v);
        return b.array();
    }

    public static long bytesToLong(byte[] a) {
        if (a == null || a.length != 8) {
            throw new IllegalArgumentException("expected 8 bytes");
        }
        return ByteBuffer.wrap(a).getLong();
    }
}
