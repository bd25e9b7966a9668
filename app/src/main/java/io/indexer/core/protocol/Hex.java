package io.indexer.core.protocol;

import io.indexer.core.error.InvalidInputException;

import java.math.BigInteger;

public final class Hex {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private Hex() {}

    public static String encode(byte[] b) {
        char[] out = new char[b.length * 2];
        for (int i = 0, j = 0; i < b.length; i++) {
            int v = b[i] & 0xff;
            out[j++] = HEX[v >>> 4];
            out[j++] = HEX[v & 0x0f];
        }
        return new String(out);
    }

    public static String encodePrefixed(byte[] b) {
        return "0x" + encode(b);
    }

    /** Accepts an optional 0x prefix. Odd-length input is left-padded with a zero nibble. */
    public static byte[] decode(String hex) {
        if (hex == null) {
            throw new InvalidInputException("hex string is null");
        }
        String s = strip(hex);
        if ((s.length() & 1) == 1) {
            s = "0" + s;
        }
        byte[] out = new byte[s.length() / 2];
        for (int i = 0; i < out.length; i++) {
            int hi = Character.digit(s.charAt(2 * i), 16);
            int lo = Character.digit(s.charAt(2 * i + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new InvalidInputException("invalid hex: " + hex);
            }
            out[i] = (byte) ((hi << 4) | lo);
        }
        return out;
    }

    /** Parses a JSON-RPC quantity such as "0x1a". Empty or "0x" is zero. */
    public static BigInteger quantity(String hex) {
        if (hex == null) {
            throw new InvalidInputException("quantity is null");
        }
        String s = strip(hex);
        if (s.isEmpty()) {
            return BigInteger.ZERO;
        }
        try {
            return new BigInteger(s, 16);
        } catch (NumberFormatException e) {
            throw new InvalidInputException("invalid quantity: " + hex, e);
        }
    }

    public static long quantityLong(String hex) {
        BigInteger v = quantity(hex);
        if (v.signum() < 0 || v.bitLength() > 63) {
            throw new InvalidInputException("quantity out of range: " + hex);
        }
        return v.longValue();
    }

    public static String quantity(BigInteger v) {
        return "0x" + v.toString(16);
    }

    private static String strip(String hex) {
        return hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    }
}
