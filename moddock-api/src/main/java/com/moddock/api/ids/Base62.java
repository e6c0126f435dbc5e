package com.moddock.api.ids;

/**
 * Base62 codec for the identifiers and secrets handed to clients.
 * Alphabet is {@code 0-9A-Za-z}; covers every non-negative {@code long}.
 */
public final class Base62 {

    private static final char[] ALPHABET =
            "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz".toCharArray();
    private static final int BASE = ALPHABET.length;

    private Base62() {}

    public static String encode(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Cannot encode negative value " + value);
        }
        if (value == 0) {
            return "0";
        }
        StringBuilder sb = new StringBuilder(11);
        long remaining = value;
        while (remaining > 0) {
            sb.append(ALPHABET[(int) (remaining % BASE)]);
            remaining /= BASE;
        }
        return sb.reverse().toString();
    }

    public static long decode(String encoded) {
        if (encoded == null || encoded.isEmpty()) {
            throw new MalformedTokenException("Empty base62 string");
        }
        long result = 0;
        for (int i = 0; i < encoded.length(); i++) {
            int digit = digitOf(encoded.charAt(i));
            if (digit < 0) {
                throw new MalformedTokenException("Invalid character '" + encoded.charAt(i) + "' in base62 string");
            }
            if (result > (Long.MAX_VALUE - digit) / BASE) {
                throw new MalformedTokenException("Base62 value out of range: " + encoded);
            }
            result = result * BASE + digit;
        }
        return result;
    }

    private static int digitOf(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'A' && c <= 'Z') {
            return c - 'A' + 10;
        }
        if (c >= 'a' && c <= 'z') {
            return c - 'a' + 36;
        }
        return -1;
    }
}
