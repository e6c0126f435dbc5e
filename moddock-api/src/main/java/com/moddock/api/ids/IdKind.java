package com.moddock.api.ids;

/**
 * Kinds of randomly generated identifiers, each with its own value range.
 * Ids draw from {@code [62^7, 62^8)} and always encode to eight base62
 * characters; token secrets use the rest of the positive {@code long} range.
 */
public enum IdKind {
    PAT(8),
    PAT_TOKEN(11),
    REPORT(8),
    THREAD(8),
    THREAD_MESSAGE(8);

    private final long lowerBound;
    private final long upperBound;

    IdKind(int encodedLength) {
        this.lowerBound = pow62(encodedLength - 1);
        this.upperBound = encodedLength >= 11 ? Long.MAX_VALUE : pow62(encodedLength);
    }

    /** Inclusive. */
    public long lowerBound() {
        return lowerBound;
    }

    /** Exclusive. */
    public long upperBound() {
        return upperBound;
    }

    private static long pow62(int exponent) {
        long value = 1;
        for (int i = 0; i < exponent; i++) {
            value *= 62;
        }
        return value;
    }
}
