package com.ivamare.bulkload.schema;

/**
 * Half-open key range {@code [lo, hi)}.
 */
public record KeyRange(long lo, long hi) {

    public KeyRange {
        if (lo >= hi) {
            throw new IllegalArgumentException("empty range [" + lo + ", " + hi + ")");
        }
    }

    public long width() {
        return hi - lo;
    }

    @Override
    public String toString() {
        return "[" + lo + ", " + hi + ")";
    }
}
