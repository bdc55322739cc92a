package com.ivamare.bulkload.schema;

/**
 * A numbered partition holding keys in {@code [lo, hi)}.
 *
 * @param number partition number, used in the partition table's name
 * @param lo inclusive lower bound
 * @param hi exclusive upper bound
 */
public record Partition(int number, long lo, long hi) {

    public Partition {
        if (number < 0) {
            throw new IllegalArgumentException("number must be >= 0, was " + number);
        }
        if (lo >= hi) {
            throw new IllegalArgumentException("empty partition range [" + lo + ", " + hi + ")");
        }
    }

    public KeyRange range() {
        return new KeyRange(lo, hi);
    }
}
