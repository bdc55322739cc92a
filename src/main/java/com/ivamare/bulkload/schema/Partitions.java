package com.ivamare.bulkload.schema;

import java.util.ArrayList;
import java.util.List;

/**
 * Planning helpers that divide a keyspace into disjoint, contiguous pieces.
 */
public final class Partitions {

    private Partitions() {
    }

    /**
     * Build contiguous partitions from sorted bounds: {@code [b0, b1)}, {@code [b1, b2)}, ...
     *
     * @param bounds strictly increasing bounds, at least two
     * @param firstNumber number of the first partition
     * @return one partition per adjacent pair of bounds
     */
    public static List<Partition> fromBounds(List<Long> bounds, int firstNumber) {
        if (bounds.size() < 2) {
            throw new IllegalArgumentException("at least two bounds are required");
        }
        List<Partition> partitions = new ArrayList<>(bounds.size() - 1);
        for (int i = 0; i + 1 < bounds.size(); i++) {
            partitions.add(new Partition(firstNumber + i, bounds.get(i), bounds.get(i + 1)));
        }
        return partitions;
    }

    /**
     * Divide {@code [lo, hi)} into partitions of {@code size} keys; the last one may be shorter.
     *
     * @param lo inclusive lower bound
     * @param hi exclusive upper bound
     * @param size keys per partition
     * @param firstNumber number of the first partition
     * @return partitions covering {@code [lo, hi)}
     */
    public static List<Partition> evenly(long lo, long hi, long size, int firstNumber) {
        List<Partition> partitions = new ArrayList<>();
        int number = firstNumber;
        for (KeyRange range : batches(lo, hi, size)) {
            partitions.add(new Partition(number++, range.lo(), range.hi()));
        }
        return partitions;
    }

    /**
     * Divide {@code [lo, hi)} into disjoint batches of at most {@code size} keys.
     *
     * @param lo inclusive lower bound
     * @param hi exclusive upper bound
     * @param size keys per batch
     * @return batches in ascending order, empty if {@code lo >= hi}
     */
    public static List<KeyRange> batches(long lo, long hi, long size) {
        if (size < 1) {
            throw new IllegalArgumentException("size must be >= 1, was " + size);
        }
        List<KeyRange> batches = new ArrayList<>();
        for (long start = lo; start < hi; ) {
            long end = hi - start <= size ? hi : start + size;
            batches.add(new KeyRange(start, end));
            start = end;
        }
        return batches;
    }
}
