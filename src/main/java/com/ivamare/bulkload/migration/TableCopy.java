package com.ivamare.bulkload.migration;

import com.ivamare.bulkload.pool.RangeJob;

import java.util.Objects;

/**
 * Copy of the source rows with keys in {@code [lo, hi)} into one target table.
 */
public record TableCopy(String target, long lo, long hi) implements RangeJob<TableCopy> {

    public TableCopy {
        Objects.requireNonNull(target, "target is required");
        if (lo >= hi) {
            throw new IllegalArgumentException("empty range [" + lo + ", " + hi + ")");
        }
    }

    @Override
    public TableCopy withBounds(long lo, long hi) {
        return new TableCopy(target, lo, hi);
    }

    @Override
    public String label() {
        return target + "[" + lo + ", " + hi + ")";
    }
}
