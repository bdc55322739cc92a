package com.ivamare.bulkload.migration;

/**
 * Lifecycle phases of a partition, in the only order they may run.
 */
public enum Phase {
    DISABLE_AUTOVACUUM("disable-autovacuum"),
    BULK_COPY("bulk-copy"),
    CONSTRAIN("constrain"),
    BUILD_INDEX("build-index"),
    ATTACH("attach"),
    DROP_RANGE_CHECK("drop-range-check"),
    RESET_AUTOVACUUM("reset-autovacuum"),
    ANALYZE("analyze");

    private final String label;

    Phase(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * @return the phase after this one, or null after {@link #ANALYZE}
     */
    public Phase next() {
        Phase[] phases = values();
        return ordinal() + 1 < phases.length ? phases[ordinal() + 1] : null;
    }
}
