package io.modelcache.spec;

/**
 * Process-wide budget settings. Device capacity is deliberately absent: it is queried when needed.
 *
 * @param offloadThreshold fraction of total capacity the selected options may collectively declare
 * @param warmupEnabled    load every task on startup
 */
public record GlobalBudget(double offloadThreshold, boolean warmupEnabled) {
    public static final double DEFAULT_OFFLOAD_THRESHOLD = 0.85;

    public GlobalBudget {
        if (Double.isNaN(offloadThreshold) || offloadThreshold < 0.0 || offloadThreshold > 1.0) {
            throw new IllegalArgumentException("offloadThreshold must be within [0,1]: " + offloadThreshold);
        }
    }

    public static GlobalBudget defaults() {
        return new GlobalBudget(DEFAULT_OFFLOAD_THRESHOLD, false);
    }
}
