package io.modelcache.config;

import io.modelcache.spec.GlobalBudget;

/**
 * The {@code inference} section of {@code models.yaml}. Only the threshold and warmup flag drive the resource
 * manager; the rest is reported to operators as configured.
 */
public record InferenceSettings(
        String maxMemoryPerModel,
        double offloadThreshold,
        boolean warmupOnStartup,
        int defaultBatchSize,
        int maxBatchSize
) {
    public static InferenceSettings defaults() {
        return new InferenceSettings("auto", GlobalBudget.DEFAULT_OFFLOAD_THRESHOLD, false, 1, 8);
    }

    public GlobalBudget toGlobalBudget() {
        return new GlobalBudget(offloadThreshold, warmupOnStartup);
    }
}
