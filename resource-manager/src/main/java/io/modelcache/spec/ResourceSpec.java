package io.modelcache.spec;

import java.util.Objects;

/**
 * One loadable option for a task.
 *
 * @param modelId        opaque identifier of the weights or artifact
 * @param backend        tag naming the inference framework that loads it
 * @param declaredBytes  advertised memory requirement, drives admission and eviction
 * @param speedClass     display only
 * @param description    free text
 * @param throughputHint e.g. frames per second, may be null
 * @param quantization   e.g. {@code 4bit} or {@code awq}, may be null
 */
public record ResourceSpec(
        String modelId,
        String backend,
        long declaredBytes,
        SpeedClass speedClass,
        String description,
        Integer throughputHint,
        String quantization
) {
    public static final long BYTES_PER_GIB = 1024L * 1024 * 1024;

    public ResourceSpec {
        if (modelId == null || modelId.isBlank()) throw new IllegalArgumentException("modelId is required");
        if (backend == null || backend.isBlank()) throw new IllegalArgumentException("backend is required");
        if (declaredBytes < 0) throw new IllegalArgumentException("declaredBytes must be >= 0: " + declaredBytes);
        speedClass = Objects.requireNonNullElse(speedClass, SpeedClass.MEDIUM);
        description = Objects.requireNonNullElse(description, "");
    }

    public ResourceSpec(String modelId, String backend, long declaredBytes) {
        this(modelId, backend, declaredBytes, SpeedClass.MEDIUM, "", null, null);
    }

    /** Converts a GB figure as written in configuration ({@code vram_gb}) to bytes. */
    public static long gibToBytes(double gib) {
        return (long) (gib * BYTES_PER_GIB);
    }

    public double declaredGib() {
        return (double) declaredBytes / BYTES_PER_GIB;
    }
}
