package io.modelcache.cache;

import io.modelcache.spec.ResourceSpec;

import java.time.Instant;

/**
 * A resident resource. The handle belongs to the resource manager until it is unloaded or evicted.
 */
public record LoadedResource<H>(
        String taskId,
        String optionName,
        ResourceSpec spec,
        H handle,
        long actualBytes,
        Instant loadedAt
) {
}
