package io.modelcache.manager;

import java.time.Instant;

/**
 * Operator view of one resident resource; carries no handle.
 */
public record ResourceStatus(
        String taskId,
        String option,
        String modelId,
        String backend,
        long actualBytes,
        Instant loadedAt
) {
}
