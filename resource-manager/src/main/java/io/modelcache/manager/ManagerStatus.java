package io.modelcache.manager;

import java.util.List;

/**
 * Point-in-time view of the cache.
 *
 * @param loaded        resident resources, least recently used first
 * @param loadingTasks  tasks with a load in flight
 * @param usedBytes     sum of the actual bytes of resident resources
 * @param reservedBytes declared bytes held back for in-flight loads
 */
public record ManagerStatus(
        List<ResourceStatus> loaded,
        List<String> loadingTasks,
        long totalCapacityBytes,
        long usedBytes,
        long reservedBytes
) {
    public ManagerStatus {
        loaded = List.copyOf(loaded);
        loadingTasks = List.copyOf(loadingTasks);
    }

    public long availableBytes() { return Math.max(0, totalCapacityBytes - usedBytes - reservedBytes); }

    public boolean isLoaded(String taskId) {
        for (ResourceStatus r : loaded) if (r.taskId().equals(taskId)) return true;
        return false;
    }
}
