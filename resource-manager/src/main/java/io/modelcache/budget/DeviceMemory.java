package io.modelcache.budget;

/**
 * Source of the device's total memory. Queried each time a decision needs it, never cached by callers.
 */
public interface DeviceMemory {
    long totalCapacityBytes();
}
