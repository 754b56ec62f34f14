package io.modelcache.budget;

/**
 * Device capacity taken from configuration rather than probed from hardware.
 */
public class FixedDeviceMemory implements DeviceMemory {
    private final long totalBytes;

    public FixedDeviceMemory(long totalBytes) {
        if (totalBytes < 0) throw new IllegalArgumentException("totalBytes must be >= 0: " + totalBytes);
        this.totalBytes = totalBytes;
    }

    @Override
    public long totalCapacityBytes() { return totalBytes; }
}
