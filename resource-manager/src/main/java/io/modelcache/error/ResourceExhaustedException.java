package io.modelcache.error;

/**
 * Nothing is left to evict and the requested resource still does not fit.
 */
public class ResourceExhaustedException extends ResourceException {
    private final String taskId;
    private final long requiredBytes;
    private final long availableBytes;

    public ResourceExhaustedException(String taskId, long requiredBytes, long availableBytes) {
        super(ErrorKind.RESOURCE_EXHAUSTED, "Insufficient device memory for " + taskId
                + ": required=" + requiredBytes + " available=" + availableBytes + " and nothing left to evict");
        this.taskId = taskId;
        this.requiredBytes = requiredBytes;
        this.availableBytes = availableBytes;
    }

    public String taskId() { return taskId; }
    public long requiredBytes() { return requiredBytes; }
    public long availableBytes() { return availableBytes; }
}
