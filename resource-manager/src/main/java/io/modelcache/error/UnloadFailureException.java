package io.modelcache.error;

/**
 * A loader failed to free a handle. Never thrown to callers of the manager, only logged.
 */
public class UnloadFailureException extends ResourceException {
    private final String taskId;

    public UnloadFailureException(String taskId, Throwable cause) {
        super(ErrorKind.UNLOAD_FAILURE, "Failed to unload " + taskId + ": " + cause.getMessage(), cause);
        this.taskId = taskId;
    }

    public String taskId() { return taskId; }
}
