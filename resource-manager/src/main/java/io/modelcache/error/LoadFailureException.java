package io.modelcache.error;

/**
 * Wraps whatever the loader reported for a failed load.
 */
public class LoadFailureException extends ResourceException {
    private final String taskId;

    public LoadFailureException(String taskId, Throwable cause) {
        super(ErrorKind.LOAD_FAILURE, "Failed to load " + taskId + ": " + cause.getMessage(), cause);
        this.taskId = taskId;
    }

    public String taskId() { return taskId; }
}
