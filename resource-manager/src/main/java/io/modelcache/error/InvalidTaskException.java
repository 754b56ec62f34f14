package io.modelcache.error;

public class InvalidTaskException extends ResourceException {
    private final String taskId;

    public InvalidTaskException(String taskId) {
        super(ErrorKind.INVALID_TASK, "Invalid task: " + taskId);
        this.taskId = taskId;
    }

    public String taskId() { return taskId; }
}
