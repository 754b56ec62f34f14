package io.modelcache.error;

public class InvalidOptionException extends ResourceException {
    private final String taskId;
    private final String option;

    public InvalidOptionException(String taskId, String option) {
        super(ErrorKind.INVALID_OPTION, "Invalid option: " + option + " for task " + taskId);
        this.taskId = taskId;
        this.option = option;
    }

    public String taskId() { return taskId; }
    public String option() { return option; }
}
