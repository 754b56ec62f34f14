package io.modelcache.error;

/**
 * Base of every typed failure raised by the resource manager.
 */
public abstract class ResourceException extends Exception {
    private final ErrorKind kind;

    protected ResourceException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ResourceException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() { return kind; }
}
