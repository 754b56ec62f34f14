package io.modelcache.error;

/**
 * The spec table could not be built; the process must not start.
 */
public class ConfigInvalidException extends ResourceException {
    public ConfigInvalidException(String message) {
        super(ErrorKind.CONFIG_INVALID, message);
    }

    public ConfigInvalidException(String message, Throwable cause) {
        super(ErrorKind.CONFIG_INVALID, message, cause);
    }
}
