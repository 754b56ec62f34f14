package io.modelcache.error;

/**
 * Error kinds a caller can branch on, with the status each transport maps them to.
 */
public enum ErrorKind {
    CONFIG_INVALID(500, "FAILED_PRECONDITION"),
    INVALID_TASK(404, "NOT_FOUND"),
    INVALID_OPTION(400, "INVALID_ARGUMENT"),
    RESOURCE_EXHAUSTED(503, "RESOURCE_EXHAUSTED"),
    LOAD_FAILURE(500, "INTERNAL"),
    UNLOAD_FAILURE(500, "INTERNAL");

    private final int httpStatus;
    private final String grpcCode;

    ErrorKind(int httpStatus, String grpcCode) {
        this.httpStatus = httpStatus;
        this.grpcCode = grpcCode;
    }

    public int httpStatus() { return httpStatus; }

    /** Name of the matching {@code io.grpc.Status.Code} constant. */
    public String grpcCode() { return grpcCode; }
}
