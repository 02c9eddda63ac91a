package io.github.drompincen.tabsensei.runtime.error;

/**
 * Any failure talking to the reasoning service. Always {@link FailureKind#TRANSIENT}.
 */
public class ReasoningServiceException extends RuntimeException {

    private final int status;

    public ReasoningServiceException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
    }

    public ReasoningServiceException(String message, int status) {
        super(message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }

    public FailureKind kind() {
        return FailureKind.TRANSIENT;
    }
}
