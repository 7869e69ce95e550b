package io.quirrel;

/**
 * Base type for every failure raised by the scheduling and delivery engine.
 *
 * <p>Subclasses are grouped by the layer that detects them; the {@link ErrorCode}
 * is stable and safe to match on, the message is meant for humans.
 */
public class QuirrelException extends RuntimeException {
    private final ErrorCode code;

    public QuirrelException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public QuirrelException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}
