package io.quirrel.schedule;

import io.quirrel.ErrorCode;
import io.quirrel.QuirrelException;

/**
 * Rejected scheduling input. Always raised synchronously, before any registry mutation.
 */
public final class ValidationException extends QuirrelException {
    public ValidationException(ErrorCode code, String message) {
        super(code, message);
    }
}
