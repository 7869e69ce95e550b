package io.quirrel.storage;

import io.quirrel.ErrorCode;
import io.quirrel.QuirrelException;

public final class UnsupportedScheduleException extends QuirrelException {
    public UnsupportedScheduleException(String message) {
        super(ErrorCode.UNSUPPORTED_OPERATION, message);
    }
}
