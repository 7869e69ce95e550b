package io.quirrel.security;

import io.quirrel.ErrorCode;
import io.quirrel.QuirrelException;

public final class DecryptionFailedException extends QuirrelException {
    public DecryptionFailedException(String message) {
        super(ErrorCode.DECRYPTION_FAILED, message);
    }

    public DecryptionFailedException(String message, Throwable cause) {
        super(ErrorCode.DECRYPTION_FAILED, message, cause);
    }
}
