package io.quirrel.config;

import io.quirrel.ErrorCode;
import io.quirrel.QuirrelException;

public final class ConfigurationException extends QuirrelException {
    public ConfigurationException(String message) {
        super(ErrorCode.INVALID_CONFIGURATION, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorCode.INVALID_CONFIGURATION, message, cause);
    }
}
