package io.quirrel.storage;

import io.quirrel.ErrorCode;
import io.quirrel.QuirrelException;

/**
 * The durable scheduler could not be reached. Not retried here; the caller owns retry policy.
 */
public final class RegistryUnavailableException extends QuirrelException {
    public RegistryUnavailableException(String message, Throwable cause) {
        super(ErrorCode.REGISTRY_UNAVAILABLE, message, cause);
    }
}
