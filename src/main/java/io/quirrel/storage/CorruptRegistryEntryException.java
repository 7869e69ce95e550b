package io.quirrel.storage;

import io.quirrel.ErrorCode;
import io.quirrel.QuirrelException;

public final class CorruptRegistryEntryException extends QuirrelException {
    public CorruptRegistryEntryException(String message) {
        super(ErrorCode.CORRUPT_REGISTRY_ENTRY, message);
    }

    public CorruptRegistryEntryException(String message, Throwable cause) {
        super(ErrorCode.CORRUPT_REGISTRY_ENTRY, message, cause);
    }
}
