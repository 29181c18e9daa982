package com.phonepe.memsight.core.errors;

/**
 * Storage backend failed. Always propagated to the caller, writes are never dropped silently.
 */
public class MemoryStoreException extends MemsightException {
    public MemoryStoreException(MemsightError error) {
        super(error);
    }

    public MemoryStoreException(MemsightError error, Throwable cause) {
        super(error, cause);
    }

    public static MemoryStoreException unavailable(Throwable cause) {
        return new MemoryStoreException(MemsightError.error(ErrorType.STORE_UNAVAILABLE, cause), cause);
    }
}
