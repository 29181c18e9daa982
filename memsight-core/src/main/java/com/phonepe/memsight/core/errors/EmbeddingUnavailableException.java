package com.phonepe.memsight.core.errors;

/**
 * The embedding service failed or timed out. Recovered locally by callers.
 */
public class EmbeddingUnavailableException extends MemsightException {
    public EmbeddingUnavailableException(MemsightError error, Throwable cause) {
        super(error, cause);
    }
}
