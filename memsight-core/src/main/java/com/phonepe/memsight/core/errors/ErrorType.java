package com.phonepe.memsight.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Kinds of failures raised by the engine
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    INVALID_PARAMETER("Invalid parameter: %s", false),
    STORE_UNAVAILABLE("Memory store unavailable: %s", true),
    STORE_CONCURRENT_UPDATE("Item %s was modified concurrently", true),
    EMBEDDING_UNAVAILABLE("Embedding service unavailable: %s", true),
    EMBEDDING_TIMEOUT("Embedding call did not finish within %s", true),
    MODEL_CALL_HTTP_FAILURE("Error making HTTP Call: %s", true),
    SERIALIZATION_ERROR("Error serializing object to JSON. Error: %s", false),
    DESERIALIZATION_ERROR("Error deserializing object from JSON. Error: %s", false),
    CONFIG_LOAD_FAILURE("Could not load configuration from %s: %s", false),
    ;

    private final String message;
    private final boolean retryable;
}
