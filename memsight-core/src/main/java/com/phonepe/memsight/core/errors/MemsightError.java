package com.phonepe.memsight.core.errors;

import lombok.Value;

/**
 * Error raised by the engine or one of its collaborators
 */
@Value
public class MemsightError {
    ErrorType errorType;
    String message;

    public static MemsightError error(ErrorType errorType, Object... args) {
        return new MemsightError(errorType, String.format(errorType.getMessage(), args));
    }

    public static MemsightError error(ErrorType errorType, Throwable throwable) {
        var cause = throwable.getCause();
        var message = throwable.getMessage();
        while (cause != null) {
            message = cause.getMessage();
            cause = cause.getCause();
        }
        return MemsightError.error(errorType, message);
    }
}
