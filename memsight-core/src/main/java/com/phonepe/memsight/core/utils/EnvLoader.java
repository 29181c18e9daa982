package com.phonepe.memsight.core.utils;

import com.google.common.base.Strings;
import lombok.experimental.UtilityClass;

import java.util.Objects;
import java.util.Optional;

/**
 * Loads variables from environment
 */
@UtilityClass
public class EnvLoader {
    /**
     * Reads a mandatory environment variable
     * @param variable the name of the variable
     * @return the value of the variable
     */
    public static String readEnv(final String variable) {
        return Objects.requireNonNull(System.getenv(variable),
                                      "Please set environment variable: %s".formatted(variable));
    }

    /**
     * Reads an optional environment variable, blank values are treated as absent
     */
    public static Optional<String> readEnv(final String variable, final String defaultValue) {
        final var value = System.getenv(variable);
        return Optional.ofNullable(Strings.isNullOrEmpty(value) ? defaultValue : value);
    }
}
