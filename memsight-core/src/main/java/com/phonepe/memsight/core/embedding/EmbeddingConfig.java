package com.phonepe.memsight.core.embedding;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;

/**
 * Time budget and retries for calls to the embedding service
 */
@Value
@Builder
@Jacksonized
public class EmbeddingConfig {
    public static final EmbeddingConfig DEFAULT = EmbeddingConfig.builder().build();

    /**
     * Upper bound for one embedding request, retries included
     */
    @Builder.Default
    Duration timeout = Duration.ofSeconds(2);

    @Builder.Default
    int maxRetries = 1;

    @Builder.Default
    Duration retryDelay = Duration.ofMillis(100);
}
