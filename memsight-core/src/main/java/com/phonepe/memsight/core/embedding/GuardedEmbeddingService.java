package com.phonepe.memsight.core.embedding;

import com.phonepe.memsight.core.errors.EmbeddingUnavailableException;
import com.phonepe.memsight.core.errors.ErrorType;
import com.phonepe.memsight.core.errors.MemsightError;
import com.phonepe.memsight.embedding.EmbeddingModel;
import dev.failsafe.Failsafe;
import dev.failsafe.FailsafeExecutor;
import dev.failsafe.Policy;
import dev.failsafe.RetryPolicy;
import dev.failsafe.Timeout;
import dev.failsafe.TimeoutExceededException;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Wraps an {@link EmbeddingModel} with a timeout and retries. Failures surface as
 * {@link EmbeddingUnavailableException} or, through {@link #embed(String)}, as an empty result.
 */
@Slf4j
public class GuardedEmbeddingService {
    private final EmbeddingModel model;
    @Getter
    private final EmbeddingConfig config;
    private final FailsafeExecutor<float[]> failsafe;

    @Builder
    public GuardedEmbeddingService(@NonNull EmbeddingModel model,
                                   EmbeddingConfig config,
                                   @NonNull ExecutorService executorService) {
        this.model = model;
        this.config = Objects.requireNonNullElse(config, EmbeddingConfig.DEFAULT);
        final var retryPolicy = RetryPolicy.<float[]>builder()
                .handle(Exception.class)
                .abortOn(InterruptedException.class)
                .withMaxRetries(this.config.getMaxRetries())
                .withDelay(this.config.getRetryDelay())
                .onRetry(event -> log.debug("Retrying embedding call, attempt {}", event.getAttemptCount()))
                .build();
        final var timeout = Timeout.<float[]>builder(this.config.getTimeout())
                .withInterrupt()
                .build();
        final List<Policy<float[]>> policies = List.of(timeout, retryPolicy);
        this.failsafe = Failsafe.with(policies).with(executorService);
    }

    /**
     * Start an embedding call on the executor. The future fails with {@link EmbeddingUnavailableException} when the
     * model fails or does not answer in time.
     */
    public CompletableFuture<float[]> embedAsync(String text) {
        return failsafe.getAsync(() -> checked(model.getEmbedding(text)))
                .handle((vector, error) -> {
                    if (error != null) {
                        throw unavailable(error);
                    }
                    return vector;
                });
    }

    /**
     * Blocking embedding call bounded by the configured timeout
     *
     * @throws EmbeddingUnavailableException if the model failed or timed out
     */
    public float[] embedOrThrow(String text) {
        final var future = embedAsync(text);
        try {
            return future.get(config.getTimeout().toMillis() + 50, TimeUnit.MILLISECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw unavailable(e);
        }
        catch (TimeoutException e) {
            future.cancel(true);
            throw new EmbeddingUnavailableException(
                    MemsightError.error(ErrorType.EMBEDDING_TIMEOUT, config.getTimeout()), e);
        }
        catch (ExecutionException e) {
            throw unavailable(e.getCause());
        }
    }

    /**
     * Blocking embedding call that degrades to empty on failure
     */
    public Optional<float[]> embed(String text) {
        if (StringUtils.isBlank(text)) {
            return Optional.empty();
        }
        try {
            return Optional.of(embedOrThrow(text));
        }
        catch (EmbeddingUnavailableException e) {
            log.warn("Embedding unavailable, continuing without vector: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Batch call for backfills, not time bounded per item
     *
     * @throws EmbeddingUnavailableException if the model failed
     */
    public List<float[]> embedBatch(List<String> texts) {
        try {
            return model.getEmbeddings(texts);
        }
        catch (Exception e) {
            throw unavailable(e);
        }
    }

    private static float[] checked(float[] vector) {
        if (vector == null || vector.length == 0) {
            throw new IllegalStateException("Embedding model returned an empty vector");
        }
        return vector;
    }

    private static EmbeddingUnavailableException unavailable(Throwable error) {
        var cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof EmbeddingUnavailableException embeddingUnavailable) {
            return embeddingUnavailable;
        }
        if (cause instanceof TimeoutExceededException) {
            return new EmbeddingUnavailableException(
                    MemsightError.error(ErrorType.EMBEDDING_TIMEOUT, cause.getMessage()), cause);
        }
        return new EmbeddingUnavailableException(MemsightError.error(ErrorType.EMBEDDING_UNAVAILABLE, cause), cause);
    }
}
