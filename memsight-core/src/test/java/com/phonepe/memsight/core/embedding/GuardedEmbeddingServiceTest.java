package com.phonepe.memsight.core.embedding;

import com.phonepe.memsight.core.errors.EmbeddingUnavailableException;
import com.phonepe.memsight.core.errors.ErrorType;
import com.phonepe.memsight.embedding.EmbeddingModel;
import lombok.SneakyThrows;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link GuardedEmbeddingService}
 */
class GuardedEmbeddingServiceTest {
    private final ExecutorService executorService = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
    }

    @Test
    void testSuccess() {
        final var service = service(text -> new float[]{1, 2, 3}, EmbeddingConfig.DEFAULT);
        assertArrayEquals(new float[]{1, 2, 3}, service.embedOrThrow("hello"));
        assertArrayEquals(new float[]{1, 2, 3}, service.embed("hello").orElseThrow());
        assertTrue(service.embed(" ").isEmpty());
    }

    @Test
    void testRetriesTransientFailure() {
        final var calls = new AtomicInteger();
        final EmbeddingModel flaky = text -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("connection reset");
            }
            return new float[]{0.5f};
        };
        final var service = service(flaky, EmbeddingConfig.builder()
                .maxRetries(1)
                .retryDelay(Duration.ofMillis(10))
                .build());
        assertArrayEquals(new float[]{0.5f}, service.embedOrThrow("hello"));
        assertEquals(2, calls.get());
    }

    @Test
    void testFailure() {
        final EmbeddingModel broken = text -> {
            throw new IllegalStateException("model offline");
        };
        final var service = service(broken, EmbeddingConfig.builder().maxRetries(0).build());
        final var error = assertThrows(EmbeddingUnavailableException.class, () -> service.embedOrThrow("hello"));
        assertEquals(ErrorType.EMBEDDING_UNAVAILABLE, error.getErrorType());
        assertTrue(error.isRetryable());
        assertTrue(service.embed("hello").isEmpty());
    }

    @Test
    void testEmptyVectorIsFailure() {
        final var service = service(text -> new float[0], EmbeddingConfig.builder().maxRetries(0).build());
        assertTrue(service.embed("hello").isEmpty());
    }

    @Test
    void testTimeout() {
        final var service = service(GuardedEmbeddingServiceTest::slowEmbedding,
                                    EmbeddingConfig.builder()
                                            .timeout(Duration.ofMillis(100))
                                            .maxRetries(0)
                                            .build());
        final var start = System.nanoTime();
        final var error = assertThrows(EmbeddingUnavailableException.class, () -> service.embedOrThrow("hello"));
        assertEquals(ErrorType.EMBEDDING_TIMEOUT, error.getErrorType());
        assertTrue(Duration.ofNanos(System.nanoTime() - start).compareTo(Duration.ofSeconds(2)) < 0);
    }

    @Test
    void testBatch() {
        final var service = service(text -> new float[]{text.length()}, EmbeddingConfig.DEFAULT);
        final var vectors = service.embedBatch(List.of("a", "abc"));
        assertArrayEquals(new float[]{1}, vectors.get(0));
        assertArrayEquals(new float[]{3}, vectors.get(1));

        final EmbeddingModel broken = text -> {
            throw new IllegalStateException("model offline");
        };
        assertThrows(EmbeddingUnavailableException.class,
                     () -> service(broken, EmbeddingConfig.DEFAULT).embedBatch(List.of("a")));
    }

    private GuardedEmbeddingService service(EmbeddingModel model, EmbeddingConfig config) {
        return GuardedEmbeddingService.builder()
                .model(model)
                .config(config)
                .executorService(executorService)
                .build();
    }

    @SneakyThrows
    private static float[] slowEmbedding(String text) {
        Thread.sleep(5_000);
        return new float[]{1.0f};
    }
}
