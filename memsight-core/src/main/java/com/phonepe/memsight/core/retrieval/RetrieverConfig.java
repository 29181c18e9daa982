package com.phonepe.memsight.core.retrieval;

import com.phonepe.memsight.core.model.MemoryCategory;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.Map;

/**
 * Tunables for {@link ContextRetriever}
 */
@Value
@Builder
@Jacksonized
public class RetrieverConfig {
    public static final RetrieverConfig DEFAULT = RetrieverConfig.builder().build();

    /**
     * The c in 1 / (rank + c)
     */
    @Builder.Default
    int fusionConstant = 60;

    /**
     * Each sub-search fetches k times this many hits before fusion
     */
    @Builder.Default
    int candidateMultiplier = 4;

    /**
     * Budget for query embedding plus vector lookup. Past it, lexical results are served alone.
     */
    @Builder.Default
    Duration vectorSearchTimeout = Duration.ofMillis(1500);

    /**
     * Vector hits below this cosine similarity are ignored
     */
    @Builder.Default
    double minVectorSimilarity = 0.3;

    /**
     * Window used by recent retrieval when the caller does not give one
     */
    @Builder.Default
    Duration recentWindow = Duration.ofDays(7);

    /**
     * Conversation turns kept per user
     */
    @Builder.Default
    int conversationHistorySize = 20;

    /**
     * Latest conversation turns included in a rendered context
     */
    @Builder.Default
    int conversationContextTurns = 5;

    /**
     * Conversation history of a user is dropped after this long without activity
     */
    @Builder.Default
    Duration conversationIdleExpiry = Duration.ofHours(24);

    /**
     * Multipliers applied to fused scores. Missing categories weigh 1.
     */
    @Builder.Default
    Map<MemoryCategory, Double> categoryWeights = Map.of(
            MemoryCategory.FACT, 1.2,
            MemoryCategory.PROCEDURE, 1.2,
            MemoryCategory.CONCEPT, 1.1,
            MemoryCategory.TASK, 1.1,
            MemoryCategory.CONVERSATION, 0.9,
            MemoryCategory.QUESTION, 0.8);

    public double weight(MemoryCategory category) {
        return categoryWeights == null ? 1.0 : categoryWeights.getOrDefault(category, 1.0);
    }
}
