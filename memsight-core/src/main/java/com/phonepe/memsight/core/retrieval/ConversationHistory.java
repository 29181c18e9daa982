package com.phonepe.memsight.core.retrieval;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.phonepe.memsight.core.errors.ParameterValidationError;
import com.phonepe.memsight.core.model.ConversationTurn;
import lombok.Builder;
import lombok.NonNull;
import lombok.SneakyThrows;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Latest conversation turns of every user, on heap only. Past the size limit the oldest turns are dropped, and users
 * idle for longer than the configured time are forgotten.
 */
public class ConversationHistory {
    private final RetrieverConfig config;
    private final Clock clock;
    private final Cache<String, Deque<ConversationTurn>> turns;

    @Builder
    public ConversationHistory(RetrieverConfig config, Clock clock) {
        this.config = Objects.requireNonNullElse(config, RetrieverConfig.DEFAULT);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
        this.turns = CacheBuilder.newBuilder()
                .expireAfterAccess(this.config.getConversationIdleExpiry())
                .build();
    }

    @SneakyThrows
    public ConversationTurn add(String userId,
                                @NonNull ConversationTurn.Role role,
                                String content,
                                Map<String, Object> metadata) {
        checkUser(userId);
        if (StringUtils.isBlank(content)) {
            throw new ParameterValidationError("Content is required");
        }
        final var turn = ConversationTurn.builder()
                .role(role)
                .content(content)
                .timestamp(clock.instant())
                .metadata(Objects.requireNonNullElse(metadata, Map.of()))
                .build();
        final var history = turns.get(userId, ArrayDeque::new);
        synchronized (history) {
            history.addLast(turn);
            while (history.size() > Math.max(1, config.getConversationHistorySize())) {
                history.removeFirst();
            }
        }
        return turn;
    }

    /**
     * Up to the last n turns of a user, oldest first
     */
    public List<ConversationTurn> recent(String userId, int n) {
        checkUser(userId);
        final var history = turns.getIfPresent(userId);
        if (history == null || n <= 0) {
            return List.of();
        }
        synchronized (history) {
            return history.stream()
                    .skip(Math.max(0, history.size() - n))
                    .toList();
        }
    }

    public void clear(String userId) {
        checkUser(userId);
        turns.invalidate(userId);
    }

    private static void checkUser(String userId) {
        if (StringUtils.isBlank(userId)) {
            throw new ParameterValidationError("User id is required");
        }
    }
}
