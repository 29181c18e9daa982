package com.phonepe.memsight.models;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import com.phonepe.memsight.core.conflict.ConflictAction;
import com.phonepe.memsight.core.conflict.ConflictJudge;
import com.phonepe.memsight.core.conflict.ConflictResolver;
import com.phonepe.memsight.core.conflict.ConflictResolverConfig;
import com.phonepe.memsight.core.errors.MemsightException;
import com.phonepe.memsight.core.model.MemoryCategory;
import com.phonepe.memsight.core.model.MemoryItem;
import com.phonepe.memsight.core.model.MemoryTier;
import com.phonepe.memsight.core.utils.JsonUtils;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link OpenAICompatibleConflictJudge}
 */
@WireMockTest
class OpenAICompatibleConflictJudgeTest {

    @Test
    void testJudgement(final WireMockRuntimeInfo wiremock) {
        stubCompletion("{\"relation\": \"contradictory\", \"confidence\": 0.9}");
        final var judgement = judge(wiremock).judge("I stopped drinking coffee", "I drink coffee every morning")
                .orElseThrow();
        assertEquals(ConflictJudge.Relation.CONTRADICTORY, judgement.relation());
        assertEquals(0.9, judgement.confidence(), 1e-9);
        verify(postRequestedFor(urlEqualTo("/chat/completions"))
                       .withRequestBody(matchingJsonPath("$.model", equalTo("test-chat")))
                       .withRequestBody(matchingJsonPath("$.messages[0].content", containing("COMPLEMENTARY")))
                       .withRequestBody(matchingJsonPath(
                               "$.messages[1].content",
                               equalTo("NEW: I stopped drinking coffee\nSTORED: I drink coffee every morning"))));
    }

    @Test
    void testUnusableAnswers(final WireMockRuntimeInfo wiremock) {
        final var judge = judge(wiremock);

        stubCompletion("{\"relation\": \"SIMILAR\", \"confidence\": 0.9}");
        assertTrue(judge.judge("a", "b").isEmpty());

        stubCompletion("they contradict");
        assertTrue(judge.judge("a", "b").isEmpty());

        stubFor(post(urlEqualTo("/chat/completions")).willReturn(serverError()));
        assertThrows(MemsightException.class, () -> judge.judge("a", "b"));
    }

    @Test
    void testResolverSupersedesOnContradiction(final WireMockRuntimeInfo wiremock) {
        stubCompletion("{\"relation\": \"CONTRADICTORY\", \"confidence\": 0.95}");
        final var resolver = new ConflictResolver(ConflictResolverConfig.DEFAULT, judge(wiremock));
        final var existing = item("e1", "I drink coffee every morning");
        final var incoming = item("n1", "I gave up caffeine last week");

        final var action = resolver.resolve(incoming, List.of(new ConflictResolver.Candidate(existing, 0.9)));
        assertEquals(ConflictAction.Type.SUPERSEDE, action.getType());
        assertEquals("e1", action.getExistingId());

        //Same pair again is answered from the cache
        resolver.resolve(incoming, List.of(new ConflictResolver.Candidate(existing, 0.9)));
        verify(1, postRequestedFor(urlEqualTo("/chat/completions")));
    }

    @Test
    void testResolverKeepsItemsApartWhenModelFails(final WireMockRuntimeInfo wiremock) {
        stubFor(post(urlEqualTo("/chat/completions")).willReturn(serverError()));
        final var resolver = new ConflictResolver(ConflictResolverConfig.DEFAULT, judge(wiremock));
        final var action = resolver.resolve(item("n1", "I gave up caffeine last week"),
                                            List.of(new ConflictResolver.Candidate(
                                                    item("e1", "I drink coffee every morning"), 0.9)));
        assertEquals(ConflictAction.Type.INSERT_NEW, action.getType());
    }

    @SneakyThrows
    private static void stubCompletion(String content) {
        final var body = JsonUtils.createMapper().writeValueAsString(Map.of(
                "id", "chatcmpl-1",
                "object", "chat.completion",
                "choices", new Object[]{
                        Map.of("index", 0,
                               "finish_reason", "stop",
                               "message", Map.of("role", "assistant", "content", content))
                }));
        stubFor(post(urlEqualTo("/chat/completions")).willReturn(jsonResponse(body, 200)));
    }

    private static MemoryItem item(String id, String content) {
        final var now = Instant.parse("2025-01-01T00:00:00Z");
        return MemoryItem.builder()
                .id(id)
                .userId("u1")
                .content(content)
                .category(MemoryCategory.PERSONAL)
                .tier(MemoryTier.WORKING)
                .createdAt(now)
                .lastAccessedAt(now)
                .build();
    }

    private static OpenAICompatibleConflictJudge judge(WireMockRuntimeInfo wiremock) {
        return new OpenAICompatibleConflictJudge(new OpenAICompatibleClient(
                OpenAICompatibleClientConfig.builder()
                        .baseUrl(wiremock.getHttpBaseUrl())
                        .chatModel("test-chat")
                        .build()));
    }
}
