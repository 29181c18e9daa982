package com.phonepe.memsight.models;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import com.phonepe.memsight.core.classifier.ClassificationSource;
import com.phonepe.memsight.core.classifier.InputClassifier;
import com.phonepe.memsight.core.errors.MemsightException;
import com.phonepe.memsight.core.model.MemoryCategory;
import com.phonepe.memsight.core.model.QueryIntent;
import com.phonepe.memsight.core.utils.JsonUtils;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link OpenAICompatibleModelClassifier}
 */
@WireMockTest
class OpenAICompatibleModelClassifierTest {

    @Test
    void testCategory(final WireMockRuntimeInfo wiremock) {
        stubCompletion("{\"label\": \"concept\", \"confidence\": 0.82}");
        final var classifier = classifier(wiremock);

        final var prediction = classifier.classify("entropy always increases in a closed system").orElseThrow();
        assertEquals(MemoryCategory.CONCEPT, prediction.category());
        assertEquals(0.82, prediction.confidence(), 1e-9);
        verify(postRequestedFor(urlEqualTo("/chat/completions"))
                       .withRequestBody(matchingJsonPath("$.model", equalTo("test-chat")))
                       .withRequestBody(matchingJsonPath("$.messages[1].content",
                                                         equalTo("entropy always increases in a closed system")))
                       .withRequestBody(matchingJsonPath("$.messages[0].content", containing("GENERAL"))));
    }

    @Test
    void testIntent(final WireMockRuntimeInfo wiremock) {
        stubCompletion("{\"label\": \"find document\", \"confidence\": 3}");
        final var prediction = classifier(wiremock).classifyIntent("where is the lease").orElseThrow();
        assertEquals(QueryIntent.FIND_DOCUMENT, prediction.intent());
        assertEquals(1.0, prediction.confidence(), 1e-9);
    }

    @Test
    void testUnusableAnswers(final WireMockRuntimeInfo wiremock) {
        final var classifier = classifier(wiremock);

        stubCompletion("{\"label\": \"GOSSIP\", \"confidence\": 0.9}");
        assertTrue(classifier.classify("zebra quantum velvet").isEmpty());

        stubCompletion("the category is CONCEPT");
        assertTrue(classifier.classify("zebra quantum velvet").isEmpty());

        stubCompletion("");
        assertTrue(classifier.classifyIntent("zebra quantum velvet").isEmpty());

        stubFor(post(urlEqualTo("/chat/completions")).willReturn(serverError()));
        assertThrows(MemsightException.class, () -> classifier.classify("zebra quantum velvet"));
    }

    @Test
    void testFallbackForRuleClassifier(final WireMockRuntimeInfo wiremock) {
        stubCompletion("{\"label\": \"CONCEPT\", \"confidence\": 0.7}");
        final var inputClassifier = InputClassifier.builder()
                .modelClassifier(classifier(wiremock))
                .build();

        final var modelled = inputClassifier.classify("zebra quantum velvet");
        assertEquals(MemoryCategory.CONCEPT, modelled.getCategory());
        assertEquals(ClassificationSource.MODEL, modelled.getSource());

        stubFor(post(urlEqualTo("/chat/completions")).willReturn(serverError()));
        final var degraded = inputClassifier.classify("velvet quantum zebra");
        assertEquals(MemoryCategory.GENERAL, degraded.getCategory());
        assertEquals(ClassificationSource.FALLBACK, degraded.getSource());
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

    private static OpenAICompatibleModelClassifier classifier(WireMockRuntimeInfo wiremock) {
        return new OpenAICompatibleModelClassifier(new OpenAICompatibleClient(
                OpenAICompatibleClientConfig.builder()
                        .baseUrl(wiremock.getHttpBaseUrl())
                        .chatModel("test-chat")
                        .build()));
    }
}
