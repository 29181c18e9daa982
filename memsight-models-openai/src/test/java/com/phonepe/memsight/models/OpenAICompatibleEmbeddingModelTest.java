package com.phonepe.memsight.models;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import com.phonepe.memsight.core.errors.ErrorType;
import com.phonepe.memsight.core.errors.MemsightException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link OpenAICompatibleEmbeddingModel}
 */
@WireMockTest
class OpenAICompatibleEmbeddingModelTest {

    @Test
    void testBatchIsOrderedByIndex(final WireMockRuntimeInfo wiremock) {
        stubFor(post(urlEqualTo("/v1/embeddings"))
                        .withHeader("Authorization", equalTo("Bearer secret"))
                        .withRequestBody(matchingJsonPath("$.model", equalTo("test-embedder")))
                        .withRequestBody(matchingJsonPath("$.input[1]", equalTo("second")))
                        .willReturn(jsonResponse("""
                                                         {
                                                           "object": "list",
                                                           "data": [
                                                             {"object": "embedding", "index": 1, "embedding": [0.0, 1.0]},
                                                             {"object": "embedding", "index": 0, "embedding": [1.0, 0.5]}
                                                           ]
                                                         }
                                                         """, 200)));
        final var model = model(wiremock, "secret");

        final var embeddings = model.getEmbeddings(List.of("first", "second"));
        assertEquals(2, embeddings.size());
        assertArrayEquals(new float[]{1.0f, 0.5f}, embeddings.get(0));
        assertArrayEquals(new float[]{0.0f, 1.0f}, embeddings.get(1));
        assertTrue(model.getEmbeddings(List.of()).isEmpty());
    }

    @Test
    void testSingleInput(final WireMockRuntimeInfo wiremock) {
        stubFor(post(urlEqualTo("/v1/embeddings"))
                        .willReturn(jsonResponse("""
                                                         {"data": [{"index": 0, "embedding": [0.25, 0.75, 0.0]}]}
                                                         """, 200)));
        assertArrayEquals(new float[]{0.25f, 0.75f, 0.0f}, model(wiremock, null).getEmbedding("hello"));
        verify(postRequestedFor(urlEqualTo("/v1/embeddings")).withoutHeader("Authorization"));
    }

    @Test
    void testFailures(final WireMockRuntimeInfo wiremock) {
        final var model = model(wiremock, null);

        stubFor(post(urlEqualTo("/v1/embeddings"))
                        .willReturn(jsonResponse("{\"error\": {\"message\": \"overloaded\"}}", 503)));
        final var httpError = assertThrows(MemsightException.class, () -> model.getEmbedding("hello"));
        assertEquals(ErrorType.MODEL_CALL_HTTP_FAILURE, httpError.getErrorType());
        assertTrue(httpError.getMessage().contains("503"));

        stubFor(post(urlEqualTo("/v1/embeddings"))
                        .willReturn(jsonResponse("{\"data\": []}", 200)));
        final var missing = assertThrows(MemsightException.class, () -> model.getEmbedding("hello"));
        assertEquals(ErrorType.MODEL_CALL_HTTP_FAILURE, missing.getErrorType());

        stubFor(post(urlEqualTo("/v1/embeddings"))
                        .willReturn(okForContentType("application/json", "not json")));
        final var garbled = assertThrows(MemsightException.class, () -> model.getEmbedding("hello"));
        assertEquals(ErrorType.DESERIALIZATION_ERROR, garbled.getErrorType());
    }

    private static OpenAICompatibleEmbeddingModel model(WireMockRuntimeInfo wiremock, String apiKey) {
        return new OpenAICompatibleEmbeddingModel(new OpenAICompatibleClient(
                OpenAICompatibleClientConfig.builder()
                        .baseUrl(wiremock.getHttpBaseUrl() + "/v1/")
                        .apiKey(apiKey)
                        .embeddingModel("test-embedder")
                        .build()));
    }
}
