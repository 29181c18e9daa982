package com.phonepe.memsight.models;

import com.fasterxml.jackson.databind.JsonNode;
import com.phonepe.memsight.core.errors.ErrorType;
import com.phonepe.memsight.core.errors.MemsightError;
import com.phonepe.memsight.core.errors.MemsightException;
import com.phonepe.memsight.embedding.EmbeddingModel;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Embeddings from the {@code /embeddings} endpoint of an OpenAI compatible server. Batches go out as a single call.
 */
@Slf4j
public class OpenAICompatibleEmbeddingModel implements EmbeddingModel {
    private final OpenAICompatibleClient client;

    public OpenAICompatibleEmbeddingModel(@NonNull OpenAICompatibleClient client) {
        this.client = client;
    }

    @Override
    public float[] getEmbedding(String input) {
        return getEmbeddings(List.of(input)).get(0);
    }

    @Override
    public List<float[]> getEmbeddings(@NonNull List<String> inputs) {
        if (inputs.isEmpty()) {
            return List.of();
        }
        final var response = client.post("/embeddings",
                                          Map.of("model", client.config().getEmbeddingModel(),
                                                 "input", inputs));
        final var data = response.path("data");
        if (!data.isArray() || data.size() != inputs.size()) {
            throw new MemsightException(MemsightError.error(
                    ErrorType.MODEL_CALL_HTTP_FAILURE,
                    "expected %d embeddings, got %d".formatted(inputs.size(), data.size())));
        }
        final var embeddings = new float[inputs.size()][];
        for (final var entry : data) {
            final var index = entry.path("index").asInt(-1);
            if (index < 0 || index >= embeddings.length || embeddings[index] != null) {
                throw new MemsightException(MemsightError.error(ErrorType.MODEL_CALL_HTTP_FAILURE,
                                                                "unexpected embedding index %d".formatted(index)));
            }
            embeddings[index] = toVector(entry.path("embedding"));
        }
        log.debug("Received {} embeddings from model {}", embeddings.length, client.config().getEmbeddingModel());
        return List.of(embeddings);
    }

    private static float[] toVector(JsonNode node) {
        final var vector = new float[node.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = node.get(i).floatValue();
        }
        return vector;
    }
}
