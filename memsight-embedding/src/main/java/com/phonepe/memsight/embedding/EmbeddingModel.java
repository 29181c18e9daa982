package com.phonepe.memsight.embedding;

import java.util.List;

/**
 * A text embedding service. Implementations may block on network or native inference.
 */
public interface EmbeddingModel extends AutoCloseable {
    /**
     * Get the embedding for the given input
     *
     * @param input The input to get the embedding for
     * @return The embedding for the input
     */
    float[] getEmbedding(String input);

    /**
     * Embed a batch of inputs. Output order matches input order.
     */
    default List<float[]> getEmbeddings(List<String> inputs) {
        return inputs.stream()
                .map(this::getEmbedding)
                .toList();
    }

    @Override
    default void close() throws Exception {
        //Nothing to release by default
    }
}
