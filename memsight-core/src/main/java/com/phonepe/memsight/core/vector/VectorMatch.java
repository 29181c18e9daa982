package com.phonepe.memsight.core.vector;

/**
 * A hit from a vector search. Similarity is cosine, higher is closer.
 */
public record VectorMatch(String id, double similarity) {
}
