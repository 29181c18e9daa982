package com.phonepe.memsight.core.vector;

import com.phonepe.memsight.core.model.SearchFilter;

import java.util.List;

/**
 * Approximate nearest neighbour lookup over item embeddings. Implementations must honour the filter, results for
 * other users are never returned.
 */
public interface VectorIndex {
    /**
     * @return at most topN matches ordered by descending similarity
     */
    List<VectorMatch> query(float[] vector, SearchFilter filter, int topN);
}
