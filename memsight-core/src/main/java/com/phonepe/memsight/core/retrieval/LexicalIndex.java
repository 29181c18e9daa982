package com.phonepe.memsight.core.retrieval;

import com.phonepe.memsight.core.model.SearchFilter;

import java.util.List;

/**
 * Keyword search over item contents. Implementations must honour the filter, results for other users are never
 * returned.
 */
public interface LexicalIndex {
    /**
     * @return at most topN matches ordered by descending relevance
     */
    List<LexicalMatch> search(String query, SearchFilter filter, int topN);
}
