package com.phonepe.memsight.core.retrieval;

import com.phonepe.memsight.core.model.SearchFilter;
import com.phonepe.memsight.core.store.MemoryStore;
import lombok.NonNull;

import java.util.List;

/**
 * BM25 over the items of the partitions named in the filter, read from the store on every search. Meant for stores
 * that keep items in memory.
 */
public class StoreScanningLexicalIndex implements LexicalIndex {
    private final MemoryStore store;
    private final LexicalSearcher searcher = new LexicalSearcher();

    public StoreScanningLexicalIndex(@NonNull MemoryStore store) {
        this.store = store;
    }

    @Override
    public List<LexicalMatch> search(String query, @NonNull SearchFilter filter, int topN) {
        if (topN <= 0) {
            return List.of();
        }
        final var items = store.scan(filter.userId(), filter.categories())
                .stream()
                .filter(filter::matches)
                .toList();
        return searcher.search(query, items, topN)
                .stream()
                .map(hit -> new LexicalMatch(hit.item().getId(), hit.score()))
                .toList();
    }
}
