package com.phonepe.memsight.core.vector;

import com.phonepe.memsight.core.model.MemoryItem;
import com.phonepe.memsight.core.model.SearchFilter;
import com.phonepe.memsight.core.store.MemoryStore;
import com.phonepe.memsight.core.utils.VectorUtils;
import lombok.NonNull;

import java.util.Comparator;
import java.util.List;

/**
 * Brute force cosine search over the embeddings cached on stored items. Only the partitions named in the filter are
 * scanned, which keeps it usable for personal sized collections.
 */
public class StoreScanningVectorIndex implements VectorIndex {
    private final MemoryStore store;

    public StoreScanningVectorIndex(@NonNull MemoryStore store) {
        this.store = store;
    }

    @Override
    public List<VectorMatch> query(float[] vector, @NonNull SearchFilter filter, int topN) {
        if (vector == null || vector.length == 0 || topN <= 0) {
            return List.of();
        }
        return store.scan(filter.userId(), filter.categories())
                .stream()
                .filter(item -> item.hasEmbedding() && filter.matches(item))
                .map(item -> new VectorMatch(item.getId(),
                                             VectorUtils.cosineSimilarity(vector, item.getEmbedding())))
                .sorted(Comparator.comparingDouble(VectorMatch::similarity).reversed()
                                .thenComparing(VectorMatch::id))
                .limit(topN)
                .toList();
    }
}
