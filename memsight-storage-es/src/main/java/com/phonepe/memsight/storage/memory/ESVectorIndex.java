package com.phonepe.memsight.storage.memory;

import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import com.phonepe.memsight.core.errors.MemoryStoreException;
import com.phonepe.memsight.core.model.SearchFilter;
import com.phonepe.memsight.core.utils.VectorUtils;
import com.phonepe.memsight.core.vector.VectorIndex;
import com.phonepe.memsight.core.vector.VectorMatch;
import com.phonepe.memsight.storage.ESClient;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Approximate nearest neighbour search over the embeddings stored by {@link ESMemoryStore}. User, category and creation
 * time filters are applied inside the knn search so that the top hits are always from the requested partitions.
 */
@Slf4j
public class ESVectorIndex implements VectorIndex {
    private static final int MIN_CANDIDATES = 100;
    //index.max_result_window and the knn candidate limit
    private static final int MAX_HITS = 10_000;

    private final ESClient client;
    private final String indexName;

    public ESVectorIndex(@NonNull ESClient client, @NonNull ESMemoryStore store) {
        this.client = client;
        this.indexName = store.indexName();
    }

    @Override
    public List<VectorMatch> query(@NonNull float[] vector, @NonNull SearchFilter filter, int topN) {
        if (topN <= 0 || VectorUtils.isZero(vector)) {
            return List.of();
        }
        final var queryVector = new ArrayList<Float>(vector.length);
        for (float v : vector) {
            queryVector.add(v);
        }
        final var size = Math.min(topN, MAX_HITS);
        final var filters = ESMemoryStore.filters(filter);
        try {
            return client.getElasticsearchClient()
                    .search(s -> s.index(indexName)
                                    .query(q -> q.knn(k -> k.field(ESMemoryDocument.Fields.embedding)
                                            .queryVector(queryVector)
                                            .k(size)
                                            .numCandidates(Math.min(MAX_HITS, Math.max(size * 10, MIN_CANDIDATES)))
                                            .filter(filters)))
                                    .source(src -> src.fetch(false))
                                    .size(size),
                            ESMemoryDocument.class)
                    .hits()
                    .hits()
                    .stream()
                    .filter(hit -> hit.id() != null && hit.score() != null)
                    //cosine scores are reported as (1 + cos) / 2
                    .map(hit -> new VectorMatch(hit.id(), 2 * hit.score() - 1))
                    .toList();
        }
        catch (IOException | ElasticsearchException e) {
            throw MemoryStoreException.unavailable(e);
        }
    }
}
