package com.phonepe.memsight.storage.memory;

import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import com.phonepe.memsight.core.errors.MemoryStoreException;
import com.phonepe.memsight.core.model.SearchFilter;
import com.phonepe.memsight.core.retrieval.LexicalIndex;
import com.phonepe.memsight.core.retrieval.LexicalMatch;
import com.phonepe.memsight.storage.ESClient;
import lombok.NonNull;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.util.List;

/**
 * Full text search over the content stored by {@link ESMemoryStore}, scored by the index's own BM25
 */
public class ESLexicalIndex implements LexicalIndex {
    private static final int MAX_HITS = 10_000;

    private final ESClient client;
    private final String indexName;

    public ESLexicalIndex(@NonNull ESClient client, @NonNull ESMemoryStore store) {
        this.client = client;
        this.indexName = store.indexName();
    }

    @Override
    public List<LexicalMatch> search(String query, @NonNull SearchFilter filter, int topN) {
        if (topN <= 0 || StringUtils.isBlank(query)) {
            return List.of();
        }
        final var filters = ESMemoryStore.filters(filter);
        try {
            return client.getElasticsearchClient()
                    .search(s -> s.index(indexName)
                                    .query(q -> q.bool(b -> b.must(m -> m.match(
                                                    t -> t.field(ESMemoryDocument.Fields.content).query(query)))
                                            .filter(filters)))
                                    .source(src -> src.fetch(false))
                                    .size(Math.min(topN, MAX_HITS)),
                            ESMemoryDocument.class)
                    .hits()
                    .hits()
                    .stream()
                    .filter(hit -> hit.id() != null && hit.score() != null)
                    .map(hit -> new LexicalMatch(hit.id(), hit.score()))
                    .toList();
        }
        catch (IOException | ElasticsearchException e) {
            throw MemoryStoreException.unavailable(e);
        }
    }
}
