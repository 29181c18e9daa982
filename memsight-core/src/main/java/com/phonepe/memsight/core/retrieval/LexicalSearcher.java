package com.phonepe.memsight.core.retrieval;

import com.phonepe.memsight.core.model.MemoryItem;
import com.phonepe.memsight.core.utils.TextUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * BM25 scoring of item contents against a query. Statistics are computed over the items passed in, which are the
 * partitions being searched.
 */
class LexicalSearcher {
    private static final double K1 = 1.2;
    private static final double B = 0.75;

    record Hit(MemoryItem item, double score) {
    }

    List<Hit> search(String query, Collection<MemoryItem> items, int limit) {
        final var queryTokens = TextUtils.contentTokens(query);
        if (queryTokens.isEmpty() || items.isEmpty() || limit <= 0) {
            return List.of();
        }
        final var termFrequencies = new ArrayList<Map<String, Integer>>(items.size());
        final var documentFrequency = new HashMap<String, Integer>();
        var totalLength = 0L;
        for (final var item : items) {
            final var frequencies = new HashMap<String, Integer>();
            for (final var token : TextUtils.tokenize(item.getContent())) {
                if (!TextUtils.isStopWord(token)) {
                    frequencies.merge(token, 1, Integer::sum);
                }
            }
            frequencies.keySet().forEach(token -> documentFrequency.merge(token, 1, Integer::sum));
            termFrequencies.add(frequencies);
            totalLength += frequencies.values().stream().mapToInt(Integer::intValue).sum();
        }
        final var documents = items.size();
        final var averageLength = Math.max(1.0, (double) totalLength / documents);
        final var hits = new ArrayList<Hit>();
        var index = 0;
        for (final var item : items) {
            final var frequencies = termFrequencies.get(index++);
            final var length = frequencies.values().stream().mapToInt(Integer::intValue).sum();
            var score = 0.0;
            for (final var token : queryTokens) {
                final var frequency = frequencies.getOrDefault(token, 0);
                if (frequency == 0) {
                    continue;
                }
                final var df = documentFrequency.get(token);
                final var idf = Math.log(1 + (documents - df + 0.5) / (df + 0.5));
                score += idf * (frequency * (K1 + 1)) / (frequency + K1 * (1 - B + B * length / averageLength));
            }
            if (score > 0) {
                hits.add(new Hit(item, score));
            }
        }
        return hits.stream()
                .sorted(Comparator.comparingDouble(Hit::score).reversed()
                                .thenComparing(hit -> hit.item().getId()))
                .limit(limit)
                .toList();
    }
}
