/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.memsight.core.retrieval;

import com.phonepe.memsight.core.classifier.InputClassifier;
import com.phonepe.memsight.core.embedding.GuardedEmbeddingService;
import com.phonepe.memsight.core.errors.ParameterValidationError;
import com.phonepe.memsight.core.model.MemoryCategory;
import com.phonepe.memsight.core.model.MemoryItem;
import com.phonepe.memsight.core.model.SearchFilter;
import com.phonepe.memsight.core.store.MemoryStore;
import com.phonepe.memsight.core.tier.TieredMemoryManager;
import com.phonepe.memsight.core.vector.VectorIndex;
import com.phonepe.memsight.core.vector.VectorMatch;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Finds the items most relevant to a query.
 * <p>
 * The query intent narrows the search to a set of categories. Inside them a keyword search runs on the calling thread
 * while the query embedding and vector lookup run on the executor; both rankings are combined with reciprocal rank
 * fusion and weighted per category. If the narrow search yields fewer than k items the remaining categories are
 * searched and their results appended. When the vector side fails or misses its time budget the keyword ranking is
 * used alone.
 */
@Slf4j
public class ContextRetriever {
    private final InputClassifier classifier;
    private final MemoryStore store;
    private final LexicalIndex lexicalIndex;
    private final VectorIndex vectorIndex;
    private final GuardedEmbeddingService embeddingService;
    private final TieredMemoryManager tierManager;
    private final ExecutorService executorService;
    private final RetrieverConfig config;
    private final Clock clock;

    @Builder
    public ContextRetriever(@NonNull InputClassifier classifier,
                            @NonNull MemoryStore store,
                            LexicalIndex lexicalIndex,
                            VectorIndex vectorIndex,
                            GuardedEmbeddingService embeddingService,
                            @NonNull TieredMemoryManager tierManager,
                            @NonNull ExecutorService executorService,
                            RetrieverConfig config,
                            Clock clock) {
        this.classifier = classifier;
        this.store = store;
        this.lexicalIndex = Objects.requireNonNullElseGet(lexicalIndex, () -> new StoreScanningLexicalIndex(store));
        this.vectorIndex = vectorIndex;
        this.embeddingService = embeddingService;
        this.tierManager = tierManager;
        this.executorService = executorService;
        this.config = Objects.requireNonNullElse(config, RetrieverConfig.DEFAULT);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
    }

    /**
     * Up to k items of the user, most relevant first. Every returned item has its access recorded.
     */
    public List<MemoryItem> retrieve(String query, String userId, int k) {
        checkArguments(userId, k);
        if (StringUtils.isBlank(query)) {
            return List.of();
        }
        return find(query, userId, k, null);
    }

    /**
     * Like {@link #retrieve} but only items created within the window are considered. A blank query returns the
     * newest items of the window.
     */
    public List<MemoryItem> retrieveRecent(String query, String userId, int k, Duration window) {
        checkArguments(userId, k);
        final var since = clock.instant().minus(Objects.requireNonNullElse(window, config.getRecentWindow()));
        if (StringUtils.isBlank(query)) {
            final var filter = new SearchFilter(userId, Set.of(), since);
            return store.scan(userId, Set.of())
                    .stream()
                    .filter(filter::matches)
                    .sorted(Comparator.comparing(MemoryItem::getCreatedAt, Comparator.reverseOrder())
                                    .thenComparing(MemoryItem::getId))
                    .limit(k)
                    .map(tierManager::onAccess)
                    .flatMap(Optional::stream)
                    .toList();
        }
        return find(query, userId, k, since);
    }

    private List<MemoryItem> find(String query, String userId, int k, Instant createdAfter) {
        final var classification = classifier.classifyIntent(query);
        final var narrow = classification.getTargetCategories();
        log.debug("Query intent {} ({}) routes to {}",
                  classification.getIntent(), classification.getConfidence(), narrow);

        final var deadline = System.nanoTime() + config.getVectorSearchTimeout().toNanos();
        final var queryVector = startEmbedding(query);
        final var results = new LinkedHashMap<String, MemoryItem>();
        search(query, new SearchFilter(userId, narrow, createdAfter), k, queryVector, deadline)
                .forEach(item -> results.putIfAbsent(item.getId(), item));

        if (results.size() < k) {
            final var remaining = EnumSet.allOf(MemoryCategory.class);
            remaining.removeAll(narrow);
            if (!remaining.isEmpty()) {
                log.debug("Narrow search found {} of {} items, widening to {}", results.size(), k, remaining);
                search(query, new SearchFilter(userId, remaining, createdAfter), k - results.size(), queryVector,
                       deadline)
                        .forEach(item -> results.putIfAbsent(item.getId(), item));
            }
        }
        return results.values()
                .stream()
                .limit(k)
                .map(tierManager::onAccess)
                .flatMap(Optional::stream)
                .toList();
    }

    private List<MemoryItem> search(String query,
                                    SearchFilter filter,
                                    int limit,
                                    CompletableFuture<float[]> queryVector,
                                    long deadline) {
        //Saturated, k may be anything up to Integer.MAX_VALUE
        final var fetch = (int) Math.min(Integer.MAX_VALUE,
                                         (long) limit * Math.max(1, config.getCandidateMultiplier()));
        final var vectorHits = startVectorSearch(queryVector, filter, fetch);
        final var lexicalHits = lexicalIndex.search(query, filter, fetch);
        final var vectorMatches = awaitVectorHits(vectorHits, filter.userId(), deadline)
                .stream()
                .filter(match -> match.similarity() >= config.getMinVectorSimilarity())
                .toList();

        final var ids = new LinkedHashSet<String>();
        lexicalHits.forEach(hit -> ids.add(hit.id()));
        vectorMatches.forEach(match -> ids.add(match.id()));
        final var byId = new HashMap<String, MemoryItem>();
        store.getAll(ids)
                .stream()
                .filter(filter::matches)
                .forEach(item -> byId.put(item.getId(), item));

        final var lexicalRanking = lexicalHits.stream()
                .map(LexicalMatch::id)
                .filter(byId::containsKey)
                .toList();
        final var vectorRanking = vectorMatches.stream()
                .map(VectorMatch::id)
                .filter(byId::containsKey)
                .toList();
        final var fused = RankFusion.fuse(List.of(lexicalRanking, vectorRanking), config.getFusionConstant());
        return fused.entrySet()
                .stream()
                .map(entry -> Map.entry(byId.get(entry.getKey()),
                                        entry.getValue() * config.weight(byId.get(entry.getKey()).getCategory())))
                .sorted(Map.Entry.<MemoryItem, Double>comparingByValue(Comparator.reverseOrder())
                                .thenComparing(entry -> entry.getKey().getId()))
                .limit(limit)
                .map(Map.Entry::getKey)
                .toList();
    }

    /**
     * Null when no vector search is configured
     */
    private CompletableFuture<float[]> startEmbedding(String query) {
        if (vectorIndex == null || embeddingService == null) {
            return null;
        }
        return embeddingService.embedAsync(query);
    }

    private CompletableFuture<List<VectorMatch>> startVectorSearch(CompletableFuture<float[]> queryVector,
                                                                   SearchFilter filter,
                                                                   int topN) {
        if (queryVector == null) {
            return CompletableFuture.completedFuture(List.of());
        }
        return queryVector.thenApplyAsync(vector -> vectorIndex.query(vector, filter, topN), executorService);
    }

    private List<VectorMatch> awaitVectorHits(CompletableFuture<List<VectorMatch>> hits, String userId, long deadline) {
        final var remaining = Math.max(0, deadline - System.nanoTime());
        try {
            return hits.get(remaining, TimeUnit.NANOSECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            hits.cancel(true);
            log.warn("Interrupted waiting for vector search for user {}, serving lexical results", userId);
        }
        catch (TimeoutException e) {
            hits.cancel(true);
            log.warn("Vector search for user {} exceeded {}, serving lexical results",
                     userId, config.getVectorSearchTimeout());
        }
        catch (ExecutionException e) {
            log.warn("Vector search unavailable for user {}, serving lexical results: {}",
                     userId, e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
        }
        return List.of();
    }

    private static void checkArguments(String userId, int k) {
        if (StringUtils.isBlank(userId)) {
            throw new ParameterValidationError("User id is required");
        }
        if (k <= 0) {
            throw new ParameterValidationError("k must be positive, got %d".formatted(k));
        }
    }
}
