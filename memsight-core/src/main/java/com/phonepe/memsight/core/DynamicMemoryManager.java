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


package com.phonepe.memsight.core;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.phonepe.memsight.core.classifier.ClassificationResult;
import com.phonepe.memsight.core.classifier.InputClassifier;
import com.phonepe.memsight.core.classifier.ModelClassifier;
import com.phonepe.memsight.core.conflict.ConflictAction;
import com.phonepe.memsight.core.conflict.ConflictJudge;
import com.phonepe.memsight.core.conflict.ConflictResolver;
import com.phonepe.memsight.core.embedding.GuardedEmbeddingService;
import com.phonepe.memsight.core.errors.EmbeddingUnavailableException;
import com.phonepe.memsight.core.errors.ParameterValidationError;
import com.phonepe.memsight.core.model.ConversationTurn;
import com.phonepe.memsight.core.model.MemoryCategory;
import com.phonepe.memsight.core.model.MemoryItem;
import com.phonepe.memsight.core.model.MemoryTier;
import com.phonepe.memsight.core.model.PartitionKey;
import com.phonepe.memsight.core.retrieval.ContextFormatter;
import com.phonepe.memsight.core.retrieval.ContextRetriever;
import com.phonepe.memsight.core.retrieval.ConversationHistory;
import com.phonepe.memsight.core.retrieval.LexicalIndex;
import com.phonepe.memsight.core.store.MemoryStore;
import com.phonepe.memsight.core.store.PartitionLocks;
import com.phonepe.memsight.core.tier.TickResult;
import com.phonepe.memsight.core.tier.TieredMemoryManager;
import com.phonepe.memsight.core.utils.TextUtils;
import com.phonepe.memsight.core.vector.StoreScanningVectorIndex;
import com.phonepe.memsight.core.vector.VectorIndex;
import com.phonepe.memsight.embedding.EmbeddingModel;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point of the memory engine.
 * <p>
 * Content is classified into a category, embedded when an embedding model is available and checked against the
 * items already in its (user, category) partition before being stored. Writes to a partition are serialized through
 * {@link PartitionLocks} shared with the {@link TieredMemoryManager}. Retrieval is delegated to
 * {@link ContextRetriever}.
 */
@Slf4j
public class DynamicMemoryManager implements AutoCloseable {
    @Getter
    private final MemoryStore store;
    @Getter
    private final InputClassifier classifier;
    private final ConflictResolver conflictResolver;
    @Getter
    private final TieredMemoryManager tierManager;
    private final ContextRetriever retriever;
    private final ConversationHistory conversationHistory;
    private final GuardedEmbeddingService embeddingService;
    private final PartitionLocks locks;
    @Getter
    private final DynamicMemoryConfig config;
    private final ExecutorService executorService;
    private final boolean ownsExecutor;
    private final Clock clock;
    private ScheduledExecutorService scheduler;

    @Builder
    public DynamicMemoryManager(@NonNull MemoryStore store,
                                LexicalIndex lexicalIndex,
                                VectorIndex vectorIndex,
                                EmbeddingModel embeddingModel,
                                ModelClassifier modelClassifier,
                                ConflictJudge conflictJudge,
                                DynamicMemoryConfig config,
                                ExecutorService executorService,
                                Clock clock) {
        this.store = store;
        this.config = Objects.requireNonNullElse(config, DynamicMemoryConfig.DEFAULT);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
        this.ownsExecutor = executorService == null;
        this.executorService = Objects.requireNonNullElseGet(
                executorService,
                () -> Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                                                            .setNameFormat("memsight-worker-%d")
                                                            .setDaemon(true)
                                                            .build()));
        this.locks = new PartitionLocks();
        this.classifier = InputClassifier.builder()
                .modelClassifier(modelClassifier)
                .config(this.config.getClassifier())
                .build();
        this.conflictResolver = new ConflictResolver(this.config.getConflicts(), conflictJudge);
        this.tierManager = TieredMemoryManager.builder()
                .store(store)
                .locks(locks)
                .config(this.config.getTiers())
                .clock(this.clock)
                .build();
        this.embeddingService = embeddingModel == null
                                ? null
                                : GuardedEmbeddingService.builder()
                                        .model(embeddingModel)
                                        .config(this.config.getEmbedding())
                                        .executorService(this.executorService)
                                        .build();
        final var index = vectorIndex == null && embeddingModel != null
                          ? new StoreScanningVectorIndex(store)
                          : vectorIndex;
        this.retriever = ContextRetriever.builder()
                .classifier(classifier)
                .store(store)
                .lexicalIndex(lexicalIndex)
                .vectorIndex(index)
                .embeddingService(embeddingService)
                .tierManager(tierManager)
                .executorService(this.executorService)
                .config(this.config.getRetriever())
                .clock(this.clock)
                .build();
        this.conversationHistory = ConversationHistory.builder()
                .config(this.config.getRetriever())
                .clock(this.clock)
                .build();
    }

    /**
     * Store a piece of content for a user.
     *
     * @return id of the item now holding the content. This is an existing item's id when the content was merged into
     * it.
     */
    public String add(String content, String userId, Map<String, Object> metadata) {
        checkUser(userId);
        if (StringUtils.isBlank(content)) {
            throw new ParameterValidationError("Content is required");
        }
        final var classification = classifier.classify(content);
        final var embedding = embed(content);
        final var draft = tierManager.initialize(MemoryItem.builder()
                                                         .id(UUID.randomUUID().toString())
                                                         .userId(userId)
                                                         .content(content)
                                                         .embedding(embedding)
                                                         .category(classification.getCategory())
                                                         .classificationConfidence(classification.getConfidence())
                                                         .metadata(metadata(content, classification, metadata))
                                                         .build());
        final var id = locks.withLock(draft.partitionKey(), () -> store(draft));
        if (draft.hasEmbedding()) {
            //A merge that extended the content dropped the embedding of the stored item
            store.get(id)
                    .filter(item -> !item.hasEmbedding())
                    .ifPresent(item -> embeddingService.embed(item.getContent())
                            .ifPresent(vector -> fillEmbedding(item, vector)));
        }
        return id;
    }

    public String add(String content, String userId) {
        return add(content, userId, Map.of());
    }

    /**
     * Up to k items of the user most relevant to the query
     */
    public List<MemoryItem> retrieve(String query, String userId, int k) {
        return retriever.retrieve(query, userId, k);
    }

    /**
     * Up to k items of the user created within the window, most relevant first. A blank query gives the newest ones.
     *
     * @param window how far back to look, the configured recent window when null
     */
    public List<MemoryItem> retrieveRecent(String query, String userId, int k, Duration window) {
        return retriever.retrieveRecent(query, userId, k, window);
    }

    /**
     * Retrieve and render the results for inclusion in a prompt, followed by the latest conversation turns of the
     * user
     */
    public String retrieveContext(String query, String userId, int k, ContextFormatter.Mode mode) {
        final var items = retrieve(query, userId, k);
        final var turns = conversationHistory.recent(userId, config.getRetriever().getConversationContextTurns());
        return ContextFormatter.format(items, turns, mode);
    }

    /**
     * Remember a message of the ongoing conversation with a user. The history is kept in memory only and is not
     * stored as memory items.
     */
    public ConversationTurn addToConversationHistory(String userId,
                                                     @NonNull ConversationTurn.Role role,
                                                     String content,
                                                     Map<String, Object> metadata) {
        return conversationHistory.add(userId, role, content, metadata);
    }

    public ConversationTurn addToConversationHistory(String userId,
                                                     @NonNull ConversationTurn.Role role,
                                                     String content) {
        return addToConversationHistory(userId, role, content, Map.of());
    }

    /**
     * Latest conversation turns of a user, oldest first
     */
    public List<ConversationTurn> conversationHistory(String userId) {
        return conversationHistory.recent(userId, config.getRetriever().getConversationHistorySize());
    }

    public void clearConversationHistory(String userId) {
        conversationHistory.clear(userId);
        log.info("Cleared conversation history of user {}", userId);
    }

    /**
     * All items of a category for a user, newest first
     */
    public List<MemoryItem> getByCategory(String userId, @NonNull MemoryCategory category) {
        checkUser(userId);
        return store.scan(userId, Set.of(category))
                .stream()
                .sorted(Comparator.comparing(MemoryItem::getCreatedAt, Comparator.reverseOrder())
                                .thenComparing(MemoryItem::getId))
                .toList();
    }

    public MemoryStatistics statistics(String userId) {
        checkUser(userId);
        final var byCategory = new EnumMap<MemoryCategory, Long>(MemoryCategory.class);
        final var byTier = new EnumMap<MemoryTier, Long>(MemoryTier.class);
        final var capacities = new EnumMap<MemoryTier, Integer>(MemoryTier.class);
        for (final var tier : MemoryTier.values()) {
            byTier.put(tier, 0L);
            capacities.put(tier, config.getTiers().capacity(tier));
        }
        var total = 0L;
        for (final var category : MemoryCategory.values()) {
            final var inCategory = store.count(userId, category, null);
            if (inCategory == 0) {
                continue;
            }
            byCategory.put(category, inCategory);
            total += inCategory;
            for (final var tier : MemoryTier.values()) {
                byTier.merge(tier, store.count(userId, category, tier), Long::sum);
            }
        }
        final var withoutEmbedding = embeddingService == null
                                     ? 0L
                                     : store.scan(userId, Set.of())
                                             .stream()
                                             .filter(item -> !item.hasEmbedding())
                                             .count();
        return MemoryStatistics.builder()
                .userId(userId)
                .totalItems(total)
                .itemsByCategory(byCategory)
                .itemsByTier(byTier)
                .tierCapacities(capacities)
                .itemsWithoutEmbedding(withoutEmbedding)
                .classifiedByCategory(classifier.categoryCounts())
                .queriesByIntent(classifier.intentCounts())
                .build();
    }

    /**
     * Replace the content of an item. The item is classified and embedded again and moves to the new category's
     * partition if the category changed. Tier and access history are kept.
     *
     * @return the updated item, empty if the user has no item with this id
     */
    public Optional<MemoryItem> update(String userId, @NonNull String id, String content) {
        checkUser(userId);
        if (StringUtils.isBlank(content)) {
            throw new ParameterValidationError("Content is required");
        }
        final var existing = ownedBy(userId, id);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        final var classification = classifier.classify(content);
        final var embedding = embed(content);
        final var partitions = List.of(existing.get().partitionKey(),
                                       new PartitionKey(userId, classification.getCategory()));
        final var updated = locks.withLocks(partitions, () -> store.update(id, current -> {
            final var merged = new LinkedHashMap<String, Object>(current.getMetadata());
            merged.putAll(metadata(content, classification, Map.of()));
            return current.toBuilder()
                    .content(content)
                    .embedding(embedding)
                    .category(classification.getCategory())
                    .classificationConfidence(classification.getConfidence())
                    .clearMetadata()
                    .metadata(merged)
                    .build();
        }));
        updated.ifPresent(item -> log.info("Updated item {} of user {}, category {} -> {}",
                                           id, userId, existing.get().getCategory(), item.getCategory()));
        return updated;
    }

    /**
     * @return true if the item existed and belonged to the user
     */
    public boolean delete(String userId, @NonNull String id) {
        checkUser(userId);
        final var existing = ownedBy(userId, id);
        if (existing.isEmpty()) {
            return false;
        }
        final boolean deleted = locks.withLock(existing.get().partitionKey(),
                                               () -> store.delete(id).isPresent());
        if (deleted) {
            log.info("Deleted item {} of user {}", id, userId);
        }
        return deleted;
    }

    /**
     * Compute embeddings for items stored while the embedding model was unavailable
     *
     * @return number of items that received an embedding
     */
    public int backfillEmbeddings() {
        if (embeddingService == null) {
            return 0;
        }
        var filled = 0;
        for (final var partition : store.partitions()) {
            final var missing = store.scan(partition.userId(), Set.of(partition.category()))
                    .stream()
                    .filter(item -> !item.hasEmbedding())
                    .toList();
            if (missing.isEmpty()) {
                continue;
            }
            final List<float[]> vectors;
            try {
                vectors = embeddingService.embedBatch(missing.stream().map(MemoryItem::getContent).toList());
            }
            catch (EmbeddingUnavailableException e) {
                log.warn("Embedding still unavailable, backfill stopped after {} items: {}", filled, e.getMessage());
                return filled;
            }
            for (int i = 0; i < missing.size() && i < vectors.size(); i++) {
                if (fillEmbedding(missing.get(i), vectors.get(i))) {
                    filled++;
                }
            }
        }
        if (filled > 0) {
            log.info("Backfilled embeddings for {} items", filled);
        }
        return filled;
    }

    /**
     * One maintenance run: tier sweep followed by embedding backfill
     */
    public TickResult maintenance() {
        final var result = tierManager.tick();
        backfillEmbeddings();
        return result;
    }

    /**
     * Start running {@link #maintenance()} in the background at the configured interval
     */
    public synchronized void start() {
        Preconditions.checkState(scheduler == null, "Maintenance is already running");
        final var interval = config.getMaintenanceInterval().toMillis();
        scheduler = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                                                                      .setNameFormat("memsight-maintenance-%d")
                                                                      .setDaemon(true)
                                                                      .build());
        scheduler.scheduleWithFixedDelay(this::runMaintenance, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Started background maintenance every {}", config.getMaintenanceInterval());
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
            log.info("Stopped background maintenance");
        }
        if (ownsExecutor) {
            executorService.shutdownNow();
        }
    }

    private void runMaintenance() {
        try {
            maintenance();
        }
        catch (RuntimeException e) {
            //Keep the schedule alive, the next run will try again
            log.error("Maintenance run failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Caller holds the partition lock of the draft
     */
    private String store(MemoryItem draft) {
        final var partitionItems = store.scan(draft.getUserId(), Set.of(draft.getCategory()));
        final var candidates = conflictResolver.findCandidates(draft, partitionItems);
        final var action = conflictResolver.resolve(draft, candidates);
        log.debug("Conflict resolution for new {} item of user {}: {} ({})",
                  draft.getCategory(), draft.getUserId(), action.getType(), action.getReason());
        if (action.getType() == ConflictAction.Type.INSERT_NEW) {
            return store.insert(draft).getId();
        }
        final var existing = candidates.stream()
                .map(ConflictResolver.Candidate::item)
                .filter(item -> item.getId().equals(action.getExistingId()))
                .findFirst()
                .orElse(null);
        if (existing == null) {
            return store.insert(draft).getId();
        }
        if (action.getType() == ConflictAction.Type.MERGE_INTO) {
            return store.update(existing.getId(), current -> conflictResolver.merge(current, draft))
                    .map(MemoryItem::getId)
                    .orElseGet(() -> store.insert(draft).getId());
        }
        return store.replace(existing.getId(), conflictResolver.supersede(existing, draft)).getId();
    }

    /**
     * Set the embedding computed for the content of an item read earlier
     *
     * @return true if the stored item received it
     */
    private boolean fillEmbedding(MemoryItem item, float[] vector) {
        final var filled = new AtomicBoolean();
        locks.withLock(item.partitionKey(), () -> store.update(item.getId(), current -> {
            //Content may have changed since the read, such a vector would be stale
            final var applies = !current.hasEmbedding() && current.getContent().equals(item.getContent());
            filled.set(applies);
            return applies ? current.withEmbedding(vector) : current;
        }));
        return filled.get();
    }

    private Map<String, Object> metadata(String content,
                                         ClassificationResult classification,
                                         Map<String, Object> supplied) {
        final var metadata = new LinkedHashMap<String, Object>();
        if (supplied != null) {
            metadata.putAll(supplied);
        }
        classification.getAttributes().forEach(metadata::putIfAbsent);
        if (!classification.getSubcategories().isEmpty()) {
            metadata.put(MemoryItem.META_SUBCATEGORIES, new ArrayList<>(classification.getSubcategories()));
        }
        metadata.put(MemoryItem.META_CLASSIFIED_BY, classification.getSource().name().toLowerCase(Locale.ROOT));
        metadata.put(MemoryItem.META_CONTENT_HASH, TextUtils.contentHash(content));
        return metadata;
    }

    private float[] embed(String content) {
        if (embeddingService == null) {
            return null;
        }
        return embeddingService.embed(content).orElse(null);
    }

    private Optional<MemoryItem> ownedBy(String userId, String id) {
        return store.get(id).filter(item -> item.getUserId().equals(userId));
    }

    private static void checkUser(String userId) {
        if (StringUtils.isBlank(userId)) {
            throw new ParameterValidationError("User id is required");
        }
    }
}
