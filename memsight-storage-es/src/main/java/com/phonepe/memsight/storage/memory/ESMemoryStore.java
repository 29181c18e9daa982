package com.phonepe.memsight.storage.memory;

import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.aggregations.CompositeAggregationSource;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch._types.query_dsl.TermsQueryField;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import com.google.common.base.Strings;
import com.phonepe.memsight.core.errors.ErrorType;
import com.phonepe.memsight.core.errors.MemoryStoreException;
import com.phonepe.memsight.core.errors.MemsightError;
import com.phonepe.memsight.core.errors.ParameterValidationError;
import com.phonepe.memsight.core.model.MemoryCategory;
import com.phonepe.memsight.core.model.MemoryItem;
import com.phonepe.memsight.core.model.MemoryTier;
import com.phonepe.memsight.core.model.PartitionKey;
import com.phonepe.memsight.core.model.SearchFilter;
import com.phonepe.memsight.core.store.MemoryStore;
import com.phonepe.memsight.core.utils.VectorUtils;
import com.phonepe.memsight.storage.ESClient;
import com.phonepe.memsight.storage.IndexSettings;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Memory store backed by an elasticsearch index. The item embedding lives in the same document as a dense vector, so
 * {@link ESVectorIndex} can search it without a separate index to keep in sync.
 */
@Slf4j
public class ESMemoryStore implements MemoryStore {
    private static final String ITEMS_INDEX = "memsight-items";
    private static final int DEFAULT_MAX_SCAN_SIZE = 10_000;
    private static final int DEFAULT_MAX_UPDATE_ATTEMPTS = 5;
    private static final int PARTITION_PAGE_SIZE = 500;
    private static final int VERSION_CONFLICT = 409;

    private final ESClient client;
    private final String indexPrefix;
    private final int maxScanSize;
    private final int maxUpdateAttempts;

    @Builder
    public ESMemoryStore(@NonNull ESClient client,
                         String indexPrefix,
                         IndexSettings indexSettings,
                         int maxScanSize,
                         int maxUpdateAttempts) {
        this.client = client;
        this.indexPrefix = indexPrefix;
        this.maxScanSize = maxScanSize > 0 ? maxScanSize : DEFAULT_MAX_SCAN_SIZE;
        this.maxUpdateAttempts = maxUpdateAttempts > 0 ? maxUpdateAttempts : DEFAULT_MAX_UPDATE_ATTEMPTS;
        ensureIndex(Objects.requireNonNullElse(indexSettings, IndexSettings.DEFAULT));
    }

    @Override
    public MemoryItem insert(@NonNull MemoryItem item) {
        validate(item);
        final var existing = get(item.getId());
        if (existing.isPresent() && !existing.get().getUserId().equals(item.getUserId())) {
            throw new ParameterValidationError("Item %s belongs to another user".formatted(item.getId()));
        }
        try {
            client.getElasticsearchClient()
                    .index(i -> i.index(indexName())
                            .id(item.getId())
                            .document(toDocument(item))
                            .refresh(Refresh.True));
            return item;
        }
        catch (IOException | ElasticsearchException e) {
            throw MemoryStoreException.unavailable(e);
        }
    }

    @Override
    public Optional<MemoryItem> update(@NonNull String id, @NonNull UnaryOperator<MemoryItem> mutation) {
        for (int attempt = 1; attempt <= maxUpdateAttempts; attempt++) {
            try {
                final var current = client.getElasticsearchClient()
                        .get(g -> g.index(indexName()).id(id), ESMemoryDocument.class);
                if (!current.found() || current.source() == null) {
                    return Optional.empty();
                }
                final var existing = toItem(current.source());
                final var updated = Objects.requireNonNull(mutation.apply(existing), "Mutation returned null");
                if (!id.equals(updated.getId()) || !existing.getUserId().equals(updated.getUserId())) {
                    throw new ParameterValidationError("Id and user of item %s can not be changed".formatted(id));
                }
                validate(updated);
                client.getElasticsearchClient()
                        .index(i -> i.index(indexName())
                                .id(id)
                                .document(toDocument(updated))
                                .ifSeqNo(current.seqNo())
                                .ifPrimaryTerm(current.primaryTerm())
                                .refresh(Refresh.True));
                return Optional.of(updated);
            }
            catch (ElasticsearchException e) {
                if (e.status() != VERSION_CONFLICT) {
                    throw MemoryStoreException.unavailable(e);
                }
                log.debug("Item {} changed while updating, attempt {} of {}", id, attempt, maxUpdateAttempts);
            }
            catch (IOException e) {
                throw MemoryStoreException.unavailable(e);
            }
        }
        throw new MemoryStoreException(MemsightError.error(ErrorType.STORE_CONCURRENT_UPDATE, id));
    }

    /**
     * The new item is indexed and the old one deleted in a single bulk request followed by one refresh. Bulk requests
     * are not transactional, so whichever half succeeded is undone when the other half fails.
     */
    @Override
    public MemoryItem replace(@NonNull String oldId, @NonNull MemoryItem item) {
        validate(item);
        if (oldId.equals(item.getId())) {
            return insert(item);
        }
        final var old = get(oldId);
        if (old.isEmpty()) {
            return insert(item);
        }
        final var previous = get(item.getId());
        if (!old.get().getUserId().equals(item.getUserId())
                || previous.filter(existing -> !existing.getUserId().equals(item.getUserId())).isPresent()) {
            throw new ParameterValidationError("Item %s belongs to another user".formatted(oldId));
        }
        final BulkResponse response;
        try {
            response = client.getElasticsearchClient()
                    .bulk(b -> b.refresh(Refresh.True)
                            .operations(op -> op.index(i -> i.index(indexName())
                                    .id(item.getId())
                                    .document(toDocument(item))))
                            .operations(op -> op.delete(d -> d.index(indexName()).id(oldId))));
        }
        catch (IOException | ElasticsearchException e) {
            //The outcome is unknown, put both documents back the way they were
            final var failure = MemoryStoreException.unavailable(e);
            undo(previous.orElse(null), item, old.get(), failure);
            throw failure;
        }
        if (!response.errors()) {
            log.debug("Replaced item {} with {}", oldId, item.getId());
            return item;
        }
        final var indexed = response.items().get(0);
        final var deleted = response.items().get(1);
        final var reason = (indexed.error() != null ? indexed.error() : deleted.error()).reason();
        final var failure = new MemoryStoreException(MemsightError.error(ErrorType.STORE_UNAVAILABLE, reason));
        undo(indexed.error() == null ? previous.orElse(null) : null,
             indexed.error() == null ? item : null,
             deleted.error() == null ? old.get() : null,
             failure);
        throw failure;
    }

    @Override
    public Optional<MemoryItem> delete(@NonNull String id) {
        final var existing = get(id);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        try {
            final var result = client.getElasticsearchClient()
                    .delete(d -> d.index(indexName()).id(id).refresh(Refresh.True))
                    .result();
            log.debug("Result of deleting item {}: {}", id, result);
            return existing;
        }
        catch (IOException | ElasticsearchException e) {
            throw MemoryStoreException.unavailable(e);
        }
    }

    @Override
    public Optional<MemoryItem> get(@NonNull String id) {
        try {
            final var doc = client.getElasticsearchClient()
                    .get(g -> g.index(indexName()).id(id), ESMemoryDocument.class);
            if (doc.found() && doc.source() != null) {
                return Optional.of(toItem(doc.source()));
            }
            return Optional.empty();
        }
        catch (IOException | ElasticsearchException e) {
            throw MemoryStoreException.unavailable(e);
        }
    }

    @Override
    public List<MemoryItem> getAll(@NonNull Collection<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        try {
            return client.getElasticsearchClient()
                    .mget(m -> m.index(indexName()).ids(List.copyOf(ids)), ESMemoryDocument.class)
                    .docs()
                    .stream()
                    .filter(doc -> doc.isResult() && doc.result().found() && doc.result().source() != null)
                    .map(doc -> toItem(doc.result().source()))
                    .toList();
        }
        catch (IOException | ElasticsearchException e) {
            throw MemoryStoreException.unavailable(e);
        }
    }

    @Override
    public List<MemoryItem> scan(@NonNull String userId, Set<MemoryCategory> categories, MemoryTier tier) {
        try {
            final var hits = client.getElasticsearchClient()
                    .search(s -> s.index(indexName())
                                    .query(q -> q.bool(b -> b.filter(filters(userId, categories, tier))))
                                    .size(maxScanSize),
                            ESMemoryDocument.class)
                    .hits()
                    .hits();
            if (hits.size() >= maxScanSize) {
                log.warn("Scan for user {} hit the limit of {} items, results are truncated", userId, maxScanSize);
            }
            return hits.stream()
                    .filter(hit -> null != hit.source())
                    .map(hit -> toItem(hit.source()))
                    .toList();
        }
        catch (IOException | ElasticsearchException e) {
            throw MemoryStoreException.unavailable(e);
        }
    }

    @Override
    public long count(@NonNull String userId, @NonNull MemoryCategory category, MemoryTier tier) {
        try {
            return client.getElasticsearchClient()
                    .count(c -> c.index(indexName())
                            .query(q -> q.bool(b -> b.filter(filters(userId, Set.of(category), tier)))))
                    .count();
        }
        catch (IOException | ElasticsearchException e) {
            throw MemoryStoreException.unavailable(e);
        }
    }

    @Override
    public Set<PartitionKey> partitions() {
        final var partitions = new HashSet<PartitionKey>();
        Map<String, FieldValue> after = null;
        try {
            while (true) {
                final var afterKey = after;
                final var composite = client.getElasticsearchClient()
                        .search(s -> s.index(indexName())
                                        .size(0)
                                        .aggregations("partitions", a -> a.composite(c -> {
                                            c.size(PARTITION_PAGE_SIZE)
                                                    .sources(List.of(
                                                            Map.of(ESMemoryDocument.Fields.userId,
                                                                   termsSource(ESMemoryDocument.Fields.userId)),
                                                            Map.of(ESMemoryDocument.Fields.category,
                                                                   termsSource(ESMemoryDocument.Fields.category))));
                                            if (afterKey != null) {
                                                c.after(afterKey);
                                            }
                                            return c;
                                        })),
                                ESMemoryDocument.class)
                        .aggregations()
                        .get("partitions")
                        .composite();
                final var buckets = composite.buckets().array();
                for (final var bucket : buckets) {
                    partitions.add(new PartitionKey(
                            bucket.key().get(ESMemoryDocument.Fields.userId).stringValue(),
                            MemoryCategory.valueOf(bucket.key().get(ESMemoryDocument.Fields.category).stringValue())));
                }
                if (buckets.size() < PARTITION_PAGE_SIZE || composite.afterKey() == null
                        || composite.afterKey().isEmpty()) {
                    return partitions;
                }
                after = composite.afterKey();
            }
        }
        catch (IOException | ElasticsearchException e) {
            throw MemoryStoreException.unavailable(e);
        }
    }

    /**
     * Roll back a failed replace. A null written item means the new document was not stored, a null removed item
     * means the old document was not deleted.
     */
    private void undo(MemoryItem previous, MemoryItem written, MemoryItem removed, MemoryStoreException failure) {
        try {
            final var elasticsearchClient = client.getElasticsearchClient();
            if (written != null) {
                if (previous == null) {
                    elasticsearchClient.delete(d -> d.index(indexName()).id(written.getId()).refresh(Refresh.True));
                }
                else {
                    elasticsearchClient.index(i -> i.index(indexName())
                            .id(previous.getId())
                            .document(toDocument(previous))
                            .refresh(Refresh.True));
                }
            }
            if (removed != null) {
                elasticsearchClient.index(i -> i.index(indexName())
                        .id(removed.getId())
                        .document(toDocument(removed))
                        .refresh(Refresh.True));
            }
        }
        catch (IOException | ElasticsearchException e) {
            failure.addSuppressed(e);
            log.error("Could not roll back replace of item {}: {}",
                      removed == null ? null : removed.getId(), e.getMessage());
        }
    }

    String indexName() {
        return Strings.isNullOrEmpty(indexPrefix) ? ITEMS_INDEX : "%s.%s".formatted(indexPrefix, ITEMS_INDEX);
    }

    static List<Query> filters(String userId, Set<MemoryCategory> categories, MemoryTier tier) {
        final var filters = new ArrayList<Query>();
        filters.add(Query.of(q -> q.term(t -> t.field(ESMemoryDocument.Fields.userId).value(userId))));
        if (categories != null && !categories.isEmpty()) {
            filters.add(Query.of(q -> q.terms(t -> t.field(ESMemoryDocument.Fields.category)
                    .terms(new TermsQueryField.Builder()
                                   .value(categories.stream()
                                                  .map(category -> FieldValue.of(category.name()))
                                                  .toList())
                                   .build()))));
        }
        if (tier != null) {
            filters.add(Query.of(q -> q.term(t -> t.field(ESMemoryDocument.Fields.tier).value(tier.name()))));
        }
        return filters;
    }

    static List<Query> filters(SearchFilter filter) {
        final var filters = filters(filter.userId(), filter.categories(), null);
        if (filter.createdAfter() != null) {
            final var since = Long.toString(filter.createdAfter().toEpochMilli());
            filters.add(Query.of(q -> q.range(r -> r.date(d -> d.field(ESMemoryDocument.Fields.createdAt)
                    .gte(since)
                    .format("epoch_millis")))));
        }
        return filters;
    }

    private static CompositeAggregationSource termsSource(String field) {
        return CompositeAggregationSource.of(s -> s.terms(t -> t.field(field)));
    }

    private void ensureIndex(IndexSettings indexSettings) {
        final var elasticsearchClient = client.getElasticsearchClient();
        final var indexName = indexName();
        try {
            if (elasticsearchClient.indices().exists(ex -> ex.index(indexName)).value()) {
                log.info("Index {} already exists", indexName);
                return;
            }
            log.info("Creating index {}", indexName);
            final var creationStatus = elasticsearchClient.indices()
                    .create(ex -> ex.index(indexName)
                            .mappings(mapping -> mapping
                                    .properties(ESMemoryDocument.Fields.id, p -> p.keyword(t -> t))
                                    .properties(ESMemoryDocument.Fields.userId, p -> p.keyword(t -> t))
                                    .properties(ESMemoryDocument.Fields.content, p -> p.text(t -> t))
                                    .properties(ESMemoryDocument.Fields.embedding,
                                                p -> p.denseVector(t -> t.dims(indexSettings.getVectorDimensions())
                                                        .elementType("float")
                                                        .similarity("cosine")
                                                        .index(true)
                                                        .indexOptions(i -> i.type("hnsw"))))
                                    .properties(ESMemoryDocument.Fields.category, p -> p.keyword(t -> t))
                                    .properties(ESMemoryDocument.Fields.classificationConfidence,
                                                p -> p.double_(t -> t))
                                    .properties(ESMemoryDocument.Fields.tier, p -> p.keyword(t -> t))
                                    .properties(ESMemoryDocument.Fields.createdAt,
                                                p -> p.date(t -> t.format("epoch_millis")))
                                    .properties(ESMemoryDocument.Fields.lastAccessedAt,
                                                p -> p.date(t -> t.format("epoch_millis")))
                                    .properties(ESMemoryDocument.Fields.accessCount, p -> p.long_(t -> t))
                                    .properties(ESMemoryDocument.Fields.recentAccesses, p -> p.long_(t -> t))
                                    .properties(ESMemoryDocument.Fields.metadata, p -> p.object(t -> t.enabled(false))))
                            .settings(s -> s.numberOfShards(Integer.toString(indexSettings.getShards()))
                                    .numberOfReplicas(Integer.toString(indexSettings.getReplicas()))))
                    .acknowledged();
            log.info("Index creation status for index {}: {}", indexName, creationStatus);
        }
        catch (IOException | ElasticsearchException e) {
            throw MemoryStoreException.unavailable(e);
        }
    }

    private static ESMemoryDocument toDocument(MemoryItem item) {
        return ESMemoryDocument.builder()
                .id(item.getId())
                .userId(item.getUserId())
                .content(item.getContent())
                //elasticsearch rejects zero vectors for cosine similarity
                .embedding(VectorUtils.isZero(item.getEmbedding()) ? null : item.getEmbedding())
                .category(item.getCategory())
                .classificationConfidence(item.getClassificationConfidence())
                .tier(item.getTier())
                .createdAt(toMillis(item.getCreatedAt()))
                .lastAccessedAt(toMillis(item.getLastAccessedAt()))
                .accessCount(item.getAccessCount())
                .recentAccesses(item.getRecentAccesses() == null
                                ? List.of()
                                : item.getRecentAccesses().stream().map(Instant::toEpochMilli).toList())
                .metadata(item.getMetadata())
                .build();
    }

    static MemoryItem toItem(ESMemoryDocument document) {
        final var builder = MemoryItem.builder()
                .id(document.getId())
                .userId(document.getUserId())
                .content(document.getContent())
                .embedding(document.getEmbedding())
                .category(document.getCategory())
                .classificationConfidence(document.getClassificationConfidence())
                .tier(document.getTier())
                .createdAt(toInstant(document.getCreatedAt()))
                .lastAccessedAt(toInstant(document.getLastAccessedAt()))
                .accessCount(document.getAccessCount());
        if (document.getRecentAccesses() != null) {
            document.getRecentAccesses().forEach(millis -> builder.recentAccess(Instant.ofEpochMilli(millis)));
        }
        if (document.getMetadata() != null) {
            builder.metadata(document.getMetadata());
        }
        return builder.build();
    }

    private static Long toMillis(Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }

    private static Instant toInstant(Long millis) {
        return millis == null ? null : Instant.ofEpochMilli(millis);
    }

    private static void validate(MemoryItem item) {
        if (item.getId() == null || item.getUserId() == null || item.getCategory() == null
                || item.getTier() == null) {
            throw new ParameterValidationError("Item must have id, user, category and tier");
        }
    }
}
