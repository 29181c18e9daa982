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

package com.phonepe.memsight.core.conflict;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.phonepe.memsight.core.model.MemoryItem;
import com.phonepe.memsight.core.utils.TextUtils;
import com.phonepe.memsight.core.utils.VectorUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether a new item duplicates, refines or contradicts items already stored in its partition.
 * <p>
 * Checked per candidate, most similar first: identical normalized content merges; same subject with a different
 * time, date, number or polarity supersedes; high token overlap merges. When no rule applies and a
 * {@link ConflictJudge} is configured, the most similar candidates are put to it. Anything still undecided is
 * inserted as a new item.
 */
@Slf4j
public class ConflictResolver {

    /**
     * An existing item close enough to the new one to be judged
     */
    public record Candidate(MemoryItem item, double similarity) {
    }

    private record JudgedPair(String incoming, String existing) {
    }

    private final ConflictResolverConfig config;
    private final ConflictJudge judge;
    private final Cache<JudgedPair, Optional<ConflictJudge.Judgement>> judgements;

    public ConflictResolver() {
        this(null, null);
    }

    public ConflictResolver(ConflictResolverConfig config) {
        this(config, null);
    }

    public ConflictResolver(ConflictResolverConfig config, ConflictJudge judge) {
        this.config = Objects.requireNonNullElse(config, ConflictResolverConfig.DEFAULT);
        this.judge = judge;
        this.judgements = CacheBuilder.newBuilder()
                .maximumSize(Math.max(this.config.getModelCheckCacheSize(), 1))
                .build();
    }

    /**
     * Pick the items of the new item's partition that are worth judging, most similar first
     */
    public List<Candidate> findCandidates(MemoryItem newItem, Collection<MemoryItem> partitionItems) {
        final var newTokens = TextUtils.contentTokens(newItem.getContent());
        final var candidates = new ArrayList<Candidate>();
        for (final var existing : partitionItems) {
            if (existing.getId().equals(newItem.getId())
                    || !existing.getUserId().equals(newItem.getUserId())
                    || existing.getCategory() != newItem.getCategory()) {
                continue;
            }
            final var lexical = TextUtils.overlap(newTokens, TextUtils.contentTokens(existing.getContent()));
            final var semantic = newItem.hasEmbedding() && existing.hasEmbedding()
                                 ? VectorUtils.cosineSimilarity(newItem.getEmbedding(), existing.getEmbedding())
                                 : 0.0;
            if (semantic >= config.getCandidateSimilarityThreshold()
                    || lexical >= config.getLexicalCandidateThreshold()) {
                candidates.add(new Candidate(existing, Math.max(semantic, lexical)));
            }
        }
        return candidates.stream()
                .sorted(Comparator.comparingDouble(Candidate::similarity).reversed())
                .limit(config.getMaxCandidates())
                .toList();
    }

    public ConflictAction resolve(MemoryItem newItem, List<Candidate> candidates) {
        if (candidates.isEmpty()) {
            return ConflictAction.insertNew("no similar items");
        }
        final var incoming = FactSignature.of(newItem.getContent());
        final var incomingHash = TextUtils.contentHash(newItem.getContent());
        for (final var candidate : candidates) {
            final var existing = candidate.item();
            if (incomingHash.equals(TextUtils.contentHash(existing.getContent()))) {
                return ConflictAction.mergeInto(existing.getId(), 1.0, "duplicate content");
            }
            final var stored = FactSignature.of(existing.getContent());
            final var subjectOverlap = TextUtils.overlap(incoming.subject(), stored.subject());
            if (subjectOverlap >= config.getContradictionSubjectThreshold()) {
                if (incoming.valuesDiffer(stored)) {
                    return ConflictAction.supersede(existing.getId(), subjectOverlap, "same subject, different value");
                }
                if (incoming.negated() != stored.negated()) {
                    return ConflictAction.supersede(existing.getId(), subjectOverlap, "same subject, opposite polarity");
                }
            }
            final var tokenOverlap = TextUtils.overlap(incoming.tokens(), stored.tokens());
            if (tokenOverlap >= config.getMergeOverlapThreshold()) {
                return ConflictAction.mergeInto(existing.getId(), tokenOverlap, "overlapping content");
            }
        }
        return judged(newItem, candidates).orElseGet(() -> ConflictAction.insertNew("no confident conflict"));
    }

    private Optional<ConflictAction> judged(MemoryItem newItem, List<Candidate> candidates) {
        if (judge == null || !config.isModelCheckEnabled()) {
            return Optional.empty();
        }
        for (final var candidate : candidates.stream().limit(config.getMaxModelChecks()).toList()) {
            final var existing = candidate.item();
            final var judgement = judge(newItem.getContent(), existing.getContent())
                    .filter(found -> found.relation() != null
                            && found.relation() != ConflictJudge.Relation.UNRELATED
                            && found.confidence() >= config.getModelCheckMinConfidence());
            if (judgement.isEmpty()) {
                continue;
            }
            final var relation = judgement.get().relation();
            final var confidence = judgement.get().confidence();
            final var reason = "model judged %s".formatted(relation.name().toLowerCase(Locale.ROOT));
            return Optional.of(relation == ConflictJudge.Relation.CONTRADICTORY
                               ? ConflictAction.supersede(existing.getId(), confidence, reason)
                               : ConflictAction.mergeInto(existing.getId(), confidence, reason));
        }
        return Optional.empty();
    }

    /**
     * Failures are not remembered, the pair is asked about again next time
     */
    private Optional<ConflictJudge.Judgement> judge(String incoming, String existing) {
        final var key = new JudgedPair(incoming, existing);
        final var cached = judgements.getIfPresent(key);
        if (cached != null) {
            return cached;
        }
        try {
            final var judgement = Objects.requireNonNullElse(judge.judge(incoming, existing),
                                                             Optional.<ConflictJudge.Judgement>empty());
            judgements.put(key, judgement);
            return judgement;
        }
        catch (Exception e) {
            log.warn("Model conflict check failed, keeping items apart: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Fold the new item into the existing one. The result keeps the existing id and its content contains both texts.
     * When text is appended the embedding is dropped, it no longer describes the content and is recomputed later.
     */
    public MemoryItem merge(MemoryItem existing, MemoryItem incoming) {
        final var existingContent = existing.getContent();
        final var incomingContent = incoming.getContent();
        final var unchanged = existingContent.contains(incomingContent);
        final var content = unchanged ? existingContent : existingContent + "\n" + incomingContent;
        final var metadata = new LinkedHashMap<String, Object>();
        if (incoming.getMetadata() != null) {
            metadata.putAll(incoming.getMetadata());
        }
        if (existing.getMetadata() != null) {
            metadata.putAll(existing.getMetadata());
        }
        final var mergedFrom = new ArrayList<Object>();
        if (metadata.get(MemoryItem.META_MERGED_FROM) instanceof Collection<?> previous) {
            mergedFrom.addAll(previous);
        }
        mergedFrom.add(incoming.getId());
        metadata.put(MemoryItem.META_MERGED_FROM, List.copyOf(mergedFrom));
        metadata.put(MemoryItem.META_CONTENT_HASH, TextUtils.contentHash(content));
        log.info("Merging item {} into {}", incoming.getId(), existing.getId());
        return existing.toBuilder()
                .content(content)
                .embedding(unchanged ? mergedEmbedding(existing, incoming) : null)
                .classificationConfidence(Math.max(existing.getClassificationConfidence(),
                                                   incoming.getClassificationConfidence()))
                .clearMetadata()
                .metadata(metadata)
                .build();
    }

    private static float[] mergedEmbedding(MemoryItem existing, MemoryItem incoming) {
        if (existing.hasEmbedding()) {
            return existing.getEmbedding();
        }
        return existing.getContent().equals(incoming.getContent()) ? incoming.getEmbedding() : null;
    }

    /**
     * The new item, annotated with what it replaces
     */
    public MemoryItem supersede(MemoryItem existing, MemoryItem incoming) {
        log.info("Item {} supersedes {}", incoming.getId(), existing.getId());
        return incoming.toBuilder()
                .metadataEntry(MemoryItem.META_SUPERSEDES, existing.getId())
                .metadataEntry(MemoryItem.META_SUPERSEDED_CONTENT, existing.getContent())
                .build();
    }
}
