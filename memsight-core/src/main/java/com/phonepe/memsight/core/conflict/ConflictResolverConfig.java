package com.phonepe.memsight.core.conflict;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Thresholds used to pick and judge conflict candidates
 */
@Value
@Builder
@Jacksonized
public class ConflictResolverConfig {
    public static final ConflictResolverConfig DEFAULT = ConflictResolverConfig.builder().build();

    /**
     * Minimum embedding cosine similarity for an existing item to be considered
     */
    @Builder.Default
    double candidateSimilarityThreshold = 0.85;

    /**
     * Minimum token overlap for an existing item to be considered. Lets candidates through when embeddings are
     * missing or disagree with the surface text.
     */
    @Builder.Default
    double lexicalCandidateThreshold = 0.5;

    /**
     * Token overlap at or above which a non contradicting pair is merged
     */
    @Builder.Default
    double mergeOverlapThreshold = 0.8;

    /**
     * Overlap of the value free tokens at or above which differing values count as a contradiction
     */
    @Builder.Default
    double contradictionSubjectThreshold = 0.6;

    @Builder.Default
    int maxCandidates = 10;

    /**
     * Ask the configured {@link ConflictJudge} about candidates the rules leave undecided
     */
    @Builder.Default
    boolean modelCheckEnabled = true;

    /**
     * Candidates, most similar first, sent to the judge for one new item
     */
    @Builder.Default
    int maxModelChecks = 3;

    /**
     * Judgements below this confidence are ignored
     */
    @Builder.Default
    double modelCheckMinConfidence = 0.7;

    /**
     * Judged pairs remembered, so repeated content does not hit the model again
     */
    @Builder.Default
    int modelCheckCacheSize = 1000;
}
