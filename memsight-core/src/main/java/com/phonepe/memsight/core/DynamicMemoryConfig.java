package com.phonepe.memsight.core;

import com.phonepe.memsight.core.classifier.InputClassifierConfig;
import com.phonepe.memsight.core.conflict.ConflictResolverConfig;
import com.phonepe.memsight.core.embedding.EmbeddingConfig;
import com.phonepe.memsight.core.errors.ErrorType;
import com.phonepe.memsight.core.errors.MemsightError;
import com.phonepe.memsight.core.errors.MemsightException;
import com.phonepe.memsight.core.retrieval.RetrieverConfig;
import com.phonepe.memsight.core.tier.TierConfig;
import com.phonepe.memsight.core.utils.JsonUtils;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * All engine settings. Every section falls back to its defaults when absent.
 */
@Value
@Builder
@Jacksonized
public class DynamicMemoryConfig {
    public static final DynamicMemoryConfig DEFAULT = DynamicMemoryConfig.builder().build();

    @Builder.Default
    InputClassifierConfig classifier = InputClassifierConfig.DEFAULT;

    @Builder.Default
    ConflictResolverConfig conflicts = ConflictResolverConfig.DEFAULT;

    @Builder.Default
    TierConfig tiers = TierConfig.DEFAULT;

    @Builder.Default
    RetrieverConfig retriever = RetrieverConfig.DEFAULT;

    @Builder.Default
    EmbeddingConfig embedding = EmbeddingConfig.DEFAULT;

    /**
     * Delay between background maintenance runs (tier sweep and embedding backfill)
     */
    @Builder.Default
    Duration maintenanceInterval = Duration.ofMinutes(5);

    /**
     * Read settings from a JSON file
     */
    public static DynamicMemoryConfig load(Path path) {
        try {
            return JsonUtils.createMapper().readValue(path.toFile(), DynamicMemoryConfig.class);
        }
        catch (IOException e) {
            throw new MemsightException(MemsightError.error(ErrorType.CONFIG_LOAD_FAILURE, path, e.getMessage()), e);
        }
    }
}
