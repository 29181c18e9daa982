package com.phonepe.memsight.storage;

import lombok.Builder;
import lombok.Value;

/**
 * Settings for index
 */
@Value
@Builder
public class IndexSettings {
    public static final int DEFAULT_SHARDS = 1;
    public static final int DEFAULT_REPLICAS = 0;
    public static final int DEFAULT_VECTOR_DIMENSIONS = 384;
    public static final IndexSettings DEFAULT = IndexSettings.builder().build();

    @Builder.Default
    int shards = DEFAULT_SHARDS;

    @Builder.Default
    int replicas = DEFAULT_REPLICAS;

    /**
     * Must match the output size of the embedding model in use
     */
    @Builder.Default
    int vectorDimensions = DEFAULT_VECTOR_DIMENSIONS;
}
