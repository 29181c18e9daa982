package com.phonepe.memsight.core.tier;

import com.phonepe.memsight.core.model.MemoryTier;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.OptionalInt;

/**
 * Promotion thresholds, per partition capacities and idle expiry for the memory tiers
 */
@Value
@Builder
@Jacksonized
public class TierConfig {
    public static final TierConfig DEFAULT = TierConfig.builder().build();

    /**
     * Accesses older than this do not count towards promotion
     */
    @Builder.Default
    Duration promotionWindow = Duration.ofHours(24);

    /**
     * WORKING items are promoted once accessed more than this many times inside the window
     */
    @Builder.Default
    int workingPromotionThreshold = 2;

    /**
     * SHORT_TERM items are promoted once accessed more than this many times inside the window
     */
    @Builder.Default
    int shortTermPromotionThreshold = 5;

    /**
     * Capacities are per (user, category). Zero or less means unbounded.
     */
    @Builder.Default
    int workingCapacity = 100;

    @Builder.Default
    int shortTermCapacity = 1000;

    @Builder.Default
    int longTermCapacity = 0;

    /**
     * Idle age after which WORKING items are dropped by the sweep. Null disables expiry.
     */
    Duration workingMaxIdle;

    /**
     * Idle age after which SHORT_TERM items are dropped by the sweep. Null disables expiry.
     */
    Duration shortTermMaxIdle;

    public OptionalInt promotionThreshold(MemoryTier tier) {
        return switch (tier) {
            case WORKING -> OptionalInt.of(workingPromotionThreshold);
            case SHORT_TERM -> OptionalInt.of(shortTermPromotionThreshold);
            case LONG_TERM -> OptionalInt.empty();
        };
    }

    public int capacity(MemoryTier tier) {
        return switch (tier) {
            case WORKING -> workingCapacity;
            case SHORT_TERM -> shortTermCapacity;
            case LONG_TERM -> longTermCapacity;
        };
    }

    /**
     * Long term items never expire
     */
    public Duration maxIdle(MemoryTier tier) {
        return switch (tier) {
            case WORKING -> workingMaxIdle;
            case SHORT_TERM -> shortTermMaxIdle;
            case LONG_TERM -> null;
        };
    }
}
