package com.phonepe.memsight.core.tier;

import lombok.Value;

/**
 * Outcome of one maintenance sweep
 */
@Value
public class TickResult {
    public static final TickResult EMPTY = new TickResult(0, 0, 0);

    int partitionsVisited;
    int expired;
    int evicted;
}
