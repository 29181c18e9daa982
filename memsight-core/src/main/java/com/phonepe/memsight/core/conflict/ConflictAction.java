package com.phonepe.memsight.core.conflict;

import lombok.Value;

/**
 * What to do with a new item given the existing ones it resembles
 */
@Value
public class ConflictAction {
    public enum Type {
        INSERT_NEW,
        MERGE_INTO,
        SUPERSEDE,
    }

    Type type;
    /**
     * Target of a merge or supersede, null for insert
     */
    String existingId;
    double confidence;
    String reason;

    public static ConflictAction insertNew(String reason) {
        return new ConflictAction(Type.INSERT_NEW, null, 1.0, reason);
    }

    public static ConflictAction mergeInto(String existingId, double confidence, String reason) {
        return new ConflictAction(Type.MERGE_INTO, existingId, confidence, reason);
    }

    public static ConflictAction supersede(String existingId, double confidence, String reason) {
        return new ConflictAction(Type.SUPERSEDE, existingId, confidence, reason);
    }
}
