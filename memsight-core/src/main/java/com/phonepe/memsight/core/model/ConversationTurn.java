package com.phonepe.memsight.core.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * One message of a conversation with a user
 */
@Value
@Builder
@Jacksonized
public class ConversationTurn {
    public enum Role {
        USER,
        ASSISTANT,
        SYSTEM,
    }

    Role role;

    String content;

    Instant timestamp;

    @Singular("metadataEntry")
    Map<String, Object> metadata;
}
