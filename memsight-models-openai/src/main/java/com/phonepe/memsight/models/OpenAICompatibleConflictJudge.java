package com.phonepe.memsight.models;

import com.phonepe.memsight.core.conflict.ConflictJudge;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Asks a chat model how a new note relates to one already stored. The model answers with a JSON object holding the
 * relation and a confidence; unknown relations are discarded.
 */
@Slf4j
public class OpenAICompatibleConflictJudge implements ConflictJudge {
    private static final String PROMPT = """
            You compare two notes kept by a personal memory assistant. The user message holds the NEW note and the \
            STORED note.
            Pick exactly one relation of NEW to STORED from: %s.
            DUPLICATE: the same text. EQUIVALENT: the same meaning in other words. CONTRADICTORY: NEW negates STORED \
            or changes one of its values. COMPLEMENTARY: NEW adds detail to STORED. UNRELATED: anything else.
            Respond only with a JSON object: {"relation": "<RELATION>", "confidence": <number between 0 and 1>}
            """;

    private final OpenAICompatibleClient client;

    public OpenAICompatibleConflictJudge(@NonNull OpenAICompatibleClient client) {
        this.client = client;
    }

    @Override
    public Optional<Judgement> judge(String incoming, String existing) {
        final var prompt = PROMPT.formatted(Arrays.stream(Relation.values())
                                                    .map(Enum::name)
                                                    .collect(Collectors.joining(", ")));
        return client.chatJson(prompt, "NEW: %s\nSTORED: %s".formatted(incoming, existing))
                .flatMap(parsed -> {
                    final var label = parsed.path("relation").asText("").trim().toUpperCase(Locale.ROOT);
                    final var relation = Arrays.stream(Relation.values())
                            .filter(value -> value.name().equals(label))
                            .findFirst();
                    if (relation.isEmpty()) {
                        log.debug("Ignoring unknown relation {}", label);
                        return Optional.empty();
                    }
                    final var confidence = Math.max(0.0, Math.min(1.0, parsed.path("confidence").asDouble(0.5)));
                    return Optional.of(new Judgement(relation.get(), confidence));
                });
    }
}
