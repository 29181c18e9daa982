package com.phonepe.memsight.models;

import com.phonepe.memsight.core.classifier.ModelClassifier;
import com.phonepe.memsight.core.model.MemoryCategory;
import com.phonepe.memsight.core.model.QueryIntent;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Asks a chat model to pick a category or intent when the keyword rules are not confident. The model is asked for a
 * JSON object with the label and a confidence. Labels outside the known enums are discarded.
 */
@Slf4j
public class OpenAICompatibleModelClassifier implements ModelClassifier {
    private static final String CATEGORY_PROMPT = """
            You classify short notes captured by a personal memory assistant.
            Pick exactly one category from: %s.
            Respond only with a JSON object: {"label": "<CATEGORY>", "confidence": <number between 0 and 1>}
            """;
    private static final String INTENT_PROMPT = """
            You classify questions a user asks their personal memory assistant.
            Pick exactly one intent from: %s.
            Respond only with a JSON object: {"label": "<INTENT>", "confidence": <number between 0 and 1>}
            """;

    private record Label(String label, double confidence) {
    }

    private final OpenAICompatibleClient client;

    public OpenAICompatibleModelClassifier(@NonNull OpenAICompatibleClient client) {
        this.client = client;
    }

    @Override
    public Optional<CategoryPrediction> classify(String text) {
        return ask(CATEGORY_PROMPT.formatted(names(MemoryCategory.values())), text)
                .flatMap(label -> parse(MemoryCategory.class, label.label())
                        .map(category -> new CategoryPrediction(category, label.confidence())));
    }

    @Override
    public Optional<IntentPrediction> classifyIntent(String query) {
        return ask(INTENT_PROMPT.formatted(names(QueryIntent.values())), query)
                .flatMap(label -> parse(QueryIntent.class, label.label())
                        .map(intent -> new IntentPrediction(intent, label.confidence())));
    }

    private Optional<Label> ask(String systemPrompt, String text) {
        return client.chatJson(systemPrompt, text).flatMap(parsed -> {
            final var label = parsed.path("label").asText("");
            if (label.isEmpty()) {
                return Optional.empty();
            }
            final var confidence = Math.max(0.0, Math.min(1.0, parsed.path("confidence").asDouble(0.5)));
            return Optional.of(new Label(label, confidence));
        });
    }

    private static <E extends Enum<E>> Optional<E> parse(Class<E> type, String label) {
        final var byName = Arrays.stream(type.getEnumConstants())
                .collect(Collectors.toMap(Enum::name, Function.identity()));
        final var value = byName.get(label.trim().toUpperCase(Locale.ROOT).replace(' ', '_'));
        if (value == null) {
            log.debug("Ignoring unknown {} label {}", type.getSimpleName(), label);
        }
        return Optional.ofNullable(value);
    }

    private static String names(Enum<?>[] values) {
        return Arrays.stream(values).map(Enum::name).collect(Collectors.joining(", "));
    }
}
