package com.phonepe.memsight.core.classifier;

import com.phonepe.memsight.core.model.MemoryCategory;
import com.phonepe.memsight.core.model.QueryIntent;

import java.util.Optional;

/**
 * A language model used as the last resort when no lexical rule is confident enough. Implementations may block on
 * network I/O. Returning empty leaves the rule based result in place.
 */
public interface ModelClassifier {

    record CategoryPrediction(MemoryCategory category, double confidence) {
    }

    record IntentPrediction(QueryIntent intent, double confidence) {
    }

    Optional<CategoryPrediction> classify(String text);

    default Optional<IntentPrediction> classifyIntent(String query) {
        return Optional.empty();
    }
}
