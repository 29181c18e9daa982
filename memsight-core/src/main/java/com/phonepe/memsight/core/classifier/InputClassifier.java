/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.memsight.core.classifier;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.phonepe.memsight.core.model.MemoryCategory;
import com.phonepe.memsight.core.model.QueryIntent;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.regex.Pattern;

/**
 * Assigns a category to content and an intent to queries.
 * <p>
 * Layers, in order: lexical rules scored by the number of matching patterns, then the optional
 * {@link ModelClassifier} when no rule is confident enough, then the GENERAL / GENERAL_SEARCH fallback.
 * Ties between rule scores go to the category (or intent) declared first. Rule based results are deterministic and
 * cached; model results are never cached.
 */
@Slf4j
public class InputClassifier {
    private static final Pattern TASK_HIGH_PRIORITY = Pattern.compile(
            "\\b(urgent|important|asap|priority)\\b|(紧急|重要|尽快)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TASK_LOW_PRIORITY = Pattern.compile(
            "\\b(low priority|when possible|eventually)\\b|(有空|不急)", Pattern.CASE_INSENSITIVE);
    private static final Map<String, Pattern> CODE_LANGUAGES = Map.of(
            "python", Pattern.compile("\\bdef |\\bimport |\\bprint\\(|if __name__"),
            "javascript", Pattern.compile("\\b(const|let|var|function) |=> |\\basync |\\bawait "),
            "java", Pattern.compile("\\b(public|private|protected) |\\bvoid |\\bString "),
            "sql", Pattern.compile("\\b(SELECT|INSERT|UPDATE|DELETE)\\b.*\\b(FROM|INTO|SET|WHERE)\\b"));
    private static final List<String> CODE_LANGUAGE_ORDER = List.of("python", "java", "javascript", "sql");
    private static final Pattern URL = Pattern.compile("https?://[^\\s<>\"]+");
    private static final Pattern EXPLANATORY = Pattern.compile("\\b(why|because|reason)\\b|为什么", Pattern.CASE_INSENSITIVE);
    private static final Pattern PROCEDURAL = Pattern.compile("\\b(how to|how do)\\b|(怎么|如何)", Pattern.CASE_INSENSITIVE);
    private static final Pattern DEFINITIONAL = Pattern.compile("\\b(what is|define|explain)\\b|(是什么|定义)",
                                                                Pattern.CASE_INSENSITIVE);
    private static final Pattern RECURRING = Pattern.compile("\\b(recurring|daily|weekly|monthly|every)\\b|(每天|每周|每月)",
                                                             Pattern.CASE_INSENSITIVE);
    private static final Pattern ONE_TIME = Pattern.compile("\\b(one-time|just this|single)\\b|(一次)",
                                                            Pattern.CASE_INSENSITIVE);

    private final ClassificationRules rules;
    private final ModelClassifier modelClassifier;
    private final InputClassifierConfig config;
    private final Cache<String, ClassificationResult> cache;
    private final Map<MemoryCategory, LongAdder> categoryCounts = new ConcurrentHashMap<>();
    private final Map<QueryIntent, LongAdder> intentCounts = new ConcurrentHashMap<>();

    public InputClassifier() {
        this(null, null, null);
    }

    @Builder
    public InputClassifier(ClassificationRules rules, ModelClassifier modelClassifier, InputClassifierConfig config) {
        this.rules = Objects.requireNonNullElseGet(rules, ClassificationRules::defaults);
        this.modelClassifier = modelClassifier;
        this.config = Objects.requireNonNullElse(config, InputClassifierConfig.DEFAULT);
        this.cache = CacheBuilder.newBuilder()
                .maximumSize(Math.max(this.config.getCacheSize(), 1))
                .build();
    }

    /**
     * Classify stored content. Never throws, blank input gives GENERAL with the fallback confidence.
     */
    public ClassificationResult classify(String text) {
        final var result = doClassify(text);
        categoryCounts.computeIfAbsent(result.getCategory(), c -> new LongAdder()).increment();
        return result;
    }

    /**
     * Classify a retrieval query and resolve the categories it routes to
     */
    public QueryClassification classifyIntent(String query) {
        final var result = doClassifyIntent(query);
        intentCounts.computeIfAbsent(result.getIntent(), i -> new LongAdder()).increment();
        return result;
    }

    public Map<MemoryCategory, Long> categoryCounts() {
        return snapshot(categoryCounts, MemoryCategory.class);
    }

    public Map<QueryIntent, Long> intentCounts() {
        return snapshot(intentCounts, QueryIntent.class);
    }

    @VisibleForTesting
    long cachedEntries() {
        return cache.size();
    }

    private ClassificationResult doClassify(String text) {
        if (StringUtils.isBlank(text)) {
            return fallback();
        }
        final var key = text.strip();
        final var cached = cache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }
        var bestCategory = MemoryCategory.GENERAL;
        var bestScore = 0;
        for (final var category : MemoryCategory.values()) {
            final var score = score(rules.patterns(category), key);
            //Strictly greater keeps the earlier declared category on ties
            if (score > bestScore) {
                bestScore = score;
                bestCategory = category;
            }
        }
        final var ruleConfidence = ruleConfidence(bestScore);
        if (ruleConfidence < config.getModelFallbackThreshold() && modelClassifier != null) {
            final var modelResult = askModel(key);
            if (modelResult.isPresent()) {
                final var prediction = modelResult.get();
                return enrich(key, prediction.category(), ClassificationResult.builder()
                        .category(prediction.category())
                        .confidence(prediction.confidence())
                        .source(ClassificationSource.MODEL))
                        .build();
            }
            //Model was consulted but gave nothing. Do not cache so it gets another chance next time.
            return bestScore == 0 ? fallback() : ruleResult(key, bestCategory, ruleConfidence);
        }
        final var result = bestScore == 0 ? fallback() : ruleResult(key, bestCategory, ruleConfidence);
        cache.put(key, result);
        return result;
    }

    private QueryClassification doClassifyIntent(String query) {
        if (StringUtils.isBlank(query)) {
            return intentFallback();
        }
        final var text = query.strip();
        var bestIntent = QueryIntent.GENERAL_SEARCH;
        var bestScore = 0;
        for (final var intent : QueryIntent.values()) {
            final var score = score(rules.patterns(intent), text);
            if (score > bestScore) {
                bestScore = score;
                bestIntent = intent;
            }
        }
        final var ruleConfidence = ruleConfidence(bestScore);
        if (ruleConfidence < config.getModelFallbackThreshold() && modelClassifier != null) {
            final var prediction = askModelForIntent(text);
            if (prediction.isPresent()) {
                return QueryClassification.builder()
                        .intent(prediction.get().intent())
                        .confidence(prediction.get().confidence())
                        .source(ClassificationSource.MODEL)
                        .targetCategories(rules.route(prediction.get().intent()))
                        .build();
            }
        }
        if (bestScore == 0) {
            return intentFallback();
        }
        return QueryClassification.builder()
                .intent(bestIntent)
                .confidence(ruleConfidence)
                .source(ClassificationSource.RULES)
                .targetCategories(rules.route(bestIntent))
                .build();
    }

    private Optional<ModelClassifier.CategoryPrediction> askModel(String text) {
        try {
            return modelClassifier.classify(text)
                    .filter(prediction -> prediction.category() != null);
        }
        catch (Exception e) {
            log.warn("Model classification failed, keeping rule based result: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<ModelClassifier.IntentPrediction> askModelForIntent(String query) {
        try {
            return modelClassifier.classifyIntent(query)
                    .filter(prediction -> prediction.intent() != null);
        }
        catch (Exception e) {
            log.warn("Model intent classification failed, keeping rule based result: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private ClassificationResult ruleResult(String text, MemoryCategory category, double confidence) {
        return enrich(text, category, ClassificationResult.builder()
                .category(category)
                .confidence(confidence)
                .source(ClassificationSource.RULES))
                .build();
    }

    private ClassificationResult fallback() {
        return ClassificationResult.builder()
                .category(MemoryCategory.GENERAL)
                .confidence(config.getFallbackConfidence())
                .source(ClassificationSource.FALLBACK)
                .build();
    }

    private QueryClassification intentFallback() {
        return QueryClassification.builder()
                .intent(QueryIntent.GENERAL_SEARCH)
                .confidence(config.getFallbackConfidence())
                .source(ClassificationSource.FALLBACK)
                .targetCategories(rules.route(QueryIntent.GENERAL_SEARCH))
                .build();
    }

    /**
     * Category specific attributes and subcategories
     */
    private static ClassificationResult.ClassificationResultBuilder enrich(
            String text,
            MemoryCategory category,
            ClassificationResult.ClassificationResultBuilder builder) {
        switch (category) {
            case TASK -> {
                if (TASK_HIGH_PRIORITY.matcher(text).find()) {
                    builder.attribute("priority", "high");
                }
                else if (TASK_LOW_PRIORITY.matcher(text).find()) {
                    builder.attribute("priority", "low");
                }
                else {
                    builder.attribute("priority", "medium");
                }
                if (RECURRING.matcher(text).find()) {
                    builder.subcategory("recurring");
                }
                else if (ONE_TIME.matcher(text).find()) {
                    builder.subcategory("one-time");
                }
            }
            case CODE -> CODE_LANGUAGE_ORDER.stream()
                    .filter(language -> CODE_LANGUAGES.get(language).matcher(text).find())
                    .findFirst()
                    .ifPresent(language -> builder.attribute("language", language));
            case REFERENCE -> {
                final var urls = new ArrayList<String>();
                final var matcher = URL.matcher(text);
                while (matcher.find()) {
                    urls.add(matcher.group());
                }
                if (!urls.isEmpty()) {
                    builder.attribute("urls", List.copyOf(urls));
                }
            }
            case QUESTION -> {
                if (EXPLANATORY.matcher(text).find()) {
                    builder.subcategory("explanatory");
                }
                if (PROCEDURAL.matcher(text).find()) {
                    builder.subcategory("procedural");
                }
                if (DEFINITIONAL.matcher(text).find()) {
                    builder.subcategory("definitional");
                }
            }
            default -> {
                //No extra attributes
            }
        }
        return builder;
    }

    private double ruleConfidence(int score) {
        if (score == 0) {
            return 0.0;
        }
        return Math.min(config.getMaxRuleConfidence(),
                        config.getBaseRuleConfidence() + config.getConfidencePerMatch() * score);
    }

    private static int score(List<Pattern> patterns, String text) {
        var score = 0;
        for (final var pattern : patterns) {
            if (pattern.matcher(text).find()) {
                score++;
            }
        }
        return score;
    }

    private static <T extends Enum<T>> Map<T, Long> snapshot(Map<T, LongAdder> counts, Class<T> type) {
        final var result = new EnumMap<T, Long>(type);
        counts.forEach((key, value) -> result.put(key, value.sum()));
        return result;
    }
}
