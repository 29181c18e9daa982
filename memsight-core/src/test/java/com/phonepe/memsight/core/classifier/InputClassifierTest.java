package com.phonepe.memsight.core.classifier;

import com.phonepe.memsight.core.model.MemoryCategory;
import com.phonepe.memsight.core.model.QueryIntent;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link InputClassifier}
 */
class InputClassifierTest {

    private final InputClassifier classifier = new InputClassifier();

    @Test
    void testRuleCategories() {
        final var task = classifier.classify("Remember to deploy the staging build Friday");
        assertEquals(MemoryCategory.TASK, task.getCategory());
        assertEquals(ClassificationSource.RULES, task.getSource());
        assertEquals(0.6, task.getConfidence(), 1e-9);
        assertEquals("medium", task.getAttributes().get("priority"));

        assertEquals(MemoryCategory.GREETING, classifier.classify("Hello there").getCategory());
        assertEquals(MemoryCategory.FACT, classifier.classify("meeting moved to 3pm").getCategory());
        assertEquals(MemoryCategory.TASK, classifier.classify("别忘了提交报告").getCategory());
    }

    @Test
    void testAttributes() {
        final var code = classifier.classify("def add(a, b):\n    return a + b");
        assertEquals(MemoryCategory.CODE, code.getCategory());
        assertEquals("python", code.getAttributes().get("language"));

        final var reference = classifier.classify("Check out https://example.com/docs for the API reference");
        assertEquals(MemoryCategory.REFERENCE, reference.getCategory());
        assertEquals(0.7, reference.getConfidence(), 1e-9);
        assertEquals(List.of("https://example.com/docs"), reference.getAttributes().get("urls"));

        final var urgent = classifier.classify("Remember to renew passport, urgent");
        assertEquals("high", urgent.getAttributes().get("priority"));

        final var recurring = classifier.classify("Remember to water the plants every day");
        assertEquals(Set.of("recurring"), recurring.getSubcategories());

        final var question = classifier.classify("Why is the sky blue?");
        assertEquals(MemoryCategory.QUESTION, question.getCategory());
        assertTrue(question.getSubcategories().contains("explanatory"));
    }

    @Test
    void testTiesGoToEarlierCategory() {
        //One CODE and one TASK pattern match, CODE is declared first
        assertEquals(MemoryCategory.CODE, classifier.classify("TODO: return early").getCategory());
    }

    @Test
    void testFallback() {
        final var blank = classifier.classify("   ");
        assertEquals(MemoryCategory.GENERAL, blank.getCategory());
        assertEquals(ClassificationSource.FALLBACK, blank.getSource());
        assertEquals(0.3, blank.getConfidence(), 1e-9);
        assertEquals(MemoryCategory.GENERAL, classifier.classify("zebra quantum velvet").getCategory());
        assertEquals(MemoryCategory.GENERAL, classifier.classify(null).getCategory());
    }

    @Test
    void testDeterministicAndCached() {
        final var text = "Remember to deploy the staging build Friday";
        final var first = classifier.classify(text);
        final var second = classifier.classify(text);
        assertEquals(first, second);
        assertEquals(1, classifier.cachedEntries());
        assertEquals(2L, classifier.categoryCounts().get(MemoryCategory.TASK));
    }

    @Test
    void testModelConsultedOnlyWithoutRuleMatch() {
        final var model = mock(ModelClassifier.class);
        when(model.classify(anyString()))
                .thenReturn(Optional.of(new ModelClassifier.CategoryPrediction(MemoryCategory.CONCEPT, 0.8)));
        final var withModel = InputClassifier.builder().modelClassifier(model).build();

        final var ruled = withModel.classify("Remember to deploy the staging build Friday");
        assertEquals(ClassificationSource.RULES, ruled.getSource());
        verify(model, never()).classify(anyString());

        final var modelled = withModel.classify("zebra quantum velvet");
        assertEquals(MemoryCategory.CONCEPT, modelled.getCategory());
        assertEquals(ClassificationSource.MODEL, modelled.getSource());
        assertEquals(0.8, modelled.getConfidence(), 1e-9);
        //Model answers are not cached
        assertEquals(1, withModel.cachedEntries());
        withModel.classify("zebra quantum velvet");
        verify(model, times(2)).classify("zebra quantum velvet");
    }

    @Test
    void testModelFailureFallsBack() {
        final var model = mock(ModelClassifier.class);
        when(model.classify(anyString())).thenThrow(new IllegalStateException("model down"));
        final var withModel = InputClassifier.builder().modelClassifier(model).build();
        final var result = withModel.classify("zebra quantum velvet");
        assertEquals(MemoryCategory.GENERAL, result.getCategory());
        assertEquals(ClassificationSource.FALLBACK, result.getSource());
    }

    @Test
    void testIntents() {
        final var tasks = classifier.classifyIntent("what do I need to do Friday");
        assertEquals(QueryIntent.GET_TASKS, tasks.getIntent());
        assertEquals(EnumSet.of(MemoryCategory.TASK), tasks.getTargetCategories());

        final var code = classifier.classifyIntent("show me the code for parsing dates");
        assertEquals(QueryIntent.LOCATE_CODE, code.getIntent());
        assertEquals(0.7, code.getConfidence(), 1e-9);
        assertEquals(EnumSet.of(MemoryCategory.CODE), code.getTargetCategories());

        assertEquals(QueryIntent.FIND_PROCEDURE, classifier.classifyIntent("how do I reset the router").getIntent());
        assertEquals(QueryIntent.SEARCH_CONVERSATION,
                     classifier.classifyIntent("what did we talk about earlier").getIntent());
        assertEquals(EnumSet.of(MemoryCategory.FACT,
                                MemoryCategory.CONCEPT,
                                MemoryCategory.REFERENCE,
                                MemoryCategory.PERSONAL),
                     classifier.classifyIntent("what is a monad").getTargetCategories());

        final var general = classifier.classifyIntent("zebra quantum velvet");
        assertEquals(QueryIntent.GENERAL_SEARCH, general.getIntent());
        assertEquals(ClassificationSource.FALLBACK, general.getSource());
        assertEquals(EnumSet.allOf(MemoryCategory.class), general.getTargetCategories());
        assertEquals(1L, classifier.intentCounts().get(QueryIntent.GET_TASKS));
    }

    @Test
    void testModelIntent() {
        final var model = mock(ModelClassifier.class);
        when(model.classifyIntent(anyString()))
                .thenReturn(Optional.of(new ModelClassifier.IntentPrediction(QueryIntent.FIND_DOCUMENT, 0.75)));
        final var withModel = InputClassifier.builder().modelClassifier(model).build();
        final var result = withModel.classifyIntent("zebra quantum velvet");
        assertEquals(QueryIntent.FIND_DOCUMENT, result.getIntent());
        assertEquals(ClassificationSource.MODEL, result.getSource());
        assertTrue(result.getTargetCategories().contains(MemoryCategory.DOCUMENT));
    }
}
