package com.phonepe.memsight.core;

import com.phonepe.memsight.core.errors.MemoryStoreException;
import com.phonepe.memsight.core.errors.ParameterValidationError;
import com.phonepe.memsight.core.model.ConversationTurn;
import com.phonepe.memsight.core.model.MemoryCategory;
import com.phonepe.memsight.core.model.MemoryItem;
import com.phonepe.memsight.core.model.MemoryTier;
import com.phonepe.memsight.core.retrieval.ContextFormatter;
import com.phonepe.memsight.core.retrieval.RetrieverConfig;
import com.phonepe.memsight.core.store.InMemoryMemoryStore;
import com.phonepe.memsight.core.store.MemoryStore;
import com.phonepe.memsight.core.tier.TierConfig;
import com.phonepe.memsight.core.utils.HashingEmbeddingModel;
import com.phonepe.memsight.core.utils.MutableClock;
import com.phonepe.memsight.core.utils.TestUtils;
import com.phonepe.memsight.core.utils.TextUtils;
import com.phonepe.memsight.embedding.EmbeddingModel;
import lombok.SneakyThrows;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DynamicMemoryManager}
 */
class DynamicMemoryManagerTest {
    private final InMemoryMemoryStore store = new InMemoryMemoryStore();
    private final MutableClock clock = new MutableClock(TestUtils.EPOCH);
    private DynamicMemoryManager manager;

    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.close();
        }
    }

    @Test
    void testTaskIsFoundByTaskQuery() {
        manager = manager(new HashingEmbeddingModel(), DynamicMemoryConfig.DEFAULT);
        final var id = manager.add("Remember to deploy the staging build Friday", "u1", Map.of("app", "notes"));
        manager.add("Friday standup moved to 10am", "u1");

        final var stored = store.get(id).orElseThrow();
        assertEquals(MemoryCategory.TASK, stored.getCategory());
        assertEquals(MemoryTier.WORKING, stored.getTier());
        assertTrue(stored.hasEmbedding());
        assertEquals("notes", stored.getMetadata().get("app"));
        assertEquals("medium", stored.getMetadata().get("priority"));
        assertEquals("rules", stored.getMetadata().get(MemoryItem.META_CLASSIFIED_BY));
        assertEquals(TextUtils.contentHash(stored.getContent()), stored.getMetadata().get(MemoryItem.META_CONTENT_HASH));

        final var results = manager.retrieve("what do I need to do Friday", "u1", 1);
        assertEquals(List.of(id), results.stream().map(MemoryItem::getId).toList());
    }

    @Test
    void testEquivalentFactsMerge() {
        manager = manager(new HashingEmbeddingModel(), DynamicMemoryConfig.DEFAULT);
        final var first = manager.add("meeting moved to 3pm", "u1");
        final var second = manager.add("meeting moved to 3:00 PM", "u1");
        assertEquals(first, second);

        final var facts = store.scan("u1", Set.of(MemoryCategory.FACT));
        assertEquals(1, facts.size());
        assertTrue(facts.get(0).getContent().contains("3pm"));
        assertTrue(facts.get(0).getContent().contains("3:00 PM"));
        assertArrayEquals(new HashingEmbeddingModel().getEmbedding(facts.get(0).getContent()),
                          facts.get(0).getEmbedding());
    }

    @Test
    void testContradictingFactSupersedes() {
        manager = manager(new HashingEmbeddingModel(), DynamicMemoryConfig.DEFAULT);
        final var original = manager.add("meeting moved to 3pm", "u1");
        manager.add("meeting moved to 3:00 PM", "u1");
        final var latest = manager.add("meeting moved to 4pm", "u1");
        assertNotEquals(original, latest);
        assertTrue(store.get(original).isEmpty());

        final var replacement = store.get(latest).orElseThrow();
        assertEquals(original, replacement.getMetadata().get(MemoryItem.META_SUPERSEDES));

        final var meetings = manager.retrieve("what time is the meeting", "u1", 5)
                .stream()
                .filter(item -> item.getContent().contains("meeting"))
                .toList();
        assertEquals(1, meetings.size());
        assertEquals("meeting moved to 4pm", meetings.get(0).getContent());
    }

    @Test
    void testFailedSupersedeKeepsOriginalFact() {
        final var eraseFails = new AtomicBoolean(false);
        final var failing = new InMemoryMemoryStore() {
            @Override
            protected void erase(MemoryItem item) {
                if (eraseFails.get()) {
                    throw MemoryStoreException.unavailable(new IOException("disk gone"));
                }
            }
        };
        manager = manager(failing, new HashingEmbeddingModel(), DynamicMemoryConfig.DEFAULT);
        final var original = manager.add("meeting moved to 3pm", "u1");
        eraseFails.set(true);
        assertThrows(MemoryStoreException.class, () -> manager.add("meeting moved to 4pm", "u1"));

        final var facts = failing.scan("u1", Set.of(MemoryCategory.FACT));
        assertEquals(List.of(original), facts.stream().map(MemoryItem::getId).toList());
        assertEquals("meeting moved to 3pm", facts.get(0).getContent());
        final var meetings = manager.retrieve("what time is the meeting", "u1", 5)
                .stream()
                .filter(item -> item.getContent().contains("meeting"))
                .map(MemoryItem::getContent)
                .toList();
        assertEquals(List.of("meeting moved to 3pm"), meetings);
    }

    @Test
    void testWorksWithoutEmbeddingsAndBackfills() {
        final var available = new AtomicBoolean(false);
        final var hashing = new HashingEmbeddingModel();
        final EmbeddingModel flaky = text -> {
            if (!available.get()) {
                throw new IllegalStateException("embedding service down");
            }
            return hashing.getEmbedding(text);
        };
        manager = manager(flaky, DynamicMemoryConfig.DEFAULT);
        final var id = manager.add("Remember to deploy the staging build Friday", "u1");
        assertFalse(store.get(id).orElseThrow().hasEmbedding());

        final var results = manager.retrieve("what do I need to do Friday", "u1", 3);
        assertEquals(List.of(id), results.stream().map(MemoryItem::getId).toList());
        assertEquals(1, manager.statistics("u1").getItemsWithoutEmbedding());
        assertEquals(0, manager.backfillEmbeddings());

        available.set(true);
        assertEquals(1, manager.backfillEmbeddings());
        assertTrue(store.get(id).orElseThrow().hasEmbedding());
        assertEquals(0, manager.statistics("u1").getItemsWithoutEmbedding());
    }

    @Test
    void testUsersAreIsolated() {
        manager = manager(new HashingEmbeddingModel(), DynamicMemoryConfig.DEFAULT);
        manager.add("Remember to deploy the staging build Friday", "u1");
        manager.add("meeting moved to 3pm", "u2");
        manager.add("meeting moved to 3pm", "u1");

        assertTrue(manager.retrieve("deploy staging build", "u2", 5)
                           .stream()
                           .allMatch(item -> item.getUserId().equals("u2")));
        assertEquals(1, store.scan("u2", Set.of()).size());
        assertEquals(2, store.scan("u1", Set.of()).size());
    }

    @Test
    void testGetByCategoryNewestFirst() {
        manager = manager(null, DynamicMemoryConfig.DEFAULT);
        final var older = manager.add("Remember to file the quarterly taxes", "u1");
        clock.advance(Duration.ofMinutes(1));
        final var newer = manager.add("Remember to deploy the staging build Friday", "u1");
        assertEquals(List.of(newer, older),
                     manager.getByCategory("u1", MemoryCategory.TASK).stream().map(MemoryItem::getId).toList());
        assertTrue(manager.getByCategory("u1", MemoryCategory.CODE).isEmpty());
        assertTrue(manager.getByCategory("u2", MemoryCategory.TASK).isEmpty());
    }

    @Test
    void testStatistics() {
        manager = manager(null, DynamicMemoryConfig.DEFAULT);
        manager.add("Remember to file the quarterly taxes", "u1");
        manager.add("Remember to deploy the staging build Friday", "u1");
        manager.add("meeting moved to 3pm", "u1");
        manager.add("meeting moved to 3pm", "u2");
        manager.retrieve("what do I need to do", "u1", 5);

        final var statistics = manager.statistics("u1");
        assertEquals(3, statistics.getTotalItems());
        assertEquals(2L, statistics.getItemsByCategory().get(MemoryCategory.TASK));
        assertEquals(1L, statistics.getItemsByCategory().get(MemoryCategory.FACT));
        assertEquals(3L, statistics.getItemsByTier().get(MemoryTier.WORKING));
        assertEquals(0L, statistics.getItemsByTier().get(MemoryTier.LONG_TERM));
        assertEquals(100, statistics.getTierCapacities().get(MemoryTier.WORKING));
        assertEquals(0, statistics.getItemsWithoutEmbedding());
        assertEquals(2L, statistics.getClassifiedByCategory().get(MemoryCategory.TASK));
        assertEquals(1L, statistics.getQueriesByIntent().values().stream().mapToLong(Long::longValue).sum());
    }

    @Test
    void testRepeatedRetrievalPromotes() {
        manager = manager(null, DynamicMemoryConfig.DEFAULT);
        final var id = manager.add("Remember to deploy the staging build Friday", "u1");
        for (int i = 0; i < 3; i++) {
            manager.retrieve("what do I need to do Friday", "u1", 1);
        }
        assertEquals(MemoryTier.SHORT_TERM, store.get(id).orElseThrow().getTier());
        assertEquals(1L, manager.statistics("u1").getItemsByTier().get(MemoryTier.SHORT_TERM));
    }

    @Test
    void testUpdateReclassifies() {
        manager = manager(new HashingEmbeddingModel(), DynamicMemoryConfig.DEFAULT);
        final var id = manager.add("Remember to deploy the staging build Friday", "u1");
        assertTrue(manager.update("u2", id, "meeting moved to 5pm").isEmpty());

        final var updated = manager.update("u1", id, "meeting moved to 5pm").orElseThrow();
        assertEquals(id, updated.getId());
        assertEquals(MemoryCategory.FACT, updated.getCategory());
        assertTrue(manager.getByCategory("u1", MemoryCategory.TASK).isEmpty());
        assertEquals(List.of(id),
                     manager.getByCategory("u1", MemoryCategory.FACT).stream().map(MemoryItem::getId).toList());
        assertEquals(TextUtils.contentHash("meeting moved to 5pm"),
                     updated.getMetadata().get(MemoryItem.META_CONTENT_HASH));
    }

    @Test
    void testDelete() {
        manager = manager(null, DynamicMemoryConfig.DEFAULT);
        final var id = manager.add("Remember to deploy the staging build Friday", "u1");
        assertFalse(manager.delete("u2", id));
        assertTrue(manager.delete("u1", id));
        assertFalse(manager.delete("u1", id));
        assertEquals(0, manager.statistics("u1").getTotalItems());
    }

    @Test
    void testArguments() {
        manager = manager(null, DynamicMemoryConfig.DEFAULT);
        assertThrows(ParameterValidationError.class, () -> manager.add(" ", "u1"));
        assertThrows(ParameterValidationError.class, () -> manager.add("hello", null));
        assertThrows(ParameterValidationError.class, () -> manager.retrieve("hello", "u1", -1));
        assertThrows(ParameterValidationError.class, () -> manager.statistics(""));
    }

    @Test
    void testRetrieveContext() {
        manager = manager(null, DynamicMemoryConfig.DEFAULT);
        manager.add("Remember to deploy the staging build Friday", "u1");
        assertEquals("## task\n- Remember to deploy the staging build Friday",
                     manager.retrieveContext("what do I need to do Friday", "u1", 3,
                                             ContextFormatter.Mode.STRUCTURED));
    }

    @Test
    void testConversationHistoryInContext() {
        manager = manager(null, DynamicMemoryConfig.builder()
                .retriever(RetrieverConfig.builder().conversationContextTurns(2).build())
                .build());
        manager.add("Remember to deploy the staging build Friday", "u1");
        manager.addToConversationHistory("u1", ConversationTurn.Role.USER, "hello");
        manager.addToConversationHistory("u1", ConversationTurn.Role.ASSISTANT, "hi, how can I help?");
        manager.addToConversationHistory("u1", ConversationTurn.Role.USER, "what is pending for Friday?",
                                         Map.of("channel", "chat"));
        manager.addToConversationHistory("u2", ConversationTurn.Role.USER, "unrelated");

        assertEquals(3, manager.conversationHistory("u1").size());
        assertEquals(TestUtils.EPOCH, manager.conversationHistory("u1").get(0).getTimestamp());
        assertEquals("""
                             ## task
                             - Remember to deploy the staging build Friday

                             ## recent conversation
                             - assistant: hi, how can I help?
                             - user: what is pending for Friday?""",
                     manager.retrieveContext("what do I need to do Friday", "u1", 3,
                                             ContextFormatter.Mode.STRUCTURED));
        //History is not memory
        assertEquals(1, store.scan("u1", Set.of()).size());

        manager.clearConversationHistory("u1");
        assertTrue(manager.conversationHistory("u1").isEmpty());
        assertEquals(1, manager.conversationHistory("u2").size());
        assertEquals("## task\n- Remember to deploy the staging build Friday",
                     manager.retrieveContext("what do I need to do Friday", "u1", 3,
                                             ContextFormatter.Mode.STRUCTURED));
    }

    @Test
    void testRetrieveRecent() {
        manager = manager(new HashingEmbeddingModel(), DynamicMemoryConfig.DEFAULT);
        final var old = manager.add("Remember to file the quarterly taxes", "u1");
        clock.advance(Duration.ofDays(10));
        final var fresh = manager.add("Remember to deploy the hotfix build Friday", "u1");

        assertEquals(Set.of(old, fresh), Set.copyOf(ids(manager.retrieve("remember", "u1", 5))));
        assertEquals(List.of(fresh), ids(manager.retrieveRecent("remember", "u1", 5, null)));
        assertEquals(List.of(fresh, old), ids(manager.retrieveRecent("", "u1", 5, Duration.ofDays(30))));
        assertTrue(manager.retrieveRecent("remember", "u2", 5, null).isEmpty());
    }

    @Test
    @SneakyThrows
    void testConcurrentDuplicatesCollapse() {
        manager = manager(new HashingEmbeddingModel(), DynamicMemoryConfig.DEFAULT);
        final var executor = Executors.newFixedThreadPool(8);
        try {
            final var tasks = new ArrayList<Callable<String>>();
            for (int i = 0; i < 16; i++) {
                tasks.add(() -> manager.add("meeting moved to 3pm", "u1"));
            }
            for (final var future : executor.invokeAll(tasks)) {
                assertNotNull(future.get());
            }
        }
        finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        }
        assertEquals(1, store.scan("u1", Set.of(MemoryCategory.FACT)).size());
    }

    @Test
    void testBackgroundMaintenance() {
        final var config = DynamicMemoryConfig.builder()
                .tiers(TierConfig.builder().workingCapacity(1).build())
                .maintenanceInterval(Duration.ofMillis(100))
                .build();
        manager = manager(null, config);
        manager.add("Remember to file the quarterly taxes", "u1");
        clock.advance(Duration.ofMinutes(1));
        final var kept = manager.add("Remember to deploy the staging build Friday", "u1");
        assertEquals(2, store.count("u1", MemoryCategory.TASK, null));

        manager.start();
        assertThrows(IllegalStateException.class, manager::start);
        Awaitility.await()
                .atMost(Duration.ofSeconds(5))
                .until(() -> store.count("u1", MemoryCategory.TASK, null) == 1);
        assertTrue(store.get(kept).isPresent());
    }

    private static List<String> ids(List<MemoryItem> items) {
        return items.stream().map(MemoryItem::getId).toList();
    }

    private DynamicMemoryManager manager(EmbeddingModel model, DynamicMemoryConfig config) {
        return manager(store, model, config);
    }

    private DynamicMemoryManager manager(MemoryStore memoryStore, EmbeddingModel model, DynamicMemoryConfig config) {
        return DynamicMemoryManager.builder()
                .store(memoryStore)
                .embeddingModel(model)
                .config(config)
                .clock(clock)
                .build();
    }
}
