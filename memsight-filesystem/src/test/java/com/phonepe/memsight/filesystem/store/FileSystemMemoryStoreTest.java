package com.phonepe.memsight.filesystem.store;

import com.phonepe.memsight.core.DynamicMemoryManager;
import com.phonepe.memsight.core.model.MemoryCategory;
import com.phonepe.memsight.core.model.MemoryTier;
import com.phonepe.memsight.core.utils.HashingEmbeddingModel;
import com.phonepe.memsight.core.utils.TestUtils;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FileSystemMemoryStore}
 */
class FileSystemMemoryStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void testItemsSurviveRestart() {
        final var store = store();
        store.insert(TestUtils.item("i1", "u1", MemoryCategory.TASK, MemoryTier.WORKING, "deploy build")
                             .withEmbedding(new float[]{0.1f, 0.2f})
                             .withMetadata(Map.of("priority", "high")));
        store.insert(TestUtils.item("i2", "u1", MemoryCategory.FACT, MemoryTier.WORKING, "meeting at 3pm"));
        store.insert(TestUtils.item("i3", "user/with/slashes", MemoryCategory.FACT, MemoryTier.WORKING, "x"));
        store.update("i2", item -> item.toBuilder()
                .category(MemoryCategory.CONCEPT)
                .tier(MemoryTier.SHORT_TERM)
                .build());
        store.delete("i3");

        final var reopened = store();
        final var first = reopened.get("i1").orElseThrow();
        assertEquals("deploy build", first.getContent());
        assertArrayEquals(new float[]{0.1f, 0.2f}, first.getEmbedding());
        assertEquals("high", first.getMetadata().get("priority"));
        assertEquals(TestUtils.EPOCH, first.getCreatedAt());

        final var second = reopened.get("i2").orElseThrow();
        assertEquals(MemoryCategory.CONCEPT, second.getCategory());
        assertEquals(MemoryTier.SHORT_TERM, second.getTier());
        assertEquals(1, reopened.count("u1", MemoryCategory.CONCEPT, MemoryTier.SHORT_TERM));
        assertTrue(reopened.scan("u1", Set.of(MemoryCategory.FACT)).isEmpty());
        assertTrue(reopened.get("i3").isEmpty());
        assertTrue(reopened.scan("user/with/slashes", Set.of()).isEmpty());
    }

    @Test
    @SneakyThrows
    void testBrokenFilesAreSkipped() {
        final var store = store();
        store.insert(TestUtils.item("i1", "u1", MemoryCategory.TASK, MemoryTier.WORKING, "deploy build"));
        try (final var dirs = Files.list(tempDir)) {
            final var userDir = dirs.filter(Files::isDirectory).findFirst().orElseThrow();
            Files.writeString(userDir.resolve("broken.json"), "{not json");
            Files.writeString(userDir.resolve("incomplete.json"), "{\"content\": \"no id\"}");
        }
        final var reopened = store();
        assertEquals(1, reopened.scan("u1", Set.of()).size());
    }

    @Test
    void testEngineStateIsDurable() {
        try (final var engine = engine()) {
            final var id = engine.add("meeting moved to 3pm", "u1");
            assertEquals(id, engine.add("meeting moved to 3:00 PM", "u1"));
        }
        try (final var reopened = engine()) {
            final var facts = reopened.getByCategory("u1", MemoryCategory.FACT);
            assertEquals(1, facts.size());
            assertEquals("meeting moved to 3pm\nmeeting moved to 3:00 PM", facts.get(0).getContent());
            assertTrue(facts.get(0).hasEmbedding());
            assertEquals(1, reopened.retrieve("when is the meeting", "u1", 3).size());
        }
    }

    @Test
    @SneakyThrows
    void testReplaceSwapsFiles() {
        final var store = store();
        store.insert(TestUtils.item("old", "u1", MemoryCategory.FACT, MemoryTier.WORKING, "meeting moved to 3pm"));
        store.replace("old", TestUtils.item("new", "u1", MemoryCategory.FACT, MemoryTier.WORKING,
                                            "meeting moved to 4pm"));

        final var reopened = store();
        assertTrue(reopened.get("old").isEmpty());
        assertEquals("meeting moved to 4pm", reopened.get("new").orElseThrow().getContent());
        try (final var dirs = Files.list(tempDir)) {
            final var userDir = dirs.filter(Files::isDirectory).findFirst().orElseThrow();
            try (final var files = Files.list(userDir)) {
                assertEquals(1, files.count());
            }
        }
    }

    @Test
    void testSupersededFactIsGoneAfterRestart() {
        try (final var engine = engine()) {
            engine.add("meeting moved to 3pm", "u1");
            engine.add("meeting moved to 4pm", "u1");
        }
        try (final var reopened = engine()) {
            final var facts = reopened.getByCategory("u1", MemoryCategory.FACT);
            assertEquals(1, facts.size());
            assertEquals("meeting moved to 4pm", facts.get(0).getContent());
        }
    }

    private FileSystemMemoryStore store() {
        return FileSystemMemoryStore.builder()
                .baseDir(tempDir.toString())
                .build();
    }

    private DynamicMemoryManager engine() {
        return DynamicMemoryManager.builder()
                .store(store())
                .embeddingModel(new HashingEmbeddingModel())
                .build();
    }
}
