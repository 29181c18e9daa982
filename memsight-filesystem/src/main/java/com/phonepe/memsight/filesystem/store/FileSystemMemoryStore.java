package com.phonepe.memsight.filesystem.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.memsight.core.errors.MemoryStoreException;
import com.phonepe.memsight.core.model.MemoryItem;
import com.phonepe.memsight.core.store.InMemoryMemoryStore;
import com.phonepe.memsight.core.utils.JsonUtils;
import com.phonepe.memsight.filesystem.utils.FileUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Memory store that keeps one JSON file per item, grouped in a directory per user, and serves reads from memory.
 * Everything on disk is loaded when the store is created. This is not for serious production use.
 */
@Slf4j
public class FileSystemMemoryStore extends InMemoryMemoryStore {
    private static final String ITEM_FILE_SUFFIX = ".json";

    private final Path root;
    private final ObjectMapper mapper;

    @Builder
    public FileSystemMemoryStore(@NonNull String baseDir, ObjectMapper mapper) {
        this.root = FileUtils.ensurePath(baseDir, true, true);
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        final var loaded = loadItems();
        restore(loaded);
        log.info("Loaded {} memory items from {}", loaded.size(), root);
    }

    @Override
    protected void persist(MemoryItem item) {
        try {
            final var userDir = FileUtils.ensurePath(userDir(item.getUserId()).toString(), true, true);
            FileUtils.writeAtomically(userDir.resolve(fileName(item.getId())), mapper.writeValueAsBytes(item));
        }
        catch (IOException e) {
            throw MemoryStoreException.unavailable(e);
        }
    }

    @Override
    protected void erase(MemoryItem item) {
        try {
            FileUtils.delete(userDir(item.getUserId()).resolve(fileName(item.getId())));
        }
        catch (IOException e) {
            throw MemoryStoreException.unavailable(e);
        }
    }

    private List<MemoryItem> loadItems() {
        final var items = new ArrayList<MemoryItem>();
        try (final var userDirs = Files.list(root)) {
            for (final var userDir : userDirs.filter(Files::isDirectory).toList()) {
                try (final var files = Files.list(userDir)) {
                    files.filter(file -> file.getFileName().toString().endsWith(ITEM_FILE_SUFFIX))
                            .forEach(file -> readItem(file, items));
                }
            }
        }
        catch (IOException e) {
            throw MemoryStoreException.unavailable(e);
        }
        return items;
    }

    private void readItem(Path file, List<MemoryItem> items) {
        try {
            final var item = mapper.readValue(file.toFile(), MemoryItem.class);
            if (item.getId() == null || item.getUserId() == null || item.getCategory() == null
                    || item.getTier() == null) {
                log.error("Skipping incomplete memory item in {}", file);
                return;
            }
            items.add(item);
        }
        catch (IOException e) {
            log.error("Failed to load memory item from path: {}", file, e);
        }
    }

    private Path userDir(String userId) {
        return root.resolve(nameFor(userId));
    }

    private static String fileName(String id) {
        return nameFor(id) + ITEM_FILE_SUFFIX;
    }

    /**
     * Ids and user ids are caller supplied, so they are mapped to names that are always safe on disk
     */
    private static String nameFor(String value) {
        return UUID.nameUUIDFromBytes(value.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
