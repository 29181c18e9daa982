package com.phonepe.memsight.core.retrieval;

import com.google.common.base.CaseFormat;
import com.phonepe.memsight.core.model.ConversationTurn;
import com.phonepe.memsight.core.model.MemoryCategory;
import com.phonepe.memsight.core.model.MemoryItem;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Renders retrieved items as context text for a language model prompt
 */
@UtilityClass
public class ContextFormatter {
    private static final int ITEMS_PER_CATEGORY = 3;
    private static final int CONCISE_ITEMS = 5;

    public enum Mode {
        /**
         * Grouped under a heading per category, at most three items each
         */
        STRUCTURED,
        /**
         * The five best items, one per line
         */
        CONCISE,
        /**
         * Every item numbered, with its category and tier
         */
        DETAILED,
    }

    public static String format(List<MemoryItem> items, Mode mode) {
        if (items == null || items.isEmpty()) {
            return "";
        }
        return switch (mode) {
            case STRUCTURED -> structured(items);
            case CONCISE -> concise(items);
            case DETAILED -> detailed(items);
        };
    }

    /**
     * Items followed by the latest conversation turns, oldest turn first
     */
    public static String format(List<MemoryItem> items, List<ConversationTurn> turns, Mode mode) {
        final var memories = format(items, mode);
        if (turns == null || turns.isEmpty()) {
            return memories;
        }
        final var offset = items == null ? 0 : items.size();
        final var builder = new StringBuilder();
        if (mode == Mode.STRUCTURED) {
            builder.append("## recent conversation\n");
        }
        for (int i = 0; i < turns.size(); i++) {
            final var turn = turns.get(i);
            if (mode == Mode.DETAILED) {
                builder.append("[%d] (conversation, %s) %s".formatted(offset + i + 1,
                                                                      label(turn.getRole()),
                                                                      turn.getContent()));
            }
            else {
                builder.append("- ").append(label(turn.getRole())).append(": ").append(oneLine(turn.getContent()));
            }
            builder.append('\n');
        }
        final var conversation = builder.toString().strip();
        if (memories.isEmpty()) {
            return conversation;
        }
        return memories + (mode == Mode.STRUCTURED ? "\n\n" : "\n") + conversation;
    }

    private static String structured(List<MemoryItem> items) {
        final var groups = new LinkedHashMap<MemoryCategory, List<MemoryItem>>();
        items.forEach(item -> groups.computeIfAbsent(item.getCategory(), c -> new ArrayList<>()).add(item));
        final var builder = new StringBuilder();
        groups.forEach((category, grouped) -> {
            if (!builder.isEmpty()) {
                builder.append('\n');
            }
            builder.append("## ").append(label(category)).append('\n');
            grouped.stream()
                    .limit(ITEMS_PER_CATEGORY)
                    .forEach(item -> builder.append("- ").append(oneLine(item)).append('\n'));
        });
        return builder.toString().strip();
    }

    private static String concise(List<MemoryItem> items) {
        final var builder = new StringBuilder();
        items.stream()
                .limit(CONCISE_ITEMS)
                .forEach(item -> builder.append("- ").append(oneLine(item)).append('\n'));
        return builder.toString().strip();
    }

    private static String detailed(List<MemoryItem> items) {
        final var builder = new StringBuilder();
        for (int i = 0; i < items.size(); i++) {
            final var item = items.get(i);
            builder.append("[%d] (%s, %s) %s".formatted(i + 1,
                                                         label(item.getCategory()),
                                                         label(item.getTier()),
                                                         item.getContent()))
                    .append('\n');
        }
        return builder.toString().strip();
    }

    private static String oneLine(MemoryItem item) {
        return oneLine(item.getContent());
    }

    private static String oneLine(String content) {
        return content.replaceAll("\\s*\\n\\s*", "; ");
    }

    private static String label(Enum<?> value) {
        return CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.LOWER_UNDERSCORE, value.name());
    }
}
