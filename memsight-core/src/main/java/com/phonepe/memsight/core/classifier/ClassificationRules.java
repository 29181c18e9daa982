package com.phonepe.memsight.core.classifier;

import com.phonepe.memsight.core.model.MemoryCategory;
import com.phonepe.memsight.core.model.QueryIntent;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lexical rule tables and the intent routing table. English and Chinese patterns live side by side in the same
 * per-category list, there is no per-language branching.
 */
@Value
@Builder
public class ClassificationRules {
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.MULTILINE;

    @NonNull
    Map<MemoryCategory, List<Pattern>> categoryPatterns;

    @NonNull
    Map<QueryIntent, List<Pattern>> intentPatterns;

    @NonNull
    Map<QueryIntent, Set<MemoryCategory>> routing;

    public List<Pattern> patterns(MemoryCategory category) {
        return categoryPatterns.getOrDefault(category, List.of());
    }

    public List<Pattern> patterns(QueryIntent intent) {
        return intentPatterns.getOrDefault(intent, List.of());
    }

    /**
     * Categories searched for an intent. Unknown intents search everything.
     */
    public Set<MemoryCategory> route(QueryIntent intent) {
        final var categories = routing.get(intent);
        return categories == null || categories.isEmpty()
               ? EnumSet.allOf(MemoryCategory.class)
               : EnumSet.copyOf(categories);
    }

    public static ClassificationRules defaults() {
        final var categories = new EnumMap<MemoryCategory, List<Pattern>>(MemoryCategory.class);
        categories.put(MemoryCategory.CODE, compile(
                "```",
                "\\b(function|class|def|import|from|return|if __name__)\\b",
                "\\b(var|let|const|async|await)\\b|=>",
                "[;{}]\\s*$",
                "(代码|函数|方法|报错|编译)"));
        categories.put(MemoryCategory.PROCEDURE, compile(
                "\\b(step \\d+|first|second|then|next|after that|finally)\\b",
                "\\b(how to|how do i|instructions|guide|tutorial)\\b",
                "(第一步|首先|然后|接着|最后|步骤|教程)"));
        categories.put(MemoryCategory.WORKFLOW, compile(
                "\\b(workflow|pipeline|process|stage|approval|hand-?off|ci/cd)\\b",
                "->|→",
                "(流程|工作流|流水线|审批)"));
        categories.put(MemoryCategory.TASK, compile(
                "\\b(todo|to-do|task|remember to|don't forget|need to|have to)\\b",
                "^\\s*[-*+]\\s",
                "^\\s*\\d+\\.\\s",
                "(待办|任务|记得要|别忘了|需要做|要做)"));
        categories.put(MemoryCategory.REFERENCE, compile(
                "https?://",
                "\\b(link|reference|check out|see also)\\b",
                "(链接|参考|网址|详见)"));
        categories.put(MemoryCategory.DOCUMENT, compile(
                "\\b(file|document|attachment|save|open|read)\\b",
                "\\.(txt|md|pdf|doc|docx)\\b",
                "(文件|文档|附件|笔记|保存)"));
        categories.put(MemoryCategory.IMAGE, compile(
                "\\b(image|screenshot|photo|picture|snapshot)\\b",
                "\\.(png|jpg|jpeg|gif|bmp)\\b",
                "(图片|截图|照片|图像)"));
        categories.put(MemoryCategory.VIDEO, compile(
                "\\b(video|recording|clip|footage|screencast)\\b",
                "\\.(mp4|mov|avi|mkv|webm)\\b",
                "(视频|录像|录屏)"));
        categories.put(MemoryCategory.PERSONAL, compile(
                "\\b(my preference|i prefer|i like|i dislike|i want)\\b",
                "\\b(remember that|i always|i usually)\\b",
                "(我喜欢|我讨厌|我更喜欢|我习惯|我总是)"));
        categories.put(MemoryCategory.FACT, compile(
                "\\b(moved to|rescheduled|scheduled (for|at|on)|starts at|deadline is|due (on|by))\\b",
                "\\b(fact|fyi|note that|actually)\\b",
                "(改到|推迟到|提前到|安排在|截止)"));
        categories.put(MemoryCategory.CONCEPT, compile(
                "\\b(is defined as|refers to|means|concept of|definition of|theory|principle)\\b",
                "(是指|定义|概念|原理)"));
        categories.put(MemoryCategory.QUESTION, compile(
                "^(what|how|why|when|where|who|which|can|could|would|should|is|are|do|does|did)\\b",
                "\\?$",
                "^tell me about",
                "^explain",
                "^define",
                "^(什么|怎么|为什么|哪里|谁|如何|是否)",
                "[吗呢？]$"));
        categories.put(MemoryCategory.GREETING, compile(
                "^(hi|hello|hey|good morning|good afternoon|good evening|greetings)\\b",
                "^(你好|您好|早上好|下午好|晚上好|嗨|哈喽)"));
        categories.put(MemoryCategory.CONVERSATION, compile(
                "\\b(you said|i said|we talked|we discussed|he said|she said|told me)\\b",
                "^(user|assistant|me|them)\\s*:",
                "(你说|我说|我们聊|讨论过)"));

        final var intents = new EnumMap<QueryIntent, List<Pattern>>(QueryIntent.class);
        intents.put(QueryIntent.LOCATE_CODE, compile(
                "\\b(code|function|class|implementation|script)\\b",
                "\\b(show me the|find the|where is the)\\s+(code|function|class)",
                "(代码|函数|实现)"));
        intents.put(QueryIntent.FIND_PROCEDURE, compile(
                "\\b(how to|how do i|how can i|steps for|instructions)\\b",
                "\\b(guide|tutorial|walkthrough)\\b",
                "(怎么做|如何|步骤|教程)"));
        intents.put(QueryIntent.GET_TASKS, compile(
                "\\b(todo|tasks|to-do|action items|what do i need to)\\b",
                "\\b(what's next|what should i do|pending)\\b",
                "(待办|任务|要做什么)"));
        intents.put(QueryIntent.FIND_DOCUMENT, compile(
                "\\b(document|file|note|saved)\\b",
                "\\b(where did i|find the|locate the)\\s+(document|file|note)",
                "(文档|文件|笔记)"));
        intents.put(QueryIntent.SEARCH_CONVERSATION, compile(
                "\\b(we talk(ed|ing)? about|you said|we discuss(ed|ing)?|mention(ed)?|said about)\\b",
                "\\b(earlier|before|previously|last time|our conversation)\\b",
                "(我们聊|你说过|之前说|上次)"));
        intents.put(QueryIntent.RETRIEVE_FACT, compile(
                "\\b(what is|what are|tell me about|define|explain)\\b",
                "\\b(remember|recall|lookup)\\b",
                "(是什么|告诉我|解释|定义|记得)"));

        final var routing = new EnumMap<QueryIntent, Set<MemoryCategory>>(QueryIntent.class);
        routing.put(QueryIntent.RETRIEVE_FACT, EnumSet.of(MemoryCategory.FACT,
                                                          MemoryCategory.CONCEPT,
                                                          MemoryCategory.REFERENCE,
                                                          MemoryCategory.PERSONAL));
        routing.put(QueryIntent.FIND_PROCEDURE, EnumSet.of(MemoryCategory.PROCEDURE,
                                                           MemoryCategory.WORKFLOW,
                                                           MemoryCategory.TASK));
        routing.put(QueryIntent.SEARCH_CONVERSATION, EnumSet.of(MemoryCategory.CONVERSATION,
                                                                MemoryCategory.QUESTION,
                                                                MemoryCategory.GREETING));
        routing.put(QueryIntent.LOCATE_CODE, EnumSet.of(MemoryCategory.CODE));
        routing.put(QueryIntent.FIND_DOCUMENT, EnumSet.of(MemoryCategory.DOCUMENT,
                                                          MemoryCategory.REFERENCE,
                                                          MemoryCategory.IMAGE,
                                                          MemoryCategory.VIDEO));
        routing.put(QueryIntent.GET_TASKS, EnumSet.of(MemoryCategory.TASK));
        routing.put(QueryIntent.GENERAL_SEARCH, EnumSet.allOf(MemoryCategory.class));

        return ClassificationRules.builder()
                .categoryPatterns(categories)
                .intentPatterns(intents)
                .routing(routing)
                .build();
    }

    private static List<Pattern> compile(String... regexes) {
        return Arrays.stream(regexes)
                .map(regex -> Pattern.compile(regex, FLAGS))
                .toList();
    }
}
