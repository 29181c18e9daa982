package com.phonepe.memsight.core.utils;

import com.google.common.hash.Hashing;
import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text normalization and tokenization shared by lexical search and conflict detection.
 * <p>
 * Times are rewritten to a canonical {@code tHHMM} token ({@code 3pm}, {@code 3:00 PM}, {@code 15:00} and
 * {@code 下午3点} all become {@code t1500}), ISO and month-day dates to {@code dYYYYMMDD} / {@code mMMdDD} and
 * Chinese weekdays to their English names. Runs of Han characters are split into bigrams.
 */
@UtilityClass
public class TextUtils {
    private static final Pattern AM_PM_TIME = Pattern.compile(
            "(?<![\\d:])(\\d{1,2})(?::(\\d{2}))?\\s*([ap])\\.?m\\.?(?![a-z])");
    private static final Pattern CLOCK_TIME = Pattern.compile("(?<![\\d:])(\\d{1,2}):(\\d{2})(?![\\d:])");
    private static final Pattern CJK_TIME = Pattern.compile("(上午|早上|中午|下午|晚上)?(\\d{1,2})[点點](半|(\\d{1,2})分)?");
    private static final Pattern ISO_DATE = Pattern.compile("(?<!\\d)(\\d{4})-(\\d{1,2})-(\\d{1,2})(?!\\d)");
    private static final Pattern MONTH_DAY = Pattern.compile(
            "\\b(january|february|march|april|may|june|july|august|september|october|november|december"
                    + "|jan|feb|mar|apr|jun|jul|aug|sept|sep|oct|nov|dec)\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?\\b");
    private static final Pattern CJK_WEEKDAY = Pattern.compile("(?:星期|礼拜|周)([一二三四五六日天])");
    private static final Pattern TOKEN = Pattern.compile("\\p{IsHan}+|\\d+(?:\\.\\d+)?|[\\p{L}\\p{N}']+");
    private static final Pattern HAN = Pattern.compile("\\p{IsHan}+");

    private static final List<String> MONTHS = List.of(
            "jan", "feb", "mar", "apr", "may", "jun", "jul", "aug", "sep", "oct", "nov", "dec");
    private static final Map<String, String> CJK_WEEKDAYS = Map.of(
            "一", "monday", "二", "tuesday", "三", "wednesday", "四", "thursday",
            "五", "friday", "六", "saturday", "日", "sunday", "天", "sunday");

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "and", "or", "but", "if", "of", "to", "in", "on", "at", "by", "for", "with", "from",
            "as", "into", "about", "is", "are", "was", "were", "be", "been", "being", "am", "do", "does", "did",
            "i", "me", "my", "we", "our", "you", "your", "he", "she", "it", "its", "they", "them", "their",
            "this", "that", "these", "those", "what", "which", "who", "whom", "when", "where", "why", "how",
            "have", "has", "had", "will", "would", "shall", "should", "can", "could", "may", "might", "must",
            "so", "than", "too", "very", "just", "there", "here", "all", "any", "some", "up", "out", "then",
            "的", "了", "是", "在", "和", "我", "你", "吗", "呢", "吧");

    /**
     * Lower cases, canonicalizes time and date expressions and collapses whitespace
     */
    public static String normalize(String text) {
        if (StringUtils.isBlank(text)) {
            return "";
        }
        var normalized = text.toLowerCase(Locale.ROOT);
        normalized = replaceAll(AM_PM_TIME, normalized, m -> {
            var hour = Integer.parseInt(m.group(1)) % 12;
            if (m.group(3).equals("p")) {
                hour += 12;
            }
            return timeToken(hour, m.group(2) == null ? 0 : Integer.parseInt(m.group(2)));
        });
        normalized = replaceAll(CLOCK_TIME, normalized, m -> {
            final var hour = Integer.parseInt(m.group(1));
            final var minute = Integer.parseInt(m.group(2));
            return hour < 24 && minute < 60 ? timeToken(hour, minute) : m.group();
        });
        normalized = replaceAll(CJK_TIME, normalized, m -> {
            var hour = Integer.parseInt(m.group(2));
            final var period = m.group(1);
            if (period != null && (period.equals("下午") || period.equals("晚上")) && hour < 12) {
                hour += 12;
            }
            var minute = 0;
            if ("半".equals(m.group(3))) {
                minute = 30;
            }
            else if (m.group(4) != null) {
                minute = Integer.parseInt(m.group(4));
            }
            return " " + timeToken(hour, minute) + " ";
        });
        normalized = replaceAll(ISO_DATE, normalized,
                                m -> "d%s%02d%02d".formatted(m.group(1),
                                                             Integer.parseInt(m.group(2)),
                                                             Integer.parseInt(m.group(3))));
        normalized = replaceAll(MONTH_DAY, normalized,
                                m -> "m%02dd%02d".formatted(MONTHS.indexOf(m.group(1).substring(0, 3)) + 1,
                                                            Integer.parseInt(m.group(2))));
        normalized = replaceAll(CJK_WEEKDAY, normalized, m -> " " + CJK_WEEKDAYS.get(m.group(1)) + " ");
        return StringUtils.normalizeSpace(normalized);
    }

    /**
     * All tokens of the normalized text, in order, duplicates kept
     */
    public static List<String> tokenize(String text) {
        final var normalized = normalize(text);
        final var tokens = new ArrayList<String>();
        final var matcher = TOKEN.matcher(normalized);
        while (matcher.find()) {
            final var token = StringUtils.strip(matcher.group(), "'");
            if (token.isEmpty()) {
                continue;
            }
            if (HAN.matcher(token).matches()) {
                addHanBigrams(token, tokens);
            }
            else {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * Distinct tokens without stop words
     */
    public static Set<String> contentTokens(String text) {
        final var tokens = new LinkedHashSet<String>();
        for (final var token : tokenize(text)) {
            if (!STOP_WORDS.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    public static boolean isStopWord(String token) {
        return STOP_WORDS.contains(token);
    }

    /**
     * Stable hash of the normalized text, used to detect exact duplicates
     */
    public static String contentHash(String text) {
        return Hashing.sha256()
                .hashString(String.join(" ", tokenize(text)), StandardCharsets.UTF_8)
                .toString();
    }

    /**
     * Jaccard overlap of two token sets, 0 when both are empty
     */
    public static double overlap(Set<String> lhs, Set<String> rhs) {
        if (lhs.isEmpty() && rhs.isEmpty()) {
            return 0.0;
        }
        var common = 0;
        for (final var token : lhs) {
            if (rhs.contains(token)) {
                common++;
            }
        }
        return (double) common / (lhs.size() + rhs.size() - common);
    }

    private static void addHanBigrams(String run, List<String> tokens) {
        if (run.length() == 1) {
            tokens.add(run);
            return;
        }
        for (int i = 0; i + 1 < run.length(); i++) {
            tokens.add(run.substring(i, i + 2));
        }
    }

    private static String timeToken(int hour, int minute) {
        return "t%02d%02d".formatted(hour, minute);
    }

    private interface Replacer {
        String replace(Matcher matcher);
    }

    private static String replaceAll(Pattern pattern, String text, Replacer replacer) {
        final var matcher = pattern.matcher(text);
        final var builder = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(builder, Matcher.quoteReplacement(replacer.replace(matcher)));
        }
        matcher.appendTail(builder);
        return builder.toString();
    }
}
