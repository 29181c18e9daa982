package com.phonepe.memsight.core.conflict;

import com.phonepe.memsight.core.utils.TextUtils;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits a text into what it talks about (subject tokens) and the values it states about it (times, dates,
 * numbers) plus its polarity.
 */
record FactSignature(Set<String> tokens, Set<String> subject, Map<ValueKind, Set<String>> values, boolean negated) {

    enum ValueKind {
        TIME,
        DATE,
        NUMBER,
    }

    private static final Pattern TIME = Pattern.compile("t\\d{4}");
    private static final Pattern DATE = Pattern.compile(
            "d\\d{8}|m\\d{2}d\\d{2}|monday|tuesday|wednesday|thursday|friday|saturday|sunday"
                    + "|today|tomorrow|yesterday|tonight");
    private static final Pattern NUMBER = Pattern.compile("\\d+(\\.\\d+)?");
    private static final Set<String> NEGATIONS = Set.of(
            "not", "no", "never", "don't", "doesn't", "didn't", "isn't", "aren't", "wasn't", "weren't", "won't",
            "can't", "cannot", "shouldn't", "wouldn't", "nothing", "none");
    private static final Pattern CJK_NEGATION = Pattern.compile("[不没别]");

    static FactSignature of(String text) {
        final var tokens = TextUtils.contentTokens(text);
        final var subject = new HashSet<String>();
        final var values = new EnumMap<ValueKind, Set<String>>(ValueKind.class);
        var negated = CJK_NEGATION.matcher(text).find();
        for (final var token : tokens) {
            if (NEGATIONS.contains(token)) {
                negated = true;
            }
            else if (TIME.matcher(token).matches()) {
                values.computeIfAbsent(ValueKind.TIME, k -> new HashSet<>()).add(token);
            }
            else if (DATE.matcher(token).matches()) {
                values.computeIfAbsent(ValueKind.DATE, k -> new HashSet<>()).add(token);
            }
            else if (NUMBER.matcher(token).matches()) {
                values.computeIfAbsent(ValueKind.NUMBER, k -> new HashSet<>()).add(token);
            }
            else {
                subject.add(token);
            }
        }
        return new FactSignature(tokens, subject, values, negated);
    }

    /**
     * Both sides state a value of the same kind and the values differ
     */
    boolean valuesDiffer(FactSignature other) {
        for (final var entry : values.entrySet()) {
            final var otherValues = other.values.get(entry.getKey());
            if (otherValues != null && !otherValues.equals(entry.getValue())) {
                return true;
            }
        }
        return false;
    }
}
