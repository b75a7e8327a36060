package com.mcr.core.strategy.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for pulling structured content out of generated text.
 */
public final class TextExtraction {

    private static final Pattern FENCE = Pattern.compile("```[a-zA-Z]*\\s*\\n?(.*?)```", Pattern.DOTALL);
    private static final Pattern TRAILING_PERIODS = Pattern.compile("\\.+$");
    private static final Pattern NUMBERING = Pattern.compile("^(\\d+[.)]|[-*])\\s+");

    private TextExtraction() {}

    /**
     * Content of the first fenced code block, or the trimmed text when there is none.
     */
    public static String stripCodeFence(String text) {
        if (text == null) {
            return "";
        }
        Matcher m = FENCE.matcher(text);
        if (m.find()) {
            return m.group(1).trim();
        }
        String cleaned = text.trim();
        if (cleaned.startsWith("```")) {
            int newline = cleaned.indexOf('\n');
            cleaned = newline < 0 ? cleaned.substring(3) : cleaned.substring(newline + 1);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }

    /**
     * The outermost JSON object or array in the text, or {@code null} when none is found.
     */
    public static String extractJson(String text) {
        String cleaned = stripCodeFence(text);
        int objStart = cleaned.indexOf('{');
        int arrStart = cleaned.indexOf('[');
        int start;
        char close;
        if (objStart < 0 && arrStart < 0) {
            return null;
        } else if (arrStart < 0 || (objStart >= 0 && objStart < arrStart)) {
            start = objStart;
            close = '}';
        } else {
            start = arrStart;
            close = ']';
        }
        int end = cleaned.lastIndexOf(close);
        if (end <= start) {
            return null;
        }
        return cleaned.substring(start, end + 1);
    }

    /**
     * Normalises a generated query: strips code fences, a leading {@code ?-} and
     * list numbering, and collapses trailing periods into exactly one.
     */
    public static String normalizeQuery(String text) {
        String q = stripCodeFence(text);
        int newline = q.indexOf('\n');
        if (newline >= 0) {
            q = q.substring(0, newline).trim();
        }
        q = NUMBERING.matcher(q).replaceFirst("");
        if (q.startsWith("?-")) {
            q = q.substring(2).trim();
        }
        q = TRAILING_PERIODS.matcher(q.trim()).replaceAll("");
        return q.isEmpty() ? q : q + ".";
    }

    /**
     * Splits generated Prolog into clauses. Comment lines and blank lines are
     * dropped; a clause may span several lines and ends at a line ending in a period.
     */
    public static List<String> extractClauses(String text) {
        String body = stripCodeFence(text);
        List<String> clauses = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String rawLine : body.split("\\R")) {
            String line = rawLine.strip();
            if (line.isEmpty() || line.startsWith("%")) {
                continue;
            }
            if (current.length() > 0) {
                current.append(' ');
            }
            current.append(line);
            if (line.endsWith(".")) {
                clauses.add(current.toString());
                current.setLength(0);
            }
        }
        if (current.length() > 0) {
            clauses.add(current.toString());
        }
        return clauses;
    }
}
