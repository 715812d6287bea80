package com.cypher.guard.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Word-level view of a masked Cypher query.
 *
 * <p>Words are maximal runs of identifier characters. Each word carries the bracket
 * nesting depth at which it appears, so callers can tell top-level clauses apart from
 * keywords nested in subqueries, maps or function calls. Words directly preceded by
 * {@code .}, {@code :} or {@code $} are property keys, labels or parameters and are never
 * reported.</p>
 */
public final class QueryTokens {

    /** Clause keywords that start a new part of a query. */
    public static final Set<String> CLAUSE_KEYWORDS = Set.of(
            "MATCH", "OPTIONAL", "WHERE", "WITH", "RETURN", "UNWIND", "CREATE", "MERGE",
            "DELETE", "DETACH", "SET", "REMOVE", "CALL", "FOREACH", "LOAD", "UNION",
            "ORDER", "SKIP", "LIMIT", "USE", "YIELD", "FINISH");

    private QueryTokens() {
        // utility class
    }

    /**
     * A word found in masked query text.
     *
     * @param text  the word as written
     * @param start start offset (inclusive)
     * @param end   end offset (exclusive)
     * @param depth bracket nesting depth at {@code start}
     */
    public record Word(String text, int start, int end, int depth) {

        public String upper() {
            return text.toUpperCase(Locale.ROOT);
        }

        public boolean is(String keyword) {
            return text.equalsIgnoreCase(keyword);
        }
    }

    /**
     * Splits masked text into words. The input should already have literals and comments masked.
     */
    public static List<Word> words(String masked) {
        List<Word> words = new ArrayList<>();
        int depth = 0;
        int i = 0;
        int n = masked.length();
        while (i < n) {
            char c = masked.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
                i++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth = Math.max(0, depth - 1);
                i++;
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < n && (Character.isLetterOrDigit(masked.charAt(i)) || masked.charAt(i) == '_')) {
                    i++;
                }
                if (!isQualified(masked, start)) {
                    words.add(new Word(masked.substring(start, i), start, i, depth));
                }
            } else if (Character.isDigit(c)) {
                while (i < n && (Character.isLetterOrDigit(masked.charAt(i)) || masked.charAt(i) == '_')) {
                    i++;
                }
            } else {
                i++;
            }
        }
        return words;
    }

    /**
     * Returns the index of the next non-whitespace character at or after {@code from}, or -1.
     */
    public static int nextNonWhitespace(String text, int from) {
        for (int i = from; i < text.length(); i++) {
            if (!Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Returns the nesting depth of every position in masked text.
     */
    public static int[] depths(String masked) {
        int[] depths = new int[masked.length()];
        int depth = 0;
        for (int i = 0; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == ')' || c == ']' || c == '}') {
                depth = Math.max(0, depth - 1);
            }
            depths[i] = depth;
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            }
        }
        return depths;
    }

    private static boolean isQualified(String masked, int start) {
        int j = start - 1;
        while (j >= 0 && masked.charAt(j) == ' ') {
            j--;
        }
        if (j < 0) {
            return false;
        }
        char prev = masked.charAt(j);
        return prev == '.' || prev == ':' || prev == '$';
    }

    /**
     * Splits text on commas that are not nested in brackets, braces or parentheses.
     */
    public static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        String tail = text.substring(start);
        if (!tail.isBlank()) {
            parts.add(tail);
        }
        return parts;
    }
}
