package com.cypher.guard.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Detection and injection of a top-level {@code LIMIT} on the final projection of a query.
 *
 * <p>All structural checks run on masked text ({@link CypherText#mask(String)}) and only
 * consider top-level words, so a {@code LIMIT} written inside a string, a comment, a
 * backtick identifier or a {@code CALL { ... }} subquery is never taken for the query's
 * own limit. A {@code LIMIT} after a {@code UNION} binds to its own branch only, so a union
 * counts as limited when every branch is, and is otherwise bounded as a whole by wrapping it
 * in {@code CALL { ... } RETURN * LIMIT n}.</p>
 */
public final class LimitClauses {

    /** Clauses after which a trailing {@code RETURN} is no longer the last thing the query does. */
    private static final Set<String> MAJOR_CLAUSES = Set.of(
            "MATCH", "OPTIONAL", "WITH", "RETURN", "UNWIND", "CREATE", "MERGE", "DELETE",
            "DETACH", "SET", "REMOVE", "CALL", "FOREACH", "LOAD", "FINISH");

    private static final Set<String> RETURN_MODIFIERS = Set.of("ORDER", "SKIP", "LIMIT");

    private static final Pattern AGGREGATE_ITEM = Pattern.compile(
            "^(count|sum|avg|min|max|collect|stdev|stdevp|percentilecont|percentiledisc)\\s*\\(.*\\)$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern ALIAS = Pattern.compile("\\s+AS\\s+[\\w`]+\\s*$", Pattern.CASE_INSENSITIVE);

    private LimitClauses() {
        // utility class
    }

    /**
     * Returns {@code true} if the final projection of every {@code UNION} branch already carries a limit. Literal,
     * parameter ({@code $n}, {@code $p.x}, legacy {@code {n}}) and expression forms all count.
     */
    public static boolean hasLimitClause(String query) {
        if (query == null || query.isBlank()) {
            return false;
        }
        String masked = CypherText.mask(query);
        for (Branch branch : branches(masked)) {
            if (!branchHasLimit(masked, branch.words())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns {@code true} if the last top-level clause of the query is {@code RETURN}.
     * Queries that only write, or end in {@code YIELD}, produce no rows to bound.
     */
    public static boolean hasProjection(String query) {
        if (query == null || query.isBlank()) {
            return false;
        }
        String masked = CypherText.mask(query);
        List<Branch> branches = branches(masked);
        List<QueryTokens.Word> branch = branches.get(branches.size() - 1).words();
        String last = null;
        QueryTokens.Word previous = null;
        for (QueryTokens.Word word : branch) {
            boolean aliased = previous != null && previous.is("AS");
            if (word.depth() == 0 && !aliased && MAJOR_CLAUSES.contains(word.upper())) {
                last = word.upper();
            }
            previous = word;
        }
        return "RETURN".equals(last);
    }

    /**
     * Returns {@code true} if every item of the final {@code RETURN} of every branch is an
     * aggregate call, meaning each branch yields exactly one row and a limit would change nothing.
     */
    public static boolean isUnboundedAggregation(String query) {
        if (query == null || query.isBlank()) {
            return false;
        }
        String masked = CypherText.mask(query);
        for (Branch branch : branches(masked)) {
            if (!branchIsAggregation(masked, branch)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Appends {@code LIMIT maxRows} to the final projection when the query returns rows,
     * has no limit yet and is not a pure aggregation. A {@code UNION} query is wrapped as
     * {@code CALL { query } RETURN * LIMIT maxRows} instead. A trailing semicolon is dropped and
     * the clause is placed right after the last code character, ahead of any trailing comment.
     */
    public static LimitRewrite maybeInjectLimit(String query, int maxRows) {
        if (query == null || maxRows <= 0) {
            return LimitRewrite.unchanged(query);
        }
        if (!hasProjection(query) || hasLimitClause(query) || isUnboundedAggregation(query)) {
            return LimitRewrite.unchanged(query);
        }
        String masked = CypherText.mask(query);
        int last = lastCodeCharacter(masked, masked.length() - 1);
        if (last < 0) {
            return LimitRewrite.unchanged(query);
        }
        int tailStart = last + 1;
        if (masked.charAt(last) == ';') {
            last = lastCodeCharacter(masked, last - 1);
            if (last < 0) {
                return LimitRewrite.unchanged(query);
            }
        }
        String body = query.substring(0, last + 1);
        String bounded = branches(masked).size() > 1
                ? "CALL { " + body + " } RETURN * LIMIT " + maxRows
                : body + " LIMIT " + maxRows;
        String rewritten = bounded + query.substring(tailStart);
        return new LimitRewrite(rewritten, true);
    }

    private static int lastCodeCharacter(String masked, int from) {
        for (int i = from; i >= 0; i--) {
            if (!Character.isWhitespace(masked.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private static boolean hasOperand(String masked, QueryTokens.Word limit) {
        int next = QueryTokens.nextNonWhitespace(masked, limit.end());
        if (next < 0) {
            return false;
        }
        char c = masked.charAt(next);
        if (c == ';' || c == ')' || c == '}' || c == ',') {
            return false;
        }
        if (Character.isLetter(c)) {
            int end = next;
            while (end < masked.length() && (Character.isLetterOrDigit(masked.charAt(end)) || masked.charAt(end) == '_')) {
                end++;
            }
            return !QueryTokens.CLAUSE_KEYWORDS.contains(masked.substring(next, end).toUpperCase(Locale.ROOT));
        }
        return true;
    }

    private static boolean branchHasLimit(String masked, List<QueryTokens.Word> branch) {
        int from = lastTopLevel(branch, "RETURN");
        for (int i = Math.max(from, 0); i < branch.size(); i++) {
            QueryTokens.Word word = branch.get(i);
            if (word.depth() == 0 && word.is("LIMIT") && hasOperand(masked, word)) {
                return true;
            }
        }
        return false;
    }

    private static boolean branchIsAggregation(String masked, Branch union) {
        List<QueryTokens.Word> branch = union.words();
        int returnIndex = lastTopLevel(branch, "RETURN");
        if (returnIndex < 0) {
            return false;
        }
        int start = branch.get(returnIndex).end();
        int end = union.end();
        for (int i = returnIndex + 1; i < branch.size(); i++) {
            QueryTokens.Word word = branch.get(i);
            if (word.depth() == 0 && RETURN_MODIFIERS.contains(word.upper())) {
                end = word.start();
                break;
            }
        }
        String projection = masked.substring(start, end).trim();
        if (projection.regionMatches(true, 0, "DISTINCT", 0, 8)) {
            projection = projection.substring(8).trim();
        }
        List<String> items = QueryTokens.splitTopLevel(projection.replaceAll(";\\s*$", ""));
        if (items.isEmpty()) {
            return false;
        }
        for (String item : items) {
            String expression = ALIAS.matcher(item.trim()).replaceFirst("").trim();
            if (!AGGREGATE_ITEM.matcher(expression).matches()) {
                return false;
            }
        }
        return true;
    }

    /** Words of one {@code UNION} branch and the offset where the branch text ends. */
    private record Branch(List<QueryTokens.Word> words, int end) {
    }

    private static List<Branch> branches(String masked) {
        List<QueryTokens.Word> words = QueryTokens.words(masked);
        List<Branch> branches = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < words.size(); i++) {
            QueryTokens.Word word = words.get(i);
            if (word.depth() == 0 && word.is("UNION")) {
                branches.add(new Branch(words.subList(start, i), word.start()));
                start = i + 1;
            }
        }
        branches.add(new Branch(words.subList(start, words.size()), masked.length()));
        return branches;
    }

    private static int lastTopLevel(List<QueryTokens.Word> words, String keyword) {
        for (int i = words.size() - 1; i >= 0; i--) {
            QueryTokens.Word word = words.get(i);
            if (word.depth() == 0 && word.is(keyword)) {
                return i;
            }
        }
        return -1;
    }
}
