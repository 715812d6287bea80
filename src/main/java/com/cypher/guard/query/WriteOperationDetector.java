package com.cypher.guard.query;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects Cypher clauses and procedures that mutate the graph or the schema.
 *
 * <p>Matching runs on masked text, so keywords inside string literals and comments are
 * ignored. Keywords are matched as whole words and any run of whitespace (spaces, tabs,
 * newlines, Unicode spaces) may separate a keyword from its operand. A keyword directly preceded by
 * {@code .}, {@code :} or {@code $} is a property, label or parameter name, not a clause,
 * and one directly following {@code AS} is an alias.</p>
 */
public final class WriteOperationDetector {

    private static final List<Pattern> WRITE_PATTERNS = List.of(
            Pattern.compile("(?<![.:$\\w])(?<kw>CREATE|MERGE)\\b(?=\\s*[(\\w`])", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?<![.:$\\w])(?<kw>DETACH\\s+DELETE)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?<![.:$\\w])(?<kw>DELETE|REMOVE|SET|DROP)\\b(?=\\s*[(\\w`$])", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?<![.:$\\w])(?<kw>FOREACH)\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?<![.:$\\w])(?<kw>LOAD\\s+CSV)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?<kw>\\bdb\\s*\\.\\s*(?:create|index\\s*\\.\\s*fulltext\\s*\\.\\s*create"
                    + "|clearQueryCaches))", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?<kw>\\bapoc\\s*\\.\\s*(?:create|merge|refactor|periodic|do|nodes\\s*\\.\\s*delete"
                    + "|atomic|schema\\s*\\.\\s*assert|trigger\\s*\\.\\s*(?:add|install)))\\b",
                    Pattern.CASE_INSENSITIVE)
    );

    private WriteOperationDetector() {
        // utility class
    }

    /**
     * Returns {@code true} if the query contains a write clause or a mutating procedure call.
     */
    public static boolean containsWrite(String query) {
        return findWrite(query).isPresent();
    }

    /**
     * Returns the first write construct found in the query, normalised to single spaces and upper case.
     */
    public static Optional<String> findWrite(String query) {
        if (query == null || query.isBlank()) {
            return Optional.empty();
        }
        String masked = CypherText.unquoteIdentifiers(CypherText.maskLiteralsAndComments(query));
        for (Pattern pattern : WRITE_PATTERNS) {
            Matcher matcher = pattern.matcher(masked);
            while (matcher.find()) {
                if (isAlias(masked, matcher.start("kw"))) {
                    continue;
                }
                String keyword = matcher.group("kw").replaceAll("\\s+", " ");
                return Optional.of(keyword.toUpperCase(Locale.ROOT));
            }
        }
        return Optional.empty();
    }

    private static boolean isAlias(String masked, int keywordStart) {
        int end = keywordStart;
        while (end > 0 && Character.isWhitespace(masked.charAt(end - 1))) {
            end--;
        }
        if (end == keywordStart || end < 2 || !masked.regionMatches(true, end - 2, "AS", 0, 2)) {
            return false;
        }
        return end == 2 || !isWordChar(masked.charAt(end - 3));
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
