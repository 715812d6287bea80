package com.cypher.guard.query;

/**
 * Length-preserving masking of Cypher string literals, comments and quoted identifiers.
 *
 * <p>Every masking method returns a string of the same length as its input, so offsets
 * found in the masked text map directly back to the original query. Masked characters
 * are replaced by spaces (or underscores for identifiers), which keeps keyword matching
 * on the masked text free of content that lives inside strings and comments.</p>
 *
 * <p>A single scanner is used for all three masks. String literals are recognised only
 * outside comments and comments only outside string literals, so an apostrophe in
 * {@code // don't} does not open a literal and {@code 'https://x'} does not open a comment.</p>
 *
 * <p>Outside literals, comments and quoted identifiers, non-ASCII whitespace such as
 * {@code U+00A0} or {@code U+3000} is rewritten to a plain space. The Cypher lexer accepts
 * those characters as separators, so keyword patterns written with {@code \s} must see them as one.</p>
 */
public final class CypherText {

    private static final char MASK = ' ';
    private static final char IDENTIFIER_MASK = '_';

    private CypherText() {
        // utility class
    }

    /**
     * Replaces the content of {@code '...'} and {@code "..."} literals with spaces.
     * The quote characters themselves are kept. Backslash escapes are honoured.
     */
    public static String maskStringLiterals(String query) {
        return scan(query, true, false, false).text();
    }

    /**
     * Replaces {@code // ...} line comments and {@code /* ... *}{@code /} block comments with spaces.
     */
    public static String maskComments(String query) {
        return scan(query, false, true, false).text();
    }

    /**
     * Replaces the content of backtick-quoted identifiers with underscores.
     */
    public static String maskIdentifiers(String query) {
        return scan(query, false, false, true).text();
    }

    /**
     * Masks string literals, comments and quoted identifiers in one pass.
     */
    public static String mask(String query) {
        return scan(query, true, true, true).text();
    }

    /**
     * Masks string literals and comments, leaving quoted identifiers intact.
     */
    public static String maskLiteralsAndComments(String query) {
        return scan(query, true, true, false).text();
    }

    /**
     * Replaces backtick characters with spaces so that {@code `apoc`.`load`} reads as
     * {@code  apoc . load } for keyword matching.
     */
    public static String unquoteIdentifiers(String text) {
        return text.replace('`', MASK);
    }

    /**
     * Returns {@code true} if a string literal or quoted identifier is still open at the end of the text.
     */
    public static boolean hasUnterminatedLiteral(String query) {
        return scan(query, false, false, false).unterminated();
    }

    private enum State { CODE, SINGLE_QUOTED, DOUBLE_QUOTED, BACKTICK, LINE_COMMENT, BLOCK_COMMENT }

    record ScanResult(String text, boolean unterminated) {
    }

    static ScanResult scan(String query, boolean strings, boolean comments, boolean identifiers) {
        if (query == null || query.isEmpty()) {
            return new ScanResult(query == null ? "" : query, false);
        }
        char[] out = query.toCharArray();
        State state = State.CODE;
        int i = 0;
        int n = out.length;
        while (i < n) {
            char c = query.charAt(i);
            char next = i + 1 < n ? query.charAt(i + 1) : '\0';
            switch (state) {
                case CODE -> {
                    if (c == '\'') {
                        state = State.SINGLE_QUOTED;
                    } else if (c == '"') {
                        state = State.DOUBLE_QUOTED;
                    } else if (c == '`') {
                        state = State.BACKTICK;
                    } else if (c == '/' && next == '/') {
                        state = State.LINE_COMMENT;
                        if (comments) {
                            out[i] = MASK;
                            out[i + 1] = MASK;
                        }
                        i++;
                    } else if (c == '/' && next == '*') {
                        state = State.BLOCK_COMMENT;
                        if (comments) {
                            out[i] = MASK;
                            out[i + 1] = MASK;
                        }
                        i++;
                    } else if (isUnicodeSpace(c)) {
                        out[i] = MASK;
                    }
                }
                case SINGLE_QUOTED, DOUBLE_QUOTED -> {
                    char quote = state == State.SINGLE_QUOTED ? '\'' : '"';
                    if (c == '\\') {
                        if (strings) {
                            out[i] = MASK;
                            if (i + 1 < n) {
                                out[i + 1] = MASK;
                            }
                        }
                        i++;
                    } else if (c == quote) {
                        state = State.CODE;
                    } else if (strings) {
                        out[i] = MASK;
                    }
                }
                case BACKTICK -> {
                    if (c == '`') {
                        state = State.CODE;
                    } else if (identifiers) {
                        out[i] = IDENTIFIER_MASK;
                    }
                }
                case LINE_COMMENT -> {
                    if (c == '\n') {
                        state = State.CODE;
                    } else if (comments) {
                        out[i] = MASK;
                    }
                }
                case BLOCK_COMMENT -> {
                    if (c == '*' && next == '/') {
                        state = State.CODE;
                        if (comments) {
                            out[i] = MASK;
                            out[i + 1] = MASK;
                        }
                        i++;
                    } else if (comments) {
                        out[i] = MASK;
                    }
                }
            }
            i++;
        }
        boolean unterminated = state == State.SINGLE_QUOTED
                || state == State.DOUBLE_QUOTED
                || state == State.BACKTICK;
        return new ScanResult(new String(out), unterminated);
    }

    static boolean isUnicodeSpace(char c) {
        return c > 0x7F && (Character.isWhitespace(c) || Character.isSpaceChar(c));
    }
}
