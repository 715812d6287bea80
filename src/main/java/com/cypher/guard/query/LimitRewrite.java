package com.cypher.guard.query;

/**
 * Outcome of automatic result bounding.
 *
 * @param query    the query to execute, rewritten or not
 * @param injected whether a {@code LIMIT} clause was appended
 */
public record LimitRewrite(String query, boolean injected) {

    public static LimitRewrite unchanged(String query) {
        return new LimitRewrite(query, false);
    }
}
