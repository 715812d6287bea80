package com.cypher.guard.complexity;

import com.cypher.guard.query.QueryTokens;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds MATCH patterns that are not connected to each other.
 *
 * <p>Every comma-separated part of every MATCH clause in a {@code UNION} branch is a node of a
 * union-find structure. Parts are joined when one refers to a variable declared by another, or
 * when a WHERE predicate refers to variables of both. More than one resulting group means the
 * engine has to build a Cartesian product.</p>
 */
final class CartesianDetector {

    private static final Pattern DECLARED = Pattern.compile("[(\\[]\\s*([A-Za-z_][A-Za-z0-9_]*)");
    private static final Pattern PATH_VARIABLE = Pattern.compile("^\\s*([A-Za-z_][A-Za-z0-9_]*)\\s*=");
    private static final Pattern IDENTIFIER = Pattern.compile("(?<![.:$\\w])([A-Za-z_][A-Za-z0-9_]*)");

    private CartesianDetector() {
    }

    /**
     * Returns the disconnected groups of pattern parts of the first branch that has any,
     * or an empty list when all patterns are connected.
     *
     * @param masked query text with literals, comments and quoted identifiers masked
     */
    static List<List<String>> disconnectedGroups(String masked) {
        List<QueryTokens.Word> words = QueryTokens.words(masked);
        int[] depths = QueryTokens.depths(masked);
        int branchStart = 0;
        for (QueryTokens.Word word : words) {
            if (word.depth() == 0 && word.is("UNION")) {
                List<List<String>> groups = analyzeBranch(masked, depths, words, branchStart, word.start());
                if (groups.size() > 1) {
                    return groups;
                }
                branchStart = word.end();
            }
        }
        List<List<String>> groups = analyzeBranch(masked, depths, words, branchStart, masked.length());
        return groups.size() > 1 ? groups : List.of();
    }

    private static List<List<String>> analyzeBranch(String masked, int[] depths, List<QueryTokens.Word> words,
                                                    int from, int to) {
        List<String> parts = new ArrayList<>();
        List<String> predicates = new ArrayList<>();
        for (int i = 0; i < words.size(); i++) {
            QueryTokens.Word word = words.get(i);
            if (word.start() < from || word.start() >= to) {
                continue;
            }
            boolean match = word.is("MATCH");
            boolean where = word.is("WHERE");
            if (!match && !where) {
                continue;
            }
            int end = clauseEnd(masked, depths, words, i, to);
            String body = masked.substring(word.end(), end);
            if (match) {
                for (String part : QueryTokens.splitTopLevel(body)) {
                    if (!part.isBlank()) {
                        parts.add(part.trim());
                    }
                }
            } else {
                predicates.add(body);
            }
        }
        if (parts.size() < 2) {
            return List.of(parts);
        }

        Map<String, Integer> owners = new HashMap<>();
        for (int i = 0; i < parts.size(); i++) {
            for (String variable : declaredVariables(parts.get(i))) {
                owners.putIfAbsent(variable, i);
            }
        }

        int[] parent = new int[parts.size()];
        for (int i = 0; i < parent.length; i++) {
            parent[i] = i;
        }
        for (int i = 0; i < parts.size(); i++) {
            for (String ref : references(parts.get(i), owners.keySet())) {
                union(parent, i, owners.get(ref));
            }
        }
        for (String predicate : predicates) {
            Integer first = null;
            for (String ref : references(predicate, owners.keySet())) {
                int owner = owners.get(ref);
                if (first == null) {
                    first = owner;
                } else {
                    union(parent, first, owner);
                }
            }
        }

        Map<Integer, List<String>> groups = new LinkedHashMap<>();
        for (int i = 0; i < parts.size(); i++) {
            groups.computeIfAbsent(find(parent, i), k -> new ArrayList<>()).add(parts.get(i));
        }
        return new ArrayList<>(groups.values());
    }

    private static int clauseEnd(String masked, int[] depths, List<QueryTokens.Word> words, int index, int limit) {
        QueryTokens.Word clause = words.get(index);
        int end = limit;
        for (int p = clause.end(); p < limit; p++) {
            if (depths[p] < clause.depth()) {
                end = p;
                break;
            }
        }
        for (int j = index + 1; j < words.size(); j++) {
            QueryTokens.Word next = words.get(j);
            if (next.start() >= end) {
                break;
            }
            if (next.depth() == clause.depth() && QueryTokens.CLAUSE_KEYWORDS.contains(next.upper())) {
                return next.start();
            }
        }
        return Math.min(end, masked.length());
    }

    private static Set<String> declaredVariables(String part) {
        Set<String> variables = new LinkedHashSet<>();
        Matcher path = PATH_VARIABLE.matcher(part);
        if (path.find()) {
            variables.add(path.group(1));
        }
        Matcher matcher = DECLARED.matcher(part);
        while (matcher.find()) {
            variables.add(matcher.group(1));
        }
        return variables;
    }

    private static Set<String> references(String text, Set<String> known) {
        Set<String> refs = new LinkedHashSet<>();
        Matcher matcher = IDENTIFIER.matcher(text);
        while (matcher.find()) {
            if (known.contains(matcher.group(1))) {
                refs.add(matcher.group(1));
            }
        }
        return refs;
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static void union(int[] parent, int a, int b) {
        int rootA = find(parent, a);
        int rootB = find(parent, b);
        if (rootA != rootB) {
            parent[rootB] = rootA;
        }
    }
}
