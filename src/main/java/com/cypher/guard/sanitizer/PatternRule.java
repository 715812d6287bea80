package com.cypher.guard.sanitizer;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A single detection rule matched against masked query text.
 *
 * @param id          stable identifier, quoted in rejection messages and tests
 * @param group       the rule family, which decides whether a match rejects or warns
 * @param pattern     the compiled pattern
 * @param description short description of what the rule catches
 */
public record PatternRule(String id, RuleGroup group, Pattern pattern, String description) {

    public PatternRule {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(group, "group is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(description, "description is required");
    }

    static PatternRule of(String id, RuleGroup group, String regex, String description) {
        return new PatternRule(id, group, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), description);
    }

    public boolean matches(CharSequence text) {
        return pattern.matcher(text).find();
    }
}
