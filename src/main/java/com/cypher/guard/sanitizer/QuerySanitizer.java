package com.cypher.guard.sanitizer;

import com.cypher.guard.query.CypherText;
import com.cypher.guard.query.WriteOperationDetector;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Validates untrusted Cypher text and parameters before anything reaches the database.
 *
 * <p>Checks run in a fixed order:</p>
 * <ol>
 *   <li>empty and length checks</li>
 *   <li>Unicode and encoding inspection of the original text</li>
 *   <li>string literal masking, rejecting unterminated literals</li>
 *   <li>comment masking</li>
 *   <li>dangerous rules and delimiter balance on the masked text</li>
 *   <li>suspicious rules, reported as warnings</li>
 *   <li>parameter validation</li>
 * </ol>
 *
 * <p>The Unicode step must precede masking, since masking would hide characters placed in
 * literals or comments. {@link #sanitize} is a pure function of its inputs and the configuration;
 * it never throws for bad input.</p>
 */
public class QuerySanitizer {
    private static final Logger log = LoggerFactory.getLogger(QuerySanitizer.class);

    private final SanitizerConfig config;
    private final ParameterValidator parameterValidator;

    public QuerySanitizer(SanitizerConfig config) {
        this(config, new ObjectMapper());
    }

    public QuerySanitizer(SanitizerConfig config, ObjectMapper objectMapper) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.parameterValidator = new ParameterValidator(
                Objects.requireNonNull(objectMapper, "objectMapper is required"), config);
    }

    public SanitizerConfig config() {
        return config;
    }

    /**
     * Sanitizes a query without parameters.
     */
    public SanitizationResult sanitize(String query) {
        return sanitize(query, null);
    }

    /**
     * Sanitizes a query and its parameters.
     *
     * @param query      the raw query text
     * @param parameters the parameter map, may be {@code null}
     * @return the verdict with any accumulated warnings
     */
    public SanitizationResult sanitize(String query, Map<String, ?> parameters) {
        List<String> warnings = new ArrayList<>();

        if (query == null || query.isBlank()) {
            return reject(ViolationType.EMPTY_QUERY, "Empty query not allowed", warnings);
        }
        if (query.length() > config.maxQueryLength()) {
            return reject(ViolationType.QUERY_TOO_LONG,
                    "Query exceeds maximum length (" + config.maxQueryLength() + " characters)", warnings);
        }

        Optional<UnicodeInspector.Finding> unicode = UnicodeInspector.inspectQuery(query, config.blockNonAscii());
        if (unicode.isPresent()) {
            return reject(unicode.get().type(), unicode.get().message(), warnings);
        }

        if (CypherText.hasUnterminatedLiteral(query)) {
            return reject(ViolationType.UNBALANCED_DELIMITERS, "Unterminated string literal or quoted identifier",
                    warnings);
        }
        String withoutStrings = CypherText.maskStringLiterals(query);
        String masked = CypherText.unquoteIdentifiers(CypherText.maskComments(withoutStrings));

        Optional<SanitizationResult> dangerous = checkDangerous(query, masked, warnings);
        if (dangerous.isPresent()) {
            return dangerous.get();
        }

        Optional<SanitizationResult> suspicious = checkSuspicious(masked, warnings);
        if (suspicious.isPresent()) {
            return suspicious.get();
        }

        Optional<SanitizationResult> parameterFailure = parameterValidator.validate(parameters, warnings);
        if (parameterFailure.isPresent()) {
            log.debug("sanitizer.rejected violation={}", parameterFailure.get().violation());
            return parameterFailure.get();
        }
        return SanitizationResult.passed(warnings);
    }

    private Optional<SanitizationResult> checkDangerous(String query, String masked, List<String> warnings) {
        if (config.readOnly()) {
            Optional<String> write = WriteOperationDetector.findWrite(query);
            if (write.isPresent()) {
                return Optional.of(reject(ViolationType.WRITE_OPERATION,
                        "Blocked: write operation " + write.get() + " not allowed in read-only mode", warnings));
            }
        }
        for (PatternRule rule : SanitizerRules.DANGEROUS) {
            if (!rule.matches(masked)) {
                continue;
            }
            if (rule.group() == RuleGroup.ADMINISTRATIVE && config.allowAdministrativeProcedures()) {
                warnings.add("Administrative procedure permitted by configuration [" + rule.id() + "]: "
                        + rule.description());
                continue;
            }
            return Optional.of(reject(rule.group().violation(),
                    "Blocked: query contains dangerous pattern [" + rule.id() + "]: " + rule.description(),
                    warnings));
        }
        if (!delimitersBalanced(masked)) {
            return Optional.of(reject(ViolationType.UNBALANCED_DELIMITERS,
                    "Unbalanced parentheses, braces, or brackets detected", warnings));
        }
        return Optional.empty();
    }

    private Optional<SanitizationResult> checkSuspicious(String masked, List<String> warnings) {
        for (PatternRule rule : SanitizerRules.SUSPICIOUS) {
            if (!rule.matches(masked)) {
                continue;
            }
            if (rule.group() == RuleGroup.PROCEDURE_CALL && config.allowAdministrativeProcedures()) {
                continue;
            }
            if (rule.group() == RuleGroup.SCHEMA_CHANGE && config.allowSchemaChanges()) {
                continue;
            }
            if (config.strictMode()) {
                return Optional.of(reject(ViolationType.SUSPICIOUS_PATTERN,
                        "Blocked in strict mode: query contains suspicious pattern [" + rule.id() + "]: "
                                + rule.description(), warnings));
            }
            warnings.add("Query contains pattern that may need review [" + rule.id() + "]: " + rule.description());
        }
        return Optional.empty();
    }

    static boolean delimitersBalanced(String masked) {
        Deque<Character> stack = new ArrayDeque<>();
        for (int i = 0; i < masked.length(); i++) {
            char c = masked.charAt(i);
            switch (c) {
                case '(' -> stack.push(')');
                case '[' -> stack.push(']');
                case '{' -> stack.push('}');
                case ')', ']', '}' -> {
                    if (stack.isEmpty() || stack.pop() != c) {
                        return false;
                    }
                }
                default -> {
                }
            }
        }
        return stack.isEmpty();
    }

    private static SanitizationResult reject(ViolationType type, String error, List<String> warnings) {
        log.debug("sanitizer.rejected violation={}", type);
        return SanitizationResult.rejected(type, error, warnings);
    }
}
