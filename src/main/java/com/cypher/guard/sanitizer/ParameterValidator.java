package com.cypher.guard.sanitizer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Validates query parameters: count, names, value sizes and injection markers in string values.
 * Collections and maps are checked recursively; their size is measured on the JSON form.
 */
final class ParameterValidator {

    private static final Pattern NAME = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");

    private static final List<Pattern> INJECTION_MARKERS = List.of(
            Pattern.compile(";\\s*\\w+"),
            Pattern.compile("\\b(MATCH|CREATE|MERGE|DELETE|DROP|CALL|LOAD)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("--"),
            Pattern.compile("/\\*")
    );

    private final ObjectMapper objectMapper;
    private final SanitizerConfig config;

    ParameterValidator(ObjectMapper objectMapper, SanitizerConfig config) {
        this.objectMapper = objectMapper;
        this.config = config;
    }

    Optional<SanitizationResult> validate(Map<String, ?> parameters, List<String> warnings) {
        if (parameters == null || parameters.isEmpty()) {
            return Optional.empty();
        }
        if (parameters.size() > config.maxParameters()) {
            return reject(ViolationType.TOO_MANY_PARAMETERS,
                    "Too many parameters (" + parameters.size() + "), maximum is " + config.maxParameters(),
                    warnings);
        }
        for (Map.Entry<String, ?> entry : parameters.entrySet()) {
            String name = entry.getKey();
            if (name == null || !NAME.matcher(name).matches()) {
                return reject(ViolationType.INVALID_PARAMETER_NAME, "Invalid parameter name: " + name, warnings);
            }
            Object value = entry.getValue();
            if (value instanceof String s && s.length() > config.maxParameterLength()) {
                return reject(ViolationType.PARAMETER_TOO_LONG,
                        "Parameter '" + name + "' value too long (" + s.length() + " chars)", warnings);
            }
            if (value instanceof Collection<?> || value instanceof Map<?, ?> || value instanceof Object[]) {
                try {
                    int size = objectMapper.writeValueAsString(value).length();
                    if (size > config.maxParameterLength()) {
                        return reject(ViolationType.PARAMETER_TOO_LONG,
                                "Parameter '" + name + "' structure too large (" + size + " chars)", warnings);
                    }
                } catch (JsonProcessingException e) {
                    return reject(ViolationType.INVALID_PARAMETER_VALUE,
                            "Parameter '" + name + "' contains invalid data: " + e.getOriginalMessage(), warnings);
                }
            }
            Optional<SanitizationResult> nested = inspectValue(name, value, warnings);
            if (nested.isPresent()) {
                return nested;
            }
        }
        return Optional.empty();
    }

    private Optional<SanitizationResult> inspectValue(String name, Object value, List<String> warnings) {
        if (value instanceof String s) {
            Optional<UnicodeInspector.Finding> finding = UnicodeInspector.inspectValue(s);
            if (finding.isPresent()) {
                return reject(finding.get().type(),
                        "Parameter '" + name + "': " + finding.get().message(), warnings);
            }
            for (Pattern marker : INJECTION_MARKERS) {
                if (marker.matcher(s).find()) {
                    return reject(ViolationType.PARAMETER_INJECTION,
                            "Potential injection in parameter '" + name + "'", warnings);
                }
            }
        } else if (value instanceof Collection<?> items) {
            for (Object item : items) {
                Optional<SanitizationResult> nested = inspectValue(name, item, warnings);
                if (nested.isPresent()) {
                    return nested;
                }
            }
        } else if (value instanceof Object[] items) {
            return inspectValue(name, Arrays.asList(items), warnings);
        } else if (value instanceof Map<?, ?> map) {
            for (Object item : map.values()) {
                Optional<SanitizationResult> nested = inspectValue(name, item, warnings);
                if (nested.isPresent()) {
                    return nested;
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<SanitizationResult> reject(ViolationType type, String error, List<String> warnings) {
        return Optional.of(SanitizationResult.rejected(type, error, warnings));
    }
}
