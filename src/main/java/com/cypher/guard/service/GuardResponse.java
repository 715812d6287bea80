package com.cypher.guard.service;

import com.cypher.guard.error.ErrorKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a guarded operation. Exactly one of {@code data} and {@code error} is set.
 *
 * @param success   whether the operation completed
 * @param data      result rows or analysis, when successful
 * @param error     caller-safe error message, when not
 * @param errorKind category of the failure, when not successful
 * @param warnings  non-fatal findings of the guard stages
 * @param metadata  extra facts such as row counts, retry-after or complexity breakdown
 */
public record GuardResponse(
        boolean success,
        Object data,
        String error,
        ErrorKind errorKind,
        List<String> warnings,
        Map<String, Object> metadata
) {
    public GuardResponse {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
        if (success && errorKind != null) {
            throw new IllegalArgumentException("successful response cannot carry an error kind");
        }
        if (!success && errorKind == null) {
            throw new IllegalArgumentException("failed response requires an error kind");
        }
    }

    public static GuardResponse success(Object data, List<String> warnings, Map<String, Object> metadata) {
        return new GuardResponse(true, data, null, null, warnings, metadata);
    }

    public static GuardResponse failure(ErrorKind kind, String error, List<String> warnings,
                                        Map<String, Object> metadata) {
        return new GuardResponse(false, null, error, kind, warnings, metadata);
    }

    /**
     * Plain map form, as returned by tool handlers.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("success", success);
        if (success) {
            map.put("data", data);
        } else {
            map.put("error", error);
            map.put("error_kind", errorKind.name());
        }
        if (!warnings.isEmpty()) {
            map.put("warnings", warnings);
        }
        if (!metadata.isEmpty()) {
            map.put("metadata", metadata);
        }
        return map;
    }
}
