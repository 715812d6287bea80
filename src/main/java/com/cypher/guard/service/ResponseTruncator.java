package com.cypher.guard.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.List;
import java.util.Map;

/**
 * Keeps responses within a token budget by dropping trailing rows.
 *
 * <p>Tokens are estimated as serialized JSON length divided by four.</p>
 */
public class ResponseTruncator {

    static final int CHARS_PER_TOKEN = 4;

    private final ObjectMapper objectMapper;
    private final int tokenLimit;

    /**
     * @param tokenLimit budget in tokens, 0 for unlimited
     */
    public ResponseTruncator(int tokenLimit) {
        this(new ObjectMapper().disable(SerializationFeature.FAIL_ON_EMPTY_BEANS), tokenLimit);
    }

    public ResponseTruncator(ObjectMapper objectMapper, int tokenLimit) {
        this.objectMapper = objectMapper;
        this.tokenLimit = tokenLimit;
    }

    /**
     * @param rows          rows kept
     * @param truncated     whether rows were dropped
     * @param originalCount rows before truncation
     * @param estimatedTokens token estimate of the kept rows
     */
    public record Truncation(List<Map<String, Object>> rows, boolean truncated, int originalCount,
                             int estimatedTokens) {
    }

    public Truncation truncate(List<Map<String, Object>> rows) {
        int tokens = estimateTokens(rows);
        if (tokenLimit <= 0 || tokens <= tokenLimit) {
            return new Truncation(rows, false, rows.size(), tokens);
        }
        // largest prefix that fits, found by bisection
        int low = 0;
        int high = rows.size();
        while (low < high) {
            int mid = (low + high + 1) / 2;
            if (estimateTokens(rows.subList(0, mid)) <= tokenLimit) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        List<Map<String, Object>> kept = List.copyOf(rows.subList(0, low));
        return new Truncation(kept, true, rows.size(), estimateTokens(kept));
    }

    int estimateTokens(Object value) {
        return (serializedLength(value) + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    private int serializedLength(Object value) {
        try {
            return objectMapper.writeValueAsString(value).length();
        } catch (JsonProcessingException e) {
            // values Jackson cannot serialize are sized by their string form
            return String.valueOf(value).length();
        }
    }
}
