package com.cypher.guard.service;

import com.cypher.guard.error.ErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResponseTruncator Tests")
class ResponseTruncatorTest {

    private static List<Map<String, Object>> rows(int count) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            rows.add(Map.of("name", "person-" + i));
        }
        return rows;
    }

    @Nested
    @DisplayName("Truncation")
    class Truncation {

        @Test
        @DisplayName("Should keep everything within the budget")
        void shouldKeepRowsWithinBudget() {
            ResponseTruncator.Truncation result = new ResponseTruncator(10_000).truncate(rows(10));

            assertFalse(result.truncated());
            assertEquals(10, result.rows().size());
            assertEquals(10, result.originalCount());
        }

        @Test
        @DisplayName("Should keep the largest prefix that fits")
        void shouldKeepLargestPrefix() {
            ResponseTruncator truncator = new ResponseTruncator(40);
            List<Map<String, Object>> all = rows(50);

            ResponseTruncator.Truncation result = truncator.truncate(all);

            assertTrue(result.truncated());
            assertEquals(50, result.originalCount());
            int kept = result.rows().size();
            assertTrue(kept > 0 && kept < 50);
            assertEquals(all.subList(0, kept), result.rows());
            assertTrue(result.estimatedTokens() <= 40);
            assertTrue(truncator.estimateTokens(all.subList(0, kept + 1)) > 40);
        }

        @Test
        @DisplayName("Should never truncate with an unlimited budget")
        void shouldNotTruncateWhenUnlimited() {
            ResponseTruncator.Truncation result = new ResponseTruncator(0).truncate(rows(1000));

            assertFalse(result.truncated());
            assertEquals(1000, result.rows().size());
        }

        @Test
        @DisplayName("Should estimate tokens from serialized length")
        void shouldEstimateTokens() {
            ResponseTruncator truncator = new ResponseTruncator(100);

            // {"a":"bcd"} is 11 characters
            assertEquals(3, truncator.estimateTokens(Map.of("a", "bcd")));
            assertEquals(1, truncator.estimateTokens(List.of()));
        }
    }

    @Nested
    @DisplayName("GuardResponse")
    class Responses {

        @Test
        @DisplayName("Should render a success without error fields")
        void shouldRenderSuccess() {
            GuardResponse response = GuardResponse.success(List.of(Map.of("x", 1)), List.of("note"),
                    Map.of("row_count", 1));

            Map<String, Object> map = response.toMap();

            assertEquals(true, map.get("success"));
            assertEquals(List.of(Map.of("x", 1)), map.get("data"));
            assertEquals(List.of("note"), map.get("warnings"));
            assertFalse(map.containsKey("error"));
        }

        @Test
        @DisplayName("Should render a failure with its kind")
        void shouldRenderFailure() {
            Map<String, Object> map = GuardResponse.failure(ErrorKind.RATE_LIMIT, "Rate limit exceeded", null, null)
                    .toMap();

            assertEquals(false, map.get("success"));
            assertEquals("RATE_LIMIT", map.get("error_kind"));
            assertFalse(map.containsKey("data"));
            assertFalse(map.containsKey("warnings"));
            assertFalse(map.containsKey("metadata"));
        }

        @Test
        @DisplayName("Should reject inconsistent outcomes")
        void shouldRejectInconsistentOutcomes() {
            assertThrows(IllegalArgumentException.class,
                    () -> new GuardResponse(true, null, null, ErrorKind.ENGINE, null, null));
            assertThrows(IllegalArgumentException.class,
                    () -> new GuardResponse(false, null, "boom", null, null, null));
        }
    }
}
