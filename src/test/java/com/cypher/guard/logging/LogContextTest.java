package com.cypher.guard.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forRequest should set requestId, operation and sessionId in MDC")
    void forRequestSetsMDC() {
        try (LogContext ctx = LogContext.forRequest("req-1", "execute_cypher", "session-9")) {
            assertEquals("req-1", MDC.get("requestId"));
            assertEquals("execute_cypher", MDC.get("operation"));
            assertEquals("session-9", MDC.get("sessionId"));
        }
    }

    @Test
    @DisplayName("forRequest should skip a missing session")
    void forRequestWithoutSession() {
        try (LogContext ctx = LogContext.forRequest("req-1", "query_graph", null)) {
            assertNull(MDC.get("sessionId"));
        }
    }

    @Test
    @DisplayName("forAnalysis should set the analysis mode")
    void forAnalysisSetsMDC() {
        try (LogContext ctx = LogContext.forAnalysis("req-2", "PROFILE")) {
            assertEquals("req-2", MDC.get("requestId"));
            assertEquals("analyze", MDC.get("operation"));
            assertEquals("PROFILE", MDC.get("analysisMode"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forRequest("req-1", "execute_cypher", "s").with("clientId", "alice");
        assertEquals("alice", MDC.get("clientId"));

        ctx.close();

        assertNull(MDC.get("requestId"));
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("sessionId"));
        assertNull(MDC.get("clientId"));
    }

    @Test
    @DisplayName("Closing a nested context should restore the enclosing values")
    void nestedContextRestoresOuterValues() {
        try (LogContext outer = LogContext.forRequest("req-outer", "analyze_query_performance", null)) {
            try (LogContext inner = LogContext.forAnalysis("req-inner", "EXPLAIN")) {
                assertEquals("req-inner", MDC.get("requestId"));
                assertEquals("analyze", MDC.get("operation"));
            }
            assertEquals("req-outer", MDC.get("requestId"));
            assertEquals("analyze_query_performance", MDC.get("operation"));
            assertNull(MDC.get("analysisMode"));
        }
        assertNull(MDC.get("requestId"));
    }

    @Test
    @DisplayName("generateRequestId should produce unique ids")
    void generateRequestIdUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateRequestId());
        }
        assertEquals(100, ids.size());
    }
}
