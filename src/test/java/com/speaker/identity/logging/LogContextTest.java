package com.speaker.identity.logging;

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
    @DisplayName("forAssignment should set channelId and operation in MDC")
    void forAssignmentSetsMDC() {
        try (LogContext ctx = LogContext.forAssignment("mic-1")) {
            assertEquals("mic-1", MDC.get("channelId"));
            assertEquals("assign", MDC.get("operation"));
            assertNull(MDC.get("correlationId"));
        }
    }

    @Test
    @DisplayName("forReplay should set correlationId, channelId, fromIndex and operation in MDC")
    void forReplaySetsMDC() {
        try (LogContext ctx = LogContext.forReplay("mic-2", 7)) {
            assertNotNull(MDC.get("correlationId"));
            assertEquals("mic-2", MDC.get("channelId"));
            assertEquals("7", MDC.get("fromIndex"));
            assertEquals("replay", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forEnrollment should set correlationId, channelId and operation in MDC")
    void forEnrollmentSetsMDC() {
        try (LogContext ctx = LogContext.forEnrollment("mic-3")) {
            assertNotNull(MDC.get("correlationId"));
            assertEquals("mic-3", MDC.get("channelId"));
            assertEquals("enrollment", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forReplay("mic-1", 0);
        assertNotNull(MDC.get("correlationId"));

        ctx.close();

        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("channelId"));
        assertNull(MDC.get("fromIndex"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("with() should add additional keys to MDC")
    void withAddsKeys() {
        try (LogContext ctx = LogContext.forAssignment("mic-1").with("speakerId", "3")) {
            assertEquals("3", MDC.get("speakerId"));
        }
        assertNull(MDC.get("speakerId"));
        assertNull(MDC.get("channelId"));
    }

    @Test
    @DisplayName("generateCorrelationId should return unique UUIDs")
    void generateCorrelationIdReturnsUniqueIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size());
        assertTrue(LogContext.generateCorrelationId()
                .matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}"));
    }

    @Test
    @DisplayName("Closing an inner context should restore the outer values")
    void nestedContexts() {
        try (LogContext outer = LogContext.forAssignment("mic-1")) {
            try (LogContext inner = LogContext.forReplay("mic-1", 4).with("source", "store")) {
                assertEquals("replay", MDC.get("operation"));
                assertEquals("store", MDC.get("source"));
                assertNotNull(MDC.get("correlationId"));
            }
            assertEquals("assign", MDC.get("operation"));
            assertEquals("mic-1", MDC.get("channelId"));
            assertNull(MDC.get("source"));
            assertNull(MDC.get("correlationId"));
        }
        assertNull(MDC.get("channelId"));
        assertNull(MDC.get("operation"));
    }
}
