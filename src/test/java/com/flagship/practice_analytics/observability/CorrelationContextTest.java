package com.flagship.practice_analytics.observability;

import com.flagship.practice_analytics.scope.AnalyticsScope;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.MDC;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationContextTest {

    @AfterEach
    void tearDown() {
        CorrelationContext.end();
    }

    @Test
    @DisplayName("A well-formed incoming id is kept and put in the MDC")
    void testIncomingIdKept() {
        String correlationId = CorrelationContext.begin(" req-123 ");

        assertEquals("req-123", correlationId);
        assertEquals("req-123", MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
        assertEquals("req-123", CorrelationContext.currentCorrelationId());
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "id with spaces", "line\nbreak", "<script>"})
    @DisplayName("Missing or unsafe incoming ids are replaced by a generated one")
    void testUnsafeIdReplaced(String requestedId) {
        String correlationId = CorrelationContext.begin(requestedId);

        assertNotEquals(requestedId, correlationId);
        assertEquals(8, correlationId.length());
        assertEquals(correlationId, CorrelationContext.currentCorrelationId());
    }

    @Test
    @DisplayName("Overlong incoming ids are replaced")
    void testOverlongIdReplaced() {
        String requestedId = "a".repeat(CorrelationContext.MAX_CORRELATION_ID_LENGTH + 1);

        assertNotEquals(requestedId, CorrelationContext.begin(requestedId));
    }

    @Test
    @DisplayName("Scope tag is the scope key and ending the request clears everything")
    void testScopeTagAndEnd() {
        UUID clientId = UUID.fromString("6f1d2c3b-0000-4000-8000-000000000001");
        CorrelationContext.begin("req-9");
        CorrelationContext.tagScope(AnalyticsScope.client(clientId));

        assertEquals(AnalyticsScope.client(clientId).key(), CorrelationContext.currentScope());

        CorrelationContext.end();

        assertNull(CorrelationContext.currentCorrelationId());
        assertNull(CorrelationContext.currentScope());
    }
}
