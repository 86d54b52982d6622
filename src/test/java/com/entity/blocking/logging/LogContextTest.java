package com.entity.blocking.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class LogContextTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void indexBuildContextSetsAndClearsKeys() {
        try (LogContext ctx = LogContext.forIndexBuild("run-1", "name")) {
            assertEquals("run-1", MDC.get("runId"));
            assertEquals("name", MDC.get("field"));
            assertEquals("index", MDC.get("phase"));
        }

        assertNull(MDC.get("runId"));
        assertNull(MDC.get("field"));
        assertNull(MDC.get("phase"));
    }

    @Test
    void diagnosticsContextWithExtraKey() {
        try (LogContext ctx = LogContext.forDiagnostics("run-2").with("dataset", "data1")) {
            assertEquals("diagnostics", MDC.get("phase"));
            assertEquals("data1", MDC.get("dataset"));
        }

        assertNull(MDC.get("dataset"));
        assertNull(MDC.get("phase"));
    }

    @Test
    void runIdsAreUnique() {
        assertNotEquals(LogContext.generateRunId(), LogContext.generateRunId());
    }
}
