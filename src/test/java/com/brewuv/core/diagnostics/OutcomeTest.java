package com.brewuv.core.diagnostics;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutcomeTest {

    @Test
    void describesSuccessAndFailure() {
        assertEquals("file:UV17319.033:OK", Outcome.success("x", "file:UV17319.033").describe());
        assertEquals("eubrewnet:TIMEOUT(read timed out)",
                Outcome.failure(CauseCode.TIMEOUT, "eubrewnet", "read timed out").describe());
        assertEquals("cloud-service:NOT_CONFIGURED", Outcome.failure(CauseCode.NOT_CONFIGURED, "cloud-service").describe());
    }

    @Test
    void nullDetailsAreDropped() {
        Map<String, Object> details = new HashMap<>();
        details.put("message", "no file given");
        details.put("path", null);

        Outcome<String> outcome = Outcome.failure(CauseCode.FILE_MISSING, "file", details);

        assertFalse(outcome.success);
        assertEquals("no file given", outcome.message());
        assertFalse(outcome.details.containsKey("path"));
        assertTrue(Outcome.failure(CauseCode.NO_DATA, null).owner.isEmpty());
    }
}
