package com.healloop.core.learning;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.healloop.core.llm.OracleCall;
import com.healloop.core.llm.ScriptedOracle;
import com.healloop.core.memory.BoundedHistory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FailureAnalyzerTest {

    private OracleCall call;
    private final BoundedHistory<FailurePattern> history = new BoundedHistory<>(10);

    private FailureAnalyzer analyzer(ScriptedOracle oracle) {
        call = oracle.toCall();
        return new FailureAnalyzer(call, history, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        call.shutdown();
    }

    @Test
    @DisplayName("Interprets the oracle's diagnosis")
    void diagnosis() {
        var oracle = new ScriptedOracle().respond(ScriptedOracle.FAILURE, """
                {"root_cause": "Token expired", "fix_type": "config",
                 "suggested_fix": "Refresh the token", "prevention": "Rotate tokens"}
                """);

        FailureAnalysis analysis = analyzer(oracle).analyze("jira_search_jql", "401 Unauthorized", Map.of("attempt", 1));

        assertEquals("Token expired", analysis.rootCause());
        assertEquals(FixType.CONFIG, analysis.fixType());
        assertEquals(1, analysis.recurrenceCount());
        assertFalse(analysis.recurring());
    }

    @Test
    @DisplayName("Oracle failure degrades to the unavailable analysis")
    void unavailable() {
        FailureAnalysis analysis = analyzer(new ScriptedOracle()).analyze("t", "boom", Map.of());
        assertEquals("Unknown", analysis.rootCause());
        assertEquals(FixType.UNKNOWN, analysis.fixType());
        assertEquals("Manual investigation required", analysis.suggestedFix());
    }

    @Test
    @DisplayName("An answer without root_cause is rejected")
    void missingRootCause() {
        var oracle = new ScriptedOracle().respond(ScriptedOracle.FAILURE, "{\"fix_type\": \"code\"}");
        assertEquals(FixType.UNKNOWN, analyzer(oracle).analyze("t", "boom", Map.of()).fixType());
    }

    @Test
    @DisplayName("Recurrence counts identical (tool, error) pairs, even while the oracle is down")
    void recurrence() {
        var analyzer = analyzer(new ScriptedOracle());
        analyzer.analyze("t", "boom", Map.of("attempt", 1));
        analyzer.analyze("t", "other", Map.of("attempt", 2));
        analyzer.analyze("u", "boom", Map.of("attempt", 1));
        FailureAnalysis third = analyzer.analyze("t", "boom", Map.of("attempt", 3));

        assertEquals(2, third.recurrenceCount());
        assertTrue(third.recurring());
        assertEquals(3, analyzer.failureCount("t"));
        assertEquals(4, history.size());
        assertEquals(3, history.latest(1).get(0).attempt());
    }

    @Test
    @DisplayName("suggestAlternative returns advisory prose or empty")
    void alternative() {
        var oracle = new ScriptedOracle().respond(ScriptedOracle.ALTERNATIVE, "Use the REST search endpoint instead.");
        assertEquals(Optional.of("Use the REST search endpoint instead."),
                analyzer(oracle).suggestAlternative("find tickets", "jira_search_jql", "timeout"));
        call.shutdown();
        assertTrue(analyzer(new ScriptedOracle()).suggestAlternative("r", "t", "e").isEmpty());
    }
}
