package com.healloop.core.contract;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionContractTest {

    @Nested
    @DisplayName("Fallback contract")
    class Fallback {

        @Test
        @DisplayName("Every provided parameter is required and the payload passes through")
        void requiresEveryParameter() {
            var params = new LinkedHashMap<String, Object>();
            params.put("jql", "project = OPS");
            params.put("limit", 10);

            var contract = ExecutionContract.fallbackFor("jira_search_jql", "find ops tickets", params);

            assertTrue(contract.fallback());
            assertEquals("jira_search_jql", contract.tool());
            assertEquals(List.of("jql", "limit"), contract.requiredFields());
            assertEquals(params, contract.finalPayload(params));
            assertTrue(contract.missingFields(contract.finalPayload(params)).isEmpty());
            assertTrue(contract.executionConstraints().isEmpty());
            assertFalse(contract.successCriteria().isEmpty());
        }

        @Test
        @DisplayName("A provided but blank parameter is reported missing")
        void blankParameterMissing() {
            Map<String, Object> params = Map.of("jql", "  ");
            var contract = ExecutionContract.fallbackFor("jira_search_jql", "r", params);
            assertEquals(List.of("jql"), contract.missingFields(contract.finalPayload(params)));
        }

        @Test
        @DisplayName("Null params give an empty contract")
        void nullParams() {
            var contract = ExecutionContract.fallbackFor("t", null, null);
            assertTrue(contract.requiredFields().isEmpty());
            assertTrue(contract.finalPayload(null).isEmpty());
        }
    }

    @Test
    @DisplayName("requiredFields accepts strings and name objects, drops nameless entries")
    void requiredFieldShapes() {
        var inputs = new ContractInputs(
                List.of("format", Map.of("name", "table"), Map.of("description", "no name"), " "),
                List.of(), Map.of());
        var contract = new ExecutionContract("aws_export_data", "export", inputs,
                null, List.of("file exists"), null, null, null, false);

        assertEquals(List.of("format", "table"), contract.requiredFields());
    }

    @Test
    @DisplayName("finalPayload lets caller values win and contract values fill gaps")
    void finalPayloadMerge() {
        var inputs = new ContractInputs(List.of("format", "table"), List.of(),
                Map.of("format", "json", "table", "orders", "region", ""));
        var contract = new ExecutionContract("aws_export_data", "export", inputs,
                null, List.of(), null, null, null, false);

        var params = new LinkedHashMap<String, Object>();
        params.put("format", "csv");
        params.put("table", "");

        Map<String, Object> payload = contract.finalPayload(params);
        assertEquals("csv", payload.get("format"));
        assertEquals("orders", payload.get("table"));
        assertFalse(payload.containsKey("region"));
    }
}
