package com.healloop.core.llm;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OracleResponseParserTest {

    private final OracleResponseParser parser = new OracleResponseParser();

    @Test
    @DisplayName("Prefers a json-fenced block over other fences")
    void prefersJsonFence() {
        String content = """
                Here is some shell:
                ```bash
                echo hi
                ```
                and the plan:
                ```json
                {"tool": "jira_search_jql"}
                ```
                """;
        JsonNode node = parser.parse(content);
        assertNotNull(node);
        assertEquals("jira_search_jql", node.get("tool").asText());
    }

    @Test
    @DisplayName("Falls back to any fenced block")
    void anyFence() {
        JsonNode node = parser.parse("```\n{\"a\": 1}\n```");
        assertNotNull(node);
        assertEquals(1, node.get("a").asInt());
    }

    @Test
    @DisplayName("Parses the raw trimmed string when there is no fence")
    void rawString() {
        JsonNode node = parser.parse("   {\"a\": [1, 2]}  ");
        assertNotNull(node);
        assertEquals(2, node.get("a").size());
    }

    @Test
    @DisplayName("Relaxed pass accepts comments, single quotes, unquoted names and trailing commas")
    void relaxedPass() {
        String content = """
                {
                  // planner comment
                  tool: 'aws_export_data',
                  'inputs': {"required": ["format",],},
                }
                """;
        JsonNode node = parser.parse(content);
        assertNotNull(node);
        assertEquals("aws_export_data", node.get("tool").asText());
        assertEquals("format", node.get("inputs").get("required").get(0).asText());
    }

    @Test
    @DisplayName("Prose around the object is tolerated")
    void proseAroundObject() {
        JsonNode node = parser.parse("Sure! {\"root_cause\": \"timeout\"} Hope this helps.");
        assertNotNull(node);
        assertEquals("timeout", node.get("root_cause").asText());
    }

    @Test
    @DisplayName("A leading scalar does not hide the object that follows")
    void leadingScalar() {
        JsonNode node = parser.parse("true, here it is: {\"root_cause\": \"timeout\"}");

        assertNotNull(node);
        assertTrue(node.isObject());
        assertEquals("timeout", node.path("root_cause").asText());
    }

    @Test
    @DisplayName("Unparseable or blank content yields null")
    void unparseable() {
        assertNull(parser.parse("I cannot help with that"));
        assertNull(parser.parse("   "));
        assertNull(parser.parse(null));
    }
}
