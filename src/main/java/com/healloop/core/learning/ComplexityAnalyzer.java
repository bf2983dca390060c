package com.healloop.core.learning;

import com.fasterxml.jackson.databind.JsonNode;
import com.healloop.core.llm.OracleCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Best-effort classification of how complex a user request is. Used as planner context
 * and to decide whether a success deserves a future-enhancement idea.
 */
@Service
public class ComplexityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ComplexityAnalyzer.class);

    private final OracleCall oracleCall;

    public ComplexityAnalyzer(OracleCall oracleCall) {
        this.oracleCall = oracleCall;
    }

    public ComplexityAnalysis analyze(String userRequest, String tool) {
        String prompt = """
                Analyze this user request and determine the required domains, the complexity
                level and whether the available tool is sufficient.

                Tool: %s
                User request: "%s"

                Return JSON only:
                {
                  "complexity": "simple|moderate|complex|very_complex",
                  "required_domains": ["domain1"],
                  "capabilities_sufficient": true,
                  "missing_capabilities": [],
                  "reasoning": "explanation of analysis"
                }
                """.formatted(tool, oracleCall.clip(userRequest));

        ComplexityAnalysis analysis = oracleCall.askJson("complexity analysis", prompt,
                ComplexityAnalyzer::interpret,
                () -> ComplexityAnalysis.unknown("Analysis unavailable"));
        log.debug("Request complexity for {}: {}", tool, analysis.complexity().wireValue());
        return analysis;
    }

    private static Optional<ComplexityAnalysis> interpret(JsonNode json) {
        if (!json.hasNonNull("complexity")) {
            return Optional.empty();
        }
        return Optional.of(new ComplexityAnalysis(
                ComplexityLevel.fromWire(json.path("complexity").asText()),
                strings(json.path("required_domains")),
                json.path("capabilities_sufficient").asBoolean(true),
                strings(json.path("missing_capabilities")),
                json.path("reasoning").asText("")));
    }

    private static List<String> strings(JsonNode node) {
        var values = new ArrayList<String>();
        if (node.isArray()) {
            node.forEach(n -> {
                if (n.isValueNode() && !n.asText().isBlank()) values.add(n.asText());
            });
        }
        return values;
    }
}
