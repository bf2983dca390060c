package com.healloop.core.contract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.healloop.core.learning.ComplexityAnalysis;
import com.healloop.core.llm.OracleCall;
import com.healloop.core.memory.MemorySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Negotiates an {@link ExecutionContract} with the oracle.
 * <p>
 * The oracle is asked for a fixed JSON schema. The answer must carry {@code tool},
 * {@code intent}, an {@code inputs} object and a {@code success_criteria} array;
 * anything else (including a failed call) yields {@link ExecutionContract#fallbackFor}.
 * This method never throws.
 */
@Service
public class ContractBuilder {

    private static final Logger log = LoggerFactory.getLogger(ContractBuilder.class);

    private static final String SCHEMA = """
            {
              "tool": "<tool name>",
              "intent": "<one sentence>",
              "inputs": {
                "required": ["<field>" or {"name": "<field>", "description": "..."}],
                "optional": ["<field>"],
                "final_payload": {"<field>": <value>}
              },
              "preconditions": ["..."],
              "success_criteria": ["..."],
              "post_validations": ["..."],
              "fallback_plan": ["..."],
              "execution_constraints": {
                "max_attempts": <int>,
                "max_duration_seconds": <number>,
                "max_payload_chars": <int>
              }
            }""";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {};

    private final OracleCall oracleCall;
    private final ObjectMapper objectMapper;

    public ContractBuilder(OracleCall oracleCall, ObjectMapper objectMapper) {
        this.oracleCall = oracleCall;
        this.objectMapper = objectMapper;
    }

    public ExecutionContract build(String userRequest, String tool, Map<String, Object> params,
                                   ComplexityAnalysis complexity, List<MemorySnapshot> recentMemory) {
        String prompt = buildPrompt(userRequest, tool, params, complexity, recentMemory);
        ExecutionContract contract = oracleCall.askJson("contract", prompt,
                json -> interpret(json, tool),
                () -> ExecutionContract.fallbackFor(tool, userRequest, params));
        if (contract.fallback()) {
            log.info("Using fallback contract for {} ({} required fields)", tool, contract.requiredFields().size());
        } else {
            log.info("Contract negotiated for {}: {}", tool, contract.intent());
        }
        return contract;
    }

    String buildPrompt(String userRequest, String tool, Map<String, Object> params,
                       ComplexityAnalysis complexity, List<MemorySnapshot> recentMemory) {
        var sb = new StringBuilder();
        sb.append("Plan an execution contract for a single tool invocation.\n\n");
        sb.append("User request: ").append(oracleCall.clip(userRequest)).append("\n");
        sb.append("Tool: ").append(tool).append("\n");
        sb.append("Parameters: ").append(oracleCall.clip(toJson(params))).append("\n");
        if (complexity != null) {
            sb.append("Complexity: ").append(complexity.complexity().wireValue());
            if (!complexity.requiredDomains().isEmpty()) {
                sb.append(" (domains: ").append(String.join(", ", complexity.requiredDomains())).append(")");
            }
            sb.append("\n");
        }
        if (recentMemory != null && !recentMemory.isEmpty()) {
            sb.append("\nRecent executions:\n");
            sb.append(recentMemory.stream().map(MemorySnapshot::toPromptLine).collect(Collectors.joining("\n")));
            sb.append("\n");
        }
        sb.append("\nList every field the tool needs under inputs.required. Put values you can ")
          .append("infer from the request into inputs.final_payload.\n");
        sb.append("Return JSON only, following this schema:\n").append(SCHEMA);
        return sb.toString();
    }

    private Optional<ExecutionContract> interpret(JsonNode json, String requestedTool) {
        JsonNode inputs = json.get("inputs");
        JsonNode criteria = json.get("success_criteria");
        if (!json.hasNonNull("tool") || !json.hasNonNull("intent")
                || inputs == null || !inputs.isObject()
                || criteria == null || !criteria.isArray()) {
            return Optional.empty();
        }
        String tool = json.get("tool").asText();
        if (!tool.equals(requestedTool)) {
            log.debug("Contract names tool '{}' but '{}' was requested", tool, requestedTool);
        }
        try {
            var contractInputs = new ContractInputs(
                    list(inputs.get("required")),
                    list(inputs.get("optional")),
                    map(inputs.get("final_payload")));
            return Optional.of(new ExecutionContract(
                    requestedTool,
                    json.get("intent").asText(),
                    contractInputs,
                    strings(json.get("preconditions")),
                    strings(criteria),
                    strings(json.get("post_validations")),
                    strings(json.get("fallback_plan")),
                    map(json.get("execution_constraints")),
                    false));
        } catch (IllegalArgumentException e) {
            log.warn("Contract fields could not be converted: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private List<Object> list(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        return objectMapper.convertValue(node, LIST_TYPE);
    }

    private Map<String, Object> map(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return objectMapper.convertValue(node, MAP_TYPE);
    }

    private static List<String> strings(JsonNode node) {
        var values = new ArrayList<String>();
        if (node != null && node.isArray()) {
            for (JsonNode item : node) {
                values.add(item.isValueNode() ? item.asText() : item.toString());
            }
        }
        return values;
    }

    private String toJson(Map<String, Object> params) {
        try {
            return objectMapper.writeValueAsString(params == null ? Map.of() : params);
        } catch (JsonProcessingException e) {
            return String.valueOf(params);
        }
    }
}
