package com.healloop.core.patch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.healloop.core.llm.OracleCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a failure into a file-level {@link PatchPlan} via the oracle.
 * <p>
 * Any call failure, missing field or file operation that breaks the payload rules
 * (replace without search/replace, create/append without content) rejects the whole plan.
 */
@Service
public class PatchProposer {

    private static final Logger log = LoggerFactory.getLogger(PatchProposer.class);

    private static final String SCHEMA = """
            {
              "summary": "<short summary of the fix>",
              "reason": "<why the fix is needed>",
              "files": [
                {"path": "<relative path>", "operation": "replace", "description": "...",
                 "search": "<exact existing text>", "replace": "<new text>"},
                {"path": "<relative path>", "operation": "create", "description": "...", "content": "<file content>"},
                {"path": "<relative path>", "operation": "append", "description": "...", "content": "<text to append>"}
              ],
              "test_plan": "<how to verify the fix>"
            }""";

    private final OracleCall oracleCall;
    private final ObjectMapper objectMapper;

    public PatchProposer(OracleCall oracleCall, ObjectMapper objectMapper) {
        this.oracleCall = oracleCall;
        this.objectMapper = objectMapper;
    }

    /**
     * @param trigger what ended the execution ("attempts_exhausted", "guardrail_breach", ...)
     * @param request the user request
     * @param tool    the failing tool
     * @param error   final error text
     * @param context failure context (analysis, payload, telemetry)
     */
    public Optional<PatchPlan> propose(String trigger, String request, String tool, String error,
                                       Map<String, Object> context) {
        String prompt = """
                A tool invocation failed and could not recover. Propose a minimal code patch that
                fixes the underlying problem. Use "replace" only with text that appears exactly
                once in the target file.

                Trigger: %s
                User request: %s
                Tool: %s
                Error: %s
                Context: %s

                Return JSON only, following this schema:
                %s
                """.formatted(trigger, oracleCall.clip(request), tool, oracleCall.clip(error),
                oracleCall.clip(toJson(context)), SCHEMA);

        PatchPlan plan = oracleCall.askJson("patch plan", prompt, PatchProposer::interpret, () -> null);
        if (plan == null) {
            log.info("No patch plan produced for {} ({})", tool, trigger);
            return Optional.empty();
        }
        log.info("Patch plan for {}: '{}' touching {}", tool, plan.summary(), plan.paths());
        return Optional.of(plan);
    }

    /**
     * Asks for a forward-looking improvement after a slow or complex success. Advisory
     * only; never turned into a patch.
     */
    public Optional<String> suggestFutureEnhancement(String request, String tool, String reason) {
        String prompt = """
                The following request succeeded, but it was %s.
                Suggest one concrete enhancement to the tool or its surrounding workflow that would
                make similar requests faster or simpler next time. Answer in 2-4 sentences.

                User request: %s
                Tool: %s
                """.formatted(reason, oracleCall.clip(request), tool);
        return oracleCall.askText("future enhancement", prompt);
    }

    static Optional<PatchPlan> interpret(JsonNode json) {
        JsonNode files = json.get("files");
        if (!json.hasNonNull("summary") || files == null || !files.isArray() || files.isEmpty()) {
            return Optional.empty();
        }
        var changes = new ArrayList<FileChange>();
        for (JsonNode file : files) {
            Optional<FileChange> change = toChange(file);
            if (change.isEmpty()) {
                log.warn("Rejecting patch plan: invalid file operation {}", file);
                return Optional.empty();
            }
            changes.add(change.get());
        }
        return Optional.of(new PatchPlan(
                json.get("summary").asText(),
                json.path("reason").asText(""),
                changes,
                json.path("test_plan").asText("")));
    }

    private static Optional<FileChange> toChange(JsonNode file) {
        if (!file.isObject()) {
            return Optional.empty();
        }
        String path = text(file, "path");
        String description = file.path("description").asText("");
        Optional<PatchOperation> operation = PatchOperation.fromWire(text(file, "operation"));
        if (operation.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(switch (operation.get()) {
                case REPLACE -> new FileChange.Replace(path, description, text(file, "search"), text(file, "replace"));
                case CREATE -> new FileChange.Create(path, description, text(file, "content"));
                case APPEND -> new FileChange.Append(path, description, text(file, "content"));
            });
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() || !value.isValueNode() ? null : value.asText();
    }

    private String toJson(Map<String, Object> context) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(context == null ? Map.of() : context);
        } catch (JsonProcessingException e) {
            return String.valueOf(context);
        }
    }
}
