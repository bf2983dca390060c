package com.healloop.core.llm;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a JSON document from free-form oracle content.
 * <p>
 * Extraction order: a {@code ```json} fenced block, then any fenced block, then the raw
 * trimmed string. The candidate is parsed strictly first (a single document, nothing
 * trailing) and then with a lenient mapper
 * (comments, single quotes, unquoted names, trailing commas). Returns {@code null} when
 * nothing parses.
 */
@Component
public class OracleResponseParser {

    private static final Logger log = LoggerFactory.getLogger(OracleResponseParser.class);

    private static final Pattern JSON_FENCE = Pattern.compile("```json\\s*(.*?)```", Pattern.DOTALL);
    private static final Pattern ANY_FENCE = Pattern.compile("```[A-Za-z0-9_-]*\\s*(.*?)```", Pattern.DOTALL);

    private final ObjectMapper strictMapper = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();
    private final ObjectMapper lenientMapper = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS)
            .build();

    public JsonNode parse(String content) {
        if (content == null || content.isBlank()) {
            return null;
        }
        String candidate = extract(content);
        try {
            return strictMapper.readTree(candidate);
        } catch (Exception strictFailure) {
            log.debug("Strict JSON parse failed: {}", strictFailure.getMessage());
        }
        try {
            return lenientMapper.readTree(braced(candidate));
        } catch (Exception lenientFailure) {
            log.warn("Oracle response is not parseable JSON ({} chars): {}",
                    content.length(), lenientFailure.getMessage());
            return null;
        }
    }

    String extract(String content) {
        Matcher json = JSON_FENCE.matcher(content);
        if (json.find()) {
            return json.group(1).trim();
        }
        Matcher any = ANY_FENCE.matcher(content);
        if (any.find()) {
            return any.group(1).trim();
        }
        return content.trim();
    }

    // Prose around the object is common; keep only the outermost braces.
    private static String braced(String candidate) {
        if (candidate.startsWith("{") || candidate.startsWith("[")) {
            return candidate;
        }
        int start = candidate.indexOf('{');
        int end = candidate.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return candidate.substring(start, end + 1);
        }
        return candidate;
    }
}
