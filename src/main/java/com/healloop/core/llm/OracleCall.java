package com.healloop.core.llm;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The single ask → validate → fallback path shared by every oracle call site.
 * <p>
 * Each call is bounded by {@code healloop.llm.timeout-seconds}. Any failure along the
 * way (timeout, empty content, unparseable JSON, or an interpreter that rejects the
 * shape) yields the caller's fallback instead of an exception.
 */
@Service
public class OracleCall {

    private static final Logger log = LoggerFactory.getLogger(OracleCall.class);

    private final Oracle oracle;
    private final OracleResponseParser parser;
    private final LlmProperties properties;
    private final ExecutorService executor;

    public OracleCall(Oracle oracle, OracleResponseParser parser, LlmProperties properties) {
        this.oracle = oracle;
        this.parser = parser;
        this.properties = properties;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "oracle-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Asks the oracle for a JSON object and hands it to {@code interpreter}.
     *
     * @param purpose     short label used in logs (e.g. "contract", "patch plan")
     * @param prompt      the full prompt text
     * @param interpreter maps the parsed JSON to a value; an empty result means the shape was rejected
     * @param fallback    supplies the value returned on any failure
     */
    public <T> T askJson(String purpose, String prompt,
                         Function<JsonNode, Optional<T>> interpreter, Supplier<T> fallback) {
        try {
            String content = invokeWithTimeout(prompt);
            JsonNode json = parser.parse(content);
            if (json == null || !json.isObject()) {
                log.warn("Oracle {} response was not a JSON object, using fallback", purpose);
                return fallback.get();
            }
            Optional<T> value = interpreter.apply(json);
            if (value.isEmpty()) {
                log.warn("Oracle {} response failed schema checks, using fallback", purpose);
                return fallback.get();
            }
            return value.get();
        } catch (Exception e) {
            log.warn("Oracle {} call failed, using fallback: {}", purpose, e.getMessage());
            return fallback.get();
        }
    }

    /**
     * Asks the oracle for advisory prose. Empty when the call fails or returns nothing.
     */
    public Optional<String> askText(String purpose, String prompt) {
        try {
            String content = invokeWithTimeout(prompt);
            return Optional.ofNullable(content).map(String::trim).filter(s -> !s.isEmpty());
        } catch (Exception e) {
            log.warn("Oracle {} call failed: {}", purpose, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Truncates context text to the configured prompt budget.
     */
    public String clip(String text) {
        if (text == null) {
            return "";
        }
        int max = properties.getContextChars();
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }

    String invokeWithTimeout(String prompt) {
        Future<String> future = executor.submit(() -> oracle.invoke(prompt));
        try {
            return future.get(properties.getTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new LlmTimeoutException("Oracle did not answer within "
                    + properties.getTimeoutSeconds() + "s", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new LlmParseException("Oracle call failed: " + cause, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new LlmTimeoutException("Interrupted while waiting for oracle", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
