package com.healloop.core.knowledge;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link KnowledgeStore} persisted as a JSON object keyed by error pattern.
 */
public class JsonFileKnowledgeStore implements KnowledgeStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileKnowledgeStore.class);
    private static final TypeReference<LinkedHashMap<String, ErrorSolution>> MAP_TYPE = new TypeReference<>() {};

    private final Path storeFile;
    private final ObjectMapper objectMapper;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonFileKnowledgeStore(Path storeFile, ObjectMapper objectMapper) {
        this.storeFile = storeFile;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<ErrorSolution> findErrorSolution(String errorMessage) {
        if (errorMessage == null || errorMessage.isBlank()) {
            return Optional.empty();
        }
        lock.lock();
        try {
            Map<String, ErrorSolution> solutions = load();
            ErrorSolution exact = solutions.get(errorMessage);
            if (exact != null) {
                return Optional.of(exact);
            }
            String lower = errorMessage.toLowerCase(Locale.ROOT);
            return solutions.entrySet().stream()
                    .filter(e -> {
                        String pattern = e.getKey().toLowerCase(Locale.ROOT);
                        return lower.contains(pattern) || pattern.contains(lower);
                    })
                    .map(Map.Entry::getValue)
                    .findFirst();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ErrorSolution addErrorSolution(String pattern, String solution, Map<String, Object> metadata) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("pattern must not be blank");
        }
        double rate = metadata != null && metadata.get(SUCCESS_RATE) instanceof Number n
                ? n.doubleValue() : ErrorSolution.DEFAULT_SUCCESS_RATE;
        var entry = new ErrorSolution(pattern, solution, rate, metadata, Instant.now());
        lock.lock();
        try {
            var solutions = load();
            solutions.put(pattern, entry);
            save(solutions);
        } finally {
            lock.unlock();
        }
        log.info("Stored solution for error pattern '{}' (success rate {})", pattern, rate);
        return entry;
    }

    @Override
    public ErrorSolution updateSuccessRate(String pattern, double successRate) {
        lock.lock();
        try {
            var solutions = load();
            ErrorSolution existing = solutions.get(pattern);
            if (existing == null) {
                throw new IllegalArgumentException("No solution stored for pattern: " + pattern);
            }
            ErrorSolution updated = existing.withSuccessRate(successRate);
            solutions.put(pattern, updated);
            save(solutions);
            log.debug("Success rate for '{}' now {}", pattern, successRate);
            return updated;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ErrorSolution> all() {
        lock.lock();
        try {
            return new ArrayList<>(load().values());
        } finally {
            lock.unlock();
        }
    }

    private LinkedHashMap<String, ErrorSolution> load() {
        if (!Files.exists(storeFile)) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(storeFile.toFile(), MAP_TYPE);
        } catch (IOException e) {
            throw new StoreException("Cannot read knowledge store " + storeFile, e);
        }
    }

    private void save(Map<String, ErrorSolution> solutions) {
        try {
            Path parent = storeFile.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, "knowledge", ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), solutions);
            Files.move(temp, storeFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StoreException("Cannot write knowledge store " + storeFile, e);
        }
    }
}
