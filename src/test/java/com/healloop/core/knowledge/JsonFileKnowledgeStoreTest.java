package com.healloop.core.knowledge;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileKnowledgeStoreTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private JsonFileKnowledgeStore store;

    @BeforeEach
    void setUp() {
        store = new JsonFileKnowledgeStore(dir.resolve("knowledge.json"), mapper);
    }

    @Test
    @DisplayName("Exact match wins over containment")
    void exactFirst() {
        store.addErrorSolution("timeout", "Increase timeout", Map.of());
        store.addErrorSolution("Read timeout on /search", "Paginate", Map.of());

        assertEquals("Paginate", store.findErrorSolution("Read timeout on /search").orElseThrow().solution());
    }

    @Test
    @DisplayName("Containment matches either way, ignoring case")
    void containment() {
        store.addErrorSolution("ImportError", "Add the import", Map.of());

        assertTrue(store.findErrorSolution("importerror: no module named csv").isPresent());
        assertTrue(store.findErrorSolution("IMPORT").isPresent());
        assertTrue(store.findErrorSolution("KeyError").isEmpty());
        assertTrue(store.findErrorSolution(" ").isEmpty());
    }

    @Test
    @DisplayName("Success rate defaults to 0.5 unless metadata carries one")
    void successRate() {
        assertEquals(0.5, store.addErrorSolution("a", "s", Map.of()).successRate());
        assertEquals(0.9, store.addErrorSolution("b", "s", Map.of(KnowledgeStore.SUCCESS_RATE, 0.9)).successRate());
        assertEquals(0.5, store.addErrorSolution("c", "s", Map.of(KnowledgeStore.SUCCESS_RATE, "high")).successRate());
    }

    @Test
    @DisplayName("A hand-written entry without success_rate reads as 0.5")
    void storedEntryWithoutRate() throws Exception {
        Files.writeString(dir.resolve("knowledge.json"), """
                {"KeyError: 'bucket'": {"pattern": "KeyError: 'bucket'", "solution": "Add bucket"}}
                """);

        var solution = store.findErrorSolution("KeyError: 'bucket'").orElseThrow();
        assertEquals(0.5, solution.successRate(), 1e-9);
        assertEquals("Add bucket", solution.solution());
    }

    @Test
    @DisplayName("updateSuccessRate persists and rejects unknown patterns")
    void update() {
        store.addErrorSolution("a", "s", Map.of("tool", "t"));
        store.updateSuccessRate("a", 0.95);

        var reopened = new JsonFileKnowledgeStore(dir.resolve("knowledge.json"), mapper);
        var solution = reopened.findErrorSolution("a").orElseThrow();
        assertEquals(0.95, solution.successRate());
        assertEquals("t", solution.metadata().get("tool"));
        assertThrows(IllegalArgumentException.class, () -> store.updateSuccessRate("zzz", 1.0));
    }

    @Test
    @DisplayName("A corrupt store file raises StoreException")
    void corrupt() throws Exception {
        Files.writeString(dir.resolve("knowledge.json"), "{not json");
        assertThrows(StoreException.class, () -> store.all());
    }
}
