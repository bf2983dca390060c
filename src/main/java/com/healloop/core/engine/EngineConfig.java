package com.healloop.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.healloop.core.knowledge.JsonFileKnowledgeStore;
import com.healloop.core.knowledge.KnowledgeStore;
import com.healloop.core.learning.FailurePattern;
import com.healloop.core.memory.BoundedHistory;
import com.healloop.core.memory.ExecutionMemory;
import com.healloop.core.memory.RecommendationLog;
import com.healloop.core.proposal.JsonFileProposalRegistry;
import com.healloop.core.proposal.PatchApplier;
import com.healloop.core.proposal.ProposalRegistry;
import com.healloop.core.proposal.StoreProperties;
import com.healloop.core.telemetry.TelemetryRecorder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class EngineConfig {

    @Bean
    public TelemetryRecorder telemetryRecorder(EngineProperties properties) {
        return new TelemetryRecorder(properties.getTelemetryCapacity());
    }

    @Bean
    public BoundedHistory<FailurePattern> failurePatternHistory(EngineProperties properties) {
        return new BoundedHistory<>(properties.getFailureHistoryCapacity());
    }

    @Bean
    public ExecutionMemory executionMemory(EngineProperties properties) {
        return new ExecutionMemory(properties.getMemoryCapacity());
    }

    @Bean
    public RecommendationLog recommendationLog(EngineProperties properties) {
        return new RecommendationLog(properties.getRecommendationCapacity());
    }

    @Bean
    public PatchApplier patchApplier(StoreProperties properties) {
        return new PatchApplier(Path.of(properties.getProposals().getWorkspaceRoot()));
    }

    /**
     * File-backed default; declare another {@link ProposalRegistry} bean to replace it.
     */
    @Bean
    @ConditionalOnMissingBean(ProposalRegistry.class)
    public ProposalRegistry proposalRegistry(StoreProperties properties, PatchApplier applier,
                                             ObjectMapper objectMapper) {
        return new JsonFileProposalRegistry(Path.of(properties.getProposals().getStoreFile()), applier, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean(KnowledgeStore.class)
    public KnowledgeStore knowledgeStore(StoreProperties properties, ObjectMapper objectMapper) {
        return new JsonFileKnowledgeStore(Path.of(properties.getKnowledge().getStoreFile()), objectMapper);
    }
}
