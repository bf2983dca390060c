package com.healloop.core.proposal;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.healloop.core.patch.FileChange;
import com.healloop.core.patch.PatchPlan;
import com.healloop.core.scoring.FixAssessment;
import com.healloop.core.scoring.RiskLevel;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A scored patch plan waiting for (or past) a human or automatic decision.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EnhancementProposal(
    String id,
    String trigger,
    String userRequest,
    String tool,
    String error,
    Map<String, Object> analysis,
    String summary,
    String reason,
    List<FileChange> files,
    String testPlan,
    Map<String, Object> metadata,
    double confidence,
    RiskLevel riskLevel,
    ProposalStatus status,
    Instant createdAt,
    Instant appliedAt
) {
    public EnhancementProposal {
        analysis = analysis == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(analysis));
        files = files == null ? List.of() : List.copyOf(files);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /** A new pending proposal with a fresh id. */
    public static EnhancementProposal pending(String trigger, String userRequest, String tool, String error,
                                              Map<String, Object> analysis, PatchPlan plan,
                                              FixAssessment assessment, Map<String, Object> metadata) {
        return new EnhancementProposal(
                UUID.randomUUID().toString().substring(0, 8),
                trigger, userRequest, tool, error, analysis,
                plan.summary(), plan.reason(), plan.files(), plan.testPlan(),
                metadata, assessment.confidence(), assessment.riskLevel(),
                ProposalStatus.PENDING, Instant.now(), null);
    }

    public PatchPlan plan() {
        return new PatchPlan(summary, reason, files, testPlan);
    }

    /** The text a knowledge-store lookup should match: the error, or the reason when there is none. */
    public String errorPattern() {
        return error != null && !error.isBlank() ? error : reason;
    }

    public EnhancementProposal withStatus(ProposalStatus newStatus, Instant when) {
        return new EnhancementProposal(id, trigger, userRequest, tool, error, analysis, summary, reason,
                files, testPlan, metadata, confidence, riskLevel, newStatus, createdAt, when);
    }

    public EnhancementProposal withMetadata(String key, Object value) {
        var updated = new LinkedHashMap<>(metadata);
        updated.put(key, value);
        return new EnhancementProposal(id, trigger, userRequest, tool, error, analysis, summary, reason,
                files, testPlan, updated, confidence, riskLevel, status, createdAt, appliedAt);
    }
}
