package com.healloop.core.engine;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.healloop.core.proposal.EnhancementProposal;
import com.healloop.core.scoring.RiskLevel;

import java.util.List;

/**
 * The part of a registered proposal a caller needs to decide what to do next.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProposalSummary(
    String id,
    String summary,
    List<String> files,
    String testPlan,
    double confidence,
    RiskLevel riskLevel
) {
    public static ProposalSummary of(EnhancementProposal proposal) {
        return new ProposalSummary(proposal.id(), proposal.summary(), proposal.plan().paths(),
                proposal.testPlan(), proposal.confidence(), proposal.riskLevel());
    }
}
