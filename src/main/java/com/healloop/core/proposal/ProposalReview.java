package com.healloop.core.proposal;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Oracle opinion on a pending proposal. Advisory only; it never changes the proposal.
 *
 * @param recommendation approve, reject, modify or review_manually
 * @param riskLevel      the reviewer's own risk estimate
 * @param concerns       problems spotted in the change
 * @param suggestions    improvements to consider before applying
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProposalReview(
    String proposalId,
    String recommendation,
    String riskLevel,
    List<String> concerns,
    List<String> suggestions
) {
    public ProposalReview {
        concerns = concerns == null ? List.of() : List.copyOf(concerns);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public static ProposalReview manual(String proposalId, String note) {
        return new ProposalReview(proposalId, "review_manually", "unknown", List.of(note), List.of());
    }
}
