package com.healloop.core.proposal;

import java.util.List;
import java.util.Optional;

/**
 * Owns enhancement proposals and is the only component that mutates source files.
 */
public interface ProposalRegistry {

    EnhancementProposal registerProposal(EnhancementProposal proposal);

    Optional<EnhancementProposal> getProposal(String id);

    /** All proposals, newest first; {@code status} may be null for no filter. */
    List<EnhancementProposal> listEnhancements(ProposalStatus status);

    /**
     * Applies a pending proposal's patch and marks it applied.
     *
     * @throws ProposalNotFoundException when {@code id} is unknown
     * @throws PatchApplicationException when the patch cannot be applied; the proposal stays pending
     */
    EnhancementProposal applyProposal(String id);

    /** Marks an applied proposal as applied by the auto-fix gate. */
    EnhancementProposal markAutoApplied(String id);

    /** Rejects a pending proposal. */
    EnhancementProposal rejectProposal(String id, String reason);
}
