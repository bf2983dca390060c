package com.healloop.core.proposal;

public class ProposalNotFoundException extends RuntimeException {
    public ProposalNotFoundException(String id) {
        super("Proposal not found: " + id);
    }
}
