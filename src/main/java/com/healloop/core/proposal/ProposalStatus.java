package com.healloop.core.proposal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of an {@link EnhancementProposal}. Only {@link #PENDING} proposals can be
 * applied or rejected.
 */
public enum ProposalStatus {
    PENDING,
    AUTO_APPLIED,
    APPLIED,
    REJECTED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ProposalStatus fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
