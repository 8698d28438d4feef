package com.entityradar.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Candidate archetypes plus {@link #UNKNOWN}. Declaration order is the archetype order used in score maps and
 * for stable ranking.
 */
public enum EntityType {
    CEX_HOT_WALLET("CEX Hot Wallet"),
    MEV_BOT("MEV Bot"),
    FUND_INSTITUTIONAL_WHALE("Fund/Institutional Whale"),
    INDIVIDUAL_WHALE("Individual Whale"),
    UNKNOWN("Unknown");

    private final String label;

    EntityType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isUnknown() {
        return this == UNKNOWN;
    }
}
