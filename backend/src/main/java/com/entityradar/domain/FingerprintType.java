package com.entityradar.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Labels of the fingerprint overlay. Declaration order is the ranking order on equal scores.
 * {@code scoreKey} names the entry in {@link EntityFingerprint#scores()}.
 */
public enum FingerprintType {
    CENTRALIZED_EXCHANGE("Centralized Exchange", "exchange_confidence_score"),
    MEV_SEARCHER("MEV Searcher", "mev_searcher_score"),
    BRIDGE("Bridge", "bridge_score"),
    PROTOCOL_ROUTER("Protocol Router", "protocol_router_score"),
    FUND_WHALE("Fund / Whale", "fund_score"),
    SMART_MONEY("Smart Money", "smart_money_score"),
    UNKNOWN("Unknown", null);

    private final String label;
    private final String scoreKey;

    FingerprintType(String label, String scoreKey) {
        this.label = label;
        this.scoreKey = scoreKey;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public String getScoreKey() {
        return scoreKey;
    }
}
