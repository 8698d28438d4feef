package com.entityradar.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RiskProfile(
        @JsonProperty("market_impact_risk") RiskScore marketImpactRisk,
        @JsonProperty("counterparty_risk") RiskScore counterpartyRisk,
        @JsonProperty("behavioral_risk") RiskScore behavioralRisk
) {
}
