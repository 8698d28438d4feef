package com.entityradar.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RiskScore(
        @JsonProperty("score") double score,
        @JsonProperty("label") RiskLevel label
) {
}
