package com.entityradar.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Certainty about a {@link Classification}. Reasons are ordered and de-duplicated so identical input yields
 * identical output.
 */
public record ConfidenceResult(
        @JsonProperty("confidence_score") double confidenceScore,
        @JsonProperty("confidence_reasons") List<String> confidenceReasons
) {

    public ConfidenceResult {
        confidenceReasons = confidenceReasons == null ? List.of() : List.copyOf(new LinkedHashSet<>(confidenceReasons));
    }
}
