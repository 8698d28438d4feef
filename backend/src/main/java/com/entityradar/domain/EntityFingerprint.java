package com.entityradar.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Secondary, additive enrichment label. Never authoritative for classification or risk.
 */
public record EntityFingerprint(
        @JsonProperty("entity_type") FingerprintType entityType,
        @JsonProperty("confidence_score") double confidenceScore,
        @JsonProperty("supporting_signals") List<String> supportingSignals,
        @JsonProperty("scores") Map<String, Double> scores,
        @JsonProperty("entity_cluster_id") String entityClusterId,
        @JsonProperty("cluster_size") int clusterSize,
        @JsonProperty("related_wallets") List<String> relatedWallets
) {

    public EntityFingerprint {
        entityType = entityType == null ? FingerprintType.UNKNOWN : entityType;
        supportingSignals = supportingSignals == null ? List.of() : List.copyOf(supportingSignals);
        scores = scores == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(scores));
        relatedWallets = relatedWallets == null ? List.of() : List.copyOf(relatedWallets);
    }

    public static EntityFingerprint unknown() {
        return new EntityFingerprint(FingerprintType.UNKNOWN, 0.0, List.of(), Map.of(), null, 0, List.of());
    }

    @JsonIgnore
    public boolean isLabelled() {
        return entityType != FingerprintType.UNKNOWN;
    }
}
