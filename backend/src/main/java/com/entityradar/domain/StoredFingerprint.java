package com.entityradar.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One persisted fingerprint entry (append-only history per address).
 */
public record StoredFingerprint(
        @JsonProperty("address") String address,
        @JsonProperty("entity_type") FingerprintType entityType,
        @JsonProperty("confidence_score") double confidenceScore,
        @JsonProperty("supporting_signals") List<String> supportingSignals,
        @JsonProperty("entity_cluster_id") String entityClusterId,
        @JsonProperty("scores") Map<String, Double> scores,
        @JsonProperty("recorded_at") Instant recordedAt
) {

    public StoredFingerprint {
        supportingSignals = supportingSignals == null ? List.of() : List.copyOf(supportingSignals);
        scores = scores == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(scores));
    }

    public static StoredFingerprint of(String address, EntityFingerprint fingerprint, Instant recordedAt) {
        return new StoredFingerprint(address, fingerprint.entityType(), fingerprint.confidenceScore(),
                fingerprint.supportingSignals(), fingerprint.entityClusterId(), fingerprint.scores(), recordedAt);
    }
}
