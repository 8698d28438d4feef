package com.entityradar.fingerprint.store;

import com.entityradar.domain.FingerprintType;
import com.entityradar.domain.StoredFingerprint;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persisted fingerprint entry. One document per recorded fingerprint; address is lowercase. Indexes are created
 * when spring.data.mongodb.auto-index-creation is on.
 */
@Document(collection = "entity_fingerprints")
@CompoundIndex(name = "address_recorded", def = "{'address': 1, 'recordedAt': -1}")
@NoArgsConstructor
@Getter
@Setter
public class FingerprintDocument {

    @Id
    private String id;
    private String address;
    private FingerprintType entityType;
    private double confidenceScore;
    private List<String> supportingSignals = new ArrayList<>();
    private String entityClusterId;
    private Map<String, Double> scores = new LinkedHashMap<>();
    @Indexed(name = "recorded_at")
    private Instant recordedAt;

    static FingerprintDocument from(String address, StoredFingerprint entry) {
        FingerprintDocument doc = new FingerprintDocument();
        doc.setAddress(address);
        doc.setEntityType(entry.entityType());
        doc.setConfidenceScore(entry.confidenceScore());
        doc.setSupportingSignals(new ArrayList<>(entry.supportingSignals()));
        doc.setEntityClusterId(entry.entityClusterId());
        doc.setScores(new LinkedHashMap<>(entry.scores()));
        doc.setRecordedAt(entry.recordedAt());
        return doc;
    }

    StoredFingerprint toStored() {
        return new StoredFingerprint(address, entityType, confidenceScore, supportingSignals, entityClusterId, scores,
                recordedAt);
    }
}
