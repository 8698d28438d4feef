package com.entityradar.fingerprint;

import com.entityradar.common.ChainValues;
import com.entityradar.common.ScoreMath;
import com.entityradar.config.FingerprintProperties;
import com.entityradar.domain.Classification;
import com.entityradar.domain.ClusterData;
import com.entityradar.domain.CoordinationSignals;
import com.entityradar.domain.EntityFingerprint;
import com.entityradar.domain.FeatureSummary;
import com.entityradar.domain.StoredFingerprint;
import com.entityradar.domain.TransactionRecord;
import com.entityradar.fingerprint.store.FingerprintStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Computes the fingerprint overlay and records labelled, sufficiently confident results. Store failures are logged
 * and never affect the returned fingerprint.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FingerprintService {

    private final FingerprintScorer scorer;
    private final FingerprintStore store;
    private final FingerprintProperties properties;

    public EntityFingerprint fingerprint(FeatureSummary features, Classification classification,
                                         ClusterData clusterData, List<TransactionRecord> txs, String address,
                                         CoordinationSignals coordination) {
        if (!properties.isEnabled()) {
            return EntityFingerprint.unknown();
        }
        EntityFingerprint fingerprint = scorer.score(features, classification, clusterData, txs, address,
                coordination);
        if (shouldRecord(fingerprint)) {
            String key = ChainValues.normalizeAddress(address);
            try {
                store.append(StoredFingerprint.of(key, fingerprint, Instant.now()));
            } catch (RuntimeException e) {
                log.warn("Fingerprint store append failed for {}: {}", key, e.getMessage());
            }
        }
        return fingerprint;
    }

    /** Stored history for the address, newest first. Empty when the store is unreachable. */
    public List<StoredFingerprint> storedFingerprints(String address) {
        try {
            return store.findByAddress(address);
        } catch (RuntimeException e) {
            log.warn("Fingerprint store lookup failed for {}: {}", ChainValues.normalizeAddress(address),
                    e.getMessage());
            return List.of();
        }
    }

    private boolean shouldRecord(EntityFingerprint fingerprint) {
        return properties.isRecordToStore()
                && fingerprint.isLabelled()
                && ScoreMath.atLeast(fingerprint.confidenceScore(), properties.getMinConfidenceToRecord());
    }
}
