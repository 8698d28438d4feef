package com.entityradar.fingerprint;

import com.entityradar.common.ScoreMath;
import com.entityradar.domain.Classification;
import com.entityradar.domain.ClusterData;
import com.entityradar.domain.CoordinationSignals;
import com.entityradar.domain.EntityFingerprint;
import com.entityradar.domain.FeatureSummary;
import com.entityradar.domain.FingerprintType;
import com.entityradar.domain.TransactionRecord;
import com.entityradar.fingerprint.signature.SignatureInput;
import com.entityradar.fingerprint.signature.SignatureScore;
import com.entityradar.fingerprint.signature.SignatureScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Independent enrichment overlay. Runs every signature, labels the top candidate only when it scores at least
 * 0.35 and leads the runner-up by at least 0.15. Never changes the primary classification or cluster.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FingerprintScorer {

    static final double MIN_LABEL_SCORE = 0.35;
    static final double MIN_GAP = 0.15;

    private final List<SignatureScorer> signatures;
    private final EntityClusterIdAssigner clusterIdAssigner;

    public EntityFingerprint score(FeatureSummary features, Classification classification, ClusterData clusterData,
                                   List<TransactionRecord> txs, String address, CoordinationSignals coordination) {
        if (address == null || address.isBlank()) {
            return EntityFingerprint.unknown();
        }
        SignatureInput input = new SignatureInput(features, classification, txs, address);
        Map<FingerprintType, SignatureScore> results = new EnumMap<>(FingerprintType.class);
        for (SignatureScorer signature : signatures) {
            results.put(signature.type(), signature.score(input));
        }

        Map<String, Double> scores = new LinkedHashMap<>();
        List<Map.Entry<FingerprintType, SignatureScore>> candidates = new ArrayList<>();
        for (Map.Entry<FingerprintType, SignatureScore> entry : results.entrySet()) {
            scores.put(entry.getKey().getScoreKey(), entry.getValue().score());
            if (ScoreMath.atLeast(entry.getValue().score(), MIN_LABEL_SCORE)) {
                candidates.add(entry);
            }
        }
        candidates.sort(Comparator.comparing(
                (Map.Entry<FingerprintType, SignatureScore> e) -> e.getValue().score()).reversed());

        FingerprintType type = FingerprintType.UNKNOWN;
        double confidence = 0.0;
        List<String> supporting = List.of();
        if (!candidates.isEmpty()) {
            SignatureScore top = candidates.get(0).getValue();
            boolean clearLead = candidates.size() == 1
                    || ScoreMath.atLeast(ScoreMath.difference(top.score(), candidates.get(1).getValue().score()),
                    MIN_GAP);
            if (clearLead) {
                type = candidates.get(0).getKey();
                confidence = top.score();
                supporting = top.signals();
            }
        }

        EntityClusterAssignment cluster = clusterIdAssigner.assign(input.address(), clusterData, input.features(),
                coordination);
        log.debug("Fingerprint for {}: {} ({}), scores={}", input.address(), type.getLabel(), confidence, scores);
        return new EntityFingerprint(type, confidence, supporting, scores, cluster.entityClusterId(),
                cluster.clusterSize(), cluster.relatedWallets());
    }
}
