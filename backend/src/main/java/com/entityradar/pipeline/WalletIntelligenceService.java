package com.entityradar.pipeline;

import com.entityradar.classification.EntityClassifier;
import com.entityradar.cluster.ClusterBuilder;
import com.entityradar.common.ChainValues;
import com.entityradar.confidence.ConfidenceEngine;
import com.entityradar.context.CoordinationDetector;
import com.entityradar.context.FundingAnalyzer;
import com.entityradar.domain.Classification;
import com.entityradar.domain.ClusterData;
import com.entityradar.domain.ConfidenceResult;
import com.entityradar.domain.CoordinationSignals;
import com.entityradar.domain.EntityFingerprint;
import com.entityradar.domain.FeatureSummary;
import com.entityradar.domain.FundingAnalysis;
import com.entityradar.domain.RiskProfile;
import com.entityradar.domain.ScoringContext;
import com.entityradar.domain.TransactionRecord;
import com.entityradar.features.FeatureExtractor;
import com.entityradar.fingerprint.FingerprintService;
import com.entityradar.risk.RiskScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs the whole pipeline for one address over already-fetched transactions. Stateless; safe for concurrent calls.
 * Feature extraction, funding analysis and coordination detection run over the same input; clustering uses only
 * funding and coordination; the fingerprint overlay runs last and never changes earlier results.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WalletIntelligenceService {

    private final FeatureExtractor featureExtractor;
    private final FundingAnalyzer fundingAnalyzer;
    private final CoordinationDetector coordinationDetector;
    private final EntityClassifier entityClassifier;
    private final ConfidenceEngine confidenceEngine;
    private final ClusterBuilder clusterBuilder;
    private final RiskScorer riskScorer;
    private final FingerprintService fingerprintService;

    /**
     * Scoring context is derived from this call's cluster size and funder count.
     */
    public WalletIntelligenceReport analyze(String address, List<TransactionRecord> txs,
                                            List<TransactionRecord> internalTxs) {
        return run(address, txs, internalTxs, null);
    }

    /**
     * Uses the caller's scoring context, e.g. cluster size known from a previous pass.
     */
    public WalletIntelligenceReport analyze(String address, List<TransactionRecord> txs,
                                            List<TransactionRecord> internalTxs, ScoringContext context) {
        return run(address, txs, internalTxs, context == null ? ScoringContext.none() : context);
    }

    private WalletIntelligenceReport run(String address, List<TransactionRecord> txs,
                                         List<TransactionRecord> internalTxs, ScoringContext explicitContext) {
        String self = ChainValues.normalizeAddress(address);
        List<TransactionRecord> normal = txs == null ? List.of() : txs;
        List<TransactionRecord> internal = internalTxs == null ? List.of() : internalTxs;

        FeatureSummary features = featureExtractor.extract(normal, internal, self);
        FundingAnalysis funding = fundingAnalyzer.analyze(normal, internal, self);
        CoordinationSignals coordination = coordinationDetector.detect(normal, internal, self);
        ClusterData cluster = clusterBuilder.build(self, funding, coordination);
        ScoringContext context = explicitContext != null ? explicitContext : ScoringContext.from(cluster, funding);
        log.debug("Context for {}: {}", self, context);

        Classification classification = entityClassifier.classify(features, context);
        ConfidenceResult confidence = confidenceEngine.compute(features, classification);
        RiskProfile risk = riskScorer.score(features, classification, confidence);
        EntityFingerprint fingerprint = fingerprintService.fingerprint(features, classification, cluster, normal,
                self, coordination);

        log.info("Analyzed {}: {} (score {}, confidence {}), cluster={}, fingerprint={}", self,
                classification.entityType().getLabel(), classification.entityScore(), confidence.confidenceScore(),
                cluster.clusterId(), fingerprint.entityType().getLabel());
        return new WalletIntelligenceReport(self, features, funding, coordination, context, classification,
                confidence, cluster, risk, fingerprint);
    }
}
