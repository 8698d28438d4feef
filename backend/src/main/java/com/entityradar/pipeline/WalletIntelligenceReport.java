package com.entityradar.pipeline;

import com.entityradar.domain.Classification;
import com.entityradar.domain.ClusterData;
import com.entityradar.domain.ConfidenceResult;
import com.entityradar.domain.CoordinationSignals;
import com.entityradar.domain.EntityFingerprint;
import com.entityradar.domain.FeatureSummary;
import com.entityradar.domain.FundingAnalysis;
import com.entityradar.domain.RiskProfile;
import com.entityradar.domain.ScoringContext;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Everything produced for one address in one call.
 */
public record WalletIntelligenceReport(
        @JsonProperty("address") String address,
        @JsonProperty("feature_summary") FeatureSummary features,
        @JsonProperty("funding_analysis") FundingAnalysis funding,
        @JsonProperty("coordination") CoordinationSignals coordination,
        @JsonProperty("scoring_context") ScoringContext context,
        @JsonProperty("classification") Classification classification,
        @JsonProperty("confidence") ConfidenceResult confidence,
        @JsonProperty("cluster_data") ClusterData cluster,
        @JsonProperty("risk_profile") RiskProfile risk,
        @JsonProperty("entity_fingerprint") EntityFingerprint fingerprint
) {
}
