package com.entityradar.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Numeric context for scoring, usually derived from {@link ClusterData} and {@link FundingAnalysis} in a second pass.
 * {@code fundingSourceCount} is carried for explainability only.
 */
public record ScoringContext(
        @JsonProperty("cluster_size") int clusterSize,
        @JsonProperty("funding_source_count") int fundingSourceCount
) {

    public static ScoringContext none() {
        return new ScoringContext(0, 0);
    }

    public static ScoringContext from(ClusterData clusterData, FundingAnalysis fundingAnalysis) {
        int clusterSize = clusterData == null ? 0 : clusterData.clusterSize();
        int funders = fundingAnalysis == null ? 0 : fundingAnalysis.funderCount();
        return new ScoringContext(clusterSize, funders);
    }
}
