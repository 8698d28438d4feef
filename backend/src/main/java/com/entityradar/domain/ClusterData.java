package com.entityradar.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Conservative grouping evidence. {@code clusterId} is null unless the grouping evidence is strong.
 * {@code relatedWallets} holds at most three non-contract addresses.
 */
public record ClusterData(
        @JsonProperty("cluster_id") String clusterId,
        @JsonProperty("cluster_size") int clusterSize,
        @JsonProperty("related_wallets") List<String> relatedWallets,
        @JsonProperty("cluster_confidence") double clusterConfidence
) {

    public static final int MAX_RELATED_WALLETS = 3;

    public ClusterData {
        relatedWallets = relatedWallets == null
                ? List.of()
                : List.copyOf(relatedWallets.subList(0, Math.min(MAX_RELATED_WALLETS, relatedWallets.size())));
    }

    public static ClusterData none() {
        return new ClusterData(null, 0, List.of(), 0.0);
    }

    public boolean hasCluster() {
        return clusterId != null;
    }
}
