package com.entityradar.fingerprint;

import java.util.List;

/**
 * Cluster id used by the fingerprint overlay, with the primary cluster's size and members.
 */
public record EntityClusterAssignment(String entityClusterId, int clusterSize, List<String> relatedWallets) {

    public EntityClusterAssignment {
        relatedWallets = relatedWallets == null ? List.of() : List.copyOf(relatedWallets);
    }
}
