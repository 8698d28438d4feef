package com.entityradar.fingerprint;

import com.entityradar.common.ChainValues;
import com.entityradar.common.ContentHash;
import com.entityradar.domain.ClusterData;
import com.entityradar.domain.CoordinationSignals;
import com.entityradar.domain.FeatureSummary;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reuses the primary cluster id when the cluster has at least two members; otherwise derives a stable id from the
 * address, its behavioral profile and its coordination signals.
 */
@Component
public class EntityClusterIdAssigner {

    static final int MIN_CLUSTER_SIZE = 2;
    private static final int MAX_SEED_WALLETS = 5;
    private static final int MAX_SEED_SIGNALS = 3;

    public EntityClusterAssignment assign(String address, ClusterData clusterData, FeatureSummary features,
                                         CoordinationSignals coordination) {
        ClusterData cluster = clusterData == null ? ClusterData.none() : clusterData;
        FeatureSummary f = features == null ? FeatureSummary.empty() : features;
        CoordinationSignals cs = coordination == null ? CoordinationSignals.empty() : coordination;

        if (cluster.hasCluster() && cluster.clusterSize() >= MIN_CLUSTER_SIZE) {
            return new EntityClusterAssignment(cluster.clusterId(), cluster.clusterSize(), cluster.relatedWallets());
        }

        List<String> seed = new ArrayList<>();
        seed.add(ChainValues.normalizeAddress(address));
        seed.add(Integer.toString(f.network().uniqueCounterparties()));
        seed.add(fixed(f.network().top5CounterpartyShare()));
        seed.add(fixed(f.behavioral().dexInteractionRatio()));
        seed.add(fixed(f.behavioral().cexInteractionRatio()));
        seed.add(fixed(f.temporal().burstActivityScore()));
        seed.add(fixed(f.activity().avgTxPerDay()));
        cluster.relatedWallets().stream().limit(MAX_SEED_WALLETS).map(ChainValues::normalizeAddress).forEach(seed::add);
        cs.temporalSignals().stream().limit(MAX_SEED_SIGNALS).forEach(seed::add);
        cs.sharedCounterpartySignals().stream().limit(MAX_SEED_SIGNALS).forEach(seed::add);

        return new EntityClusterAssignment(ContentHash.shortId(String.join("|", seed)), cluster.clusterSize(),
                cluster.relatedWallets());
    }

    private static String fixed(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
