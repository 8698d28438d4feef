package com.entityradar.cluster;

import com.entityradar.common.ChainValues;
import com.entityradar.common.ContentHash;
import com.entityradar.common.ScoreMath;
import com.entityradar.domain.ClusterData;
import com.entityradar.domain.CoordinationSignals;
import com.entityradar.domain.FundingAnalysis;
import com.entityradar.labels.KnownAddressRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Conservative wallet grouping from funding and coordination evidence. A cluster id needs two or more
 * non-contract connected wallets, or two or more independent strong signals; a lone connected wallet or
 * funding source never produces one. Known contracts are never members.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ClusterBuilder {

    public static final String SHARED_FUNDING_SOURCE = "shared_funding_source";
    public static final String MULTIPLE_FUNDING_SOURCES = "multiple_funding_sources";
    public static final String REPEATED_TEMPORAL_SYNC = "repeated_temporal_sync";

    static final int MIN_STRONG_SIGNALS = 2;
    static final int MIN_CONNECTED_WALLETS = 2;

    private final KnownAddressRegistry knownAddresses;

    public ClusterData build(String address, FundingAnalysis funding, CoordinationSignals coordination) {
        String self = ChainValues.normalizeAddress(address);
        FundingAnalysis fa = funding == null ? FundingAnalysis.empty() : funding;
        CoordinationSignals cs = coordination == null ? CoordinationSignals.empty() : coordination;

        List<String> signals = strongSignals(fa, cs);
        List<String> connected = cs.connectedWallets().stream()
                .map(ChainValues::normalizeAddress)
                .filter(a -> !a.isEmpty() && !a.equals(self) && !knownAddresses.isKnownContract(a))
                .distinct()
                .toList();
        int size = connected.size();
        int funders = fa.funderCount();

        if (size == 0 && signals.size() < MIN_STRONG_SIGNALS) {
            return ClusterData.none();
        }
        if (size == 1 && funders <= 1 && signals.size() < MIN_STRONG_SIGNALS) {
            return new ClusterData(null, size, List.of(), 0.0);
        }

        double confidence;
        if (size >= MIN_CONNECTED_WALLETS) {
            confidence = Math.min(0.9, 0.4 + 0.1 * size + 0.05 * signals.size());
        } else if (size == 1 && signals.size() >= MIN_STRONG_SIGNALS) {
            confidence = Math.min(0.5, 0.25 + 0.08 * signals.size());
        } else if (size == 0 && signals.size() >= MIN_STRONG_SIGNALS && funders >= 2) {
            confidence = Math.min(0.4, 0.2 + 0.06 * signals.size());
        } else {
            return new ClusterData(null, size, connected, 0.0);
        }

        String clusterId = clusterId(self, connected, signals);
        log.debug("Cluster {} for {}: size={}, signals={}", clusterId, self, size, signals);
        return new ClusterData(clusterId, size, connected, ScoreMath.score(confidence));
    }

    private static List<String> strongSignals(FundingAnalysis funding, CoordinationSignals coordination) {
        Set<String> signals = new LinkedHashSet<>();
        if (funding.hasSignal(FundingAnalysis.SHARED_FUNDING_CEX_BRIDGE)) {
            signals.add(SHARED_FUNDING_SOURCE);
        }
        if (funding.funderCount() >= 2) {
            signals.add(MULTIPLE_FUNDING_SOURCES);
        }
        if (coordination.temporalSignals().contains(CoordinationSignals.TEMPORAL_BURST)) {
            signals.add(REPEATED_TEMPORAL_SYNC);
        }
        signals.addAll(coordination.sharedCounterpartySignals());
        return new ArrayList<>(signals);
    }

    /** SHA-256 over the sorted address set and the sorted signal list. */
    static String clusterId(String self, List<String> connected, List<String> signals) {
        Set<String> addresses = new TreeSet<>(connected);
        addresses.add(self);
        return ContentHash.shortId(String.join("|", addresses) + "#" + String.join("|", new TreeSet<>(signals)));
    }
}
