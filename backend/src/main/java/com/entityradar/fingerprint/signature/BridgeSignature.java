package com.entityradar.fingerprint.signature;

import com.entityradar.common.ChainValues;
import com.entityradar.domain.FeatureSummary;
import com.entityradar.domain.FingerprintType;
import com.entityradar.domain.TransactionRecord;
import com.entityradar.labels.KnownAddressRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * Bridge user or operator: repeated interaction with known bridge contracts, across several bridges.
 */
@Component
@Order(300)
@RequiredArgsConstructor
public class BridgeSignature implements SignatureScorer {

    private final KnownAddressRegistry knownAddresses;

    @Override
    public FingerprintType type() {
        return FingerprintType.BRIDGE;
    }

    @Override
    public SignatureScore score(SignatureInput input) {
        FeatureSummary f = input.features();
        int bridgeTxs = 0;
        Set<String> bridges = new HashSet<>();
        for (TransactionRecord tx : input.txs()) {
            if (!input.involvesSelf(tx)) {
                continue;
            }
            String from = ChainValues.normalizeAddress(tx.from());
            String to = ChainValues.normalizeAddress(tx.to());
            if (knownAddresses.isBridge(to) || knownAddresses.isBridge(from)) {
                bridgeTxs++;
                if (!to.isEmpty()) {
                    bridges.add(to);
                }
                if (!from.isEmpty()) {
                    bridges.add(from);
                }
            }
        }
        double bridgeRatio = f.behavioral().bridgeRatio();

        ScoreAccumulator acc = new ScoreAccumulator();
        if (bridgeRatio >= 0.3) {
            acc.add(0.35, "high_bridge_ratio");
        } else if (bridgeRatio >= 0.1) {
            acc.add(0.2, "repeated_bridge_interaction");
        } else if (bridgeTxs >= 3) {
            acc.add(0.15, "multiple_bridge_txs");
        }
        bridges.remove(input.address());
        if (bridges.size() >= 2) {
            acc.add(0.2, "multi_bridge_counterparties");
        }
        if (f.activity().totalTxs() >= 20 && bridgeTxs >= 2 && f.volume().lifetimeVolumeEth() > 10) {
            acc.add(0.15, "volume_via_bridges");
        }
        if (bridgeRatio > 0 && f.behavioral().cexInteractionRatio() < 0.5) {
            acc.add(0.1, "bridge_not_cex_dominant");
        }
        return acc.result();
    }
}
