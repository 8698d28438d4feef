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
 * Router or aggregator-like flow. Looks at the known routers actually called, not only the DEX ratio.
 */
@Component
@Order(400)
@RequiredArgsConstructor
public class ProtocolRouterSignature implements SignatureScorer {

    private final KnownAddressRegistry knownAddresses;

    @Override
    public FingerprintType type() {
        return FingerprintType.PROTOCOL_ROUTER;
    }

    @Override
    public SignatureScore score(SignatureInput input) {
        FeatureSummary f = input.features();
        int routerTxs = 0;
        Set<String> routers = new HashSet<>();
        for (TransactionRecord tx : input.txs()) {
            String to = ChainValues.normalizeAddress(tx == null ? null : tx.to());
            if (input.involvesSelf(tx) && knownAddresses.isDexRouter(to)) {
                routerTxs++;
                routers.add(to);
            }
        }
        double contractCalls = f.behavioral().contractCallRatio();
        int totalTxs = f.activity().totalTxs();

        ScoreAccumulator acc = new ScoreAccumulator();
        if (contractCalls >= 0.7) {
            acc.add(0.3, "high_contract_calls");
        } else if (contractCalls >= 0.5) {
            acc.add(0.15, "contract_heavy");
        }
        if (f.behavioral().dexInteractionRatio() >= 0.5 && totalTxs >= 50) {
            acc.add(0.25, "dex_router_usage");
        }
        if (routerTxs >= 10 && routers.size() >= 2) {
            acc.add(0.2, "multi_router_interaction");
        }
        if (f.network().uniqueCounterparties() >= 20 && f.activity().avgTxPerDay() > 2 && contractCalls > 0.4) {
            acc.add(0.15, "aggregator_like");
        }
        if (routerTxs >= 5 && totalTxs >= 20) {
            acc.add(0.1, "routed_flow");
        }
        return acc.result();
    }
}
