package com.entityradar.fingerprint.signature;

import com.entityradar.domain.FeatureSummary;
import com.entityradar.domain.FingerprintType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * MEV searcher: same-block bundles, DEX-heavy flow, gas premiums and recurring bursts.
 */
@Component
@Order(200)
public class MevSearcherSignature implements SignatureScorer {

    @Override
    public FingerprintType type() {
        return FingerprintType.MEV_SEARCHER;
    }

    @Override
    public SignatureScore score(SignatureInput input) {
        FeatureSummary f = input.features();
        int sameBlockMax = f.behavioral().sameBlockMaxTxs();
        double dex = f.behavioral().dexInteractionRatio();
        double burst = f.temporal().burstActivityScore();

        ScoreAccumulator acc = new ScoreAccumulator();
        if (sameBlockMax >= 5) {
            acc.add(0.3, "same_block_multi_tx");
        } else if (sameBlockMax >= 3) {
            acc.add(0.15, "same_block_bundles");
        }
        if (dex >= 0.6) {
            acc.add(0.25, "dex_heavy");
        } else if (dex >= 0.4) {
            acc.add(0.1, "high_dex_ratio");
        }
        if (f.behavioral().gasSpikeRatio() > 0.2) {
            acc.add(0.15, "gas_premium_usage");
        }
        if (burst >= 0.5) {
            acc.add(0.2, "burst_activity");
        } else if (burst >= 0.2) {
            acc.add(0.08);
        }
        if (f.network().uniqueCounterparties() < 300 && dex > 0.3) {
            acc.add(0.1, "arbitrage_like_cp");
        }
        if (f.network().repeatCounterpartyRatio() < 0.3 && f.behavioral().sameBlock3PlusCount() >= 1) {
            acc.add(0.05, "short_holding_pattern");
        }
        return acc.result();
    }
}
