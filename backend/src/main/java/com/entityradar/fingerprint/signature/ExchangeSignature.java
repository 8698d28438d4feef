package com.entityradar.fingerprint.signature;

import com.entityradar.domain.FeatureSummary;
import com.entityradar.domain.FingerprintType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Exchange hot wallet: many counterparties, symmetric flows, hub-and-spoke shape, sweeps and batched withdrawals.
 */
@Component
@Order(100)
public class ExchangeSignature implements SignatureScorer {

    @Override
    public FingerprintType type() {
        return FingerprintType.CENTRALIZED_EXCHANGE;
    }

    @Override
    public SignatureScore score(SignatureInput input) {
        FeatureSummary f = input.features();
        int cp = f.network().uniqueCounterparties();
        int totalTxs = f.activity().totalTxs();
        double in = f.volume().totalInEth();
        double out = f.volume().totalOutEth();
        double symmetry = in + out > 0 ? Math.min(in, out) / Math.max(Math.max(in, out), 0.001) : 0.0;

        ScoreAccumulator acc = new ScoreAccumulator();
        if (cp >= 500) {
            acc.add(0.3, "high_unique_counterparties");
        } else if (cp >= 200) {
            acc.add(0.15, "many_counterparties");
        }
        if (totalTxs >= 1000) {
            acc.add(0.25, "high_tx_count");
        } else if (totalTxs >= 300) {
            acc.add(0.1, "moderate_tx_count");
        }
        if (symmetry >= 0.85) {
            acc.add(0.2, "symmetric_inflow_outflow");
        } else if (symmetry >= 0.6) {
            acc.add(0.1);
        }
        if (f.network().top5CounterpartyShare() < 0.4 && cp > 50) {
            acc.add(0.1, "hub_spoke_flow");
        }
        if (f.behavioral().zeroBalanceFrequency() > 0.05) {
            acc.add(0.1, "frequent_zero_balance");
        }
        if (f.behavioral().sweepPatternScore() > 0.2) {
            acc.add(0.1, "sweep_pattern");
        }
        if (f.behavioral().sameBlock3PlusCount() >= 2) {
            acc.add(0.05, "batched_withdrawals");
        }
        if (f.activity().walletAgeDays() >= 180 && f.activity().avgTxPerDay() > 5) {
            acc.add(0.05, "sustained_hot_activity");
        }
        return acc.result();
    }
}
