package com.entityradar.fingerprint.signature;

import com.entityradar.domain.FeatureSummary;
import com.entityradar.domain.FingerprintType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Fund or whale: large, infrequent transfers to a limited set of counterparties over a long history.
 */
@Component
@Order(500)
public class FundWhaleSignature implements SignatureScorer {

    @Override
    public FingerprintType type() {
        return FingerprintType.FUND_WHALE;
    }

    @Override
    public SignatureScore score(SignatureInput input) {
        FeatureSummary f = input.features();
        double maxTx = f.volume().maxSingleTx();
        double perDay = f.activity().avgTxPerDay();
        double age = f.activity().walletAgeDays();
        int cp = f.network().uniqueCounterparties();
        double lifetime = f.volume().lifetimeVolumeEth();
        double cexShare = f.behavioral().cexVolumeShare();

        ScoreAccumulator acc = new ScoreAccumulator();
        if (maxTx >= 100) {
            acc.add(0.25, "large_tx_size");
        } else if (maxTx >= 50) {
            acc.add(0.12, "high_value_txs");
        }
        if (perDay < 1 && age >= 90) {
            acc.add(0.25, "low_frequency");
        } else if (perDay < 2 && age >= 30) {
            acc.add(0.1);
        }
        if (cp <= 50 && lifetime > 100) {
            acc.add(0.2, "limited_counterparties");
        } else if (cp <= 100) {
            acc.add(0.08);
        }
        if (age >= 180) {
            acc.add(0.1, "long_holding_period");
        }
        if (f.behavioral().dexInteractionRatio() < 0.3 && lifetime > 50) {
            acc.add(0.1, "low_dex_usage");
        }
        if (cexShare >= 0.1 && cexShare <= 0.8) {
            acc.add(0.05, "custody_like");
        }
        if (f.network().top5CounterpartyShare() > 0.5) {
            acc.add(0.05, "concentrated_flow");
        }
        return acc.result();
    }
}
