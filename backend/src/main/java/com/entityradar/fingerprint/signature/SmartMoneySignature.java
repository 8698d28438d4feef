package com.entityradar.fingerprint.signature;

import com.entityradar.domain.EntityType;
import com.entityradar.domain.FeatureSummary;
import com.entityradar.domain.FingerprintType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Smart money heuristic: moderate volume over a diverse but not hub-like counterparty set, DEX usage without
 * bot timing, net positive flow. Uses the primary classification as context only.
 */
@Component
@Order(600)
public class SmartMoneySignature implements SignatureScorer {

    @Override
    public FingerprintType type() {
        return FingerprintType.SMART_MONEY;
    }

    @Override
    public SignatureScore score(SignatureInput input) {
        FeatureSummary f = input.features();
        EntityType primary = input.classification().entityType();
        double lifetime = f.volume().lifetimeVolumeEth();
        int cp = f.network().uniqueCounterparties();
        double dex = f.behavioral().dexInteractionRatio();
        double perDay = f.activity().avgTxPerDay();

        ScoreAccumulator acc = new ScoreAccumulator();
        if (lifetime >= 50 && lifetime <= 5000 && cp >= 10 && cp <= 200) {
            acc.add(0.2, "moderate_volume_diverse_cp");
        }
        if (dex >= 0.2 && dex <= 0.7 && f.behavioral().sameBlockMaxTxs() < 5) {
            acc.add(0.2, "dex_usage_not_bot");
        }
        if (f.volume().netFlow() > 0 && lifetime > 20) {
            acc.add(0.15, "net_positive_flow");
        }
        if (f.temporal().burstActivityScore() < 0.5 && perDay >= 0.1 && perDay <= 10) {
            acc.add(0.15, "strategic_timing");
        }
        if (f.activity().walletAgeDays() >= 30 && primary != EntityType.CEX_HOT_WALLET
                && primary != EntityType.MEV_BOT) {
            acc.add(0.15, "non_cex_mev_profile");
        }
        if (primary == EntityType.INDIVIDUAL_WHALE || primary == EntityType.FUND_INSTITUTIONAL_WHALE) {
            acc.add(0.1, "whale_or_fund_base");
        }
        if (cp >= 5 && cp <= 150 && dex > 0.1) {
            acc.add(0.05, "alpha_like_diversity");
        }
        return acc.result();
    }
}
