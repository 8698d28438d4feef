package com.entityradar.risk;

import com.entityradar.common.ScoreMath;
import com.entityradar.domain.Classification;
import com.entityradar.domain.ConfidenceResult;
import com.entityradar.domain.FeatureSummary;
import com.entityradar.domain.RiskLevel;
import com.entityradar.domain.RiskProfile;
import com.entityradar.domain.RiskScore;
import org.springframework.stereotype.Component;

/**
 * Market-impact, counterparty and behavioral risk. Behavioral risk is the archetype base risk scaled by
 * confidence, so a low-confidence label never yields a high number.
 */
@Component
public class RiskScorer {

    static final double YOUNG_WALLET_DAYS = 30;
    static final double YOUNG_WALLET_COUNTERPARTY_CAP = 0.6;
    static final double MIN_CONFIDENCE = 0.05;

    public RiskProfile score(FeatureSummary features, Classification classification, ConfidenceResult confidence) {
        FeatureSummary f = features == null ? FeatureSummary.empty() : features;
        Classification c = classification == null ? Classification.unknown() : classification;
        double confidenceScore = confidence == null ? MIN_CONFIDENCE : confidence.confidenceScore();
        return new RiskProfile(
                risk(marketImpact(f)),
                risk(counterparty(f)),
                risk(behavioralBase(f, c) * Math.max(MIN_CONFIDENCE, ScoreMath.clamp01(confidenceScore))));
    }

    private static double marketImpact(FeatureSummary f) {
        double maxTx = f.volume().maxSingleTx();
        if (maxTx >= 500) {
            return 0.9;
        }
        if (maxTx >= 100) {
            return 0.75;
        }
        if (maxTx >= 50) {
            return 0.6;
        }
        if (maxTx < 10 && f.volume().lifetimeVolumeEth() < 100) {
            return 0.2;
        }
        return 0.5;
    }

    private static double counterparty(FeatureSummary f) {
        int cp = f.network().uniqueCounterparties();
        double score = cp < 5 ? 0.7 : cp >= 50 ? 0.3 : 0.5;
        if (f.network().top5CounterpartyShare() > 0.8) {
            score += 0.2;
        }
        if (f.network().repeatCounterpartyRatio() > 0.5) {
            score += 0.1;
        }
        // focus in a young wallet is not treated as high risk
        if (f.activity().walletAgeDays() < YOUNG_WALLET_DAYS) {
            score = Math.min(score, YOUNG_WALLET_COUNTERPARTY_CAP);
        }
        return score;
    }

    private static double behavioralBase(FeatureSummary f, Classification c) {
        switch (c.entityType()) {
            case MEV_BOT:
                return 0.75;
            case CEX_HOT_WALLET:
                return 0.4;
            case FUND_INSTITUTIONAL_WHALE:
                return 0.35;
            default:
                break;
        }
        if (f.behavioral().sameBlock3PlusCount() >= 2) {
            return 0.65;
        }
        return f.behavioral().dexInteractionRatio() > 0.5 ? 0.55 : 0.5;
    }

    private static RiskScore risk(double value) {
        double score = ScoreMath.score(value);
        return new RiskScore(score, RiskLevel.of(score));
    }
}
