package com.entityradar.classification;

import com.entityradar.common.ScoreMath;
import com.entityradar.domain.FeatureSummary;
import org.springframework.stereotype.Component;

/**
 * Lowers scores that contradict stronger evidence for another archetype. Rules apply in a fixed order;
 * a strong CEX score actively suppresses MEV and Fund rather than coexisting with them.
 */
@Component
public class ContradictionFilter {

    static final int CEX_LIKE_MIN_COUNTERPARTIES = 800;
    static final double CEX_LIKE_MIN_FLOW_SYMMETRY = 0.8;
    static final double MEV_CAP_WHEN_CEX_LIKE = 0.5;
    static final double MAX_PENALTY = 0.4;

    public AdjustedScores apply(BehavioralScores scores, FeatureSummary features) {
        FeatureSummary f = features == null ? FeatureSummary.empty() : features;
        double cex = scores.cexHub();
        double mev = scores.mev();
        double fund = scores.fund();
        double penalty = 0.0;

        if (f.network().uniqueCounterparties() > CEX_LIKE_MIN_COUNTERPARTIES
                && flowSymmetry(f) > CEX_LIKE_MIN_FLOW_SYMMETRY) {
            mev = Math.min(mev, MEV_CAP_WHEN_CEX_LIKE);
            penalty += 0.15;
        }
        // large but frequent transfers are not fund-like
        if (f.volume().avgTxSize() >= 50 && f.activity().totalTxs() > 500) {
            fund -= 0.2;
            penalty += 0.05;
        }
        // long holding, low frequency
        if (f.activity().walletAgeDays() >= 180 && f.activity().avgTxPerDay() < 1) {
            mev -= 0.15;
        }
        if (ScoreMath.atLeast(cex, 0.6)) {
            mev -= 0.3;
            fund -= 0.2;
        }
        if (ScoreMath.atLeast(ScoreMath.score(mev), 0.6)) {
            fund -= 0.1;
        }

        return new AdjustedScores(
                ScoreMath.score(cex),
                ScoreMath.score(mev),
                ScoreMath.score(fund),
                ScoreMath.score(scores.whale()),
                ScoreMath.score(Math.min(MAX_PENALTY, penalty)));
    }

    private static double flowSymmetry(FeatureSummary f) {
        double in = f.volume().totalInEth();
        double out = f.volume().totalOutEth();
        if (in + out <= 0) {
            return 0.0;
        }
        return Math.min(in, out) / Math.max(Math.max(in, out), 0.001);
    }
}
