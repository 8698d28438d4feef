package com.entityradar.classification;

import com.entityradar.common.ScoreMath;
import com.entityradar.domain.FeatureSummary;
import com.entityradar.domain.ScoringContext;
import org.springframework.stereotype.Component;

/**
 * Four fixed-weight staircase scores per archetype. Weights in each sum add to 1.0; each staircase
 * boundary keeps its own operator ({@code >=} or {@code <}).
 */
@Component
public class BehavioralScorer {

    public BehavioralScores score(FeatureSummary features, ScoringContext context) {
        FeatureSummary f = features == null ? FeatureSummary.empty() : features;
        ScoringContext ctx = context == null ? ScoringContext.none() : context;

        double cexHub = ScoreMath.score(cexHub(f, ctx));
        double mev = ScoreMath.score(mev(f));
        double fund = ScoreMath.score(fund(f));
        double whale = ScoreMath.score(whale(f, cexHub));
        return new BehavioralScores(cexHub, mev, fund, whale);
    }

    private static double cexHub(FeatureSummary f, ScoringContext ctx) {
        double zeroBalance = f.behavioral().zeroBalanceFrequency();
        double zeroing = zeroBalance >= 0.1 ? Math.min(1.0, zeroBalance * 5) : 0.0;
        return 0.25 * counterpartyStep(f.network().uniqueCounterparties())
                + 0.25 * flowSymmetryStep(f.volume().inflowOutflowRatio())
                + 0.2 * f.behavioral().sweepPatternScore()
                + 0.2 * clusterStep(ctx.clusterSize())
                + 0.1 * zeroing;
    }

    static double counterpartyStep(int counterparties) {
        if (counterparties >= 500) {
            return 1.0;
        }
        if (counterparties >= 200) {
            return 0.7;
        }
        if (counterparties >= 100) {
            return 0.4;
        }
        return counterparties >= 50 ? 0.2 : 0.0;
    }

    private static double flowSymmetryStep(double ratio) {
        if (ratio >= 0.9) {
            return 1.0;
        }
        if (ratio >= 0.7) {
            return 0.7;
        }
        return ratio >= 0.5 ? 0.4 : 0.0;
    }

    private static double clusterStep(int clusterSize) {
        if (clusterSize >= 20) {
            return 1.0;
        }
        if (clusterSize >= 10) {
            return 0.6;
        }
        return clusterSize >= 3 ? 0.3 : 0.0;
    }

    private static double mev(FeatureSummary f) {
        int sameBlockMax = f.behavioral().sameBlockMaxTxs();
        double sameBlock = sameBlockMax >= 5 ? 1.0 : sameBlockMax >= 3 ? 0.6 : sameBlockMax >= 1 ? 0.2 : 0.0;
        double dexRatio = f.behavioral().dexInteractionRatio();
        double dex = dexRatio >= 0.6 ? 1.0 : dexRatio >= 0.4 ? 0.6 : dexRatio >= 0.2 ? 0.3 : 0.0;
        double gasRatio = f.behavioral().gasSpikeRatio();
        double gas = gasRatio >= 0.2 ? 1.0 : gasRatio >= 0.1 ? 0.5 : 0.0;
        double burstScore = f.temporal().burstActivityScore();
        double burst = burstScore >= 0.5 ? 1.0 : burstScore >= 0.3 ? 0.5 : 0.0;
        double lowRepeat = 1.0 - Math.min(1.0, f.network().repeatCounterpartyRatio() * 2);
        return 0.3 * sameBlock + 0.3 * dex + 0.2 * gas + 0.15 * burst + 0.05 * lowRepeat;
    }

    private static double fund(FeatureSummary f) {
        double maxTx = f.volume().maxSingleTx();
        double largeTx = maxTx >= 500 ? 1.0 : maxTx >= 100 ? 0.7 : maxTx >= 50 ? 0.4 : 0.0;
        double perDay = f.activity().avgTxPerDay();
        double age = f.activity().walletAgeDays();
        double lowFreq = perDay < 1 && age >= 180 ? 1.0 : perDay < 2 && age >= 90 ? 0.6 : 0.0;
        double dexRatio = f.behavioral().dexInteractionRatio();
        double lowDex = dexRatio < 0.2 ? 1.0 : dexRatio < 0.4 ? 0.5 : 0.0;
        double cexShare = f.behavioral().cexVolumeShare();
        double custody = cexShare >= 0.2 ? 0.8 : cexShare >= 0.1 ? 0.4 : 0.0;
        return 0.3 * largeTx + 0.25 * lowFreq + 0.25 * lowDex + 0.2 * custody;
    }

    private static double whale(FeatureSummary f, double cexHub) {
        double lifetime = f.volume().lifetimeVolumeEth();
        double volume = lifetime >= 1000 ? 1.0 : lifetime >= 500 ? 0.7 : lifetime >= 100 ? 0.4 : 0.0;
        double perDay = f.activity().avgTxPerDay();
        double moderateFreq = perDay >= 0.5 && perDay <= 20 ? 1.0 : perDay > 0 ? 0.5 : 0.0;
        double nonHub = f.network().top5CounterpartyShare() > 0.3 || f.network().uniqueCounterparties() < 200
                ? 0.8 : 1.0;
        return 0.35 * volume + 0.35 * moderateFreq + 0.2 * (1 - cexHub) + 0.1 * nonHub;
    }
}
