package com.entityradar.classification;

import com.entityradar.classification.RuleCounts.Checklist;
import com.entityradar.common.ScoreMath;
import com.entityradar.domain.EntityType;
import com.entityradar.domain.FeatureSummary;
import com.entityradar.domain.ScoringContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Independent per-archetype checklists (CEX 4 of 6, MEV 4 of 6, Fund 3 of 5). An archetype below its minimum
 * is capped, never zeroed. Individual Whale is the ungated fallback.
 */
@Component
public class RuleCounter {

    public static final String CEX_HIGH_COUNTERPARTIES = "cex_high_counterparties";
    public static final String CEX_HIGH_TX_COUNT = "cex_high_tx_count";
    public static final String CEX_BALANCED_FLOW = "cex_inflow_outflow_balanced";
    public static final String CEX_ZERO_BALANCE = "cex_zero_balance_pattern";
    public static final String CEX_DISTRIBUTED_COUNTERPARTIES = "cex_distributed_counterparties";
    public static final String CEX_LARGE_CLUSTER = "cex_large_cluster";

    public static final String MEV_SAME_BLOCK_BUNDLES = "mev_same_block_bundles";
    public static final String MEV_DEX_DOMINANT = "mev_dex_dominant";
    public static final String MEV_GAS_SPIKES = "mev_gas_spikes";
    public static final String MEV_BURST_ACTIVITY = "mev_burst_activity";
    public static final String MEV_FOCUSED_COUNTERPARTIES = "mev_focused_counterparties";
    public static final String MEV_REPEATED_SAME_BLOCK = "mev_repeated_same_block";

    public static final String FUND_LARGE_SINGLE_TX = "fund_large_single_tx";
    public static final String FUND_LOW_FREQUENCY = "fund_low_frequency";
    public static final String FUND_LONG_HISTORY = "fund_long_history";
    public static final String FUND_LOW_DEX = "fund_low_dex";
    public static final String FUND_CUSTODY_FLOW = "fund_custody_flow";

    static final double CEX_CAP = 0.5;
    static final double MEV_CAP = 0.55;
    static final double FUND_CAP = 0.5;
    static final double BALANCED_FLOW_MIN_RATIO = 0.9;

    public RuleCounts count(FeatureSummary features, ScoringContext context) {
        FeatureSummary f = features == null ? FeatureSummary.empty() : features;
        ScoringContext ctx = context == null ? ScoringContext.none() : context;
        Map<EntityType, Checklist> checklists = new EnumMap<>(EntityType.class);
        checklists.put(EntityType.CEX_HOT_WALLET, cex(f, ctx));
        checklists.put(EntityType.MEV_BOT, mev(f));
        checklists.put(EntityType.FUND_INSTITUTIONAL_WHALE, fund(f));
        return new RuleCounts(checklists);
    }

    /** Caps every archetype that misses its checklist minimum. */
    public Map<EntityType, Double> gate(AdjustedScores adjusted, RuleCounts counts) {
        Map<EntityType, Double> gated = adjusted.byType();
        capUnlessMet(gated, counts, EntityType.CEX_HOT_WALLET, CEX_CAP);
        capUnlessMet(gated, counts, EntityType.MEV_BOT, MEV_CAP);
        capUnlessMet(gated, counts, EntityType.FUND_INSTITUTIONAL_WHALE, FUND_CAP);
        return gated;
    }

    private static void capUnlessMet(Map<EntityType, Double> scores, RuleCounts counts, EntityType type, double cap) {
        if (!counts.meetsMinimum(type)) {
            scores.put(type, Math.min(scores.get(type), cap));
        }
    }

    /** Inflow and outflow within 10 % of each other; no flow at all counts as balanced. */
    public static boolean balancedFlow(FeatureSummary f) {
        double in = f.volume().totalInEth();
        double out = f.volume().totalOutEth();
        double max = Math.max(in, out);
        if (in + out == 0 || max == 0) {
            return true;
        }
        return ScoreMath.atLeast(Math.min(in, out) / max, BALANCED_FLOW_MIN_RATIO);
    }

    private static Checklist cex(FeatureSummary f, ScoringContext ctx) {
        int cp = f.network().uniqueCounterparties();
        List<String> met = new ArrayList<>();
        addIf(met, cp > 500, CEX_HIGH_COUNTERPARTIES);
        addIf(met, f.activity().totalTxs() > 1000, CEX_HIGH_TX_COUNT);
        addIf(met, balancedFlow(f), CEX_BALANCED_FLOW);
        addIf(met, f.behavioral().zeroBalanceFrequency() > 0.05, CEX_ZERO_BALANCE);
        addIf(met, f.network().top5CounterpartyShare() < 0.4 && cp > 100, CEX_DISTRIBUTED_COUNTERPARTIES);
        addIf(met, ctx.clusterSize() > 20, CEX_LARGE_CLUSTER);
        return new Checklist(met, 6, 4);
    }

    private static Checklist mev(FeatureSummary f) {
        List<String> met = new ArrayList<>();
        addIf(met, f.behavioral().sameBlockMaxTxs() >= 5, MEV_SAME_BLOCK_BUNDLES);
        addIf(met, f.behavioral().dexInteractionRatio() > 0.6, MEV_DEX_DOMINANT);
        addIf(met, f.behavioral().gasSpikeRatio() > 0.2, MEV_GAS_SPIKES);
        addIf(met, f.temporal().burstActivityScore() > 0.5, MEV_BURST_ACTIVITY);
        addIf(met, f.network().uniqueCounterparties() < 300, MEV_FOCUSED_COUNTERPARTIES);
        addIf(met, f.behavioral().sameBlock3PlusCount() >= 3, MEV_REPEATED_SAME_BLOCK);
        return new Checklist(met, 6, 4);
    }

    private static Checklist fund(FeatureSummary f) {
        double age = f.activity().walletAgeDays();
        List<String> met = new ArrayList<>();
        addIf(met, f.volume().maxSingleTx() >= 100, FUND_LARGE_SINGLE_TX);
        addIf(met, f.activity().avgTxPerDay() < 2 && age >= 90, FUND_LOW_FREQUENCY);
        addIf(met, age >= 180, FUND_LONG_HISTORY);
        addIf(met, f.behavioral().dexInteractionRatio() < 0.3, FUND_LOW_DEX);
        addIf(met, f.behavioral().cexVolumeShare() >= 0.1, FUND_CUSTODY_FLOW);
        return new Checklist(met, 5, 3);
    }

    private static void addIf(List<String> met, boolean condition, String item) {
        if (condition) {
            met.add(item);
        }
    }
}
