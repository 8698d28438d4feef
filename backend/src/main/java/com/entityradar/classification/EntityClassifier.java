package com.entityradar.classification;

import com.entityradar.classification.RuleCounts.Checklist;
import com.entityradar.domain.Classification;
import com.entityradar.domain.EntityType;
import com.entityradar.domain.FeatureSummary;
import com.entityradar.domain.ScoringContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the CEX override, scoring, contradiction filtering, rule gating and decision bands for one address.
 * Prefers Unknown over a wrong label.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EntityClassifier {

    static final int OVERRIDE_MIN_TXS = 1000;
    static final int OVERRIDE_MIN_COUNTERPARTIES = 501;
    static final int OVERRIDE_MIN_CLUSTER_SIZE = 20;
    static final double OVERRIDE_SCORE = 0.8;
    /** Below this many normal transactions no archetype is labelled. */
    static final int MIN_LABELLED_TXS = 10;

    static final String INSUFFICIENT_CONFIDENCE = "insufficient_confidence_unknown";
    static final String WHALE_FALLBACK = "whale_fallback_non_hub";
    static final String MEV_ALL_SIGNALS = "mev_all_signals";
    static final String MEV_CAPPED = "mev_capped";
    static final List<String> OVERRIDE_SIGNALS = List.of(
            "cex_override_high_cp", "high_tx_count", "inflow_outflow_balanced", "large_cluster");

    private final BehavioralScorer behavioralScorer;
    private final ContradictionFilter contradictionFilter;
    private final RuleCounter ruleCounter;
    private final AttributionDecider attributionDecider;

    public Classification classify(FeatureSummary features, ScoringContext context) {
        FeatureSummary f = features == null ? FeatureSummary.empty() : features;
        ScoringContext ctx = context == null ? ScoringContext.none() : context;

        if (isCexOverride(f, ctx)) {
            log.debug("CEX override: txs={}, cp={}, cluster={}", f.activity().totalTxs(),
                    f.network().uniqueCounterparties(), ctx.clusterSize());
            return new Classification(EntityType.CEX_HOT_WALLET, OVERRIDE_SCORE, OVERRIDE_SIGNALS,
                    Classification.scoreMap(OVERRIDE_SCORE, 0, 0, 0), 0.0);
        }

        BehavioralScores raw = behavioralScorer.score(f, ctx);
        AdjustedScores adjusted = contradictionFilter.apply(raw, f);
        RuleCounts counts = ruleCounter.count(f, ctx);
        Map<EntityType, Double> gated = ruleCounter.gate(adjusted, counts);
        AttributionDecision decision = attributionDecider.decide(gated);
        if (decision.band().isLabelled() && f.activity().totalTxs() < MIN_LABELLED_TXS) {
            decision = new AttributionDecision(EntityType.UNKNOWN, decision.topType(), decision.entityScore(),
                    DecisionBand.WEAK, decision.gap());
        }
        log.debug("Scores raw={} adjusted={} gated={} band={} gap={}", raw, adjusted, gated, decision.band(),
                decision.gap());

        return new Classification(decision.entityType(), decision.entityScore(), signals(decision, counts),
                Classification.scoreMap(gated), adjusted.contradictionPenalty());
    }

    private static boolean isCexOverride(FeatureSummary f, ScoringContext ctx) {
        return f.activity().totalTxs() > OVERRIDE_MIN_TXS
                && f.network().uniqueCounterparties() > OVERRIDE_MIN_COUNTERPARTIES
                && ctx.clusterSize() > OVERRIDE_MIN_CLUSTER_SIZE
                && RuleCounter.balancedFlow(f);
    }

    private static List<String> signals(AttributionDecision decision, RuleCounts counts) {
        List<String> signals = new ArrayList<>();
        EntityType type = decision.entityType();
        if (type.isUnknown()) {
            signals.add(decision.band() == DecisionBand.AMBIGUOUS
                    ? decision.band().getSignal()
                    : INSUFFICIENT_CONFIDENCE);
            return signals;
        }
        signals.add(decision.band().getSignal());
        Optional<Checklist> checklist = counts.checklist(type);
        checklist.ifPresent(c -> {
            signals.add(rulesSignal(type, c));
            signals.addAll(c.satisfied());
        });
        if (type == EntityType.MEV_BOT) {
            signals.add(checklist.map(Checklist::allSatisfied).orElse(false) ? MEV_ALL_SIGNALS : MEV_CAPPED);
        }
        if (type == EntityType.INDIVIDUAL_WHALE) {
            signals.add(WHALE_FALLBACK);
        }
        return signals;
    }

    private static String rulesSignal(EntityType type, Checklist checklist) {
        String prefix = switch (type) {
            case CEX_HOT_WALLET -> "cex";
            case MEV_BOT -> "mev";
            case FUND_INSTITUTIONAL_WHALE -> "fund";
            default -> type.name().toLowerCase(Locale.ROOT);
        };
        return prefix + "_rules_" + checklist.count() + "_of_" + checklist.total();
    }
}
