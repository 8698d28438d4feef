package com.entityradar.classification;

import com.entityradar.common.ScoreMath;
import com.entityradar.domain.EntityType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Turns gated scores into a label through decision bands. Evaluated in order: none, ambiguous (gap at most 0.10,
 * ties included), strong, moderate, weak. Gaps are exact decimal differences.
 */
@Component
public class AttributionDecider {

    static final double MIN_TOP_SCORE = 0.01;
    static final double AMBIGUOUS_MAX_GAP = 0.10;
    static final double STRONG_MIN_TOP = 0.75;
    static final double STRONG_MIN_GAP = 0.20;
    static final double MODERATE_MIN_TOP = 0.60;
    static final double MODERATE_MIN_GAP = 0.10;

    public AttributionDecision decide(Map<EntityType, Double> gatedScores) {
        List<Map.Entry<EntityType, Double>> ranked = new ArrayList<>();
        for (EntityType type : EntityType.values()) {
            if (!type.isUnknown()) {
                ranked.add(Map.entry(type, gatedScores.getOrDefault(type, 0.0)));
            }
        }
        // stable: equal scores keep archetype order
        ranked.sort(Map.Entry.<EntityType, Double>comparingByValue(Comparator.reverseOrder()));

        EntityType topType = ranked.get(0).getKey();
        double top = ranked.get(0).getValue();
        BigDecimal gap = ScoreMath.difference(top, ranked.get(1).getValue());

        if (top < MIN_TOP_SCORE) {
            return new AttributionDecision(EntityType.UNKNOWN, topType, 0.0, DecisionBand.NONE, gap);
        }
        if (ScoreMath.atMost(gap, AMBIGUOUS_MAX_GAP)) {
            return unknown(topType, top, DecisionBand.AMBIGUOUS, gap);
        }
        if (ScoreMath.atLeast(top, STRONG_MIN_TOP) && ScoreMath.atLeast(gap, STRONG_MIN_GAP)) {
            return new AttributionDecision(topType, topType, ScoreMath.score(top), DecisionBand.STRONG, gap);
        }
        if (ScoreMath.atLeast(top, MODERATE_MIN_TOP) && ScoreMath.atLeast(gap, MODERATE_MIN_GAP)) {
            return new AttributionDecision(topType, topType, ScoreMath.score(top), DecisionBand.MODERATE, gap);
        }
        return unknown(topType, top, DecisionBand.WEAK, gap);
    }

    private static AttributionDecision unknown(EntityType topType, double top, DecisionBand band, BigDecimal gap) {
        return new AttributionDecision(EntityType.UNKNOWN, topType, ScoreMath.score(top), band, gap);
    }
}
