package com.entityradar.classification;

import com.entityradar.domain.EntityType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Scores after contradiction filtering, plus the accumulated penalty (at most 0.4).
 */
public record AdjustedScores(double cexHub, double mev, double fund, double whale, double contradictionPenalty) {

    /** Archetype order: CEX, MEV, Fund, Whale. */
    public Map<EntityType, Double> byType() {
        Map<EntityType, Double> map = new EnumMap<>(EntityType.class);
        map.put(EntityType.CEX_HOT_WALLET, cexHub);
        map.put(EntityType.MEV_BOT, mev);
        map.put(EntityType.FUND_INSTITUTIONAL_WHALE, fund);
        map.put(EntityType.INDIVIDUAL_WHALE, whale);
        return map;
    }
}
