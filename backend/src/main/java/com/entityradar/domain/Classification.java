package com.entityradar.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Attribution result. {@code signalsUsed} is ordered and duplicate-free; {@code allScores} is keyed by entity label
 * and always carries every {@link EntityType} in declaration order (Unknown = 0).
 */
public record Classification(
        @JsonProperty("entity_type") EntityType entityType,
        @JsonProperty("entity_score") double entityScore,
        @JsonProperty("signals_used") List<String> signalsUsed,
        @JsonProperty("all_scores") Map<String, Double> allScores,
        @JsonProperty("contradiction_penalty") double contradictionPenalty
) {

    public Classification {
        entityType = entityType == null ? EntityType.UNKNOWN : entityType;
        signalsUsed = signalsUsed == null ? List.of() : List.copyOf(new LinkedHashSet<>(signalsUsed));
        allScores = canonicalScores(allScores);
    }

    public static Classification unknown() {
        return new Classification(EntityType.UNKNOWN, 0.0, List.of("insufficient_confidence_unknown"), null, 0.0);
    }

    public double scoreOf(EntityType type) {
        return allScores.getOrDefault(type.getLabel(), 0.0);
    }

    /** Score map in archetype order, keyed by label. */
    public static Map<String, Double> scoreMap(Map<EntityType, Double> byType) {
        Map<String, Double> map = new LinkedHashMap<>();
        byType.forEach((type, score) -> map.put(type.getLabel(), score));
        return map;
    }

    public static Map<String, Double> scoreMap(double cex, double mev, double fund, double whale) {
        Map<EntityType, Double> map = new EnumMap<>(EntityType.class);
        map.put(EntityType.CEX_HOT_WALLET, cex);
        map.put(EntityType.MEV_BOT, mev);
        map.put(EntityType.FUND_INSTITUTIONAL_WHALE, fund);
        map.put(EntityType.INDIVIDUAL_WHALE, whale);
        return scoreMap(map);
    }

    private static Map<String, Double> canonicalScores(Map<String, Double> scores) {
        Map<String, Double> ordered = new LinkedHashMap<>();
        for (EntityType type : EntityType.values()) {
            Double value = scores == null || type.isUnknown() ? null : scores.get(type.getLabel());
            ordered.put(type.getLabel(), value == null ? 0.0 : value);
        }
        return Collections.unmodifiableMap(ordered);
    }
}
