package com.entityradar.classification;

import com.entityradar.domain.EntityType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Satisfied checklist items per gated archetype. Individual Whale has no checklist.
 */
public record RuleCounts(Map<EntityType, Checklist> checklists) {

    public RuleCounts {
        checklists = Collections.unmodifiableMap(new EnumMap<>(checklists));
    }

    public Optional<Checklist> checklist(EntityType type) {
        return Optional.ofNullable(checklists.get(type));
    }

    /** True when the archetype has no checklist or meets its minimum. */
    public boolean meetsMinimum(EntityType type) {
        return checklist(type).map(Checklist::meetsMinimum).orElse(true);
    }

    /**
     * @param satisfied names of satisfied items, in checklist order
     * @param total     checklist length
     * @param minimum   items required to avoid the score cap
     */
    public record Checklist(List<String> satisfied, int total, int minimum) {

        public Checklist {
            satisfied = List.copyOf(satisfied);
        }

        public int count() {
            return satisfied.size();
        }

        public boolean meetsMinimum() {
            return count() >= minimum;
        }

        public boolean allSatisfied() {
            return count() == total;
        }
    }
}
