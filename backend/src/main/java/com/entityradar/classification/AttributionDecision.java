package com.entityradar.classification;

import com.entityradar.domain.EntityType;

import java.math.BigDecimal;

/**
 * Outcome of the decision bands. {@code entityType} is Unknown unless the band is labelled.
 *
 * @param topType archetype with the highest gated score, whatever the band
 * @param gap     exact decimal difference between the top two scores
 */
public record AttributionDecision(EntityType entityType, EntityType topType, double entityScore,
                                  DecisionBand band, BigDecimal gap) {
}
