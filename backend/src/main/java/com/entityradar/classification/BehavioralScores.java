package com.entityradar.classification;

/**
 * Raw archetype scores before contradiction filtering and rule gating. Each in [0,1], 2 decimals.
 */
public record BehavioralScores(double cexHub, double mev, double fund, double whale) {
}
