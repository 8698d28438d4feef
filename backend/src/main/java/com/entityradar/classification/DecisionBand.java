package com.entityradar.classification;

/**
 * Attribution tiers. Only STRONG and MODERATE produce a label; the rest resolve to Unknown.
 */
public enum DecisionBand {
    NONE(null),
    AMBIGUOUS("top_two_scores_within_0_1_prefer_unknown"),
    STRONG("strong_attribution_band"),
    MODERATE("moderate_attribution_band"),
    WEAK(null);

    private final String signal;

    DecisionBand(String signal) {
        this.signal = signal;
    }

    public String getSignal() {
        return signal;
    }

    public boolean isLabelled() {
        return this == STRONG || this == MODERATE;
    }
}
