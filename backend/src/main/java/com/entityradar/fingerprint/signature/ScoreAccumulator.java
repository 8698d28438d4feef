package com.entityradar.fingerprint.signature;

import java.util.ArrayList;
import java.util.List;

/**
 * Additive score with named contributions.
 */
final class ScoreAccumulator {

    private double score;
    private final List<String> signals = new ArrayList<>();

    void add(double weight, String signal) {
        score += weight;
        if (signal != null) {
            signals.add(signal);
        }
    }

    /** Weight without a named signal (partial credit). */
    void add(double weight) {
        add(weight, null);
    }

    SignatureScore result() {
        return new SignatureScore(Math.min(1.0, score), signals);
    }
}
