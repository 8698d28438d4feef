package com.entityradar.fingerprint.signature;

import com.entityradar.common.ScoreMath;

import java.util.List;

/**
 * Signature score in [0,1] (2 decimals) and the signal names that contributed to it.
 */
public record SignatureScore(double score, List<String> signals) {

    public SignatureScore {
        score = ScoreMath.score(score);
        signals = signals == null ? List.of() : List.copyOf(signals);
    }
}
