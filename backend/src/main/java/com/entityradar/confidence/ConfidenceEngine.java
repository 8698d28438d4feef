package com.entityradar.confidence;

import com.entityradar.common.ScoreMath;
import com.entityradar.domain.Classification;
import com.entityradar.domain.ConfidenceResult;
import com.entityradar.domain.FeatureSummary;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Confidence = data quality x entity score x history depth, then hard caps for weak scores, short history and
 * young wallets (the lowest triggered cap wins). Reasons come out in a fixed order without duplicates.
 */
@Component
public class ConfidenceEngine {

    static final double DATA_QUALITY_FLOOR = 0.2;
    static final double HISTORY_DEPTH_FLOOR = 0.3;
    static final double LOW_ENTITY_SCORE = 0.6;
    static final double LOW_ENTITY_SCORE_CAP = 0.55;
    static final int FEW_TXS = 100;
    static final double FEW_TXS_CAP = 0.5;
    static final double YOUNG_WALLET_DAYS = 30;
    static final double YOUNG_WALLET_CAP = 0.45;
    static final double MIN_CONFIDENCE = 0.05;
    static final int STRONG_MIN_SIGNALS = 3;
    static final double STRONG_MIN_ENTITY_SCORE = 0.7;

    static final String LIMITED_HISTORY = "Limited history reduces certainty";
    static final String MODERATE_HISTORY = "Moderate transaction history";
    static final String YOUNG_WALLET = "Wallet age under 30 days";
    static final String SHORT_WINDOW = "Short activity window";
    static final String LOW_COUNTERPARTIES = "Low counterparty count";
    static final String LIMITED_COUNTERPARTIES = "Limited counterparty diversity";
    static final String LOW_ENTITY_SCORE_REASON = "Low entity score caps confidence";
    static final String CONTRADICTIONS_APPLIED = "Contradiction filters applied";
    static final String INSUFFICIENT_SIGNALS = "Insufficient signals for high-confidence classification";

    public ConfidenceResult compute(FeatureSummary features, Classification classification) {
        FeatureSummary f = features == null ? FeatureSummary.empty() : features;
        Classification c = classification == null ? Classification.unknown() : classification;
        int totalTxs = f.activity().totalTxs();
        double ageDays = f.activity().walletAgeDays();
        int counterparties = f.network().uniqueCounterparties();
        double entityScore = c.entityScore();

        List<String> reasons = new ArrayList<>();
        double dataQuality = 1.0;
        double historyDepth = 1.0;
        if (totalTxs < FEW_TXS) {
            dataQuality -= 0.3;
            reasons.add(LIMITED_HISTORY);
        } else if (totalTxs < 300) {
            dataQuality -= 0.15;
            reasons.add(MODERATE_HISTORY);
        }
        if (ageDays < YOUNG_WALLET_DAYS) {
            historyDepth -= 0.35;
            reasons.add(YOUNG_WALLET);
        } else if (ageDays < 90) {
            historyDepth -= 0.15;
            reasons.add(SHORT_WINDOW);
        }
        if (counterparties < 10) {
            dataQuality -= 0.2;
            reasons.add(LOW_COUNTERPARTIES);
        } else if (counterparties < 30) {
            dataQuality -= 0.1;
            reasons.add(LIMITED_COUNTERPARTIES);
        }
        dataQuality = Math.max(DATA_QUALITY_FLOOR, dataQuality);
        historyDepth = Math.max(HISTORY_DEPTH_FLOOR, historyDepth);

        double confidence = dataQuality * ScoreMath.clamp01(entityScore) * historyDepth;
        if (entityScore < LOW_ENTITY_SCORE) {
            confidence = Math.min(confidence, LOW_ENTITY_SCORE_CAP);
            reasons.add(LOW_ENTITY_SCORE_REASON);
        }
        if (totalTxs < FEW_TXS) {
            confidence = Math.min(confidence, FEW_TXS_CAP);
        }
        if (ageDays < YOUNG_WALLET_DAYS) {
            confidence = Math.min(confidence, YOUNG_WALLET_CAP);
        }
        if (c.contradictionPenalty() > 0) {
            reasons.add(CONTRADICTIONS_APPLIED);
        }
        reasons.add(narrative(c));

        return new ConfidenceResult(ScoreMath.round(Math.max(MIN_CONFIDENCE, ScoreMath.clamp01(confidence)),
                ScoreMath.SCORE_SCALE), reasons);
    }

    private static String narrative(Classification c) {
        if (c.entityType().isUnknown()) {
            return INSUFFICIENT_SIGNALS;
        }
        String label = c.entityType().getLabel();
        if (c.signalsUsed().size() >= STRONG_MIN_SIGNALS && c.entityScore() >= STRONG_MIN_ENTITY_SCORE) {
            return "Strong " + label + " signals detected";
        }
        return label + " classification based on on-chain patterns";
    }
}
