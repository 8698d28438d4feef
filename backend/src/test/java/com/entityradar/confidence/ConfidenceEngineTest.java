package com.entityradar.confidence;

import com.entityradar.domain.Classification;
import com.entityradar.domain.ConfidenceResult;
import com.entityradar.domain.EntityType;
import com.entityradar.domain.FeatureSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.entityradar.domain.FeatureFixtures.features;
import static org.assertj.core.api.Assertions.assertThat;

class ConfidenceEngineTest {

    private ConfidenceEngine engine;

    @BeforeEach
    void setUp() {
        engine = new ConfidenceEngine();
    }

    private static FeatureSummary history(int txs, double ageDays, int counterparties) {
        return features().totalTxs(txs).walletAgeDays(ageDays).uniqueCounterparties(counterparties).build();
    }

    private static Classification labelled(EntityType type, double score, double penalty, String... signals) {
        return new Classification(type, score, List.of(signals), Classification.scoreMap(0, 0, 0, 0), penalty);
    }

    @Test
    @DisplayName("young wallet with few transactions gets a very low score and every limiting reason")
    void youngSparseWallet() {
        Classification unknown = new Classification(EntityType.UNKNOWN, 0.28,
                List.of("insufficient_confidence_unknown"), null, 0.0);

        ConfidenceResult result = engine.compute(history(5, 10, 3), unknown);

        assertThat(result.confidenceScore()).isEqualTo(0.09);
        assertThat(result.confidenceReasons()).containsExactly(
                "Limited history reduces certainty",
                "Wallet age under 30 days",
                "Low counterparty count",
                "Low entity score caps confidence",
                "Insufficient signals for high-confidence classification");
    }

    @Test
    @DisplayName("deep history and a strong label keep the entity score")
    void strongLabel() {
        Classification mev = labelled(EntityType.MEV_BOT, 0.99, 0.0,
                "strong_attribution_band", "mev_rules_6_of_6", "mev_all_signals");

        ConfidenceResult result = engine.compute(history(2000, 400, 200), mev);

        assertThat(result.confidenceScore()).isEqualTo(0.99);
        assertThat(result.confidenceReasons()).containsExactly("Strong MEV Bot signals detected");
    }

    @Test
    @DisplayName("wallet younger than 30 days is capped at 0.45")
    void youngWalletCap() {
        Classification fund = labelled(EntityType.FUND_INSTITUTIONAL_WHALE, 0.95, 0.0, "a", "b", "c");

        assertThat(engine.compute(history(500, 10, 100), fund).confidenceScore()).isEqualTo(0.45);
    }

    @Test
    @DisplayName("fewer than 100 transactions is capped at 0.5")
    void fewTransactionsCap() {
        Classification fund = labelled(EntityType.FUND_INSTITUTIONAL_WHALE, 0.95, 0.0, "a", "b", "c");

        assertThat(engine.compute(history(50, 400, 100), fund).confidenceScore()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("moderate history multiplies the quality and depth factors")
    void moderateHistory() {
        Classification fund = labelled(EntityType.FUND_INSTITUTIONAL_WHALE, 0.8, 0.0,
                "moderate_attribution_band", "fund_rules_3_of_5");

        ConfidenceResult result = engine.compute(history(150, 60, 20), fund);

        assertThat(result.confidenceScore()).isEqualTo(0.51);
        assertThat(result.confidenceReasons()).containsExactly(
                "Moderate transaction history",
                "Short activity window",
                "Limited counterparty diversity",
                "Fund/Institutional Whale classification based on on-chain patterns");
    }

    @Test
    @DisplayName("zero entity score floors at 0.05")
    void floor() {
        ConfidenceResult result = engine.compute(history(2000, 400, 200), Classification.unknown());

        assertThat(result.confidenceScore()).isEqualTo(0.05);
        assertThat(result.confidenceReasons()).contains("Low entity score caps confidence");
    }

    @Test
    @DisplayName("a contradiction penalty is reported before the narrative")
    void contradictionReason() {
        Classification cex = labelled(EntityType.CEX_HOT_WALLET, 0.7, 0.15, "moderate_attribution_band");

        List<String> reasons = engine.compute(history(2000, 400, 200), cex).confidenceReasons();

        assertThat(reasons).containsExactly(
                "Contradiction filters applied",
                "CEX Hot Wallet classification based on on-chain patterns");
    }

    @Test
    @DisplayName("null inputs fall back to empty features and Unknown")
    void nullInputs() {
        ConfidenceResult result = engine.compute(null, null);

        assertThat(result.confidenceScore()).isEqualTo(0.05);
        assertThat(result.confidenceReasons()).last()
                .isEqualTo("Insufficient signals for high-confidence classification");
    }
}
