package com.entityradar.fingerprint.signature;

import com.entityradar.domain.FeatureSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.entityradar.domain.FeatureFixtures.features;
import static com.entityradar.domain.TestTransactions.SELF;
import static org.assertj.core.api.Assertions.assertThat;

class MevSearcherSignatureTest {

    private final MevSearcherSignature signature = new MevSearcherSignature();

    @Test
    @DisplayName("bundled DEX activity with gas premiums is capped at 1.0")
    void searcher() {
        FeatureSummary f = features()
                .sameBlock(6, 4)
                .dexInteractionRatio(0.7)
                .gasSpikeRatio(0.3)
                .burstActivityScore(0.6)
                .uniqueCounterparties(120)
                .repeatCounterpartyRatio(0.1)
                .build();

        SignatureScore result = signature.score(new SignatureInput(f, null, List.of(), SELF));

        assertThat(result.score()).isEqualTo(1.0);
        assertThat(result.signals()).containsExactly(
                "same_block_multi_tx", "dex_heavy", "gas_premium_usage", "burst_activity", "arbitrage_like_cp",
                "short_holding_pattern");
    }

    @Test
    @DisplayName("partial burst credit adds weight without a signal")
    void partialBurstCredit() {
        FeatureSummary f = features().burstActivityScore(0.3).uniqueCounterparties(400).build();

        SignatureScore result = signature.score(new SignatureInput(f, null, List.of(), SELF));

        assertThat(result.score()).isEqualTo(0.08);
        assertThat(result.signals()).isEmpty();
    }
}
