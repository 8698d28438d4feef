package com.entityradar.classification;

import com.entityradar.domain.FeatureSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.entityradar.domain.FeatureFixtures.features;
import static org.assertj.core.api.Assertions.assertThat;

class ContradictionFilterTest {

    private ContradictionFilter filter;

    @BeforeEach
    void setUp() {
        filter = new ContradictionFilter();
    }

    @Test
    @DisplayName("CEX-like flow caps MEV at 0.5 and adds a penalty")
    void cexLikeFlow_capsMev() {
        FeatureSummary f = features().uniqueCounterparties(900).flows(100, 95).build();

        AdjustedScores adjusted = filter.apply(new BehavioralScores(0.3, 0.9, 0.4, 0.5), f);

        assertThat(adjusted.mev()).isEqualTo(0.5);
        assertThat(adjusted.fund()).isEqualTo(0.4);
        assertThat(adjusted.contradictionPenalty()).isEqualTo(0.15);
    }

    @Test
    @DisplayName("exactly 800 counterparties is not CEX-like")
    void boundary800() {
        FeatureSummary f = features().uniqueCounterparties(800).flows(100, 95).build();

        AdjustedScores adjusted = filter.apply(new BehavioralScores(0.3, 0.9, 0.4, 0.5), f);

        assertThat(adjusted.contradictionPenalty()).isZero();
        assertThat(adjusted.mev()).isEqualTo(0.9);
    }

    @Test
    @DisplayName("a strong CEX score suppresses MEV and Fund")
    void strongCex_suppressesCompetitors() {
        AdjustedScores adjusted = filter.apply(new BehavioralScores(0.7, 0.8, 0.6, 0.3), FeatureSummary.empty());

        assertThat(adjusted.cexHub()).isEqualTo(0.7);
        assertThat(adjusted.mev()).isEqualTo(0.5);
        assertThat(adjusted.fund()).isEqualTo(0.4);
        assertThat(adjusted.whale()).isEqualTo(0.3);
        assertThat(adjusted.contradictionPenalty()).isZero();
    }

    @Test
    @DisplayName("a strong MEV score dampens Fund")
    void strongMev_dampensFund() {
        AdjustedScores adjusted = filter.apply(new BehavioralScores(0.2, 0.7, 0.5, 0.3), FeatureSummary.empty());

        assertThat(adjusted.fund()).isEqualTo(0.4);
    }

    @Test
    @DisplayName("long, slow history lowers MEV")
    void longHolding_lowersMev() {
        FeatureSummary f = features().walletAgeDays(200).avgTxPerDay(0.5).build();

        AdjustedScores adjusted = filter.apply(new BehavioralScores(0.2, 0.7, 0.5, 0.3), f);

        assertThat(adjusted.mev()).isEqualTo(0.55);
        assertThat(adjusted.fund()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("large but frequent transfers lower Fund and add a penalty")
    void largeFrequent_lowersFund() {
        FeatureSummary f = features().avgTxSize(60).totalTxs(600).uniqueCounterparties(900).flows(100, 95).build();

        AdjustedScores adjusted = filter.apply(new BehavioralScores(0.3, 0.4, 0.7, 0.3), f);

        assertThat(adjusted.fund()).isEqualTo(0.5);
        assertThat(adjusted.contradictionPenalty()).isEqualTo(0.2);
    }

    @Test
    @DisplayName("scores never go below zero")
    void clampedAtZero() {
        AdjustedScores adjusted = filter.apply(new BehavioralScores(0.9, 0.1, 0.1, 0.0), FeatureSummary.empty());

        assertThat(adjusted.mev()).isZero();
        assertThat(adjusted.fund()).isZero();
    }
}
