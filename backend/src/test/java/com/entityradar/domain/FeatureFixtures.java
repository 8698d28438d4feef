package com.entityradar.domain;

import com.entityradar.domain.FeatureSummary.ActivityMetrics;
import com.entityradar.domain.FeatureSummary.BehavioralMetrics;
import com.entityradar.domain.FeatureSummary.InstitutionalMetrics;
import com.entityradar.domain.FeatureSummary.NetworkMetrics;
import com.entityradar.domain.FeatureSummary.TemporalMetrics;
import com.entityradar.domain.FeatureSummary.VolumeMetrics;

/**
 * Fluent {@link FeatureSummary} builder for scoring tests. Starts from the empty shape.
 */
public final class FeatureFixtures {

    private ActivityMetrics activity;
    private VolumeMetrics volume;
    private NetworkMetrics network;
    private BehavioralMetrics behavioral;
    private TemporalMetrics temporal;
    private InstitutionalMetrics institutional;

    private FeatureFixtures() {
        FeatureSummary empty = FeatureSummary.empty();
        activity = empty.activity();
        volume = empty.volume();
        network = empty.network();
        behavioral = empty.behavioral();
        temporal = empty.temporal();
        institutional = empty.institutional();
    }

    public static FeatureFixtures features() {
        return new FeatureFixtures();
    }

    public FeatureFixtures totalTxs(int value) {
        activity = activity.toBuilder().totalTxs(value).build();
        return this;
    }

    public FeatureFixtures walletAgeDays(double value) {
        activity = activity.toBuilder().walletAgeDays(value).build();
        return this;
    }

    public FeatureFixtures avgTxPerDay(double value) {
        activity = activity.toBuilder().avgTxPerDay(value).build();
        return this;
    }

    /** Sets inflow, outflow and the derived lifetime volume, net flow and symmetry ratio. */
    public FeatureFixtures flows(double inEth, double outEth) {
        double max = Math.max(Math.max(inEth, outEth), 0.001);
        volume = volume.toBuilder()
                .totalInEth(inEth)
                .totalOutEth(outEth)
                .lifetimeVolumeEth(inEth + outEth)
                .netFlow(inEth - outEth)
                .inflowOutflowRatio(Math.min(inEth, outEth) / max)
                .build();
        return this;
    }

    public FeatureFixtures lifetimeVolumeEth(double value) {
        volume = volume.toBuilder().lifetimeVolumeEth(value).build();
        return this;
    }

    public FeatureFixtures avgTxSize(double value) {
        volume = volume.toBuilder().avgTxSize(value).build();
        return this;
    }

    public FeatureFixtures maxSingleTx(double value) {
        volume = volume.toBuilder().maxSingleTx(value).build();
        return this;
    }

    public FeatureFixtures uniqueCounterparties(int value) {
        network = network.toBuilder().uniqueCounterparties(value).build();
        return this;
    }

    public FeatureFixtures repeatCounterpartyRatio(double value) {
        network = network.toBuilder().repeatCounterpartyRatio(value).build();
        return this;
    }

    public FeatureFixtures top5CounterpartyShare(double value) {
        network = network.toBuilder().top5CounterpartyShare(value).build();
        return this;
    }

    public FeatureFixtures dexInteractionRatio(double value) {
        behavioral = behavioral.toBuilder().dexInteractionRatio(value).build();
        return this;
    }

    public FeatureFixtures cexInteractionRatio(double value) {
        behavioral = behavioral.toBuilder().cexInteractionRatio(value).build();
        return this;
    }

    public FeatureFixtures bridgeRatio(double value) {
        behavioral = behavioral.toBuilder().bridgeRatio(value).build();
        return this;
    }

    public FeatureFixtures contractCallRatio(double value) {
        behavioral = behavioral.toBuilder().contractCallRatio(value).build();
        return this;
    }

    public FeatureFixtures sameBlock(int maxTxs, int threePlusCount) {
        behavioral = behavioral.toBuilder().sameBlockMaxTxs(maxTxs).sameBlock3PlusCount(threePlusCount).build();
        return this;
    }

    public FeatureFixtures gasSpikeRatio(double value) {
        behavioral = behavioral.toBuilder().gasSpikeRatio(value).build();
        return this;
    }

    public FeatureFixtures cexVolumeShare(double value) {
        behavioral = behavioral.toBuilder().cexVolumeShare(value).build();
        return this;
    }

    public FeatureFixtures sweepPatternScore(double value) {
        behavioral = behavioral.toBuilder().sweepPatternScore(value).build();
        return this;
    }

    public FeatureFixtures zeroBalanceFrequency(double value) {
        behavioral = behavioral.toBuilder().zeroBalanceFrequency(value).build();
        return this;
    }

    public FeatureFixtures burstActivityScore(double value) {
        temporal = temporal.toBuilder().burstActivityScore(value).build();
        return this;
    }

    public FeatureSummary build() {
        return new FeatureSummary(activity, volume, network, behavioral, temporal, institutional);
    }
}
