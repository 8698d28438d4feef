package com.entityradar.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.Collections;
import java.util.List;

/**
 * Derived metrics for one address, recomputed on every call. Never partially populated: with no data the
 * canonical {@link #empty()} shape is returned (all zeros, seven-slot weekly pattern).
 * Ratios carry 3 decimals, ETH amounts 4.
 */
@Builder(toBuilder = true)
public record FeatureSummary(
        @JsonProperty("activity_metrics") ActivityMetrics activity,
        @JsonProperty("volume_metrics") VolumeMetrics volume,
        @JsonProperty("network_metrics") NetworkMetrics network,
        @JsonProperty("behavioral_metrics") BehavioralMetrics behavioral,
        @JsonProperty("temporal_metrics") TemporalMetrics temporal,
        @JsonProperty("institutional_metrics") InstitutionalMetrics institutional
) {

    public static final int DAYS_PER_WEEK = 7;

    private static final FeatureSummary EMPTY = new FeatureSummary(
            new ActivityMetrics(0, 0, 0, 0, 0, 0),
            new VolumeMetrics(0, 0, 0, 0, 0, 0, 0, 0),
            new NetworkMetrics(0, 0, 0),
            new BehavioralMetrics(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0),
            new TemporalMetrics(0, Collections.nCopies(DAYS_PER_WEEK, 0.0)),
            new InstitutionalMetrics(0, 0, 0));

    public static FeatureSummary empty() {
        return EMPTY;
    }

    @Builder(toBuilder = true)
    public record ActivityMetrics(
            @JsonProperty("total_txs") int totalTxs,
            @JsonProperty("internal_tx_count") int internalTxCount,
            @JsonProperty("wallet_age_days") double walletAgeDays,
            @JsonProperty("active_days_ratio") double activeDaysRatio,
            @JsonProperty("avg_tx_per_day") double avgTxPerDay,
            @JsonProperty("tx_frequency_std_dev") double txFrequencyStdDev
    ) {
    }

    @Builder(toBuilder = true)
    public record VolumeMetrics(
            @JsonProperty("lifetime_volume_eth") double lifetimeVolumeEth,
            @JsonProperty("total_in_eth") double totalInEth,
            @JsonProperty("total_out_eth") double totalOutEth,
            @JsonProperty("net_flow") double netFlow,
            @JsonProperty("inflow_outflow_ratio") double inflowOutflowRatio,
            @JsonProperty("avg_tx_size") double avgTxSize,
            @JsonProperty("median_tx_size") double medianTxSize,
            @JsonProperty("max_single_tx") double maxSingleTx
    ) {
    }

    @Builder(toBuilder = true)
    public record NetworkMetrics(
            @JsonProperty("unique_counterparties") int uniqueCounterparties,
            @JsonProperty("repeat_counterparty_ratio") double repeatCounterpartyRatio,
            @JsonProperty("top_5_counterparty_share") double top5CounterpartyShare
    ) {
    }

    @Builder(toBuilder = true)
    public record BehavioralMetrics(
            @JsonProperty("dex_interaction_ratio") double dexInteractionRatio,
            @JsonProperty("cex_interaction_ratio") double cexInteractionRatio,
            @JsonProperty("bridge_ratio") double bridgeRatio,
            @JsonProperty("contract_call_ratio") double contractCallRatio,
            @JsonProperty("same_block_3_plus_count") int sameBlock3PlusCount,
            @JsonProperty("same_block_max_txs") int sameBlockMaxTxs,
            @JsonProperty("gas_spike_ratio") double gasSpikeRatio,
            @JsonProperty("cex_counterparty_count") int cexCounterpartyCount,
            @JsonProperty("cex_volume_share") double cexVolumeShare,
            @JsonProperty("cex_interaction_count") int cexInteractionCount,
            @JsonProperty("round_number_transfers") int roundNumberTransfers,
            @JsonProperty("weekly_burst_count") int weeklyBurstCount,
            @JsonProperty("sweep_pattern_score") double sweepPatternScore,
            @JsonProperty("zero_balance_frequency") double zeroBalanceFrequency
    ) {
    }

    /**
     * @param weeklyActivityPattern share of transactions per UTC day of week, Sunday first
     */
    @Builder(toBuilder = true)
    public record TemporalMetrics(
            @JsonProperty("burst_activity_score") double burstActivityScore,
            @JsonProperty("weekly_activity_pattern") List<Double> weeklyActivityPattern
    ) {
        public TemporalMetrics {
            weeklyActivityPattern = weeklyActivityPattern == null
                    ? Collections.nCopies(DAYS_PER_WEEK, 0.0)
                    : List.copyOf(weeklyActivityPattern);
        }
    }

    @Builder(toBuilder = true)
    public record InstitutionalMetrics(
            @JsonProperty("behavioral_stability_score") double behavioralStabilityScore,
            @JsonProperty("flow_consistency_metric") double flowConsistencyMetric,
            @JsonProperty("counterparty_entropy_score") double counterpartyEntropyScore
    ) {
    }
}
