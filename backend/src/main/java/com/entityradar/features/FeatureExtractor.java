package com.entityradar.features;

import com.entityradar.common.ChainValues;
import com.entityradar.common.ScoreMath;
import com.entityradar.domain.FeatureSummary;
import com.entityradar.domain.FeatureSummary.ActivityMetrics;
import com.entityradar.domain.FeatureSummary.BehavioralMetrics;
import com.entityradar.domain.FeatureSummary.InstitutionalMetrics;
import com.entityradar.domain.FeatureSummary.NetworkMetrics;
import com.entityradar.domain.FeatureSummary.TemporalMetrics;
import com.entityradar.domain.FeatureSummary.VolumeMetrics;
import com.entityradar.domain.TransactionRecord;
import com.entityradar.labels.KnownAddressRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns an address's normal and internal transactions into a {@link FeatureSummary}.
 * Pure function of its inputs; malformed fields are coerced to zero and never throw.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FeatureExtractor {

    static final double ROUND_NUMBER_MIN_ETH = 10.0;
    static final double ROUND_NUMBER_TOLERANCE = 0.001;
    static final int SAME_BLOCK_MIN_TXS = 3;
    static final int BURST_MIN_TXS = 3;
    static final long BURST_WINDOW_SECONDS = 600;
    static final int BURST_MIN_WEEKS = 2;
    static final double BURST_SATURATION = 20.0;
    static final int SWEEP_MIN_OUTBOUND_VALUES = 15;
    static final int SWEEP_MIN_OUTBOUND_COUNTERPARTIES = 10;
    static final double SWEEP_COUNTERPARTY_SATURATION = 50.0;
    static final int ZERO_BALANCE_MIN_TXS = 10;
    static final int CONTRACT_CALL_MIN_INPUT_LENGTH = 10;
    static final double FLOW_CONSISTENCY_FACTOR = 1.2;
    private static final long SECONDS_PER_DAY = 86_400;
    private static final long SECONDS_PER_WEEK = SECONDS_PER_DAY * 7;
    private static final double MIN_FLOW = 0.001;
    private static final int TOP_COUNTERPARTIES = 5;

    private final KnownAddressRegistry knownAddresses;

    public FeatureSummary extract(List<TransactionRecord> txs, List<TransactionRecord> internalTxs, String address) {
        List<TransactionRecord> normal = txs == null ? List.of() : txs;
        int internalCount = internalTxs == null ? 0 : internalTxs.size();
        if (normal.isEmpty()) {
            return FeatureSummary.empty();
        }
        String self = ChainValues.normalizeAddress(address);
        List<Tx> parsed = normal.stream().filter(t -> t != null).map(Tx::of).toList();
        if (parsed.isEmpty()) {
            return FeatureSummary.empty();
        }

        List<Long> timestamps = parsed.stream().map(Tx::timestamp).filter(t -> t != null).sorted().toList();
        ActivityMetrics activity = activity(parsed.size(), internalCount, timestamps);
        Map<String, Integer> counterparties = counterparties(parsed, self);
        VolumeMetrics volume = volume(parsed, self);
        NetworkMetrics network = network(counterparties);
        BehavioralMetrics behavioral = behavioral(parsed, self, timestamps, volume);
        TemporalMetrics temporal = temporal(parsed.size(), timestamps);
        InstitutionalMetrics institutional = institutional(timestamps, volume, counterparties);

        FeatureSummary summary = new FeatureSummary(activity, volume, network, behavioral, temporal, institutional);
        log.debug("Features for {}: txs={}, cp={}, ageDays={}", self, activity.totalTxs(),
                network.uniqueCounterparties(), activity.walletAgeDays());
        return summary;
    }

    private ActivityMetrics activity(int totalTxs, int internalCount, List<Long> timestamps) {
        double ageDays = 0;
        if (timestamps.size() >= 2) {
            ageDays = ScoreMath.round((timestamps.get(timestamps.size() - 1) - timestamps.get(0))
                    / (double) SECONDS_PER_DAY, ScoreMath.SCORE_SCALE);
        }
        Map<Long, Integer> perDay = new TreeMap<>();
        for (long ts : timestamps) {
            perDay.merge(Math.floorDiv(ts, SECONDS_PER_DAY), 1, Integer::sum);
        }
        double span = Math.max(1.0, ageDays);
        double activeDaysRatio = ScoreMath.ratio(Math.min(1.0, perDay.size() / span));
        double avgTxPerDay = ageDays > 0 ? ScoreMath.ratio(totalTxs / span) : 0.0;
        return new ActivityMetrics(totalTxs, internalCount, ageDays, activeDaysRatio, avgTxPerDay,
                ScoreMath.ratio(stdDev(perDay.values())));
    }

    private static double stdDev(Iterable<Integer> counts) {
        List<Integer> values = new ArrayList<>();
        counts.forEach(values::add);
        if (values.isEmpty()) {
            return 0.0;
        }
        double mean = values.stream().mapToInt(Integer::intValue).average().orElse(0);
        double variance = values.stream().mapToDouble(c -> (c - mean) * (c - mean)).sum() / values.size();
        return Math.sqrt(variance);
    }

    private static double meanDaily(List<Long> timestamps) {
        Map<Long, Integer> perDay = new HashMap<>();
        for (long ts : timestamps) {
            perDay.merge(Math.floorDiv(ts, SECONDS_PER_DAY), 1, Integer::sum);
        }
        return perDay.isEmpty() ? 0.0 : (double) timestamps.size() / perDay.size();
    }

    private VolumeMetrics volume(List<Tx> txs, String self) {
        double in = 0;
        double out = 0;
        List<Double> values = new ArrayList<>();
        for (Tx tx : txs) {
            if (tx.from().equals(self)) {
                out += tx.valueEth();
                if (tx.valueEth() > 0) {
                    values.add(tx.valueEth());
                }
            }
            if (tx.to().equals(self)) {
                in += tx.valueEth();
                if (tx.valueEth() > 0) {
                    values.add(tx.valueEth());
                }
            }
        }
        double maxFlow = Math.max(Math.max(in, out), MIN_FLOW);
        double avg = values.isEmpty() ? 0 : values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        List<Double> sorted = values.stream().sorted().toList();
        double median = sorted.isEmpty() ? 0 : sorted.get(sorted.size() / 2);
        double max = sorted.isEmpty() ? 0 : sorted.get(sorted.size() - 1);
        return new VolumeMetrics(
                ScoreMath.money(in + out),
                ScoreMath.money(in),
                ScoreMath.money(out),
                ScoreMath.money(in - out),
                ScoreMath.ratio(Math.min(in, out) / maxFlow),
                ScoreMath.money(avg),
                ScoreMath.money(median),
                ScoreMath.money(max));
    }

    /** Interaction counts per counterparty, both directions, insertion ordered. */
    private static Map<String, Integer> counterparties(List<Tx> txs, String self) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Tx tx : txs) {
            if (tx.from().equals(self) && !tx.to().isEmpty()) {
                counts.merge(tx.to(), 1, Integer::sum);
            }
            if (tx.to().equals(self) && !tx.from().isEmpty()) {
                counts.merge(tx.from(), 1, Integer::sum);
            }
        }
        return counts;
    }

    private static NetworkMetrics network(Map<String, Integer> counterparties) {
        int unique = counterparties.size();
        int interactions = counterparties.values().stream().mapToInt(Integer::intValue).sum();
        if (interactions == 0) {
            return new NetworkMetrics(0, 0, 0);
        }
        int top5 = counterparties.values().stream()
                .sorted(Comparator.reverseOrder())
                .limit(TOP_COUNTERPARTIES)
                .mapToInt(Integer::intValue)
                .sum();
        return new NetworkMetrics(unique,
                ScoreMath.ratio(1.0 - (double) unique / interactions),
                ScoreMath.ratio((double) top5 / interactions));
    }

    private BehavioralMetrics behavioral(List<Tx> txs, String self, List<Long> timestamps, VolumeMetrics volume) {
        int total = txs.size();
        int dex = 0;
        int cexOrBridge = 0;
        int bridge = 0;
        int contractCalls = 0;
        int roundNumbers = 0;
        double cexVolume = 0;
        Set<String> cexCounterparties = new HashSet<>();
        Map<Long, Integer> sentPerBlock = new HashMap<>();
        for (Tx tx : txs) {
            boolean involvesSelf = tx.from().equals(self) || tx.to().equals(self);
            if (involvesSelf && knownAddresses.isDexRouter(tx.to())) {
                dex++;
            }
            if (involvesSelf && knownAddresses.isCexOrBridge(tx.to())) {
                cexOrBridge++;
            }
            if (involvesSelf && knownAddresses.isCexOrBridge(tx.from())) {
                cexOrBridge++;
            }
            if (involvesSelf && (knownAddresses.isBridge(tx.to()) || knownAddresses.isBridge(tx.from()))) {
                bridge++;
            }
            if (knownAddresses.isCex(tx.to())) {
                cexCounterparties.add(tx.to());
            }
            if (knownAddresses.isCex(tx.from())) {
                cexCounterparties.add(tx.from());
            }
            if (tx.from().equals(self) && knownAddresses.isCex(tx.to())) {
                cexVolume += tx.valueEth();
            }
            if (tx.to().equals(self) && knownAddresses.isCex(tx.from())) {
                cexVolume += tx.valueEth();
            }
            if (isRoundNumber(tx.valueEth())) {
                roundNumbers++;
            }
            if (involvesSelf && !tx.to().isEmpty() && tx.input().length() > CONTRACT_CALL_MIN_INPUT_LENGTH) {
                contractCalls++;
            }
            if (tx.from().equals(self) && tx.block() != null) {
                sentPerBlock.merge(tx.block(), 1, Integer::sum);
            }
        }
        int sameBlock3Plus = (int) sentPerBlock.values().stream().filter(c -> c >= SAME_BLOCK_MIN_TXS).count();
        int sameBlockMax = sentPerBlock.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        double totalVolume = volume.totalInEth() + volume.totalOutEth();

        return BehavioralMetrics.builder()
                .dexInteractionRatio(ScoreMath.ratio((double) dex / total))
                .cexInteractionRatio(ScoreMath.ratio(Math.min(1.0, (double) cexOrBridge / total)))
                .bridgeRatio(ScoreMath.ratio((double) bridge / total))
                .contractCallRatio(ScoreMath.ratio((double) contractCalls / total))
                .sameBlock3PlusCount(sameBlock3Plus)
                .sameBlockMaxTxs(sameBlockMax)
                .gasSpikeRatio(gasSpikeRatio(txs))
                .cexCounterpartyCount(cexCounterparties.size())
                .cexVolumeShare(totalVolume > 0 ? ScoreMath.ratio(Math.min(1.0, cexVolume / totalVolume)) : 0)
                .cexInteractionCount(cexOrBridge)
                .roundNumberTransfers(roundNumbers)
                .weeklyBurstCount(burstWeeks(timestamps).size())
                .sweepPatternScore(sweepPatternScore(txs, self))
                .zeroBalanceFrequency(zeroBalanceFrequency(txs, self))
                .build();
    }

    private static boolean isRoundNumber(double eth) {
        return eth >= ROUND_NUMBER_MIN_ETH && Math.abs(eth - Math.rint(eth)) < ROUND_NUMBER_TOLERANCE;
    }

    /** Share of transactions paying at least twice the (upper) median gas price. */
    private static double gasSpikeRatio(List<Tx> txs) {
        List<Long> prices = txs.stream().map(Tx::gasPrice).filter(g -> g != null && g > 0).sorted().toList();
        if (prices.isEmpty()) {
            return 0.0;
        }
        long median = prices.get(prices.size() / 2);
        // g >= 2 * median without overflowing near Long.MAX_VALUE
        long spikes = prices.stream().filter(g -> g / 2 >= median).count();
        return ScoreMath.ratio((double) spikes / txs.size());
    }

    /** Epoch weeks holding at least one window of 3+ transactions within 600 seconds. */
    private static Set<Long> burstWeeks(List<Long> timestamps) {
        Set<Long> weeks = new HashSet<>();
        for (int i = 0; i < timestamps.size(); i++) {
            if (windowSize(timestamps, i) >= BURST_MIN_TXS) {
                weeks.add(Math.floorDiv(timestamps.get(i), SECONDS_PER_WEEK));
            }
        }
        return weeks;
    }

    private static int windowSize(List<Long> timestamps, int start) {
        long t = timestamps.get(start);
        int count = 1;
        while (start + count < timestamps.size() && timestamps.get(start + count) - t <= BURST_WINDOW_SECONDS) {
            count++;
        }
        return count;
    }

    private static double burstActivityScore(List<Long> timestamps) {
        if (burstWeeks(timestamps).size() < BURST_MIN_WEEKS) {
            return 0.0;
        }
        int burstTotal = 0;
        for (int i = 0; i < timestamps.size(); i++) {
            int size = windowSize(timestamps, i);
            if (size >= BURST_MIN_TXS) {
                burstTotal += size;
            }
        }
        return ScoreMath.ratio(Math.min(1.0, burstTotal / BURST_SATURATION));
    }

    /** Many small outbound sends spread over many recipients. */
    private static double sweepPatternScore(List<Tx> txs, String self) {
        List<Tx> outbound = txs.stream().filter(t -> t.from().equals(self)).toList();
        List<Double> values = outbound.stream().map(Tx::valueEth).filter(v -> v > 0).sorted().toList();
        long recipients = outbound.stream().map(Tx::to).filter(to -> !to.isEmpty()).distinct().count();
        if (values.size() < SWEEP_MIN_OUTBOUND_VALUES || recipients < SWEEP_MIN_OUTBOUND_COUNTERPARTIES) {
            return 0.0;
        }
        double median = values.get(values.size() / 2);
        double limit = (median > 0 ? median : 1.0) * 2;
        long small = values.stream().filter(v -> v <= limit).count();
        if (small < values.size() * 0.5) {
            return 0.0;
        }
        return ScoreMath.ratio(Math.min(1.0, recipients / SWEEP_COUNTERPARTY_SATURATION));
    }

    /** Outbound transaction followed within a day by a non-inbound one, per transaction. */
    private static double zeroBalanceFrequency(List<Tx> txs, String self) {
        if (txs.size() <= ZERO_BALANCE_MIN_TXS) {
            return 0.0;
        }
        List<Tx> ordered = txs.stream()
                .filter(t -> t.timestamp() != null)
                .sorted(Comparator.comparing(Tx::timestamp))
                .toList();
        int signals = 0;
        for (int i = 1; i < ordered.size(); i++) {
            Tx prev = ordered.get(i - 1);
            Tx curr = ordered.get(i);
            if (prev.from().equals(self) && !curr.to().equals(self)
                    && curr.timestamp() - prev.timestamp() < SECONDS_PER_DAY) {
                signals++;
            }
        }
        return ScoreMath.ratio(Math.min(1.0, (double) signals / txs.size()));
    }

    private static TemporalMetrics temporal(int totalTxs, List<Long> timestamps) {
        int[] perWeekday = new int[FeatureSummary.DAYS_PER_WEEK];
        for (long ts : timestamps) {
            DayOfWeek day = Instant.ofEpochSecond(ts).atOffset(ZoneOffset.UTC).getDayOfWeek();
            perWeekday[day.getValue() % FeatureSummary.DAYS_PER_WEEK]++;
        }
        List<Double> pattern = new ArrayList<>(FeatureSummary.DAYS_PER_WEEK);
        for (int count : perWeekday) {
            pattern.add(ScoreMath.ratio((double) count / totalTxs));
        }
        return new TemporalMetrics(burstActivityScore(timestamps), pattern);
    }

    private static InstitutionalMetrics institutional(List<Long> timestamps, VolumeMetrics volume,
                                                      Map<String, Integer> counterparties) {
        double mean = meanDaily(timestamps);
        double std = ScoreMath.ratio(stdDev(dailyCounts(timestamps)));
        double stability = 1.0 - Math.min(1.0, std / (mean > 0 ? mean : 1.0));
        double flowConsistency = Math.min(1.0, volume.inflowOutflowRatio() * FLOW_CONSISTENCY_FACTOR);
        return new InstitutionalMetrics(ScoreMath.ratio(stability), ScoreMath.ratio(flowConsistency),
                entropy(counterparties));
    }

    private static List<Integer> dailyCounts(List<Long> timestamps) {
        Map<Long, Integer> perDay = new HashMap<>();
        for (long ts : timestamps) {
            perDay.merge(Math.floorDiv(ts, SECONDS_PER_DAY), 1, Integer::sum);
        }
        return new ArrayList<>(perDay.values());
    }

    /** Shannon entropy of the counterparty distribution, normalized by log2(unique). */
    private static double entropy(Map<String, Integer> counterparties) {
        int unique = counterparties.size();
        int total = counterparties.values().stream().mapToInt(Integer::intValue).sum();
        if (unique <= 1 || total == 0) {
            return 0.0;
        }
        double entropy = 0;
        for (int count : counterparties.values()) {
            double p = (double) count / total;
            entropy -= p * log2(p);
        }
        return ScoreMath.ratio(ScoreMath.clamp01(entropy / log2(unique)));
    }

    private static double log2(double x) {
        return Math.log(x) / Math.log(2);
    }

    /** Parsed view of one transaction, addresses lowercased. */
    private record Tx(String from, String to, double valueEth, Long timestamp, Long block, Long gasPrice,
                      String input) {

        static Tx of(TransactionRecord tx) {
            return new Tx(
                    ChainValues.normalizeAddress(tx.from()),
                    ChainValues.normalizeAddress(tx.to()),
                    ChainValues.weiToEth(tx.value()),
                    ChainValues.parseLong(tx.timeStamp()),
                    ChainValues.parseLong(tx.blockNumber()),
                    ChainValues.parseLong(tx.gasPrice()),
                    tx.input() == null ? "" : tx.input());
        }
    }
}
