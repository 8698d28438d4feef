package com.entityradar.context;

import com.entityradar.common.ChainValues;
import com.entityradar.domain.CoordinationSignals;
import com.entityradar.domain.TransactionRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds coordination evidence: wallets reached through internal transactions, bursts of outbound sends,
 * and a small circle of repeatedly paid counterparties.
 */
@Component
@Slf4j
public class CoordinationDetector {

    static final long BURST_WINDOW_SECONDS = 600;
    static final int BURST_MIN_SENDS = 3;
    static final int SMALL_CIRCLE_MIN_COUNTERPARTIES = 2;
    static final int SMALL_CIRCLE_MAX_COUNTERPARTIES = 5;
    static final int SMALL_CIRCLE_MIN_SENDS = 3;

    public CoordinationSignals detect(List<TransactionRecord> txs, List<TransactionRecord> internalTxs,
                                      String address) {
        String self = ChainValues.normalizeAddress(address);
        List<String> connected = connectedWallets(internalTxs, self);

        List<Long> sendTimes = new ArrayList<>();
        Map<String, Integer> outbound = new LinkedHashMap<>();
        int sends = 0;
        if (txs != null) {
            for (TransactionRecord tx : txs) {
                if (tx == null || !ChainValues.normalizeAddress(tx.from()).equals(self)) {
                    continue;
                }
                sends++;
                Long ts = ChainValues.parseLong(tx.timeStamp());
                if (ts != null) {
                    sendTimes.add(ts);
                }
                String to = ChainValues.normalizeAddress(tx.to());
                if (!to.isEmpty()) {
                    outbound.merge(to, 1, Integer::sum);
                }
            }
        }

        List<String> temporal = hasBurst(sendTimes) ? List.of(CoordinationSignals.TEMPORAL_BURST) : List.of();
        List<String> shared = outbound.size() >= SMALL_CIRCLE_MIN_COUNTERPARTIES
                && outbound.size() <= SMALL_CIRCLE_MAX_COUNTERPARTIES
                && sends >= SMALL_CIRCLE_MIN_SENDS
                ? List.of(CoordinationSignals.SMALL_REPEATED_COUNTERPARTIES)
                : List.of();
        log.debug("Coordination for {}: connected={}, temporal={}, shared={}", self, connected.size(), temporal, shared);
        return new CoordinationSignals(connected, temporal, shared);
    }

    private static List<String> connectedWallets(List<TransactionRecord> internalTxs, String self) {
        Set<String> connected = new LinkedHashSet<>();
        if (internalTxs == null) {
            return List.of();
        }
        for (TransactionRecord tx : internalTxs) {
            if (tx == null) {
                continue;
            }
            String from = ChainValues.normalizeAddress(tx.from());
            String to = ChainValues.normalizeAddress(tx.to());
            if (from.equals(self) && !to.isEmpty() && !to.equals(self)) {
                connected.add(to);
            }
            if (to.equals(self) && !from.isEmpty() && !from.equals(self)) {
                connected.add(from);
            }
        }
        return new ArrayList<>(connected);
    }

    private static boolean hasBurst(List<Long> sendTimes) {
        List<Long> sorted = sendTimes.stream().sorted().toList();
        for (int i = 0; i + BURST_MIN_SENDS - 1 < sorted.size(); i++) {
            if (sorted.get(i + BURST_MIN_SENDS - 1) - sorted.get(i) <= BURST_WINDOW_SECONDS) {
                return true;
            }
        }
        return false;
    }
}
