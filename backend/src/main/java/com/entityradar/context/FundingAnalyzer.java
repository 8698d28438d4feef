package com.entityradar.context;

import com.entityradar.common.ChainValues;
import com.entityradar.common.ScoreMath;
import com.entityradar.domain.Funder;
import com.entityradar.domain.FundingAnalysis;
import com.entityradar.domain.TransactionRecord;
import com.entityradar.labels.KnownAddressRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates who sent value to an address, across normal and internal transactions.
 * Funders keep first-seen order; exchange and bridge funders are flagged for clustering.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FundingAnalyzer {

    private final KnownAddressRegistry knownAddresses;

    public FundingAnalysis analyze(List<TransactionRecord> txs, List<TransactionRecord> internalTxs, String address) {
        String self = ChainValues.normalizeAddress(address);
        Map<String, FunderTotals> funders = new LinkedHashMap<>();
        collectInbound(txs, self, funders);
        collectInbound(internalTxs, self, funders);
        if (funders.isEmpty()) {
            return FundingAnalysis.empty();
        }

        List<Funder> result = new ArrayList<>(funders.size());
        List<String> cexOrBridge = new ArrayList<>();
        funders.forEach((funder, totals) -> {
            result.add(totals.toFunder(funder));
            if (knownAddresses.isCexOrBridge(funder)) {
                cexOrBridge.add(funder);
            }
        });

        List<String> signals = new ArrayList<>();
        if (!cexOrBridge.isEmpty()) {
            signals.add(FundingAnalysis.SHARED_FUNDING_CEX_BRIDGE);
        }
        signals.add(FundingAnalysis.HAS_FUNDING_SOURCES);
        log.debug("Funding for {}: {} funders, {} exchange/bridge", self, result.size(), cexOrBridge.size());
        return new FundingAnalysis(result, cexOrBridge, signals);
    }

    private static void collectInbound(List<TransactionRecord> txs, String self, Map<String, FunderTotals> funders) {
        if (txs == null) {
            return;
        }
        for (TransactionRecord tx : txs) {
            if (tx == null || !ChainValues.normalizeAddress(tx.to()).equals(self)) {
                continue;
            }
            String from = ChainValues.normalizeAddress(tx.from());
            if (from.isEmpty() || from.equals(self)) {
                continue;
            }
            Long ts = ChainValues.parseLong(tx.timeStamp());
            funders.computeIfAbsent(from, k -> new FunderTotals())
                    .add(ChainValues.weiToEth(tx.value()), ts == null ? 0L : ts);
        }
    }

    private static final class FunderTotals {
        private int count;
        private double totalEth;
        private long firstTs;
        private long lastTs;

        void add(double eth, long ts) {
            count++;
            totalEth += eth;
            if (ts > 0 && (firstTs == 0 || ts < firstTs)) {
                firstTs = ts;
            }
            lastTs = Math.max(lastTs, ts);
        }

        Funder toFunder(String address) {
            return new Funder(address, count, ScoreMath.money(totalEth), firstTs, lastTs);
        }
    }
}
