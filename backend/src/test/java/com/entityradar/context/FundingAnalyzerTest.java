package com.entityradar.context;

import com.entityradar.config.KnownAddressProperties;
import com.entityradar.domain.Funder;
import com.entityradar.domain.FundingAnalysis;
import com.entityradar.domain.TransactionRecord;
import com.entityradar.labels.DefaultKnownAddressRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.entityradar.domain.TestTransactions.BINANCE_14;
import static com.entityradar.domain.TestTransactions.POLYGON_BRIDGE;
import static com.entityradar.domain.TestTransactions.SELF;
import static com.entityradar.domain.TestTransactions.internalFrom;
import static com.entityradar.domain.TestTransactions.receive;
import static com.entityradar.domain.TestTransactions.send;
import static com.entityradar.domain.TestTransactions.wallet;
import static org.assertj.core.api.Assertions.assertThat;

class FundingAnalyzerTest {

    private FundingAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new FundingAnalyzer(new DefaultKnownAddressRegistry(new KnownAddressProperties()));
    }

    @Test
    @DisplayName("aggregates inbound senders across normal and internal transactions")
    void aggregatesFunders() {
        List<TransactionRecord> txs = List.of(
                receive(wallet(1), 1, 100, 1),
                receive(wallet(1), 2, 50, 2),
                send(wallet(2), 5, 200, 3));
        List<TransactionRecord> internal = List.of(internalFrom(BINANCE_14, 5, 300));

        FundingAnalysis result = analyzer.analyze(txs, internal, SELF);

        assertThat(result.funders()).containsExactly(
                new Funder(wallet(1), 2, 3.0, 50, 100),
                new Funder(BINANCE_14, 1, 5.0, 300, 300));
        assertThat(result.cexOrBridgeFunders()).containsExactly(BINANCE_14);
        assertThat(result.signals()).containsExactly(
                FundingAnalysis.SHARED_FUNDING_CEX_BRIDGE, FundingAnalysis.HAS_FUNDING_SOURCES);
    }

    @Test
    @DisplayName("no inbound transfers yields the empty analysis")
    void noInbound_returnsEmpty() {
        FundingAnalysis result = analyzer.analyze(List.of(send(wallet(1), 1, 100, 1)), List.of(), SELF);

        assertThat(result).isEqualTo(FundingAnalysis.empty());
        assertThat(analyzer.analyze(null, null, SELF).signals()).isEmpty();
    }

    @Test
    @DisplayName("plain funders emit only has_funding_sources")
    void plainFunders() {
        FundingAnalysis result = analyzer.analyze(List.of(receive(wallet(1), 1, 100, 1)), List.of(), SELF);

        assertThat(result.funderCount()).isEqualTo(1);
        assertThat(result.cexOrBridgeFunders()).isEmpty();
        assertThat(result.signals()).containsExactly(FundingAnalysis.HAS_FUNDING_SOURCES);
    }

    @Test
    @DisplayName("bridge funders are flagged like exchanges")
    void bridgeFunder() {
        FundingAnalysis result = analyzer.analyze(List.of(receive(POLYGON_BRIDGE, 1, 100, 1)), List.of(), SELF);

        assertThat(result.hasSignal(FundingAnalysis.SHARED_FUNDING_CEX_BRIDGE)).isTrue();
    }

    @Test
    @DisplayName("address matching is case-insensitive and self-transfers are ignored")
    void caseInsensitiveAndSelfIgnored() {
        TransactionRecord upper = TransactionRecord.of(wallet(1).toUpperCase().replace("0X", "0x"),
                SELF.toUpperCase().replace("0X", "0x"), "1000000000000000000", 10, 1, null, "0x");
        TransactionRecord selfTransfer = TransactionRecord.of(SELF, SELF, "1000000000000000000", 20, 2, null, "0x");

        FundingAnalysis result = analyzer.analyze(List.of(upper, selfTransfer), List.of(), SELF);

        assertThat(result.funders()).extracting(Funder::address).containsExactly(wallet(1));
    }
}
