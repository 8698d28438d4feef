package com.entityradar.domain;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Transaction builders and well-known addresses for tests.
 */
public final class TestTransactions {

    public static final String SELF = "0x1111111111111111111111111111111111111111";
    public static final String BINANCE_14 = "0x28c6c06298d514db089934071355e5743bf21d60";
    public static final String POLYGON_BRIDGE = "0x40ec5b33f54e0e8a33a975908c5ba1c14e5bbbdf";
    public static final String POLYGON_PLASMA_BRIDGE = "0xa0c68c638235ee32657e8f720a23cec1bfc77c77";
    public static final String UNISWAP_V2 = "0x7a250d5630b4cf539739df2c5dacb4c659f2488d";
    public static final String UNISWAP_V3 = "0xe592427a0aece92de3edee1f18e0157c05861564";
    public static final String WETH = "0xc02aaa39b223fe8d0a0e5c4f27ead9083c756cc2";

    /** 2023-11-14T22:13:20Z, a Tuesday. */
    public static final long T0 = 1_700_000_000L;
    public static final long DAY = 86_400L;
    public static final String GAS_20_GWEI = "20000000000";

    private TestTransactions() {
    }

    /** Deterministic plain wallet address for index {@code i}. */
    public static String wallet(int i) {
        return String.format(Locale.ROOT, "0x%040x", 0xabc000L + i);
    }

    public static String wei(double eth) {
        return BigDecimal.valueOf(eth).movePointRight(18).toBigInteger().toString();
    }

    public static TransactionRecord send(String to, double eth, long ts, long block) {
        return TransactionRecord.of(SELF, to, wei(eth), ts, block, GAS_20_GWEI, "0x");
    }

    public static TransactionRecord receive(String from, double eth, long ts, long block) {
        return TransactionRecord.of(from, SELF, wei(eth), ts, block, GAS_20_GWEI, "0x");
    }

    public static TransactionRecord internalFrom(String from, double eth, long ts) {
        return TransactionRecord.internal(from, SELF, wei(eth), ts, 0);
    }

    public static TransactionRecord internalTo(String to, double eth, long ts) {
        return TransactionRecord.internal(SELF, to, wei(eth), ts, 0);
    }
}
