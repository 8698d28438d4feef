package com.entityradar.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ChainValuesTest {

    @Test
    @DisplayName("decimal and hex wei convert to the same ETH amount")
    void weiToEthDecimalAndHex() {
        assertThat(ChainValues.weiToEth("1000000000000000000")).isEqualTo(1.0);
        assertThat(ChainValues.weiToEth("0xde0b6b3a7640000")).isEqualTo(1.0);
        assertThat(ChainValues.weiToEth("0x1bc16d674ec80000")).isEqualTo(2.0);
        assertThat(ChainValues.weiToEth("250000000000000000")).isEqualTo(0.25);
    }

    @Test
    @DisplayName("malformed or missing wei is zero")
    void malformedWeiIsZero() {
        assertThat(ChainValues.weiToEth(null)).isZero();
        assertThat(ChainValues.weiToEth("")).isZero();
        assertThat(ChainValues.weiToEth("abc")).isZero();
        assertThat(ChainValues.weiToEth("0x")).isZero();
        assertThat(ChainValues.weiToEth("0xzz")).isZero();
    }

    @Test
    @DisplayName("parseLong accepts decimal and hex, returns null otherwise")
    void parseLong() {
        assertThat(ChainValues.parseLong("1700000000")).isEqualTo(1_700_000_000L);
        assertThat(ChainValues.parseLong("0x10")).isEqualTo(16L);
        assertThat(ChainValues.parseLong(" 42 ")).isEqualTo(42L);
        assertThat(ChainValues.parseLong("oops")).isNull();
        assertThat(ChainValues.parseLong(null)).isNull();
        assertThat(ChainValues.parseLong("")).isNull();
    }

    @Test
    @DisplayName("addresses are stripped and lowercased; null becomes empty")
    void normalizeAddress() {
        assertThat(ChainValues.normalizeAddress(" 0xAbC ")).isEqualTo("0xabc");
        assertThat(ChainValues.normalizeAddress(null)).isEmpty();
    }
}
