package com.entityradar.labels;

import com.entityradar.config.KnownAddressProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.entityradar.domain.TestTransactions.BINANCE_14;
import static com.entityradar.domain.TestTransactions.POLYGON_BRIDGE;
import static com.entityradar.domain.TestTransactions.UNISWAP_V2;
import static com.entityradar.domain.TestTransactions.WETH;
import static org.assertj.core.api.Assertions.assertThat;

class DefaultKnownAddressRegistryTest {

    private KnownAddressRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DefaultKnownAddressRegistry(new KnownAddressProperties());
    }

    @Test
    @DisplayName("exchange lookup is case-insensitive")
    void exchangeCaseInsensitive() {
        assertThat(registry.isCex(BINANCE_14)).isTrue();
        assertThat(registry.isCex(BINANCE_14.toUpperCase().replace("0X", "0x"))).isTrue();
        assertThat(registry.isCex(" " + BINANCE_14 + " ")).isTrue();
    }

    @Test
    @DisplayName("bridges are not exchanges but count for cex-or-bridge")
    void bridgeIsNotExchange() {
        assertThat(registry.isBridge(POLYGON_BRIDGE)).isTrue();
        assertThat(registry.isCex(POLYGON_BRIDGE)).isFalse();
        assertThat(registry.isCexOrBridge(POLYGON_BRIDGE)).isTrue();
        assertThat(registry.isCexOrBridge(BINANCE_14)).isTrue();
    }

    @Test
    @DisplayName("routers, WETH and USDT are known contracts")
    void knownContracts() {
        assertThat(registry.isDexRouter(UNISWAP_V2)).isTrue();
        assertThat(registry.isWeth(WETH)).isTrue();
        assertThat(registry.isUsdt("0xdAC17F958D2ee523a2206206994597C13D831ec7")).isTrue();
        assertThat(registry.isKnownContract(UNISWAP_V2)).isTrue();
        assertThat(registry.isKnownContract(WETH)).isTrue();
        assertThat(registry.isKnownContract(BINANCE_14)).isTrue();
        assertThat(registry.isKnownContract("0x0000000000000000000000000000000000000001")).isFalse();
    }

    @Test
    @DisplayName("null or blank returns false")
    void nullOrBlank() {
        assertThat(registry.isCex(null)).isFalse();
        assertThat(registry.isBridge("")).isFalse();
        assertThat(registry.isDexRouter("   ")).isFalse();
        assertThat(registry.isWeth(null)).isFalse();
        assertThat(registry.isKnownContract(null)).isFalse();
    }

    @Test
    @DisplayName("synthetic address universe replaces the mainnet defaults")
    void syntheticUniverse() {
        KnownAddressProperties props = new KnownAddressProperties();
        props.setCex(List.of("0xAAAA"));
        props.setBridges(List.of());
        props.setDexRouters(null);
        props.setWeth("");
        DefaultKnownAddressRegistry synthetic = new DefaultKnownAddressRegistry(props);

        assertThat(synthetic.isCex("0xaaaa")).isTrue();
        assertThat(synthetic.isCex(BINANCE_14)).isFalse();
        assertThat(synthetic.isBridge(POLYGON_BRIDGE)).isFalse();
        assertThat(synthetic.isDexRouter(UNISWAP_V2)).isFalse();
        assertThat(synthetic.isWeth("")).isFalse();
        assertThat(synthetic.isWeth(WETH)).isFalse();
    }
}
