package com.entityradar.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Static known-address sets (Ethereum mainnet by default). See application.yml entityradar.known-addresses.
 * Lists are case-insensitive; bridges are kept apart from exchanges so exchange-only signals can exclude them.
 */
@ConfigurationProperties(prefix = "entityradar.known-addresses")
@NoArgsConstructor
@Getter
@Setter
public class KnownAddressProperties {

    /** Centralized exchange hot / custody wallets. Bridges must not be listed here. */
    private List<String> cex = new ArrayList<>(List.of(
            "0x28c6c06298d514db089934071355e5743bf21d60",  // Binance 14
            "0x21a31ee1afc51d94c2efccaa2092ad1028285549",  // Binance 15
            "0xdfd5293d8e347dfe59e90efd55b2956a1343963d",  // Binance 16
            "0x56eddb7aa87536c09ccc2793473599fd21a8d17a",  // Binance 17
            "0xbe0eb53f46cd790cd13851d5eff43d12404d33e8",  // Binance 7
            "0xf977814e90da44bfa03b6295a0616a897441acec",  // Binance 8
            "0x47ac0fb4f2d84898e4d9e7b4dab3c24507a6d503",  // Binance
            "0x876eabf441b2ee5b5b0554fd502a8e0600950cfa",  // Bitfinex
            "0x1151314c646ce4e0efd76d1af4760ae66a9fe30f",  // Bitfinex
            "0x2faf487a4414fe77e2327f0bf4ae2a264a776ad2"   // FTX
    ));

    /** Bridge / cross-chain contracts. */
    private List<String> bridges = new ArrayList<>(List.of(
            "0xc098b2a3aa256d2140208c3de6543aaef5cd3a94",
            "0x40ec5b33f54e0e8a33a975908c5ba1c14e5bbbdf",  // Polygon ERC20 bridge
            "0xa0c68c638235ee32657e8f720a23cec1bfc77c77"   // Polygon bridge
    ));

    /** DEX routers and aggregators. */
    private List<String> dexRouters = new ArrayList<>(List.of(
            "0x7a250d5630b4cf539739df2c5dacb4c659f2488d",  // Uniswap V2
            "0xe592427a0aece92de3edee1f18e0157c05861564",  // Uniswap V3
            "0x68b3465833fb72a70ecdf485e0e4c7bd8665fc45",  // Uniswap V3 router 2
            "0xef1c6e67703c7bd7107eed8303fbe6ec2554bf6b",  // Uniswap universal router (old)
            "0xdef1c0ded9bec7f1a1670819833240f027b25eff",  // 0x exchange proxy
            "0x1111111254eeb25477b68fb85ed929f73a960582",  // 1inch v5
            "0x111111125421ca6dc452d289314280a0f8842a65"   // 1inch v6
    ));

    /** Wrapped Ether. */
    private String weth = "0xc02aaa39b223fe8d0a0e5c4f27ead9083c756cc2";

    /** Tether USD. */
    private String usdt = "0xdac17f958d2ee523a2206206994597c13d831ec7";
}
