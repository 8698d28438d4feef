package com.entityradar.labels;

/**
 * Known-address lookups used by feature extraction, funding analysis and clustering.
 * All checks are case-insensitive; null or blank input is never known.
 */
public interface KnownAddressRegistry {

    /** Strict exchange set: bridges excluded. */
    boolean isCex(String address);

    boolean isBridge(String address);

    default boolean isCexOrBridge(String address) {
        return isCex(address) || isBridge(address);
    }

    boolean isDexRouter(String address);

    boolean isWeth(String address);

    boolean isUsdt(String address);

    /**
     * Known contract (DEX router, exchange, bridge, WETH, USDT). Such addresses are never cluster members.
     */
    default boolean isKnownContract(String address) {
        return isCexOrBridge(address) || isDexRouter(address) || isWeth(address) || isUsdt(address);
    }
}
