package com.entityradar.common;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

/**
 * Lenient coercion of Etherscan-style string fields. Never throws: malformed input becomes zero / null / "".
 */
public final class ChainValues {

    private static final BigDecimal WEI_PER_ETH = new BigDecimal("1e18");

    private ChainValues() {
    }

    /**
     * Wei string (decimal or 0x-hex) to ETH. Hex is parsed as {@link BigInteger} before dividing so large values keep
     * full precision up to the final double conversion.
     */
    public static double weiToEth(String wei) {
        BigDecimal value = parseWei(wei);
        if (value.signum() == 0) {
            return 0.0;
        }
        return value.divide(WEI_PER_ETH, MathContext.DECIMAL64).doubleValue();
    }

    static BigDecimal parseWei(String wei) {
        if (wei == null) {
            return BigDecimal.ZERO;
        }
        String s = wei.strip();
        if (s.isEmpty()) {
            return BigDecimal.ZERO;
        }
        try {
            if (s.startsWith("0x") || s.startsWith("0X")) {
                String hex = s.substring(2);
                return hex.isEmpty() ? BigDecimal.ZERO : new BigDecimal(new BigInteger(hex, 16));
            }
            return new BigDecimal(s);
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }

    /**
     * Integer field (timestamp, block number, gas price), decimal or 0x-hex. Returns null when absent or malformed.
     */
    public static Long parseLong(String value) {
        if (value == null) {
            return null;
        }
        String s = value.strip();
        if (s.isEmpty()) {
            return null;
        }
        try {
            if (s.startsWith("0x") || s.startsWith("0X")) {
                return new BigInteger(s.substring(2), 16).longValueExact();
            }
            return new BigDecimal(s).toBigInteger().longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            return null;
        }
    }

    /** Lowercase, stripped address; null becomes "". */
    public static String normalizeAddress(String address) {
        if (address == null) {
            return "";
        }
        return address.strip().toLowerCase();
    }
}
