package com.entityradar.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * One on-chain transaction as supplied by the caller (Etherscan-style field names). Immutable; never fetched here.
 * All scalars are strings: {@code value} is wei in decimal or 0x-hex, {@code timeStamp} is unix seconds.
 * Internal transactions use the same shape with an empty {@code input}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TransactionRecord(
        @JsonProperty("from") String from,
        @JsonProperty("to") String to,
        @JsonProperty("value") String value,
        @JsonProperty("timeStamp") String timeStamp,
        @JsonProperty("blockNumber") String blockNumber,
        @JsonProperty("gasPrice") String gasPrice,
        @JsonProperty("input") String input,
        @JsonProperty("logs") List<Map<String, Object>> logs
) {

    public static TransactionRecord of(String from, String to, String value, long timeStamp, long blockNumber,
                                       String gasPrice, String input) {
        return new TransactionRecord(from, to, value, Long.toString(timeStamp), Long.toString(blockNumber),
                gasPrice, input, null);
    }

    /** Internal (trace) transaction: no gas price, no call data. */
    public static TransactionRecord internal(String from, String to, String value, long timeStamp, long blockNumber) {
        return new TransactionRecord(from, to, value, Long.toString(timeStamp), Long.toString(blockNumber),
                null, "", null);
    }
}
