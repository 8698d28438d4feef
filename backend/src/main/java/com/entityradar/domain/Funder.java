package com.entityradar.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One inbound funding source. Timestamps are unix seconds (0 when unknown).
 */
public record Funder(
        @JsonProperty("address") String address,
        @JsonProperty("count") int count,
        @JsonProperty("total_eth") double totalEth,
        @JsonProperty("first_ts") long firstTs,
        @JsonProperty("last_ts") long lastTs
) {
}
