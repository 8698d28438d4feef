package com.entityradar.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record FundingAnalysis(
        @JsonProperty("funders") List<Funder> funders,
        @JsonProperty("cex_or_bridge_funders") List<String> cexOrBridgeFunders,
        @JsonProperty("signals") List<String> signals
) {

    public static final String SHARED_FUNDING_CEX_BRIDGE = "shared_funding_cex_bridge";
    public static final String HAS_FUNDING_SOURCES = "has_funding_sources";

    public FundingAnalysis {
        funders = funders == null ? List.of() : List.copyOf(funders);
        cexOrBridgeFunders = cexOrBridgeFunders == null ? List.of() : List.copyOf(cexOrBridgeFunders);
        signals = signals == null ? List.of() : List.copyOf(signals);
    }

    public static FundingAnalysis empty() {
        return new FundingAnalysis(List.of(), List.of(), List.of());
    }

    public int funderCount() {
        return funders.size();
    }

    public boolean hasSignal(String signal) {
        return signals.contains(signal);
    }
}
