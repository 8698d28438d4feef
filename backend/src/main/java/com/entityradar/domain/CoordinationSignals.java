package com.entityradar.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Temporal and counterparty coordination evidence for one address.
 */
public record CoordinationSignals(
        @JsonProperty("connected_wallets") List<String> connectedWallets,
        @JsonProperty("temporal_signals") List<String> temporalSignals,
        @JsonProperty("shared_counterparty_signals") List<String> sharedCounterpartySignals
) {

    public static final String TEMPORAL_BURST = "temporal_burst";
    public static final String SMALL_REPEATED_COUNTERPARTIES = "small_repeated_counterparties";

    public CoordinationSignals {
        connectedWallets = connectedWallets == null ? List.of() : List.copyOf(connectedWallets);
        temporalSignals = temporalSignals == null ? List.of() : List.copyOf(temporalSignals);
        sharedCounterpartySignals = sharedCounterpartySignals == null ? List.of() : List.copyOf(sharedCounterpartySignals);
    }

    public static CoordinationSignals empty() {
        return new CoordinationSignals(List.of(), List.of(), List.of());
    }
}
