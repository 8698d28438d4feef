package com.entityradar.fingerprint.signature;

import com.entityradar.common.ChainValues;
import com.entityradar.domain.Classification;
import com.entityradar.domain.FeatureSummary;
import com.entityradar.domain.TransactionRecord;

import java.util.List;

/**
 * Everything a signature may look at. Address is normalized; nulls become canonical defaults.
 */
public record SignatureInput(FeatureSummary features, Classification classification, List<TransactionRecord> txs,
                             String address) {

    public SignatureInput {
        features = features == null ? FeatureSummary.empty() : features;
        classification = classification == null ? Classification.unknown() : classification;
        txs = txs == null ? List.of() : txs;
        address = ChainValues.normalizeAddress(address);
    }

    /** True when the transaction was sent or received by this address. */
    boolean involvesSelf(TransactionRecord tx) {
        return tx != null && (ChainValues.normalizeAddress(tx.from()).equals(address)
                || ChainValues.normalizeAddress(tx.to()).equals(address));
    }
}
