package com.entityradar.fingerprint.store;

import com.entityradar.domain.StoredFingerprint;

import java.util.List;

/**
 * Append-only, bounded fingerprint history. Writes for one address are serialized; reads take no lock.
 * Implementations keep at most a configured number of newest entries per address and a global entry cap.
 */
public interface FingerprintStore {

    /** Appends an entry for {@code entry.address()} and enforces retention. */
    void append(StoredFingerprint entry);

    /** Entries for the address, newest first. Empty when none. */
    List<StoredFingerprint> findByAddress(String address);

    long totalEntries();
}
