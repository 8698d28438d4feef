package com.entityradar.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Fingerprint overlay and store settings. See application.yml entityradar.fingerprint.
 */
@ConfigurationProperties(prefix = "entityradar.fingerprint")
@NoArgsConstructor
@Getter
@Setter
public class FingerprintProperties {

    /** When false the overlay is skipped and reports carry an Unknown fingerprint. Default true. */
    private boolean enabled = true;

    /** Persist labelled fingerprints to the store. Default true. */
    private boolean recordToStore = true;

    /** Store backend: memory (Caffeine) or mongo. Default memory. */
    private String store = "memory";

    /** Minimum fingerprint confidence to persist. Default 0.35. */
    private double minConfidenceToRecord = 0.35;

    /** Newest entries kept per address. Default 5. */
    private int maxEntriesPerAddress = 5;

    /** Global entry cap across all addresses. Default 50 000. */
    private long maxTotalEntries = 50_000;

    public void validate() {
        if (maxEntriesPerAddress <= 0) {
            throw new IllegalArgumentException("entityradar.fingerprint.max-entries-per-address must be positive");
        }
        if (maxTotalEntries <= 0) {
            throw new IllegalArgumentException("entityradar.fingerprint.max-total-entries must be positive");
        }
    }
}
