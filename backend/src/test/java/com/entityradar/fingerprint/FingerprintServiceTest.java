package com.entityradar.fingerprint;

import com.entityradar.config.FingerprintProperties;
import com.entityradar.domain.EntityFingerprint;
import com.entityradar.domain.FingerprintType;
import com.entityradar.domain.StoredFingerprint;
import com.entityradar.fingerprint.store.FingerprintStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.entityradar.domain.TestTransactions.SELF;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class FingerprintServiceTest {

    private static final String MIXED_CASE = "0xABCDEF0000000000000000000000000000000001";

    @Mock
    FingerprintScorer scorer;
    @Mock
    FingerprintStore store;

    private FingerprintProperties properties;
    private FingerprintService service;

    @BeforeEach
    void setUp() {
        properties = new FingerprintProperties();
        service = new FingerprintService(scorer, store, properties);
    }

    private void scorerReturns(FingerprintType type, double confidence) {
        EntityFingerprint fingerprint = new EntityFingerprint(type, confidence, List.of("sweep_pattern"),
                Map.of("exchange_confidence_score", confidence), "0123456789abcdef", 0, List.of());
        when(scorer.score(any(), any(), any(), any(), any(), any())).thenReturn(fingerprint);
    }

    @Test
    @DisplayName("labelled confident fingerprint is appended under the lowercase address")
    void labelled_isRecorded() {
        scorerReturns(FingerprintType.CENTRALIZED_EXCHANGE, 0.8);

        EntityFingerprint result = service.fingerprint(null, null, null, List.of(), MIXED_CASE, null);

        ArgumentCaptor<StoredFingerprint> captor = ArgumentCaptor.forClass(StoredFingerprint.class);
        verify(store).append(captor.capture());
        StoredFingerprint stored = captor.getValue();
        assertThat(stored.address()).isEqualTo(MIXED_CASE.toLowerCase());
        assertThat(stored.entityType()).isEqualTo(FingerprintType.CENTRALIZED_EXCHANGE);
        assertThat(stored.confidenceScore()).isEqualTo(0.8);
        assertThat(stored.entityClusterId()).isEqualTo("0123456789abcdef");
        assertThat(stored.recordedAt()).isNotNull();
        assertThat(result.entityType()).isEqualTo(FingerprintType.CENTRALIZED_EXCHANGE);
    }

    @Test
    @DisplayName("Unknown fingerprints are not recorded")
    void unknown_notRecorded() {
        scorerReturns(FingerprintType.UNKNOWN, 0.0);

        service.fingerprint(null, null, null, List.of(), SELF, null);

        verify(store, never()).append(any());
    }

    @Test
    @DisplayName("confidence below the record threshold is not recorded")
    void lowConfidence_notRecorded() {
        scorerReturns(FingerprintType.BRIDGE, 0.34);

        service.fingerprint(null, null, null, List.of(), SELF, null);

        verify(store, never()).append(any());
    }

    @Test
    @DisplayName("disabled overlay returns Unknown without scoring")
    void disabled_skipsEverything() {
        properties.setEnabled(false);

        EntityFingerprint result = service.fingerprint(null, null, null, List.of(), SELF, null);

        assertThat(result).isEqualTo(EntityFingerprint.unknown());
        verifyNoInteractions(scorer, store);
    }

    @Test
    @DisplayName("recording can be switched off while scoring stays on")
    void recordingOff() {
        properties.setRecordToStore(false);
        scorerReturns(FingerprintType.CENTRALIZED_EXCHANGE, 0.9);

        EntityFingerprint result = service.fingerprint(null, null, null, List.of(), SELF, null);

        assertThat(result.isLabelled()).isTrue();
        verify(store, never()).append(any());
    }

    @Test
    @DisplayName("a failing store does not affect the returned fingerprint")
    void storeFailure_isSwallowed() {
        scorerReturns(FingerprintType.CENTRALIZED_EXCHANGE, 0.8);
        doThrow(new IllegalStateException("store down")).when(store).append(any());

        EntityFingerprint result = service.fingerprint(null, null, null, List.of(), SELF, null);

        assertThat(result.entityType()).isEqualTo(FingerprintType.CENTRALIZED_EXCHANGE);
        assertThat(result.confidenceScore()).isEqualTo(0.8);
    }

    @Test
    @DisplayName("stored history falls back to empty when the store fails")
    void storedFingerprints_storeFailure() {
        when(store.findByAddress(SELF)).thenThrow(new IllegalStateException("store down"));

        assertThat(service.storedFingerprints(SELF)).isEmpty();
    }

    @Test
    @DisplayName("stored history is passed through from the store")
    void storedFingerprints_passThrough() {
        StoredFingerprint entry = new StoredFingerprint(SELF, FingerprintType.FUND_WHALE, 0.6, List.of(), null,
                Map.of(), Instant.parse("2024-01-01T00:00:00Z"));
        when(store.findByAddress(SELF)).thenReturn(List.of(entry));

        assertThat(service.storedFingerprints(SELF)).containsExactly(entry);
    }
}
