package com.entityradar.fingerprint.signature;

import com.entityradar.domain.FingerprintType;

/**
 * Scores how well an address matches one fingerprint archetype. Implementations are stateless and ordered
 * with {@link org.springframework.core.annotation.Order} in archetype order.
 */
public interface SignatureScorer {

    FingerprintType type();

    SignatureScore score(SignatureInput input);
}
