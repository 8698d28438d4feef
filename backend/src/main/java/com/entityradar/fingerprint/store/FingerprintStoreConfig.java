package com.entityradar.fingerprint.store;

import com.entityradar.config.FingerprintProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Selects the fingerprint store backend: Caffeine in memory (default) or MongoDB when
 * entityradar.fingerprint.store=mongo.
 */
@Configuration
public class FingerprintStoreConfig {

    @Bean
    @ConditionalOnProperty(prefix = "entityradar.fingerprint", name = "store", havingValue = "memory",
            matchIfMissing = true)
    public FingerprintStore inMemoryFingerprintStore(FingerprintProperties properties) {
        return new InMemoryFingerprintStore(properties);
    }

    @Bean
    @ConditionalOnProperty(prefix = "entityradar.fingerprint", name = "store", havingValue = "mongo")
    public FingerprintStore mongoFingerprintStore(MongoTemplate mongoTemplate, FingerprintProperties properties) {
        return new MongoFingerprintStore(mongoTemplate, properties);
    }
}
