package com.entityradar.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Binds the known-address sets and fingerprint settings.
 */
@Configuration
@EnableConfigurationProperties({ KnownAddressProperties.class, FingerprintProperties.class })
public class EntityRadarConfig {
}
