package com.purchasingpower.repoagent.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the standalone {@code @ConfigurationProperties} classes.
 *
 * <ul>
 *   <li>{@link ResilienceConfig} - retry, fallback and connectivity cache settings
 *   <li>{@link ModelConfig} - known, required and fallback model identifiers
 * </ul>
 *
 * {@link com.purchasingpower.repoagent.configuration.AppProperties} is picked up
 * by component scanning.
 */
@Configuration
@EnableConfigurationProperties({
    ResilienceConfig.class,
    ModelConfig.class
})
public class ConfigurationPropertiesEnablerConfig {
}
