package com.purchasingpower.repoagent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Retry and connectivity-cache settings for completion calls.
 *
 * <p>Properties are loaded from the {@code app.resilience} namespace:
 * <pre>
 * app:
 *   resilience:
 *     max-attempts: 2
 *     retry-delay: 1s
 *     connectivity-ttl: 60s
 * </pre>
 *
 * <p>The preferred model gets {@code maxAttempts} attempts with a fixed
 * {@code retryDelay} between them; each fallback model then gets exactly one.
 */
@ConfigurationProperties(prefix = "app.resilience")
@Data
public class ResilienceConfig {

    /**
     * Attempts on the preferred model before falling back. Minimum 1.
     */
    private int maxAttempts = 2;

    /**
     * Fixed delay between attempts on the preferred model.
     */
    private Duration retryDelay = Duration.ofSeconds(1);

    /**
     * How long a connectivity result stays authoritative.
     */
    private Duration connectivityTtl = Duration.ofSeconds(60);
}
