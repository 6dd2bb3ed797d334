package com.audiencemanager.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for segment materialization under the {@code materialization} prefix.
 *
 * <p>Controls the scheduler and the executor:
 * <ul>
 *   <li>{@code schedulerEnabled} -- master toggle; when off, rules are stored but never run</li>
 *   <li>{@code retryDelay} -- earliest re-attempt after a failed run</li>
 *   <li>{@code refreshStaleDependencies} -- materialize missing or stale dependencies before
 *       combining them into a composite segment</li>
 * </ul>
 *
 * <p>The retry policy of the catalog update after a table write is the Resilience4j
 * instance {@code catalogUpdate}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "materialization")
public class MaterializationConfig {

    private boolean schedulerEnabled = true;
    private Duration retryDelay = Duration.ofMinutes(5);
    private boolean refreshStaleDependencies = true;
}
