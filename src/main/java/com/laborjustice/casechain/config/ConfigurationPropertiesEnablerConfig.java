package com.laborjustice.casechain.config;

import com.laborjustice.casechain.configuration.ReconciliationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the {@code @ConfigurationProperties} classes of the engine.
 *
 * <p>Enabled configuration classes:
 * <ul>
 *   <li>{@link ReconciliationProperties} - code tables, thresholds and keyword lists
 * </ul>
 *
 * @since 1.0.0
 */
@Configuration
@EnableConfigurationProperties({
    ReconciliationProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
}
