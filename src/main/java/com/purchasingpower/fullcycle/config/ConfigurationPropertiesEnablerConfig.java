package com.purchasingpower.fullcycle.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers all {@code @ConfigurationProperties} classes of the application.
 *
 * <ul>
 *   <li>{@link AppProperties} - project root and CLI switch
 *   <li>{@link PipelineProperties} - retry budgets and policy flags of a run
 *   <li>{@link LlmProperties} - provider selection, keys and rate-limit backoff
 *   <li>{@link GitHubProperties} - API access and repository coordinates
 * </ul>
 */
@Configuration
@EnableConfigurationProperties({
    AppProperties.class,
    PipelineProperties.class,
    LlmProperties.class,
    GitHubProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
}
