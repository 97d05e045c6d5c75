package org.cloudvision.chartpatterns.config;

import org.cloudvision.chartpatterns.geometry.ExtremaFinder;
import org.cloudvision.chartpatterns.scoring.ConfidencePolicy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Spring wiring for the pattern engine. Host applications pull it in with
 * {@code @Import(PatternEngineConfig.class)}; a host-supplied
 * {@link ConfidencePolicy} bean replaces the default scoring. No policy bean
 * is registered here; the validators fall back to the default scoring when the
 * host defines none.
 */
@Configuration("patternEngineConfig")
@ComponentScan("org.cloudvision.chartpatterns")
@EnableConfigurationProperties(PatternDetectionProperties.class)
public class PatternEngineConfig {

    @Bean
    public ExtremaFinder extremaFinder(PatternDetectionProperties properties) {
        return new ExtremaFinder(properties.validatedExtremaRadius());
    }
}
