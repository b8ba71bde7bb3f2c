package com.tagfilter.adapter.spring;

import com.tagfilter.config.ConfigLoader;
import com.tagfilter.config.TagFilterConfig;
import com.tagfilter.engine.ExpressionFilterEngine;
import com.tagfilter.engine.FilterEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for tag filters.
 */
@Configuration
@ConditionalOnProperty(prefix = "tagfilter", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(TagFilterProperties.class)
public class TagFilterAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TagFilterAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public TagFilterConfig tagFilterConfig(TagFilterProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public FilterEngine filterEngine(TagFilterConfig config) {
        log.info("Creating FilterEngine: {}", config.name());
        return new ExpressionFilterEngine(config);
    }
}
