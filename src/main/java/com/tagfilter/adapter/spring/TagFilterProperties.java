package com.tagfilter.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for tag filters.
 */
@ConfigurationProperties(prefix = "tagfilter")
public class TagFilterProperties {

    /**
     * Whether tag filters are enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the filter configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:tagfilter.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }
}
