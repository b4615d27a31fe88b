package com.perm.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the PERM rules engine.
 */
@ConfigurationProperties(prefix = "perm")
public class PermRulesProperties {

    /**
     * Whether the rules engine beans are created.
     */
    private boolean enabled = true;

    /**
     * Path to the rules configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:perm-rules.yaml";

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
