package com.copilot.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the decision copilot.
 */
@ConfigurationProperties(prefix = "copilot")
public class CopilotProperties {

    /**
     * Whether the copilot is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the graph and rules configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:copilot.yaml";

    /**
     * Path to the JSON feature file keyed by subject id.
     */
    private String featuresPath = "classpath:sample-features.json";

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

    public String getFeaturesPath() {
        return featuresPath;
    }

    public void setFeaturesPath(String featuresPath) {
        this.featuresPath = featuresPath;
    }
}
