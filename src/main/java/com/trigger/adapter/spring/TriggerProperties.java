package com.trigger.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the trigger engine.
 */
@ConfigurationProperties(prefix = "trigger")
public class TriggerProperties {

    /**
     * Whether the engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the engine configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:trigger.yaml";

    /**
     * Whether the rule manager is started as soon as it is created.
     */
    private boolean autoStart = true;

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

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }
}
