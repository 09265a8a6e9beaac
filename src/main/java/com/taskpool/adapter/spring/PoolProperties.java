package com.taskpool.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the task pool.
 */
@ConfigurationProperties(prefix = "taskpool")
public class PoolProperties {

    /**
     * Whether the worker pool bean is created.
     */
    private boolean enabled = true;

    /**
     * Path to the pool configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:taskpool.yaml";

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
