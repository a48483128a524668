package com.qml.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the QML parser.
 */
@ConfigurationProperties(prefix = "qml")
public class QmlProperties {

    /**
     * Whether the parser beans are created.
     */
    private boolean enabled = true;

    /**
     * Path to the parser configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:qml-parser.yaml";

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
