package com.qml.adapter.spring;

import com.qml.config.ConfigLoader;
import com.qml.config.ParserConfig;
import com.qml.core.FormulaParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the QML parser.
 */
@Configuration
@ConditionalOnProperty(prefix = "qml", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(QmlProperties.class)
public class QmlAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(QmlAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public ParserConfig parserConfig(QmlProperties properties) {
        log.info("Loading parser configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public FormulaParser formulaParser(ParserConfig config) {
        return new FormulaParser(config);
    }
}
