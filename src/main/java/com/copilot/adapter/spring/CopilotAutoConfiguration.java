package com.copilot.adapter.spring;

import com.copilot.config.ConfigLoader;
import com.copilot.config.CopilotConfig;
import com.copilot.engine.DecisionEngine;
import com.copilot.feature.FeatureStore;
import com.copilot.feature.FeatureVectorFactory;
import com.copilot.report.ActionReportBuilder;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the decision copilot.
 */
@Configuration
@ConditionalOnProperty(prefix = "copilot", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(CopilotProperties.class)
public class CopilotAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CopilotAutoConfiguration.class);

    private DecisionEngine decisionEngine;

    @Bean
    @ConditionalOnMissingBean
    public CopilotConfig copilotConfig(CopilotProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public DecisionEngine decisionEngine(CopilotConfig config) {
        log.info("Creating DecisionEngine: {} v{}", config.name(), config.version());
        this.decisionEngine = DecisionEngine.fromConfig(config);
        return this.decisionEngine;
    }

    @Bean
    @ConditionalOnMissingBean
    public FeatureStore featureStore(CopilotProperties properties) {
        log.info("Loading features from: {}", properties.getFeaturesPath());
        return FeatureVectorFactory.load(properties.getFeaturesPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public ActionReportBuilder actionReportBuilder(DecisionEngine engine) {
        return new ActionReportBuilder(engine.getGraph());
    }

    @PreDestroy
    public void shutdown() {
        if (decisionEngine != null && !decisionEngine.isShutdown()) {
            decisionEngine.shutdown();
        }
    }
}
