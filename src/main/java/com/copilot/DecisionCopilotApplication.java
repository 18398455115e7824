package com.copilot;

import com.copilot.engine.DecisionEngine;
import com.copilot.engine.RunSummary;
import com.copilot.feature.FeatureStore;
import com.copilot.report.ActionReport;
import com.copilot.report.ActionReportBuilder;
import com.copilot.spring.EnableDecisionCopilot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Example Spring Boot application: runs the sample HR rules over the sample features
 * and logs each decision record with its execution report.
 */
@SpringBootApplication
@EnableDecisionCopilot
public class DecisionCopilotApplication {

    private static final Logger log = LoggerFactory.getLogger(DecisionCopilotApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(DecisionCopilotApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(DecisionEngine engine, FeatureStore featureStore,
                                  ActionReportBuilder reportBuilder) {
        return args -> {
            log.info("=== Decision Copilot Demo Started ===");
            ObjectMapper mapper = new ObjectMapper();

            RunSummary summary = engine.run(featureStore, record -> {
                try {
                    ActionReport report = reportBuilder.build(record);
                    log.info("Decision: {}", mapper.writeValueAsString(record));
                    log.info("Report: {}", mapper.writeValueAsString(report));
                } catch (JsonProcessingException e) {
                    throw new IllegalStateException("Failed to serialize record for " + record.subjectId(), e);
                }
            });

            log.info("=== Demo Completed: {} of {} subjects delivered ===",
                    summary.delivered(), summary.subjects());
        };
    }
}
