package com.vidnyan.hint.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.hint.domain.rule.RuleEvaluator;
import com.vidnyan.hint.domain.rule.RuleRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring configuration for the linter components.
 * Wires together the clean architecture components.
 */
@Slf4j
@Configuration
public class HintConfiguration {

    /**
     * ObjectMapper for JSON config files.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * The evaluator beans in their {@code @Order}, which is the order problems are reported in.
     * Logs them on startup.
     */
    @Bean
    public RuleRegistry ruleRegistry(List<RuleEvaluator> evaluators) {
        RuleRegistry registry = new RuleRegistry(evaluators);
        log.info("Registered {} rule evaluators:", registry.evaluators().size());
        registry.evaluators().forEach(e -> log.info("  - {}", e.getName()));
        return registry;
    }
}
