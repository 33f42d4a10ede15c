package com.vidnyan.rpax.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vidnyan.rpax.RpaxProperties;
import com.vidnyan.rpax.domain.explain.WorkflowExplainer;
import com.vidnyan.rpax.domain.graph.CallGraphBuilder;
import com.vidnyan.rpax.domain.invocation.InvocationResolver;
import com.vidnyan.rpax.domain.pseudocode.PseudocodeGenerator;
import com.vidnyan.rpax.domain.rule.ValidationRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;
import java.util.List;

/**
 * Spring configuration for rpax components.
 * Wires the framework-free domain engine into the application.
 */
@Slf4j
@Configuration
public class RpaxConfiguration {

    /**
     * ObjectMapper for project files and artifacts.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public InvocationResolver invocationResolver(RpaxProperties properties) {
        return new InvocationResolver(
                properties.getInvocation().getDynamicIndicators(),
                properties.getInvocation().getCodedExtensions(),
                Files::isRegularFile);
    }

    @Bean
    public CallGraphBuilder callGraphBuilder() {
        return new CallGraphBuilder();
    }

    @Bean
    public PseudocodeGenerator pseudocodeGenerator() {
        return new PseudocodeGenerator();
    }

    @Bean
    public WorkflowExplainer workflowExplainer() {
        return new WorkflowExplainer();
    }

    /**
     * Log available validation rules on startup.
     */
    @Bean
    public String logValidationRules(List<ValidationRule> rules) {
        log.info("Registered {} validation rules:", rules.size());
        rules.forEach(r -> log.info("  - {} ({})", r.getName(), r.id()));
        return "rules-logged";
    }
}
