package com.example.chronology.infrastructure.config;

import com.example.chronology.domain.model.RuleSet;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/** Compiles the rule file once at startup and exposes it as a bean. */
@Configuration
public class RuleSetConfig {

    @Bean
    public RuleSet ruleSet(ChronologyProperties properties, ResourceLoader resourceLoader) {
        return new YamlRuleSetLoader().load(resourceLoader.getResource(properties.rulesLocation()));
    }
}
