package com.example.chronology;

import com.example.chronology.domain.model.RuleSet;
import com.example.chronology.infrastructure.config.ChronologyProperties;
import com.example.chronology.infrastructure.config.YamlRuleSetLoader;
import org.springframework.core.io.ClassPathResource;

import java.time.Duration;

/**
 * Shared builders for the bundled rule set and for settings objects used across unit tests.
 */
public final class TestFixtures {

    private TestFixtures() {
    }

    /**
     * @return the rule set shipped in {@code rules.yaml}
     */
    public static RuleSet defaultRules() {
        return new YamlRuleSetLoader().load(new ClassPathResource("rules.yaml"));
    }

    public static ChronologyProperties.Llm llmSettings(boolean enabled, int maxChunkChars) {
        return new ChronologyProperties.Llm(enabled, "gemini", "gemini-1.5-flash", "test-key", 2, maxChunkChars,
                Duration.ofSeconds(60), 0.0);
    }

    public static ChronologyProperties properties(boolean llmEnabled) {
        return new ChronologyProperties("classpath:rules.yaml", false, 0.6,
                llmSettings(llmEnabled, 6000), new ChronologyProperties.Batch("", ""));
    }
}
