package com.example.chronology.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Immutable settings bound from {@code chronology.*} in application.yml.
 * Built once at startup and injected wherever a threshold or switch is needed.
 *
 * @param rulesLocation       Spring resource location of the rule YAML
 * @param ocrEnabled          whether scanned PDF pages are sent to the OCR engine
 * @param confidenceThreshold rows scoring below this are escalated
 * @param llm                 secondary extractor settings
 * @param batch               optional batch-mode input and output paths
 */
@ConfigurationProperties(prefix = "chronology")
public record ChronologyProperties(
        @DefaultValue("classpath:rules.yaml") String rulesLocation,
        @DefaultValue("false") boolean ocrEnabled,
        @DefaultValue("0.6") double confidenceThreshold,
        @DefaultValue Llm llm,
        @DefaultValue Batch batch
) {

    /**
     * Secondary extractor settings.
     *
     * @param enabled            turns escalation on
     * @param provider           {@code gemini} or {@code openai}
     * @param model              model name passed to the provider
     * @param apiKey             provider API key
     * @param maxConcurrentCalls upper bound on in-flight calls
     * @param maxChunkChars      chunk text is truncated to this many characters
     * @param timeout            per-call request timeout enforced by the model client
     * @param temperature        sampling temperature
     */
    public record Llm(
            @DefaultValue("false") boolean enabled,
            @DefaultValue("gemini") String provider,
            @DefaultValue("gemini-1.5-flash") String model,
            @DefaultValue("") String apiKey,
            @DefaultValue("4") int maxConcurrentCalls,
            @DefaultValue("6000") int maxChunkChars,
            @DefaultValue("60s") Duration timeout,
            @DefaultValue("0.0") double temperature
    ) {
    }

    /**
     * Batch mode paths. When {@code input} is blank the batch runner stays idle.
     */
    public record Batch(
            @DefaultValue("") String input,
            @DefaultValue("") String output
    ) {
    }
}
