package com.example.chronology.infrastructure.llm;

import com.example.chronology.infrastructure.config.ChronologyProperties;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

/**
 * Configuration for the secondary extractor's LangChain4j model and agent. Only active when
 * {@code chronology.llm.enabled=true}.
 */
@Configuration
@ConditionalOnProperty(prefix = "chronology.llm", name = "enabled", havingValue = "true")
public class LangChain4jConfig {

    static final String GEMINI = "gemini";
    static final String OPENAI = "openai";

    @Bean
    public ChatModel chronologyChatModel(ChronologyProperties properties) {
        ChronologyProperties.Llm llm = properties.llm();
        validateApiKey(llm);

        String provider = llm.provider() == null ? "" : llm.provider().trim().toLowerCase(Locale.ROOT);
        return switch (provider) {
            case GEMINI -> GoogleAiGeminiChatModel.builder()
                    .apiKey(llm.apiKey())
                    .modelName(llm.model())
                    .temperature(llm.temperature())
                    .timeout(llm.timeout())
                    .responseFormat(ResponseFormat.JSON)
                    .build();
            case OPENAI -> OpenAiChatModel.builder()
                    .apiKey(llm.apiKey())
                    .modelName(llm.model())
                    .temperature(llm.temperature())
                    .timeout(llm.timeout())
                    .responseFormat("json_object")
                    .logRequests(false)
                    .logResponses(false)
                    .build();
            default -> throw new IllegalStateException(
                    "Unsupported LLM provider '" + llm.provider() + "'. Use 'gemini' or 'openai'.");
        };
    }

    /** Extraction agent backed by the JSON-mode chat model. */
    @Bean
    public ChronologyExtractionAgent chronologyExtractionAgent(ChatModel chronologyChatModel) {
        return AiServices.builder(ChronologyExtractionAgent.class).chatModel(chronologyChatModel).build();
    }

    @Bean
    public LangChain4jSecondaryExtractor secondaryExtractor(ChronologyExtractionAgent chronologyExtractionAgent) {
        return new LangChain4jSecondaryExtractor(chronologyExtractionAgent);
    }

    private void validateApiKey(ChronologyProperties.Llm llm) {
        if (llm.apiKey() == null || llm.apiKey().isBlank()) {
            throw new IllegalStateException(
                    "An LLM API key is required when chronology.llm.enabled=true. Set chronology.llm.api-key.");
        }
    }
}
