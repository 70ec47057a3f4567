package com.example.chronology.infrastructure.llm;

import com.example.chronology.infrastructure.config.ChronologyProperties;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for provider selection and key validation. No model is called.
 */
class LangChain4jConfigTest {

    private final LangChain4jConfig config = new LangChain4jConfig();

    @Test
    void openAiProviderBuildsOpenAiModel() {
        ChatModel model = config.chronologyChatModel(properties("OpenAI", "sk-test"));

        assertThat(model).isInstanceOf(OpenAiChatModel.class);
    }

    @Test
    void missingApiKeyIsFatal() {
        assertThatThrownBy(() -> config.chronologyChatModel(properties("gemini", " ")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("api-key");
    }

    @Test
    void unknownProviderIsFatal() {
        assertThatThrownBy(() -> config.chronologyChatModel(properties("mistral", "key")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("mistral");
    }

    private ChronologyProperties properties(String provider, String apiKey) {
        ChronologyProperties.Llm llm = new ChronologyProperties.Llm(true, provider, "gpt-4o-mini", apiKey, 4, 6000,
                Duration.ofSeconds(60), 0.0);
        return new ChronologyProperties("classpath:rules.yaml", false, 0.6, llm,
                new ChronologyProperties.Batch("", ""));
    }
}
