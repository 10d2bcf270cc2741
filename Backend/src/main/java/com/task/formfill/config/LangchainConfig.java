package com.task.formfill.config;

import com.theokanning.openai.service.OpenAiService;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class LangchainConfig {

    @Value("${openai.api-key:}")
    private String apiKey;

    @Value("${openai.model:gpt-4o}")
    private String modelName;

    @Value("${openai.temperature:0.1}")
    private double temperature;

    @Value("${openai.timeout-seconds:120}")
    private long timeoutSeconds;

    @Bean
    @ConditionalOnProperty(name = "formfill.classification.provider", havingValue = "openai")
    public OpenAiService openAiService() {
        return new OpenAiService(requireApiKey(), Duration.ofSeconds(timeoutSeconds));
    }

    @Bean
    @ConditionalOnProperty(name = "formfill.classification.provider", havingValue = "langchain", matchIfMissing = true)
    public ChatModel chatLanguageModel() {
        return OpenAiChatModel.builder()
                .apiKey(requireApiKey())
                .modelName(modelName)
                .temperature(temperature)
                .maxTokens(3000)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .build();
    }

    private String requireApiKey() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("openai.api-key (OPENAI_API_KEY) must be set and non-empty");
        }
        return apiKey;
    }
}
