package com.tdnet.insight.config;

import com.google.cloud.vertexai.VertexAI;
import com.google.cloud.vertexai.api.GenerationConfig;
import com.google.cloud.vertexai.generativeai.GenerativeModel;
import com.tdnet.insight.summarize.GeminiSummarizationClient;
import com.tdnet.insight.summarize.PromptTemplates;
import com.tdnet.insight.summarize.RetryingSummarizer;
import com.tdnet.insight.summarize.SummarizationClient;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.vertexai.VertexAiGeminiChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LlmConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(LlmConfig.class);
    private static final int CHAT_MODEL_RETRIES = 0;

    @Bean(destroyMethod = "close")
    VertexAI vertexAi(InsightProperties properties) {
        InsightProperties.Llm llm = properties.getLlm();
        LOGGER.info("Using Vertex AI project {} in {}", llm.getProject(), llm.getLocation());
        return new VertexAI(llm.getProject(), llm.getLocation());
    }

    @Bean
    ChatModel geminiChatModel(VertexAI vertexAi, InsightProperties properties) {
        InsightProperties.Llm llm = properties.getLlm();
        GenerationConfig.Builder config = GenerationConfig.newBuilder();
        if (llm.getTemperature() != null) {
            config.setTemperature(llm.getTemperature());
        }
        if (llm.getMaxOutputTokens() != null) {
            config.setMaxOutputTokens(llm.getMaxOutputTokens());
        }
        GenerationConfig generationConfig = config.build();

        @SuppressWarnings("deprecation")
        GenerativeModel generativeModel = new GenerativeModel(llm.getModel(), vertexAi);
        LOGGER.info("Summaries use model {}", llm.getModel());
        return chatModel(generativeModel, generationConfig);
    }

    /**
     * Wraps the Vertex AI model with LangChain4j's own retries switched off; {@link RetryingSummarizer} is the
     * only retry policy.
     */
    static ChatModel chatModel(GenerativeModel generativeModel, GenerationConfig generationConfig) {
        return new VertexAiGeminiChatModel(generativeModel, generationConfig, CHAT_MODEL_RETRIES);
    }

    @Bean
    SummarizationClient summarizationClient(ChatModel chatModel) {
        return new GeminiSummarizationClient(chatModel);
    }

    @Bean
    RetryingSummarizer retryingSummarizer(SummarizationClient client, InsightProperties properties) {
        InsightProperties.Retry retry = properties.getRetry();
        return new RetryingSummarizer(client, retry.getMaxAttempts(), retry.getInitialBackoff());
    }

    @Bean
    PromptTemplates promptTemplates() {
        return new PromptTemplates();
    }
}
