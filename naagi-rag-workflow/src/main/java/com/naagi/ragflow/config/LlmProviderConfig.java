package com.naagi.ragflow.config;

import com.naagi.ragflow.http.Http;
import com.naagi.ragflow.llm.ChatClient;
import com.naagi.ragflow.llm.LlmAnswerGenerator;
import com.naagi.ragflow.llm.LlmCategoryRouter;
import com.naagi.ragflow.llm.LlmRelevanceScorer;
import com.naagi.ragflow.llm.openai.OpenAIChatClient;
import com.naagi.ragflow.llm.openai.OpenAIEmbeddingsClient;
import com.naagi.ragflow.qdrant.QdrantClient;
import com.naagi.ragflow.tools.AnswerGenerator;
import com.naagi.ragflow.tools.CategoryRouter;
import com.naagi.ragflow.tools.EmbeddingService;
import com.naagi.ragflow.tools.RelevanceScorer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;

/**
 * Default adapters for the workflow's external collaborators. Any of them can be replaced by
 * declaring a bean of the same interface.
 */
@Configuration
public class LlmProviderConfig {

    @Bean
    @ConditionalOnMissingBean
    public HttpClient workflowHttpClient(WorkflowProperties properties) {
        return Http.newClient(properties.getHttp().getConnectTimeout());
    }

    // OpenAI-compatible API: llama.cpp, Ollama, vLLM or OpenAI itself
    @Bean
    @ConditionalOnProperty(name = "naagi.workflow.llm.provider", havingValue = "openai", matchIfMissing = true)
    @ConditionalOnMissingBean
    public ChatClient chatClient(
            @Value("${naagi.workflow.llm.base-url}") String baseUrl,
            @Value("${naagi.workflow.llm.chat-model}") String model,
            @Value("${naagi.workflow.llm.api-key:}") String apiKey,
            HttpClient workflowHttpClient,
            WorkflowProperties properties
    ) {
        return new OpenAIChatClient(baseUrl, model, apiKey, workflowHttpClient, properties.getHttp().getRequestTimeout());
    }

    @Bean
    @ConditionalOnProperty(name = "naagi.workflow.llm.provider", havingValue = "openai", matchIfMissing = true)
    @ConditionalOnMissingBean
    public EmbeddingService embeddingService(
            @Value("${naagi.workflow.llm.base-url}") String baseUrl,
            @Value("${naagi.workflow.llm.embed-model}") String model,
            @Value("${naagi.workflow.llm.api-key:}") String apiKey,
            HttpClient workflowHttpClient,
            WorkflowProperties properties
    ) {
        return new OpenAIEmbeddingsClient(baseUrl, model, apiKey, workflowHttpClient, properties.getHttp().getRequestTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public CategoryRouter categoryRouter(ChatClient chatClient) {
        return new LlmCategoryRouter(chatClient);
    }

    @Bean
    @ConditionalOnMissingBean
    public AnswerGenerator answerGenerator(
            ChatClient chatClient,
            @Value("${naagi.workflow.llm.temperature:0.2}") double temperature,
            @Value("${naagi.workflow.llm.max-tokens:800}") int maxTokens
    ) {
        return new LlmAnswerGenerator(chatClient, temperature, maxTokens);
    }

    @Bean
    @ConditionalOnMissingBean
    public RelevanceScorer relevanceScorer(ChatClient chatClient) {
        return new LlmRelevanceScorer(chatClient);
    }

    @Bean
    @ConditionalOnMissingBean
    public QdrantClient qdrantClient(
            @Value("${naagi.workflow.qdrant.base-url}") String baseUrl,
            @Value("${naagi.workflow.qdrant.collection}") String collection,
            HttpClient workflowHttpClient,
            WorkflowProperties properties
    ) {
        return new QdrantClient(baseUrl, collection, workflowHttpClient, properties.getHttp().getRequestTimeout());
    }
}
