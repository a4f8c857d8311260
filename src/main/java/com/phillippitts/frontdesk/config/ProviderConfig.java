package com.phillippitts.frontdesk.config;

import com.phillippitts.frontdesk.config.properties.OpenAiProperties;
import com.phillippitts.frontdesk.util.LogSanitizer;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

/**
 * External provider clients: the streaming reply model, the embedding model and its in-memory
 * index, and the WebSocket client shared by the speech providers.
 */
@Configuration
public class ProviderConfig {

    private static final Logger LOG = LogManager.getLogger(ProviderConfig.class);

    @Bean
    public StreamingChatModel streamingChatModel(OpenAiProperties props) {
        LOG.info("Reply model: {} (temperature={}, maxTokens={}, key={})",
                props.chatModel(), props.temperature(), props.maxTokens(), LogSanitizer.maskSecret(props.apiKey()));
        return OpenAiStreamingChatModel.builder()
                .apiKey(props.apiKey())
                .modelName(props.chatModel())
                .temperature(props.temperature())
                .maxTokens(props.maxTokens())
                .timeout(props.timeout())
                .build();
    }

    @Bean
    public EmbeddingModel embeddingModel(OpenAiProperties props) {
        return OpenAiEmbeddingModel.builder()
                .apiKey(props.apiKey())
                .modelName(props.embeddingModel())
                .timeout(props.timeout())
                .build();
    }

    /**
     * Read-only after startup indexing; safe for concurrent searches.
     */
    @Bean
    public EmbeddingStore<TextSegment> embeddingStore() {
        return new InMemoryEmbeddingStore<>();
    }

    @Bean(name = "providerWebSocketClient")
    public WebSocketClient providerWebSocketClient() {
        return new StandardWebSocketClient();
    }
}
