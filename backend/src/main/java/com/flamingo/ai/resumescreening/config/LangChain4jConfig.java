package com.flamingo.ai.resumescreening.config;

import com.flamingo.ai.resumescreening.exception.ScreeningConfigurationException;
import com.flamingo.ai.resumescreening.service.synthesis.ChatModelTextGenerationOracle;
import com.flamingo.ai.resumescreening.service.synthesis.TextGenerationOracle;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2q.AllMiniLmL6V2QuantizedEmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for LangChain4j models.
 *
 * <p>The embedding model defaults to the in-process all-MiniLM-L6-v2 (quantized), so ingestion
 * works without any API key. The chat model is optional: when the provider is {@code none} or its
 * credentials are missing, the oracle reports itself unavailable and every report comes from the
 * deterministic fallback.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class LangChain4jConfig {

  private final ScreeningConfig screeningConfig;

  @Bean
  public EmbeddingModel embeddingModel() {
    ScreeningConfig.Embedding embedding = screeningConfig.getEmbedding();
    String provider = embedding.getProvider().toLowerCase(Locale.ROOT);
    return switch (provider) {
      case "local" -> {
        log.info("Embedding model: all-MiniLM-L6-v2 quantized (in-process)");
        yield new AllMiniLmL6V2QuantizedEmbeddingModel();
      }
      case "openai" -> {
        if (embedding.getApiKey() == null || embedding.getApiKey().isBlank()) {
          throw new ScreeningConfigurationException(
              "OpenAI embedding provider requires an API key. Set OPENAI_API_KEY.");
        }
        log.info("Embedding model: OpenAI {}", embedding.getModelName());
        yield OpenAiEmbeddingModel.builder()
            .apiKey(embedding.getApiKey())
            .modelName(embedding.getModelName())
            .dimensions(screeningConfig.getVectorIndex().getDimensions())
            .timeout(Duration.ofSeconds(30))
            .build();
      }
      default ->
          throw new ScreeningConfigurationException(
              "Unknown embedding provider: " + embedding.getProvider());
    };
  }

  @Bean
  public TextGenerationOracle textGenerationOracle() {
    ScreeningConfig.Llm llm = screeningConfig.getLlm();
    String provider = llm.getProvider().toLowerCase(Locale.ROOT);
    ChatModel chatModel = createChatModel(provider, llm);
    if (chatModel == null) {
      log.warn(
          "No text-generation oracle configured (provider={}); reports will use the fallback",
          provider);
    } else {
      log.info("Text-generation oracle: {} / {}", provider, llm.getModelName());
    }
    return new ChatModelTextGenerationOracle(chatModel, provider);
  }

  private ChatModel createChatModel(String provider, ScreeningConfig.Llm llm) {
    return switch (provider) {
      case "none" -> null;
      case "openai" ->
          hasCredentials(provider, llm)
              ? OpenAiChatModel.builder()
                  .apiKey(llm.getApiKey())
                  .modelName(llm.getModelName())
                  .timeout(llm.getTimeout())
                  .logRequests(false)
                  .logResponses(false)
                  .build()
              : null;
      case "gemini" ->
          hasCredentials(provider, llm)
              ? GoogleAiGeminiChatModel.builder()
                  .apiKey(llm.getApiKey())
                  .modelName(llm.getModelName())
                  .timeout(llm.getTimeout())
                  .build()
              : null;
      case "ollama" ->
          OllamaChatModel.builder()
              .baseUrl(llm.getBaseUrl())
              .modelName(llm.getModelName())
              .timeout(llm.getTimeout())
              .build();
      default -> throw new ScreeningConfigurationException("Unknown LLM provider: " + provider);
    };
  }

  private boolean hasCredentials(String provider, ScreeningConfig.Llm llm) {
    if (llm.getApiKey() != null && !llm.getApiKey().isBlank()) {
      return true;
    }
    if (llm.isRequireCredentials()) {
      throw new ScreeningConfigurationException(
          "API key for LLM provider '" + provider + "' is required but not set.");
    }
    log.warn("API key for LLM provider '{}' is not set", provider);
    return false;
  }
}
