package com.flamingo.ai.resumescreening.service.synthesis;

import com.flamingo.ai.resumescreening.exception.OracleException;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;

/** {@link TextGenerationOracle} backed by a LangChain4j {@link ChatModel}, which may be absent. */
@Slf4j
public class ChatModelTextGenerationOracle implements TextGenerationOracle {

  private final ChatModel chatModel;
  private final String provider;

  public ChatModelTextGenerationOracle(ChatModel chatModel, String provider) {
    this.chatModel = chatModel;
    this.provider = provider;
  }

  @Override
  public String generate(String prompt, GenerationOptions options) {
    if (chatModel == null) {
      throw new OracleException("No text-generation model configured (" + provider + ")", true);
    }
    ChatRequest request =
        ChatRequest.builder()
            .messages(UserMessage.from(prompt))
            .temperature(options.temperature())
            .maxOutputTokens(options.maxOutputTokens())
            .build();
    try {
      ChatResponse response = chatModel.chat(request);
      String text = response.aiMessage() == null ? null : response.aiMessage().text();
      if (text == null) {
        throw new OracleException("Provider " + provider + " returned no text", false);
      }
      log.debug("Oracle {} returned {} chars", provider, text.length());
      return text;
    } catch (OracleException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new OracleException("Generation failed on provider " + provider, e);
    }
  }

  @Override
  public boolean isAvailable() {
    return chatModel != null;
  }

  public String getProvider() {
    return provider;
  }
}
