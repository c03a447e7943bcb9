package com.flamingo.ai.doctranslator.service.translation;

import com.flamingo.ai.doctranslator.exception.DocumentTranslationException;
import com.flamingo.ai.doctranslator.exception.ErrorCode;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.List;
import lombok.RequiredArgsConstructor;

/** {@link TextTranslator} backed by a LangChain4j {@link ChatModel}. */
@RequiredArgsConstructor
public class LangChain4jTextTranslator implements TextTranslator {

  private final ChatModel chatModel;

  @Override
  public String generate(String systemPrompt, String userPrompt) {
    try {
      ChatResponse response =
          chatModel.chat(List.of(SystemMessage.from(systemPrompt), UserMessage.from(userPrompt)));
      if (response == null || response.aiMessage() == null) {
        return "";
      }
      String text = response.aiMessage().text();
      return text == null ? "" : text;
    } catch (AuthenticationException e) {
      throw new DocumentTranslationException(
          ErrorCode.CONFIG_ERROR, "Translation model rejected the API key: " + e.getMessage(), e);
    }
  }
}
