package com.flamingo.ai.doctranslator.service.extraction;

import com.flamingo.ai.doctranslator.exception.DocumentTranslationException;
import com.flamingo.ai.doctranslator.exception.ErrorCode;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.Base64;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** {@link VisionExtractor} backed by a LangChain4j {@link ChatModel}. */
@RequiredArgsConstructor
@Slf4j
public class LangChain4jVisionExtractor implements VisionExtractor {

  private final ChatModel chatModel;
  private final String imageMimeType;

  @Override
  public String generate(byte[] imageBytes, String instruction) {
    String base64Image = Base64.getEncoder().encodeToString(imageBytes);
    UserMessage message =
        UserMessage.from(
            TextContent.from(instruction), ImageContent.from(base64Image, imageMimeType));

    log.debug("Sending {} byte {} image to vision model", imageBytes.length, imageMimeType);
    try {
      ChatResponse response = chatModel.chat(List.of(message));
      if (response == null || response.aiMessage() == null) {
        return "";
      }
      String text = response.aiMessage().text();
      return text == null ? "" : text;
    } catch (AuthenticationException e) {
      throw new DocumentTranslationException(
          ErrorCode.CONFIG_ERROR, "Vision model rejected the API key: " + e.getMessage(), e);
    }
  }
}
