package com.flamingo.ai.doctranslator.config;

import com.flamingo.ai.doctranslator.exception.DocumentTranslationException;
import com.flamingo.ai.doctranslator.exception.ErrorCode;
import com.flamingo.ai.doctranslator.service.extraction.LangChain4jVisionExtractor;
import com.flamingo.ai.doctranslator.service.extraction.VisionExtractor;
import com.flamingo.ai.doctranslator.service.translation.LangChain4jTextTranslator;
import com.flamingo.ai.doctranslator.service.translation.TextTranslator;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the LangChain4j vision and text models. */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class LangChain4jConfig {

  private final TranslationConfig translationConfig;

  @Bean
  public VisionExtractor visionExtractor() {
    TranslationConfig.Model settings = translationConfig.getModels().getVision();
    if (!settings.hasApiKey()) {
      log.warn(
          "No API key configured for vision model '{}'; page extraction will fail until one is"
              + " set",
          settings.getModelName());
      return (imageBytes, instruction) -> {
        throw notConfigured("Vision");
      };
    }
    return new LangChain4jVisionExtractor(
        buildChatModel(settings), translationConfig.getExtraction().getImageMimeType());
  }

  @Bean
  public TextTranslator textTranslator() {
    TranslationConfig.Model settings = translationConfig.getModels().getText();
    if (!settings.hasApiKey()) {
      log.warn(
          "No API key configured for text model '{}'; chunk translation will fail until one is"
              + " set",
          settings.getModelName());
      return (systemPrompt, userPrompt) -> {
        throw notConfigured("Translation");
      };
    }
    return new LangChain4jTextTranslator(buildChatModel(settings));
  }

  ChatModel buildChatModel(TranslationConfig.Model settings) {
    String provider =
        settings.getProvider() == null ? "" : settings.getProvider().toLowerCase(Locale.ROOT);
    log.info("Creating {} chat model '{}'", provider, settings.getModelName());
    return switch (provider) {
      case "openai" -> {
        OpenAiChatModel.OpenAiChatModelBuilder builder =
            OpenAiChatModel.builder()
                .apiKey(settings.getApiKey())
                .modelName(settings.getModelName())
                .temperature(settings.getTemperature())
                .maxCompletionTokens(settings.getMaxTokens())
                .timeout(settings.getTimeout())
                .logRequests(false)
                .logResponses(false);
        if (settings.getBaseUrl() != null && !settings.getBaseUrl().isBlank()) {
          builder.baseUrl(settings.getBaseUrl());
        }
        yield builder.build();
      }
      case "anthropic" -> {
        AnthropicChatModel.AnthropicChatModelBuilder builder =
            AnthropicChatModel.builder()
                .apiKey(settings.getApiKey())
                .modelName(settings.getModelName())
                .temperature(settings.getTemperature())
                .maxTokens(settings.getMaxTokens())
                .timeout(settings.getTimeout())
                .logRequests(false)
                .logResponses(false);
        if (settings.getBaseUrl() != null && !settings.getBaseUrl().isBlank()) {
          builder.baseUrl(settings.getBaseUrl());
        }
        yield builder.build();
      }
      default ->
          throw new IllegalStateException(
              "Unsupported model provider: '" + settings.getProvider() + "'");
    };
  }

  private static DocumentTranslationException notConfigured(String purpose) {
    return new DocumentTranslationException(
        ErrorCode.CONFIG_ERROR, purpose + " model not configured: API key is missing");
  }
}
