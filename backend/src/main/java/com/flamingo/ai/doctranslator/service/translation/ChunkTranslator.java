package com.flamingo.ai.doctranslator.service.translation;

import com.flamingo.ai.doctranslator.config.TranslationConfig;
import com.flamingo.ai.doctranslator.exception.DocumentTranslationException;
import com.flamingo.ai.doctranslator.exception.ErrorCode;
import com.flamingo.ai.doctranslator.service.markup.ModelOutputCleaner;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Translates one chunk of page markup, retrying transient failures with exponential backoff.
 *
 * <p>Provider and content errors are retried. A configuration error fails immediately. Once all
 * attempts are used up the last error is wrapped in a TRANSLATION_ERROR.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChunkTranslator {

  static final String SYSTEM_PROMPT =
      """
      You are translating HTML content. Your only task is to translate the visible text inside \
      the HTML from the source language to the target language.

      Rules:
      1. Output only the translated HTML, with no explanation, introduction or commentary.
      2. Never prefix the answer with phrases such as "Here's the translation".
      3. Keep every tag and attribute exactly as it appears in the input.
      4. Keep the document structure, layout, classes and styling.
      5. Leave CSS classes, ids and all other attributes unchanged.
      6. Keep table structures and form layouts exactly.
      7. Translate only text that would be displayed to a reader.

      The whole response must be valid HTML that can be used in a web page as is.""";

  private final TextTranslator textTranslator;
  private final ModelOutputCleaner outputCleaner;
  private final TranslationConfig translationConfig;
  private final MeterRegistry meterRegistry;

  /** Translates with the configured number of attempts. */
  @Timed(value = "translation.chunk", description = "Time to translate a chunk, retries included")
  public String translateChunk(String markup, String fromLang, String toLang) {
    return translateChunk(markup, fromLang, toLang, translationConfig.getRetry().getMaxAttempts());
  }

  @Timed(value = "translation.chunk", description = "Time to translate a chunk, retries included")
  public String translateChunk(String markup, String fromLang, String toLang, int maxAttempts) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
    }
    if (markup == null || markup.isBlank()) {
      return markup == null ? "" : markup;
    }

    String chunkId = chunkId(markup);
    AtomicInteger attempts = new AtomicInteger();
    Retry retry = Retry.of("chunk-" + chunkId, retryConfig(maxAttempts));
    retry
        .getEventPublisher()
        .onRetry(
            event -> {
              meterRegistry.counter("translation.chunk.retries").increment();
              log.warn(
                  "Chunk {} attempt {}/{} failed, retrying in {} ms: {}",
                  chunkId,
                  event.getNumberOfRetryAttempts(),
                  maxAttempts,
                  event.getWaitInterval().toMillis(),
                  event.getLastThrowable().getMessage());
            });

    try {
      String translated =
          Retry.decorateSupplier(
                  retry,
                  () -> attempt(markup, fromLang, toLang, chunkId, attempts.incrementAndGet()))
              .get();
      meterRegistry.counter("translation.chunk.success").increment();
      log.debug("Chunk {} translated after {} attempt(s)", chunkId, attempts.get());
      return translated;
    } catch (DocumentTranslationException e) {
      if (!e.isRetryable()) {
        throw e;
      }
      meterRegistry.counter("translation.chunk.failure").increment();
      log.error("Chunk {} failed after {} attempts: {}", chunkId, attempts.get(), e.getMessage());
      throw new DocumentTranslationException(
          ErrorCode.TRANSLATION_ERROR,
          String.format(
              "Translation of chunk %s failed after %d attempts: %s",
              chunkId, attempts.get(), e.getMessage()),
          e);
    }
  }

  private String attempt(
      String markup, String fromLang, String toLang, String chunkId, int attemptNumber) {
    log.info(
        "Translating chunk {} ({} chars), attempt {}", chunkId, markup.length(), attemptNumber);
    String raw;
    try {
      raw = textTranslator.generate(SYSTEM_PROMPT, userPrompt(markup, fromLang, toLang));
    } catch (DocumentTranslationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new DocumentTranslationException(
          ErrorCode.PROVIDER_ERROR, "Translation model call failed: " + e.getMessage(), e);
    }

    // A chunk cut mid-element starts with bare text. Its translation loses that text when a later
    // tag exists, and fails validation on every attempt when none does.
    String translated = outputCleaner.trimToFirstTag(outputCleaner.stripPreamble(raw));
    int minLength = translationConfig.getRetry().getMinOutputLength();
    if (translated.isEmpty() || translated.length() < minLength) {
      throw new DocumentTranslationException(
          ErrorCode.CONTENT_ERROR,
          String.format(
              "Translation of chunk %s too short: %d chars, expected at least %d",
              chunkId, translated.length(), minLength));
    }
    if (!outputCleaner.startsWithTag(translated)) {
      throw new DocumentTranslationException(
          ErrorCode.CONTENT_ERROR, "Translation of chunk " + chunkId + " is not HTML");
    }
    return translated;
  }

  private RetryConfig retryConfig(int maxAttempts) {
    TranslationConfig.Retry settings = translationConfig.getRetry();
    return RetryConfig.custom()
        .maxAttempts(maxAttempts)
        .intervalFunction(
            IntervalFunction.ofExponentialBackoff(
                settings.getInitialBackoff(), settings.getBackoffMultiplier()))
        .retryOnException(
            e -> e instanceof DocumentTranslationException dte && dte.isRetryable())
        .build();
  }

  static String userPrompt(String markup, String fromLang, String toLang) {
    return "Translate the text in this HTML from " + fromLang + " to " + toLang + ".\n\n" + markup;
  }

  /** Short content-derived id used to correlate log lines and metrics of one chunk. */
  static String chunkId(String markup) {
    try {
      byte[] digest =
          MessageDigest.getInstance("SHA-256").digest(markup.getBytes(StandardCharsets.UTF_8));
      return Base64.getUrlEncoder().withoutPadding().encodeToString(digest).substring(0, 8);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
