package com.flamingo.ai.doctranslator.service.translation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.doctranslator.config.TranslationConfig;
import com.flamingo.ai.doctranslator.exception.DocumentTranslationException;
import com.flamingo.ai.doctranslator.exception.ErrorCode;
import com.flamingo.ai.doctranslator.service.markup.ModelOutputCleaner;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ChunkTranslatorTest {

  private static final String CHUNK = "<p>Hello world.</p>";
  private static final String TRANSLATED = "<p>Hola mundo.</p>";

  private TranslationConfig translationConfig;
  private SimpleMeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    translationConfig = new TranslationConfig();
    translationConfig.getRetry().setInitialBackoff(Duration.ofMillis(1));
    translationConfig.getRetry().setBackoffMultiplier(1.0);
    meterRegistry = new SimpleMeterRegistry();
  }

  private ChunkTranslator translatorWith(TextTranslator textTranslator) {
    return new ChunkTranslator(
        textTranslator, new ModelOutputCleaner(), translationConfig, meterRegistry);
  }

  @Test
  void shouldReturnTranslation_whenFirstAttemptSucceeds() {
    // Given
    AtomicReference<String> userPrompt = new AtomicReference<>();
    AtomicReference<String> systemPrompt = new AtomicReference<>();
    ChunkTranslator translator =
        translatorWith(
            (system, user) -> {
              systemPrompt.set(system);
              userPrompt.set(user);
              return TRANSLATED;
            });

    // When
    String result = translator.translateChunk(CHUNK, "English", "Spanish");

    // Then
    assertThat(result).isEqualTo(TRANSLATED);
    assertThat(userPrompt.get())
        .isEqualTo("Translate the text in this HTML from English to Spanish.\n\n" + CHUNK);
    assertThat(systemPrompt.get()).contains("Output only the translated HTML");
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 2, 4})
  @DisplayName("k transient failures followed by success take k+1 calls")
  void shouldRetryTransientFailures(int failures) {
    // Given
    AtomicInteger calls = new AtomicInteger();
    ChunkTranslator translator =
        translatorWith(
            (system, user) -> {
              if (calls.incrementAndGet() <= failures) {
                throw new RuntimeException("503 Service Unavailable");
              }
              return TRANSLATED;
            });

    // When
    String result = translator.translateChunk(CHUNK, "English", "Spanish", failures + 1);

    // Then
    assertThat(result).isEqualTo(TRANSLATED);
    assertThat(calls.get()).isEqualTo(failures + 1);
    assertThat(meterRegistry.counter("translation.chunk.retries").count()).isEqualTo(failures);
  }

  @Test
  void shouldFailWithTranslationError_afterMaxAttempts() {
    // Given
    AtomicInteger calls = new AtomicInteger();
    ChunkTranslator translator =
        translatorWith(
            (system, user) -> {
              calls.incrementAndGet();
              throw new RuntimeException("timeout");
            });

    // When / Then
    assertThatThrownBy(() -> translator.translateChunk(CHUNK, "English", "Spanish", 3))
        .isInstanceOf(DocumentTranslationException.class)
        .satisfies(
            e -> {
              DocumentTranslationException ex = (DocumentTranslationException) e;
              assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.TRANSLATION_ERROR);
              assertThat(ex.getCause())
                  .isInstanceOf(DocumentTranslationException.class)
                  .hasMessageContaining("timeout");
              assertThat(((DocumentTranslationException) ex.getCause()).getErrorCode())
                  .isEqualTo(ErrorCode.PROVIDER_ERROR);
            });
    assertThat(calls.get()).isEqualTo(3);
  }

  @Test
  void shouldUseConfiguredAttempts_whenNotGiven() {
    // Given
    translationConfig.getRetry().setMaxAttempts(2);
    AtomicInteger calls = new AtomicInteger();
    ChunkTranslator translator =
        translatorWith(
            (system, user) -> {
              calls.incrementAndGet();
              return "";
            });

    // When / Then
    assertThatThrownBy(() -> translator.translateChunk(CHUNK, "English", "Spanish"))
        .isInstanceOf(DocumentTranslationException.class)
        .extracting(e -> ((DocumentTranslationException) e).getErrorCode())
        .isEqualTo(ErrorCode.TRANSLATION_ERROR);
    assertThat(calls.get()).isEqualTo(2);
  }

  @Test
  void shouldRetryContentErrors_untilMarkupReturned() {
    // Given
    AtomicInteger calls = new AtomicInteger();
    ChunkTranslator translator =
        translatorWith(
            (system, user) ->
                calls.incrementAndGet() == 1 ? "Sorry, I cannot do that." : TRANSLATED);

    // When
    String result = translator.translateChunk(CHUNK, "English", "Spanish");

    // Then
    assertThat(result).isEqualTo(TRANSLATED);
    assertThat(calls.get()).isEqualTo(2);
  }

  @Test
  void shouldNotRetryConfigError() {
    // Given
    AtomicInteger calls = new AtomicInteger();
    ChunkTranslator translator =
        translatorWith(
            (system, user) -> {
              calls.incrementAndGet();
              throw new DocumentTranslationException(ErrorCode.CONFIG_ERROR, "missing key");
            });

    // When / Then
    assertThatThrownBy(() -> translator.translateChunk(CHUNK, "English", "Spanish", 5))
        .isInstanceOf(DocumentTranslationException.class)
        .extracting(e -> ((DocumentTranslationException) e).getErrorCode())
        .isEqualTo(ErrorCode.CONFIG_ERROR);
    assertThat(calls.get()).isEqualTo(1);
  }

  @Test
  void shouldStripPreambleAndLeadingText() {
    ChunkTranslator translator =
        translatorWith((system, user) -> "Here is the translation:\nOkay!\n" + TRANSLATED);

    assertThat(translator.translateChunk(CHUNK, "English", "Spanish")).isEqualTo(TRANSLATED);
  }

  @Test
  void shouldRejectOutputShorterThanConfiguredMinimum() {
    // Given
    translationConfig.getRetry().setMinOutputLength(100);
    ChunkTranslator translator = translatorWith((system, user) -> TRANSLATED);

    // When / Then
    assertThatThrownBy(() -> translator.translateChunk(CHUNK, "English", "Spanish", 1))
        .isInstanceOf(DocumentTranslationException.class)
        .hasMessageContaining("too short");
  }

  @Test
  void shouldSkipModelCall_whenChunkIsBlank() {
    AtomicInteger calls = new AtomicInteger();
    ChunkTranslator translator =
        translatorWith(
            (system, user) -> {
              calls.incrementAndGet();
              return TRANSLATED;
            });

    assertThat(translator.translateChunk("", "English", "Spanish")).isEmpty();
    assertThat(calls.get()).isZero();
  }

  @Test
  void shouldRejectNonPositiveAttempts() {
    ChunkTranslator translator = translatorWith((system, user) -> TRANSLATED);

    assertThatThrownBy(() -> translator.translateChunk(CHUNK, "English", "Spanish", 0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void shouldDeriveStableEightCharacterChunkId() {
    String id = ChunkTranslator.chunkId(CHUNK);

    assertThat(id).hasSize(8).isEqualTo(ChunkTranslator.chunkId(CHUNK));
    assertThat(ChunkTranslator.chunkId("<p>Other</p>")).isNotEqualTo(id);
  }

  @Test
  @DisplayName("A chunk starting mid-element loses its leading text when a later tag exists")
  void shouldDropLeadingBareText_whenChunkStartsMidElement() {
    // Given
    ChunkTranslator translator = translatorWith((system, user) -> "Segundo.</p><p>Tercero.</p>");

    // When
    String result = translator.translateChunk("Second.</p><p>Third.</p>", "English", "Spanish");

    // Then
    assertThat(result).isEqualTo("<p>Tercero.</p>");
  }

  @Test
  void shouldFailWithTranslationError_whenMidElementChunkHasNoOpeningTag() {
    // Given
    AtomicInteger calls = new AtomicInteger();
    ChunkTranslator translator =
        translatorWith(
            (system, user) -> {
              calls.incrementAndGet();
              return "Segundo.</p>";
            });

    // When / Then
    assertThatThrownBy(() -> translator.translateChunk("Second.</p>", "English", "Spanish", 2))
        .isInstanceOf(DocumentTranslationException.class)
        .extracting(e -> ((DocumentTranslationException) e).getErrorCode())
        .isEqualTo(ErrorCode.TRANSLATION_ERROR);
    assertThat(calls.get()).isEqualTo(2);
  }
}
