package com.flamingo.ai.doctranslator.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.doctranslator.config.TranslationConfig;
import com.flamingo.ai.doctranslator.exception.DocumentTranslationException;
import com.flamingo.ai.doctranslator.exception.ErrorCode;
import com.flamingo.ai.doctranslator.service.markup.ModelOutputCleaner;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PageExtractorTest {

  private static final byte[] PAGE = {1, 2, 3};

  private static final String FORM_PAGE =
      "<div class=\"form-section\"><div class=\"form-row\"><div class=\"label\">Name:</div>"
          + "<div class=\"value\">John Smith</div></div></div>";

  @Mock private VisionExtractor visionExtractor;

  private SimpleMeterRegistry meterRegistry;
  private TranslationConfig translationConfig;
  private PageExtractor pageExtractor;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    translationConfig = new TranslationConfig();
    pageExtractor =
        new PageExtractor(
            visionExtractor,
            new IndexNormalizer(),
            new ModelOutputCleaner(),
            translationConfig,
            meterRegistry);
  }

  @Test
  void shouldPrependStyles_andSendStructureInstruction() {
    // Given
    when(visionExtractor.generate(any(byte[].class), any(String.class))).thenReturn(FORM_PAGE);

    // When
    String html = pageExtractor.extract(PAGE, 1);

    // Then
    assertThat(html).startsWith("<style>");
    assertThat(html).contains(".form-row").endsWith(FORM_PAGE);
    verify(visionExtractor).generate(eq(PAGE), eq(ExtractionPrompts.STRUCTURE_DETECTION));
    assertThat(meterRegistry.counter("translation.page.extracted").count()).isEqualTo(1.0);
  }

  @Test
  void shouldStripCodeFencesAndLeadingChatter() {
    // Given
    when(visionExtractor.generate(any(byte[].class), any(String.class)))
        .thenReturn("Here is the page:\n```html\n" + FORM_PAGE + "\n```");

    // When
    String html = pageExtractor.extract(PAGE);

    // Then
    assertThat(html).doesNotContain("```").doesNotContain("Here is the page");
    assertThat(html).endsWith(FORM_PAGE);
  }

  @Test
  void shouldNotAddSecondStyleBlock_whenOutputHasOne() {
    // Given
    String withStyle = "<style>.x { color: red; }</style>" + FORM_PAGE;
    when(visionExtractor.generate(any(byte[].class), any(String.class))).thenReturn(withStyle);

    // When
    String html = pageExtractor.extract(PAGE, 2);

    // Then
    assertThat(html).isEqualTo(withStyle);
  }

  @Test
  void shouldNormalizeIndexElements() {
    // Given
    String page =
        "<section><div class=\"index\">1,2</div><div class=\"index\">l.3</div>"
            + "<p class=\"text-content\">Body text with 1,2 kept as is.</p></section>";
    when(visionExtractor.generate(any(byte[].class), any(String.class))).thenReturn(page);

    // When
    String html = pageExtractor.extract(PAGE, 3);

    // Then
    assertThat(html)
        .contains("<div class=\"index\">1.2</div>")
        .contains("<div class=\"index\">1.3</div>")
        .contains("Body text with 1,2 kept as is.");
  }

  @Test
  void shouldThrowContentError_whenOutputTooShort() {
    // Given
    when(visionExtractor.generate(any(byte[].class), any(String.class))).thenReturn("<p>Hi</p>");

    // When / Then
    assertThatThrownBy(() -> pageExtractor.extract(PAGE, 4))
        .isInstanceOf(DocumentTranslationException.class)
        .satisfies(
            e -> {
              DocumentTranslationException ex = (DocumentTranslationException) e;
              assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.CONTENT_ERROR);
              assertThat(ex.getPageNumber()).isEqualTo(4);
            });
  }

  @Test
  void shouldThrowContentError_whenOutputEmpty() {
    when(visionExtractor.generate(any(byte[].class), any(String.class))).thenReturn("```html\n```");

    assertThatThrownBy(() -> pageExtractor.extract(PAGE))
        .isInstanceOf(DocumentTranslationException.class)
        .extracting(e -> ((DocumentTranslationException) e).getErrorCode())
        .isEqualTo(ErrorCode.CONTENT_ERROR);
  }

  @Test
  void shouldThrowContentError_whenOutputHasNoMarkup() {
    when(visionExtractor.generate(any(byte[].class), any(String.class)))
        .thenReturn("I could not read this page because the image is too blurry to process.");

    assertThatThrownBy(() -> pageExtractor.extract(PAGE))
        .isInstanceOf(DocumentTranslationException.class)
        .extracting(e -> ((DocumentTranslationException) e).getErrorCode())
        .isEqualTo(ErrorCode.CONTENT_ERROR);
  }

  @Test
  void shouldHonourConfiguredMinimumLength() {
    // Given
    translationConfig.getExtraction().setMinLength(5);
    when(visionExtractor.generate(any(byte[].class), any(String.class))).thenReturn("<p>Hi</p>");

    // When
    String html = pageExtractor.extract(PAGE);

    // Then
    assertThat(html).endsWith("<p>Hi</p>");
  }

  @Test
  void shouldWrapModelFailureAsProcessingError() {
    // Given
    when(visionExtractor.generate(any(byte[].class), any(String.class)))
        .thenThrow(new RuntimeException("connection reset"));

    // When / Then
    assertThatThrownBy(() -> pageExtractor.extract(PAGE, 7))
        .isInstanceOf(DocumentTranslationException.class)
        .hasMessageContaining("connection reset")
        .extracting(e -> ((DocumentTranslationException) e).getErrorCode())
        .isEqualTo(ErrorCode.PROCESSING_ERROR);
  }

  @Test
  void shouldKeepConfigError_whenCredentialsMissing() {
    // Given
    when(visionExtractor.generate(any(byte[].class), any(String.class)))
        .thenThrow(new DocumentTranslationException(ErrorCode.CONFIG_ERROR, "no key"));

    // When / Then
    assertThatThrownBy(() -> pageExtractor.extract(PAGE, 1))
        .isInstanceOf(DocumentTranslationException.class)
        .extracting(e -> ((DocumentTranslationException) e).getErrorCode())
        .isEqualTo(ErrorCode.CONFIG_ERROR);
  }
}
