package com.flamingo.ai.doctranslator.service.extraction;

import com.flamingo.ai.doctranslator.config.TranslationConfig;
import com.flamingo.ai.doctranslator.exception.DocumentTranslationException;
import com.flamingo.ai.doctranslator.exception.ErrorCode;
import com.flamingo.ai.doctranslator.service.markup.ModelOutputCleaner;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;

/**
 * Extracts the visual content of a rasterized page as HTML.
 *
 * <p>The vision model's output is cleaned of code fences and leading chatter, validated, given
 * the shared stylesheet and has its section numbers normalized. There is no retry here; a failed
 * page is reported to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PageExtractor {

  private static final String INDEX_SELECTOR = ".index";

  private final VisionExtractor visionExtractor;
  private final IndexNormalizer indexNormalizer;
  private final ModelOutputCleaner outputCleaner;
  private final TranslationConfig translationConfig;
  private final MeterRegistry meterRegistry;

  @Timed(value = "translation.page.extract", description = "Time to extract a page as markup")
  public String extract(byte[] pageBytes) {
    return extract(pageBytes, null);
  }

  /**
   * Extracts a page.
   *
   * @param pageBytes the rasterized page image
   * @param pageNumber the 1-based page number, used for logging and error reporting; may be null
   * @return the page markup, starting with a {@code <style>} block
   * @throws DocumentTranslationException with CONFIG_ERROR, PROCESSING_ERROR or CONTENT_ERROR
   */
  @Timed(value = "translation.page.extract", description = "Time to extract a page as markup")
  public String extract(byte[] pageBytes, Integer pageNumber) {
    Objects.requireNonNull(pageBytes, "pageBytes");
    log.info("Extracting page {} ({} bytes)", pageLabel(pageNumber), pageBytes.length);

    String raw = callVisionModel(pageBytes, pageNumber);
    String html = outputCleaner.trimToFirstTag(outputCleaner.stripCodeFences(raw));
    validate(html, pageNumber);

    if (!html.contains("<style>")) {
      html = ExtractionPrompts.PAGE_STYLES + "\n" + html;
    }
    String normalized = normalizeIndexNumbers(html);

    meterRegistry.counter("translation.page.extracted").increment();
    log.info("Extracted page {}: {} chars of markup", pageLabel(pageNumber), normalized.length());
    return normalized;
  }

  private String callVisionModel(byte[] pageBytes, Integer pageNumber) {
    try {
      return visionExtractor.generate(pageBytes, ExtractionPrompts.STRUCTURE_DETECTION);
    } catch (DocumentTranslationException e) {
      if (e.getErrorCode() == ErrorCode.CONFIG_ERROR) {
        throw new DocumentTranslationException(
            ErrorCode.CONFIG_ERROR, e.getMessage(), pageNumber, e);
      }
      throw new DocumentTranslationException(
          ErrorCode.PROCESSING_ERROR,
          "Failed to process page " + pageLabel(pageNumber) + ": " + e.getMessage(),
          pageNumber,
          e);
    } catch (RuntimeException e) {
      meterRegistry.counter("translation.page.extract.errors").increment();
      throw new DocumentTranslationException(
          ErrorCode.PROCESSING_ERROR,
          "Failed to process page " + pageLabel(pageNumber) + ": " + e.getMessage(),
          pageNumber,
          e);
    }
  }

  private void validate(String html, Integer pageNumber) {
    int minLength = translationConfig.getExtraction().getMinLength();
    if (html.isBlank()) {
      throw contentError("No content extracted from page " + pageLabel(pageNumber), pageNumber);
    }
    if (html.length() < minLength) {
      throw contentError(
          String.format(
              "Insufficient content extracted from page %s: %d chars, expected at least %d",
              pageLabel(pageNumber), html.length(), minLength),
          pageNumber);
    }
    if (!outputCleaner.startsWithTag(html)) {
      throw contentError(
          "Extracted content of page " + pageLabel(pageNumber) + " is not HTML", pageNumber);
    }
  }

  String normalizeIndexNumbers(String html) {
    Document document = Jsoup.parseBodyFragment(html);
    document.outputSettings().prettyPrint(false);
    for (Element index : document.select(INDEX_SELECTOR)) {
      String text = index.text();
      String normalized = indexNormalizer.normalize(text);
      if (!normalized.equals(text)) {
        log.debug("Normalized index '{}' to '{}'", text, normalized);
        index.text(normalized);
      }
    }
    return document.body().html();
  }

  private DocumentTranslationException contentError(String message, Integer pageNumber) {
    meterRegistry.counter("translation.page.content.errors").increment();
    return new DocumentTranslationException(ErrorCode.CONTENT_ERROR, message, pageNumber, null);
  }

  private static String pageLabel(Integer pageNumber) {
    return pageNumber == null ? "?" : pageNumber.toString();
  }
}
