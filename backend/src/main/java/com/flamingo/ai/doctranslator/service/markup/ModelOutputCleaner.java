package com.flamingo.ai.doctranslator.service.markup;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Strips the wrapping that chat models put around the markup they were asked to return. */
@Component
public class ModelOutputCleaner {

  private static final Pattern CODE_FENCE =
      Pattern.compile("```(?:html)?", Pattern.CASE_INSENSITIVE);
  private static final Pattern FIRST_TAG = Pattern.compile("<\\w+");
  private static final Pattern LEADING_TAG = Pattern.compile("^<[A-Za-z!/]");

  private static final List<Pattern> PREAMBLES =
      List.of(
          preamble("^Translation:\\s*"),
          preamble("^Here's the translation:\\s*"),
          preamble("^Translated text:\\s*"),
          preamble("^Here is the translation:\\s*"),
          preamble("^Here's the HTML content translated to [^:]+:\\s*"),
          preamble("^The HTML content translated to [^:]+:\\s*"),
          preamble("^Translated HTML content:\\s*"),
          preamble("^Translated content:\\s*"),
          preamble("^Here is the HTML translated [^:]*:\\s*"));

  /** Removes Markdown code fences, with or without the {@code html} language tag. */
  public String stripCodeFences(String output) {
    if (output == null) {
      return "";
    }
    return CODE_FENCE.matcher(output).replaceAll("").strip();
  }

  /** Removes introductory phrases such as "Here is the translation:". */
  public String stripPreamble(String output) {
    if (output == null) {
      return "";
    }
    String cleaned = output.strip();
    for (Pattern pattern : PREAMBLES) {
      cleaned = pattern.matcher(cleaned).replaceFirst("");
    }
    return cleaned.strip();
  }

  /** Drops any text before the first opening tag. Output without tags is returned stripped. */
  public String trimToFirstTag(String output) {
    if (output == null) {
      return "";
    }
    String trimmed = output.strip();
    if (startsWithTag(trimmed)) {
      return trimmed;
    }
    Matcher matcher = FIRST_TAG.matcher(trimmed);
    return matcher.find() ? trimmed.substring(matcher.start()) : trimmed;
  }

  public boolean startsWithTag(String output) {
    return output != null && LEADING_TAG.matcher(output.strip()).find();
  }

  /** Full cleanup applied to translation output. */
  public String clean(String output) {
    return trimToFirstTag(stripPreamble(stripCodeFences(output)));
  }

  private static Pattern preamble(String regex) {
    return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
  }
}
