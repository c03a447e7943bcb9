package com.flamingo.ai.doctranslator.service.assembly;

import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Merges translated page markup into one document. */
@Component
@Slf4j
public class DocumentAssembler {

  private static final Pattern DOCUMENT_LEVEL_TAGS =
      Pattern.compile("</?(?:html|head|body)\\b[^>]*>", Pattern.CASE_INSENSITIVE);

  /**
   * Wraps every page in a {@code page} div and all pages in a {@code document} div. Document
   * level {@code html}, {@code head} and {@code body} tags are removed from each page first.
   *
   * @param pages page markup in page order
   * @return the combined document
   */
  public String combine(List<String> pages) {
    StringBuilder document = new StringBuilder("<div class='document'>\n");
    for (String page : pages) {
      String content = DOCUMENT_LEVEL_TAGS.matcher(page == null ? "" : page).replaceAll("");
      document.append("<div class='page'>\n").append(content).append("\n</div>\n");
    }
    document.append("</div>");
    log.debug("Combined {} pages into {} chars", pages.size(), document.length());
    return document.toString();
  }
}
