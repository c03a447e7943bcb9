package com.flamingo.ai.doctranslator.service.history.dto;

import com.flamingo.ai.doctranslator.domain.enums.JobStatus;
import java.time.LocalDateTime;
import java.util.List;

/** A translation with its pages in page order. */
public record TranslationContent(
    String processId,
    String fileName,
    String sourceLanguage,
    String targetLanguage,
    JobStatus status,
    int totalPages,
    LocalDateTime completedAt,
    List<TranslatedPage> pages) {

  public boolean hasContent() {
    return !pages.isEmpty();
  }
}
