package com.flamingo.ai.doctranslator.service.progress;

import com.flamingo.ai.doctranslator.domain.entity.TranslationJob;
import com.flamingo.ai.doctranslator.domain.enums.JobStatus;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/** Point-in-time view of a translation job and the pages recorded for it. */
public record JobProgress(
    String processId,
    String userId,
    int totalPages,
    int currentPage,
    int progressPercent,
    JobStatus status,
    String fileName,
    String sourceLanguage,
    String targetLanguage,
    String fileType,
    String failureReason,
    LocalDateTime createdAt,
    LocalDateTime updatedAt,
    SortedSet<Integer> completedPages) {

  public static JobProgress of(TranslationJob job, Collection<Integer> recordedPages) {
    return new JobProgress(
        job.getProcessId(),
        job.getUserId(),
        job.getTotalPages(),
        job.getCurrentPage(),
        job.getProgressPercent(),
        job.getStatus(),
        job.getFileName(),
        job.getSourceLanguage(),
        job.getTargetLanguage(),
        job.getFileType(),
        job.getFailureReason(),
        job.getCreatedAt(),
        job.getUpdatedAt(),
        Collections.unmodifiableSortedSet(new TreeSet<>(recordedPages)));
  }

  /** Page numbers in {@code 1..totalPages} with no recorded result, ascending. */
  public List<Integer> missingPages() {
    List<Integer> missing = new ArrayList<>();
    for (int page = 1; page <= totalPages; page++) {
      if (!completedPages.contains(page)) {
        missing.add(page);
      }
    }
    return missing;
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }
}
