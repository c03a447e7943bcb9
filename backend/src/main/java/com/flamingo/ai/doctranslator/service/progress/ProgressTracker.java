package com.flamingo.ai.doctranslator.service.progress;

import com.flamingo.ai.doctranslator.domain.entity.TranslationJob;
import com.flamingo.ai.doctranslator.domain.enums.JobStatus;
import com.flamingo.ai.doctranslator.exception.JobNotFoundException;
import com.flamingo.ai.doctranslator.exception.JobStateException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persists the lifecycle and per-page results of translation jobs.
 *
 * <p>Pages may be recorded concurrently and in any order. The progress marker only moves
 * forward, and recording the same page again replaces its content.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProgressTracker {

  private final PersistenceStore persistenceStore;
  private final MeterRegistry meterRegistry;

  /**
   * Creates an IN_PROGRESS job with no recorded pages.
   *
   * @throws com.flamingo.ai.doctranslator.exception.DocumentTranslationException with
   *     ALREADY_EXISTS when the process id is taken
   */
  @Transactional
  @Timed(value = "translation.job.start", description = "Time to create a translation job")
  public JobProgress start(
      String processId,
      int totalPages,
      String userId,
      String fromLang,
      String toLang,
      String fileName,
      String fileType) {
    Objects.requireNonNull(processId, "processId");
    if (totalPages < 1) {
      throw new IllegalArgumentException("totalPages must be at least 1, got " + totalPages);
    }

    TranslationJob job =
        persistenceStore.createJob(
            TranslationJob.builder()
                .processId(processId)
                .userId(userId)
                .totalPages(totalPages)
                .sourceLanguage(fromLang)
                .targetLanguage(toLang)
                .fileName(fileName)
                .fileType(fileType)
                .build());

    meterRegistry.counter("translation.jobs.started").increment();
    log.info(
        "Started translation job {} for user {}: {} pages, {} -> {}",
        processId,
        userId,
        totalPages,
        fromLang,
        toLang);
    return JobProgress.of(job, List.of());
  }

  /**
   * Stores the translated content of a page and moves the progress marker forward.
   *
   * @throws IllegalArgumentException if the page number is outside {@code 1..totalPages}
   * @throws JobStateException if the job is already COMPLETED
   */
  @Transactional
  public void recordPage(String processId, int pageNumber, String content) {
    Objects.requireNonNull(content, "content");
    TranslationJob job = requireJob(processId);
    if (pageNumber < 1 || pageNumber > job.getTotalPages()) {
      throw new IllegalArgumentException(
          String.format(
              "Page %d is outside 1..%d for job %s", pageNumber, job.getTotalPages(), processId));
    }
    if (job.getStatus() == JobStatus.COMPLETED) {
      throw new JobStateException(processId, job.getStatus(), "record page " + pageNumber + " of");
    }

    persistenceStore.upsertPageResult(job, pageNumber, content);
    int percent = progressPercent(pageNumber, job.getTotalPages());
    boolean advanced = persistenceStore.advanceProgress(processId, pageNumber, percent);

    meterRegistry.counter("translation.pages.recorded").increment();
    log.debug(
        "Recorded page {}/{} of job {} ({})",
        pageNumber,
        job.getTotalPages(),
        processId,
        advanced ? percent + "%" : "progress unchanged");
  }

  /** Closes the job successfully and sets progress to 100%. */
  @Transactional
  public void complete(String processId) {
    TranslationJob job = requireJob(processId);
    if (!persistenceStore.markCompleted(processId)) {
      throw new JobStateException(processId, currentStatus(processId, job), "complete");
    }
    meterRegistry.counter("translation.jobs.completed").increment();
    log.info("Completed translation job {}", processId);
  }

  /** Closes the job as failed. Recorded pages are kept. */
  @Transactional
  public void fail(String processId, String errorInfo) {
    TranslationJob job = requireJob(processId);
    if (!persistenceStore.markFailed(processId, errorInfo)) {
      throw new JobStateException(processId, currentStatus(processId, job), "fail");
    }
    meterRegistry.counter("translation.jobs.failed").increment();
    log.warn("Translation job {} failed: {}", processId, errorInfo);
  }

  /**
   * Returns the job with its recorded page numbers.
   *
   * @throws JobNotFoundException if no such job exists
   */
  @Transactional(readOnly = true)
  public JobProgress getProgress(String processId) {
    return findProgress(processId).orElseThrow(() -> new JobNotFoundException(processId));
  }

  @Transactional(readOnly = true)
  public Optional<JobProgress> findProgress(String processId) {
    return persistenceStore
        .findJob(processId)
        .map(job -> JobProgress.of(job, persistenceStore.listRecordedPageNumbers(processId)));
  }

  /** Recorded pages of the job, ordered by page number. */
  @Transactional(readOnly = true)
  public List<RecordedPage> recordedPages(String processId) {
    requireJob(processId);
    return persistenceStore.listPageResults(processId).stream()
        .map(page -> new RecordedPage(page.getPageNumber(), page.getContent()))
        .toList();
  }

  static int progressPercent(int currentPage, int totalPages) {
    return (int) Math.round(currentPage * 100.0 / totalPages);
  }

  private TranslationJob requireJob(String processId) {
    return persistenceStore
        .findJob(processId)
        .orElseThrow(() -> new JobNotFoundException(processId));
  }

  private JobStatus currentStatus(String processId, TranslationJob fallback) {
    return persistenceStore
        .findJob(processId)
        .map(TranslationJob::getStatus)
        .orElse(fallback.getStatus());
  }
}
