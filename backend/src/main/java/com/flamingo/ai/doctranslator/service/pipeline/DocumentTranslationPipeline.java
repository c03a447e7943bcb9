package com.flamingo.ai.doctranslator.service.pipeline;

import com.flamingo.ai.doctranslator.config.TranslationConfig;
import com.flamingo.ai.doctranslator.domain.enums.JobStatus;
import com.flamingo.ai.doctranslator.exception.DocumentTranslationException;
import com.flamingo.ai.doctranslator.exception.ErrorCode;
import com.flamingo.ai.doctranslator.service.assembly.DocumentAssembler;
import com.flamingo.ai.doctranslator.service.chunking.ChunkSplitter;
import com.flamingo.ai.doctranslator.service.extraction.PageExtractor;
import com.flamingo.ai.doctranslator.service.progress.JobProgress;
import com.flamingo.ai.doctranslator.service.progress.ProgressTracker;
import com.flamingo.ai.doctranslator.service.progress.RecordedPage;
import com.flamingo.ai.doctranslator.service.translation.ChunkTranslator;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Translates a document page by page on a bounded worker pool.
 *
 * <p>Each page is extracted, split, translated chunk by chunk and recorded as soon as it is done,
 * so an interrupted or failed run can be resumed and only the missing pages are redone. A
 * configuration error stops all pages that have not started yet.
 */
@Service
@Slf4j
public class DocumentTranslationPipeline {

  private final PageExtractor pageExtractor;
  private final ChunkSplitter chunkSplitter;
  private final ChunkTranslator chunkTranslator;
  private final DocumentAssembler documentAssembler;
  private final ProgressTracker progressTracker;
  private final TranslationConfig translationConfig;
  private final Executor pageTranslationExecutor;
  private final MeterRegistry meterRegistry;

  private final Set<String> activeRuns = ConcurrentHashMap.newKeySet();
  private final Set<String> cancelledRuns = ConcurrentHashMap.newKeySet();

  public DocumentTranslationPipeline(
      PageExtractor pageExtractor,
      ChunkSplitter chunkSplitter,
      ChunkTranslator chunkTranslator,
      DocumentAssembler documentAssembler,
      ProgressTracker progressTracker,
      TranslationConfig translationConfig,
      @Qualifier("pageTranslationExecutor") Executor pageTranslationExecutor,
      MeterRegistry meterRegistry) {
    this.pageExtractor = pageExtractor;
    this.chunkSplitter = chunkSplitter;
    this.chunkTranslator = chunkTranslator;
    this.documentAssembler = documentAssembler;
    this.progressTracker = progressTracker;
    this.translationConfig = translationConfig;
    this.pageTranslationExecutor = pageTranslationExecutor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Translates the pages of a document, resuming the job if it already exists.
   *
   * @param request the job identity and languages
   * @param pages rasterized page images in page order
   * @return the outcome of this run
   * @throws IllegalArgumentException if no pages are given or a resumed job has another page
   *     count
   * @throws IllegalStateException if a run for the same job is already active
   */
  @Timed(value = "translation.document", description = "Time to translate a whole document")
  public TranslationRunResult translate(TranslationRequest request, List<byte[]> pages) {
    if (pages == null || pages.isEmpty()) {
      throw new IllegalArgumentException("A document needs at least one page");
    }
    String processId = request.processId();
    if (!activeRuns.add(processId)) {
      throw new IllegalStateException("Translation job " + processId + " is already running");
    }
    try {
      return run(request, pages);
    } finally {
      activeRuns.remove(processId);
      cancelledRuns.remove(processId);
    }
  }

  /**
   * Stops scheduling pages of an active run. Pages already in flight finish and stay recorded.
   *
   * @return whether a run for the job was active
   */
  public boolean cancel(String processId) {
    if (!activeRuns.contains(processId)) {
      return false;
    }
    cancelledRuns.add(processId);
    log.info("Cancellation requested for translation job {}", processId);
    return true;
  }

  private TranslationRunResult run(TranslationRequest request, List<byte[]> pages) {
    String processId = request.processId();
    JobProgress progress = startOrResume(request, pages.size());
    int skipped = progress.completedPages().size();

    if (progress.status() == JobStatus.COMPLETED) {
      log.info("Translation job {} is already completed, assembling stored pages", processId);
      return TranslationRunResult.completed(processId, assemble(processId), 0, skipped);
    }

    AtomicReference<DocumentTranslationException> abortCause = new AtomicReference<>();
    List<CompletableFuture<PageOutcome>> futures = new ArrayList<>();
    List<Integer> missingPages = progress.missingPages();
    for (int i = 0; i < missingPages.size(); i++) {
      int pageNumber = missingPages.get(i);
      byte[] pageBytes = pages.get(pageNumber - 1);
      try {
        futures.add(
            CompletableFuture.supplyAsync(
                () -> translatePage(request, pageNumber, pageBytes, abortCause),
                pageTranslationExecutor));
      } catch (RejectedExecutionException e) {
        List<Integer> unscheduled = missingPages.subList(i, missingPages.size());
        log.error(
            "Worker queue rejected job {} at page {}: {} pages not scheduled",
            processId,
            pageNumber,
            unscheduled.size(),
            e);
        for (int rejectedPage : unscheduled) {
          futures.add(
              CompletableFuture.completedFuture(
                  pageFailed(
                      processId,
                      new PageFailure(
                          rejectedPage,
                          ErrorCode.PROCESSING_ERROR,
                          "Page was not scheduled: worker queue is full"))));
        }
        break;
      }
    }
    CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();

    int translated = 0;
    int notStarted = 0;
    List<PageFailure> failures = new ArrayList<>();
    for (CompletableFuture<PageOutcome> future : futures) {
      PageOutcome outcome = future.join();
      if (outcome.failure() != null) {
        failures.add(outcome.failure());
      } else if (outcome.translated()) {
        translated++;
      } else {
        notStarted++;
      }
    }
    failures.sort(Comparator.comparingInt(PageFailure::pageNumber));

    if (!failures.isEmpty()) {
      return failRun(processId, progress.status(), translated, skipped, failures);
    }
    if (notStarted > 0) {
      meterRegistry.counter("translation.document.cancelled").increment();
      log.info(
          "Translation job {} cancelled: {} pages translated, {} not started",
          processId,
          translated,
          notStarted);
      return TranslationRunResult.cancelled(processId, translated, skipped);
    }

    String document = assemble(processId);
    if (progress.status() == JobStatus.IN_PROGRESS) {
      progressTracker.complete(processId);
    } else {
      log.warn(
          "All pages of job {} are now recorded but it stays {}; returning the assembled document",
          processId,
          progress.status());
    }
    meterRegistry.counter("translation.document.success").increment();
    return TranslationRunResult.completed(processId, document, translated, skipped);
  }

  private JobProgress startOrResume(TranslationRequest request, int pageCount) {
    Optional<JobProgress> existing = progressTracker.findProgress(request.processId());
    if (existing.isEmpty()) {
      return progressTracker.start(
          request.processId(),
          pageCount,
          request.userId(),
          request.sourceLanguage(),
          request.targetLanguage(),
          request.fileName(),
          request.fileType());
    }
    JobProgress progress = existing.get();
    if (progress.totalPages() != pageCount) {
      throw new IllegalArgumentException(
          String.format(
              "Job %s has %d pages but %d were supplied",
              request.processId(), progress.totalPages(), pageCount));
    }
    log.info(
        "Resuming translation job {} ({}): {}/{} pages already recorded",
        request.processId(),
        progress.status(),
        progress.completedPages().size(),
        progress.totalPages());
    return progress;
  }

  private PageOutcome translatePage(
      TranslationRequest request,
      int pageNumber,
      byte[] pageBytes,
      AtomicReference<DocumentTranslationException> abortCause) {
    String processId = request.processId();
    if (cancelledRuns.contains(processId) || abortCause.get() != null) {
      log.debug("Skipping page {} of job {}: run stopped", pageNumber, processId);
      return PageOutcome.notStarted();
    }

    try {
      String markup = pageExtractor.extract(pageBytes, pageNumber);
      int maxSize = translationConfig.getChunking().maxSizeFor(request.targetLanguage());
      List<String> chunks = chunkSplitter.split(markup, maxSize);
      List<String> translatedChunks = new ArrayList<>(chunks.size());
      for (String chunk : chunks) {
        translatedChunks.add(
            chunkTranslator.translateChunk(
                chunk, request.sourceLanguage(), request.targetLanguage()));
      }
      progressTracker.recordPage(
          processId, pageNumber, String.join(ChunkSplitter.CHUNK_SEPARATOR, translatedChunks));

      meterRegistry.counter("translation.page.success").increment();
      log.info("Translated page {} of job {} in {} chunks", pageNumber, processId, chunks.size());
      return PageOutcome.done();
    } catch (DocumentTranslationException e) {
      if (e.getErrorCode() == ErrorCode.CONFIG_ERROR && abortCause.compareAndSet(null, e)) {
        log.error("Aborting translation job {}: {}", processId, e.getMessage());
      }
      return pageFailed(processId, new PageFailure(pageNumber, e.getErrorCode(), e.getMessage()));
    } catch (RuntimeException e) {
      log.error("Unexpected error on page {} of job {}", pageNumber, processId, e);
      return pageFailed(
          processId, new PageFailure(pageNumber, ErrorCode.PROCESSING_ERROR, e.getMessage()));
    }
  }

  private PageOutcome pageFailed(String processId, PageFailure failure) {
    meterRegistry.counter("translation.page.failure").increment();
    log.error(
        "Page {} of job {} failed with {}: {}",
        failure.pageNumber(),
        processId,
        failure.errorCode(),
        failure.message());
    return PageOutcome.failed(failure);
  }

  private TranslationRunResult failRun(
      String processId,
      JobStatus statusAtStart,
      int translated,
      int skipped,
      List<PageFailure> failures) {
    if (statusAtStart == JobStatus.IN_PROGRESS) {
      progressTracker.fail(processId, failures.get(0).describe());
    }
    meterRegistry.counter("translation.document.failure").increment();
    log.warn(
        "Translation job {} failed: {} of {} attempted pages failed",
        processId,
        failures.size(),
        translated + failures.size());
    return TranslationRunResult.failed(processId, translated, skipped, failures);
  }

  private String assemble(String processId) {
    List<String> contents =
        progressTracker.recordedPages(processId).stream().map(RecordedPage::content).toList();
    return documentAssembler.combine(contents);
  }

  private record PageOutcome(boolean translated, PageFailure failure) {

    static PageOutcome done() {
      return new PageOutcome(true, null);
    }

    static PageOutcome notStarted() {
      return new PageOutcome(false, null);
    }

    static PageOutcome failed(PageFailure failure) {
      return new PageOutcome(false, failure);
    }
  }
}
