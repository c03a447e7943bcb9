package com.flamingo.ai.doctranslator.service.pipeline;

import java.util.List;

/**
 * Outcome of one {@link DocumentTranslationPipeline#translate} run.
 *
 * @param processId the job
 * @param status how the run ended
 * @param document the assembled document, or null unless every page is recorded
 * @param translatedPages pages translated during this run
 * @param skippedPages pages already recorded by an earlier run
 * @param failures failed pages in page order, empty unless the run failed
 */
public record TranslationRunResult(
    String processId,
    RunStatus status,
    String document,
    int translatedPages,
    int skippedPages,
    List<PageFailure> failures) {

  /** Terminal state of a run. */
  public enum RunStatus {
    COMPLETED,
    FAILED,
    CANCELLED
  }

  public TranslationRunResult {
    failures = List.copyOf(failures);
  }

  static TranslationRunResult completed(
      String processId, String document, int translatedPages, int skippedPages) {
    return new TranslationRunResult(
        processId, RunStatus.COMPLETED, document, translatedPages, skippedPages, List.of());
  }

  static TranslationRunResult failed(
      String processId, int translatedPages, int skippedPages, List<PageFailure> failures) {
    return new TranslationRunResult(
        processId, RunStatus.FAILED, null, translatedPages, skippedPages, failures);
  }

  static TranslationRunResult cancelled(String processId, int translatedPages, int skippedPages) {
    return new TranslationRunResult(
        processId, RunStatus.CANCELLED, null, translatedPages, skippedPages, List.of());
  }

  public boolean isSuccess() {
    return status == RunStatus.COMPLETED;
  }
}
