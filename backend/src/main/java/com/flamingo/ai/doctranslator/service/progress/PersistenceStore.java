package com.flamingo.ai.doctranslator.service.progress;

import com.flamingo.ai.doctranslator.domain.entity.TranslationJob;
import com.flamingo.ai.doctranslator.domain.entity.TranslationPageResult;
import java.util.List;
import java.util.Optional;

/** Storage of translation jobs and their page results. */
public interface PersistenceStore {

  /**
   * Inserts a new job.
   *
   * @throws com.flamingo.ai.doctranslator.exception.DocumentTranslationException with
   *     ALREADY_EXISTS when the process id is taken
   */
  TranslationJob createJob(TranslationJob job);

  /** Inserts the page result, or replaces the content of the existing one. */
  TranslationPageResult upsertPageResult(TranslationJob job, int pageNumber, String content);

  Optional<TranslationJob> findJob(String processId);

  /** Page results of the job, ordered by page number. */
  List<TranslationPageResult> listPageResults(String processId);

  /** Recorded page numbers of the job, ascending. */
  List<Integer> listRecordedPageNumbers(String processId);

  /**
   * Sets the progress marker to {@code pageNumber} unless it is already at or past it.
   *
   * @return whether the marker moved
   */
  boolean advanceProgress(String processId, int pageNumber, int progressPercent);

  /** Moves an IN_PROGRESS job to COMPLETED. Returns false when the job was not IN_PROGRESS. */
  boolean markCompleted(String processId);

  /** Moves an IN_PROGRESS job to FAILED. Returns false when the job was not IN_PROGRESS. */
  boolean markFailed(String processId, String failureReason);
}
