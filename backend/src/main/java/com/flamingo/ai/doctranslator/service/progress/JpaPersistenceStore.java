package com.flamingo.ai.doctranslator.service.progress;

import com.flamingo.ai.doctranslator.domain.entity.TranslationJob;
import com.flamingo.ai.doctranslator.domain.entity.TranslationPageResult;
import com.flamingo.ai.doctranslator.domain.enums.JobStatus;
import com.flamingo.ai.doctranslator.domain.repository.TranslationJobRepository;
import com.flamingo.ai.doctranslator.domain.repository.TranslationPageResultRepository;
import com.flamingo.ai.doctranslator.exception.DocumentTranslationException;
import com.flamingo.ai.doctranslator.exception.ErrorCode;
import com.flamingo.ai.doctranslator.exception.JobNotFoundException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** {@link PersistenceStore} over the Spring Data repositories. */
@Repository
@RequiredArgsConstructor
@Slf4j
public class JpaPersistenceStore implements PersistenceStore {

  private final TranslationJobRepository jobRepository;
  private final TranslationPageResultRepository pageResultRepository;

  @Override
  @Transactional
  public TranslationJob createJob(TranslationJob job) {
    if (jobRepository.existsByProcessId(job.getProcessId())) {
      throw alreadyExists(job.getProcessId(), null);
    }
    try {
      return jobRepository.saveAndFlush(job);
    } catch (DataIntegrityViolationException e) {
      throw alreadyExists(job.getProcessId(), e);
    }
  }

  /**
   * Writes the page while holding a row lock on its job. Concurrent writers of the same page
   * therefore run one after the other, and the later one updates the row the earlier one inserted.
   */
  @Override
  @Transactional
  public TranslationPageResult upsertPageResult(
      TranslationJob job, int pageNumber, String content) {
    TranslationJob lockedJob =
        jobRepository
            .findWithLockByProcessId(job.getProcessId())
            .orElseThrow(() -> new JobNotFoundException(job.getProcessId()));
    TranslationPageResult pageResult =
        pageResultRepository
            .findByJobProcessIdAndPageNumber(lockedJob.getProcessId(), pageNumber)
            .orElseGet(
                () ->
                    TranslationPageResult.builder().job(lockedJob).pageNumber(pageNumber).build());
    pageResult.setContent(content);
    return pageResultRepository.saveAndFlush(pageResult);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<TranslationJob> findJob(String processId) {
    return jobRepository.findByProcessId(processId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<TranslationPageResult> listPageResults(String processId) {
    return pageResultRepository.findByJobProcessIdOrderByPageNumberAsc(processId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Integer> listRecordedPageNumbers(String processId) {
    return pageResultRepository.findPageNumbersByProcessId(processId);
  }

  @Override
  @Transactional
  public boolean advanceProgress(String processId, int pageNumber, int progressPercent) {
    LocalDateTime now = LocalDateTime.now();
    int updated = jobRepository.advanceProgress(processId, pageNumber, progressPercent, now);
    if (updated == 0) {
      jobRepository.touch(processId, now);
    }
    return updated > 0;
  }

  @Override
  @Transactional
  public boolean markCompleted(String processId) {
    return jobRepository.transitionToCompleted(
            processId, JobStatus.IN_PROGRESS, JobStatus.COMPLETED, LocalDateTime.now())
        > 0;
  }

  @Override
  @Transactional
  public boolean markFailed(String processId, String failureReason) {
    return jobRepository.transitionToFailed(
            processId,
            JobStatus.IN_PROGRESS,
            JobStatus.FAILED,
            failureReason,
            LocalDateTime.now())
        > 0;
  }

  private static DocumentTranslationException alreadyExists(String processId, Throwable cause) {
    log.warn("Translation job {} already exists", processId);
    return new DocumentTranslationException(
        ErrorCode.ALREADY_EXISTS, "Translation job already exists: " + processId, cause);
  }
}
