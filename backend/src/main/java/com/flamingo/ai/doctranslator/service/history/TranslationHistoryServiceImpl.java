package com.flamingo.ai.doctranslator.service.history;

import com.flamingo.ai.doctranslator.domain.entity.TranslationJob;
import com.flamingo.ai.doctranslator.domain.enums.JobStatus;
import com.flamingo.ai.doctranslator.domain.repository.TranslationJobRepository;
import com.flamingo.ai.doctranslator.domain.repository.TranslationPageResultRepository;
import com.flamingo.ai.doctranslator.service.history.dto.RecentTranslation;
import com.flamingo.ai.doctranslator.service.history.dto.TranslatedPage;
import com.flamingo.ai.doctranslator.service.history.dto.TranslationContent;
import com.flamingo.ai.doctranslator.service.history.dto.TranslationStats;
import io.micrometer.core.annotation.Timed;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of the TranslationHistoryService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class TranslationHistoryServiceImpl implements TranslationHistoryService {

  static final String UNTITLED = "Untitled Document";
  static final String UNKNOWN_LANGUAGE = "Unknown";

  private final TranslationJobRepository jobRepository;
  private final TranslationPageResultRepository pageResultRepository;

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "history.recent", description = "Time to list recent translations")
  public List<RecentTranslation> recentTranslations(String userId, int limit) {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be at least 1, got " + limit);
    }
    List<RecentTranslation> recent =
        jobRepository
            .findByUserIdAndStatusOrderByUpdatedAtDesc(
                userId, JobStatus.COMPLETED, PageRequest.of(0, limit))
            .stream()
            .map(this::toRecentTranslation)
            .toList();
    log.debug("Found {} recent translations for user {}", recent.size(), userId);
    return recent;
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "history.content", description = "Time to load a translation's pages")
  public Optional<TranslationContent> translationContent(String processId, String userId) {
    Optional<TranslationJob> found = jobRepository.findByProcessId(processId);
    if (found.isEmpty()) {
      log.debug("Translation {} not found", processId);
      return Optional.empty();
    }
    TranslationJob job = found.get();
    if (!job.getUserId().equals(userId)) {
      log.warn("User {} requested translation {} owned by another user", userId, processId);
      return Optional.empty();
    }

    List<TranslatedPage> pages =
        pageResultRepository.findByJobProcessIdOrderByPageNumberAsc(processId).stream()
            .map(page -> new TranslatedPage(page.getPageNumber(), page.getContent()))
            .toList();
    return Optional.of(
        new TranslationContent(
            job.getProcessId(),
            orDefault(job.getFileName(), UNTITLED),
            orDefault(job.getSourceLanguage(), UNKNOWN_LANGUAGE),
            orDefault(job.getTargetLanguage(), UNKNOWN_LANGUAGE),
            job.getStatus(),
            job.getTotalPages(),
            completedAt(job),
            pages));
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "history.stats", description = "Time to compute translation stats")
  public TranslationStats stats(String userId) {
    long count = jobRepository.countByUserIdAndStatus(userId, JobStatus.COMPLETED);
    long pages = jobRepository.sumTotalPagesByUserIdAndStatus(userId, JobStatus.COMPLETED);
    Optional<TranslationJob> mostRecent =
        jobRepository.findFirstByUserIdAndStatusOrderByUpdatedAtDesc(
            userId, JobStatus.COMPLETED);
    return new TranslationStats(
        count,
        pages,
        mostRecent.map(TranslationJob::getUpdatedAt).orElse(null),
        mostRecent.map(TranslationJob::getFileName).orElse(null));
  }

  private RecentTranslation toRecentTranslation(TranslationJob job) {
    return new RecentTranslation(
        job.getProcessId(),
        orDefault(job.getFileName(), UNTITLED),
        orDefault(job.getSourceLanguage(), UNKNOWN_LANGUAGE),
        orDefault(job.getTargetLanguage(), UNKNOWN_LANGUAGE),
        job.getStatus(),
        job.getTotalPages(),
        completedAt(job),
        job.getCreatedAt());
  }

  private static LocalDateTime completedAt(TranslationJob job) {
    return job.getStatus() == JobStatus.COMPLETED ? job.getUpdatedAt() : null;
  }

  private static String orDefault(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }
}
