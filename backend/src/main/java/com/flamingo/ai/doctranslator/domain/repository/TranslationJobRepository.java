package com.flamingo.ai.doctranslator.domain.repository;

import com.flamingo.ai.doctranslator.domain.entity.TranslationJob;
import com.flamingo.ai.doctranslator.domain.enums.JobStatus;
import jakarta.persistence.LockModeType;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for TranslationJob entities. */
@Repository
public interface TranslationJobRepository extends JpaRepository<TranslationJob, UUID> {

  Optional<TranslationJob> findByProcessId(String processId);

  boolean existsByProcessId(String processId);

  /** Loads the job and holds a write lock on its row until the transaction ends. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  Optional<TranslationJob> findWithLockByProcessId(String processId);

  List<TranslationJob> findByUserIdAndStatusOrderByUpdatedAtDesc(
      String userId, JobStatus status, Pageable pageable);

  Optional<TranslationJob> findFirstByUserIdAndStatusOrderByUpdatedAtDesc(
      String userId, JobStatus status);

  long countByUserIdAndStatus(String userId, JobStatus status);

  @Query(
      "SELECT COALESCE(SUM(j.totalPages), 0) FROM TranslationJob j "
          + "WHERE j.userId = :userId AND j.status = :status")
  long sumTotalPagesByUserIdAndStatus(
      @Param("userId") String userId, @Param("status") JobStatus status);

  /**
   * Moves the progress marker forward. Rows whose marker is already at or past the page are left
   * alone, so completions arriving out of order never move it backwards.
   *
   * @return number of rows updated, 0 or 1
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "UPDATE TranslationJob j SET j.currentPage = :pageNumber, "
          + "j.progressPercent = :progressPercent, j.updatedAt = :now "
          + "WHERE j.processId = :processId AND j.currentPage < :pageNumber")
  int advanceProgress(
      @Param("processId") String processId,
      @Param("pageNumber") int pageNumber,
      @Param("progressPercent") int progressPercent,
      @Param("now") LocalDateTime now);

  /** Bumps the modification time without touching the progress marker. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("UPDATE TranslationJob j SET j.updatedAt = :now WHERE j.processId = :processId")
  int touch(@Param("processId") String processId, @Param("now") LocalDateTime now);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "UPDATE TranslationJob j SET j.status = :target, j.progressPercent = 100, "
          + "j.updatedAt = :now WHERE j.processId = :processId AND j.status = :expected")
  int transitionToCompleted(
      @Param("processId") String processId,
      @Param("expected") JobStatus expected,
      @Param("target") JobStatus target,
      @Param("now") LocalDateTime now);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "UPDATE TranslationJob j SET j.status = :target, j.failureReason = :failureReason, "
          + "j.updatedAt = :now WHERE j.processId = :processId AND j.status = :expected")
  int transitionToFailed(
      @Param("processId") String processId,
      @Param("expected") JobStatus expected,
      @Param("target") JobStatus target,
      @Param("failureReason") String failureReason,
      @Param("now") LocalDateTime now);
}
