package com.flamingo.ai.doctranslator.domain.repository;

import com.flamingo.ai.doctranslator.domain.entity.TranslationPageResult;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for TranslationPageResult entities. */
@Repository
public interface TranslationPageResultRepository
    extends JpaRepository<TranslationPageResult, UUID> {

  List<TranslationPageResult> findByJobProcessIdOrderByPageNumberAsc(String processId);

  Optional<TranslationPageResult> findByJobProcessIdAndPageNumber(
      String processId, int pageNumber);

  @Query(
      "SELECT p.pageNumber FROM TranslationPageResult p "
          + "WHERE p.job.processId = :processId ORDER BY p.pageNumber")
  List<Integer> findPageNumbersByProcessId(@Param("processId") String processId);

  long countByJobProcessId(String processId);
}
