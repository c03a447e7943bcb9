package com.flamingo.ai.doctranslator.domain.entity;

import com.flamingo.ai.doctranslator.domain.enums.JobStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** One document-translation request and its progress. */
@Entity
@Table(
    name = "translation_jobs",
    indexes = @Index(name = "ix_translation_jobs_user_status", columnList = "user_id, status"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TranslationJob {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "process_id", nullable = false, unique = true)
  private String processId;

  @Column(name = "user_id", nullable = false)
  private String userId;

  @Column(nullable = false)
  private int totalPages;

  /** Highest page number recorded so far. */
  @Column(nullable = false)
  @Builder.Default
  private int currentPage = 0;

  @Column(nullable = false)
  @Builder.Default
  private int progressPercent = 0;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false)
  @Builder.Default
  private JobStatus status = JobStatus.IN_PROGRESS;

  private String fileName;

  private String sourceLanguage;

  private String targetLanguage;

  private String fileType;

  @Column(length = 4000)
  private String failureReason;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @Column(nullable = false)
  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
    updatedAt = createdAt;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }
}
