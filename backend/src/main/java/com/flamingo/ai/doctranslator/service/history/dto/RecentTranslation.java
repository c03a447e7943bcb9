package com.flamingo.ai.doctranslator.service.history.dto;

import com.flamingo.ai.doctranslator.domain.enums.JobStatus;
import java.time.LocalDateTime;

/** Summary of a finished translation for history listings. */
public record RecentTranslation(
    String processId,
    String fileName,
    String sourceLanguage,
    String targetLanguage,
    JobStatus status,
    int totalPages,
    LocalDateTime completedAt,
    LocalDateTime createdAt) {}
