package com.flamingo.ai.doctranslator.service.history.dto;

import java.time.LocalDateTime;

/** Totals over a user's completed translations. The most recent fields are null without any. */
public record TranslationStats(
    long totalTranslations,
    long totalPages,
    LocalDateTime mostRecentDate,
    String mostRecentFileName) {}
