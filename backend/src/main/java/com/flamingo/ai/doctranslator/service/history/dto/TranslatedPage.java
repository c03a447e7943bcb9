package com.flamingo.ai.doctranslator.service.history.dto;

/** Translated markup of one page, 1-based. */
public record TranslatedPage(int pageNumber, String content) {}
