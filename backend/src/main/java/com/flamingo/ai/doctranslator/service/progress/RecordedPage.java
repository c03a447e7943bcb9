package com.flamingo.ai.doctranslator.service.progress;

/** Stored translation of one page. */
public record RecordedPage(int pageNumber, String content) {}
