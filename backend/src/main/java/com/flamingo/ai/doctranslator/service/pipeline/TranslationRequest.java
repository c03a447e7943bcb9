package com.flamingo.ai.doctranslator.service.pipeline;

import java.util.Objects;

/** Identity and languages of a document translation run. */
public record TranslationRequest(
    String processId,
    String userId,
    String sourceLanguage,
    String targetLanguage,
    String fileName,
    String fileType) {

  public TranslationRequest {
    Objects.requireNonNull(processId, "processId");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(targetLanguage, "targetLanguage");
  }
}
