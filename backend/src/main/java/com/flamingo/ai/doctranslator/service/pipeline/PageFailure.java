package com.flamingo.ai.doctranslator.service.pipeline;

import com.flamingo.ai.doctranslator.exception.ErrorCode;

/** Why a page could not be translated. */
public record PageFailure(int pageNumber, ErrorCode errorCode, String message) {

  /** Text stored as the job's failure reason. */
  public String describe() {
    return errorCode + ": " + message;
  }
}
