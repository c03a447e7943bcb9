package com.flamingo.ai.doctranslator.exception;

/** Exception thrown when a translation job is not found. */
public class JobNotFoundException extends RuntimeException {

  private final String processId;

  public JobNotFoundException(String processId) {
    super("Translation job not found: " + processId);
    this.processId = processId;
  }

  public String getProcessId() {
    return processId;
  }
}
