package com.flamingo.ai.doctranslator.domain.enums;

/** Lifecycle status of a translation job. */
public enum JobStatus {
  /** Pages are being extracted and translated. */
  IN_PROGRESS,

  /** Every page was translated and the job was closed. */
  COMPLETED,

  /** The job stopped on an error; recorded pages are kept for resume. */
  FAILED;

  public boolean isTerminal() {
    return this != IN_PROGRESS;
  }
}
