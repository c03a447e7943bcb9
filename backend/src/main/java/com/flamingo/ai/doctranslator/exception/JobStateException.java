package com.flamingo.ai.doctranslator.exception;

import com.flamingo.ai.doctranslator.domain.enums.JobStatus;

/** Exception thrown when an operation is not allowed in the job's current status. */
public class JobStateException extends RuntimeException {

  private final String processId;
  private final JobStatus currentStatus;

  public JobStateException(String processId, JobStatus currentStatus, String operation) {
    super(
        String.format(
            "Cannot %s translation job %s in status %s", operation, processId, currentStatus));
    this.processId = processId;
    this.currentStatus = currentStatus;
  }

  public String getProcessId() {
    return processId;
  }

  public JobStatus getCurrentStatus() {
    return currentStatus;
  }
}
