package com.novelvision.visualization.jobs;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of a visualization job. Capability flags are derived from the state value and
 * never stored alongside it.
 */
public enum JobStatus {
  /** Job accepted and waiting to be claimed by a worker. */
  PENDING(0),
  /** Job claimed by a worker; no external call issued yet. */
  QUEUED(5),
  /** Prompt synthesis in progress. */
  GENERATING_PROMPT(10),
  /** Image provider call in progress. */
  PROCESSING(30),
  /** Generated images are being stored. */
  UPLOADING(80),
  /** Job finished successfully. */
  COMPLETED(100),
  /** Job failed; see the job's error message. */
  FAILED(100),
  /** Job was cancelled before any external work started. */
  CANCELLED(100);

  private final int progressPercent;

  JobStatus(int progressPercent) {
    this.progressPercent = progressPercent;
  }

  /** Nominal progress reported to observers when a job enters this state. */
  public int progressPercent() {
    return progressPercent;
  }

  public boolean canCancel() {
    return this == PENDING || this == QUEUED;
  }

  public boolean canRetry() {
    return this == FAILED || this == CANCELLED;
  }

  public boolean isFinal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }

  public boolean isProcessing() {
    return this == GENERATING_PROMPT || this == PROCESSING || this == UPLOADING;
  }

  /** States reachable from this one in a single step. */
  public Set<JobStatus> successors() {
    switch (this) {
      case PENDING:
        return EnumSet.of(QUEUED, CANCELLED);
      case QUEUED:
        return EnumSet.of(GENERATING_PROMPT, FAILED, CANCELLED);
      case GENERATING_PROMPT:
        return EnumSet.of(PROCESSING, FAILED);
      case PROCESSING:
        return EnumSet.of(UPLOADING, FAILED);
      case UPLOADING:
        return EnumSet.of(COMPLETED, FAILED);
      case FAILED:
      case CANCELLED:
        // retry
        return EnumSet.of(PENDING);
      case COMPLETED:
      default:
        return EnumSet.noneOf(JobStatus.class);
    }
  }

  public boolean canTransitionTo(JobStatus next) {
    return next != null && successors().contains(next);
  }
}
