package com.novelvision.visualization.jobs;

import static org.junit.jupiter.api.Assertions.*;

import java.util.EnumSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JobStatusTest {

  @Test
  @DisplayName("Happy path walks Pending through Completed")
  void happyPathIsAllowed() {
    assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.QUEUED));
    assertTrue(JobStatus.QUEUED.canTransitionTo(JobStatus.GENERATING_PROMPT));
    assertTrue(JobStatus.GENERATING_PROMPT.canTransitionTo(JobStatus.PROCESSING));
    assertTrue(JobStatus.PROCESSING.canTransitionTo(JobStatus.UPLOADING));
    assertTrue(JobStatus.UPLOADING.canTransitionTo(JobStatus.COMPLETED));
  }

  @Test
  @DisplayName("Completed is terminal")
  void completedHasNoSuccessor() {
    for (JobStatus next : JobStatus.values()) {
      assertFalse(JobStatus.COMPLETED.canTransitionTo(next), "COMPLETED -> " + next);
    }
  }

  @Test
  @DisplayName("Only Pending and Queued can be cancelled")
  void cancellationWindow() {
    EnumSet<JobStatus> cancellable = EnumSet.noneOf(JobStatus.class);
    for (JobStatus status : JobStatus.values()) {
      if (status.canCancel()) cancellable.add(status);
      assertEquals(status.canCancel(), status.canTransitionTo(JobStatus.CANCELLED), status.name());
    }
    assertEquals(EnumSet.of(JobStatus.PENDING, JobStatus.QUEUED), cancellable);
  }

  @Test
  @DisplayName("Failed and Cancelled are retryable back to Pending")
  void retryEdges() {
    assertTrue(JobStatus.FAILED.canRetry());
    assertTrue(JobStatus.CANCELLED.canRetry());
    assertFalse(JobStatus.COMPLETED.canRetry());
    assertTrue(JobStatus.FAILED.canTransitionTo(JobStatus.PENDING));
    assertTrue(JobStatus.CANCELLED.canTransitionTo(JobStatus.PENDING));
  }

  @Test
  void pendingCannotSkipToWork() {
    assertFalse(JobStatus.PENDING.canTransitionTo(JobStatus.GENERATING_PROMPT));
    assertFalse(JobStatus.PENDING.canTransitionTo(JobStatus.FAILED));
    assertFalse(JobStatus.GENERATING_PROMPT.canTransitionTo(JobStatus.CANCELLED));
    assertFalse(JobStatus.QUEUED.canTransitionTo(null));
  }

  @Test
  void progressAndFlags() {
    assertEquals(0, JobStatus.PENDING.progressPercent());
    assertEquals(5, JobStatus.QUEUED.progressPercent());
    assertEquals(10, JobStatus.GENERATING_PROMPT.progressPercent());
    assertEquals(30, JobStatus.PROCESSING.progressPercent());
    assertEquals(80, JobStatus.UPLOADING.progressPercent());
    assertEquals(100, JobStatus.FAILED.progressPercent());
    assertTrue(JobStatus.UPLOADING.isProcessing());
    assertFalse(JobStatus.QUEUED.isProcessing());
    assertTrue(JobStatus.CANCELLED.isFinal());
    assertFalse(JobStatus.UPLOADING.isFinal());
  }
}
