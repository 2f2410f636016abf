package com.novelvision.visualization.notification;

import com.novelvision.visualization.jobs.JobStatus;
import com.novelvision.visualization.jobs.VisualizationJob;
import java.time.Instant;

/** Progress of one job, published after every state change. */
public record JobProgressEvent(
    String jobId,
    String userId,
    String bookId,
    String pageId,
    JobStatus status,
    int progressPercent,
    String message,
    Instant timestamp) {

  public static JobProgressEvent of(VisualizationJob job, String message) {
    return of(job, job.status().progressPercent(), message);
  }

  public static JobProgressEvent of(VisualizationJob job, int progressPercent, String message) {
    return new JobProgressEvent(
        job.id(),
        job.userId(),
        job.bookId(),
        job.pageId(),
        job.status(),
        progressPercent,
        message,
        Instant.now());
  }
}
