package com.novelvision.visualization.jobs;

import java.time.Instant;

/** Read-only projection of a job for status queries. */
public record JobStatusView(
    String jobId,
    String bookId,
    String pageId,
    JobTrigger trigger,
    JobStatus status,
    int progressPercent,
    String errorMessage,
    int retryCount,
    Instant createdAt,
    Instant processingStartedAt,
    Instant completedAt,
    int imageCount,
    GeneratedImage selectedImage,
    boolean canCancel,
    boolean canRetry,
    boolean hasImages,
    boolean isFinal) {

  public static JobStatusView from(VisualizationJob job) {
    return new JobStatusView(
        job.id(),
        job.bookId(),
        job.pageId(),
        job.trigger(),
        job.status(),
        job.status().progressPercent(),
        job.errorMessage(),
        job.retryCount(),
        job.createdAt(),
        job.processingStartedAt(),
        job.completedAt(),
        job.activeImages().size(),
        job.selectedImage().orElse(null),
        job.canCancel(),
        job.canRetry(),
        job.hasImages(),
        job.isFinal());
  }
}
