package com.novelvision.visualization.notification;

import com.novelvision.visualization.logging.LoggingService;

/** Writes every progress event to the log. */
public class LoggingProgressNotifier implements ProgressNotifier {
  private static final org.slf4j.Logger log =
      LoggingService.getLogger(LoggingProgressNotifier.class);

  @Override
  public void publish(JobProgressEvent event) {
    log.info(
        "Job {} [{}] {}% {}",
        event.jobId(),
        event.status(),
        event.progressPercent(),
        event.message() == null ? "" : event.message());
  }
}
