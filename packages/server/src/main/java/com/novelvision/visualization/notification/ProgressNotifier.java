package com.novelvision.visualization.notification;

/**
 * Fire-and-forget outbound channel for job progress. Implementations must return promptly and never
 * throw: delivery problems are theirs to log.
 */
public interface ProgressNotifier {
  void publish(JobProgressEvent event);
}
