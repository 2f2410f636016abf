package com.novelvision.visualization.notification;

import com.novelvision.visualization.logging.LoggingService;
import java.util.List;

/** Publishes to several channels; one failing channel does not affect the others. */
public class CompositeProgressNotifier implements ProgressNotifier {
  private static final org.slf4j.Logger log =
      LoggingService.getLogger(CompositeProgressNotifier.class);

  private final List<ProgressNotifier> delegates;

  public CompositeProgressNotifier(List<ProgressNotifier> delegates) {
    this.delegates = List.copyOf(delegates);
  }

  @Override
  public void publish(JobProgressEvent event) {
    for (ProgressNotifier delegate : delegates) {
      try {
        delegate.publish(event);
      } catch (RuntimeException e) {
        log.warn(
            "Notifier {} failed for job {}: {}",
            delegate.getClass().getSimpleName(),
            event.jobId(),
            e.toString());
      }
    }
  }
}
