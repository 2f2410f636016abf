package com.novelvision.visualization.notification;

import com.novelvision.visualization.logging.LoggingService;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process fan-out of progress events. Subscribers run on the publishing thread, so they should
 * hand off anything slow; a throwing subscriber is logged and skipped.
 */
public class ProgressBroadcaster implements ProgressNotifier {
  private static final org.slf4j.Logger log = LoggingService.getLogger(ProgressBroadcaster.class);

  private final List<Consumer<JobProgressEvent>> subscribers = new CopyOnWriteArrayList<>();

  /** Handle returned by {@link #subscribe}; closing it unsubscribes. */
  public interface Subscription extends AutoCloseable {
    @Override
    void close();
  }

  public Subscription subscribe(Consumer<JobProgressEvent> subscriber) {
    subscribers.add(subscriber);
    return () -> subscribers.remove(subscriber);
  }

  public int subscriberCount() {
    return subscribers.size();
  }

  @Override
  public void publish(JobProgressEvent event) {
    for (Consumer<JobProgressEvent> subscriber : subscribers) {
      try {
        subscriber.accept(event);
      } catch (RuntimeException e) {
        log.warn("Progress subscriber failed for job {}: {}", event.jobId(), e.toString());
      }
    }
  }
}
