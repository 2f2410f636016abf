package com.novelvision.visualization.jobs;

import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/**
 * Retry limits shared by user retries and automatic retries. Automatic requeue of transient
 * failures is opt-in; by default a failed job stays {@code FAILED} until its owner retries it.
 *
 * @param maxRetries ceiling for {@link VisualizationJob#retryCount()}
 * @param autoRetryEnabled whether transient pipeline failures are requeued automatically
 * @param backoff delay before an automatically requeued job becomes claimable
 */
public record RetryPolicy(int maxRetries, boolean autoRetryEnabled, Duration backoff) {
  public static final int DEFAULT_MAX_RETRIES = 3;

  public static RetryPolicy defaults() {
    return new RetryPolicy(DEFAULT_MAX_RETRIES, false, Duration.ofSeconds(30));
  }

  /** Reads {@code jobs.max-retries}, {@code jobs.auto-retry.enabled} and its backoff. */
  public static RetryPolicy fromConfiguration(Configuration configuration) {
    return new RetryPolicy(
        configuration.getInt("jobs.max-retries", DEFAULT_MAX_RETRIES),
        configuration.getBoolean("jobs.auto-retry.enabled", false),
        Duration.ofSeconds(configuration.getLong("jobs.auto-retry.backoff-seconds", 30L)));
  }

  public boolean hasRetriesLeft(VisualizationJob job) {
    return job.retryCount() < maxRetries;
  }
}
