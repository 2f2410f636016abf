package com.novelvision.visualization.worker;

import com.novelvision.visualization.exception.InvalidStateException;
import com.novelvision.visualization.exception.NotFoundException;
import com.novelvision.visualization.exception.StateException;
import com.novelvision.visualization.exception.VisualizationErrorCode;
import com.novelvision.visualization.jobs.JobClaim;
import com.novelvision.visualization.jobs.JobStatus;
import com.novelvision.visualization.jobs.JobStore;
import com.novelvision.visualization.jobs.VisualizationJob;
import com.novelvision.visualization.logging.LoggingService;
import com.novelvision.visualization.notification.JobProgressEvent;
import com.novelvision.visualization.notification.ProgressNotifier;
import com.novelvision.visualization.pipeline.PipelineExecutor;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/**
 * Fixed set of workers that claim jobs from the {@link JobStore} and run them through the {@link
 * PipelineExecutor}. Idle workers poll with a doubling delay, capped at {@code worker.poll.max-ms}.
 * A separate sweep fails jobs whose worker lease has expired so they can be retried.
 */
public final class WorkerPool {
  private static final org.slf4j.Logger log = LoggingService.getLogger(WorkerPool.class);

  static final Set<JobStatus> LEASED =
      EnumSet.of(
          JobStatus.QUEUED, JobStatus.GENERATING_PROMPT, JobStatus.PROCESSING, JobStatus.UPLOADING);
  static final String LEASE_EXPIRED = "Worker lease expired";

  /** Pool sizing and timing, read from the {@code worker} configuration subset. */
  public record Settings(
      int threads,
      Duration initialPoll,
      Duration maxPoll,
      Duration leaseTimeout,
      Duration recoveryInterval) {

    public static Settings fromConfiguration(Configuration configuration) {
      Configuration worker = configuration.subset("worker");
      return new Settings(
          worker.getInt("threads", 4),
          Duration.ofMillis(worker.getLong("poll.initial-ms", 200L)),
          Duration.ofMillis(worker.getLong("poll.max-ms", 5000L)),
          Duration.ofSeconds(worker.getLong("lease-timeout-seconds", 600L)),
          Duration.ofSeconds(worker.getLong("recovery-interval-seconds", 60L)));
    }
  }

  private final JobStore store;
  private final PipelineExecutor executor;
  private final ProgressNotifier notifier;
  private final Settings settings;
  private final Clock clock;
  private final AtomicBoolean running = new AtomicBoolean(false);
  private ExecutorService workers;
  private ScheduledExecutorService recovery;

  public WorkerPool(
      JobStore store,
      PipelineExecutor executor,
      ProgressNotifier notifier,
      Settings settings,
      Clock clock) {
    if (settings.threads() < 1) {
      throw new IllegalArgumentException("worker.threads must be at least 1");
    }
    this.store = store;
    this.executor = executor;
    this.notifier = notifier;
    this.settings = settings;
    this.clock = clock;
  }

  public Settings settings() {
    return settings;
  }

  public boolean isRunning() {
    return running.get();
  }

  public synchronized void start() {
    if (!running.compareAndSet(false, true)) {
      throw new StateException("Worker pool already started");
    }
    workers =
        Executors.newFixedThreadPool(
            settings.threads(),
            new ThreadFactory() {
              private int next = 1;

              @Override
              public synchronized Thread newThread(Runnable r) {
                return new Thread(r, "visualization-worker-" + next++);
              }
            });
    for (int i = 1; i <= settings.threads(); i++) {
      String workerId = "worker-" + i;
      workers.submit(() -> loop(workerId));
    }
    recovery =
        Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, "visualization-lease-sweep"));
    long interval = Math.max(1, settings.recoveryInterval().toMillis());
    recovery.scheduleWithFixedDelay(this::recoverSafely, interval, interval, TimeUnit.MILLISECONDS);
    log.info("Worker pool started with {} worker(s)", settings.threads());
  }

  /** Stop claiming new jobs and wait up to {@code grace} for in-flight pipelines. */
  public synchronized void stop(Duration grace) {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    recovery.shutdownNow();
    workers.shutdown();
    try {
      if (!workers.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Workers did not finish within {}, interrupting", grace);
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
    log.info("Worker pool stopped");
  }

  /**
   * Claim and run at most one job.
   *
   * @return whether a job was claimed
   */
  public boolean processNext(String workerId) {
    Optional<VisualizationJob> claimed = store.claimNext(workerId, clock.instant());
    if (claimed.isEmpty()) {
      return false;
    }
    VisualizationJob job = claimed.get();
    log.debug("{} picked up job {}", workerId, job.id());
    try {
      VisualizationJob finished = executor.execute(job);
      log.debug("{} finished job {} as {}", workerId, job.id(), finished.status());
    } catch (RuntimeException e) {
      // The executor records failures itself; reaching here is a bug, not a job failure.
      log.error("{} crashed while running job {}", workerId, job.id(), e);
    }
    return true;
  }

  /**
   * Fail every leased job whose claim is older than the lease timeout.
   *
   * @return the number of jobs failed
   */
  public int recoverExpiredLeases() {
    Instant cutoff = clock.instant().minus(settings.leaseTimeout());
    List<VisualizationJob> expired =
        store.find(
            j ->
                LEASED.contains(j.status())
                    && j.claimedAt() != null
                    && j.claimedAt().isBefore(cutoff));
    int recovered = 0;
    for (VisualizationJob job : expired) {
      try {
        VisualizationJob failed =
            store.transition(
                job.id(),
                EnumSet.of(job.status()),
                JobClaim.of(job),
                JobStatus.FAILED,
                b ->
                    b.errorMessage(LEASE_EXPIRED)
                        .errorCode(VisualizationErrorCode.TRANSIENT_ERROR)
                        .completedAt(clock.instant()));
        recovered++;
        log.warn(
            "Job {} held by {} since {}: {}",
            job.id(),
            job.claimedBy(),
            job.claimedAt(),
            LEASE_EXPIRED);
        notifier.publish(JobProgressEvent.of(failed, "Failed: " + LEASE_EXPIRED));
      } catch (InvalidStateException | NotFoundException e) {
        log.debug("Job {} moved on before lease recovery: {}", job.id(), e.getMessage());
      }
    }
    return recovered;
  }

  private void recoverSafely() {
    try {
      recoverExpiredLeases();
    } catch (RuntimeException e) {
      log.error("Lease recovery sweep failed", e);
    }
  }

  private void loop(String workerId) {
    long delay = Math.max(1, settings.initialPoll().toMillis());
    while (running.get() && !Thread.currentThread().isInterrupted()) {
      boolean worked;
      try {
        worked = processNext(workerId);
      } catch (RuntimeException e) {
        log.error("{} failed to claim a job", workerId, e);
        worked = false;
      }
      if (worked) {
        delay = Math.max(1, settings.initialPoll().toMillis());
        continue;
      }
      try {
        Thread.sleep(delay);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }
      delay = Math.min(delay * 2, settings.maxPoll().toMillis());
    }
    log.debug("{} exiting", workerId);
  }
}
