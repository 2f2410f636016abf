package com.novelvision.visualization.jobs;

import com.novelvision.visualization.exception.AlreadyInProgressException;
import com.novelvision.visualization.exception.InvalidStateException;
import com.novelvision.visualization.exception.NotFoundException;
import com.novelvision.visualization.logging.LoggingService;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;

/**
 * In-memory JobStore. Each job slot is replaced with {@link ConcurrentHashMap#compute}, which gives
 * per-job compare-and-set semantics; reads are lock free. Operations that can make a job active
 * (insert and retry) also serialize on one lock so the duplicate-target check cannot race.
 */
public final class InMemoryJobStore implements JobStore {
  private static final Logger log = LoggingService.getLogger(InMemoryJobStore.class);

  /** Claim order: higher priority first, then older, then id for a stable tie-break. */
  public static final Comparator<VisualizationJob> CLAIM_ORDER =
      Comparator.comparingInt(VisualizationJob::priority)
          .reversed()
          .thenComparing(VisualizationJob::createdAt)
          .thenComparing(VisualizationJob::id);

  private final Map<String, VisualizationJob> jobs = new ConcurrentHashMap<>();
  private final ReentrantLock activationLock = new ReentrantLock();

  @Override
  public VisualizationJob insert(VisualizationJob job) {
    activationLock.lock();
    try {
      VisualizationJob stored = job.toBuilder().version(1).build();
      rejectConflicts(stored);
      if (jobs.putIfAbsent(stored.id(), stored) != null) {
        throw new InvalidStateException("Job " + stored.id() + " already exists");
      }
      log.debug("Stored job {}", stored);
      return stored;
    } finally {
      activationLock.unlock();
    }
  }

  @Override
  public Optional<VisualizationJob> get(String id) {
    return Optional.ofNullable(id == null ? null : jobs.get(id));
  }

  @Override
  public Optional<VisualizationJob> claimNext(String workerId, Instant now) {
    List<VisualizationJob> candidates = find(j -> isClaimable(j, now));
    for (VisualizationJob candidate : candidates) {
      VisualizationJob[] claimed = new VisualizationJob[1];
      jobs.computeIfPresent(
          candidate.id(),
          (id, current) -> {
            if (!isClaimable(current, now)) {
              return current;
            }
            claimed[0] =
                current.toBuilder()
                    .status(JobStatus.QUEUED)
                    .claimedBy(workerId)
                    .claimedAt(now)
                    .version(current.version() + 1)
                    .build();
            return claimed[0];
          });
      if (claimed[0] != null) {
        log.debug("Worker {} claimed job {}", workerId, claimed[0].id());
        return Optional.of(claimed[0]);
      }
      // Lost the race for this candidate, try the next one.
    }
    return Optional.empty();
  }

  @Override
  public VisualizationJob transition(
      String id,
      Set<JobStatus> expected,
      JobClaim claim,
      JobStatus next,
      UnaryOperator<VisualizationJob.Builder> mutator) {
    boolean activates = next == JobStatus.PENDING;
    if (activates) {
      activationLock.lock();
    }
    try {
      VisualizationJob[] result = new VisualizationJob[1];
      VisualizationJob updated =
          jobs.computeIfPresent(
              id,
              (key, current) -> {
                if (!expected.contains(current.status())) {
                  throw new InvalidStateException(
                          "Job " + id + " is " + current.status() + ", expected one of " + expected)
                      .withContext("jobId", id)
                      .withContext("status", current.status());
                }
                if (claim != null && !claim.holds(current)) {
                  throw new InvalidStateException(
                          "Job " + id + " is now held by " + current.claimedBy())
                      .withContext("jobId", id)
                      .withContext("claimedBy", current.claimedBy());
                }
                if (!current.status().canTransitionTo(next)) {
                  throw new InvalidStateException(
                          "Illegal transition " + current.status() + " -> " + next)
                      .withContext("jobId", id);
                }
                VisualizationJob.Builder builder = current.toBuilder();
                if (mutator != null) {
                  builder = mutator.apply(builder);
                }
                VisualizationJob candidate =
                    builder.status(next).version(current.version() + 1).build();
                if (activates) {
                  rejectConflicts(candidate);
                }
                result[0] = candidate;
                return candidate;
              });
      if (updated == null) {
        throw new NotFoundException("Job " + id + " not found").withContext("jobId", id);
      }
      log.debug("Job {} -> {}", id, next);
      return result[0];
    } finally {
      if (activates) {
        activationLock.unlock();
      }
    }
  }

  @Override
  public VisualizationJob update(
      String id, Set<JobStatus> expected, UnaryOperator<VisualizationJob.Builder> mutator) {
    VisualizationJob updated =
        jobs.computeIfPresent(
            id,
            (key, current) -> {
              if (!expected.contains(current.status())) {
                throw new InvalidStateException(
                        "Job " + id + " is " + current.status() + ", expected one of " + expected)
                    .withContext("jobId", id);
              }
              VisualizationJob candidate = mutator.apply(current.toBuilder()).build();
              if (candidate.status() != current.status()) {
                throw new InvalidStateException("Status changes must go through transition()");
              }
              return candidate.toBuilder().version(current.version() + 1).build();
            });
    if (updated == null) {
      throw new NotFoundException("Job " + id + " not found").withContext("jobId", id);
    }
    return updated;
  }

  @Override
  public List<VisualizationJob> find(Predicate<VisualizationJob> filter) {
    return jobs.values().stream().filter(filter).sorted(CLAIM_ORDER).toList();
  }

  @Override
  public Optional<VisualizationJob> delete(String id, Set<JobStatus> expected) {
    VisualizationJob[] removed = new VisualizationJob[1];
    jobs.computeIfPresent(
        id,
        (key, current) -> {
          if (!expected.contains(current.status())) {
            throw new InvalidStateException(
                    "Job " + id + " is " + current.status() + ", expected one of " + expected)
                .withContext("jobId", id)
                .withContext("status", current.status());
          }
          removed[0] = current;
          return null;
        });
    return Optional.ofNullable(removed[0]);
  }

  private void rejectConflicts(VisualizationJob candidate) {
    for (VisualizationJob existing : jobs.values()) {
      if (candidate.conflictsWith(existing)) {
        throw new AlreadyInProgressException(
                "Job "
                    + existing.id()
                    + " is already "
                    + existing.status()
                    + " for page "
                    + candidate.pageId())
            .withContext("existingJobId", existing.id())
            .withContext("pageId", candidate.pageId());
      }
    }
  }

  private static boolean isClaimable(VisualizationJob job, Instant now) {
    return job.status() == JobStatus.PENDING
        && job.claimedBy() == null
        && (job.availableAt() == null || !job.availableAt().isAfter(now));
  }
}
