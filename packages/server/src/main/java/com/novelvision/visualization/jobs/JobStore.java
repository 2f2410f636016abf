package com.novelvision.visualization.jobs;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Storage for visualization jobs and their images. Implementations guarantee that every mutating
 * operation is atomic with respect to the job it touches, and that {@link #claimNext} hands a
 * given job to at most one worker.
 */
public interface JobStore {

  /**
   * Store a new job. The check for a conflicting active job on the same target and the insert
   * happen atomically.
   *
   * @throws com.novelvision.visualization.exception.AlreadyInProgressException if an active job
   *     already occupies the target
   */
  VisualizationJob insert(VisualizationJob job);

  Optional<VisualizationJob> get(String id);

  /**
   * Atomically take the highest-priority, oldest claimable job: {@code PENDING} and available at
   * {@code now}. The job moves to {@code QUEUED} and records {@code workerId} as its claimant.
   *
   * @return the claimed job, or empty when nothing is eligible
   */
  Optional<VisualizationJob> claimNext(String workerId, Instant now);

  /**
   * Compare-and-set on the status field: moves the job from one of {@code expected} to {@code
   * next} and applies {@code mutator} to the remaining fields in the same step.
   *
   * @throws com.novelvision.visualization.exception.NotFoundException if the job does not exist
   * @throws com.novelvision.visualization.exception.InvalidStateException if the job is not in one
   *     of the expected states or the edge is not part of the state machine
   * @throws com.novelvision.visualization.exception.AlreadyInProgressException if the job is
   *     reactivated while another active job occupies its target
   */
  default VisualizationJob transition(
      String id,
      Set<JobStatus> expected,
      JobStatus next,
      UnaryOperator<VisualizationJob.Builder> mutator) {
    return transition(id, expected, null, next, mutator);
  }

  default VisualizationJob transition(
      String id,
      JobStatus expected,
      JobStatus next,
      UnaryOperator<VisualizationJob.Builder> mutator) {
    return transition(id, EnumSet.of(expected), null, next, mutator);
  }

  /**
   * Like {@link #transition(String, Set, JobStatus, UnaryOperator)}, but only while {@code claim}
   * still holds the job. Workers pass the claim they were handed so a job that was released and
   * claimed again is never driven by two of them.
   *
   * @param claim required holder of the job, or {@code null} for no claim check
   * @throws com.novelvision.visualization.exception.InvalidStateException also when the job is no
   *     longer held by {@code claim}
   */
  VisualizationJob transition(
      String id,
      Set<JobStatus> expected,
      JobClaim claim,
      JobStatus next,
      UnaryOperator<VisualizationJob.Builder> mutator);

  /**
   * Update non-status fields (image selection, soft deletes) of a job in {@code expected} state.
   *
   * @throws com.novelvision.visualization.exception.NotFoundException if the job does not exist
   * @throws com.novelvision.visualization.exception.InvalidStateException if the job is not in the
   *     expected state or the mutator tried to change the status
   */
  VisualizationJob update(
      String id, Set<JobStatus> expected, UnaryOperator<VisualizationJob.Builder> mutator);

  /** Snapshot of all jobs matching {@code filter}, in claim order. */
  List<VisualizationJob> find(Predicate<VisualizationJob> filter);

  /**
   * Remove a job and its image records, provided it is in one of the {@code expected} states at
   * the moment of removal.
   *
   * @return the removed job, or empty if it did not exist
   * @throws com.novelvision.visualization.exception.InvalidStateException if the job is in another
   *     state
   */
  Optional<VisualizationJob> delete(String id, Set<JobStatus> expected);
}
