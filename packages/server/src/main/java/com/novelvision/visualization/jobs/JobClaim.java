package com.novelvision.visualization.jobs;

import java.time.Instant;
import java.util.Objects;

/**
 * A worker's hold on a job, taken from the snapshot {@link JobStore#claimNext} returned. Once the
 * job is released (failed by lease recovery, retried) and claimed again, the old claim no longer
 * holds and the store rejects its transitions.
 */
public record JobClaim(String workerId, Instant claimedAt) {

  public static JobClaim of(VisualizationJob job) {
    return new JobClaim(job.claimedBy(), job.claimedAt());
  }

  public boolean holds(VisualizationJob current) {
    return Objects.equals(workerId, current.claimedBy())
        && Objects.equals(claimedAt, current.claimedAt());
  }
}
