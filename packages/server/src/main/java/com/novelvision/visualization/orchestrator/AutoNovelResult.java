package com.novelvision.visualization.orchestrator;

import com.novelvision.visualization.jobs.VisualizationJob;
import java.util.List;

/**
 * Outcome of a bulk run: the jobs created, pages skipped because a job was already in flight, and
 * pages that already carry an image.
 */
public record AutoNovelResult(
    String bookId,
    List<VisualizationJob> createdJobs,
    List<String> skippedInFlightPageIds,
    List<String> alreadyVisualizedPageIds) {

  public AutoNovelResult {
    createdJobs = List.copyOf(createdJobs);
    skippedInFlightPageIds = List.copyOf(skippedInFlightPageIds);
    alreadyVisualizedPageIds = List.copyOf(alreadyVisualizedPageIds);
  }

  public int skippedCount() {
    return skippedInFlightPageIds.size();
  }
}
