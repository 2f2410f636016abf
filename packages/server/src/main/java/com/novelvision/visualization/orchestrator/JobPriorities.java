package com.novelvision.visualization.orchestrator;

import com.novelvision.visualization.jobs.JobTrigger;
import org.apache.commons.configuration2.Configuration;

/** Claim priority per trigger, from {@code jobs.priority.*}. */
public record JobPriorities(int pageRequest, int textSelection, int autoNovel) {

  public static JobPriorities defaults() {
    return new JobPriorities(10, 15, 5);
  }

  public static JobPriorities fromConfiguration(Configuration configuration) {
    Configuration p = configuration.subset("jobs.priority");
    return new JobPriorities(
        p.getInt("page-request", 10), p.getInt("text-selection", 15), p.getInt("auto-novel", 5));
  }

  public int forTrigger(JobTrigger trigger) {
    switch (trigger) {
      case TEXT_SELECTION_REQUEST:
        return textSelection;
      case AUTO_NOVEL:
        return autoNovel;
      case PAGE_REQUEST:
      default:
        return pageRequest;
    }
  }
}
