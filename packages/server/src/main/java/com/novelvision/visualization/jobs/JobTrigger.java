package com.novelvision.visualization.jobs;

/** Why a job exists. */
public enum JobTrigger {
  /** Reader or author asked for a picture of a whole page. */
  PAGE_REQUEST,
  /** Reader selected a span of text to illustrate. */
  TEXT_SELECTION_REQUEST,
  /** Part of a bulk run over an entire book. */
  AUTO_NOVEL;

  /** Whether the job illustrates the page as a whole rather than a selected span. */
  public boolean isWholePage() {
    return this != TEXT_SELECTION_REQUEST;
  }

  /**
   * Whether two active jobs with these triggers compete for the same page. Whole-page triggers
   * share one slot per page; text selections have their own.
   */
  public boolean sharesSlotWith(JobTrigger other) {
    return other != null && isWholePage() == other.isWholePage();
  }
}
