package com.novelvision.visualization.catalog;

/** How a book wants its pages illustrated. */
public enum VisualizationMode {
  NONE,
  PER_PAGE,
  PER_CHAPTER,
  USER_SELECTED,
  AUTHOR_DEFINED;

  /** Lenient parse of catalog values such as {@code PerPage} or {@code per_page}. */
  public static VisualizationMode parse(String value) {
    if (value == null || value.isBlank()) return NONE;
    String normalized = value.replaceAll("[^A-Za-z]", "").toUpperCase();
    for (VisualizationMode mode : values()) {
      if (mode.name().replace("_", "").equals(normalized)) {
        return mode;
      }
    }
    return NONE;
  }
}
