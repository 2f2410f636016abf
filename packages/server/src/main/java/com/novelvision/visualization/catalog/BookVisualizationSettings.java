package com.novelvision.visualization.catalog;

import java.util.Set;

/**
 * Visualization settings of a book. A book is eligible for new jobs only when it is published and
 * visualization is enabled.
 */
public record BookVisualizationSettings(
    String bookId,
    boolean enabled,
    boolean published,
    VisualizationMode primaryMode,
    Set<VisualizationMode> allowedModes,
    String preferredProvider,
    String preferredStyle) {

  public BookVisualizationSettings {
    primaryMode = primaryMode == null ? VisualizationMode.NONE : primaryMode;
    allowedModes = allowedModes == null ? Set.of() : Set.copyOf(allowedModes);
  }

  public boolean isEligible() {
    return enabled && published;
  }

  /** Whether bulk generation should cover every page rather than only visualization points. */
  public boolean coversEveryPage() {
    return primaryMode == VisualizationMode.PER_PAGE;
  }
}
