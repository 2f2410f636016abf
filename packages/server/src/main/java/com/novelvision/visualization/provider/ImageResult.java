package com.novelvision.visualization.provider;

import java.time.Duration;
import java.util.List;

/** Normalized provider response. */
public record ImageResult(
    ProviderType provider, List<ImageData> images, String revisedPrompt, Duration elapsed) {

  public ImageResult {
    images = images == null ? List.of() : List.copyOf(images);
  }
}
