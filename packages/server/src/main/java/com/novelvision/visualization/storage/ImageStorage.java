package com.novelvision.visualization.storage;

import com.novelvision.visualization.provider.ImageData;

/** Durable storage for generated images. */
public interface ImageStorage {

  /**
   * Persist one provider image for a job, downloading it first when the provider returned a URL.
   *
   * @throws com.novelvision.visualization.exception.VisualizationException with code {@code
   *     TRANSIENT_ERROR} when the image cannot be fetched or written
   */
  StoredImage store(String bookId, String jobId, ImageData image);

  /** Remove a stored image and its thumbnail. Unknown keys are ignored. */
  void delete(String storageKey);
}
