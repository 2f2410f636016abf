package com.novelvision.visualization.jobs;

import com.novelvision.visualization.provider.ProviderType;
import java.time.Instant;

/**
 * One stored provider output, owned by its job. {@code storageKey} locates the stored file so the
 * image can be removed together with the job.
 */
public record GeneratedImage(
    String id,
    String url,
    String thumbnailUrl,
    String storageKey,
    int width,
    int height,
    long fileSizeBytes,
    ImageFormat format,
    ProviderType provider,
    Instant generatedAt,
    boolean selected,
    boolean deleted) {

  public String mimeType() {
    return format == null ? null : format.mimeType();
  }

  public GeneratedImage withSelected(boolean value) {
    return new GeneratedImage(
        id, url, thumbnailUrl, storageKey, width, height, fileSizeBytes, format, provider,
        generatedAt, value, deleted);
  }

  public GeneratedImage asDeleted() {
    return new GeneratedImage(
        id, url, thumbnailUrl, storageKey, width, height, fileSizeBytes, format, provider,
        generatedAt, false, true);
  }
}
