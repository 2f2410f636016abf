package com.novelvision.visualization.storage;

import com.novelvision.visualization.jobs.ImageFormat;

/** Where an image ended up and what it turned out to be. */
public record StoredImage(
    String storageKey,
    String url,
    String thumbnailUrl,
    int width,
    int height,
    long sizeBytes,
    ImageFormat format) {}
