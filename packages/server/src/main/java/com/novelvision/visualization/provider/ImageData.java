package com.novelvision.visualization.provider;

import com.novelvision.visualization.jobs.ImageFormat;

/**
 * One image returned by a provider, either inline ({@code bytes}) or as a downloadable {@code
 * url}. Exactly one of the two is set.
 */
public record ImageData(byte[] bytes, String url, int width, int height, ImageFormat format) {

  public static ImageData inline(byte[] bytes, int width, int height, ImageFormat format) {
    return new ImageData(bytes, null, width, height, format);
  }

  public static ImageData remote(String url, int width, int height, ImageFormat format) {
    return new ImageData(null, url, width, height, format);
  }

  public boolean isInline() {
    return bytes != null;
  }
}
