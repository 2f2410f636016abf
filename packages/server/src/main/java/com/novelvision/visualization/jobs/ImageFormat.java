package com.novelvision.visualization.jobs;

import java.util.Locale;

/** Image encodings providers return. */
public enum ImageFormat {
  PNG("image/png", "png"),
  JPEG("image/jpeg", "jpg"),
  WEBP("image/webp", "webp");

  private final String mimeType;
  private final String extension;

  ImageFormat(String mimeType, String extension) {
    this.mimeType = mimeType;
    this.extension = extension;
  }

  public String mimeType() {
    return mimeType;
  }

  public String extension() {
    return extension;
  }

  /** Resolve a format from a mime type or file extension, defaulting to PNG. */
  public static ImageFormat from(String value) {
    if (value == null) return PNG;
    String v = value.toLowerCase(Locale.ROOT).trim();
    for (ImageFormat f : values()) {
      if (f.mimeType.equals(v) || f.extension.equals(v) || f.name().equalsIgnoreCase(v)) {
        return f;
      }
    }
    if (v.equals("jpeg") || v.equals("image/jpg")) return JPEG;
    return PNG;
  }

  /** Sniff the format from magic bytes, or {@code null} when unrecognized. */
  public static ImageFormat detect(byte[] bytes) {
    if (bytes == null || bytes.length < 12) return null;
    if ((bytes[0] & 0xFF) == 0x89 && bytes[1] == 'P' && bytes[2] == 'N' && bytes[3] == 'G') {
      return PNG;
    }
    if ((bytes[0] & 0xFF) == 0xFF && (bytes[1] & 0xFF) == 0xD8) {
      return JPEG;
    }
    if (bytes[0] == 'R' && bytes[1] == 'I' && bytes[2] == 'F' && bytes[3] == 'F'
        && bytes[8] == 'W' && bytes[9] == 'E' && bytes[10] == 'B' && bytes[11] == 'P') {
      return WEBP;
    }
    return null;
  }
}
