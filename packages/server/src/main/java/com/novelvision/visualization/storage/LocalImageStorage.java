package com.novelvision.visualization.storage;

import com.novelvision.visualization.exception.ExceptionUtil;
import com.novelvision.visualization.exception.VisualizationErrorCode;
import com.novelvision.visualization.exception.VisualizationException;
import com.novelvision.visualization.http.OkHttpFactory;
import com.novelvision.visualization.jobs.ImageFormat;
import com.novelvision.visualization.logging.LoggingService;
import com.novelvision.visualization.provider.ImageData;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;
import javax.imageio.ImageIO;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.configuration2.Configuration;

/**
 * Stores images on the local filesystem:
 *
 * <pre>
 * {base-path}/books/{bookId}/images/{jobId}_{suffix}.{ext}
 * {base-path}/books/{bookId}/thumbnails/{jobId}_{suffix}.png
 * </pre>
 *
 * URLs are {@code {base-url}/{storage key}}. Formats ImageIO cannot decode keep the full image as
 * their thumbnail.
 */
public class LocalImageStorage implements ImageStorage {
  private static final org.slf4j.Logger log = LoggingService.getLogger(LocalImageStorage.class);

  private final Path basePath;
  private final String baseUrl;
  private final int thumbnailMaxSize;
  private final OkHttpClient downloader;

  /** @param configuration the {@code storage} subset */
  public LocalImageStorage(Configuration configuration) {
    this.basePath =
        Paths.get(configuration.getString("base-path", "uploads")).toAbsolutePath().normalize();
    String url = configuration.getString("base-url", "/uploads");
    this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    this.thumbnailMaxSize = configuration.getInt("thumbnail.max-size", 256);
    this.downloader =
        OkHttpFactory.create(
            null, "image-download", configuration.getLong("download-timeout-seconds", 60L));
  }

  public Path basePath() {
    return basePath;
  }

  @Override
  public StoredImage store(String bookId, String jobId, ImageData image) {
    byte[] bytes = image.isInline() ? image.bytes() : download(image.url());
    ImageFormat detected = ImageFormat.detect(bytes);
    ImageFormat format = detected != null ? detected : image.format();
    if (format == null) {
      format = ImageFormat.PNG;
    }

    String fileName = jobId + "_" + UUID.randomUUID().toString().substring(0, 8);
    String imageKey = "books/" + bookId + "/images/" + fileName + "." + format.extension();
    String thumbKey = "books/" + bookId + "/thumbnails/" + fileName + ".png";

    try {
      Path target = resolve(imageKey);
      Files.createDirectories(target.getParent());
      Files.write(target, bytes);

      BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(bytes));
      int width = decoded != null ? decoded.getWidth() : image.width();
      int height = decoded != null ? decoded.getHeight() : image.height();
      String thumbnailUrl = urlOf(imageKey);
      if (decoded != null) {
        writeThumbnail(decoded, resolve(thumbKey));
        thumbnailUrl = urlOf(thumbKey);
      }
      log.info("Stored image {} ({} bytes, {}x{})", imageKey, bytes.length, width, height);
      return new StoredImage(
          imageKey, urlOf(imageKey), thumbnailUrl, width, height, bytes.length, format);
    } catch (IOException e) {
      throw new VisualizationException(
              VisualizationErrorCode.TRANSIENT_ERROR,
              "Could not store image: " + ExceptionUtil.extractErrorMessage(e),
              e)
          .withContext("storageKey", imageKey);
    }
  }

  @Override
  public void delete(String storageKey) {
    if (storageKey == null || storageKey.isBlank()) return;
    String thumbKey =
        storageKey.replace("/images/", "/thumbnails/").replaceFirst("\\.[A-Za-z0-9]+$", ".png");
    try {
      Files.deleteIfExists(resolve(storageKey));
      Files.deleteIfExists(resolve(thumbKey));
      log.info("Deleted stored image {}", storageKey);
    } catch (IOException e) {
      log.warn("Could not delete stored image {}: {}", storageKey, e.getMessage());
    }
  }

  private byte[] download(String url) {
    Request request = new Request.Builder().url(url).get().build();
    try (Response response = downloader.newCall(request).execute()) {
      ResponseBody body = response.body();
      if (!response.isSuccessful() || body == null) {
        throw new VisualizationException(
            VisualizationErrorCode.TRANSIENT_ERROR,
            "Image download failed: HTTP " + response.code());
      }
      return body.bytes();
    } catch (IOException e) {
      throw new VisualizationException(
          VisualizationErrorCode.TRANSIENT_ERROR,
          "Image download failed: " + ExceptionUtil.extractErrorMessage(e),
          e);
    }
  }

  private void writeThumbnail(BufferedImage source, Path target) throws IOException {
    double scale =
        Math.min(1.0, (double) thumbnailMaxSize / Math.max(source.getWidth(), source.getHeight()));
    int w = Math.max(1, (int) Math.round(source.getWidth() * scale));
    int h = Math.max(1, (int) Math.round(source.getHeight() * scale));
    BufferedImage thumb = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
    Graphics2D g = thumb.createGraphics();
    try {
      g.setRenderingHint(
          RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
      g.drawImage(source, 0, 0, w, h, null);
    } finally {
      g.dispose();
    }
    Files.createDirectories(target.getParent());
    try (OutputStream out = Files.newOutputStream(target)) {
      ImageIO.write(thumb, "png", out);
    }
  }

  /** Resolve a storage key inside the base directory, refusing keys that escape it. */
  private Path resolve(String storageKey) {
    Path path = basePath.resolve(storageKey).normalize();
    if (!path.startsWith(basePath)) {
      throw new VisualizationException(
          VisualizationErrorCode.VALIDATION_ERROR, "Storage key escapes base path: " + storageKey);
    }
    return path;
  }

  private String urlOf(String storageKey) {
    return baseUrl + "/" + storageKey;
  }
}
