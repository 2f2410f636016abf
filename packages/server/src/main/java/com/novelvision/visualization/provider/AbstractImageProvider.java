package com.novelvision.visualization.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.novelvision.visualization.exception.ExceptionUtil;
import com.novelvision.visualization.exception.PermanentProviderException;
import com.novelvision.visualization.exception.ProviderException;
import com.novelvision.visualization.exception.ProviderUnavailableException;
import com.novelvision.visualization.exception.TransientProviderException;
import com.novelvision.visualization.logging.LoggingService;
import com.novelvision.visualization.utility.JacksonUtility;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.TimeUnit;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.configuration2.Configuration;

/**
 * Base {@link ImageProvider} with the shared plumbing: timeout handling and the mapping of HTTP
 * outcomes onto the provider error taxonomy. The timeout is enforced by the OkHttp client's call
 * timeout (see {@link com.novelvision.visualization.http.OkHttpFactory}).
 *
 * <p>Subclasses implement {@link #runGeneration(ImageRequest)}. Configuration is the provider's
 * own subset ({@code providers.<apiName>}):
 *
 * <ul>
 *   <li>{@code timeout-seconds} (long, defaults to {@code providers.timeout-seconds})
 *   <li>{@code api-url}, {@code api-key}, {@code model} (adapter specific)
 * </ul>
 */
public abstract class AbstractImageProvider implements ImageProvider {
  private static final org.slf4j.Logger log =
      LoggingService.getLogger(AbstractImageProvider.class);

  protected static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  protected final ProviderType type;
  protected final Configuration configuration;
  protected final long timeoutSeconds;

  protected AbstractImageProvider(
      ProviderType type, Configuration configuration, long defaultTimeoutSeconds) {
    this.type = type;
    this.configuration = configuration;
    this.timeoutSeconds = configuration.getLong("timeout-seconds", defaultTimeoutSeconds);
  }

  @Override
  public ProviderType type() {
    return type;
  }

  public long timeoutSeconds() {
    return timeoutSeconds;
  }

  @Override
  public ImageResult generate(ImageRequest request) {
    log.debug(
        "[{}] generate() prompt length {}, size {}",
        type.apiName(),
        request.prompt().length(),
        request.parameters().size());
    long start = System.currentTimeMillis();
    ImageResult result;
    try {
      result = runGeneration(request);
    } catch (ProviderException e) {
      throw e;
    } catch (Exception e) {
      throw mapFailure(e);
    }
    if (result == null || result.images().isEmpty()) {
      throw new PermanentProviderException(type.apiName(), "Provider returned no images");
    }
    Duration elapsed = Duration.ofMillis(System.currentTimeMillis() - start);
    log.info(
        "[{}] generated {} image(s) in {} ms",
        type.apiName(),
        result.images().size(),
        elapsed.toMillis());
    return new ImageResult(type, result.images(), result.revisedPrompt(), elapsed);
  }

  /**
   * Perform the provider call on the caller's thread. HTTP calls are bounded by the client's call
   * timeout, so adapters that loop must bound themselves with {@link #deadline()}.
   */
  protected abstract ImageResult runGeneration(ImageRequest request) throws Exception;

  /** Wall clock millis after which a generation started now has timed out. */
  protected long deadline() {
    return System.currentTimeMillis() + TimeUnit.SECONDS.toMillis(timeoutSeconds);
  }

  protected TransientProviderException timedOut(Throwable cause) {
    return new TransientProviderException(
        type.apiName(), "Generation timed out after " + timeoutSeconds + "s", cause);
  }

  private ProviderException mapFailure(Exception cause) {
    if (cause instanceof InterruptedIOException && !(cause instanceof ConnectException)) {
      return timedOut(cause);
    }
    if (cause instanceof IOException) {
      return new TransientProviderException(
          type.apiName(), ExceptionUtil.extractErrorMessage(cause), cause);
    }
    if (cause instanceof InterruptedException) {
      Thread.currentThread().interrupt();
      return new TransientProviderException(type.apiName(), "Generation interrupted", cause);
    }
    log.error("[{}] unexpected provider failure", type.apiName(), cause);
    return new PermanentProviderException(
        type.apiName(),
        "Unexpected provider failure: " + ExceptionUtil.extractErrorMessage(cause),
        cause);
  }

  /**
   * Execute {@code request} and parse the JSON body. 408, 429 and 5xx map to transient failures,
   * any other non-2xx status to a permanent one.
   */
  protected JsonNode executeJson(OkHttpClient client, Request request) throws IOException {
    try (Response response = client.newCall(request).execute()) {
      ResponseBody body = response.body();
      String text = body == null ? "" : body.string();
      if (!response.isSuccessful()) {
        throw statusFailure(response.code(), text);
      }
      try {
        return JacksonUtility.getJsonMapper().readTree(text);
      } catch (IOException e) {
        throw new PermanentProviderException(type.apiName(), "Malformed provider response", e);
      }
    }
  }

  protected ProviderException statusFailure(int code, String body) {
    String message = "HTTP " + code + describeError(body);
    if (code == 408 || code == 429 || code >= 500) {
      return new TransientProviderException(type.apiName(), message);
    }
    return new PermanentProviderException(type.apiName(), message);
  }

  /** Best effort extraction of {@code error.message} style fields from an error body. */
  private static String describeError(String body) {
    if (body == null || body.isBlank()) return "";
    try {
      JsonNode node = JacksonUtility.getJsonMapper().readTree(body);
      JsonNode error = node.path("error");
      if (error.isObject() && error.hasNonNull("message")) {
        return ": " + error.get("message").asText();
      }
      if (error.isTextual()) {
        return ": " + error.asText();
      }
      if (node.hasNonNull("detail")) {
        return ": " + node.get("detail").asText();
      }
    } catch (IOException e) {
      log.trace("Provider error body is not JSON, using raw text");
    }
    return ": " + (body.length() > 200 ? body.substring(0, 200) : body);
  }

  protected byte[] decodeBase64(String value) {
    try {
      String data = value;
      int comma = data.indexOf(',');
      if (data.startsWith("data:") && comma > 0) {
        data = data.substring(comma + 1);
      }
      return Base64.getDecoder().decode(data);
    } catch (IllegalArgumentException e) {
      throw new PermanentProviderException(type.apiName(), "Invalid base64 image payload", e);
    }
  }

  protected static String requireText(String value, String name, ProviderType type) {
    // An unset ${env:...} placeholder stays unresolved.
    if (value == null || value.isBlank() || value.startsWith("${")) {
      throw new ProviderUnavailableException(
          type.apiName(), "Missing configuration providers." + type.apiName() + "." + name);
    }
    return value;
  }
}
