package com.novelvision.visualization.http;

import com.novelvision.visualization.logging.LoggingService;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;

public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log = LoggingService.getLogger(LoggingInterceptor.class);

  // Image payloads can be megabytes of base64.
  private static final long MAX_LOGGED_BODY = 2048;

  private final String collaborator;

  public LoggingInterceptor(String collaborator) {
    this.collaborator = collaborator == null ? "http" : collaborator;
  }

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();

    long startTime = System.nanoTime();
    if (log.isDebugEnabled()) {
      log.debug(
          "[{}] Sending {} {}\nBody:\n{}",
          collaborator,
          request.method(),
          request.url(),
          bodyToString(request.body()));
    }

    Response response;
    try {
      response = chain.proceed(request);
    } catch (SocketTimeoutException e) {
      log.warn(
          "[{}] Request timed out: {} {} ({}ms)",
          collaborator,
          request.method(),
          request.url(),
          elapsedMs(startTime));
      throw e;
    } catch (ConnectException e) {
      log.warn(
          "[{}] Connection error: {} {} ({}ms): {}",
          collaborator,
          request.method(),
          request.url(),
          elapsedMs(startTime),
          e.getMessage());
      throw e;
    } catch (IOException e) {
      log.warn(
          "[{}] IO error: {} {} ({}ms): {}",
          collaborator,
          request.method(),
          request.url(),
          elapsedMs(startTime),
          e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
      throw e;
    }

    log.debug(
        "[{}] Received {} for {} {} in {} ms",
        collaborator,
        response.code(),
        request.method(),
        response.request().url(),
        elapsedMs(startTime));
    if (log.isTraceEnabled()) {
      ResponseBody peeked = response.peekBody(MAX_LOGGED_BODY);
      log.trace("[{}] Response body (truncated):\n{}", collaborator, peeked.string());
    }
    return response;
  }

  private static long elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }

  private static String bodyToString(RequestBody body) {
    if (body == null) {
      return "";
    }
    try {
      Buffer buffer = new Buffer();
      body.writeTo(buffer);
      if (buffer.size() > MAX_LOGGED_BODY) {
        return buffer.readUtf8(MAX_LOGGED_BODY) + "...";
      }
      return buffer.readUtf8();
    } catch (IOException e) {
      return "(error reading body)";
    }
  }
}
