package com.novelvision.visualization.notification;

import com.novelvision.visualization.http.OkHttpFactory;
import com.novelvision.visualization.logging.LoggingService;
import com.novelvision.visualization.utility.JacksonUtility;
import java.io.IOException;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/** POSTs each event as JSON to a webhook. Calls are enqueued and never awaited. */
public class WebhookProgressNotifier implements ProgressNotifier {
  private static final org.slf4j.Logger log =
      LoggingService.getLogger(WebhookProgressNotifier.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final String url;
  private final OkHttpClient client;

  public WebhookProgressNotifier(String url, long timeoutSeconds) {
    this.url = url;
    this.client = OkHttpFactory.create(null, "webhook", timeoutSeconds);
  }

  @Override
  public void publish(JobProgressEvent event) {
    Request request;
    try {
      request =
          new Request.Builder()
              .url(url)
              .post(RequestBody.create(JacksonUtility.toJson(event), JSON))
              .build();
    } catch (RuntimeException e) {
      log.warn("Could not build webhook request for job {}: {}", event.jobId(), e.getMessage());
      return;
    }
    client
        .newCall(request)
        .enqueue(
            new Callback() {
              @Override
              public void onFailure(@NotNull Call call, @NotNull IOException e) {
                log.warn("Webhook delivery failed for job {}: {}", event.jobId(), e.getMessage());
              }

              @Override
              public void onResponse(@NotNull Call call, @NotNull Response response) {
                try (response) {
                  if (!response.isSuccessful()) {
                    log.warn(
                        "Webhook rejected event for job {}: HTTP {}",
                        event.jobId(),
                        response.code());
                  }
                }
              }
            });
  }

  /** Stop the dispatcher threads. */
  public void close() {
    client.dispatcher().executorService().shutdown();
    client.connectionPool().evictAll();
  }
}
