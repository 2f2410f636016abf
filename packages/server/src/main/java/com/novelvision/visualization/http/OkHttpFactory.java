package com.novelvision.visualization.http;

import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  private OkHttpFactory() {}

  /**
   * Build a client for one collaborator. {@code timeoutSeconds} bounds the whole call, read
   * timeout included; connection setup is capped at 10 seconds.
   */
  public static OkHttpClient create(String baseUrl, String collaborator, long timeoutSeconds) {
    if (timeoutSeconds <= 0) {
      throw new IllegalArgumentException("timeoutSeconds must be positive");
    }
    return new OkHttpClient.Builder()
        .connectTimeout(Math.min(10, timeoutSeconds), TimeUnit.SECONDS)
        .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
        .writeTimeout(timeoutSeconds, TimeUnit.SECONDS)
        .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
        .addInterceptor(new BaseUrlInterceptor(baseUrl))
        .addInterceptor(new LoggingInterceptor(collaborator))
        .build();
  }
}
