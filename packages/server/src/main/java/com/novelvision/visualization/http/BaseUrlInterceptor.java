package com.novelvision.visualization.http;

import java.io.IOException;
import okhttp3.HttpUrl;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/**
 * Rewrites relative request URLs against a configured base URL. Clients build requests with a
 * placeholder host ({@link #PLACEHOLDER}) and only the path; this interceptor swaps in the scheme,
 * host, port and path prefix of the collaborator.
 */
public class BaseUrlInterceptor implements Interceptor {
  public static final String PLACEHOLDER = "http://base.invalid";

  private final HttpUrl baseUrl;

  public BaseUrlInterceptor(String baseUrl) {
    if (baseUrl == null || baseUrl.isBlank()) {
      this.baseUrl = null;
      return;
    }
    HttpUrl parsed = HttpUrl.parse(baseUrl);
    if (parsed == null) {
      throw new IllegalArgumentException("Invalid base url: " + baseUrl);
    }
    this.baseUrl = parsed;
  }

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    HttpUrl url = request.url();
    if (baseUrl == null || !"base.invalid".equals(url.host())) {
      return chain.proceed(request);
    }

    HttpUrl.Builder rewritten =
        url.newBuilder().scheme(baseUrl.scheme()).host(baseUrl.host()).port(baseUrl.port());
    String prefix = baseUrl.encodedPath();
    if (!"/".equals(prefix)) {
      String trimmed = prefix.endsWith("/") ? prefix.substring(0, prefix.length() - 1) : prefix;
      rewritten.encodedPath(trimmed + url.encodedPath());
    }
    return chain.proceed(request.newBuilder().url(rewritten.build()).build());
  }
}
