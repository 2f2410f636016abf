package com.novelvision.visualization.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.novelvision.visualization.exception.PermanentProviderException;
import com.novelvision.visualization.http.BaseUrlInterceptor;
import com.novelvision.visualization.http.OkHttpFactory;
import com.novelvision.visualization.jobs.GenerationParameters;
import com.novelvision.visualization.jobs.ImageFormat;
import com.novelvision.visualization.logging.LoggingService;
import com.novelvision.visualization.utility.JacksonUtility;
import java.util.List;
import java.util.Map;
import java.util.Set;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import org.apache.commons.configuration2.Configuration;

/**
 * Flux through a submit-and-poll task API: the submit call returns a task id, and {@code
 * get_result} is polled until the task is ready or {@code timeout-seconds} have passed since the
 * submit.
 */
public class FluxImageProvider extends AbstractImageProvider {
  private static final org.slf4j.Logger log = LoggingService.getLogger(FluxImageProvider.class);

  static final String DEFAULT_API_URL = "https://api.bfl.ml";
  static final String DEFAULT_MODEL = "flux-pro-1.1";

  private static final Set<String> REJECTED =
      Set.of("Error", "Failed", "Content Moderated", "Request Moderated");

  private final String apiKey;
  private final String model;
  private final long pollIntervalMs;
  private final OkHttpClient client;

  public FluxImageProvider(Configuration configuration, long defaultTimeoutSeconds) {
    super(ProviderType.FLUX, configuration, defaultTimeoutSeconds);
    this.apiKey = requireText(configuration.getString("api-key", null), "api-key", type);
    this.model = configuration.getString("model", DEFAULT_MODEL);
    this.pollIntervalMs = configuration.getLong("poll-interval-ms", 1000L);
    this.client =
        OkHttpFactory.create(
            configuration.getString("api-url", DEFAULT_API_URL), type.apiName(), timeoutSeconds);
  }

  @Override
  protected ImageResult runGeneration(ImageRequest request) throws Exception {
    long deadline = deadline();
    String taskId = submit(request);
    log.debug("Flux task {} submitted", taskId);

    HttpUrl pollUrl =
        HttpUrl.get(BaseUrlInterceptor.PLACEHOLDER + "/v1/get_result")
            .newBuilder()
            .addQueryParameter("id", taskId)
            .build();
    while (true) {
      Request poll = new Request.Builder().url(pollUrl).header("x-key", apiKey).get().build();
      JsonNode result = executeJson(client, poll);
      String status = result.path("status").asText("");
      if ("Ready".equals(status)) {
        String sample = result.path("result").path("sample").asText(null);
        if (sample == null || sample.isBlank()) {
          throw new PermanentProviderException(type.apiName(), "Task " + taskId + " has no sample");
        }
        GenerationParameters params = request.parameters();
        return new ImageResult(
            type,
            List.of(ImageData.remote(sample, params.width(), params.height(), ImageFormat.JPEG)),
            null,
            null);
      }
      if (REJECTED.contains(status)) {
        throw new PermanentProviderException(
            type.apiName(), "Task " + taskId + " ended with status '" + status + "'");
      }
      long remaining = deadline - System.currentTimeMillis();
      if (remaining <= 0) {
        log.warn("Flux task {} still '{}' at the deadline", taskId, status);
        throw timedOut(null);
      }
      Thread.sleep(Math.min(pollIntervalMs, remaining));
    }
  }

  private String submit(ImageRequest request) throws Exception {
    GenerationParameters params = request.parameters();
    ObjectNode body = JacksonUtility.getJsonMapper().createObjectNode();
    body.put("prompt", request.prompt());
    if (request.negativePrompt() != null) {
      body.put("negative_prompt", request.negativePrompt());
    }
    body.put("width", params.width());
    body.put("height", params.height());
    if (params.seed() != null && params.seed() >= 0) {
      body.put("seed", params.seed());
    }
    if (params.steps() != null) {
      body.put("steps", params.steps());
    }
    if (params.cfgScale() != null) {
      body.put("guidance", params.cfgScale());
    }
    for (Map.Entry<String, Object> e : params.extra().entrySet()) {
      body.set(e.getKey(), JacksonUtility.getJsonMapper().valueToTree(e.getValue()));
    }

    Request submit =
        new Request.Builder()
            .url(BaseUrlInterceptor.PLACEHOLDER + "/v1/" + model)
            .header("x-key", apiKey)
            .post(RequestBody.create(JacksonUtility.toJson(body), JSON))
            .build();
    JsonNode response = executeJson(client, submit);
    String id = response.path("id").asText(null);
    if (id == null || id.isBlank()) {
      throw new PermanentProviderException(type.apiName(), "Submit response carried no task id");
    }
    return id;
  }
}
