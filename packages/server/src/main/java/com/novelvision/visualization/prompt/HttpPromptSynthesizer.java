package com.novelvision.visualization.prompt;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.novelvision.visualization.exception.ExceptionUtil;
import com.novelvision.visualization.exception.VisualizationErrorCode;
import com.novelvision.visualization.exception.VisualizationException;
import com.novelvision.visualization.http.BaseUrlInterceptor;
import com.novelvision.visualization.http.OkHttpFactory;
import com.novelvision.visualization.logging.LoggingService;
import com.novelvision.visualization.provider.ProviderType;
import com.novelvision.visualization.utility.JacksonUtility;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.configuration2.Configuration;

/**
 * Client of the remote prompt generation service ({@code POST
 * /api/v1/visualization/generate-prompts}, snake_case JSON). When the service answers without a
 * prompt, the source text itself is used.
 */
public class HttpPromptSynthesizer implements PromptSynthesizer {
  private static final org.slf4j.Logger log = LoggingService.getLogger(HttpPromptSynthesizer.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  static final String PATH = "/api/v1/visualization/generate-prompts";

  private final OkHttpClient client;
  private final ObjectMapper mapper = JacksonUtility.getSnakeCaseMapper();

  /** @param configuration the {@code prompt} subset */
  public HttpPromptSynthesizer(Configuration configuration) {
    String apiUrl = configuration.getString("api-url", null);
    if (apiUrl == null || apiUrl.isBlank()) {
      throw new VisualizationException(
          VisualizationErrorCode.CONFIGURATION_ERROR,
          "prompt.api-url is required when prompt.mode is remote");
    }
    this.client =
        OkHttpFactory.create(apiUrl, "prompt-gen", configuration.getLong("timeout-seconds", 30L));
  }

  record GeneratePromptsRequest(
      String bookId,
      String pageContent,
      String targetModel,
      String style,
      boolean maintainConsistency,
      int maxPrompts) {}

  @Override
  public PromptResult enhance(
      String bookId, String sourceText, String style, ProviderType targetModel) {
    log.debug(
        "Requesting prompt for book {}, model {}, text length {}",
        bookId,
        targetModel.apiName(),
        sourceText == null ? 0 : sourceText.length());
    GeneratePromptsRequest payload =
        new GeneratePromptsRequest(bookId, sourceText, targetModel.apiName(), style, true, 1);

    Request request;
    try {
      request =
          new Request.Builder()
              .url(BaseUrlInterceptor.PLACEHOLDER + PATH)
              .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
              .build();
    } catch (IOException e) {
      throw failure("Could not encode prompt request", e);
    }

    try (Response response = client.newCall(request).execute()) {
      ResponseBody body = response.body();
      String text = body == null ? "" : body.string();
      if (!response.isSuccessful()) {
        log.warn("Prompt service returned HTTP {}: {}", response.code(), text);
        throw failure("Prompt service error: HTTP " + response.code(), null);
      }
      return parse(text, sourceText, style, targetModel);
    } catch (IOException e) {
      throw failure("Prompt service unreachable: " + ExceptionUtil.extractErrorMessage(e), e);
    }
  }

  private PromptResult parse(
      String text, String sourceText, String style, ProviderType targetModel) throws IOException {
    JsonNode data = mapper.readTree(text).path("data");
    if (data.isMissingNode() || data.isNull()) {
      throw failure("Invalid response from prompt service", null);
    }
    JsonNode first = data.path("prompts").path(0);
    String prompt = first.path("prompt").asText(null);
    List<String> characters = new ArrayList<>();
    first.path("characters").forEach(c -> characters.add(c.asText()));
    log.debug("Prompt service answered in {} ms", data.path("processing_time_ms").asLong(-1));
    return new PromptResult(
        prompt == null || prompt.isBlank() ? sourceText : prompt,
        first.path("negative_prompt").asText(null),
        style,
        targetModel.apiName(),
        first.path("scene_description").asText(null),
        characters);
  }

  private static VisualizationException failure(String message, Throwable cause) {
    return new VisualizationException(VisualizationErrorCode.TRANSIENT_ERROR, message, cause);
  }
}
