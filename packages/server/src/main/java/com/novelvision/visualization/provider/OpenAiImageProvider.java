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
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import org.apache.commons.configuration2.Configuration;

/** DALL-E 3 through the OpenAI images REST API. */
public class OpenAiImageProvider extends AbstractImageProvider {
  private static final org.slf4j.Logger log = LoggingService.getLogger(OpenAiImageProvider.class);

  static final String DEFAULT_API_URL = "https://api.openai.com";
  static final String DEFAULT_MODEL = "dall-e-3";

  private final String apiKey;
  private final String model;
  private final String responseFormat;
  private final OkHttpClient client;

  public OpenAiImageProvider(Configuration configuration, long defaultTimeoutSeconds) {
    super(ProviderType.DALLE3, configuration, defaultTimeoutSeconds);
    this.apiKey = requireText(configuration.getString("api-key", null), "api-key", type);
    this.model = configuration.getString("model", DEFAULT_MODEL);
    this.responseFormat = configuration.getString("response-format", "b64_json");
    this.client =
        OkHttpFactory.create(
            configuration.getString("api-url", DEFAULT_API_URL), type.apiName(), timeoutSeconds);
  }

  @Override
  protected ImageResult runGeneration(ImageRequest request) throws Exception {
    GenerationParameters params = request.parameters();
    String size = dalleSize(params.size());

    ObjectNode body = JacksonUtility.getJsonMapper().createObjectNode();
    body.put("model", model);
    body.put("prompt", request.prompt());
    body.put("n", 1);
    body.put("size", size);
    body.put("quality", dalleQuality(params.quality()));
    body.put("style", dalleStyle(params.style()));
    body.put("response_format", responseFormat);

    Request httpRequest =
        new Request.Builder()
            .url(BaseUrlInterceptor.PLACEHOLDER + "/v1/images/generations")
            .header("Authorization", "Bearer " + apiKey)
            .post(RequestBody.create(JacksonUtility.toJson(body), JSON))
            .build();

    JsonNode response = executeJson(client, httpRequest);
    JsonNode data = response.path("data");
    if (!data.isArray() || data.isEmpty()) {
      throw new PermanentProviderException(type.apiName(), "Response contained no images");
    }

    String[] dims = size.split("x");
    int width = Integer.parseInt(dims[0]);
    int height = Integer.parseInt(dims[1]);
    List<ImageData> images = new ArrayList<>();
    String revisedPrompt = null;
    for (JsonNode item : data) {
      if (item.hasNonNull("b64_json")) {
        images.add(
            ImageData.inline(
                decodeBase64(item.get("b64_json").asText()), width, height, ImageFormat.PNG));
      } else if (item.hasNonNull("url")) {
        images.add(ImageData.remote(item.get("url").asText(), width, height, ImageFormat.PNG));
      }
      if (revisedPrompt == null && item.hasNonNull("revised_prompt")) {
        revisedPrompt = item.get("revised_prompt").asText();
      }
    }
    log.debug(
        "DALL-E returned {} image(s), revised prompt present: {}",
        images.size(),
        revisedPrompt != null);
    return new ImageResult(type, images, revisedPrompt, null);
  }

  /** DALL-E 3 only accepts three sizes; anything else falls back to square. */
  static String dalleSize(String size) {
    if ("1792x1024".equals(size) || "1024x1792".equals(size)) {
      return size;
    }
    return "1024x1024";
  }

  static String dalleQuality(String quality) {
    if (quality == null) return "standard";
    String q = quality.toLowerCase(Locale.ROOT);
    return q.equals("hd") || q.equals("high") ? "hd" : "standard";
  }

  static String dalleStyle(String style) {
    return style != null && style.equalsIgnoreCase("natural") ? "natural" : "vivid";
  }
}
