package com.novelvision.visualization.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.novelvision.visualization.exception.PermanentProviderException;
import com.novelvision.visualization.http.BaseUrlInterceptor;
import com.novelvision.visualization.http.OkHttpFactory;
import com.novelvision.visualization.jobs.GenerationParameters;
import com.novelvision.visualization.jobs.ImageFormat;
import com.novelvision.visualization.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import org.apache.commons.configuration2.Configuration;

/** Stable Diffusion through an Automatic1111-compatible {@code txt2img} endpoint. */
public class StableDiffusionImageProvider extends AbstractImageProvider {
  static final String DEFAULT_API_URL = "http://localhost:7860";
  static final String DEFAULT_NEGATIVE_PROMPT = "blurry, low quality, distorted, deformed";
  static final int DEFAULT_STEPS = 30;
  static final double DEFAULT_CFG_SCALE = 7.5;
  static final String DEFAULT_SAMPLER = "DPM++ 2M Karras";

  private final String apiKey;
  private final OkHttpClient client;

  public StableDiffusionImageProvider(Configuration configuration, long defaultTimeoutSeconds) {
    super(ProviderType.STABLE_DIFFUSION, configuration, defaultTimeoutSeconds);
    this.apiKey = configuration.getString("api-key", null);
    this.client =
        OkHttpFactory.create(
            configuration.getString("api-url", DEFAULT_API_URL), type.apiName(), timeoutSeconds);
  }

  @Override
  protected ImageResult runGeneration(ImageRequest request) throws Exception {
    GenerationParameters params = request.parameters();
    ObjectNode body = JacksonUtility.getJsonMapper().createObjectNode();
    body.put("prompt", request.prompt());
    body.put(
        "negative_prompt",
        request.negativePrompt() == null ? DEFAULT_NEGATIVE_PROMPT : request.negativePrompt());
    body.put("steps", params.steps() == null ? DEFAULT_STEPS : params.steps());
    body.put("cfg_scale", params.cfgScale() == null ? DEFAULT_CFG_SCALE : params.cfgScale());
    body.put("sampler_name", params.sampler() == null ? DEFAULT_SAMPLER : params.sampler());
    body.put("seed", params.seed() == null ? -1L : params.seed());
    body.put("width", params.width());
    body.put("height", params.height());
    body.put("batch_size", 1);
    if (params.upscale()) {
      body.put("enable_hr", true);
    }
    for (Map.Entry<String, Object> e : params.extra().entrySet()) {
      body.set(e.getKey(), JacksonUtility.getJsonMapper().valueToTree(e.getValue()));
    }

    Request.Builder builder =
        new Request.Builder()
            .url(BaseUrlInterceptor.PLACEHOLDER + "/sdapi/v1/txt2img")
            .post(RequestBody.create(JacksonUtility.toJson(body), JSON));
    if (apiKey != null && !apiKey.isBlank()) {
      builder.header("Authorization", "Bearer " + apiKey);
    }

    JsonNode response = executeJson(client, builder.build());
    JsonNode encoded = response.path("images");
    if (!encoded.isArray() || encoded.isEmpty()) {
      throw new PermanentProviderException(type.apiName(), "Stable Diffusion returned no images");
    }
    List<ImageData> images = new ArrayList<>();
    for (JsonNode item : encoded) {
      byte[] bytes = decodeBase64(item.asText());
      ImageFormat format = ImageFormat.detect(bytes);
      images.add(
          ImageData.inline(
              bytes, params.width(), params.height(), format == null ? ImageFormat.PNG : format));
    }
    return new ImageResult(type, images, null, null);
  }
}
