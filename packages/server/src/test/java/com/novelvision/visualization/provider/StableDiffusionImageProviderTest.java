package com.novelvision.visualization.provider;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.novelvision.visualization.exception.PermanentProviderException;
import com.novelvision.visualization.jobs.GenerationParameters;
import com.novelvision.visualization.jobs.ImageFormat;
import com.novelvision.visualization.utility.JacksonUtility;
import java.util.Base64;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StableDiffusionImageProviderTest {

  private static final byte[] JPEG_HEADER = {
    (byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0, 0, 0x10, 'J', 'F', 'I', 'F', 0, 1
  };

  private MockWebServer server;
  private StableDiffusionImageProvider provider;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    BaseConfiguration config = new BaseConfiguration();
    config.addProperty("api-url", server.url("/").toString());
    provider = new StableDiffusionImageProvider(config, 30);
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
  }

  @Test
  void sendsTxt2ImgRequestWithDefaults() throws Exception {
    server.enqueue(
        new MockResponse()
            .setBody(
                "{\"images\":[\"" + Base64.getEncoder().encodeToString(JPEG_HEADER) + "\"]}"));

    ImageResult result =
        provider.generate(
            ImageRequest.forProvider(
                ProviderType.STABLE_DIFFUSION,
                "castle",
                null,
                new GenerationParameters(
                    "768x512",
                    null,
                    null,
                    null,
                    42L,
                    null,
                    null,
                    null,
                    true,
                    Map.of("tiling", true))));

    ImageData image = result.images().get(0);
    assertEquals(ImageFormat.JPEG, image.format());
    assertEquals(768, image.width());
    assertEquals(512, image.height());

    RecordedRequest recorded = server.takeRequest();
    assertEquals("/sdapi/v1/txt2img", recorded.getPath());
    assertNull(recorded.getHeader("Authorization"));
    JsonNode body = JacksonUtility.getJsonMapper().readTree(recorded.getBody().readUtf8());
    assertEquals("castle", body.get("prompt").asText());
    assertEquals(
        StableDiffusionImageProvider.DEFAULT_NEGATIVE_PROMPT, body.get("negative_prompt").asText());
    assertEquals(30, body.get("steps").asInt());
    assertEquals(7.5, body.get("cfg_scale").asDouble());
    assertEquals("DPM++ 2M Karras", body.get("sampler_name").asText());
    assertEquals(42L, body.get("seed").asLong());
    assertTrue(body.get("enable_hr").asBoolean());
    assertTrue(body.get("tiling").asBoolean());
  }

  @Test
  void negativePromptIsForwarded() throws Exception {
    server.enqueue(
        new MockResponse()
            .setBody(
                "{\"images\":[\"" + Base64.getEncoder().encodeToString(JPEG_HEADER) + "\"]}"));

    provider.generate(
        ImageRequest.forProvider(
            ProviderType.STABLE_DIFFUSION, "castle", "people", GenerationParameters.defaults()));

    JsonNode body =
        JacksonUtility.getJsonMapper().readTree(server.takeRequest().getBody().readUtf8());
    assertEquals("people", body.get("negative_prompt").asText());
    assertFalse(body.has("enable_hr"));
  }

  @Test
  void noImagesIsPermanent() {
    server.enqueue(new MockResponse().setBody("{\"images\":[]}"));

    ImageRequest request =
        ImageRequest.forProvider(
            ProviderType.STABLE_DIFFUSION, "castle", null, GenerationParameters.defaults());
    assertThrows(PermanentProviderException.class, () -> provider.generate(request));
  }
}
