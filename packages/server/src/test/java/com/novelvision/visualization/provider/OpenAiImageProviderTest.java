package com.novelvision.visualization.provider;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.novelvision.visualization.exception.PermanentProviderException;
import com.novelvision.visualization.exception.ProviderUnavailableException;
import com.novelvision.visualization.exception.TransientProviderException;
import com.novelvision.visualization.jobs.GenerationParameters;
import com.novelvision.visualization.jobs.ImageFormat;
import com.novelvision.visualization.utility.JacksonUtility;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OpenAiImageProviderTest {

  private MockWebServer server;
  private BaseConfiguration config;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    config = new BaseConfiguration();
    config.addProperty("api-url", server.url("/").toString());
    config.addProperty("api-key", "sk-test");
    config.addProperty("timeout-seconds", 5);
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
  }

  private ImageRequest request(GenerationParameters params) {
    return ImageRequest.forProvider(ProviderType.DALLE3, "A lighthouse in a storm", null, params);
  }

  @Test
  @DisplayName("Base64 images are decoded and the revised prompt is kept")
  void decodesInlineImage() throws Exception {
    String b64 = Base64.getEncoder().encodeToString("png-bytes".getBytes(StandardCharsets.UTF_8));
    server.enqueue(
        new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody(
                "{\"data\":[{\"b64_json\":\""
                    + b64
                    + "\",\"revised_prompt\":\"A tall lighthouse\"}]}"));
    OpenAiImageProvider provider = new OpenAiImageProvider(config, 60);
    GenerationParameters wide =
        new GenerationParameters(
            "1792x1024", "hd", "natural", null, null, null, null, null, false, null);

    ImageResult result = provider.generate(request(wide));

    assertEquals(ProviderType.DALLE3, result.provider());
    assertEquals(1, result.images().size());
    ImageData image = result.images().get(0);
    assertTrue(image.isInline());
    assertArrayEquals("png-bytes".getBytes(StandardCharsets.UTF_8), image.bytes());
    assertEquals(1792, image.width());
    assertEquals(ImageFormat.PNG, image.format());
    assertEquals("A tall lighthouse", result.revisedPrompt());
    assertNotNull(result.elapsed());

    RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
    assertEquals("/v1/images/generations", recorded.getPath());
    assertEquals("Bearer sk-test", recorded.getHeader("Authorization"));
    JsonNode body = JacksonUtility.getJsonMapper().readTree(recorded.getBody().readUtf8());
    assertEquals("dall-e-3", body.get("model").asText());
    assertEquals("1792x1024", body.get("size").asText());
    assertEquals("hd", body.get("quality").asText());
    assertEquals("natural", body.get("style").asText());
    assertEquals("b64_json", body.get("response_format").asText());
  }

  @Test
  void urlResponse() {
    server.enqueue(
        new MockResponse().setBody("{\"data\":[{\"url\":\"https://cdn.example/img.png\"}]}"));

    ImageResult result =
        new OpenAiImageProvider(config, 60).generate(request(GenerationParameters.defaults()));

    assertFalse(result.images().get(0).isInline());
    assertEquals("https://cdn.example/img.png", result.images().get(0).url());
  }

  @Test
  @DisplayName("Rate limits and server errors are transient")
  void serverErrorsAreTransient() {
    server.enqueue(new MockResponse().setResponseCode(503).setBody("{\"error\":\"overloaded\"}"));
    OpenAiImageProvider provider = new OpenAiImageProvider(config, 60);

    TransientProviderException ex =
        assertThrows(
            TransientProviderException.class,
            () -> provider.generate(request(GenerationParameters.defaults())));
    assertEquals("[dalle3] HTTP 503: overloaded", ex.taggedMessage());

    server.enqueue(new MockResponse().setResponseCode(429));
    assertThrows(
        TransientProviderException.class,
        () -> provider.generate(request(GenerationParameters.defaults())));
  }

  @Test
  @DisplayName("Client errors are permanent and carry the provider's error message")
  void clientErrorsArePermanent() {
    server.enqueue(
        new MockResponse()
            .setResponseCode(400)
            .setBody("{\"error\":{\"message\":\"Your request was rejected\"}}"));

    PermanentProviderException ex =
        assertThrows(
            PermanentProviderException.class,
            () ->
                new OpenAiImageProvider(config, 60)
                    .generate(request(GenerationParameters.defaults())));
    assertEquals("HTTP 400: Your request was rejected", ex.getMessage());
    assertEquals("dalle3", ex.getProvider());
  }

  @Test
  void malformedOrEmptyResponsesArePermanent() {
    server.enqueue(new MockResponse().setBody("not json"));
    server.enqueue(new MockResponse().setBody("{\"data\":[]}"));
    OpenAiImageProvider provider = new OpenAiImageProvider(config, 60);

    assertThrows(
        PermanentProviderException.class,
        () -> provider.generate(request(GenerationParameters.defaults())));
    assertThrows(
        PermanentProviderException.class,
        () -> provider.generate(request(GenerationParameters.defaults())));
  }

  @Test
  @DisplayName("A call slower than the timeout fails as transient")
  void timeoutIsTransient() {
    config.setProperty("timeout-seconds", 1);
    server.enqueue(
        new MockResponse().setBody("{\"data\":[]}").setHeadersDelay(3, TimeUnit.SECONDS));

    TransientProviderException ex =
        assertThrows(
            TransientProviderException.class,
            () ->
                new OpenAiImageProvider(config, 60)
                    .generate(request(GenerationParameters.defaults())));
    assertEquals("Generation timed out after 1s", ex.getMessage());
  }

  @Test
  void missingKeyMakesProviderUnavailable() {
    config.clearProperty("api-key");
    assertThrows(ProviderUnavailableException.class, () -> new OpenAiImageProvider(config, 60));

    config.setProperty("api-key", "${env:OPENAI_API_KEY_NOT_SET}");
    assertThrows(ProviderUnavailableException.class, () -> new OpenAiImageProvider(config, 60));
  }

  @Test
  void parameterMapping() {
    assertEquals("1024x1024", OpenAiImageProvider.dalleSize("512x512"));
    assertEquals("1024x1792", OpenAiImageProvider.dalleSize("1024x1792"));
    assertEquals("hd", OpenAiImageProvider.dalleQuality("HIGH"));
    assertEquals("standard", OpenAiImageProvider.dalleQuality(null));
    assertEquals("vivid", OpenAiImageProvider.dalleStyle("anime"));
  }
}
