package com.novelvision.visualization.provider;

import static org.junit.jupiter.api.Assertions.*;

import com.novelvision.visualization.exception.PermanentProviderException;
import com.novelvision.visualization.exception.TransientProviderException;
import com.novelvision.visualization.jobs.GenerationParameters;
import com.novelvision.visualization.jobs.ImageFormat;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FluxImageProviderTest {

  private MockWebServer server;
  private BaseConfiguration config;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    config = new BaseConfiguration();
    config.addProperty("api-url", server.url("/").toString());
    config.addProperty("api-key", "bfl-key");
    config.addProperty("poll-interval-ms", 10);
    config.addProperty("timeout-seconds", 5);
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
  }

  private static ImageRequest request() {
    return ImageRequest.forProvider(
        ProviderType.FLUX, "a fox in the snow", null, GenerationParameters.defaults());
  }

  @Test
  @DisplayName("Submits the task and polls until the sample is ready")
  void pollsUntilReady() throws Exception {
    server.enqueue(new MockResponse().setBody("{\"id\":\"task-1\"}"));
    server.enqueue(new MockResponse().setBody("{\"status\":\"Pending\"}"));
    server.enqueue(
        new MockResponse()
            .setBody(
                "{\"status\":\"Ready\",\"result\":{\"sample\":\"https://cdn.bfl/fox.jpg\"}}"));

    ImageResult result = new FluxImageProvider(config, 60).generate(request());

    ImageData image = result.images().get(0);
    assertEquals("https://cdn.bfl/fox.jpg", image.url());
    assertEquals(ImageFormat.JPEG, image.format());

    RecordedRequest submit = server.takeRequest();
    assertEquals("POST", submit.getMethod());
    assertEquals("/v1/flux-pro-1.1", submit.getPath());
    assertEquals("bfl-key", submit.getHeader("x-key"));
    assertEquals("/v1/get_result?id=task-1", server.takeRequest().getPath());
    assertEquals("/v1/get_result?id=task-1", server.takeRequest().getPath());
  }

  @Test
  void moderatedTaskIsPermanent() {
    server.enqueue(new MockResponse().setBody("{\"id\":\"task-2\"}"));
    server.enqueue(new MockResponse().setBody("{\"status\":\"Content Moderated\"}"));

    PermanentProviderException ex =
        assertThrows(
            PermanentProviderException.class,
            () -> new FluxImageProvider(config, 60).generate(request()));
    assertTrue(ex.getMessage().contains("Content Moderated"));
  }

  @Test
  @DisplayName("Polling stops once timeout-seconds have passed")
  void pollingTimesOut() {
    config.setProperty("timeout-seconds", 1);
    config.setProperty("poll-interval-ms", 100);
    server.enqueue(new MockResponse().setBody("{\"id\":\"task-3\"}"));
    for (int i = 0; i < 50; i++) {
      server.enqueue(new MockResponse().setBody("{\"status\":\"Pending\"}"));
    }

    TransientProviderException ex =
        assertThrows(
            TransientProviderException.class,
            () -> new FluxImageProvider(config, 60).generate(request()));
    assertEquals("Generation timed out after 1s", ex.getMessage());
    assertTrue(server.getRequestCount() < 50);
  }

  @Test
  void submitWithoutIdIsPermanent() {
    server.enqueue(new MockResponse().setBody("{}"));
    assertThrows(
        PermanentProviderException.class,
        () -> new FluxImageProvider(config, 60).generate(request()));
  }
}
