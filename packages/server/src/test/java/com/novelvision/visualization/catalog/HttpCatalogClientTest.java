package com.novelvision.visualization.catalog;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.novelvision.visualization.exception.VisualizationErrorCode;
import com.novelvision.visualization.exception.VisualizationException;
import com.novelvision.visualization.utility.JacksonUtility;
import java.util.List;
import java.util.Set;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpCatalogClientTest {

  private MockWebServer server;
  private HttpCatalogClient client;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    BaseConfiguration config = new BaseConfiguration();
    config.addProperty("api-url", server.url("/catalog").toString());
    client = new HttpCatalogClient(config);
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
  }

  @Test
  void readsPage() throws Exception {
    server.enqueue(
        new MockResponse()
            .setBody(
                "{\"data\":{\"id\":\"p-1\",\"bookId\":\"b-1\",\"chapterId\":\"c-1\","
                    + "\"pageNumber\":7,\"content\":\"Once upon a time\","
                    + "\"isVisualizationPoint\":true,\"hasVisualization\":false}}"));

    PageInfo page = client.getPage("p-1").orElseThrow();

    assertEquals(new PageInfo("p-1", "b-1", "c-1", 7, "Once upon a time", true, false), page);
    RecordedRequest recorded = server.takeRequest();
    assertEquals("/catalog/api/v1/pages/p-1", recorded.getPath());
  }

  @Test
  void missingPageIsEmpty() {
    server.enqueue(new MockResponse().setResponseCode(404));
    assertTrue(client.getPage("nope").isEmpty());
  }

  @Test
  void serverErrorIsTransient() {
    server.enqueue(new MockResponse().setResponseCode(502));
    VisualizationException ex =
        assertThrows(VisualizationException.class, () -> client.getPage("p-1"));
    assertEquals(VisualizationErrorCode.TRANSIENT_ERROR, ex.getCode());
  }

  @Test
  void readsBookSettings() {
    server.enqueue(
        new MockResponse()
            .setBody(
                "{\"data\":{\"enabled\":true,\"published\":true,\"primaryMode\":\"PerPage\","
                    + "\"allowedModes\":[\"PerPage\",\"UserSelected\"],"
                    + "\"preferredProvider\":\"flux\",\"preferredStyle\":\"ink\"}}"));

    BookVisualizationSettings settings = client.getBookVisualizationSettings("b-1").orElseThrow();

    assertTrue(settings.isEligible());
    assertTrue(settings.coversEveryPage());
    assertEquals(
        Set.of(VisualizationMode.PER_PAGE, VisualizationMode.USER_SELECTED),
        settings.allowedModes());
    assertEquals("flux", settings.preferredProvider());
    assertEquals("ink", settings.preferredStyle());
  }

  @Test
  void listsBookPages() throws Exception {
    server.enqueue(
        new MockResponse()
            .setBody(
                "{\"data\":{\"pages\":[{\"pageId\":\"p-1\",\"pageNumber\":1,"
                    + "\"isVisualizationPoint\":true},{\"pageId\":\"p-2\",\"pageNumber\":2}]}}"));

    List<PageInfo> pages = client.getBookPages("b-1");

    assertEquals(2, pages.size());
    assertEquals("b-1", pages.get(0).bookId());
    assertTrue(pages.get(0).visualizationPoint());
    assertFalse(pages.get(1).visualizationPoint());
    assertEquals(
        "/catalog/api/v1/books/b-1/pages-for-visualization", server.takeRequest().getPath());
  }

  @Test
  void unknownBookPagesIsInvalidTarget() {
    server.enqueue(new MockResponse().setResponseCode(404));
    VisualizationException ex =
        assertThrows(VisualizationException.class, () -> client.getBookPages("missing"));
    assertEquals(VisualizationErrorCode.INVALID_TARGET, ex.getCode());
  }

  @Test
  void writesBackVisualization() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(204));

    client.setPageVisualization("b-1", "c-1", "p-1", "/img.png", "/thumb.png", "job-1");

    RecordedRequest recorded = server.takeRequest();
    assertEquals("PUT", recorded.getMethod());
    assertEquals("/catalog/api/v1/pages/p-1/visualization", recorded.getPath());
    JsonNode body = JacksonUtility.getJsonMapper().readTree(recorded.getBody().readUtf8());
    assertTrue(body.get("hasVisualization").asBoolean());
    assertEquals("/img.png", body.get("visualizationImageUrl").asText());
    assertEquals("job-1", body.get("visualizationJobId").asText());
  }

  @Test
  void failedWriteBackThrows() {
    server.enqueue(new MockResponse().setResponseCode(500));
    assertThrows(
        VisualizationException.class,
        () -> client.setPageVisualization("b-1", "c-1", "p-1", "/i.png", "/t.png", "job-1"));
  }
}
