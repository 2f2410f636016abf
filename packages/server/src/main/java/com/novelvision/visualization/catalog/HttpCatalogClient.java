package com.novelvision.visualization.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.novelvision.visualization.exception.ExceptionUtil;
import com.novelvision.visualization.exception.VisualizationErrorCode;
import com.novelvision.visualization.exception.VisualizationException;
import com.novelvision.visualization.http.BaseUrlInterceptor;
import com.novelvision.visualization.http.OkHttpFactory;
import com.novelvision.visualization.logging.LoggingService;
import com.novelvision.visualization.utility.JacksonUtility;
import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.configuration2.Configuration;

/**
 * REST client of the catalog service. Responses are wrapped as {@code {"success": .., "data":
 * ..}}; a 404 means the entity does not exist, any other failure is raised as a transient error.
 */
public class HttpCatalogClient implements CatalogClient {
  private static final org.slf4j.Logger log = LoggingService.getLogger(HttpCatalogClient.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient client;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  /** @param configuration the {@code catalog} subset */
  public HttpCatalogClient(Configuration configuration) {
    String apiUrl = configuration.getString("api-url", null);
    if (apiUrl == null || apiUrl.isBlank()) {
      throw new VisualizationException(
          VisualizationErrorCode.CONFIGURATION_ERROR, "catalog.api-url is required");
    }
    this.client =
        OkHttpFactory.create(apiUrl, "catalog", configuration.getLong("timeout-seconds", 10L));
  }

  @Override
  public Optional<PageInfo> getPage(String pageId) {
    return get(path("api", "v1", "pages", pageId)).map(data -> toPage(data, null));
  }

  @Override
  public Optional<BookVisualizationSettings> getBookVisualizationSettings(String bookId) {
    return get(path("api", "v1", "books", bookId, "visualization-settings"))
        .map(
            data -> {
              Set<VisualizationMode> allowed = EnumSet.noneOf(VisualizationMode.class);
              data.path("allowedModes")
                  .forEach(m -> allowed.add(VisualizationMode.parse(m.asText())));
              return new BookVisualizationSettings(
                  bookId,
                  data.path("enabled").asBoolean(false),
                  data.path("published").asBoolean(false),
                  VisualizationMode.parse(data.path("primaryMode").asText(null)),
                  allowed,
                  data.path("preferredProvider").asText(null),
                  data.path("preferredStyle").asText(null));
            });
  }

  @Override
  public List<PageInfo> getBookPages(String bookId) {
    JsonNode data =
        get(path("api", "v1", "books", bookId, "pages-for-visualization"))
            .orElseThrow(
                () ->
                    new VisualizationException(
                        VisualizationErrorCode.INVALID_TARGET, "Book " + bookId + " not found"));
    List<PageInfo> pages = new ArrayList<>();
    data.path("pages").forEach(p -> pages.add(toPage(p, bookId)));
    return pages;
  }

  @Override
  public void setPageVisualization(
      String bookId,
      String chapterId,
      String pageId,
      String imageUrl,
      String thumbnailUrl,
      String jobId) {
    ObjectNode body = mapper.createObjectNode();
    body.put("hasVisualization", true);
    body.put("visualizationImageUrl", imageUrl);
    body.put("thumbnailUrl", thumbnailUrl);
    body.put("visualizationJobId", jobId);
    body.put("bookId", bookId);
    body.put("chapterId", chapterId);
    Request request =
        new Request.Builder()
            .url(path("api", "v1", "pages", pageId, "visualization"))
            .put(RequestBody.create(JacksonUtility.toJson(body), JSON))
            .build();
    try (Response response = client.newCall(request).execute()) {
      if (!response.isSuccessful()) {
        throw unavailable("Page write-back failed: HTTP " + response.code(), null);
      }
      log.debug("Page {} now shows image of job {}", pageId, jobId);
    } catch (IOException e) {
      throw unavailable("Page write-back failed: " + ExceptionUtil.extractErrorMessage(e), e);
    }
  }

  private Optional<JsonNode> get(HttpUrl url) {
    Request request = new Request.Builder().url(url).get().build();
    try (Response response = client.newCall(request).execute()) {
      if (response.code() == 404) {
        return Optional.empty();
      }
      ResponseBody body = response.body();
      String text = body == null ? "" : body.string();
      if (!response.isSuccessful()) {
        throw unavailable(
            "Catalog returned HTTP " + response.code() + " for " + url.encodedPath(), null);
      }
      JsonNode data = mapper.readTree(text).path("data");
      if (data.isMissingNode() || data.isNull()) {
        return Optional.empty();
      }
      return Optional.of(data);
    } catch (IOException e) {
      throw unavailable("Catalog unreachable: " + ExceptionUtil.extractErrorMessage(e), e);
    }
  }

  private static PageInfo toPage(JsonNode node, String fallbackBookId) {
    String id = node.hasNonNull("id") ? node.get("id").asText() : node.path("pageId").asText(null);
    return new PageInfo(
        id,
        node.path("bookId").asText(fallbackBookId),
        node.path("chapterId").asText(null),
        node.path("pageNumber").asInt(0),
        node.path("content").asText(null),
        node.path("isVisualizationPoint").asBoolean(false),
        node.path("hasVisualization").asBoolean(false));
  }

  private static HttpUrl path(String... segments) {
    HttpUrl.Builder builder = HttpUrl.get(BaseUrlInterceptor.PLACEHOLDER).newBuilder();
    for (String segment : segments) {
      builder.addPathSegment(segment);
    }
    return builder.build();
  }

  private static VisualizationException unavailable(String message, Throwable cause) {
    return new VisualizationException(VisualizationErrorCode.TRANSIENT_ERROR, message, cause);
  }
}
