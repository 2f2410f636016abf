package com.novelvision.visualization.notification;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.novelvision.visualization.jobs.JobStatus;
import com.novelvision.visualization.jobs.JobTrigger;
import com.novelvision.visualization.jobs.VisualizationJob;
import com.novelvision.visualization.utility.JacksonUtility;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ProgressNotifierTest {

  private static JobProgressEvent event(JobStatus status) {
    VisualizationJob job =
        VisualizationJob.builder()
            .id("job-1")
            .bookId("book-1")
            .pageId("page-1")
            .trigger(JobTrigger.PAGE_REQUEST)
            .userId("user-1")
            .status(status)
            .createdAt(Instant.parse("2026-01-01T00:00:00Z"))
            .build();
    return JobProgressEvent.of(job, "message");
  }

  @Test
  void eventCarriesStatusProgress() {
    JobProgressEvent e = event(JobStatus.UPLOADING);
    assertEquals(80, e.progressPercent());
    assertEquals("user-1", e.userId());
    assertEquals("page-1", e.pageId());
  }

  @Test
  @DisplayName("Subscribers receive events until they unsubscribe")
  void broadcasterSubscription() {
    ProgressBroadcaster broadcaster = new ProgressBroadcaster();
    List<JobProgressEvent> received = new ArrayList<>();
    ProgressBroadcaster.Subscription subscription = broadcaster.subscribe(received::add);

    broadcaster.publish(event(JobStatus.QUEUED));
    subscription.close();
    broadcaster.publish(event(JobStatus.COMPLETED));

    assertEquals(1, received.size());
    assertEquals(JobStatus.QUEUED, received.get(0).status());
    assertEquals(0, broadcaster.subscriberCount());
  }

  @Test
  void throwingSubscriberDoesNotStopOthers() {
    ProgressBroadcaster broadcaster = new ProgressBroadcaster();
    List<JobProgressEvent> received = new ArrayList<>();
    broadcaster.subscribe(
        e -> {
          throw new IllegalStateException("gone");
        });
    broadcaster.subscribe(received::add);

    assertDoesNotThrow(() -> broadcaster.publish(event(JobStatus.FAILED)));
    assertEquals(1, received.size());
  }

  @Test
  void compositeGuardsEachChannel() {
    List<JobProgressEvent> received = new ArrayList<>();
    CompositeProgressNotifier composite =
        new CompositeProgressNotifier(
            List.of(
                e -> {
                  throw new IllegalStateException("broken channel");
                },
                new LoggingProgressNotifier(),
                received::add));

    composite.publish(event(JobStatus.PROCESSING));

    assertEquals(1, received.size());
  }

  @Test
  @DisplayName("Webhook posts the event as JSON")
  void webhookPostsEvent() throws Exception {
    try (MockWebServer server = new MockWebServer()) {
      server.enqueue(new MockResponse().setResponseCode(202));
      server.start();
      WebhookProgressNotifier webhook =
          new WebhookProgressNotifier(server.url("/hooks/progress").toString(), 5);
      try {
        webhook.publish(event(JobStatus.COMPLETED));

        RecordedRequest recorded = server.takeRequest(5, TimeUnit.SECONDS);
        assertNotNull(recorded);
        assertEquals("/hooks/progress", recorded.getPath());
        JsonNode body = JacksonUtility.getJsonMapper().readTree(recorded.getBody().readUtf8());
        assertEquals("job-1", body.get("jobId").asText());
        assertEquals("COMPLETED", body.get("status").asText());
        assertEquals(100, body.get("progressPercent").asInt());
      } finally {
        webhook.close();
      }
    }
  }

  @Test
  void webhookFailuresStayInside() throws Exception {
    MockWebServer server = new MockWebServer();
    server.start();
    String url = server.url("/hooks").toString();
    server.shutdown();
    WebhookProgressNotifier webhook = new WebhookProgressNotifier(url, 1);
    try {
      assertDoesNotThrow(() -> webhook.publish(event(JobStatus.FAILED)));
    } finally {
      webhook.close();
    }
  }
}
