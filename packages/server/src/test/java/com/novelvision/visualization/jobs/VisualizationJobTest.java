package com.novelvision.visualization.jobs;

import static org.junit.jupiter.api.Assertions.*;

import com.novelvision.visualization.exception.ValidationException;
import com.novelvision.visualization.exception.VisualizationErrorCode;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class VisualizationJobTest {

  private static VisualizationJob.Builder page(String id, JobTrigger trigger, JobStatus status) {
    return VisualizationJob.builder()
        .id(id)
        .bookId("book-1")
        .pageId("page-1")
        .trigger(trigger)
        .userId("user-1")
        .status(status)
        .createdAt(Instant.parse("2026-01-01T00:00:00Z"));
  }

  @Test
  @DisplayName("A job needs either a page or a text selection")
  void requiresTarget() {
    VisualizationJob.Builder builder =
        VisualizationJob.builder()
            .id("j")
            .bookId("b")
            .trigger(JobTrigger.PAGE_REQUEST)
            .userId("u")
            .status(JobStatus.PENDING);
    assertThrows(ValidationException.class, builder::build);
  }

  @Test
  void wholePageTriggersConflictOnSamePage() {
    VisualizationJob a = page("a", JobTrigger.PAGE_REQUEST, JobStatus.PENDING).build();
    VisualizationJob b = page("b", JobTrigger.AUTO_NOVEL, JobStatus.PROCESSING).build();
    assertTrue(a.conflictsWith(b));
    assertTrue(b.conflictsWith(a));
  }

  @Test
  @DisplayName("Text selections do not compete with whole-page jobs")
  void selectionHasOwnSlot() {
    VisualizationJob wholePage = page("a", JobTrigger.PAGE_REQUEST, JobStatus.PENDING).build();
    VisualizationJob selection =
        page("b", JobTrigger.TEXT_SELECTION_REQUEST, JobStatus.PENDING)
            .textSelection(new TextSelection("a long enough span", 0, 18, null, null))
            .build();
    VisualizationJob otherSelection = selection.toBuilder().id("c").build();
    assertFalse(wholePage.conflictsWith(selection));
    assertTrue(selection.conflictsWith(otherSelection));
  }

  @Test
  void finalJobsAndSelfNeverConflict() {
    VisualizationJob active = page("a", JobTrigger.PAGE_REQUEST, JobStatus.QUEUED).build();
    VisualizationJob done = page("b", JobTrigger.PAGE_REQUEST, JobStatus.COMPLETED).build();
    assertFalse(active.conflictsWith(done));
    assertFalse(active.conflictsWith(active));
  }

  @Test
  @DisplayName("resetForRetry clears failure, lease and timing fields")
  void resetForRetry() {
    VisualizationJob failed =
        page("a", JobTrigger.PAGE_REQUEST, JobStatus.FAILED)
            .errorMessage("boom")
            .errorCode(VisualizationErrorCode.TRANSIENT_ERROR)
            .claimedBy("worker-1")
            .claimedAt(Instant.now())
            .processingStartedAt(Instant.now())
            .completedAt(Instant.now())
            .retryCount(1)
            .build();

    VisualizationJob reset = failed.toBuilder().resetForRetry().build();

    assertEquals(JobStatus.PENDING, reset.status());
    assertNull(reset.errorMessage());
    assertNull(reset.errorCode());
    assertNull(reset.claimedBy());
    assertNull(reset.claimedAt());
    assertNull(reset.processingStartedAt());
    assertNull(reset.completedAt());
    assertEquals(1, reset.retryCount());
    assertEquals(failed.createdAt(), reset.createdAt());
  }

  @Test
  void imagesAndSelection() {
    GeneratedImage first = image("img-1", true);
    GeneratedImage second = image("img-2", false).asDeleted();
    VisualizationJob job =
        page("a", JobTrigger.PAGE_REQUEST, JobStatus.COMPLETED)
            .addImage(first)
            .addImage(second)
            .selectedImageId("img-1")
            .build();

    assertEquals(1, job.activeImages().size());
    assertTrue(job.hasImages());
    assertEquals("img-1", job.selectedImage().orElseThrow().id());
    assertTrue(job.image("img-2").orElseThrow().deleted());
    assertTrue(job.isOwnedBy("user-1"));
    assertFalse(job.isOwnedBy("user-2"));
  }

  @Test
  @DisplayName("Selection context is clipped next to the selected text")
  void selectionContextClipping() {
    String before = "b".repeat(150) + "A".repeat(200);
    String after = "Z".repeat(200) + "c".repeat(150);
    TextSelection selection = new TextSelection("the selected text", 10, 27, before, after);

    assertEquals("A".repeat(200), selection.contextBefore());
    assertEquals("Z".repeat(200), selection.contextAfter());
    assertEquals(
        "A".repeat(200) + "the selected text" + "Z".repeat(200), selection.fullContext());
  }

  @Test
  void generationParameterDefaults() {
    GenerationParameters params = GenerationParameters.defaults();
    assertEquals("1024x1024", params.size());
    assertEquals("standard", params.quality());
    assertEquals("1:1", params.aspectRatio());
    assertEquals(1024, params.width());

    GenerationParameters wide =
        new GenerationParameters(
            "1792x1024", null, null, null, null, null, null, null, false, null);
    assertEquals(1792, wide.width());
    assertEquals(1024, wide.height());
    assertEquals("watercolor", wide.withStyle("watercolor").style());
  }

  private static GeneratedImage image(String id, boolean selected) {
    return new GeneratedImage(
        id,
        "/uploads/" + id + ".png",
        "/uploads/" + id + "_thumb.png",
        "books/book-1/images/" + id + ".png",
        1024,
        1024,
        2048,
        ImageFormat.PNG,
        null,
        Instant.now(),
        selected,
        false);
  }
}
