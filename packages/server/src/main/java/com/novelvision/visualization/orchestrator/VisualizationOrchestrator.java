package com.novelvision.visualization.orchestrator;

import com.novelvision.visualization.catalog.BookVisualizationSettings;
import com.novelvision.visualization.catalog.CatalogClient;
import com.novelvision.visualization.catalog.PageInfo;
import com.novelvision.visualization.exception.AlreadyInProgressException;
import com.novelvision.visualization.exception.InvalidStateException;
import com.novelvision.visualization.exception.InvalidTargetException;
import com.novelvision.visualization.exception.NotFoundException;
import com.novelvision.visualization.exception.RetryLimitExceededException;
import com.novelvision.visualization.exception.ValidationException;
import com.novelvision.visualization.exception.VisualizationErrorCode;
import com.novelvision.visualization.jobs.GeneratedImage;
import com.novelvision.visualization.jobs.GenerationParameters;
import com.novelvision.visualization.jobs.JobStatus;
import com.novelvision.visualization.jobs.JobStatusView;
import com.novelvision.visualization.jobs.JobStore;
import com.novelvision.visualization.jobs.JobTrigger;
import com.novelvision.visualization.jobs.RetryPolicy;
import com.novelvision.visualization.jobs.TextSelection;
import com.novelvision.visualization.jobs.VisualizationJob;
import com.novelvision.visualization.logging.LoggingService;
import com.novelvision.visualization.notification.JobProgressEvent;
import com.novelvision.visualization.notification.ProgressNotifier;
import com.novelvision.visualization.provider.ProviderGateway;
import com.novelvision.visualization.provider.ProviderType;
import com.novelvision.visualization.storage.ImageStorage;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Public entry points of the visualization service. Requests are validated against the catalog
 * before anything is stored; accepted requests become {@code PENDING} jobs that the worker pool
 * picks up. No operation here waits for a job to finish.
 *
 * <p>Validation and state errors are thrown synchronously as {@link
 * com.novelvision.visualization.exception.VisualizationException} subclasses.
 */
public class VisualizationOrchestrator {
  private static final org.slf4j.Logger log =
      LoggingService.getLogger(VisualizationOrchestrator.class);

  private static final Set<JobStatus> PROCESSING_STATES =
      EnumSet.of(
          JobStatus.QUEUED, JobStatus.GENERATING_PROMPT, JobStatus.PROCESSING, JobStatus.UPLOADING);
  private static final Set<JobStatus> FINAL_STATES =
      EnumSet.of(JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED);
  private static final Comparator<VisualizationJob> NEWEST_FIRST =
      Comparator.comparing(VisualizationJob::createdAt).reversed();

  private final JobStore store;
  private final CatalogClient catalog;
  private final ProviderGateway gateway;
  private final ImageStorage storage;
  private final ProgressNotifier notifier;
  private final RetryPolicy retryPolicy;
  private final JobPriorities priorities;
  private final int workerCount;
  private final Clock clock;

  public VisualizationOrchestrator(
      JobStore store,
      CatalogClient catalog,
      ProviderGateway gateway,
      ImageStorage storage,
      ProgressNotifier notifier,
      RetryPolicy retryPolicy,
      JobPriorities priorities,
      int workerCount,
      Clock clock) {
    this.store = store;
    this.catalog = catalog;
    this.gateway = gateway;
    this.storage = storage;
    this.notifier = notifier;
    this.retryPolicy = retryPolicy;
    this.priorities = priorities;
    this.workerCount = Math.max(1, workerCount);
    this.clock = clock;
  }

  // ---------------------------------------------------------------------------------------------
  // Job creation
  // ---------------------------------------------------------------------------------------------

  /**
   * Request an illustration of a whole page.
   *
   * @throws InvalidTargetException if the page does not exist, belongs to another book, or the
   *     book is not published or has visualization disabled
   * @throws AlreadyInProgressException if an active job already targets the page
   */
  public VisualizationJob requestPageVisualization(
      String bookId,
      String pageId,
      String userId,
      String preferredProvider,
      GenerationParameters parameters) {
    requireText(bookId, "bookId");
    requireText(pageId, "pageId");
    requireText(userId, "userId");
    ProviderType provider = ProviderType.parse(preferredProvider);
    log.info("Page visualization requested: book {}, page {}, user {}", bookId, pageId, userId);

    PageInfo page = requirePage(bookId, pageId);
    BookVisualizationSettings settings = requireEligibleBook(bookId);

    VisualizationJob job =
        newJob(JobTrigger.PAGE_REQUEST, bookId, userId, provider, parameters, settings)
            .pageId(pageId)
            .chapterId(page.chapterId())
            .build();
    return accept(job);
  }

  /** Text selection request without a page reference. */
  public VisualizationJob requestTextSelectionVisualization(
      String bookId,
      TextSelection selection,
      String userId,
      String preferredProvider,
      GenerationParameters parameters) {
    return requestTextSelectionVisualization(
        bookId, null, selection, userId, preferredProvider, parameters);
  }

  /**
   * Request an illustration of a text span.
   *
   * @param pageId optional page the selection was made on
   * @throws ValidationException if offsets are inconsistent or the selected text is shorter than
   *     {@value TextSelection#MIN_SELECTION_LENGTH} or longer than {@value
   *     TextSelection#MAX_SELECTION_LENGTH} characters
   */
  public VisualizationJob requestTextSelectionVisualization(
      String bookId,
      String pageId,
      TextSelection selection,
      String userId,
      String preferredProvider,
      GenerationParameters parameters) {
    requireText(bookId, "bookId");
    requireText(userId, "userId");
    validateSelection(selection);
    ProviderType provider = ProviderType.parse(preferredProvider);
    log.info(
        "Text selection visualization requested: book {}, page {}, user {}, {} chars",
        bookId,
        pageId,
        userId,
        selection.selectedText().length());

    String chapterId = null;
    if (pageId != null && !pageId.isBlank()) {
      chapterId = requirePage(bookId, pageId).chapterId();
    }
    BookVisualizationSettings settings = requireEligibleBook(bookId);

    VisualizationJob job =
        newJob(JobTrigger.TEXT_SELECTION_REQUEST, bookId, userId, provider, parameters, settings)
            .pageId(pageId == null || pageId.isBlank() ? null : pageId)
            .chapterId(chapterId)
            .textSelection(selection)
            .build();
    return accept(job);
  }

  /**
   * Create one {@code AUTO_NOVEL} job per page of the book lacking an image: every page for
   * per-page books, visualization points otherwise. Pages with an active job are skipped and
   * reported, not treated as errors.
   */
  public AutoNovelResult startAutoNovelGeneration(
      String bookId, String userId, String preferredProvider) {
    requireText(bookId, "bookId");
    requireText(userId, "userId");
    ProviderType provider = ProviderType.parse(preferredProvider);
    BookVisualizationSettings settings = requireEligibleBook(bookId);
    log.info(
        "Auto-novel generation requested: book {}, user {}, mode {}",
        bookId,
        userId,
        settings.primaryMode());

    Set<String> pagesWithImages =
        store
            .find(
                j ->
                    bookId.equals(j.bookId())
                        && j.pageId() != null
                        && j.status() == JobStatus.COMPLETED
                        && j.trigger().isWholePage()
                        && j.hasImages())
            .stream()
            .map(VisualizationJob::pageId)
            .collect(Collectors.toSet());

    List<VisualizationJob> created = new ArrayList<>();
    List<String> skipped = new ArrayList<>();
    List<String> alreadyVisualized = new ArrayList<>();
    for (PageInfo page : catalog.getBookPages(bookId)) {
      if (!settings.coversEveryPage() && !page.visualizationPoint()) {
        continue;
      }
      if (page.hasVisualization() || pagesWithImages.contains(page.pageId())) {
        alreadyVisualized.add(page.pageId());
        continue;
      }
      VisualizationJob job =
          newJob(JobTrigger.AUTO_NOVEL, bookId, userId, provider, null, settings)
              .pageId(page.pageId())
              .chapterId(page.chapterId())
              .build();
      try {
        created.add(accept(job));
      } catch (AlreadyInProgressException e) {
        skipped.add(page.pageId());
      }
    }
    log.info(
        "Auto-novel for book {}: {} job(s) created, {} in flight, {} already visualized",
        bookId,
        created.size(),
        skipped.size(),
        alreadyVisualized.size());
    return new AutoNovelResult(bookId, created, skipped, alreadyVisualized);
  }

  /**
   * Create a fresh job for the same target as a completed one. The original is left untouched.
   *
   * @throws InvalidStateException unless the original job is {@code COMPLETED}
   */
  public VisualizationJob regenerate(String originalJobId, String userId) {
    requireText(userId, "userId");
    VisualizationJob original = requireJob(originalJobId);
    if (original.status() != JobStatus.COMPLETED) {
      throw new InvalidStateException(
              "Only completed jobs can be regenerated, job is " + original.status())
          .withContext("jobId", originalJobId);
    }
    log.info("Regeneration of job {} requested by {}", originalJobId, userId);
    VisualizationJob job =
        VisualizationJob.builder()
            .id(UUID.randomUUID().toString())
            .bookId(original.bookId())
            .chapterId(original.chapterId())
            .pageId(original.pageId())
            .trigger(original.trigger())
            .userId(userId)
            .status(JobStatus.PENDING)
            .preferredProvider(original.preferredProvider())
            .priority(original.priority())
            .textSelection(original.textSelection())
            .parameters(original.parameters())
            .createdAt(clock.instant())
            .regeneratedFrom(original.id())
            .build();
    return accept(job);
  }

  // ---------------------------------------------------------------------------------------------
  // Lifecycle control
  // ---------------------------------------------------------------------------------------------

  /**
   * Cancel a job that has not started external work.
   *
   * @return {@code true} once the job is {@code CANCELLED}
   * @throws InvalidStateException if the job is past {@code QUEUED} or already final
   */
  public boolean cancelJob(String jobId, Caller caller, String reason) {
    VisualizationJob job = requireJob(jobId);
    caller.checkAccess(job, "cancel");
    if (!job.canCancel()) {
      throw new InvalidStateException("Job " + jobId + " cannot be cancelled in " + job.status())
          .withContext("jobId", jobId)
          .withContext("status", job.status());
    }
    VisualizationJob cancelled =
        store.transition(
            jobId,
            EnumSet.of(JobStatus.PENDING, JobStatus.QUEUED),
            JobStatus.CANCELLED,
            b -> b.cancelReason(reason).completedAt(clock.instant()));
    log.info("Job {} cancelled by {}: {}", jobId, caller.userId(), reason);
    publish(cancelled, reason == null ? "Cancelled" : "Cancelled: " + reason);
    return true;
  }

  /**
   * Put a failed or cancelled job back in the queue.
   *
   * @throws RetryLimitExceededException once the retry ceiling is reached, or when a job rejected
   *     by its provider already used its one user retry
   */
  public boolean retryJob(String jobId, Caller caller) {
    VisualizationJob job = requireJob(jobId);
    caller.checkAccess(job, "retry");
    if (!job.canRetry()) {
      throw new InvalidStateException("Job " + jobId + " cannot be retried in " + job.status())
          .withContext("jobId", jobId);
    }
    if (!retryPolicy.hasRetriesLeft(job)) {
      throw new RetryLimitExceededException(
              "Job " + jobId + " reached the retry limit of " + retryPolicy.maxRetries())
          .withContext("jobId", jobId)
          .withContext("retryCount", job.retryCount());
    }
    boolean permanent = job.errorCode() == VisualizationErrorCode.PERMANENT_ERROR;
    if (permanent && job.permanentRetryUsed()) {
      throw new RetryLimitExceededException(
              "Job " + jobId + " was rejected by its provider again, no further retries")
          .withContext("jobId", jobId);
    }
    VisualizationJob retried =
        store.transition(
            jobId,
            EnumSet.of(JobStatus.FAILED, JobStatus.CANCELLED),
            JobStatus.PENDING,
            b ->
                b.resetForRetry()
                    .retryCount(job.retryCount() + 1)
                    .permanentRetryUsed(job.permanentRetryUsed() || permanent));
    log.info("Job {} retried by {} (attempt {})", jobId, caller.userId(), retried.retryCount());
    publish(retried, "Retry requested");
    return true;
  }

  // ---------------------------------------------------------------------------------------------
  // Images
  // ---------------------------------------------------------------------------------------------

  /** Make another image of a completed job the canonical one and update the page. */
  public VisualizationJob selectImage(String jobId, String imageId, Caller caller) {
    VisualizationJob job = requireJob(jobId);
    caller.checkAccess(job, "update");
    requireActiveImage(job, imageId);
    VisualizationJob updated =
        store.update(
            jobId,
            EnumSet.of(JobStatus.COMPLETED),
            b -> b.images(reselect(job.images(), imageId)).selectedImageId(imageId));
    log.info("Job {}: image {} selected by {}", jobId, imageId, caller.userId());
    writeBack(updated);
    return updated;
  }

  /**
   * Soft-delete an image and remove its stored file. When the selected image goes, the first
   * remaining image takes its place.
   */
  public VisualizationJob deleteImage(String jobId, String imageId, Caller caller) {
    VisualizationJob job = requireJob(jobId);
    caller.checkAccess(job, "update");
    GeneratedImage image = requireActiveImage(job, imageId);

    VisualizationJob updated =
        store.update(
            jobId,
            FINAL_STATES,
            b -> {
              List<GeneratedImage> images = new ArrayList<>();
              for (GeneratedImage i : job.images()) {
                images.add(i.id().equals(imageId) ? i.asDeleted() : i);
              }
              String selected = job.selectedImageId();
              if (imageId.equals(selected)) {
                selected =
                    images.stream()
                        .filter(i -> !i.deleted())
                        .map(GeneratedImage::id)
                        .findFirst()
                        .orElse(null);
                images = reselect(images, selected);
              }
              return b.images(images).selectedImageId(selected);
            });
    storage.delete(image.storageKey());
    log.info("Job {}: image {} deleted by {}", jobId, imageId, caller.userId());
    if (!Objects.equals(job.selectedImageId(), updated.selectedImageId())) {
      writeBack(updated);
    }
    return updated;
  }

  /** Remove a final job together with its images. */
  public void deleteJob(String jobId, Caller caller) {
    VisualizationJob job = requireJob(jobId);
    caller.checkAccess(job, "delete");
    if (!job.isFinal()) {
      throw new InvalidStateException("Job " + jobId + " is still " + job.status())
          .withContext("jobId", jobId);
    }
    // Re-checked on removal, the job may have been requeued since it was read.
    VisualizationJob removed = store.delete(jobId, FINAL_STATES).orElse(job);
    for (GeneratedImage image : removed.images()) {
      if (!image.deleted()) {
        storage.delete(image.storageKey());
      }
    }
    log.info("Job {} deleted by {}", jobId, caller.userId());
  }

  // ---------------------------------------------------------------------------------------------
  // Queries
  // ---------------------------------------------------------------------------------------------

  public JobStatusView getJobStatus(String jobId) {
    return JobStatusView.from(requireJob(jobId));
  }

  public VisualizationJob getJob(String jobId) {
    return requireJob(jobId);
  }

  /** Most recent jobs of a user, newest first. */
  public List<VisualizationJob> getUserJobs(String userId, int limit) {
    requireText(userId, "userId");
    return store.find(j -> userId.equals(j.userId())).stream()
        .sorted(NEWEST_FIRST)
        .limit(Math.max(0, limit))
        .toList();
  }

  public List<VisualizationJob> getBookJobs(String bookId) {
    requireText(bookId, "bookId");
    return store.find(j -> bookId.equals(j.bookId())).stream().sorted(NEWEST_FIRST).toList();
  }

  /** Live images generated for a page, newest job first. */
  public List<GeneratedImage> getPageImages(String pageId) {
    requireText(pageId, "pageId");
    return store
        .find(j -> pageId.equals(j.pageId()) && j.status() == JobStatus.COMPLETED)
        .stream()
        .sorted(NEWEST_FIRST)
        .flatMap(j -> j.activeImages().stream())
        .toList();
  }

  /**
   * Queue counters, plus position and estimated wait for {@code jobId} when it is pending. The
   * estimate assumes the workers drain the jobs ahead evenly at the provider's average pace.
   */
  public QueueStatus getQueueStatus(String jobId) {
    List<VisualizationJob> pending = store.find(j -> j.status() == JobStatus.PENDING);
    int processing = store.find(j -> PROCESSING_STATES.contains(j.status())).size();
    if (jobId == null) {
      return new QueueStatus(pending.size(), processing, null, null);
    }
    VisualizationJob job = requireJob(jobId);
    if (job.status() != JobStatus.PENDING) {
      return new QueueStatus(pending.size(), processing, null, null);
    }
    int position = 1;
    for (VisualizationJob candidate : pending) {
      if (candidate.id().equals(jobId)) break;
      position++;
    }
    ProviderType provider = gateway.resolve(job.preferredProvider());
    int seconds = provider == null ? 0 : provider.averageGenerationSeconds();
    long rounds = (position + workerCount - 1) / workerCount;
    return new QueueStatus(
        pending.size(), processing, position, Duration.ofSeconds(rounds * seconds));
  }

  // ---------------------------------------------------------------------------------------------

  private VisualizationJob.Builder newJob(
      JobTrigger trigger,
      String bookId,
      String userId,
      ProviderType provider,
      GenerationParameters parameters,
      BookVisualizationSettings settings) {
    ProviderType effective = provider;
    if (effective == null && settings.preferredProvider() != null) {
      effective = ProviderType.fromApiName(settings.preferredProvider()).orElse(null);
    }
    GenerationParameters params =
        parameters == null ? GenerationParameters.defaults() : parameters;
    if (params.style() == null && settings.preferredStyle() != null) {
      params = params.withStyle(settings.preferredStyle());
    }
    return VisualizationJob.builder()
        .id(UUID.randomUUID().toString())
        .bookId(bookId)
        .trigger(trigger)
        .userId(userId)
        .status(JobStatus.PENDING)
        .preferredProvider(effective)
        .priority(priorities.forTrigger(trigger))
        .parameters(params)
        .createdAt(clock.instant());
  }

  private VisualizationJob accept(VisualizationJob job) {
    VisualizationJob stored = store.insert(job);
    log.info("Job {} created ({}, priority {})", stored.id(), stored.trigger(), stored.priority());
    publish(stored, "Queued for generation");
    return stored;
  }

  private PageInfo requirePage(String bookId, String pageId) {
    PageInfo page =
        catalog
            .getPage(pageId)
            .orElseThrow(() -> new InvalidTargetException("Page " + pageId + " not found"));
    if (page.bookId() != null && !bookId.equals(page.bookId())) {
      throw new InvalidTargetException("Page " + pageId + " does not belong to book " + bookId)
          .withContext("pageId", pageId)
          .withContext("bookId", bookId);
    }
    return page;
  }

  private BookVisualizationSettings requireEligibleBook(String bookId) {
    BookVisualizationSettings settings =
        catalog
            .getBookVisualizationSettings(bookId)
            .orElseThrow(() -> new InvalidTargetException("Book " + bookId + " not found"));
    if (!settings.published()) {
      throw new InvalidTargetException("Book " + bookId + " is not published")
          .withContext("bookId", bookId);
    }
    if (!settings.enabled()) {
      throw new InvalidTargetException("Visualization is disabled for book " + bookId)
          .withContext("bookId", bookId);
    }
    return settings;
  }

  private VisualizationJob requireJob(String jobId) {
    requireText(jobId, "jobId");
    return store
        .get(jobId)
        .orElseThrow(
            () -> new NotFoundException("Job " + jobId + " not found").withContext("jobId", jobId));
  }

  private static GeneratedImage requireActiveImage(VisualizationJob job, String imageId) {
    return job.image(imageId)
        .filter(i -> !i.deleted())
        .orElseThrow(
            () ->
                new NotFoundException("Image " + imageId + " not found in job " + job.id())
                    .withContext("imageId", imageId));
  }

  private static List<GeneratedImage> reselect(List<GeneratedImage> images, String selectedId) {
    List<GeneratedImage> result = new ArrayList<>(images.size());
    for (GeneratedImage image : images) {
      result.add(image.withSelected(image.id().equals(selectedId)));
    }
    return result;
  }

  private static void validateSelection(TextSelection selection) {
    if (selection == null || selection.selectedText() == null) {
      throw new ValidationException("A text selection is required");
    }
    if (selection.startOffset() < 0 || selection.startOffset() >= selection.endOffset()) {
      throw new ValidationException(
          "Selection start must be non-negative and before its end ("
              + selection.startOffset()
              + ", "
              + selection.endOffset()
              + ")");
    }
    int length = selection.selectedText().length();
    if (length < TextSelection.MIN_SELECTION_LENGTH
        || length > TextSelection.MAX_SELECTION_LENGTH) {
      throw new ValidationException(
          "Selected text must be between "
              + TextSelection.MIN_SELECTION_LENGTH
              + " and "
              + TextSelection.MAX_SELECTION_LENGTH
              + " characters, got "
              + length);
    }
  }

  private static void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new ValidationException(name + " is required");
    }
  }

  private void writeBack(VisualizationJob job) {
    if (job.pageId() == null) return;
    job.selectedImage()
        .ifPresent(
            image -> {
              try {
                catalog.setPageVisualization(
                    job.bookId(),
                    job.chapterId(),
                    job.pageId(),
                    image.url(),
                    image.thumbnailUrl(),
                    job.id());
              } catch (RuntimeException e) {
                log.warn("Catalog write-back failed for job {}: {}", job.id(), e.getMessage());
              }
            });
  }

  private void publish(VisualizationJob job, String message) {
    try {
      notifier.publish(JobProgressEvent.of(job, message));
    } catch (RuntimeException e) {
      log.warn("Progress notification for job {} failed: {}", job.id(), e.toString());
    }
  }
}
