package com.novelvision.visualization.pipeline;

import com.novelvision.visualization.catalog.CatalogClient;
import com.novelvision.visualization.catalog.PageInfo;
import com.novelvision.visualization.exception.AlreadyInProgressException;
import com.novelvision.visualization.exception.ExceptionUtil;
import com.novelvision.visualization.exception.InvalidStateException;
import com.novelvision.visualization.exception.InvalidTargetException;
import com.novelvision.visualization.exception.NotFoundException;
import com.novelvision.visualization.exception.ProviderException;
import com.novelvision.visualization.exception.VisualizationErrorCode;
import com.novelvision.visualization.exception.VisualizationException;
import com.novelvision.visualization.jobs.GeneratedImage;
import com.novelvision.visualization.jobs.JobClaim;
import com.novelvision.visualization.jobs.JobStatus;
import com.novelvision.visualization.jobs.JobStore;
import com.novelvision.visualization.jobs.PromptData;
import com.novelvision.visualization.jobs.RetryPolicy;
import com.novelvision.visualization.jobs.VisualizationJob;
import com.novelvision.visualization.logging.LoggingService;
import com.novelvision.visualization.notification.JobProgressEvent;
import com.novelvision.visualization.notification.ProgressNotifier;
import com.novelvision.visualization.prompt.PromptResult;
import com.novelvision.visualization.prompt.PromptSynthesizer;
import com.novelvision.visualization.provider.ImageData;
import com.novelvision.visualization.provider.ImageResult;
import com.novelvision.visualization.provider.ProviderGateway;
import com.novelvision.visualization.provider.ProviderType;
import com.novelvision.visualization.storage.ImageStorage;
import com.novelvision.visualization.storage.StoredImage;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Drives one claimed job through {@code GENERATING_PROMPT -> PROCESSING -> UPLOADING ->
 * COMPLETED}. Every transition is stored before the next external call, and a progress event goes
 * out after each one.
 *
 * <p>{@link #execute} never throws. Stage failures end in {@code FAILED} with the error recorded
 * on the job; transient ones are requeued with a backoff while retries remain.
 */
public class PipelineExecutor {
  private static final org.slf4j.Logger log = LoggingService.getLogger(PipelineExecutor.class);

  private final JobStore store;
  private final PromptSynthesizer prompts;
  private final ProviderGateway gateway;
  private final ImageStorage storage;
  private final CatalogClient catalog;
  private final ProgressNotifier notifier;
  private final RetryPolicy retryPolicy;
  private final Clock clock;

  public PipelineExecutor(
      JobStore store,
      PromptSynthesizer prompts,
      ProviderGateway gateway,
      ImageStorage storage,
      CatalogClient catalog,
      ProgressNotifier notifier,
      RetryPolicy retryPolicy,
      Clock clock) {
    this.store = store;
    this.prompts = prompts;
    this.gateway = gateway;
    this.storage = storage;
    this.catalog = catalog;
    this.notifier = notifier;
    this.retryPolicy = retryPolicy;
    this.clock = clock;
  }

  /**
   * Run the pipeline for a job a worker has claimed ({@code QUEUED}); a {@code PENDING} job is
   * moved to {@code QUEUED} first.
   *
   * @return the job's snapshot when the pipeline stopped
   */
  public VisualizationJob execute(VisualizationJob claimed) {
    String jobId = claimed.id();
    JobClaim claim = JobClaim.of(claimed);
    try {
      VisualizationJob job = claimed;
      if (job.status() == JobStatus.PENDING) {
        Instant claimedAt = now();
        job =
            advance(
                jobId,
                JobClaim.of(job),
                JobStatus.PENDING,
                JobStatus.QUEUED,
                b -> b.claimedAt(claimedAt),
                null);
      }
      claim = JobClaim.of(job);
      job = generatePrompt(job, claim);
      // Failed or requeued while preparing the prompt.
      if (job.status() != JobStatus.PROCESSING) return job;
      ImageResult result = callProvider(job, claim);
      if (result == null) return current(jobId, job);
      return upload(job, claim, result);
    } catch (InvalidStateException | NotFoundException e) {
      // Moved or removed by someone else, e.g. lease recovery; their state wins.
      log.warn("Job {} left the pipeline: {}", jobId, e.getMessage());
      return current(jobId, claimed);
    } catch (Exception e) {
      log.error("Unexpected pipeline failure for job {}", jobId, e);
      VisualizationJob latest = current(jobId, claimed);
      if (!latest.isFinal() && claim.holds(latest)) {
        return fail(
            latest,
            claim,
            e,
            VisualizationErrorCode.UNKNOWN,
            ExceptionUtil.extractErrorMessage(e));
      }
      return latest;
    }
  }

  private VisualizationJob generatePrompt(VisualizationJob job, JobClaim claim) {
    Instant started = now();
    job =
        advance(
            job.id(),
            claim,
            JobStatus.QUEUED,
            JobStatus.GENERATING_PROMPT,
            b -> b.processingStartedAt(started),
            "Generating prompt");

    String sourceText;
    try {
      sourceText = sourceText(job);
    } catch (InvalidTargetException e) {
      return fail(job, claim, e, e.getCode(), e.getMessage());
    } catch (RuntimeException e) {
      return fail(
          job,
          claim,
          e,
          VisualizationErrorCode.TRANSIENT_ERROR,
          "Could not load page content: " + ExceptionUtil.extractErrorMessage(e));
    }

    ProviderType target = gateway.resolve(job.preferredProvider());
    PromptResult result;
    try {
      result = prompts.enhance(job.bookId(), sourceText, job.parameters().style(), target);
    } catch (RuntimeException e) {
      // Prompt synthesis failures are always worth another attempt.
      return fail(
          job,
          claim,
          e,
          VisualizationErrorCode.TRANSIENT_ERROR,
          "Prompt generation failed: " + ExceptionUtil.extractErrorMessage(e));
    }

    PromptData promptData =
        new PromptData(
            sourceText,
            result.enhancedPrompt(),
            result.negativePrompt(),
            result.style() != null ? result.style() : job.parameters().style(),
            result.targetModel() != null ? result.targetModel() : target.apiName());
    return advance(
        job.id(),
        claim,
        JobStatus.GENERATING_PROMPT,
        JobStatus.PROCESSING,
        b -> b.promptData(promptData),
        "Generating image with " + target.displayName());
  }

  private ImageResult callProvider(VisualizationJob job, JobClaim claim) {
    PromptData promptData = job.promptData();
    try {
      return gateway.generate(
          promptData.enhancedPrompt(),
          promptData.negativePrompt(),
          job.parameters(),
          job.preferredProvider());
    } catch (ProviderException e) {
      fail(job, claim, e, e.getCode(), e.taggedMessage());
      return null;
    } catch (VisualizationException e) {
      fail(job, claim, e, e.getCode(), ExceptionUtil.extractErrorMessage(e));
      return null;
    }
  }

  private VisualizationJob upload(VisualizationJob job, JobClaim claim, ImageResult result) {
    job =
        advance(
            job.id(),
            claim,
            JobStatus.PROCESSING,
            JobStatus.UPLOADING,
            null,
            "Storing generated image");

    List<GeneratedImage> stored = new ArrayList<>();
    RuntimeException lastFailure = null;
    for (ImageData data : result.images()) {
      try {
        StoredImage image = storage.store(job.bookId(), job.id(), data);
        stored.add(
            new GeneratedImage(
                UUID.randomUUID().toString(),
                image.url(),
                image.thumbnailUrl(),
                image.storageKey(),
                image.width(),
                image.height(),
                image.sizeBytes(),
                image.format(),
                result.provider(),
                now(),
                false,
                false));
      } catch (RuntimeException e) {
        lastFailure = e;
        log.warn("Job {}: storing one image failed: {}", job.id(), e.getMessage());
      }
    }
    if (stored.isEmpty()) {
      RuntimeException cause =
          lastFailure != null
              ? lastFailure
              : new VisualizationException(
                  VisualizationErrorCode.TRANSIENT_ERROR, "Provider returned no images");
      return fail(
          job,
          claim,
          cause,
          VisualizationErrorCode.TRANSIENT_ERROR,
          "Upload failed: " + ExceptionUtil.extractErrorMessage(cause));
    }

    boolean selectFirst = job.selectedImage().isEmpty();
    Instant completed = now();
    VisualizationJob done =
        advance(
            job.id(),
            claim,
            JobStatus.UPLOADING,
            JobStatus.COMPLETED,
            b -> {
              for (int i = 0; i < stored.size(); i++) {
                GeneratedImage image = stored.get(i);
                b.addImage(selectFirst && i == 0 ? image.withSelected(true) : image);
              }
              if (selectFirst) {
                b.selectedImageId(stored.get(0).id());
              }
              return b.errorMessage(null).errorCode(null).completedAt(completed);
            },
            "Visualization completed");
    writeBack(done);
    return done;
  }

  private String sourceText(VisualizationJob job) {
    if (job.textSelection() != null) {
      return job.textSelection().fullContext();
    }
    PageInfo page =
        catalog
            .getPage(job.pageId())
            .orElseThrow(() -> new InvalidTargetException("Page " + job.pageId() + " not found"));
    if (page.content() == null || page.content().isBlank()) {
      throw new InvalidTargetException("Page " + job.pageId() + " has no text");
    }
    return page.content();
  }

  /** Page write-back; failures are logged and leave the job untouched. */
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

  /**
   * Record a failure on the job and, when automatic retry is on, requeue transient failures with
   * retries left behind the configured backoff. A requeued job keeps the error until it completes.
   */
  private VisualizationJob fail(
      VisualizationJob job,
      JobClaim claim,
      Throwable cause,
      VisualizationErrorCode code,
      String message) {
    log.warn(
        "Job {} failed in {}: {} ({})",
        job.id(),
        job.status(),
        message,
        ExceptionUtil.whereThrown(cause, 3));
    VisualizationJob failed;
    try {
      failed =
          store.transition(
              job.id(),
              EnumSet.of(job.status()),
              claim,
              JobStatus.FAILED,
              b -> b.errorMessage(message).errorCode(code).completedAt(now()));
    } catch (InvalidStateException e) {
      log.warn("Job {} could not be marked failed: {}", job.id(), e.getMessage());
      return current(job.id(), job);
    }
    publish(failed, "Failed: " + message);

    if (code == null
        || !code.isAutoRetryable()
        || !retryPolicy.autoRetryEnabled()
        || !retryPolicy.hasRetriesLeft(failed)) {
      return failed;
    }
    Instant availableAt = now().plus(retryPolicy.backoff());
    try {
      VisualizationJob requeued =
          store.transition(
              failed.id(),
              EnumSet.of(JobStatus.FAILED),
              claim,
              JobStatus.PENDING,
              b ->
                  b.resetForRetry()
                      .errorMessage(message)
                      .errorCode(code)
                      .retryCount(failed.retryCount() + 1)
                      .availableAt(availableAt));
      publish(
          requeued,
          "Retry %d/%d scheduled after: %s"
              .formatted(requeued.retryCount(), retryPolicy.maxRetries(), message));
      return requeued;
    } catch (AlreadyInProgressException | InvalidStateException e) {
      log.info("Job {} stays failed, automatic retry skipped: {}", failed.id(), e.getMessage());
      return failed;
    }
  }

  private VisualizationJob advance(
      String jobId,
      JobClaim claim,
      JobStatus from,
      JobStatus to,
      UnaryOperator<VisualizationJob.Builder> mutator,
      String message) {
    VisualizationJob job = store.transition(jobId, EnumSet.of(from), claim, to, mutator);
    log.debug("Job {} {} -> {}", jobId, from, to);
    publish(job, message);
    return job;
  }

  private void publish(VisualizationJob job, String message) {
    try {
      notifier.publish(JobProgressEvent.of(job, message));
    } catch (RuntimeException e) {
      log.warn("Progress notification for job {} failed: {}", job.id(), e.toString());
    }
  }

  private VisualizationJob current(String jobId, VisualizationJob fallback) {
    return store.get(jobId).orElse(fallback);
  }

  private Instant now() {
    return clock.instant();
  }
}
