package com.novelvision.visualization.jobs;

import com.novelvision.visualization.exception.ValidationException;
import com.novelvision.visualization.exception.VisualizationErrorCode;
import com.novelvision.visualization.provider.ProviderType;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a visualization job. The {@link JobStore} replaces snapshots atomically;
 * every accepted replacement bumps {@link #version()}.
 */
public final class VisualizationJob {
  private final String id;
  private final String bookId;
  private final String chapterId;
  private final String pageId;
  private final JobTrigger trigger;
  private final String userId;
  private final JobStatus status;
  private final ProviderType preferredProvider;
  private final int priority;
  private final PromptData promptData;
  private final TextSelection textSelection;
  private final GenerationParameters parameters;
  private final String errorMessage;
  private final VisualizationErrorCode errorCode;
  private final int retryCount;
  private final boolean permanentRetryUsed;
  private final String cancelReason;
  private final Instant createdAt;
  private final Instant processingStartedAt;
  private final Instant completedAt;
  private final Instant availableAt;
  private final String claimedBy;
  private final Instant claimedAt;
  private final List<GeneratedImage> images;
  private final String selectedImageId;
  private final String regeneratedFrom;
  private final long version;

  private VisualizationJob(Builder b) {
    this.id = b.id;
    this.bookId = b.bookId;
    this.chapterId = b.chapterId;
    this.pageId = b.pageId;
    this.trigger = b.trigger;
    this.userId = b.userId;
    this.status = b.status;
    this.preferredProvider = b.preferredProvider;
    this.priority = b.priority;
    this.promptData = b.promptData;
    this.textSelection = b.textSelection;
    this.parameters = b.parameters == null ? GenerationParameters.defaults() : b.parameters;
    this.errorMessage = b.errorMessage;
    this.errorCode = b.errorCode;
    this.retryCount = b.retryCount;
    this.permanentRetryUsed = b.permanentRetryUsed;
    this.cancelReason = b.cancelReason;
    this.createdAt = b.createdAt;
    this.processingStartedAt = b.processingStartedAt;
    this.completedAt = b.completedAt;
    this.availableAt = b.availableAt;
    this.claimedBy = b.claimedBy;
    this.claimedAt = b.claimedAt;
    this.images = Collections.unmodifiableList(new ArrayList<>(b.images));
    this.selectedImageId = b.selectedImageId;
    this.regeneratedFrom = b.regeneratedFrom;
    this.version = b.version;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public String id() {
    return id;
  }

  public String bookId() {
    return bookId;
  }

  public String chapterId() {
    return chapterId;
  }

  public String pageId() {
    return pageId;
  }

  public JobTrigger trigger() {
    return trigger;
  }

  public String userId() {
    return userId;
  }

  public JobStatus status() {
    return status;
  }

  public ProviderType preferredProvider() {
    return preferredProvider;
  }

  public int priority() {
    return priority;
  }

  public PromptData promptData() {
    return promptData;
  }

  public TextSelection textSelection() {
    return textSelection;
  }

  public GenerationParameters parameters() {
    return parameters;
  }

  public String errorMessage() {
    return errorMessage;
  }

  /** Code of the last failure, or {@code null} when the job has not failed. */
  public VisualizationErrorCode errorCode() {
    return errorCode;
  }

  public int retryCount() {
    return retryCount;
  }

  /** Whether the single user retry granted after a permanent provider rejection was spent. */
  public boolean permanentRetryUsed() {
    return permanentRetryUsed;
  }

  public String cancelReason() {
    return cancelReason;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Instant processingStartedAt() {
    return processingStartedAt;
  }

  public Instant completedAt() {
    return completedAt;
  }

  /** Earliest instant a worker may claim the job; {@code null} means immediately. */
  public Instant availableAt() {
    return availableAt;
  }

  public String claimedBy() {
    return claimedBy;
  }

  public Instant claimedAt() {
    return claimedAt;
  }

  /** All images in generation order, soft-deleted ones included. */
  public List<GeneratedImage> images() {
    return images;
  }

  public List<GeneratedImage> activeImages() {
    return images.stream().filter(i -> !i.deleted()).toList();
  }

  public String selectedImageId() {
    return selectedImageId;
  }

  public Optional<GeneratedImage> selectedImage() {
    if (selectedImageId == null) return Optional.empty();
    return images.stream()
        .filter(i -> !i.deleted() && i.id().equals(selectedImageId))
        .findFirst();
  }

  public Optional<GeneratedImage> image(String imageId) {
    return images.stream().filter(i -> i.id().equals(imageId)).findFirst();
  }

  /** Id of the completed job this one was regenerated from, if any. */
  public String regeneratedFrom() {
    return regeneratedFrom;
  }

  public long version() {
    return version;
  }

  public boolean canCancel() {
    return status.canCancel();
  }

  public boolean canRetry() {
    return status.canRetry();
  }

  public boolean isFinal() {
    return status.isFinal();
  }

  public boolean hasImages() {
    return images.stream().anyMatch(i -> !i.deleted());
  }

  public boolean isOwnedBy(String user) {
    return userId.equals(user);
  }

  /**
   * Whether this job and {@code other} may not both be active: same page, competing triggers, both
   * non-terminal, different identities.
   */
  public boolean conflictsWith(VisualizationJob other) {
    return other != null
        && !id.equals(other.id)
        && !status.isFinal()
        && !other.status.isFinal()
        && pageId != null
        && pageId.equals(other.pageId)
        && bookId.equals(other.bookId)
        && trigger.sharesSlotWith(other.trigger);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof VisualizationJob that)) return false;
    return version == that.version && id.equals(that.id);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, version);
  }

  @Override
  public String toString() {
    return "VisualizationJob{id="
        + id
        + ", book="
        + bookId
        + ", page="
        + pageId
        + ", trigger="
        + trigger
        + ", status="
        + status
        + ", retries="
        + retryCount
        + ", v"
        + version
        + '}';
  }

  public static final class Builder {
    private String id;
    private String bookId;
    private String chapterId;
    private String pageId;
    private JobTrigger trigger;
    private String userId;
    private JobStatus status = JobStatus.PENDING;
    private ProviderType preferredProvider;
    private int priority;
    private PromptData promptData;
    private TextSelection textSelection;
    private GenerationParameters parameters;
    private String errorMessage;
    private VisualizationErrorCode errorCode;
    private int retryCount;
    private boolean permanentRetryUsed;
    private String cancelReason;
    private Instant createdAt;
    private Instant processingStartedAt;
    private Instant completedAt;
    private Instant availableAt;
    private String claimedBy;
    private Instant claimedAt;
    private List<GeneratedImage> images = new ArrayList<>();
    private String selectedImageId;
    private String regeneratedFrom;
    private long version;

    private Builder() {}

    private Builder(VisualizationJob j) {
      this.id = j.id;
      this.bookId = j.bookId;
      this.chapterId = j.chapterId;
      this.pageId = j.pageId;
      this.trigger = j.trigger;
      this.userId = j.userId;
      this.status = j.status;
      this.preferredProvider = j.preferredProvider;
      this.priority = j.priority;
      this.promptData = j.promptData;
      this.textSelection = j.textSelection;
      this.parameters = j.parameters;
      this.errorMessage = j.errorMessage;
      this.errorCode = j.errorCode;
      this.retryCount = j.retryCount;
      this.permanentRetryUsed = j.permanentRetryUsed;
      this.cancelReason = j.cancelReason;
      this.createdAt = j.createdAt;
      this.processingStartedAt = j.processingStartedAt;
      this.completedAt = j.completedAt;
      this.availableAt = j.availableAt;
      this.claimedBy = j.claimedBy;
      this.claimedAt = j.claimedAt;
      this.images = new ArrayList<>(j.images);
      this.selectedImageId = j.selectedImageId;
      this.regeneratedFrom = j.regeneratedFrom;
      this.version = j.version;
    }

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder bookId(String bookId) {
      this.bookId = bookId;
      return this;
    }

    public Builder chapterId(String chapterId) {
      this.chapterId = chapterId;
      return this;
    }

    public Builder pageId(String pageId) {
      this.pageId = pageId;
      return this;
    }

    public Builder trigger(JobTrigger trigger) {
      this.trigger = trigger;
      return this;
    }

    public Builder userId(String userId) {
      this.userId = userId;
      return this;
    }

    public Builder status(JobStatus status) {
      this.status = status;
      return this;
    }

    public Builder preferredProvider(ProviderType preferredProvider) {
      this.preferredProvider = preferredProvider;
      return this;
    }

    public Builder priority(int priority) {
      this.priority = priority;
      return this;
    }

    public Builder promptData(PromptData promptData) {
      this.promptData = promptData;
      return this;
    }

    public Builder textSelection(TextSelection textSelection) {
      this.textSelection = textSelection;
      return this;
    }

    public Builder parameters(GenerationParameters parameters) {
      this.parameters = parameters;
      return this;
    }

    public Builder errorMessage(String errorMessage) {
      this.errorMessage = errorMessage;
      return this;
    }

    public Builder errorCode(VisualizationErrorCode errorCode) {
      this.errorCode = errorCode;
      return this;
    }

    public Builder retryCount(int retryCount) {
      this.retryCount = retryCount;
      return this;
    }

    public Builder permanentRetryUsed(boolean permanentRetryUsed) {
      this.permanentRetryUsed = permanentRetryUsed;
      return this;
    }

    public Builder cancelReason(String cancelReason) {
      this.cancelReason = cancelReason;
      return this;
    }

    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public Builder processingStartedAt(Instant processingStartedAt) {
      this.processingStartedAt = processingStartedAt;
      return this;
    }

    public Builder completedAt(Instant completedAt) {
      this.completedAt = completedAt;
      return this;
    }

    public Builder availableAt(Instant availableAt) {
      this.availableAt = availableAt;
      return this;
    }

    public Builder claimedBy(String claimedBy) {
      this.claimedBy = claimedBy;
      return this;
    }

    public Builder claimedAt(Instant claimedAt) {
      this.claimedAt = claimedAt;
      return this;
    }

    public Builder images(List<GeneratedImage> images) {
      this.images = new ArrayList<>(images == null ? List.of() : images);
      return this;
    }

    public Builder addImage(GeneratedImage image) {
      this.images.add(image);
      return this;
    }

    public Builder selectedImageId(String selectedImageId) {
      this.selectedImageId = selectedImageId;
      return this;
    }

    public Builder regeneratedFrom(String regeneratedFrom) {
      this.regeneratedFrom = regeneratedFrom;
      return this;
    }

    Builder version(long version) {
      this.version = version;
      return this;
    }

    /** Clear failure, lease and timing fields so the job can be claimed again. */
    public Builder resetForRetry() {
      this.status = JobStatus.PENDING;
      this.errorMessage = null;
      this.errorCode = null;
      this.cancelReason = null;
      this.processingStartedAt = null;
      this.completedAt = null;
      this.claimedBy = null;
      this.claimedAt = null;
      this.availableAt = null;
      return this;
    }

    public VisualizationJob build() {
      if (id == null || bookId == null || trigger == null || userId == null || status == null) {
        throw new ValidationException("id, bookId, trigger, userId and status are required");
      }
      if (pageId == null && textSelection == null) {
        throw new ValidationException("A job needs a page or a text selection");
      }
      if (createdAt == null) {
        createdAt = Instant.now();
      }
      return new VisualizationJob(this);
    }
  }
}
