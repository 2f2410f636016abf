package com.novelvision.visualization;

import com.novelvision.visualization.catalog.CatalogClient;
import com.novelvision.visualization.catalog.HttpCatalogClient;
import com.novelvision.visualization.exception.StateException;
import com.novelvision.visualization.jobs.InMemoryJobStore;
import com.novelvision.visualization.jobs.JobStore;
import com.novelvision.visualization.jobs.RetryPolicy;
import com.novelvision.visualization.logging.LoggingService;
import com.novelvision.visualization.notification.CompositeProgressNotifier;
import com.novelvision.visualization.notification.LoggingProgressNotifier;
import com.novelvision.visualization.notification.ProgressBroadcaster;
import com.novelvision.visualization.notification.ProgressNotifier;
import com.novelvision.visualization.notification.WebhookProgressNotifier;
import com.novelvision.visualization.orchestrator.JobPriorities;
import com.novelvision.visualization.orchestrator.VisualizationOrchestrator;
import com.novelvision.visualization.pipeline.PipelineExecutor;
import com.novelvision.visualization.prompt.PromptSynthesizer;
import com.novelvision.visualization.prompt.PromptSynthesizerFactory;
import com.novelvision.visualization.provider.ImageProviderFactory;
import com.novelvision.visualization.provider.ProviderGateway;
import com.novelvision.visualization.storage.ImageStorage;
import com.novelvision.visualization.storage.LocalImageStorage;
import com.novelvision.visualization.worker.WorkerPool;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/**
 * Application container. Reads configuration, builds every component and starts the worker pool.
 */
public class VisualizationService {

  private static final org.slf4j.Logger log =
      LoggingService.getLogger(VisualizationService.class);

  private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

  private final StartupParameters startupParameters;
  private final Clock clock;
  private ConfigurationProvider configurationProvider;
  private JobStore jobStore;
  private ProviderGateway providerGateway;
  private PromptSynthesizer promptSynthesizer;
  private CatalogClient catalogClient;
  private ImageStorage imageStorage;
  private ProgressBroadcaster broadcaster;
  private WebhookProgressNotifier webhookNotifier;
  private ProgressNotifier notifier;
  private PipelineExecutor pipelineExecutor;
  private WorkerPool workerPool;
  private VisualizationOrchestrator orchestrator;
  private final AtomicBoolean initialized = new AtomicBoolean(false);
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public VisualizationService(String[] applicationArgs) {
    this(applicationArgs, Clock.systemUTC());
  }

  VisualizationService(String[] applicationArgs, Clock clock) {
    this.startupParameters = new StartupParameters(applicationArgs);
    this.clock = clock;
  }

  public void initialize() {
    if (!initialized.compareAndSet(false, true)) {
      throw new StateException("VisualizationService already initialized");
    }
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    // Apply logging levels from application.yaml as early as possible
    LoggingService.applyConfiguration(configuration());
    Configuration config = configuration();

    this.jobStore = new InMemoryJobStore();
    this.providerGateway = ImageProviderFactory.createGateway(config);
    this.promptSynthesizer = PromptSynthesizerFactory.create(config);
    this.catalogClient = new HttpCatalogClient(config.subset("catalog"));
    this.imageStorage = new LocalImageStorage(config.subset("storage"));
    this.notifier = createNotifier(config);

    RetryPolicy retryPolicy = RetryPolicy.fromConfiguration(config);
    WorkerPool.Settings workerSettings = WorkerPool.Settings.fromConfiguration(config);
    this.pipelineExecutor =
        new PipelineExecutor(
            jobStore,
            promptSynthesizer,
            providerGateway,
            imageStorage,
            catalogClient,
            notifier,
            retryPolicy,
            clock);
    this.workerPool =
        new WorkerPool(jobStore, pipelineExecutor, notifier, workerSettings, clock);
    this.orchestrator =
        new VisualizationOrchestrator(
            jobStore,
            catalogClient,
            providerGateway,
            imageStorage,
            notifier,
            retryPolicy,
            JobPriorities.fromConfiguration(config),
            workerSettings.threads(),
            clock);

    workerPool.start();
    log.info(
        "Visualization service started: providers {}, default {}, {} worker(s)",
        providerGateway.availableProviders(),
        providerGateway.defaultProvider(),
        workerSettings.threads());
  }

  private ProgressNotifier createNotifier(Configuration config) {
    List<ProgressNotifier> channels = new ArrayList<>();
    channels.add(new LoggingProgressNotifier());
    this.broadcaster = new ProgressBroadcaster();
    channels.add(broadcaster);
    String webhookUrl = config.getString("notifications.webhook.url", null);
    if (webhookUrl != null && !webhookUrl.isBlank()) {
      this.webhookNotifier =
          new WebhookProgressNotifier(
              webhookUrl, config.getLong("notifications.webhook.timeout-seconds", 10L));
      channels.add(webhookNotifier);
      log.info("Progress events are posted to {}", webhookUrl);
    }
    return new CompositeProgressNotifier(channels);
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   * When signaled, this method invokes {@link #shutdown()} to release resources before returning.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "visualization-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      log.info("Shutting down visualization service");
      try {
        if (workerPool != null) {
          workerPool.stop(SHUTDOWN_GRACE);
        }
        if (webhookNotifier != null) {
          webhookNotifier.close();
        }
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  public boolean isShutdown() {
    return shuttingDown.get();
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("VisualizationService not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public JobStore jobStore() {
    return jobStore;
  }

  public ProviderGateway providerGateway() {
    return providerGateway;
  }

  public PromptSynthesizer promptSynthesizer() {
    return promptSynthesizer;
  }

  public CatalogClient catalogClient() {
    return catalogClient;
  }

  public ImageStorage imageStorage() {
    return imageStorage;
  }

  /** In-process channel for observers of job progress. */
  public ProgressBroadcaster progressBroadcaster() {
    return broadcaster;
  }

  public PipelineExecutor pipelineExecutor() {
    return pipelineExecutor;
  }

  public WorkerPool workerPool() {
    return workerPool;
  }

  public VisualizationOrchestrator orchestrator() {
    return orchestrator;
  }
}
