package org.waabox.budman;

import java.net.URI;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.budman.context.DataContext;
import org.waabox.budman.metrics.BudmanMetrics;
import org.waabox.budman.metrics.NoopBudmanMetrics;
import org.waabox.budman.storage.FolderResolver;
import org.waabox.budman.store.ConfigurationRecord;
import org.waabox.budman.store.ConfigurationStore;
import org.waabox.budman.store.SaveAck;
import org.waabox.budman.store.WorkbookContentStore;

/**
 * The main entry point of Budman.
 *
 * <p>Budman ties a configuration store and a workbook content store to a
 * {@link BudgetDomainModel} and the {@link DataContext} over it. Starting
 * it reads the configuration record, builds and initializes the model, and
 * brings the data context to its ready state.</p>
 *
 * <p>Instances are created through the fluent {@link Builder} starting
 * with {@link #builder()}.</p>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * Budman budman = Budman.builder()
 *     .configurationStore(new JsonConfigurationStore())
 *     .contentStore(new FileSystemWorkbookContentStore())
 *     .configurationUrl(Paths.get("budget/budget.jsonc").toUri())
 *     .defaultConfiguration(DefaultConfiguration.create())
 *     .build();
 *
 * InitializationReport report = budman.start();
 *
 * DataContext context = budman.dataContext();
 * context.selectWorkbook("0");
 * WorkbookContent content = context.load(context.currentWorkbook().get());
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Budman {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(Budman.class);

  /** Reads and writes the configuration record, never null. */
  private final ConfigurationStore configurationStore;

  /** Reads and writes workbook content, never null. */
  private final WorkbookContentStore contentStore;

  /** Where the configuration record lives, never null. */
  private final URI configurationUrl;

  /** The record to start from when none is stored, may be null. */
  private final ConfigurationRecord defaultConfiguration;

  /** Resolves and verifies folders, never null. */
  private final FolderResolver folderResolver;

  /** The metrics reporter, never null. */
  private final BudmanMetrics metrics;

  /** Whether missing folders are created on start. */
  private final boolean createMissingFolders;

  /** Whether the first initialization failure aborts start. */
  private final boolean raiseOnErrors;

  /** Whether this instance has been started. */
  private final AtomicBoolean started = new AtomicBoolean(false);

  /** Stops an initialization in progress. */
  private volatile CancellationToken token = new CancellationToken();

  /** The model, null until started. */
  private volatile BudgetDomainModel model;

  /** The data context, null until started. */
  private volatile DataContext dataContext;

  /** The report of the last initialization, null until started. */
  private volatile InitializationReport report;

  /** Creates a new Budman instance from its builder.
   *
   * @param builder the builder, never null.
   */
  private Budman(final Builder builder) {
    configurationStore = builder.configurationStore;
    contentStore = builder.contentStore;
    configurationUrl = builder.configurationUrl;
    defaultConfiguration = builder.defaultConfiguration;
    folderResolver = builder.folderResolver;
    metrics = builder.metrics;
    createMissingFolders = builder.createMissingFolders;
    raiseOnErrors = builder.raiseOnErrors;
  }

  /**
   * Creates a new builder for constructing a Budman instance.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts Budman.
   *
   * <p>This method performs the following steps in order:</p>
   * <ol>
   *   <li>Reads the configuration record. If none is stored and a default
   *       configuration was given, the default is stored and used.</li>
   *   <li>Builds the domain model, validating the record.</li>
   *   <li>Sets the data context selectors from the working state
   *       defaults.</li>
   *   <li>Initializes the model: verifies the folders and catalogs the
   *       workbooks found in them.</li>
   *   <li>Marks the data context ready.</li>
   * </ol>
   *
   * @return the initialization report, never null.
   *
   * @throws IllegalStateException if already started.
   * @throws ConfigurationException if the record is malformed.
   * @throws NotFoundException if no record is stored and there is no
   * default configuration.
   */
  public InitializationReport start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Budman is already started");
    }
    try {
      final ConfigurationRecord record = readConfiguration();
      final BudgetDomainModel newModel = new BudgetDomainModel(record,
          folderResolver, metrics);
      final DataContext newContext = new DataContext(newModel, contentStore,
          record.workingState(), metrics);

      newContext.initialize();
      final InitializationReport newReport = newModel.initialize(
          createMissingFolders, raiseOnErrors, token);
      newContext.ready();

      model = newModel;
      dataContext = newContext;
      report = newReport;
      log.info("Budman started from {}: {}", configurationUrl, newReport);
      return newReport;
    } catch (final RuntimeException e) {
      started.set(false);
      throw e;
    }
  }

  /**
   * Stops Budman, cancelling an initialization in progress.
   *
   * <p>The model and data context stay readable; nothing is saved.</p>
   */
  public void stop() {
    token.cancel();
    token = new CancellationToken();
    started.set(false);
    log.info("Budman stopped");
  }

  /** Tells whether Budman is started.
   *
   * @return true between {@link #start()} and {@link #stop()}.
   */
  public boolean isStarted() {
    return started.get() && model != null;
  }

  /** Returns the domain model.
   *
   * @return the model, never null.
   *
   * @throws IllegalStateException if Budman was never started.
   */
  public BudgetDomainModel model() {
    final BudgetDomainModel current = model;
    if (current == null) {
      throw new IllegalStateException("Budman is not started");
    }
    return current;
  }

  /** Returns the data context.
   *
   * @return the data context, never null.
   *
   * @throws IllegalStateException if Budman was never started.
   */
  public DataContext dataContext() {
    final DataContext current = dataContext;
    if (current == null) {
      throw new IllegalStateException("Budman is not started");
    }
    return current;
  }

  /** Returns the report of the last initialization.
   *
   * @return the report, never null.
   *
   * @throws IllegalStateException if Budman was never started.
   */
  public InitializationReport report() {
    final InitializationReport current = report;
    if (current == null) {
      throw new IllegalStateException("Budman is not started");
    }
    return current;
  }

  /** Returns where the configuration record lives.
   *
   * @return the url, never null.
   */
  public URI configurationUrl() {
    return configurationUrl;
  }

  /** Writes the catalog and the working state back to the configuration
   * store.
   *
   * @return the acknowledgement, never null.
   *
   * @throws IllegalStateException if Budman was never started.
   */
  public SaveAck saveConfiguration() {
    final ConfigurationRecord record = model().toRecord(
        dataContext().toWorkingStateRecord());
    final SaveAck ack = configurationStore.put(record, configurationUrl);
    log.info("Saved configuration to {}", configurationUrl);
    return ack;
  }

  /** Reads the configuration record, falling back to the default.
   *
   * @return the record, never null.
   */
  private ConfigurationRecord readConfiguration() {
    try {
      return configurationStore.get(configurationUrl);
    } catch (final NotFoundException e) {
      if (defaultConfiguration == null) {
        throw e;
      }
      log.warn("No configuration at {}, storing the default one",
          configurationUrl);
      configurationStore.put(defaultConfiguration, configurationUrl);
      return defaultConfiguration;
    }
  }

  /**
   * Builder for constructing {@link Budman} instances.
   *
   * <p>The configuration store, the content store and the configuration
   * url are required. By default missing folders are created and
   * initialization failures are reported rather than raised.</p>
   */
  public static final class Builder {

    /** The configuration store, required. */
    private ConfigurationStore configurationStore;

    /** The content store, required. */
    private WorkbookContentStore contentStore;

    /** The configuration url, required. */
    private URI configurationUrl;

    /** The record to start from when none is stored. */
    private ConfigurationRecord defaultConfiguration;

    /** The folder resolver. */
    private FolderResolver folderResolver = new FolderResolver();

    /** The metrics reporter. */
    private BudmanMetrics metrics = NoopBudmanMetrics.INSTANCE;

    /** Whether missing folders are created on start. */
    private boolean createMissingFolders = true;

    /** Whether the first initialization failure aborts start. */
    private boolean raiseOnErrors = false;

    /** Creates a new builder with default settings. */
    private Builder() {
    }

    /**
     * Sets the configuration store.
     *
     * @param store the store, never null
     *
     * @return this builder, never null
     */
    public Builder configurationStore(final ConfigurationStore store) {
      configurationStore = Objects.requireNonNull(store,
          "configurationStore must not be null");
      return this;
    }

    /**
     * Sets the workbook content store.
     *
     * @param store the store, never null
     *
     * @return this builder, never null
     */
    public Builder contentStore(final WorkbookContentStore store) {
      contentStore = Objects.requireNonNull(store,
          "contentStore must not be null");
      return this;
    }

    /**
     * Sets where the configuration record lives.
     *
     * @param url the url, never null
     *
     * @return this builder, never null
     */
    public Builder configurationUrl(final URI url) {
      configurationUrl = Objects.requireNonNull(url,
          "configurationUrl must not be null");
      return this;
    }

    /**
     * Sets the record to start from, and store, when none is stored.
     *
     * @param record the record, never null
     *
     * @return this builder, never null
     */
    public Builder defaultConfiguration(final ConfigurationRecord record) {
      defaultConfiguration = Objects.requireNonNull(record,
          "defaultConfiguration must not be null");
      return this;
    }

    /**
     * Sets the folder resolver.
     *
     * @param resolver the resolver, never null
     *
     * @return this builder, never null
     */
    public Builder folderResolver(final FolderResolver resolver) {
      folderResolver = Objects.requireNonNull(resolver,
          "folderResolver must not be null");
      return this;
    }

    /**
     * Sets the metrics reporter.
     *
     * @param theMetrics the metrics reporter, never null
     *
     * @return this builder, never null
     */
    public Builder metrics(final BudmanMetrics theMetrics) {
      metrics = Objects.requireNonNull(theMetrics,
          "metrics must not be null");
      return this;
    }

    /**
     * Sets whether missing folders are created on start.
     *
     * @param create true to create them
     *
     * @return this builder, never null
     */
    public Builder createMissingFolders(final boolean create) {
      createMissingFolders = create;
      return this;
    }

    /**
     * Sets whether the first initialization failure aborts start.
     *
     * @param raise true to abort
     *
     * @return this builder, never null
     */
    public Builder raiseOnErrors(final boolean raise) {
      raiseOnErrors = raise;
      return this;
    }

    /**
     * Builds a new Budman instance.
     *
     * @return a new Budman instance, never null
     *
     * @throws NullPointerException if a required setting is missing
     */
    public Budman build() {
      Objects.requireNonNull(configurationStore,
          "configurationStore must be set");
      Objects.requireNonNull(contentStore, "contentStore must be set");
      Objects.requireNonNull(configurationUrl,
          "configurationUrl must be set");
      return new Budman(this);
    }
  }
}
