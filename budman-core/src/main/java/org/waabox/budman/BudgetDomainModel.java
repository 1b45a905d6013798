package org.waabox.budman;

import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.budman.CatalogReconciler.ReconcileResult;
import org.waabox.budman.metrics.BudmanMetrics;
import org.waabox.budman.metrics.NoopBudmanMetrics;
import org.waabox.budman.storage.FolderResolver;
import org.waabox.budman.storage.WorkbookDiscovery;
import org.waabox.budman.store.ConfigurationRecord;
import org.waabox.budman.store.FinancialInstitutionRecord;
import org.waabox.budman.store.WorkbookRecord;
import org.waabox.budman.store.WorkflowRecord;
import org.waabox.budman.store.WorkingStateRecord;

/**
 * The in-memory catalog of a budget: its financial institutions, their
 * workflows and every workbook found in the workflow folders.
 *
 * <p>The model is built from a {@link ConfigurationRecord}, which is
 * validated up front; a malformed record never yields a model. The
 * catalog is then brought in line with the filesystem by
 * {@link #initialize}, which verifies, or creates, every folder and merges
 * the workbooks found in them. Workbooks are only cataloged from folders
 * that were verified to exist.</p>
 *
 * <p>Scanning only adds workbooks. Entries whose file disappeared are kept
 * and reported until {@link #pruneMissing} or {@link #removeWorkbook} is
 * called explicitly.</p>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * BudgetDomainModel model = new BudgetDomainModel(record);
 * InitializationReport report = model.initialize(true, false);
 *
 * for (Workbook workbook : model.workbooks("boa").sorted()) {
 *   ...
 * }
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class BudgetDomainModel {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      BudgetDomainModel.class);

  /** The sentinel key that selects every institution or workflow. */
  public static final String ALL = "all";

  /** The record the model was built from, never null. */
  private final ConfigurationRecord source;

  /** The budget root folder as configured, never null. */
  private final String rootFolder;

  /** The financial institutions by key, in configuration order. */
  private final Map<String, FinancialInstitution> institutions;

  /** The workflows by key, in configuration order. */
  private final Map<String, Workflow> workflows;

  /** Resolves and verifies folders, never null. */
  private final FolderResolver resolver;

  /** Finds workbook files, never null. */
  private final WorkbookDiscovery discovery;

  /** Merges found workbooks into the catalog, never null. */
  private final CatalogReconciler reconciler = new CatalogReconciler();

  /** The metrics reporter, never null. */
  private final BudmanMetrics metrics;

  /** Serializes initialization, rescans and pruning. */
  private final ReentrantLock scanLock = new ReentrantLock();

  /** Creates a model with the default resolver and no metrics.
   *
   * @param record the configuration record, cannot be null.
   *
   * @throws ConfigurationException if the record is malformed.
   */
  public BudgetDomainModel(final ConfigurationRecord record) {
    this(record, new FolderResolver(), NoopBudmanMetrics.INSTANCE);
  }

  /** Creates a model.
   *
   * @param record the configuration record, cannot be null.
   * @param theResolver the folder resolver, cannot be null.
   * @param theMetrics the metrics reporter, cannot be null.
   *
   * @throws ConfigurationException if the record is malformed.
   */
  public BudgetDomainModel(final ConfigurationRecord record,
      final FolderResolver theResolver, final BudmanMetrics theMetrics) {
    source = Objects.requireNonNull(record, "record must not be null");
    resolver = Objects.requireNonNull(theResolver,
        "resolver must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");

    if (record.rootFolder() == null || record.rootFolder().isBlank()) {
      throw new ConfigurationException("Root folder must be set");
    }
    rootFolder = record.rootFolder().trim();
    discovery = createDiscovery(record.options());
    workflows = buildWorkflows(record.workflows());
    institutions = buildInstitutions(record.institutions());

    for (final FinancialInstitutionRecord fi : record.institutions()) {
      rehydrate(institutions.get(fi.key()), fi.workbooks());
    }

    log.info("Budget model built with {} institution(s) and {} "
        + "workflow(s) under {}", institutions.size(), workflows.size(),
        rootFolder);
  }

  /** Returns the budget root folder as configured.
   *
   * @return the root folder, possibly starting with {@code ~}, never null.
   */
  public String rootFolder() {
    return rootFolder;
  }

  /** Returns the resolved budget root folder.
   *
   * @return the absolute path, never null.
   */
  public Path rootPath() {
    return resolver.resolve(rootFolder);
  }

  /** Returns the value of a global option.
   *
   * @param name the option name, cannot be null.
   *
   * @return the value, empty if the option is not set.
   */
  public Optional<String> option(final String name) {
    Objects.requireNonNull(name, "name must not be null");
    return Optional.ofNullable(source.options().get(name));
  }

  /** Returns every financial institution in configuration order.
   *
   * @return an immutable list, never null.
   */
  public List<FinancialInstitution> institutions() {
    return List.copyOf(institutions.values());
  }

  /** Returns every workflow in configuration order.
   *
   * @return an immutable list, never null.
   */
  public List<Workflow> workflows() {
    return List.copyOf(workflows.values());
  }

  /** Looks up a financial institution.
   *
   * @param key the key, cannot be {@link #ALL}.
   *
   * @return the institution, never null.
   *
   * @throws KeyNotFoundException if the key is unknown or is {@link #ALL}.
   */
  public FinancialInstitution fi(final String key) {
    final FinancialInstitution fi = isAll(key) ? null
        : institutions.get(key);
    if (fi == null) {
      throw new KeyNotFoundException("financial institution", key);
    }
    return fi;
  }

  /** Looks up a workflow.
   *
   * @param key the key, cannot be {@link #ALL}.
   *
   * @return the workflow, never null.
   *
   * @throws KeyNotFoundException if the key is unknown or is {@link #ALL}.
   */
  public Workflow workflow(final String key) {
    final Workflow workflow = isAll(key) ? null : workflows.get(key);
    if (workflow == null) {
      throw new KeyNotFoundException("workflow", key);
    }
    return workflow;
  }

  /** Looks up the folder role a workflow uses for a purpose.
   *
   * @param wfKey the workflow key, cannot be {@link #ALL}.
   * @param purpose the purpose, cannot be null.
   *
   * @return the folder role, never null.
   *
   * @throws KeyNotFoundException if the workflow is unknown or does not
   * use the purpose.
   */
  public FolderRole purposeFolder(final String wfKey,
      final Purpose purpose) {
    Objects.requireNonNull(purpose, "purpose must not be null");
    return workflow(wfKey).folder(purpose).orElseThrow(() ->
        new KeyNotFoundException("purpose", wfKey + "/" + purpose));
  }

  /** Resolves the folder of a (financial institution, workflow, purpose).
   *
   * @param fiKey the financial institution key, cannot be {@link #ALL}.
   * @param wfKey the workflow key, cannot be {@link #ALL}.
   * @param purpose the purpose, cannot be null.
   *
   * @return the absolute path, never null.
   */
  public Path folderPath(final String fiKey, final String wfKey,
      final Purpose purpose) {
    final FinancialInstitution fi = fi(fiKey);
    final FolderRole role = purposeFolder(wfKey, purpose);
    return resolver.resolve(rootFolder, fi.folder(), role.folder());
  }

  /** Returns the workbooks of a financial institution.
   *
   * @param fiKey the key, cannot be {@link #ALL}.
   *
   * @return the live collection, never null.
   */
  public WorkbookCollection workbooks(final String fiKey) {
    return fi(fiKey).workbooks();
  }

  /** Expands a financial institution selector into keys.
   *
   * @param selector a key, or {@link #ALL}.
   *
   * @return the selected keys in configuration order, never null.
   *
   * @throws KeyNotFoundException if the key is unknown.
   */
  public List<String> fiKeys(final String selector) {
    if (isAll(selector)) {
      return List.copyOf(institutions.keySet());
    }
    return List.of(fi(selector).key());
  }

  /** Expands a workflow selector into keys.
   *
   * @param selector a key, or {@link #ALL}.
   *
   * @return the selected keys in configuration order, never null.
   *
   * @throws KeyNotFoundException if the key is unknown.
   */
  public List<String> workflowKeys(final String selector) {
    if (isAll(selector)) {
      return List.copyOf(workflows.keySet());
    }
    return List.of(workflow(selector).key());
  }

  /** Finds a cataloged workbook in any financial institution.
   *
   * @param id the workbook id, cannot be null.
   *
   * @return the workbook, empty if no institution catalogs it.
   */
  public Optional<Workbook> findWorkbook(final String id) {
    Objects.requireNonNull(id, "id must not be null");
    for (final FinancialInstitution fi : institutions.values()) {
      final Optional<Workbook> workbook = fi.workbooks().get(id);
      if (workbook.isPresent()) {
        return workbook;
      }
    }
    return Optional.empty();
  }

  /** Verifies every folder and catalogs the workbooks found in them.
   *
   * @param createMissingFolders whether missing folders are created.
   * @param raiseOnErrors whether the first failure aborts.
   *
   * @return what was done and skipped, never null.
   *
   * @see #initialize(boolean, boolean, CancellationToken)
   */
  public InitializationReport initialize(final boolean createMissingFolders,
      final boolean raiseOnErrors) {
    return initialize(createMissingFolders, raiseOnErrors,
        CancellationToken.NONE);
  }

  /** Verifies every folder and catalogs the workbooks found in them.
   *
   * <p>The root folder is verified first, then for each financial
   * institution its folder and the folder of every (workflow, purpose) it
   * goes through, each followed by discovery and reconciliation.</p>
   *
   * <p>When raiseOnErrors is false, a failure is logged, added to the
   * report and skipped, and processing goes on with the next folder or
   * institution. When it is true, the first failure propagates.
   * Configuration errors always propagate.</p>
   *
   * <p>The token is checked before each financial institution. A
   * cancelled run leaves the catalog consistent and can be run again.</p>
   *
   * @param createMissingFolders whether missing folders are created.
   * @param raiseOnErrors whether the first failure aborts.
   * @param token the cancellation token, cannot be null.
   *
   * @return what was done and skipped, never null.
   *
   * @throws NotFoundException if a folder is missing, creation is off and
   * raiseOnErrors is set.
   * @throws UncheckedIOException if a folder cannot be created and
   * raiseOnErrors is set.
   */
  public InitializationReport initialize(final boolean createMissingFolders,
      final boolean raiseOnErrors, final CancellationToken token) {
    Objects.requireNonNull(token, "token must not be null");
    final InitializationReport report = scan(institutions(),
        createMissingFolders, raiseOnErrors, token);
    log.info("Budget model initialized: {}", report);
    return report;
  }

  /** Scans again the folders of the selected financial institutions.
   *
   * <p>Missing folders are not created and failures never propagate.
   * Cataloged workbooks whose file is gone are logged as warnings but
   * kept.</p>
   *
   * @param fiSelector a financial institution key, or {@link #ALL}.
   *
   * @return what was done and skipped, never null.
   *
   * @throws KeyNotFoundException if the key is unknown.
   */
  public InitializationReport rescan(final String fiSelector) {
    final List<FinancialInstitution> selected = select(fiSelector);
    final InitializationReport report = scan(selected, false, false,
        CancellationToken.NONE);
    for (final FinancialInstitution fi : selected) {
      for (final String id : reconciler.findStale(fi.workbooks())) {
        log.warn("Workbook {} is cataloged but its file is missing", id);
      }
    }
    log.info("Rescanned {}: {}", fiSelector, report);
    return report;
  }

  /** Removes the cataloged workbooks whose file no longer exists.
   *
   * @param fiSelector a financial institution key, or {@link #ALL}.
   *
   * @return the removed ids, never null.
   *
   * @throws KeyNotFoundException if the key is unknown.
   */
  public List<String> pruneMissing(final String fiSelector) {
    final List<FinancialInstitution> selected = select(fiSelector);
    final List<String> removed = new ArrayList<>();
    scanLock.lock();
    try {
      for (final FinancialInstitution fi : selected) {
        for (final String id : reconciler.findStale(fi.workbooks())) {
          fi.workbooks().remove(id).ifPresent(wb -> removed.add(wb.id()));
          log.info("Pruned workbook {}", id);
        }
      }
    } finally {
      scanLock.unlock();
    }
    return Collections.unmodifiableList(removed);
  }

  /** Removes a workbook from the catalog. The file is left untouched.
   *
   * @param fiKey the financial institution key, cannot be {@link #ALL}.
   * @param workbookId the workbook id, cannot be null.
   *
   * @return the removed workbook, never null.
   *
   * @throws KeyNotFoundException if the key is unknown.
   * @throws NotFoundException if the workbook is not cataloged.
   */
  public Workbook removeWorkbook(final String fiKey,
      final String workbookId) {
    Objects.requireNonNull(workbookId, "workbookId must not be null");
    final Workbook removed = fi(fiKey).workbooks().remove(workbookId)
        .orElseThrow(() -> new NotFoundException(
            "Workbook " + workbookId + " is not cataloged for " + fiKey));
    log.info("Removed workbook {}", workbookId);
    return removed;
  }

  /** Builds the configuration record of the current state of the model.
   *
   * <p>Cataloged workbooks are written without content or loaded
   * state.</p>
   *
   * @param workingState the working state defaults to store, cannot be
   * null.
   *
   * @return the record, never null.
   */
  public ConfigurationRecord toRecord(final WorkingStateRecord workingState) {
    Objects.requireNonNull(workingState, "workingState must not be null");

    final List<FinancialInstitutionRecord> records = new ArrayList<>();
    for (final FinancialInstitution fi : institutions.values()) {
      final List<WorkbookRecord> workbooks = new ArrayList<>();
      for (final Workbook wb : fi.workbooks().sorted()) {
        workbooks.add(new WorkbookRecord(wb.name(), wb.url().toString(),
            wb.wfKey(), wb.purpose().value(), wb.folderRoleId(),
            wb.folder(), wb.type().value()));
      }
      records.add(new FinancialInstitutionRecord(fi.key(), fi.name(),
          fi.type().value(), fi.folder(), workbooks));
    }

    return source.withInstitutions(records)
        .withWorkingState(workingState)
        .modified(Instant.now().toString(), System.getProperty("user.name"));
  }

  /** Runs discovery and reconciliation over some institutions.
   *
   * @param selected the institutions, never null.
   * @param create whether missing folders are created.
   * @param raise whether the first failure aborts.
   * @param token the cancellation token, never null.
   *
   * @return the report, never null.
   */
  private InitializationReport scan(
      final List<FinancialInstitution> selected, final boolean create,
      final boolean raise, final CancellationToken token) {

    final InitializationReport report = new InitializationReport();

    scanLock.lock();
    try {
      final Path root = resolver.resolve(rootFolder);
      try {
        if (!resolver.verify(root, create, raise)) {
          skip(report, null, null, null, "root folder " + root
              + " does not exist");
          return report;
        }
      } catch (final UncheckedIOException e) {
        if (raise) {
          throw e;
        }
        skip(report, null, null, null, e.getMessage());
        return report;
      }

      for (final FinancialInstitution fi : selected) {
        if (token.isCancelled()) {
          log.warn("Scan cancelled before {}", fi.key());
          report.cancel();
          break;
        }
        scanInstitution(fi, create, raise, report);
      }
      return report;
    } finally {
      scanLock.unlock();
    }
  }

  /** Scans every workflow folder of one financial institution.
   *
   * @param fi the institution, never null.
   * @param create whether missing folders are created.
   * @param raise whether the first failure aborts.
   * @param report the report to fill in, never null.
   */
  private void scanInstitution(final FinancialInstitution fi,
      final boolean create, final boolean raise,
      final InitializationReport report) {

    final long start = System.nanoTime();
    final Path fiPath = resolver.resolve(rootFolder, fi.folder());

    try {
      if (!resolver.verify(fiPath, create, raise)) {
        skip(report, fi.key(), null, null, "folder " + fiPath
            + " does not exist");
        return;
      }
    } catch (final ConfigurationException e) {
      throw e;
    } catch (final BudmanException | UncheckedIOException e) {
      if (raise) {
        throw e;
      }
      skip(report, fi.key(), null, null, e.getMessage());
      return;
    }

    int found = 0;
    for (final Workflow wf : workflows.values()) {
      for (final Map.Entry<Purpose, FolderRole> entry
          : wf.folders().entrySet()) {
        found += scanFolder(fi, wf, entry.getKey(), entry.getValue(), create,
            raise, report);
      }
    }

    report.institutionProcessed();
    metrics.institutionScanned(fi.key(), found,
        Duration.ofNanos(System.nanoTime() - start));
    log.debug("Scanned {}: {} workbook file(s), {} cataloged", fi.key(),
        found, fi.workbooks().size());
  }

  /** Verifies one workflow folder and reconciles what it holds.
   *
   * @param fi the institution, never null.
   * @param wf the workflow, never null.
   * @param purpose the purpose, never null.
   * @param role the folder role for the purpose, never null.
   * @param create whether a missing folder is created.
   * @param raise whether a failure propagates.
   * @param report the report to fill in, never null.
   *
   * @return the number of workbook files found.
   */
  private int scanFolder(final FinancialInstitution fi, final Workflow wf,
      final Purpose purpose, final FolderRole role, final boolean create,
      final boolean raise, final InitializationReport report) {

    final Path folder = resolver.resolve(rootFolder, fi.folder(),
        role.folder());
    try {
      if (!resolver.verify(folder, create, raise)) {
        skip(report, fi.key(), wf.key(), purpose, "folder " + folder
            + " does not exist");
        return 0;
      }
      final List<Workbook> candidates = discovery.discover(fi.key(),
          wf.key(), purpose, role, folder);
      final ReconcileResult result = reconciler.reconcile(fi.workbooks(),
          candidates);

      report.folderScanned(wf.key(), candidates.size(), result.addedIds());
      if (!result.addedIds().isEmpty()) {
        metrics.workbooksAdded(fi.key(), result.addedIds().size());
      }
      return candidates.size();
    } catch (final ConfigurationException e) {
      throw e;
    } catch (final BudmanException | UncheckedIOException e) {
      if (raise) {
        throw e;
      }
      skip(report, fi.key(), wf.key(), purpose, e.getMessage());
      return 0;
    }
  }

  /** Records and logs something that was skipped.
   *
   * @param report the report, never null.
   * @param fiKey the institution key, may be null.
   * @param wfKey the workflow key, may be null.
   * @param purpose the purpose, may be null.
   * @param reason why, may be null.
   */
  private void skip(final InitializationReport report, final String fiKey,
      final String wfKey, final Purpose purpose, final String reason) {
    final ReconciliationWarning warning = new ReconciliationWarning(fiKey,
        wfKey, purpose, reason == null ? "unknown failure" : reason);
    log.warn("Skipped {}", warning);
    report.skipped(warning);
    metrics.folderSkipped(fiKey, warning.reason());
  }

  /** Expands a financial institution selector into institutions.
   *
   * @param selector a key, or {@link #ALL}.
   *
   * @return the institutions, never null.
   */
  private List<FinancialInstitution> select(final String selector) {
    final List<FinancialInstitution> selected = new ArrayList<>();
    for (final String key : fiKeys(selector)) {
      selected.add(institutions.get(key));
    }
    return selected;
  }

  /** Restores the workbooks a configuration record carries.
   *
   * <p>Entries whose file is missing are kept and logged. Entries that
   * reference a workflow or purpose the configuration no longer has are
   * dropped with a warning.</p>
   *
   * @param fi the institution, never null.
   * @param records the stored workbooks, never null.
   */
  private void rehydrate(final FinancialInstitution fi,
      final List<WorkbookRecord> records) {
    final List<Workbook> restored = new ArrayList<>();
    for (final WorkbookRecord record : records) {
      final Workbook workbook = restore(fi, record);
      if (workbook != null) {
        restored.add(workbook);
      }
    }
    fi.workbooks().addAllIfAbsent(restored);
    for (final String id : reconciler.findStale(fi.workbooks())) {
      log.warn("Workbook {} is cataloged but its file is missing", id);
    }
  }

  /** Restores one stored workbook.
   *
   * @param fi the owning institution, never null.
   * @param record the stored workbook, never null.
   *
   * @return the workbook, null if the record cannot be restored.
   */
  private Workbook restore(final FinancialInstitution fi,
      final WorkbookRecord record) {
    if (record.name() == null || record.url() == null
        || record.workflow() == null || record.purpose() == null) {
      log.warn("Dropping incomplete workbook record {} of {}", record,
          fi.key());
      return null;
    }
    final Workflow wf = workflows.get(record.workflow());
    if (wf == null) {
      log.warn("Dropping workbook {} of {}: unknown workflow {}",
          record.name(), fi.key(), record.workflow());
      return null;
    }
    final Purpose purpose;
    try {
      purpose = Purpose.of(record.purpose());
    } catch (final ConfigurationException e) {
      log.warn("Dropping workbook {} of {}: {}", record.name(), fi.key(),
          e.getMessage());
      return null;
    }
    final Optional<FolderRole> role = wf.folder(purpose);
    if (role.isEmpty()) {
      log.warn("Dropping workbook {} of {}: workflow {} has no {} folder",
          record.name(), fi.key(), wf.key(), purpose);
      return null;
    }
    if (!matches(record.folderRole(), role.get().id())
        || !matches(record.folder(), role.get().folder())) {
      log.warn("Dropping workbook {} of {}: stored under {} ({}) but {} {}"
          + " now uses {} ({})", record.name(), fi.key(),
          record.folderRole(), record.folder(), wf.key(), purpose,
          role.get().id(), role.get().folder());
      return null;
    }

    final URI url;
    final Path file;
    final Path expected;
    try {
      url = URI.create(record.url());
      if (!"file".equalsIgnoreCase(url.getScheme())) {
        log.warn("Dropping workbook {} of {}: {} is not a file url",
            record.name(), fi.key(), url);
        return null;
      }
      file = Paths.get(url).toAbsolutePath().normalize();
      expected = resolver.resolve(rootFolder, fi.folder(),
          role.get().folder()).resolve(record.name());
    } catch (final IllegalArgumentException
        | FileSystemNotFoundException e) {
      throw new ConfigurationException("Workbook " + record.name() + " of "
          + fi.key() + " has a malformed url: " + record.url(), e);
    }

    if (!file.equals(expected)) {
      log.warn("Dropping workbook {} of {}: {} is not in its {} folder {}",
          record.name(), fi.key(), file, purpose, expected.getParent());
      return null;
    }

    return Workbook.builder()
        .name(record.name())
        .url(url)
        .institution(fi.key())
        .workflow(wf.key())
        .purpose(purpose)
        .folderRole(role.get())
        .type(record.type() == null ? null : WorkbookType.of(record.type()))
        .build();
  }

  /** Tells whether a stored attribute agrees with the configured one.
   *
   * @param stored the stored value, null when the record predates it.
   * @param configured the configured value, never null.
   *
   * @return true if unset or equal.
   */
  private static boolean matches(final String stored,
      final String configured) {
    return stored == null || stored.trim().equals(configured);
  }

  /** Builds the discovery configured by the global options.
   *
   * @param options the global options, never null.
   *
   * @return the discovery, never null.
   */
  private static WorkbookDiscovery createDiscovery(
      final Map<String, String> options) {
    final String extensions = options.get(
        ConfigurationRecord.OPTION_WORKBOOK_EXTENSIONS);
    if (extensions == null || extensions.isBlank()) {
      return new WorkbookDiscovery();
    }
    return new WorkbookDiscovery(Arrays.asList(extensions.split(",")));
  }

  /** Validates and builds the workflows.
   *
   * @param records the stored workflows, never null.
   *
   * @return the workflows by key, never null.
   */
  private static Map<String, Workflow> buildWorkflows(
      final List<WorkflowRecord> records) {
    final Map<String, Workflow> result = new LinkedHashMap<>();
    for (final WorkflowRecord record : records) {
      final String key = requireKey(record.key(), "workflow");
      if (result.containsKey(key)) {
        throw new ConfigurationException("Duplicate workflow key: " + key);
      }

      final Map<Purpose, FolderRole> folders = new EnumMap<>(Purpose.class);
      for (final Map.Entry<String, String> entry
          : record.purposes().entrySet()) {
        final Purpose purpose = Purpose.of(entry.getKey());
        final String roleId = entry.getValue();
        final String folder = roleId == null ? null
            : record.folders().get(roleId);
        if (folder == null || folder.isBlank()) {
          throw new ConfigurationException("Workflow " + key + " maps "
              + purpose + " to undeclared folder role '" + roleId + "'");
        }
        requireRelative(folder, "folder of workflow " + key);
        final FolderRole role = new FolderRole(roleId, folder.trim(),
            record.prefixes().get(roleId));
        if (folders.put(purpose, role) != null) {
          throw new ConfigurationException("Workflow " + key + " maps "
              + purpose + " more than once");
        }
      }

      final String name = record.name() == null ? key : record.name();
      result.put(key, new Workflow(key, name, folders));
    }
    return Collections.unmodifiableMap(result);
  }

  /** Validates and builds the financial institutions.
   *
   * @param records the stored institutions, never null.
   *
   * @return the institutions by key, never null.
   */
  private static Map<String, FinancialInstitution> buildInstitutions(
      final List<FinancialInstitutionRecord> records) {
    final Map<String, FinancialInstitution> result = new LinkedHashMap<>();
    for (final FinancialInstitutionRecord record : records) {
      final String key = requireKey(record.key(), "financial institution");
      if (result.containsKey(key)) {
        throw new ConfigurationException(
            "Duplicate financial institution key: " + key);
      }
      if (record.folder() == null || record.folder().isBlank()) {
        throw new ConfigurationException(
            "Financial institution " + key + " has no folder");
      }
      requireRelative(record.folder(), "folder of " + key);
      final String name = record.name() == null ? key : record.name();
      result.put(key, new FinancialInstitution(key, name,
          InstitutionType.of(record.type()), record.folder().trim()));
    }
    return Collections.unmodifiableMap(result);
  }

  /** Validates a configured key.
   *
   * @param key the key, may be null.
   * @param kind what the key identifies.
   *
   * @return the key, never null.
   */
  private static String requireKey(final String key, final String kind) {
    if (key == null || key.isBlank()) {
      throw new ConfigurationException(kind + " key must not be blank");
    }
    if (isAll(key)) {
      throw new ConfigurationException("'" + ALL + "' is reserved and "
          + "cannot be used as a " + kind + " key");
    }
    if (key.contains(WorkbookId.SEPARATOR)) {
      throw new ConfigurationException(kind + " key '" + key
          + "' must not contain '" + WorkbookId.SEPARATOR + "'");
    }
    return key;
  }

  /** Validates a configured relative folder.
   *
   * @param folder the folder, never null.
   * @param what what the folder belongs to.
   */
  private static void requireRelative(final String folder,
      final String what) {
    if (folder.contains(WorkbookId.SEPARATOR)) {
      throw new ConfigurationException(what + " '" + folder
          + "' must not contain '" + WorkbookId.SEPARATOR + "'");
    }
    final Path path;
    try {
      path = Paths.get(folder.trim());
    } catch (final InvalidPathException e) {
      throw new ConfigurationException(what + " '" + folder
          + "' is not a valid path: " + e.getReason(), e);
    }
    if (path.isAbsolute()) {
      throw new ConfigurationException(what + " '" + folder
          + "' must be relative");
    }
  }

  /** Tells whether a key is the {@link #ALL} sentinel.
   *
   * @param key the key, may be null.
   *
   * @return true for {@code all} in any case.
   */
  private static boolean isAll(final String key) {
    return key != null && ALL.equals(key.trim().toLowerCase(Locale.ROOT));
  }
}
