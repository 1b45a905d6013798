package org.waabox.budman.context;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.budman.BudgetDomainModel;
import org.waabox.budman.BudmanException;
import org.waabox.budman.ConfigurationException;
import org.waabox.budman.FinancialInstitution;
import org.waabox.budman.KeyNotFoundException;
import org.waabox.budman.NotFoundException;
import org.waabox.budman.Purpose;
import org.waabox.budman.Workbook;
import org.waabox.budman.WorkbookCollection;
import org.waabox.budman.WorkbookType;
import org.waabox.budman.Workflow;
import org.waabox.budman.metrics.BudmanMetrics;
import org.waabox.budman.metrics.NoopBudmanMetrics;
import org.waabox.budman.store.SaveAck;
import org.waabox.budman.store.WorkbookContent;
import org.waabox.budman.store.WorkbookContentStore;
import org.waabox.budman.store.WorkingStateRecord;

/**
 * The working state of a budget session: what is currently selected and
 * which workbook contents are loaded.
 *
 * <p>The selected financial institution decides the active collection, the
 * workbooks that references are resolved against. The current workbook is
 * kept as one {@link WorkbookSelection}; reading it re-checks it against
 * the active collection, so a selection whose workbook was removed reads
 * as empty and a stale index is corrected.</p>
 *
 * <p>Content is loaded lazily from the {@link WorkbookContentStore} and
 * cached by workbook id. Loading a workbook twice reads it once.</p>
 *
 * <p>A context goes through {@link ContextState}: {@link #initialize()}
 * sets the selectors from the configuration defaults, and {@link #ready()}
 * is called once the catalog is populated.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DataContext {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      DataContext.class);

  /** The model the context selects from, never null. */
  private final BudgetDomainModel model;

  /** Where workbook contents are read from and written to, never null. */
  private final WorkbookContentStore contentStore;

  /** The metrics reporter, never null. */
  private final BudmanMetrics metrics;

  /** The defaults the selectors start from, never null. */
  private final WorkingStateRecord defaults;

  /** The lifecycle state. */
  private volatile ContextState state = ContextState.UNINITIALIZED;

  /** The selected financial institution key, null before initialization. */
  private volatile String fiKey;

  /** The selected workflow key, null before initialization. */
  private volatile String wfKey;

  /** The selected purpose. */
  private volatile Purpose purpose = Purpose.WORKING;

  /** The current workbook. */
  private final AtomicReference<WorkbookSelection> selection =
      new AtomicReference<>(WorkbookSelection.NONE);

  /** The loaded contents by workbook id. */
  private final Map<String, WorkbookContent> cache =
      new ConcurrentHashMap<>();

  /** Creates a context without metrics.
   *
   * @param theModel the model, cannot be null.
   * @param theContentStore the content store, cannot be null.
   * @param theDefaults the working state defaults, cannot be null.
   */
  public DataContext(final BudgetDomainModel theModel,
      final WorkbookContentStore theContentStore,
      final WorkingStateRecord theDefaults) {
    this(theModel, theContentStore, theDefaults, NoopBudmanMetrics.INSTANCE);
  }

  /** Creates a context.
   *
   * @param theModel the model, cannot be null.
   * @param theContentStore the content store, cannot be null.
   * @param theDefaults the working state defaults, cannot be null.
   * @param theMetrics the metrics reporter, cannot be null.
   */
  public DataContext(final BudgetDomainModel theModel,
      final WorkbookContentStore theContentStore,
      final WorkingStateRecord theDefaults, final BudmanMetrics theMetrics) {
    model = Objects.requireNonNull(theModel, "model must not be null");
    contentStore = Objects.requireNonNull(theContentStore,
        "contentStore must not be null");
    defaults = Objects.requireNonNull(theDefaults,
        "defaults must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
  }

  /** Sets the selectors from the configuration defaults.
   *
   * <p>Default keys the model does not know fall back to the first
   * configured financial institution or workflow, and an unknown purpose
   * falls back to {@link Purpose#WORKING}, each with a warning.</p>
   */
  public void initialize() {
    state = ContextState.INITIALIZING;
    fiKey = defaultKey(defaults.fiKey(), "financial institution",
        model.fiKeys(BudgetDomainModel.ALL));
    wfKey = defaultKey(defaults.wfKey(), "workflow",
        model.workflowKeys(BudgetDomainModel.ALL));
    purpose = defaultPurpose(defaults.purpose());
    selection.set(WorkbookSelection.NONE);
    log.debug("Data context initializing with {}/{}/{}", fiKey, wfKey,
        purpose);
  }

  /** Marks the catalog as populated and selects the default workbook.
   *
   * <p>The default workbook is selected only if the active collection
   * has it.</p>
   *
   * @throws IllegalStateException if {@link #initialize()} was not called.
   */
  public void ready() {
    if (state == ContextState.UNINITIALIZED) {
      throw new IllegalStateException("Data context is not initialized");
    }
    if (defaults.allWorkbooks()) {
      selection.set(WorkbookSelection.ALL);
    } else if (defaults.workbookId() != null) {
      final ReferenceResolution resolution = resolveReference(
          WorkbookReference.id(defaults.workbookId()));
      if (resolution.found()) {
        select(resolution);
      } else {
        log.warn("Default workbook {} is not cataloged for {}",
            defaults.workbookId(), fiKey);
      }
    }
    state = ContextState.READY;
    log.info("Data context ready with {}/{}/{}", fiKey, wfKey, purpose);
  }

  public ContextState state() {
    return state;
  }

  /** Returns the selected financial institution.
   *
   * @return the institution, empty before initialization or when none is
   * configured.
   */
  public Optional<FinancialInstitution> financialInstitution() {
    final String key = fiKey;
    return key == null ? Optional.empty() : Optional.of(model.fi(key));
  }

  /** Returns the selected workflow.
   *
   * @return the workflow, empty before initialization or when none is
   * configured.
   */
  public Optional<Workflow> workflow() {
    final String key = wfKey;
    return key == null ? Optional.empty() : Optional.of(model.workflow(key));
  }

  public Purpose purpose() {
    return purpose;
  }

  /** Selects a financial institution.
   *
   * <p>Changing the institution changes the active collection, so the
   * workbook selection is cleared.</p>
   *
   * @param key the key, cannot be the {@code all} sentinel.
   *
   * @throws KeyNotFoundException if the key is unknown or is {@code all}.
   */
  public void selectFinancialInstitution(final String key) {
    final String selected = model.fi(key).key();
    if (!selected.equals(fiKey)) {
      fiKey = selected;
      selection.set(WorkbookSelection.NONE);
      log.debug("Selected financial institution {}", selected);
    }
  }

  /** Selects a workflow.
   *
   * @param key the key, cannot be the {@code all} sentinel.
   *
   * @throws KeyNotFoundException if the key is unknown or is {@code all}.
   */
  public void selectWorkflow(final String key) {
    wfKey = model.workflow(key).key();
    log.debug("Selected workflow {}", wfKey);
  }

  /** Selects a purpose.
   *
   * @param thePurpose the purpose, cannot be null.
   */
  public void selectPurpose(final Purpose thePurpose) {
    purpose = Objects.requireNonNull(thePurpose, "purpose must not be null");
    log.debug("Selected purpose {}", purpose);
  }

  /** Selects a purpose by its configuration value.
   *
   * @param value the purpose value, e.g. {@code input}.
   *
   * @throws ConfigurationException if the value names no purpose.
   */
  public void selectPurpose(final String value) {
    selectPurpose(Purpose.of(value));
  }

  /** Returns the workbooks of the selected financial institution.
   *
   * @return the workbooks sorted by id, empty if nothing is selected.
   */
  public List<Workbook> activeWorkbooks() {
    final WorkbookCollection collection = activeCollection();
    return collection == null ? List.of() : collection.sorted();
  }

  /** Resolves a reference typed by a user.
   *
   * <p>The text is tried, in order, as the {@code all} sentinel, as an
   * index into the id sorted active collection when it is numeric, then as
   * an exact id, name and url. A numeric text that is out of range is
   * still tried as an id, name and url.</p>
   *
   * @param text the reference, may be null.
   *
   * @return the resolution, {@link ReferenceResolution#notFound()} if
   * nothing matched, never null.
   */
  public ReferenceResolution resolveReference(final String text) {
    if (text == null || text.isBlank()) {
      return ReferenceResolution.notFound();
    }
    final String trimmed = text.trim();
    if (BudgetDomainModel.ALL.equals(trimmed.toLowerCase(Locale.ROOT))) {
      return resolveReference(WorkbookReference.all());
    }
    if (isNumeric(trimmed)) {
      final ReferenceResolution byIndex = resolveIndex(trimmed);
      if (byIndex.found()) {
        return byIndex;
      }
    }
    for (final WorkbookReference candidate : List.of(
        WorkbookReference.id(trimmed),
        WorkbookReference.name(trimmed),
        WorkbookReference.url(trimmed))) {
      final ReferenceResolution resolution = resolveReference(candidate);
      if (resolution.found()) {
        return resolution;
      }
    }
    return ReferenceResolution.notFound();
  }

  /** Resolves the workbook at a position of the active collection.
   *
   * @param index the zero based position.
   *
   * @return the resolution, never null.
   */
  public ReferenceResolution resolveReference(final int index) {
    return resolveReference(WorkbookReference.index(index));
  }

  /** Resolves a typed reference against the active collection.
   *
   * <p>Never throws for a reference that matches nothing; the {@code all}
   * reference always resolves, even on an empty collection.</p>
   *
   * @param reference the reference, cannot be null.
   *
   * @return the resolution, never null.
   */
  public ReferenceResolution resolveReference(
      final WorkbookReference reference) {
    Objects.requireNonNull(reference, "reference must not be null");

    if (reference instanceof WorkbookReference.AllRef) {
      return ReferenceResolution.everything();
    }

    final List<Workbook> workbooks = activeWorkbooks();

    if (reference instanceof WorkbookReference.IndexRef indexRef) {
      final int index = indexRef.index();
      if (index < 0 || index >= workbooks.size()) {
        return ReferenceResolution.notFound();
      }
      return ReferenceResolution.of(index, workbooks.get(index));
    }

    for (int i = 0; i < workbooks.size(); i++) {
      final Workbook workbook = workbooks.get(i);
      if (matches(reference, workbook)) {
        return ReferenceResolution.of(i, workbook);
      }
    }
    return ReferenceResolution.notFound();
  }

  /** Makes a workbook, or every workbook, the current selection.
   *
   * @param reference the reference, cannot be null.
   *
   * @return the resolution; when nothing matched the selection is left
   * unchanged.
   */
  public ReferenceResolution selectWorkbook(
      final WorkbookReference reference) {
    final ReferenceResolution resolution = resolveReference(reference);
    if (resolution.found()) {
      select(resolution);
    }
    return resolution;
  }

  /** Makes a workbook, or every workbook, the current selection.
   *
   * @param text the reference as typed by a user, may be null.
   *
   * @return the resolution; when nothing matched the selection is left
   * unchanged.
   */
  public ReferenceResolution selectWorkbook(final String text) {
    final ReferenceResolution resolution = resolveReference(text);
    if (resolution.found()) {
      select(resolution);
    }
    return resolution;
  }

  /** Clears the workbook selection. */
  public void clearWorkbookSelection() {
    selection.set(WorkbookSelection.NONE);
  }

  /** Returns the current selection, checked against the active collection.
   *
   * <p>A selection whose workbook left the active collection is cleared,
   * and one whose index moved is corrected, before being returned.</p>
   *
   * @return the selection, never null.
   */
  public WorkbookSelection selection() {
    while (true) {
      final WorkbookSelection current = selection.get();
      if (!current.isSet()) {
        return current;
      }
      final List<Workbook> workbooks = activeWorkbooks();
      WorkbookSelection checked = WorkbookSelection.NONE;
      for (int i = 0; i < workbooks.size(); i++) {
        if (workbooks.get(i).id().equals(current.id())) {
          checked = new WorkbookSelection(i, current.id(), current.name(),
              false);
          break;
        }
      }
      if (checked.equals(current)) {
        return current;
      }
      if (selection.compareAndSet(current, checked)) {
        if (!checked.isSet()) {
          log.debug("Cleared selection of workbook {}", current.id());
        }
        return checked;
      }
    }
  }

  /** Returns the current workbook.
   *
   * @return the workbook, empty if none or every workbook is selected.
   */
  public Optional<Workbook> currentWorkbook() {
    final WorkbookSelection current = selection();
    if (!current.isSet()) {
      return Optional.empty();
    }
    return activeCollection().get(current.id());
  }

  /** Returns what the current selection covers.
   *
   * @return every active workbook when all are selected, the current
   * workbook, or nothing; never null.
   */
  public List<Workbook> selectedWorkbooks() {
    if (selection().all()) {
      return activeWorkbooks();
    }
    return currentWorkbook().map(List::of).orElse(List.of());
  }

  /** Loads the content of a workbook, reading it only once.
   *
   * @param workbook the workbook, cannot be null.
   *
   * @return the content, never null.
   *
   * @throws NotFoundException if the workbook is not in the active
   * collection, or the store has no content for it.
   * @throws UncheckedIOException if reading fails.
   */
  public WorkbookContent load(final Workbook workbook) {
    final Workbook member = requireActive(workbook);
    final WorkbookContent cached = cache.get(member.id());
    if (cached != null) {
      return cached;
    }
    try {
      final WorkbookContent content = cache.computeIfAbsent(member.id(),
          id -> contentStore.load(member.url()));
      member.markLoaded(true);
      member.lastError(null);
      metrics.workbookLoaded(member.id(), content.size());
      log.info("Loaded workbook {} ({} bytes)", member.id(), content.size());
      return content;
    } catch (final BudmanException | UncheckedIOException e) {
      member.lastError(e.getMessage());
      throw e;
    }
  }

  /** Loads the content of a referenced workbook.
   *
   * @param reference the reference, cannot be null.
   *
   * @return the content, never null.
   *
   * @throws NotFoundException if the reference matches no single workbook.
   */
  public WorkbookContent load(final WorkbookReference reference) {
    return load(requireSingle(reference));
  }

  /** Replaces the cached content of a workbook, marking it loaded.
   *
   * @param workbook the workbook, cannot be null.
   * @param data the new content, cannot be null.
   *
   * @return the cached content, never null.
   *
   * @throws NotFoundException if the workbook is not in the active
   * collection.
   */
  public WorkbookContent update(final Workbook workbook, final byte[] data) {
    Objects.requireNonNull(data, "data must not be null");
    final Workbook member = requireActive(workbook);
    final WorkbookContent content = WorkbookContent.of(member.url(), data);
    cache.put(member.id(), content);
    member.markLoaded(true);
    log.debug("Updated content of workbook {}", member.id());
    return content;
  }

  /** Writes the cached content of a workbook back to the store.
   *
   * @param workbook the workbook, cannot be null.
   *
   * @return the acknowledgement, never null.
   *
   * @throws NotFoundException if no content is cached for the workbook.
   * @throws UncheckedIOException if writing fails.
   */
  public SaveAck save(final Workbook workbook) {
    Objects.requireNonNull(workbook, "workbook must not be null");
    final WorkbookContent content = cache.get(workbook.id());
    if (content == null) {
      throw new NotFoundException("Workbook " + workbook.id()
          + " is not loaded, nothing to save");
    }
    try {
      final SaveAck ack = contentStore.save(content, workbook.url());
      workbook.lastError(null);
      metrics.workbookSaved(workbook.id(), ack.bytes());
      log.info("Saved workbook {} ({} bytes)", workbook.id(), ack.bytes());
      return ack;
    } catch (final BudmanException | UncheckedIOException e) {
      workbook.lastError(e.getMessage());
      throw e;
    }
  }

  /** Writes the cached content of a referenced workbook back to the store.
   *
   * @param reference the reference, cannot be null.
   *
   * @return the acknowledgement, never null.
   *
   * @throws NotFoundException if the reference matches no single workbook
   * or the workbook is not loaded.
   */
  public SaveAck save(final WorkbookReference reference) {
    return save(requireSingle(reference));
  }

  /** Drops the cached content of a workbook.
   *
   * @param workbook the workbook, cannot be null.
   *
   * @return true if content was cached.
   */
  public boolean unload(final Workbook workbook) {
    Objects.requireNonNull(workbook, "workbook must not be null");
    final boolean wasLoaded = cache.remove(workbook.id()) != null;
    workbook.markLoaded(false);
    if (wasLoaded) {
      log.debug("Unloaded workbook {}", workbook.id());
    }
    return wasLoaded;
  }

  /** Returns the cached content of a workbook without loading it.
   *
   * @param workbook the workbook, cannot be null.
   *
   * @return the content, empty if the workbook is not loaded.
   */
  public Optional<WorkbookContent> cached(final Workbook workbook) {
    Objects.requireNonNull(workbook, "workbook must not be null");
    return Optional.ofNullable(cache.get(workbook.id()));
  }

  /** Changes the type of a workbook of the active collection.
   *
   * @param workbook the workbook, cannot be null.
   * @param type the new type, cannot be null.
   *
   * @throws NotFoundException if the workbook is not in the active
   * collection.
   */
  public void reclassify(final Workbook workbook, final WorkbookType type) {
    Objects.requireNonNull(type, "type must not be null");
    final Workbook member = requireActive(workbook);
    final WorkbookType previous = member.type();
    member.reclassify(type);
    log.info("Reclassified workbook {} from {} to {}", member.id(), previous,
        type);
  }

  /** Removes referenced workbooks from the catalog, dropping their content.
   *
   * <p>The files are left untouched. The {@code all} reference removes every
   * workbook of the active collection.</p>
   *
   * @param reference the reference, cannot be null.
   *
   * @return the removed workbooks, never null.
   *
   * @throws NotFoundException if the reference matches nothing.
   */
  public List<Workbook> remove(final WorkbookReference reference) {
    final ReferenceResolution resolution = resolveReference(reference);
    if (!resolution.found()) {
      throw new NotFoundException("No workbook matches " + reference);
    }
    final List<Workbook> targets = resolution.all() ? activeWorkbooks()
        : List.of(resolution.workbook());
    final List<Workbook> removed = new ArrayList<>();
    for (final Workbook workbook : targets) {
      unload(workbook);
      removed.add(model.removeWorkbook(workbook.fiKey(), workbook.id()));
    }
    selection();
    return removed;
  }

  /** Returns the ids of every loaded workbook.
   *
   * @return an immutable list, never null.
   */
  public List<String> loadedIds() {
    return List.copyOf(cache.keySet());
  }

  /** Captures the selectors as working state defaults.
   *
   * @return the record, never null.
   */
  public WorkingStateRecord toWorkingStateRecord() {
    final WorkbookSelection current = selection();
    return new WorkingStateRecord(fiKey, wfKey, purpose.value(),
        current.id(), current.all());
  }

  /** Stores a resolution as the current selection.
   *
   * @param resolution a resolution that found something, never null.
   */
  private void select(final ReferenceResolution resolution) {
    if (resolution.all()) {
      selection.set(WorkbookSelection.ALL);
      log.debug("Selected every workbook of {}", fiKey);
      return;
    }
    final Workbook workbook = resolution.workbook();
    selection.set(new WorkbookSelection(resolution.index(), workbook.id(),
        workbook.name(), false));
    log.debug("Selected workbook {}", workbook.id());
  }

  /** Returns the collection of the selected financial institution.
   *
   * @return the collection, null if none is selected.
   */
  private WorkbookCollection activeCollection() {
    final String key = fiKey;
    return key == null ? null : model.workbooks(key);
  }

  /** Returns the active collection entry for a workbook.
   *
   * @param workbook the workbook, cannot be null.
   *
   * @return the cataloged workbook, never null.
   */
  private Workbook requireActive(final Workbook workbook) {
    Objects.requireNonNull(workbook, "workbook must not be null");
    final WorkbookCollection collection = activeCollection();
    final Optional<Workbook> member = collection == null ? Optional.empty()
        : collection.get(workbook.id());
    return member.orElseThrow(() -> new NotFoundException("Workbook "
        + workbook.id() + " is not in the active collection of " + fiKey));
  }

  /** Resolves a reference that must match exactly one workbook.
   *
   * @param reference the reference, cannot be null.
   *
   * @return the workbook, never null.
   */
  private Workbook requireSingle(final WorkbookReference reference) {
    return resolveReference(reference).single().orElseThrow(() ->
        new NotFoundException("No single workbook matches " + reference));
  }

  /** Tells whether a non positional reference designates a workbook.
   *
   * @param reference the reference, never null.
   * @param workbook the workbook, never null.
   *
   * @return true on an exact match.
   */
  private static boolean matches(final WorkbookReference reference,
      final Workbook workbook) {
    if (reference instanceof WorkbookReference.IdRef idRef) {
      return workbook.id().equals(idRef.id());
    }
    if (reference instanceof WorkbookReference.NameRef nameRef) {
      return workbook.name().equals(nameRef.name());
    }
    if (reference instanceof WorkbookReference.UrlRef urlRef) {
      return workbook.url().toString().equals(urlRef.url());
    }
    return false;
  }

  /** Resolves a numeric text as an index.
   *
   * @param digits the text, only digits.
   *
   * @return the resolution, never null.
   */
  private ReferenceResolution resolveIndex(final String digits) {
    try {
      return resolveReference(Integer.parseInt(digits));
    } catch (final NumberFormatException e) {
      log.debug("Index {} is out of range", digits);
      return ReferenceResolution.notFound();
    }
  }

  /** Picks a default key, falling back to the first configured one.
   *
   * @param key the default key, may be null.
   * @param kind what the key identifies, for logging.
   * @param configured the configured keys, never null.
   *
   * @return the key, null when nothing is configured.
   */
  private static String defaultKey(final String key, final String kind,
      final List<String> configured) {
    if (key != null && configured.contains(key)) {
      return key;
    }
    final String fallback = configured.isEmpty() ? null : configured.get(0);
    if (key != null) {
      log.warn("Default {} '{}' is not configured, using '{}'", kind, key,
          fallback);
    }
    return fallback;
  }

  /** Parses the default purpose, falling back to {@link Purpose#WORKING}.
   *
   * @param value the default value, may be null.
   *
   * @return the purpose, never null.
   */
  private static Purpose defaultPurpose(final String value) {
    if (value == null) {
      return Purpose.WORKING;
    }
    try {
      return Purpose.of(value);
    } catch (final ConfigurationException e) {
      log.warn("Default purpose '{}' is unknown, using '{}'", value,
          Purpose.WORKING);
      return Purpose.WORKING;
    }
  }

  /** Tells whether a text is made only of ascii digits.
   *
   * @param text the text, never null nor empty.
   *
   * @return true if numeric.
   */
  private static boolean isNumeric(final String text) {
    for (int i = 0; i < text.length(); i++) {
      final char c = text.charAt(i);
      if (c < '0' || c > '9') {
        return false;
      }
    }
    return true;
  }
}
