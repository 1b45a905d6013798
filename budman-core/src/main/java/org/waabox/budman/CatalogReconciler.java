package org.waabox.budman;

import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges discovered workbooks into a {@link WorkbookCollection}.
 *
 * <p>Reconciliation only adds. A candidate whose id is already cataloged is
 * ignored, so the existing entry keeps its loaded state and any
 * reclassification. Entries with no matching candidate stay as they are;
 * dropping them is the job of {@link BudgetDomainModel#pruneMissing}.
 * Running the same reconciliation twice leaves the collection unchanged.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CatalogReconciler {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      CatalogReconciler.class);

  /**
   * The outcome of a reconciliation.
   *
   * @param collection the reconciled collection, never null
   * @param addedIds   the ids that were added, in discovery order, never
   *                   null
   */
  public record ReconcileResult(WorkbookCollection collection,
      List<String> addedIds) {

    /**
     * Creates a result, validating its arguments.
     *
     * @throws NullPointerException if any argument is null
     */
    public ReconcileResult {
      Objects.requireNonNull(collection, "collection must not be null");
      addedIds = List.copyOf(
          Objects.requireNonNull(addedIds, "addedIds must not be null"));
    }
  }

  /** Merges candidates into a collection.
   *
   * @param existing the collection to update, cannot be null.
   * @param discovered the candidates, cannot be null.
   *
   * @return the updated collection and the ids added to it, never null.
   */
  public ReconcileResult reconcile(final WorkbookCollection existing,
      final List<Workbook> discovered) {
    Objects.requireNonNull(existing, "existing must not be null");
    Objects.requireNonNull(discovered, "discovered must not be null");

    final List<String> added = existing.addAllIfAbsent(discovered);
    for (final String id : added) {
      log.info("Added workbook {}", id);
    }
    log.debug("Reconciled {} candidate(s), {} added, {} cataloged",
        discovered.size(), added.size(), existing.size());
    return new ReconcileResult(existing, added);
  }

  /** Finds the cataloged workbooks whose backing file no longer exists.
   *
   * <p>Only {@code file:} urls naming a local path are checked; other
   * workbooks are never reported.</p>
   *
   * @param collection the collection to check, cannot be null.
   *
   * @return the stale ids in id order, never null.
   */
  public List<String> findStale(final WorkbookCollection collection) {
    Objects.requireNonNull(collection, "collection must not be null");
    final List<String> stale = new ArrayList<>();
    for (final Workbook workbook : collection.sorted()) {
      if (!"file".equalsIgnoreCase(workbook.url().getScheme())) {
        continue;
      }
      final Path path;
      try {
        path = Paths.get(workbook.url());
      } catch (final IllegalArgumentException
          | FileSystemNotFoundException e) {
        log.warn("Cannot check workbook {}, url {} is not a local file: {}",
            workbook.id(), workbook.url(), e.getMessage());
        continue;
      }
      if (!Files.isRegularFile(path)) {
        stale.add(workbook.id());
      }
    }
    return stale;
  }
}
