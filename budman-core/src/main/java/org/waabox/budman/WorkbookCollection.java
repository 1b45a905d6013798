package org.waabox.budman;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The workbooks of a financial institution, keyed and ordered by id.
 *
 * <p>Ids are unique. Writers are serialized by a lock and publish a new
 * immutable snapshot on every change, so readers never block and always
 * see a complete state. The id order is the stable display order that
 * index based workbook references rely on.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class WorkbookCollection {

  /** Serializes writers. */
  private final ReentrantLock writeLock = new ReentrantLock();

  /** The current snapshot, never modified once published. */
  private volatile SortedMap<String, Workbook> snapshot =
      Collections.unmodifiableSortedMap(new TreeMap<>());

  /** Returns the number of workbooks.
   *
   * @return the size.
   */
  public int size() {
    return snapshot.size();
  }

  public boolean isEmpty() {
    return snapshot.isEmpty();
  }

  /** Tells whether a workbook with the given id is cataloged.
   *
   * @param id the id, cannot be null.
   *
   * @return true if present.
   */
  public boolean contains(final String id) {
    Objects.requireNonNull(id, "id must not be null");
    return snapshot.containsKey(id);
  }

  /** Returns the workbook with the given id.
   *
   * @param id the id, cannot be null.
   *
   * @return the workbook, empty if absent.
   */
  public Optional<Workbook> get(final String id) {
    Objects.requireNonNull(id, "id must not be null");
    return Optional.ofNullable(snapshot.get(id));
  }

  /** Returns the workbooks sorted by id.
   *
   * @return an immutable list, never null.
   */
  public List<Workbook> sorted() {
    return List.copyOf(snapshot.values());
  }

  /** Returns the ids in sorted order.
   *
   * @return an immutable list, never null.
   */
  public List<String> ids() {
    return List.copyOf(snapshot.keySet());
  }

  /** Adds a workbook unless one with the same id is already present.
   *
   * @param workbook the workbook, cannot be null.
   *
   * @return true if it was added, false if the id was already taken, in
   * which case the existing entry is kept untouched.
   */
  public boolean addIfAbsent(final Workbook workbook) {
    Objects.requireNonNull(workbook, "workbook must not be null");
    return !addAllIfAbsent(List.of(workbook)).isEmpty();
  }

  /** Adds every workbook whose id is not already present.
   *
   * <p>The whole batch is published as one snapshot.</p>
   *
   * @param workbooks the candidates, cannot be null.
   *
   * @return the ids that were added, in the order given, never null.
   */
  public List<String> addAllIfAbsent(
      final Collection<Workbook> workbooks) {
    Objects.requireNonNull(workbooks, "workbooks must not be null");
    writeLock.lock();
    try {
      final TreeMap<String, Workbook> next = new TreeMap<>(snapshot);
      final List<String> added = new ArrayList<>();
      for (final Workbook workbook : workbooks) {
        if (next.putIfAbsent(workbook.id(), workbook) == null) {
          added.add(workbook.id());
        }
      }
      if (!added.isEmpty()) {
        snapshot = Collections.unmodifiableSortedMap(next);
      }
      return Collections.unmodifiableList(added);
    } finally {
      writeLock.unlock();
    }
  }

  /** Removes a workbook.
   *
   * @param id the id, cannot be null.
   *
   * @return the removed workbook, empty if there was none.
   */
  public Optional<Workbook> remove(final String id) {
    Objects.requireNonNull(id, "id must not be null");
    writeLock.lock();
    try {
      if (!snapshot.containsKey(id)) {
        return Optional.empty();
      }
      final TreeMap<String, Workbook> next = new TreeMap<>(snapshot);
      final Workbook removed = next.remove(id);
      snapshot = Collections.unmodifiableSortedMap(next);
      return Optional.of(removed);
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public String toString() {
    return "WorkbookCollection" + snapshot.keySet();
  }
}
