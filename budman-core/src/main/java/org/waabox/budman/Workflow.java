package org.waabox.budman;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A named processing stage, mapping each purpose it supports to a folder
 * role.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Workflow {

  /** The unique key, never null. */
  private final String key;

  /** The display name, never null. */
  private final String name;

  /** The folder role of each supported purpose, never null. */
  private final Map<Purpose, FolderRole> folders;

  /** Creates a new workflow.
   *
   * @param theKey the unique key, cannot be null.
   * @param theName the display name, cannot be null.
   * @param theFolders the folder role of each supported purpose, cannot be
   * null.
   */
  public Workflow(final String theKey, final String theName,
      final Map<Purpose, FolderRole> theFolders) {
    key = Objects.requireNonNull(theKey, "key must not be null");
    name = Objects.requireNonNull(theName, "name must not be null");
    Objects.requireNonNull(theFolders, "folders must not be null");
    final Map<Purpose, FolderRole> copy = new EnumMap<>(Purpose.class);
    copy.putAll(theFolders);
    folders = Collections.unmodifiableMap(copy);
  }

  /** Returns the unique key.
   *
   * @return the key, never null.
   */
  public String key() {
    return key;
  }

  /** Returns the display name.
   *
   * @return the name, never null.
   */
  public String name() {
    return name;
  }

  /** Returns the folder role of each supported purpose, in purpose order.
   *
   * @return an unmodifiable map, never null.
   */
  public Map<Purpose, FolderRole> folders() {
    return folders;
  }

  /** Returns the folder role for the given purpose.
   *
   * @param purpose the purpose, cannot be null.
   *
   * @return the folder role, empty if the workflow does not use the purpose.
   */
  public Optional<FolderRole> folder(final Purpose purpose) {
    Objects.requireNonNull(purpose, "purpose must not be null");
    return Optional.ofNullable(folders.get(purpose));
  }

  @Override
  public String toString() {
    return "Workflow{key='" + key + "', purposes=" + folders.keySet() + "}";
  }
}
