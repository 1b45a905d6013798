package org.waabox.budman.storage;

import java.net.URI;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A workbook file found by {@link WorkbookDiscovery}.
 *
 * @param name      the file name including the extension, never null
 * @param stem      the file name without the extension, never null
 * @param extension the lower cased extension including the dot, never null
 * @param path      the absolute path of the file, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record FileDescriptor(String name, String stem, String extension,
    Path path) {

  /**
   * Creates a descriptor, validating its arguments.
   *
   * @throws NullPointerException if any argument is null
   */
  public FileDescriptor {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(stem, "stem must not be null");
    Objects.requireNonNull(extension, "extension must not be null");
    Objects.requireNonNull(path, "path must not be null");
  }

  /** Returns the storage url of the file.
   *
   * @return the {@code file:} url, never null.
   */
  public URI url() {
    return path.toUri();
  }
}
