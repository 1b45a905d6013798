package org.waabox.budman.store.fs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Filesystem helpers shared by the stores of this package.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class FileUrls {

  /** The suffix of the temporary file a write goes through. */
  private static final String TEMP_SUFFIX = ".tmp";

  /** Private constructor to prevent instantiation. */
  private FileUrls() {
    throw new UnsupportedOperationException("Utility class");
  }

  /** Converts a {@code file:} url into a path.
   *
   * @param url the url, cannot be null.
   *
   * @return the absolute path, never null.
   *
   * @throws IllegalArgumentException if the url is not a {@code file:} url.
   */
  static Path toPath(final URI url) {
    Objects.requireNonNull(url, "url must not be null");
    if (!"file".equalsIgnoreCase(url.getScheme())) {
      throw new IllegalArgumentException(
          "Only file: urls are supported, got: " + url);
    }
    return Paths.get(url).toAbsolutePath().normalize();
  }

  /** Writes bytes to a file atomically.
   *
   * <p>The data is written to a temporary file next to the target, which
   * is then moved over it, so a crash mid write leaves the previous content
   * intact. Missing parent folders are created.</p>
   *
   * @param file the target file, cannot be null.
   * @param data the bytes, cannot be null.
   *
   * @throws UncheckedIOException if writing fails.
   */
  static void writeAtomically(final Path file, final byte[] data) {
    final Path parent = file.getParent();
    final Path temp = file.resolveSibling(file.getFileName() + TEMP_SUFFIX);
    try {
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.write(temp, data);
      Files.move(temp, file,
          StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to write " + file, e);
    }
  }
}
