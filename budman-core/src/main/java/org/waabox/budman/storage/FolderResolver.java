package org.waabox.budman.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.budman.ConfigurationException;
import org.waabox.budman.NotFoundException;

/**
 * Turns the folder strings of a configuration into absolute paths and
 * verifies, or creates, the directories behind them.
 *
 * <p>A leading {@code ~} in the root folder expands to the user home. The
 * result is absolute and normalized; segments are never rewritten in any
 * other way, so a nested folder that is itself absolute is rejected
 * instead of silently replacing the root.</p>
 *
 * <p>The only side effect of this class is directory creation.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FolderResolver {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      FolderResolver.class);

  /** The user home folder a leading {@code ~} expands to, never null. */
  private final Path userHome;

  /** Creates a resolver that expands {@code ~} to the JVM user home. */
  public FolderResolver() {
    this(Paths.get(System.getProperty("user.home")));
  }

  /** Creates a resolver with an explicit user home.
   *
   * @param theUserHome the folder {@code ~} expands to, cannot be null.
   */
  public FolderResolver(final Path theUserHome) {
    userHome = Objects.requireNonNull(theUserHome,
        "userHome must not be null");
  }

  /** Resolves a root folder and any number of nested relative folders.
   *
   * @param root the root folder, may start with {@code ~}, cannot be blank.
   * @param folders the nested folders, relative, none can be blank.
   *
   * @return the absolute, normalized path, never null.
   *
   * @throws ConfigurationException if a segment is null or blank, or if a
   * nested folder is absolute.
   */
  public Path resolve(final String root, final String... folders) {
    requireSegment(root, "root folder");
    try {
      Path path = expandHome(root.trim());
      for (final String folder : folders) {
        requireSegment(folder, "folder");
        final Path nested = Paths.get(folder.trim());
        if (nested.isAbsolute()) {
          throw new ConfigurationException("Folder '" + folder
              + "' must be relative to '" + path + "'");
        }
        path = path.resolve(nested);
      }
      return path.toAbsolutePath().normalize();
    } catch (final InvalidPathException e) {
      throw new ConfigurationException("Invalid folder under '" + root
          + "': " + e.getMessage(), e);
    }
  }

  /** Verifies that a directory exists, optionally creating it.
   *
   * <p>A path that exists but is not a directory is reported as missing
   * and is never replaced.</p>
   *
   * @param path the directory, cannot be null.
   * @param createIfMissing whether to create it, with its parents, when it
   * does not exist.
   * @param raiseOnMissing whether a missing directory is an error rather
   * than a false result.
   *
   * @return true if the directory exists when this method returns.
   *
   * @throws NotFoundException if the directory is missing and
   * raiseOnMissing is set.
   * @throws UncheckedIOException if the directory cannot be created.
   */
  public boolean verify(final Path path, final boolean createIfMissing,
      final boolean raiseOnMissing) {
    Objects.requireNonNull(path, "path must not be null");

    if (Files.isDirectory(path)) {
      return true;
    }

    if (Files.exists(path)) {
      log.warn("Path {} exists but is not a directory", path);
      return missing(path, raiseOnMissing, "is not a directory");
    }

    if (createIfMissing) {
      try {
        Files.createDirectories(path);
      } catch (final IOException e) {
        throw new UncheckedIOException(
            "Failed to create folder: " + path, e);
      }
      log.info("Created folder {}", path);
      return true;
    }

    log.debug("Folder {} does not exist", path);
    return missing(path, raiseOnMissing, "does not exist");
  }

  /** Reports a missing directory the way the caller asked for.
   *
   * @param path the directory, never null.
   * @param raise whether to throw.
   * @param reason the reason, never null.
   *
   * @return always false.
   */
  private boolean missing(final Path path, final boolean raise,
      final String reason) {
    if (raise) {
      throw new NotFoundException("Folder " + path + " " + reason);
    }
    return false;
  }

  /** Expands a leading {@code ~} to the user home.
   *
   * @param root the trimmed root folder, never null.
   *
   * @return the expanded path, never null.
   */
  private Path expandHome(final String root) {
    if (root.equals("~")) {
      return userHome;
    }
    if (root.startsWith("~/") || root.startsWith("~\\")) {
      return userHome.resolve(root.substring(2));
    }
    return Paths.get(root);
  }

  /** Fails if a configuration segment is unset.
   *
   * @param segment the segment, may be null.
   * @param what what the segment is, for the message.
   */
  private static void requireSegment(final String segment,
      final String what) {
    if (segment == null || segment.isBlank()) {
      throw new ConfigurationException(what + " must not be blank");
    }
  }
}
