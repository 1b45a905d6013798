package org.waabox.budman.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.budman.FolderRole;
import org.waabox.budman.Purpose;
import org.waabox.budman.Workbook;

/**
 * Scans a folder for workbook files.
 *
 * <p>Only the regular files directly inside the folder whose extension is
 * recognized are reported. Office lock files ({@code ~$...}) and hidden
 * files are skipped. Scanning is tolerant: a folder that is missing or
 * cannot be read yields no files and a logged warning, and an empty folder
 * is not an error.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class WorkbookDiscovery {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      WorkbookDiscovery.class);

  /** The extensions recognized when none are configured. */
  public static final List<String> DEFAULT_EXTENSIONS =
      List.of(".xlsx", ".csv");

  /** The prefix of the lock files office suites leave next to open files. */
  private static final String LOCK_FILE_PREFIX = "~$";

  /** The recognized extensions, lower cased, including the dot. */
  private final Set<String> extensions;

  /** Creates a discovery recognizing {@link #DEFAULT_EXTENSIONS}. */
  public WorkbookDiscovery() {
    this(DEFAULT_EXTENSIONS);
  }

  /** Creates a discovery recognizing the given extensions.
   *
   * @param theExtensions the extensions, with or without the leading dot,
   * cannot be null nor empty.
   */
  public WorkbookDiscovery(final Collection<String> theExtensions) {
    Objects.requireNonNull(theExtensions, "extensions must not be null");
    final Set<String> normalized = new LinkedHashSet<>();
    for (final String extension : theExtensions) {
      final String trimmed = extension.trim().toLowerCase(Locale.ROOT);
      if (!trimmed.isEmpty()) {
        normalized.add(trimmed.startsWith(".") ? trimmed : "." + trimmed);
      }
    }
    if (normalized.isEmpty()) {
      throw new IllegalArgumentException(
          "At least one workbook extension is required");
    }
    extensions = Set.copyOf(normalized);
  }

  /** Returns the recognized extensions.
   *
   * @return the lower cased extensions, never null.
   */
  public Set<String> extensions() {
    return extensions;
  }

  /** Lists the workbook files in a folder.
   *
   * @param folder the folder to scan, cannot be null.
   *
   * @return the files sorted by name, never null.
   */
  public List<FileDescriptor> scan(final Path folder) {
    Objects.requireNonNull(folder, "folder must not be null");

    if (!Files.isDirectory(folder)) {
      log.warn("Cannot scan {}: not an existing folder", folder);
      return List.of();
    }

    final List<Path> files;
    try (Stream<Path> entries = Files.list(folder)) {
      files = entries.filter(Files::isRegularFile)
          .collect(Collectors.toList());
    } catch (final IOException | SecurityException e) {
      log.warn("Cannot scan {}: {}", folder, e.getMessage(), e);
      return List.of();
    }

    final List<FileDescriptor> result = new ArrayList<>();
    for (final Path file : files) {
      final String name = file.getFileName().toString();
      if (name.startsWith(LOCK_FILE_PREFIX) || name.startsWith(".")) {
        log.debug("Skipping {}", file);
        continue;
      }
      final int dot = name.lastIndexOf('.');
      if (dot <= 0) {
        continue;
      }
      final String extension = name.substring(dot).toLowerCase(Locale.ROOT);
      if (extensions.contains(extension)) {
        result.add(new FileDescriptor(name, name.substring(0, dot),
            extension, file.toAbsolutePath().normalize()));
      }
    }
    result.sort(Comparator.comparing(FileDescriptor::name));
    log.debug("Found {} workbook(s) in {}", result.size(), folder);
    return result;
  }

  /** Builds candidate workbooks for every file in a workflow folder.
   *
   * @param fiKey the financial institution key, cannot be null.
   * @param wfKey the workflow key, cannot be null.
   * @param purpose the purpose of the folder, cannot be null.
   * @param role the folder role the folder was resolved from, cannot be
   * null.
   * @param folder the resolved folder, cannot be null.
   *
   * @return the candidates sorted by file name, never null.
   */
  public List<Workbook> discover(final String fiKey, final String wfKey,
      final Purpose purpose, final FolderRole role, final Path folder) {
    Objects.requireNonNull(fiKey, "fiKey must not be null");
    Objects.requireNonNull(wfKey, "wfKey must not be null");
    Objects.requireNonNull(purpose, "purpose must not be null");
    Objects.requireNonNull(role, "role must not be null");

    final List<Workbook> candidates = new ArrayList<>();
    for (final FileDescriptor file : scan(folder)) {
      candidates.add(Workbook.builder()
          .name(file.name())
          .url(file.url())
          .institution(fiKey)
          .workflow(wfKey)
          .purpose(purpose)
          .folderRole(role)
          .build());
    }
    return candidates;
  }
}
