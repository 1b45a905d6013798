package org.waabox.budman.store.fs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.budman.NotFoundException;
import org.waabox.budman.store.SaveAck;
import org.waabox.budman.store.WorkbookContent;
import org.waabox.budman.store.WorkbookContentStore;

/**
 * A {@link WorkbookContentStore} that reads and writes workbook files on the
 * local filesystem.
 *
 * <p>Only {@code file:} urls are supported. Writes use an atomic pattern:
 * the content is written to a temporary file and then moved over the
 * workbook, so a crash mid write never leaves a truncated workbook.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FileSystemWorkbookContentStore
    implements WorkbookContentStore {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      FileSystemWorkbookContentStore.class);

  /**
   * {@inheritDoc}
   *
   * @throws IllegalArgumentException if the url is not a {@code file:} url
   */
  @Override
  public WorkbookContent load(final URI url) {
    final Path file = FileUrls.toPath(url);
    if (!Files.isRegularFile(file)) {
      throw new NotFoundException("Workbook file " + file
          + " does not exist");
    }
    try {
      final byte[] data = Files.readAllBytes(file);
      log.debug("Read {} bytes from {}", data.length, file);
      return WorkbookContent.of(url, data);
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to read workbook " + file, e);
    }
  }

  /**
   * {@inheritDoc}
   *
   * @throws IllegalArgumentException if the url is not a {@code file:} url
   */
  @Override
  public SaveAck save(final WorkbookContent content, final URI url) {
    Objects.requireNonNull(content, "content must not be null");
    final Path file = FileUrls.toPath(url);
    FileUrls.writeAtomically(file, content.data());
    log.debug("Wrote {} bytes to {}", content.size(), file);
    return new SaveAck(url, content.size(), Instant.now());
  }
}
