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
import org.waabox.budman.store.ConfigurationRecord;
import org.waabox.budman.store.ConfigurationRecordCodec;
import org.waabox.budman.store.ConfigurationStore;
import org.waabox.budman.store.SaveAck;

/**
 * A {@link ConfigurationStore} that keeps configuration records as JSON
 * files on the local filesystem.
 *
 * <p>Both {@code .json} and {@code .jsonc} files are read; comments and
 * trailing commas are allowed. Records are written pretty printed through
 * a temporary file that is then moved over the target.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JsonConfigurationStore implements ConfigurationStore {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      JsonConfigurationStore.class);

  /**
   * {@inheritDoc}
   *
   * @throws IllegalArgumentException if the url is not a {@code file:} url
   */
  @Override
  public ConfigurationRecord get(final URI url) {
    final Path file = FileUrls.toPath(url);
    if (!Files.isRegularFile(file)) {
      throw new NotFoundException("Configuration file " + file
          + " does not exist");
    }
    final byte[] json;
    try {
      json = Files.readAllBytes(file);
    } catch (final IOException e) {
      throw new UncheckedIOException(
          "Failed to read configuration " + file, e);
    }
    final ConfigurationRecord record =
        ConfigurationRecordCodec.deserialize(json);
    log.info("Read configuration {} from {}", record.id(), file);
    return record;
  }

  /**
   * {@inheritDoc}
   *
   * @throws IllegalArgumentException if the url is not a {@code file:} url
   */
  @Override
  public SaveAck put(final ConfigurationRecord record, final URI url) {
    Objects.requireNonNull(record, "record must not be null");
    final Path file = FileUrls.toPath(url);
    final byte[] json = ConfigurationRecordCodec.serialize(record);
    FileUrls.writeAtomically(file, json);
    log.info("Wrote configuration {} to {}", record.id(), file);
    return new SaveAck(url, json.length, Instant.now());
  }
}
