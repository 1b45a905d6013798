package org.waabox.budman.store;

import java.net.URI;
import java.time.Instant;
import java.util.Objects;

/**
 * Acknowledges that a store persisted something.
 *
 * @param url     where it was written, never null
 * @param bytes   how many bytes were written
 * @param savedAt when the write completed, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SaveAck(URI url, long bytes, Instant savedAt) {

  /**
   * Creates an acknowledgement, validating its arguments.
   *
   * @throws NullPointerException if url or savedAt is null
   */
  public SaveAck {
    Objects.requireNonNull(url, "url must not be null");
    Objects.requireNonNull(savedAt, "savedAt must not be null");
  }
}
