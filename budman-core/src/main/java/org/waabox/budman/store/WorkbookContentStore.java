package org.waabox.budman.store;

import java.net.URI;

/**
 * Reads and writes the opaque content of workbooks.
 *
 * <p>The store knows nothing about spreadsheets; validating cells is the
 * job of whoever interprets the bytes.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface WorkbookContentStore {

  /**
   * Reads the content stored at a url.
   *
   * @param url where the content lives, never null
   *
   * @return the content, never null
   *
   * @throws org.waabox.budman.NotFoundException if nothing is stored there
   * @throws java.io.UncheckedIOException if reading fails
   */
  WorkbookContent load(URI url);

  /**
   * Writes content to a url, replacing what was there.
   *
   * @param content the content, never null
   * @param url     where to write it, never null
   *
   * @return the acknowledgement, never null
   *
   * @throws java.io.UncheckedIOException if writing fails
   */
  SaveAck save(WorkbookContent content, URI url);
}
