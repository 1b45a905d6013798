package org.waabox.budman.store;

import java.net.URI;

/**
 * Reads and writes configuration records.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ConfigurationStore {

  /**
   * Reads the configuration record stored at a url.
   *
   * @param url where the record lives, never null
   *
   * @return the record, never null
   *
   * @throws org.waabox.budman.NotFoundException if nothing is stored there
   * @throws org.waabox.budman.ConfigurationException if the stored record
   *         cannot be parsed
   */
  ConfigurationRecord get(URI url);

  /**
   * Writes a configuration record to a url, replacing what was there.
   *
   * @param record the record, never null
   * @param url    where to write it, never null
   *
   * @return the acknowledgement, never null
   */
  SaveAck put(ConfigurationRecord record, URI url);
}
