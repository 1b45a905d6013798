package org.waabox.budman.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The stored shape of a workflow.
 *
 * <p>A workflow declares folder roles by id, then maps each purpose it
 * supports to one of them:</p>
 * <pre>
 * folders:  { "wf_in": "data/new", "wf_out": "data/categorized" }
 * purposes: { "input": "wf_in", "output": "wf_out" }
 * prefixes: { "wf_out": "categorized_" }
 * </pre>
 *
 * @param key      the unique key
 * @param name     the display name
 * @param folders  relative folder by folder role id, never null
 * @param purposes folder role id by purpose value, never null
 * @param prefixes file name prefix by folder role id, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record WorkflowRecord(
    String key,
    String name,
    Map<String, String> folders,
    Map<String, String> purposes,
    Map<String, String> prefixes
) {

  /** Compact constructor that copies the maps, keeping their order. */
  public WorkflowRecord {
    folders = copy(folders);
    purposes = copy(purposes);
    prefixes = copy(prefixes);
  }

  private static Map<String, String> copy(final Map<String, String> map) {
    return map == null ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(map));
  }
}
