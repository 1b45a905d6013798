package org.waabox.budman.context;

/**
 * The lifecycle of a {@link DataContext}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum ContextState {

  /** Nothing is selected yet. */
  UNINITIALIZED,

  /** Selectors hold the configuration defaults; the catalog is loading. */
  INITIALIZING,

  /** The catalog is populated and every selector is valid. */
  READY
}
