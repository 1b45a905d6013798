package org.waabox.budman.categorization;

/**
 * Maps a transaction description to a budget category.
 *
 * <p>Categorization runs after the engine has decided which workbooks a
 * workflow processes; the engine never calls it itself.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface Categorizer {

  /**
   * Returns the category of a description.
   *
   * @param description the transaction description, may be null
   *
   * @return the category, never null
   */
  String categorize(String description);
}
