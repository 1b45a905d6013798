package org.waabox.budman.context;

import java.util.Objects;

/**
 * A way to point at a workbook of the active collection.
 *
 * <p>Users name workbooks in many ways: by their position in the listing,
 * by id, by file name, by url, or all of them at once. Each way is its own
 * type so {@link DataContext#resolveReference(WorkbookReference)} can
 * resolve them without guessing.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public sealed interface WorkbookReference {

  /** Every workbook of the active collection. */
  record AllRef() implements WorkbookReference {
  }

  /**
   * The workbook at a position of the id sorted active collection.
   *
   * @param index the zero based position
   */
  record IndexRef(int index) implements WorkbookReference {
  }

  /**
   * The workbook with an id.
   *
   * @param id the workbook id, never null
   */
  record IdRef(String id) implements WorkbookReference {

    /** Validates the id. */
    public IdRef {
      Objects.requireNonNull(id, "id must not be null");
    }
  }

  /**
   * The workbook with a file name.
   *
   * @param name the file name including the extension, never null
   */
  record NameRef(String name) implements WorkbookReference {

    /** Validates the name. */
    public NameRef {
      Objects.requireNonNull(name, "name must not be null");
    }
  }

  /**
   * The workbook stored at a url.
   *
   * @param url the storage url, never null
   */
  record UrlRef(String url) implements WorkbookReference {

    /** Validates the url. */
    public UrlRef {
      Objects.requireNonNull(url, "url must not be null");
    }
  }

  static WorkbookReference all() {
    return new AllRef();
  }

  static WorkbookReference index(final int index) {
    return new IndexRef(index);
  }

  static WorkbookReference id(final String id) {
    return new IdRef(id);
  }

  static WorkbookReference name(final String name) {
    return new NameRef(name);
  }

  static WorkbookReference url(final String url) {
    return new UrlRef(url);
  }
}
