package org.waabox.budman;

import java.net.URI;
import java.util.Objects;

/**
 * A catalog entry for one workbook file and the role it plays.
 *
 * <p>The identity and placement of a workbook never change once it is
 * cataloged. Only the data context mutates the rest: the type when the
 * workbook is reclassified, and the loaded flag and last error as content
 * moves in and out of the cache.</p>
 *
 * <p>Instances are created with {@link #builder()}.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Workbook {

  /** The stable id, see {@link WorkbookId}, never null. */
  private final String id;

  /** The file name including the extension, never null. */
  private final String name;

  /** The file extension including the dot, never null. */
  private final String filetype;

  /** Where the content is stored, never null. */
  private final URI url;

  /** The owning financial institution key, never null. */
  private final String fiKey;

  /** The owning workflow key, never null. */
  private final String wfKey;

  /** The purpose of the folder the workbook lives in, never null. */
  private final Purpose purpose;

  /** The folder role id the workbook was found through, never null. */
  private final String folderRoleId;

  /** The folder relative to the institution folder, never null. */
  private final String folder;

  /** The workbook type, never null. */
  private volatile WorkbookType type;

  /** Whether the content is currently cached by a data context. */
  private volatile boolean loaded;

  /** The message of the last failed load or save, null if none. */
  private volatile String lastError;

  /** Creates a new workbook from its builder.
   *
   * @param builder the builder, cannot be null.
   */
  private Workbook(final Builder builder) {
    id = WorkbookId.of(builder.fiKey, builder.wfKey, builder.purpose,
        builder.folder, builder.name);
    name = builder.name;
    filetype = extensionOf(builder.name);
    url = builder.url;
    fiKey = builder.fiKey;
    wfKey = builder.wfKey;
    purpose = builder.purpose;
    folderRoleId = builder.folderRoleId;
    folder = builder.folder;
    type = builder.type != null
        ? builder.type
        : WorkbookType.determine(stemOf(builder.name), filetype);
  }

  /** Creates a new builder.
   *
   * @return the builder, never null.
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns the stable id.
   *
   * @return the id, never null.
   */
  public String id() {
    return id;
  }

  /** Returns the file name including the extension.
   *
   * @return the name, never null.
   */
  public String name() {
    return name;
  }

  /** Returns the file name without the extension.
   *
   * @return the stem, never null.
   */
  public String stem() {
    return stemOf(name);
  }

  /** Returns the file extension including the dot.
   *
   * @return the extension, empty if the file has none, never null.
   */
  public String filetype() {
    return filetype;
  }

  /** Returns where the workbook content is stored.
   *
   * @return the url, never null.
   */
  public URI url() {
    return url;
  }

  public String fiKey() {
    return fiKey;
  }

  public String wfKey() {
    return wfKey;
  }

  public Purpose purpose() {
    return purpose;
  }

  public String folderRoleId() {
    return folderRoleId;
  }

  public String folder() {
    return folder;
  }

  public WorkbookType type() {
    return type;
  }

  /** Changes the workbook type.
   *
   * @param newType the new type, cannot be null.
   */
  public void reclassify(final WorkbookType newType) {
    type = Objects.requireNonNull(newType, "type must not be null");
  }

  public boolean loaded() {
    return loaded;
  }

  /** Marks the content as cached or evicted.
   *
   * @param isLoaded true when the content is cached.
   */
  public void markLoaded(final boolean isLoaded) {
    loaded = isLoaded;
  }

  /** Returns the message of the last failed load or save.
   *
   * @return the message, null if the last operation succeeded.
   */
  public String lastError() {
    return lastError;
  }

  /** Records the outcome of a load or save.
   *
   * @param message the failure message, null to clear it.
   */
  public void lastError(final String message) {
    lastError = message;
  }

  /** Returns the extension of a file name, including the dot.
   *
   * @param filename the file name, cannot be null.
   *
   * @return the extension, empty if there is none.
   */
  static String extensionOf(final String filename) {
    final int dot = filename.lastIndexOf('.');
    return dot <= 0 ? "" : filename.substring(dot);
  }

  /** Returns a file name without its extension.
   *
   * @param filename the file name, cannot be null.
   *
   * @return the stem, never null.
   */
  static String stemOf(final String filename) {
    final int dot = filename.lastIndexOf('.');
    return dot <= 0 ? filename : filename.substring(0, dot);
  }

  @Override
  public boolean equals(final Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Workbook)) {
      return false;
    }
    return id.equals(((Workbook) other).id);
  }

  @Override
  public int hashCode() {
    return id.hashCode();
  }

  @Override
  public String toString() {
    return "Workbook{id='" + id + "', type=" + type + ", loaded=" + loaded
        + "}";
  }

  /** Builds {@link Workbook} instances. */
  public static final class Builder {

    /** The file name, required. */
    private String name;

    /** The storage url, required. */
    private URI url;

    /** The financial institution key, required. */
    private String fiKey;

    /** The workflow key, required. */
    private String wfKey;

    /** The purpose, required. */
    private Purpose purpose;

    /** The folder role id, required. */
    private String folderRoleId;

    /** The relative folder, required. */
    private String folder;

    /** The type, guessed from the name when null. */
    private WorkbookType type;

    private Builder() {
    }

    public Builder name(final String theName) {
      name = Objects.requireNonNull(theName, "name must not be null");
      return this;
    }

    public Builder url(final URI theUrl) {
      url = Objects.requireNonNull(theUrl, "url must not be null");
      return this;
    }

    public Builder institution(final String theFiKey) {
      fiKey = Objects.requireNonNull(theFiKey, "fiKey must not be null");
      return this;
    }

    public Builder workflow(final String theWfKey) {
      wfKey = Objects.requireNonNull(theWfKey, "wfKey must not be null");
      return this;
    }

    public Builder purpose(final Purpose thePurpose) {
      purpose = Objects.requireNonNull(thePurpose,
          "purpose must not be null");
      return this;
    }

    /** Sets the folder role the workbook was found through.
     *
     * @param role the folder role, cannot be null.
     *
     * @return this builder.
     */
    public Builder folderRole(final FolderRole role) {
      Objects.requireNonNull(role, "role must not be null");
      folderRoleId = role.id();
      folder = role.folder();
      return this;
    }

    /** Sets the type, overriding the guess made from the file name.
     *
     * @param theType the type, may be null to guess.
     *
     * @return this builder.
     */
    public Builder type(final WorkbookType theType) {
      type = theType;
      return this;
    }

    /** Builds the workbook.
     *
     * @return the workbook, never null.
     *
     * @throws NullPointerException if a required attribute is missing.
     */
    public Workbook build() {
      Objects.requireNonNull(name, "name must be set");
      Objects.requireNonNull(url, "url must be set");
      Objects.requireNonNull(fiKey, "institution must be set");
      Objects.requireNonNull(wfKey, "workflow must be set");
      Objects.requireNonNull(purpose, "purpose must be set");
      Objects.requireNonNull(folderRoleId, "folderRole must be set");
      return new Workbook(this);
    }
  }
}
