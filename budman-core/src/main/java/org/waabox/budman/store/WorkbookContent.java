package org.waabox.budman.store;

import java.net.URI;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Objects;

/**
 * The opaque content of a workbook, as read from or written to a
 * {@link WorkbookContentStore}.
 *
 * <p>The bytes are defensively copied on construction and on access. Two
 * contents are equal when their bytes are; the SHA-256 hash is kept so that
 * callers can compare or log contents cheaply.</p>
 *
 * @param url  where the content was read from, never null
 * @param hash the hex encoded SHA-256 hash of the data, never null
 * @param data the raw bytes, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record WorkbookContent(URI url, String hash, byte[] data) {

  /** Lookup table for hex encoding. */
  private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();

  /**
   * Compact constructor that defensively copies the data and validates
   * required fields.
   */
  public WorkbookContent {
    Objects.requireNonNull(url, "url must not be null");
    Objects.requireNonNull(hash, "hash must not be null");
    Objects.requireNonNull(data, "data must not be null");
    data = data.clone();
  }

  /** Creates a content, computing the hash of the data.
   *
   * @param url where the content lives, cannot be null.
   * @param data the raw bytes, cannot be null.
   *
   * @return the content, never null.
   */
  public static WorkbookContent of(final URI url, final byte[] data) {
    Objects.requireNonNull(data, "data must not be null");
    return new WorkbookContent(url, computeHash(data), data);
  }

  /**
   * Returns a defensive copy of the data.
   *
   * @return a copy of the bytes, never null
   */
  @Override
  public byte[] data() {
    return data.clone();
  }

  /** Returns the content size.
   *
   * @return the number of bytes.
   */
  public int size() {
    return data.length;
  }

  /**
   * Compares contents by their bytes, ignoring where they were read from.
   *
   * @param o the object to compare with
   * @return true if the bytes are equal
   */
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof WorkbookContent that)) {
      return false;
    }
    return hash.equals(that.hash) && Arrays.equals(data, that.data);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    return "WorkbookContent{url=" + url + ", size=" + data.length
        + ", hash=" + hash + "}";
  }

  /**
   * Computes the SHA-256 hash of the given bytes.
   *
   * @param data the bytes to hash, never null
   *
   * @return the hex encoded hash, never null
   */
  static String computeHash(final byte[] data) {
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return toHexString(digest.digest(data));
    } catch (final NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }

  /**
   * Converts a byte array to a lowercase hex string.
   *
   * @param bytes the bytes to convert, never null
   *
   * @return the hex string, never null
   */
  private static String toHexString(final byte[] bytes) {
    final char[] hexChars = new char[bytes.length * 2];
    for (int i = 0; i < bytes.length; i++) {
      final int v = bytes[i] & 0xFF;
      hexChars[i * 2] = HEX_CHARS[v >>> 4];
      hexChars[i * 2 + 1] = HEX_CHARS[v & 0x0F];
    }
    return new String(hexChars);
  }
}
