package org.waabox.budman.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.net.URI;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link WorkbookContent}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class WorkbookContentTest {

  private static final URI URL = URI.create("file:///tmp/A.xlsx");

  @Test
  void whenCreating_givenBytes_shouldComputeSha256() {
    final WorkbookContent content = WorkbookContent.of(URL,
        "abc".getBytes(StandardCharsets.UTF_8));

    assertEquals(
        "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
        content.hash());
    assertEquals(3, content.size());
  }

  @Test
  void whenMutatingSourceArray_givenContent_shouldKeepOriginalBytes() {
    final byte[] data = {1, 2, 3};
    final WorkbookContent content = WorkbookContent.of(URL, data);

    data[0] = 9;
    content.data()[1] = 9;

    assertEquals(1, content.data()[0]);
    assertEquals(2, content.data()[1]);
  }

  @Test
  void whenComparing_givenSameBytesAtOtherUrl_shouldBeEqual() {
    final WorkbookContent a = WorkbookContent.of(URL, new byte[] {1, 2});
    final WorkbookContent b = WorkbookContent.of(
        URI.create("file:///tmp/B.xlsx"), new byte[] {1, 2});

    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, WorkbookContent.of(URL, new byte[] {2, 1}));
  }
}
