package org.waabox.budman.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.waabox.budman.FolderRole;
import org.waabox.budman.Purpose;
import org.waabox.budman.TestConfigurations;
import org.waabox.budman.Workbook;
import org.waabox.budman.WorkbookType;

/**
 * Tests for {@link WorkbookDiscovery}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class WorkbookDiscoveryTest {

  @Test
  void whenScanning_givenMixedFiles_shouldReturnRecognizedWorkbooksSorted(
      @TempDir final Path folder) throws Exception {
    TestConfigurations.touch(folder, "B.xlsx", "A.xlsx", "register.CSV",
        "notes.txt", "~$A.xlsx", ".hidden.xlsx", "README");
    Files.createDirectories(folder.resolve("nested.xlsx"));

    final List<FileDescriptor> files = new WorkbookDiscovery().scan(folder);

    assertEquals(List.of("A.xlsx", "B.xlsx", "register.CSV"),
        files.stream().map(FileDescriptor::name)
            .collect(Collectors.toList()));

    final FileDescriptor register = files.get(2);
    assertEquals("register", register.stem());
    assertEquals(".csv", register.extension());
    assertEquals("file", register.url().getScheme());
    assertEquals(folder.resolve("register.CSV").toAbsolutePath(),
        register.path());
  }

  @Test
  void whenScanning_givenMissingFolder_shouldReturnEmpty(
      @TempDir final Path root) {
    assertTrue(new WorkbookDiscovery().scan(root.resolve("missing"))
        .isEmpty());
  }

  @Test
  void whenScanning_givenEmptyFolder_shouldReturnEmpty(
      @TempDir final Path folder) {
    assertTrue(new WorkbookDiscovery().scan(folder).isEmpty());
  }

  @Test
  void whenScanning_givenCustomExtensions_shouldOnlyMatchThem(
      @TempDir final Path folder) {
    TestConfigurations.touch(folder, "a.xlsx", "b.json", "c.jsonc");

    final WorkbookDiscovery discovery =
        new WorkbookDiscovery(List.of("json", " .JSONC "));

    assertEquals(List.of("b.json", "c.jsonc"),
        discovery.scan(folder).stream().map(FileDescriptor::name)
            .collect(Collectors.toList()));
  }

  @Test
  void whenCreating_givenNoExtensions_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> new WorkbookDiscovery(List.of(" ")));
  }

  @Test
  void whenDiscovering_givenSameFolderTwice_shouldProduceSameIds(
      @TempDir final Path folder) {
    TestConfigurations.touch(folder, "A.xlsx", "B.xlsx");
    final WorkbookDiscovery discovery = new WorkbookDiscovery();
    final FolderRole role = new FolderRole("wf_in", "data/new", null);

    final List<Workbook> first = discovery.discover("boa", "categorization",
        Purpose.INPUT, role, folder);
    final List<Workbook> second = discovery.discover("boa",
        "categorization", Purpose.INPUT, role, folder);

    assertEquals(ids(first), ids(second));
    assertEquals("boa|categorization|input|data/new|A.xlsx",
        first.get(0).id());
    assertEquals(WorkbookType.TRANSACTIONS, first.get(0).type());
    assertEquals(folder.resolve("A.xlsx").toUri(), first.get(0).url());
  }

  @Test
  void whenDiscovering_givenSameFileInOtherContext_shouldProduceOtherIds(
      @TempDir final Path folder) {
    TestConfigurations.touch(folder, "A.xlsx");
    final WorkbookDiscovery discovery = new WorkbookDiscovery();
    final FolderRole role = new FolderRole("wf_out", "data/finalized", null);

    final Workbook asWorking = discovery.discover("boa", "finalization",
        Purpose.WORKING, role, folder).get(0);
    final Workbook asOutput = discovery.discover("boa", "finalization",
        Purpose.OUTPUT, role, folder).get(0);
    final Workbook otherFi = discovery.discover("merrill", "finalization",
        Purpose.OUTPUT, role, folder).get(0);

    assertNotEquals(asWorking.id(), asOutput.id());
    assertNotEquals(asOutput.id(), otherFi.id());
  }

  private static List<String> ids(final List<Workbook> workbooks) {
    return workbooks.stream().map(Workbook::id)
        .collect(Collectors.toList());
  }
}
