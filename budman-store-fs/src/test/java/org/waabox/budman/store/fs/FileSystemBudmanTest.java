package org.waabox.budman.store.fs;

import static org.easymock.EasyMock.createNiceMock;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.waabox.budman.Budman;
import org.waabox.budman.Workbook;
import org.waabox.budman.context.DataContext;
import org.waabox.budman.metrics.BudmanMetrics;
import org.waabox.budman.store.DefaultConfiguration;
import org.waabox.budman.store.WorkbookContent;

/**
 * Runs {@link Budman} over the file system stores.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class FileSystemBudmanTest {

  @Test
  void whenEditingWorkbook_givenRestart_shouldKeepCatalogAndBytes(
      @TempDir final Path dir) throws Exception {
    final Path root = dir.resolve("budget");
    final URI url = root.resolve("budget_manager.jsonc").toUri();

    final Budman first = budman(root, url);
    first.start();
    assertTrue(Files.isRegularFile(Path.of(url)));

    final Path file = root.resolve("boa/data/categorized/categorized_A.xlsx");
    Files.write(file, "raw".getBytes());
    first.model().rescan("boa");

    final DataContext context = first.dataContext();
    final Workbook workbook = context.selectWorkbook("categorized_A.xlsx")
        .single().orElseThrow();
    context.load(workbook);
    context.update(workbook, "categorized".getBytes());
    context.save(workbook);
    first.saveConfiguration();
    first.stop();

    final Budman second = budman(root, url);
    second.start();

    final DataContext reopened = second.dataContext();
    final Workbook current = reopened.currentWorkbook().orElseThrow();
    assertEquals(workbook.id(), current.id());
    final WorkbookContent content = reopened.load(current);
    assertArrayEquals("categorized".getBytes(), content.data());
    // The categorized folder is shared by three workflows.
    assertEquals(3, second.report().workbooks());
  }

  @Test
  void whenLoadingAndSaving_givenMetrics_shouldReportFileSizes(
      @TempDir final Path dir) throws Exception {
    final Path root = dir.resolve("budget");
    final Path file = root.resolve("merrill/data/new/M.xlsx");
    Files.createDirectories(file.getParent());
    Files.write(file, "raw".getBytes());

    final String id = "merrill|categorization|input|data/new|M.xlsx";
    final BudmanMetrics metrics = createNiceMock(BudmanMetrics.class);
    metrics.workbookLoaded(id, 3L);
    metrics.workbookSaved(id, 11L);
    replay(metrics);

    final Budman budman = Budman.builder()
        .configurationStore(new JsonConfigurationStore())
        .contentStore(new FileSystemWorkbookContentStore())
        .configurationUrl(root.resolve("budget_manager.jsonc").toUri())
        .defaultConfiguration(DefaultConfiguration.create(root.toString()))
        .metrics(metrics)
        .build();
    budman.start();

    final DataContext context = budman.dataContext();
    context.selectFinancialInstitution("merrill");
    final Workbook workbook = context.selectWorkbook(id).single()
        .orElseThrow();
    context.load(workbook);
    context.update(workbook, "categorized".getBytes());
    context.save(workbook);

    assertArrayEquals("categorized".getBytes(), Files.readAllBytes(file));
    verify(metrics);
  }

  private static Budman budman(final Path root, final URI url) {
    return Budman.builder()
        .configurationStore(new JsonConfigurationStore())
        .contentStore(new FileSystemWorkbookContentStore())
        .configurationUrl(url)
        .defaultConfiguration(DefaultConfiguration.create(root.toString()))
        .build();
  }
}
