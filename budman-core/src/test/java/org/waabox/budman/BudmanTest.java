package org.waabox.budman;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.capture;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import org.easymock.Capture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.waabox.budman.context.ContextState;
import org.waabox.budman.context.DataContext;
import org.waabox.budman.store.ConfigurationRecord;
import org.waabox.budman.store.ConfigurationStore;
import org.waabox.budman.store.DefaultConfiguration;
import org.waabox.budman.store.SaveAck;
import org.waabox.budman.store.WorkbookContentStore;

/**
 * Tests for {@link Budman}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class BudmanTest {

  @Test
  void whenStarting_givenStoredRecord_shouldBuildReadyContext(
      @TempDir final Path root) {
    TestConfigurations.touch(root, "boa/data/new/A.xlsx");
    final URI url = root.resolve("budget.jsonc").toUri();
    final ConfigurationStore configurationStore =
        createMock(ConfigurationStore.class);
    final WorkbookContentStore contentStore =
        createMock(WorkbookContentStore.class);
    expect(configurationStore.get(url))
        .andReturn(TestConfigurations.boa(root));
    replay(configurationStore, contentStore);

    final Budman budman = Budman.builder()
        .configurationStore(configurationStore)
        .contentStore(contentStore)
        .configurationUrl(url)
        .build();

    final InitializationReport report = budman.start();

    assertTrue(budman.isStarted());
    assertSame(report, budman.report());
    assertEquals(1, report.workbooks());
    final DataContext context = budman.dataContext();
    assertEquals(ContextState.READY, context.state());
    assertEquals("A.xlsx", context.activeWorkbooks().get(0).name());
    assertThrows(IllegalStateException.class, budman::start);
    verify(configurationStore, contentStore);
  }

  @Test
  void whenStarting_givenNoStoredRecord_shouldStoreTheDefault(
      @TempDir final Path root) {
    final URI url = root.resolve("budget.jsonc").toUri();
    final ConfigurationRecord defaults = DefaultConfiguration.create(
        root.toString());
    final ConfigurationStore configurationStore =
        createMock(ConfigurationStore.class);
    expect(configurationStore.get(url))
        .andThrow(new NotFoundException("missing"));
    expect(configurationStore.put(defaults, url))
        .andReturn(new SaveAck(url, 10, Instant.now()));
    replay(configurationStore);

    final Budman budman = Budman.builder()
        .configurationStore(configurationStore)
        .contentStore(createMock(WorkbookContentStore.class))
        .configurationUrl(url)
        .defaultConfiguration(defaults)
        .build();

    budman.start();

    assertTrue(Files.isDirectory(root.resolve("merrill/data/categorized")));
    assertEquals("boa",
        budman.dataContext().financialInstitution().orElseThrow().key());
    verify(configurationStore);
  }

  @Test
  void whenStarting_givenNoRecordAndNoDefault_shouldFailAndStayStopped(
      @TempDir final Path root) {
    final URI url = root.resolve("budget.jsonc").toUri();
    final ConfigurationStore configurationStore =
        createMock(ConfigurationStore.class);
    expect(configurationStore.get(url))
        .andThrow(new NotFoundException("missing"));
    replay(configurationStore);

    final Budman budman = Budman.builder()
        .configurationStore(configurationStore)
        .contentStore(createMock(WorkbookContentStore.class))
        .configurationUrl(url)
        .build();

    assertThrows(NotFoundException.class, budman::start);
    assertFalse(budman.isStarted());
    assertThrows(IllegalStateException.class, budman::model);
    verify(configurationStore);
  }

  @Test
  void whenSavingConfiguration_givenSelection_shouldStoreCatalogAndState(
      @TempDir final Path root) {
    TestConfigurations.touch(root, "boa/data/new/A.xlsx");
    final URI url = root.resolve("budget.jsonc").toUri();
    final ConfigurationStore configurationStore =
        createMock(ConfigurationStore.class);
    final Capture<ConfigurationRecord> saved = Capture.newInstance();
    expect(configurationStore.get(url))
        .andReturn(TestConfigurations.boa(root));
    expect(configurationStore.put(capture(saved), eq(url)))
        .andReturn(new SaveAck(url, 1, Instant.now()));
    replay(configurationStore);

    final Budman budman = Budman.builder()
        .configurationStore(configurationStore)
        .contentStore(createMock(WorkbookContentStore.class))
        .configurationUrl(url)
        .build();
    budman.start();
    budman.dataContext().selectPurpose(Purpose.INPUT);
    budman.dataContext().selectWorkbook("A.xlsx");

    budman.saveConfiguration();

    final ConfigurationRecord record = saved.getValue();
    assertEquals("A.xlsx",
        record.institutions().get(0).workbooks().get(0).name());
    assertEquals("input", record.workingState().purpose());
    assertEquals("boa|categorization|input|data/new|A.xlsx",
        record.workingState().workbookId());
    verify(configurationStore);
  }

  @Test
  void whenStopping_givenStartedInstance_shouldAllowRestart(
      @TempDir final Path root) {
    final URI url = root.resolve("budget.jsonc").toUri();
    final ConfigurationStore configurationStore =
        createMock(ConfigurationStore.class);
    expect(configurationStore.get(anyObject(URI.class)))
        .andReturn(TestConfigurations.boa(root)).times(2);
    replay(configurationStore);

    final Budman budman = Budman.builder()
        .configurationStore(configurationStore)
        .contentStore(createMock(WorkbookContentStore.class))
        .configurationUrl(url)
        .createMissingFolders(false)
        .build();

    final InitializationReport first = budman.start();
    budman.stop();
    assertFalse(budman.isStarted());

    final InitializationReport second = budman.start();

    assertFalse(first.complete());
    assertFalse(second.cancelled());
    assertTrue(budman.isStarted());
    verify(configurationStore);
  }
}
