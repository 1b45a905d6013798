package org.waabox.budman.spring;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.waabox.budman.Budman;
import org.waabox.budman.metrics.BudmanMetrics;
import org.waabox.budman.store.ConfigurationRecord;
import org.waabox.budman.store.ConfigurationStore;
import org.waabox.budman.store.DefaultConfiguration;
import org.waabox.budman.store.fs.JsonConfigurationStore;

/**
 * Tests for {@link BudmanAutoConfiguration}.
 *
 * <p>Uses {@link ApplicationContextRunner} with the budget rooted in a
 * temporary folder, so nothing is written under the user home.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class BudmanAutoConfigurationTest {

  /** The budget root, fresh for each test. */
  @TempDir
  Path root;

  /** The application context runner configured with the auto-configuration. */
  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(BudmanAutoConfiguration.class));

  /**
   * Verifies that, with no configuration file, the default one is stored
   * and the folders of every institution are created.
   */
  @Test
  void whenContextLoads_givenNoConfigurationFile_shouldStartWithDefaults() {
    runner.withPropertyValues(properties())
        .run(context -> {
          final Budman budman = context.getBean(Budman.class);

          assertTrue(budman.isStarted());
          assertTrue(budman.report().complete());
          assertTrue(Files.isRegularFile(configurationFile()));
          assertTrue(Files.isDirectory(root.resolve("boa/data/new")));
          assertEquals("boa", budman.dataContext().financialInstitution()
              .orElseThrow().key());
        });
  }

  @Test
  void whenContextLoads_givenDisabled_shouldNotCreateBudman() {
    runner.withPropertyValues("budman.enabled=false")
        .run(context -> assertFalse(context.containsBean("budman")));
  }

  /**
   * Verifies that customizers run against the builder before Budman is
   * built.
   */
  @Test
  void whenContextLoads_givenCustomizer_shouldApplyIt() {
    runner.withPropertyValues(properties())
        .withUserConfiguration(NoFolderCreationConfig.class)
        .run(context -> {
          final Budman budman = context.getBean(Budman.class);

          assertFalse(budman.report().complete());
          assertFalse(Files.exists(root.resolve("boa")));
        });
  }

  @Test
  void whenContextLoads_givenConfigurationStoreBean_shouldReadFromIt() {
    final ConfigurationStore store = createMock(ConfigurationStore.class);
    expect(store.get(configurationFile().toUri()))
        .andReturn(DefaultConfiguration.create(root.toString()));
    replay(store);

    runner.withPropertyValues(properties())
        .withBean(ConfigurationStore.class, () -> store)
        .run(context -> {
          final Budman budman = context.getBean(Budman.class);

          assertTrue(budman.isStarted());
          assertFalse(Files.exists(configurationFile()));
        });
    verify(store);
  }

  @Test
  void whenContextLoads_givenMetricsBean_shouldReportScans() {
    runner.withPropertyValues(properties())
        .withUserConfiguration(RecordingMetricsConfig.class)
        .run(context -> {
          final RecordingMetrics metrics =
              context.getBean(RecordingMetrics.class);
          assertEquals(List.of("boa", "merrill"), metrics.scanned);
        });
  }

  /**
   * Verifies that the catalog and the working state are written back when
   * the context closes and save on stop is set.
   */
  @Test
  void whenContextCloses_givenSaveOnStop_shouldWriteConfiguration()
      throws Exception {
    runner.withPropertyValues(properties())
        .withPropertyValues("budman.save-on-stop=true")
        .run(context -> {
          Files.write(root.resolve("boa/data/new/A.xlsx"), new byte[] {1});
          context.getBean(Budman.class).model().rescan("boa");
        });

    final ConfigurationRecord saved = new JsonConfigurationStore()
        .get(configurationFile().toUri());
    assertEquals("A.xlsx",
        saved.institutions().get(0).workbooks().get(0).name());
    assertNotNull(saved.lastModifiedDate());
  }

  private String[] properties() {
    return new String[] {
        "budman.root-folder=" + root,
        "budman.configuration-file=" + configurationFile()
    };
  }

  private Path configurationFile() {
    return root.resolve("budget_manager.jsonc");
  }

  @Configuration(proxyBeanMethods = false)
  static class NoFolderCreationConfig {

    @Bean
    BudmanCustomizer noFolderCreation() {
      return builder -> builder.createMissingFolders(false);
    }
  }

  @Configuration(proxyBeanMethods = false)
  static class RecordingMetricsConfig {

    @Bean
    RecordingMetrics recordingMetrics() {
      return new RecordingMetrics();
    }
  }

  /** Remembers which institutions were scanned. */
  static class RecordingMetrics implements BudmanMetrics {

    /** The scanned institution keys, in order. */
    private final List<String> scanned = new ArrayList<>();

    @Override
    public void institutionScanned(final String fiKey, final int workbooks,
        final Duration duration) {
      scanned.add(fiKey);
    }

    @Override
    public void workbooksAdded(final String fiKey, final int count) {
    }

    @Override
    public void folderSkipped(final String fiKey, final String reason) {
    }

    @Override
    public void workbookLoaded(final String workbookId, final long bytes) {
    }

    @Override
    public void workbookSaved(final String workbookId, final long bytes) {
    }
  }
}
