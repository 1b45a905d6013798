package org.waabox.budman.spring;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.waabox.budman.Budman;
import org.waabox.budman.InitializationReport;
import org.waabox.budman.metrics.BudmanMetrics;
import org.waabox.budman.storage.FolderResolver;
import org.waabox.budman.store.ConfigurationStore;
import org.waabox.budman.store.DefaultConfiguration;
import org.waabox.budman.store.WorkbookContentStore;
import org.waabox.budman.store.fs.FileSystemWorkbookContentStore;
import org.waabox.budman.store.fs.JsonConfigurationStore;

/**
 * Spring Boot auto-configuration for Budman.
 *
 * <p>This configuration creates and manages a singleton {@link Budman}
 * instance. Configuration and content stores, a folder resolver and a
 * metrics reporter are taken from the application context when present;
 * otherwise the filesystem stores and no metrics are used. All
 * {@link BudmanCustomizer} beans are applied to the builder last.</p>
 *
 * <p>The Budman lifecycle (start/stop) is managed through Spring's
 * {@link SmartLifecycle}.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "budman", name = "enabled",
    matchIfMissing = true)
@EnableConfigurationProperties(BudmanProperties.class)
public class BudmanAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      BudmanAutoConfiguration.class);

  /**
   * Creates the singleton {@link Budman} bean.
   *
   * @param properties                 the configuration properties, never
   *                                   null
   * @param configurationStoreProvider provider for an optional
   *                                   ConfigurationStore bean
   * @param contentStoreProvider       provider for an optional
   *                                   WorkbookContentStore bean
   * @param folderResolverProvider     provider for an optional
   *                                   FolderResolver bean
   * @param metricsProvider            provider for an optional
   *                                   BudmanMetrics bean
   * @param customizers                the builder customizers, may be empty
   *
   * @return the configured Budman instance, never null
   */
  @Bean
  public Budman budman(
      final BudmanProperties properties,
      final ObjectProvider<ConfigurationStore> configurationStoreProvider,
      final ObjectProvider<WorkbookContentStore> contentStoreProvider,
      final ObjectProvider<FolderResolver> folderResolverProvider,
      final ObjectProvider<BudmanMetrics> metricsProvider,
      final List<BudmanCustomizer> customizers) {

    final FolderResolver resolver =
        folderResolverProvider.getIfAvailable(FolderResolver::new);

    final Budman.Builder builder = Budman.builder()
        .configurationStore(
            configurationStoreProvider.getIfAvailable(
                JsonConfigurationStore::new))
        .contentStore(
            contentStoreProvider.getIfAvailable(
                FileSystemWorkbookContentStore::new))
        .configurationUrl(
            resolver.resolve(properties.getConfigurationFile()).toUri())
        .defaultConfiguration(
            DefaultConfiguration.create(properties.getRootFolder()))
        .folderResolver(resolver)
        .createMissingFolders(properties.isCreateMissingFolders())
        .raiseOnErrors(properties.isRaiseOnErrors());

    metricsProvider.ifAvailable(metrics -> {
      builder.metrics(metrics);
      log.info("Budman using custom BudmanMetrics: {}",
          metrics.getClass().getSimpleName());
    });

    for (final BudmanCustomizer customizer : customizers) {
      customizer.customize(builder);
      log.debug("Applied BudmanCustomizer: {}",
          customizer.getClass().getSimpleName());
    }

    final Budman budman = builder.build();
    log.info("Budman created for configuration {}",
        budman.configurationUrl());
    return budman;
  }

  /**
   * Creates a {@link SmartLifecycle} bean that manages the Budman
   * start/stop lifecycle.
   *
   * <p>The lifecycle starts late (phase {@code Integer.MAX_VALUE - 1})
   * to ensure all other beans are initialized first, and stops early
   * for the same reason.</p>
   *
   * @param budman     the Budman instance to manage, never null
   * @param properties the configuration properties, never null
   *
   * @return the lifecycle bean, never null
   */
  @Bean
  public SmartLifecycle budmanLifecycle(final Budman budman,
      final BudmanProperties properties) {
    return new SmartLifecycle() {

      /** Whether the lifecycle is currently running. */
      private volatile boolean running = false;

      @Override
      public void start() {
        log.info("Starting Budman lifecycle...");
        final InitializationReport report = budman.start();
        running = true;
        log.info("Budman lifecycle started: {}", report);
      }

      @Override
      public void stop() {
        log.info("Stopping Budman lifecycle...");
        if (properties.isSaveOnStop() && budman.isStarted()) {
          budman.saveConfiguration();
        }
        budman.stop();
        running = false;
        log.info("Budman lifecycle stopped.");
      }

      @Override
      public boolean isRunning() {
        return running;
      }

      @Override
      public int getPhase() {
        return Integer.MAX_VALUE - 1;
      }
    };
  }
}
