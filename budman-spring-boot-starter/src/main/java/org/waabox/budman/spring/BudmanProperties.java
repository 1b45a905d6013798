package org.waabox.budman.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.waabox.budman.store.DefaultConfiguration;

/**
 * Configuration properties for Budman, mapped from the {@code budman.*}
 * prefix in application.yml or application.properties.
 *
 * <p>Supports:</p>
 * <ul>
 *   <li>{@code budman.enabled} - whether the auto-configuration applies,
 *       true by default.</li>
 *   <li>{@code budman.configuration-file} - the configuration record file,
 *       may start with {@code ~}.</li>
 *   <li>{@code budman.root-folder} - the budget root folder of the default
 *       configuration, used when no configuration file exists yet.</li>
 *   <li>{@code budman.create-missing-folders} - whether missing workflow
 *       folders are created on start, true by default.</li>
 *   <li>{@code budman.raise-on-errors} - whether the first initialization
 *       failure aborts start, false by default.</li>
 *   <li>{@code budman.save-on-stop} - whether the catalog and working state
 *       are written back when the application stops, false by default.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "budman")
public class BudmanProperties {

  /** The default configuration file name, under the default root. */
  public static final String DEFAULT_CONFIGURATION_FILE =
      DefaultConfiguration.ROOT_FOLDER + "/budget_manager.jsonc";

  /** Whether the auto-configuration applies. */
  private boolean enabled = true;

  /** The configuration record file. */
  private String configurationFile = DEFAULT_CONFIGURATION_FILE;

  /** The root folder of the default configuration. */
  private String rootFolder = DefaultConfiguration.ROOT_FOLDER;

  /** Whether missing folders are created on start. */
  private boolean createMissingFolders = true;

  /** Whether the first initialization failure aborts start. */
  private boolean raiseOnErrors = false;

  /** Whether the configuration is saved when the application stops. */
  private boolean saveOnStop = false;

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(final boolean enabled) {
    this.enabled = enabled;
  }

  /**
   * Returns the configuration record file.
   *
   * @return the file, possibly starting with {@code ~}, never null
   */
  public String getConfigurationFile() {
    return configurationFile;
  }

  public void setConfigurationFile(final String configurationFile) {
    this.configurationFile = configurationFile;
  }

  /**
   * Returns the root folder written into the default configuration when
   * the configuration file does not exist yet.
   *
   * @return the folder, never null
   */
  public String getRootFolder() {
    return rootFolder;
  }

  public void setRootFolder(final String rootFolder) {
    this.rootFolder = rootFolder;
  }

  public boolean isCreateMissingFolders() {
    return createMissingFolders;
  }

  public void setCreateMissingFolders(final boolean createMissingFolders) {
    this.createMissingFolders = createMissingFolders;
  }

  public boolean isRaiseOnErrors() {
    return raiseOnErrors;
  }

  public void setRaiseOnErrors(final boolean raiseOnErrors) {
    this.raiseOnErrors = raiseOnErrors;
  }

  public boolean isSaveOnStop() {
    return saveOnStop;
  }

  public void setSaveOnStop(final boolean saveOnStop) {
    this.saveOnStop = saveOnStop;
  }
}
