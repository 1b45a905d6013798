package org.waabox.budman.store.fs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.waabox.budman.ConfigurationException;
import org.waabox.budman.NotFoundException;
import org.waabox.budman.store.ConfigurationRecord;
import org.waabox.budman.store.DefaultConfiguration;

/**
 * Tests for {@link JsonConfigurationStore}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class JsonConfigurationStoreTest {

  private final JsonConfigurationStore store = new JsonConfigurationStore();

  @Test
  void whenPuttingThenGetting_givenDefaultRecord_shouldReadItBack(
      @TempDir final Path dir) {
    final URI url = dir.resolve("budget/budget_manager.jsonc").toUri();
    final ConfigurationRecord record = DefaultConfiguration.create(
        dir.resolve("budget").toString());

    store.put(record, url);

    assertEquals(record, store.get(url));
  }

  @Test
  void whenGetting_givenMissingFile_shouldThrowNotFound(
      @TempDir final Path dir) {
    assertThrows(NotFoundException.class,
        () -> store.get(dir.resolve("none.jsonc").toUri()));
  }

  @Test
  void whenGetting_givenHandEditedFile_shouldAcceptComments(
      @TempDir final Path dir) throws Exception {
    final Path file = dir.resolve("budget.jsonc");
    Files.writeString(file, "{\n  // edited by hand\n"
        + "  \"root_folder\": \"~/budget\",\n}\n", StandardCharsets.UTF_8);

    assertEquals("~/budget", store.get(file.toUri()).rootFolder());
  }

  @Test
  void whenGetting_givenBrokenFile_shouldThrowConfiguration(
      @TempDir final Path dir) throws Exception {
    final Path file = dir.resolve("budget.jsonc");
    Files.writeString(file, "{ \"root_folder\": ", StandardCharsets.UTF_8);

    assertThrows(ConfigurationException.class,
        () -> store.get(file.toUri()));
  }
}
