package tech.yump.credstore.storage.prefs;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tech.yump.credstore.storage.CorruptedDataException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FilePreferenceStoreTest {

  @TempDir
  Path tempDir;

  private Path prefsFile;
  private FilePreferenceStore store;

  @BeforeEach
  void setUp() {
    prefsFile = tempDir.resolve("nested/preferences.json");
    store = new FilePreferenceStore(new ObjectMapper(), prefsFile);
  }

  @Test
  @DisplayName("get on a missing file returns empty")
  void get_whenFileMissing_shouldReturnEmpty() {
    assertFalse(Files.exists(prefsFile));
    assertEquals(Optional.empty(), store.get("secret_openai"));
  }

  @Test
  @DisplayName("put creates the file and the value can be read back")
  void put_thenGet_shouldReturnValue() {
    store.put("secret_openai", "sk-ABC123");

    assertTrue(Files.isRegularFile(prefsFile));
    assertEquals(Optional.of("sk-ABC123"), store.get("secret_openai"));
  }

  @Test
  void put_shouldKeepUnrelatedEntries() {
    store.put("theme", "dark");
    store.put("secret_openai", "sk-1");
    store.put("secret_openai", "sk-2");

    assertEquals(Optional.of("dark"), store.get("theme"));
    assertEquals(Optional.of("sk-2"), store.get("secret_openai"));
    assertEquals(Set.of("theme", "secret_openai"), store.keys());
  }

  @Test
  void remove_shouldDeleteOnlyThatKey() {
    store.put("theme", "dark");
    store.put("secret_openai", "sk-1");

    store.remove("secret_openai");

    assertEquals(Optional.empty(), store.get("secret_openai"));
    assertEquals(Optional.of("dark"), store.get("theme"));
  }

  @Test
  void remove_absentKey_shouldNotFail() {
    assertDoesNotThrow(() -> store.remove("secret_missing"));
    assertFalse(Files.exists(prefsFile));
  }

  @Test
  @DisplayName("Writes leave no temporary files behind")
  void put_shouldNotLeaveTempFiles() throws IOException {
    store.put("a", "1");
    store.put("b", "2");

    try (var files = Files.list(prefsFile.getParent())) {
      assertEquals(1, files.count());
    }
  }

  @Test
  void get_whenFileContainsInvalidJson_shouldThrowCorruptedDataException() throws IOException {
    Files.createDirectories(prefsFile.getParent());
    Files.writeString(prefsFile, "{not json", StandardCharsets.UTF_8);

    assertThrows(CorruptedDataException.class, () -> store.get("secret_openai"));
  }

  @Test
  void invalidKey_shouldThrowIllegalArgumentException() {
    assertThrows(IllegalArgumentException.class, () -> store.get(" "));
    assertThrows(IllegalArgumentException.class, () -> store.put(null, "x"));
    assertThrows(IllegalArgumentException.class, () -> store.put("k", null));
  }
}
