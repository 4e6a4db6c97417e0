package tech.yump.credstore.storage.prefs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import tech.yump.credstore.storage.CorruptedDataException;
import tech.yump.credstore.storage.StorageException;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Preference store persisted as a single JSON object in a file.
 * Every read goes to disk; every write rewrites the file through a temporary file and an atomic move.
 */
@Slf4j
public class FilePreferenceStore implements PreferenceStore {

  private static final TypeReference<Map<String, String>> MAP_TYPE_REFERENCE = new TypeReference<>() {};

  private final Path file;
  private final ObjectMapper objectMapper;

  public FilePreferenceStore(final ObjectMapper objectMapper, final Path file) {
    if (file == null) {
      throw new IllegalArgumentException("Preference file path cannot be null.");
    }
    this.objectMapper = objectMapper;
    this.file = file.toAbsolutePath().normalize();
    log.info("FilePreferenceStore initialized with file: {}", this.file);
  }

  @Override
  public Optional<String> get(String key) throws StorageException {
    validateKey(key);
    String value = readAll().get(key);
    log.debug("Preference '{}' {}", key, value != null ? "found" : "not found");
    return Optional.ofNullable(value);
  }

  @Override
  public synchronized void put(String key, String value) throws StorageException {
    validateKey(key);
    if (value == null) {
      throw new IllegalArgumentException("Preference value cannot be null for put operation.");
    }
    Map<String, String> entries = readAll();
    entries.put(key, value);
    writeAll(entries);
    log.debug("Stored preference '{}'", key);
  }

  @Override
  public synchronized void remove(String key) throws StorageException {
    validateKey(key);
    Map<String, String> entries = readAll();
    if (entries.remove(key) == null) {
      log.debug("No preference to remove for key '{}'", key);
      return;
    }
    writeAll(entries);
    log.debug("Removed preference '{}'", key);
  }

  @Override
  public Set<String> keys() throws StorageException {
    return Set.copyOf(readAll().keySet());
  }

  public Path getFile() {
    return file;
  }

  private Map<String, String> readAll() throws StorageException {
    if (!Files.isRegularFile(file)) {
      return new TreeMap<>();
    }
    try {
      byte[] content = Files.readAllBytes(file);
      if (content.length == 0) {
        return new TreeMap<>();
      }
      Map<String, String> entries = objectMapper.readValue(content, MAP_TYPE_REFERENCE);
      return entries != null ? new TreeMap<>(entries) : new TreeMap<>();
    } catch (JsonProcessingException e) {
      log.error("Preference file {} is not a valid JSON object: {}", file, e.getMessage());
      throw new CorruptedDataException("Preference file is corrupted: " + file, e);
    } catch (IOException e) {
      log.error("Failed to read preference file {}: {}", file, e.getMessage(), e);
      throw new StorageException("Failed to read preference file: " + file, e);
    }
  }

  private void writeAll(Map<String, String> entries) throws StorageException {
    Path temp = null;
    try {
      Files.createDirectories(file.getParent());
      temp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), entries);
      try {
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        log.debug("Atomic move not supported for {}, falling back to replace", file);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      log.error("Failed to write preference file {}: {}", file, e.getMessage(), e);
      deleteQuietly(temp);
      throw new StorageException("Failed to write preference file: " + file, e);
    }
  }

  private void deleteQuietly(Path temp) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      log.warn("Could not delete temporary preference file {}: {}", temp, e.getMessage());
    }
  }

  private void validateKey(String key) {
    if (!StringUtils.hasText(key)) {
      throw new IllegalArgumentException("Preference key cannot be null or empty.");
    }
  }
}
