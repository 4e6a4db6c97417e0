package tech.yump.credstore.storage.secure;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import tech.yump.credstore.crypto.EncryptionService;
import tech.yump.credstore.storage.CorruptedDataException;
import tech.yump.credstore.storage.StorageException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Objects;
import java.util.Optional;

/**
 * Secure record store keeping each record as an AES-GCM sealed JSON file at
 * {@code <basePath>/<service>/<account>.json}. The ciphertext is bound to its service and account
 * through the associated data, so a record copied to another account fails to unseal.
 */
@Slf4j
public class EncryptedFileRecordStore implements SecureRecordStore {

  private static final String RECORD_EXTENSION = ".json";

  private final Path basePath;
  private final String service;
  private final ObjectMapper objectMapper;
  private final EncryptionService encryptionService;

  public EncryptedFileRecordStore(
          final ObjectMapper objectMapper,
          final EncryptionService encryptionService,
          final String basePath,
          final String service
  ) {
    if (!StringUtils.hasText(basePath) || !StringUtils.hasText(service)) {
      throw new IllegalArgumentException("Secure store base path and service cannot be null or empty.");
    }
    this.objectMapper = objectMapper;
    this.encryptionService = encryptionService;
    this.service = service;
    this.basePath = Paths.get(basePath).toAbsolutePath().normalize();
    log.info("EncryptedFileRecordStore initialized with base path: {}, service: {}", this.basePath, service);
  }

  /**
   * Validates the base path, creating the service directory with owner-only permissions if needed.
   */
  @PostConstruct
  public void initialize() {
    Path serviceDir = resolveServiceDirectory();
    try {
      if (Files.exists(serviceDir)) {
        if (!Files.isDirectory(serviceDir)) {
          throw new StorageException("Configured secure store path exists but is not a directory: " + serviceDir);
        }
        if (!Files.isReadable(serviceDir) || !Files.isWritable(serviceDir)) {
          throw new StorageException("Configured secure store directory lacks read/write permissions: " + serviceDir);
        }
        log.debug("Secure store path validation successful: {}", serviceDir);
      } else {
        log.warn("Secure store directory does not exist, attempting to create: {}", serviceDir);
        Files.createDirectories(serviceDir);
        restrictPermissions(serviceDir, "rwx------");
        log.info("Successfully created secure store directory: {}", serviceDir);
      }
    } catch (IOException e) {
      log.error("Failed to validate or create secure store path: {}", serviceDir, e);
      throw new StorageException("Failed to initialize secure store path: " + serviceDir, e);
    }
  }

  @Override
  public String service() {
    return service;
  }

  @Override
  public Optional<byte[]> read(String account) throws StorageException {
    Path recordPath = resolveRecordPath(account);
    log.debug("Reading secure record '{}' from path: {}", account, recordPath);

    if (!Files.isRegularFile(recordPath)) {
      log.debug("No secure record found for account '{}'", account);
      return Optional.empty();
    }

    SealedRecord record;
    try {
      record = objectMapper.readValue(recordPath.toFile(), SealedRecord.class);
    } catch (IOException e) {
      log.error("Secure record '{}' at {} could not be parsed: {}", account, recordPath, e.getMessage());
      throw new CorruptedDataException("Secure record is corrupted: " + account, e);
    }
    if (record == null || !service.equals(record.getService()) || !Objects.equals(account, record.getAccount())) {
      log.error("Secure record at {} does not belong to service '{}' / account '{}'", recordPath, service, account);
      throw new CorruptedDataException("Secure record scope mismatch for account: " + account, null);
    }

    try {
      byte[] plaintext = encryptionService.decrypt(concat(record.nonceBytes(), record.ciphertextBytes()), associatedData(account));
      log.debug("Successfully unsealed secure record '{}'", account);
      return Optional.of(plaintext);
    } catch (EncryptionService.EncryptionException e) {
      throw new StorageException("Failed to unseal secure record: " + account, e);
    } catch (IllegalStateException | IllegalArgumentException e) {
      throw new CorruptedDataException("Secure record has an invalid structure: " + account, e);
    }
  }

  @Override
  public synchronized boolean update(String account, byte[] data) throws StorageException {
    Path recordPath = resolveRecordPath(account);
    if (!Files.isRegularFile(recordPath)) {
      log.debug("Secure record '{}' does not exist, nothing to update", account);
      return false;
    }
    write(account, recordPath, data);
    log.info("Updated secure record '{}'", account);
    return true;
  }

  @Override
  public synchronized void create(String account, byte[] data) throws StorageException {
    Path recordPath = resolveRecordPath(account);
    if (Files.exists(recordPath)) {
      throw new StorageException("Secure record already exists: " + account);
    }
    write(account, recordPath, data);
    log.info("Created secure record '{}'", account);
  }

  @Override
  public synchronized void delete(String account) throws StorageException {
    Path recordPath = resolveRecordPath(account);
    try {
      if (Files.deleteIfExists(recordPath)) {
        log.info("Deleted secure record '{}'", account);
      } else {
        log.debug("No secure record to delete for account '{}'", account);
      }
    } catch (IOException e) {
      log.error("Failed to delete secure record '{}' at {}: {}", account, recordPath, e.getMessage(), e);
      throw new StorageException("Failed to delete secure record: " + account, e);
    }
  }

  private void write(String account, Path recordPath, byte[] data) throws StorageException {
    if (data == null) {
      throw new IllegalArgumentException("Record data cannot be null.");
    }

    byte[] nonceAndCiphertext;
    try {
      nonceAndCiphertext = encryptionService.encrypt(data, associatedData(account));
    } catch (EncryptionService.EncryptionException e) {
      throw new StorageException("Failed to seal secure record: " + account, e);
    }
    byte[] nonce = new byte[EncryptionService.NONCE_LENGTH_BYTE];
    byte[] ciphertext = new byte[nonceAndCiphertext.length - nonce.length];
    System.arraycopy(nonceAndCiphertext, 0, nonce, 0, nonce.length);
    System.arraycopy(nonceAndCiphertext, nonce.length, ciphertext, 0, ciphertext.length);
    SealedRecord record = new SealedRecord(service, account, nonce, ciphertext);

    Path temp = null;
    try {
      Files.createDirectories(recordPath.getParent());
      temp = Files.createTempFile(recordPath.getParent(), account, ".tmp");
      restrictPermissions(temp, "rw-------");
      objectMapper.writeValue(temp.toFile(), record);
      try {
        Files.move(temp, recordPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        log.debug("Atomic move not supported for {}, falling back to replace", recordPath);
        Files.move(temp, recordPath, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      log.error("Failed to write secure record '{}' at {}: {}", account, recordPath, e.getMessage(), e);
      if (temp != null) {
        try {
          Files.deleteIfExists(temp);
        } catch (IOException cleanup) {
          e.addSuppressed(cleanup);
        }
      }
      throw new StorageException("Failed to write secure record: " + account, e);
    }
  }

  private byte[] associatedData(String account) {
    return (service + "/" + account).getBytes(StandardCharsets.UTF_8);
  }

  private static byte[] concat(byte[] first, byte[] second) {
    byte[] combined = new byte[first.length + second.length];
    System.arraycopy(first, 0, combined, 0, first.length);
    System.arraycopy(second, 0, combined, first.length, second.length);
    return combined;
  }

  private void restrictPermissions(Path path, String permissions) throws IOException {
    try {
      Files.setPosixFilePermissions(path, PosixFilePermissions.fromString(permissions));
    } catch (UnsupportedOperationException e) {
      log.debug("POSIX permissions not supported for {}", path);
    }
  }

  private Path resolveServiceDirectory() {
    return resolvePath(service);
  }

  /**
   * Resolves the account to its record file within the service directory.
   *
   * @throws StorageException if the account is invalid or escapes the base directory.
   */
  private Path resolveRecordPath(String account) throws StorageException {
    if (!StringUtils.hasText(account)) {
      throw new IllegalArgumentException("Account cannot be null or empty.");
    }
    if (account.contains("/") || account.contains("\\")) {
      log.error("Invalid secure record account: '{}'", account);
      throw new StorageException("Invalid secure record account format: " + account);
    }
    return resolvePath(service + "/" + account + RECORD_EXTENSION);
  }

  private Path resolvePath(String relativePath) throws StorageException {
    String sanitizedPath = relativePath.replace('\\', '/').trim();
    if (sanitizedPath.startsWith("/") || sanitizedPath.endsWith("/") || sanitizedPath.contains("..") || sanitizedPath.isEmpty()) {
      log.error("Invalid secure store path provided: '{}'", relativePath);
      throw new StorageException("Invalid secure store path format: " + relativePath);
    }

    Path absolutePath = basePath.resolve(sanitizedPath).normalize();
    if (!absolutePath.startsWith(basePath)) {
      log.error("Path traversal attempt detected for path '{}', resolved path '{}' is outside base path '{}'", relativePath, absolutePath, basePath);
      throw new StorageException("Invalid path resulting in path traversal attempt: " + relativePath);
    }
    return absolutePath;
  }
}
