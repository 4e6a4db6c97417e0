package tech.yump.credstore.storage.secure;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.util.Arrays;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the master key of the secure record store. The store is locked until a key is supplied,
 * either from configuration at startup or through {@link #unlock(String)}.
 */
@Slf4j
public class SecureStoreKeyHolder {

  private static final String AES = "AES";
  private static final int EXPECTED_KEY_LENGTH = 32; // AES-256

  private final AtomicReference<SecretKey> masterKey = new AtomicReference<>(null);
  private final String initialMasterKeyBase64;

  public SecureStoreKeyHolder(String initialMasterKeyBase64) {
    this.initialMasterKeyBase64 = initialMasterKeyBase64;
  }

  @PostConstruct
  void initializeLockState() {
    if (!StringUtils.hasText(initialMasterKeyBase64)) {
      log.warn("No master key configured (credstore.storage.secure.master-key-b64). Secure store remains LOCKED.");
      return;
    }
    try {
      unlock(initialMasterKeyBase64);
    } catch (IllegalArgumentException e) {
      log.error("Automatic unlock failed: {}. Secure store remains LOCKED.", e.getMessage());
      lock();
    }
  }

  /**
   * Loads the master key.
   *
   * @param base64Key Base64 encoded AES-256 key (32 raw bytes).
   * @throws IllegalArgumentException if the key is empty, not Base64 or of the wrong length.
   */
  public synchronized void unlock(String base64Key) {
    if (!StringUtils.hasText(base64Key)) {
      throw new IllegalArgumentException("Master key cannot be null or empty.");
    }

    byte[] keyBytes;
    try {
      keyBytes = Base64.getDecoder().decode(base64Key.trim());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid Base64 encoding for master key.", e);
    }

    try {
      if (keyBytes.length != EXPECTED_KEY_LENGTH) {
        log.error("Invalid master key length. Expected {} bytes, but got {}.", EXPECTED_KEY_LENGTH, keyBytes.length);
        throw new IllegalArgumentException("Invalid master key length. Expected " + EXPECTED_KEY_LENGTH + " bytes for AES-256.");
      }
      masterKey.set(new SecretKeySpec(keyBytes, AES));
    } finally {
      Arrays.fill(keyBytes, (byte) 0);
    }
    log.info("Secure store UNLOCKED.");
  }

  /**
   * Clears the master key; subsequent secure store access fails until unlocked again.
   */
  public synchronized void lock() {
    if (masterKey.getAndSet(null) != null) {
      log.info("Secure store LOCKED.");
    }
  }

  public boolean isLocked() {
    return masterKey.get() == null;
  }

  /**
   * @throws SecureStoreLockedException if no master key is loaded.
   */
  public SecretKey getMasterKey() throws SecureStoreLockedException {
    SecretKey key = masterKey.get();
    if (key == null) {
      log.warn("Attempted to access the secure store while it is LOCKED.");
      throw new SecureStoreLockedException("Secure store is locked. Access denied.");
    }
    return key;
  }
}
