package tech.yump.credstore.crypto;

import java.nio.ByteBuffer;
import java.security.InvalidAlgorithmParameterException;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.Security;
import javax.crypto.AEADBadTagException;
import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.IllegalBlockSizeException;
import javax.crypto.NoSuchPaddingException;
import javax.crypto.spec.GCMParameterSpec;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import tech.yump.credstore.storage.secure.SecureStoreKeyHolder;
import tech.yump.credstore.storage.secure.SecureStoreLockedException;

/**
 * AES-GCM sealing of secure records with the secure store's master key.
 * Output layout is {@code nonce || ciphertext}; the associated data binds a ciphertext to its record.
 */
@Slf4j
public class EncryptionService {

  static {
    if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
      Security.addProvider(new BouncyCastleProvider());
    }
  }

  public static final int NONCE_LENGTH_BYTE = 12;
  private static final String ALGORITHM = "AES/GCM/NoPadding";
  private static final int TAG_LENGTH_BIT = 128;

  private final SecureStoreKeyHolder keyHolder;
  private final SecureRandom secureRandom = new SecureRandom();

  public EncryptionService(SecureStoreKeyHolder keyHolder) {
    this.keyHolder = keyHolder;
  }

  /**
   * Encrypts the plaintext under a fresh nonce.
   *
   * @param plaintext      The bytes to encrypt. Cannot be null.
   * @param associatedData Authenticated but unencrypted context, may be null.
   * @return nonce || ciphertext
   * @throws SecureStoreLockedException If no master key is loaded.
   * @throws EncryptionException        If any cryptographic error occurs.
   */
  public byte[] encrypt(byte[] plaintext, byte[] associatedData) {
    if (plaintext == null) {
      throw new EncryptionException("Plaintext cannot be null.");
    }
    log.debug("Attempting to encrypt {} bytes of data.", plaintext.length);

    byte[] nonce = new byte[NONCE_LENGTH_BYTE];
    secureRandom.nextBytes(nonce);

    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, keyHolder.getMasterKey(), new GCMParameterSpec(TAG_LENGTH_BIT, nonce));
      if (associatedData != null) {
        cipher.updateAAD(associatedData);
      }
      byte[] ciphertext = cipher.doFinal(plaintext);
      log.debug("Encryption successful, ciphertext length: {} bytes.", ciphertext.length);

      return ByteBuffer.allocate(nonce.length + ciphertext.length)
              .put(nonce)
              .put(ciphertext)
              .array();
    } catch (NoSuchAlgorithmException | NoSuchPaddingException | InvalidKeyException |
             InvalidAlgorithmParameterException | IllegalBlockSizeException | BadPaddingException e) {
      log.error("Encryption failed: {}", e.getMessage(), e);
      throw new EncryptionException("Failed to encrypt data.", e);
    }
  }

  /**
   * Decrypts {@code nonce || ciphertext} and verifies its authentication tag.
   *
   * @param nonceAndCiphertext Output of {@link #encrypt(byte[], byte[])}.
   * @param associatedData     The associated data used at encryption time, may be null.
   * @return The original plaintext.
   * @throws SecureStoreLockedException If no master key is loaded.
   * @throws EncryptionException        On a wrong key, tampered data or any other cryptographic error.
   */
  public byte[] decrypt(byte[] nonceAndCiphertext, byte[] associatedData) {
    if (nonceAndCiphertext == null || nonceAndCiphertext.length < NONCE_LENGTH_BYTE) {
      throw new EncryptionException("Invalid input: Nonce and ciphertext array is null or too short.");
    }
    log.debug("Attempting to decrypt {} bytes of combined nonce and ciphertext.", nonceAndCiphertext.length);

    ByteBuffer bb = ByteBuffer.wrap(nonceAndCiphertext);
    byte[] nonce = new byte[NONCE_LENGTH_BYTE];
    bb.get(nonce);
    byte[] ciphertext = new byte[bb.remaining()];
    bb.get(ciphertext);

    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, keyHolder.getMasterKey(), new GCMParameterSpec(TAG_LENGTH_BIT, nonce));
      if (associatedData != null) {
        cipher.updateAAD(associatedData);
      }
      byte[] plaintext = cipher.doFinal(ciphertext);
      log.debug("Decryption successful, plaintext length: {} bytes.", plaintext.length);
      return plaintext;
    } catch (AEADBadTagException e) {
      log.error("Decryption failed due to invalid authentication tag (wrong key or tampered record): {}", e.getMessage());
      throw new EncryptionException("Decryption failed: Invalid authentication tag. Data may be corrupt or tampered with.", e);
    } catch (NoSuchAlgorithmException | NoSuchPaddingException | InvalidKeyException |
             InvalidAlgorithmParameterException | IllegalBlockSizeException | BadPaddingException e) {
      log.error("Decryption failed due to other cryptographic error: {}", e.getMessage(), e);
      throw new EncryptionException("Failed to decrypt data.", e);
    }
  }

  /**
   * Custom runtime exception for encryption/decryption errors.
   */
  public static class EncryptionException extends RuntimeException {
    public EncryptionException(String message) {
      super(message);
    }

    public EncryptionException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
