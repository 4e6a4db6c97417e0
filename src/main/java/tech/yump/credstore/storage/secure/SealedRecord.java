package tech.yump.credstore.storage.secure;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Base64;

/**
 * On-disk format of one secure record.
 *
 * <pre>
 * {
 *   "v": 1,
 *   "svc": "cred-store",
 *   "acct": "all-keys",
 *   "n": "BASE64_ENCODED_NONCE",
 *   "c": "BASE64_ENCODED_CIPHERTEXT",
 *   "ts": 1678886400
 * }
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SealedRecord {

  public static final int CURRENT_VERSION = 1;

  @JsonProperty("v")
  private int version = CURRENT_VERSION;

  @JsonProperty("svc")
  private String service;

  @JsonProperty("acct")
  private String account;

  @JsonProperty("n")
  private String nonceBase64;

  @JsonProperty("c")
  private String ciphertextBase64;

  @JsonProperty("ts")
  private Instant timestamp;

  public SealedRecord(String service, String account, byte[] nonce, byte[] ciphertext) {
    if (nonce == null || ciphertext == null) {
      throw new IllegalArgumentException("Nonce and ciphertext cannot be null.");
    }
    this.version = CURRENT_VERSION;
    this.service = service;
    this.account = account;
    this.nonceBase64 = Base64.getEncoder().encodeToString(nonce);
    this.ciphertextBase64 = Base64.getEncoder().encodeToString(ciphertext);
    this.timestamp = Instant.now();
  }

  /**
   * @throws IllegalStateException if the nonce is missing.
   * @throws IllegalArgumentException if the nonce is not valid Base64.
   */
  public byte[] nonceBytes() {
    if (nonceBase64 == null) {
      throw new IllegalStateException("Nonce Base64 string is null.");
    }
    return Base64.getDecoder().decode(nonceBase64);
  }

  /**
   * @throws IllegalStateException if the ciphertext is missing.
   * @throws IllegalArgumentException if the ciphertext is not valid Base64.
   */
  public byte[] ciphertextBytes() {
    if (ciphertextBase64 == null) {
      throw new IllegalStateException("Ciphertext Base64 string is null.");
    }
    return Base64.getDecoder().decode(ciphertextBase64);
  }
}
