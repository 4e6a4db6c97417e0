package tech.yump.credstore.storage;

/**
 * Input cleanup for secret values. Only NUL characters are removed; every other character
 * may be legitimate key material and is preserved.
 */
public final class SecretSanitizer {

  private static final String NUL = "\u0000";

  private SecretSanitizer() {
  }

  public static String stripNul(String value) {
    return value == null ? null : value.replace(NUL, "");
  }

  /**
   * Strips NUL characters and rejects the result if nothing is left.
   *
   * @throws InvalidSecretException if the value is null or empty after stripping.
   */
  public static String requireUsable(String value) {
    String sanitized = stripNul(value);
    if (sanitized == null || sanitized.isEmpty()) {
      throw new InvalidSecretException("API key cannot be empty.");
    }
    return sanitized;
  }
}
