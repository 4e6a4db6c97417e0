package tech.yump.credstore.storage;

import java.util.Arrays;
import java.util.Locale;

/**
 * The interchangeable storage mechanisms a secret can live in. Exactly one is current at a time.
 */
public enum BackendKind {

  SECURE("secure", "Secure store (encrypted)", true),
  PLAIN("plain", "Preference file (plain text)", false);

  private final String value;
  private final String displayName;
  private final boolean secure;

  BackendKind(String value, String displayName, boolean secure) {
    this.value = value;
    this.displayName = displayName;
    this.secure = secure;
  }

  /**
   * @return the persisted form of this kind, as written to the backend preference.
   */
  public String value() {
    return value;
  }

  public String displayName() {
    return displayName;
  }

  public boolean isSecure() {
    return secure;
  }

  /**
   * Parses a persisted preference value, ignoring case.
   *
   * @throws IllegalArgumentException if the value names no known backend.
   */
  public static BackendKind fromValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Backend value cannot be null.");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
            .filter(kind -> kind.value.equals(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown storage backend: " + value));
  }
}
