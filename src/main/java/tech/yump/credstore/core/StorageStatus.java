package tech.yump.credstore.core;

import tech.yump.credstore.provider.Provider;
import tech.yump.credstore.storage.BackendKind;

import java.util.Optional;

/**
 * Where a provider's key currently lives. When both backends hold a value, the secure one is preferred.
 */
public record StorageStatus(Provider provider, String secureValue, String plainValue) {

  public enum State {
    NONE,
    SECURE_ONLY,
    PLAIN_ONLY,
    DUPLICATE
  }

  public State state() {
    boolean secure = hasSecure();
    boolean plain = hasPlain();
    if (secure && plain) {
      return State.DUPLICATE;
    }
    if (secure) {
      return State.SECURE_ONLY;
    }
    return plain ? State.PLAIN_ONLY : State.NONE;
  }

  public boolean hasSecure() {
    return secureValue != null && !secureValue.isEmpty();
  }

  public boolean hasPlain() {
    return plainValue != null && !plainValue.isEmpty();
  }

  public boolean hasApiKey() {
    return state() != State.NONE;
  }

  /**
   * @return true if both backends hold exactly the same value.
   */
  public boolean isIdenticalDuplicate() {
    return state() == State.DUPLICATE && secureValue.equals(plainValue);
  }

  public Optional<String> preferredValue() {
    if (hasSecure()) {
      return Optional.of(secureValue);
    }
    return hasPlain() ? Optional.of(plainValue) : Optional.empty();
  }

  public Optional<BackendKind> preferredBackend() {
    if (hasSecure()) {
      return Optional.of(BackendKind.SECURE);
    }
    return hasPlain() ? Optional.of(BackendKind.PLAIN) : Optional.empty();
  }

  @Override
  public String toString() {
    return "StorageStatus[provider=" + provider + ", state=" + state() + "]";
  }
}
