package tech.yump.credstore.storage;

/**
 * Thrown when a secret value is unusable, i.e. empty once NUL characters are stripped.
 */
public class InvalidSecretException extends IllegalArgumentException {

  public InvalidSecretException(String message) {
    super(message);
  }
}
