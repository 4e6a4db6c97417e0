package tech.yump.credstore.storage;

/**
 * The store accepted a change but did not reflect it when read back. Unlike a plain write failure,
 * the store may now hold a value other than both the previous and the requested one.
 */
public class StorageVerificationException extends StorageWriteException {

  public StorageVerificationException(BackendKind backend, String message) {
    super(backend, message);
  }
}
