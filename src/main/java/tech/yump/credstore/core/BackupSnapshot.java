package tech.yump.credstore.core;

import tech.yump.credstore.provider.Provider;
import tech.yump.credstore.storage.BackendKind;

/**
 * A value captured before a destructive step, kept only to attempt a rollback.
 */
public record BackupSnapshot(Provider provider, BackendKind backend, String value) {

  @Override
  public String toString() {
    return "BackupSnapshot[provider=" + provider + ", backend=" + backend + ", value=****]";
  }
}
