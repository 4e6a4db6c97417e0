package tech.yump.credstore.core;

import java.util.Locale;

public enum OperationKind {
  SAVE,
  MIGRATE,
  REMOVE,
  CLEAR;

  /**
   * @return the lowercase name used in operation ids and audit events.
   */
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
