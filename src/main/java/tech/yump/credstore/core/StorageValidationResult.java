package tech.yump.credstore.core;

/**
 * Outcome of checking a provider for keys stored in more than one backend.
 */
public record StorageValidationResult(Outcome outcome, String message) {

  public enum Outcome {
    NO_ISSUES,
    FIXED_DUPLICATES,
    /** Both backends hold different keys; only the user can pick one. */
    NEEDS_USER_CHOICE,
    CANNOT_FIX
  }

  public static StorageValidationResult noIssues() {
    return new StorageValidationResult(Outcome.NO_ISSUES, "No storage issues found");
  }

  public static StorageValidationResult fixedDuplicates() {
    return new StorageValidationResult(Outcome.FIXED_DUPLICATES, "Removed duplicate plain copy, key kept in secure storage");
  }

  public static StorageValidationResult needsUserChoice() {
    return new StorageValidationResult(Outcome.NEEDS_USER_CHOICE, "Different API keys are stored in secure and plain storage");
  }

  public static StorageValidationResult cannotFix(String reason) {
    return new StorageValidationResult(Outcome.CANNOT_FIX, reason);
  }
}
