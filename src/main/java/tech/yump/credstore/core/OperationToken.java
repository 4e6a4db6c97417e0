package tech.yump.credstore.core;

import tech.yump.credstore.provider.Provider;

import java.time.Instant;
import java.util.UUID;

/**
 * Marks one in-flight atomic operation. Ids are prefixed with the provider they are scoped to,
 * e.g. {@code openai_save_1f2e3d4c}. Never persisted.
 */
public record OperationToken(String id, OperationKind kind, Provider provider, Instant startedAt) {

  static OperationToken start(OperationKind kind, Provider provider) {
    String suffix = UUID.randomUUID().toString().substring(0, 8);
    return new OperationToken(provider.id() + "_" + kind.value() + "_" + suffix, kind, provider, Instant.now());
  }

  public String prefix() {
    return provider.id() + "_";
  }
}
