package tech.yump.credstore.core;

import lombok.extern.slf4j.Slf4j;
import tech.yump.credstore.provider.Provider;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The set of atomic operations currently in flight, at most one per provider. Callers that find
 * their provider busy get nothing back and are expected to fail fast; this class never blocks
 * beyond its own short critical sections.
 */
@Slf4j
public class OperationRegistry {

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<Provider, OperationToken> active = new LinkedHashMap<>();

  /**
   * @return a token for the new operation, or empty if an operation for the provider is already active.
   */
  public Optional<OperationToken> tryBegin(OperationKind kind, Provider provider) {
    lock.lock();
    try {
      OperationToken existing = active.get(provider);
      if (existing != null) {
        log.warn("Operation '{}' rejected for provider '{}': '{}' is in progress", kind.value(), provider, existing.id());
        return Optional.empty();
      }
      OperationToken token = OperationToken.start(kind, provider);
      active.put(provider, token);
      log.debug("Operation '{}' started", token.id());
      return Optional.of(token);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Registers one operation per provider, all or none.
   *
   * @return the tokens, or empty if any of the providers is busy.
   */
  public Optional<List<OperationToken>> tryBeginAll(OperationKind kind, Collection<Provider> providers) {
    lock.lock();
    try {
      for (Provider provider : providers) {
        if (active.containsKey(provider)) {
          log.warn("Operation '{}' rejected: provider '{}' is busy with '{}'", kind.value(), provider, active.get(provider).id());
          return Optional.empty();
        }
      }
      List<OperationToken> tokens = new ArrayList<>();
      for (Provider provider : providers) {
        OperationToken token = OperationToken.start(kind, provider);
        active.put(provider, token);
        tokens.add(token);
      }
      return Optional.of(tokens);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Releases the token. Releasing a token that is no longer registered is a no-op.
   */
  public void end(OperationToken token) {
    lock.lock();
    try {
      if (active.remove(token.provider(), token)) {
        log.debug("Operation '{}' finished", token.id());
      }
    } finally {
      lock.unlock();
    }
  }

  public void endAll(Collection<OperationToken> tokens) {
    tokens.forEach(this::end);
  }

  public boolean isActive(Provider provider) {
    lock.lock();
    try {
      return active.containsKey(provider);
    } finally {
      lock.unlock();
    }
  }

  public int activeCount() {
    lock.lock();
    try {
      return active.size();
    } finally {
      lock.unlock();
    }
  }

  public List<OperationToken> snapshot() {
    lock.lock();
    try {
      return List.copyOf(active.values());
    } finally {
      lock.unlock();
    }
  }
}
