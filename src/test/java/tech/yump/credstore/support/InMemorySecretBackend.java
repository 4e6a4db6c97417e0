package tech.yump.credstore.support;

import tech.yump.credstore.storage.BackendKind;
import tech.yump.credstore.storage.SecretBackend;
import tech.yump.credstore.storage.StorageException;
import tech.yump.credstore.storage.StorageWriteException;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Map-backed backend with switches for injecting the failures the atomic protocols have to survive.
 */
public class InMemorySecretBackend implements SecretBackend {

  private final BackendKind kind;
  private final Map<String, String> entries = new ConcurrentHashMap<>();
  private final AtomicInteger putCount = new AtomicInteger();
  private final AtomicInteger readCount = new AtomicInteger();

  private volatile boolean failReads;
  private volatile boolean failWrites;
  private volatile boolean failRemoves;
  private volatile boolean corruptWrites;
  private volatile boolean ignoreRemoves;
  private volatile int failWritesAfter = -1;
  private volatile int failReadsAfter = -1;
  private volatile CountDownLatch putGate;

  public InMemorySecretBackend(BackendKind kind) {
    this.kind = kind;
  }

  @Override
  public BackendKind kind() {
    return kind;
  }

  @Override
  public Optional<String> get(String key) {
    int count = readCount.incrementAndGet();
    if (failReads || (failReadsAfter >= 0 && count > failReadsAfter)) {
      throw new StorageException(kind, "Simulated read failure");
    }
    return Optional.ofNullable(entries.get(key));
  }

  @Override
  public void put(String key, String value) {
    awaitGate();
    int count = putCount.incrementAndGet();
    if (failWrites || (failWritesAfter >= 0 && count > failWritesAfter)) {
      throw new StorageWriteException(kind, "Simulated write failure");
    }
    entries.put(key, corruptWrites ? value + "-corrupted" : value);
  }

  @Override
  public void remove(String key) {
    if (failRemoves) {
      throw new StorageWriteException(kind, "Simulated remove failure");
    }
    if (!ignoreRemoves) {
      entries.remove(key);
    }
  }

  @Override
  public void clear() {
    if (failRemoves) {
      throw new StorageWriteException(kind, "Simulated clear failure");
    }
    entries.clear();
  }

  /**
   * Writes directly, bypassing failure switches.
   */
  public void seed(String key, String value) {
    entries.put(key, value);
  }

  public Map<String, String> entries() {
    return Map.copyOf(entries);
  }

  public int putCount() {
    return putCount.get();
  }

  public void failReads(boolean value) {
    this.failReads = value;
  }

  /**
   * Lets the first {@code successfulReads} reads through and fails every later one.
   */
  public void failReadsAfter(int successfulReads) {
    this.failReadsAfter = successfulReads;
  }

  public void failWrites(boolean value) {
    this.failWrites = value;
  }

  /**
   * Lets the first {@code successfulPuts} puts through and fails every later one.
   */
  public void failWritesAfter(int successfulPuts) {
    this.failWritesAfter = successfulPuts;
  }

  public void failRemoves(boolean value) {
    this.failRemoves = value;
  }

  public void corruptWrites(boolean value) {
    this.corruptWrites = value;
  }

  public void ignoreRemoves(boolean value) {
    this.ignoreRemoves = value;
  }

  /**
   * Blocks every put until the latch is released.
   */
  public void holdPutsUntil(CountDownLatch gate) {
    this.putGate = gate;
  }

  private void awaitGate() {
    CountDownLatch gate = putGate;
    if (gate == null) {
      return;
    }
    try {
      if (!gate.await(10, TimeUnit.SECONDS)) {
        throw new IllegalStateException("Put gate was never released");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting on put gate", e);
    }
  }
}
