/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.backend.memory;

import java.util.HashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;

import com.macstab.oss.kvspace.backend.BackendException;
import com.macstab.oss.kvspace.backend.QuotaExceededException;
import com.macstab.oss.kvspace.backend.SchemaEditor;
import com.macstab.oss.kvspace.backend.SchemaUpgrade;
import com.macstab.oss.kvspace.backend.StaleConnectionException;
import com.macstab.oss.kvspace.backend.StaleConnectionException.Reason;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * One in-memory database: committed stores, schema version and the writer permit.
 *
 * <p>Schema and committed data are guarded by this object's monitor. The writer permit is acquired
 * outside the monitor so a waiting writer never blocks readers.
 */
@Slf4j
final class InMemoryDatabase {

  @Getter private final String name;
  private final int maxEntriesPerStore;
  private final Semaphore writer = new Semaphore(1, true);
  private final Set<InMemoryConnection> connections = ConcurrentHashMap.newKeySet();

  private Map<String, NavigableMap<String, Object>> stores = new HashMap<>();
  private int version;
  private boolean deleted;
  private long committedWrites;

  InMemoryDatabase(final String name, final int maxEntriesPerStore) {
    this.name = name;
    this.maxEntriesPerStore = maxEntriesPerStore;
  }

  /**
   * Opens a connection, upgrading first if {@code requested} exceeds the current version.
   *
   * @return connection, or {@code null} if this database was deleted concurrently
   */
  InMemoryConnection open(final Integer requested, final SchemaUpgrade upgrade) {
    synchronized (this) {
      if (deleted) {
        return null;
      }
      final int target = requested != null ? requested : Math.max(version, 1);
      checkNotDowngrade(target);
      if (target == version) {
        return connect();
      }
    }

    acquireWriter();
    try {
      synchronized (this) {
        if (deleted) {
          return null;
        }
        final int target = requested != null ? requested : Math.max(version, 1);
        checkNotDowngrade(target);
        if (target > version) {
          upgrade(target, upgrade);
        }
        return connect();
      }
    } finally {
      writer.release();
    }
  }

  synchronized void markDeleted() {
    deleted = true;
    for (final var connection : connections) {
      connection.invalidate();
    }
    connections.clear();
    stores = new HashMap<>();
  }

  synchronized int getVersion() {
    return version;
  }

  synchronized long getCommittedWrites() {
    return committedWrites;
  }

  synchronized Set<String> storeNames() {
    return Set.copyOf(stores.keySet());
  }

  void disconnect(final InMemoryConnection connection) {
    connections.remove(connection);
  }

  /** Snapshot of a store for a read-only transaction. */
  synchronized NavigableMap<String, Object> snapshot(
      final InMemoryConnection connection, final String storeName) {
    return new TreeMap<>(checkUsable(connection, storeName));
  }

  /** Acquires the writer permit and returns a private working copy of a store. */
  NavigableMap<String, Object> beginWrite(
      final InMemoryConnection connection, final String storeName) {
    acquireWriter();
    try {
      synchronized (this) {
        return new TreeMap<>(checkUsable(connection, storeName));
      }
    } catch (final RuntimeException e) {
      writer.release();
      throw e;
    }
  }

  /** Publishes a working copy and releases the writer permit. */
  void commitWrite(
      final int connectionVersion,
      final String storeName,
      final NavigableMap<String, Object> working) {
    try {
      synchronized (this) {
        if (deleted || connectionVersion != version || !stores.containsKey(storeName)) {
          log.warn(
              "Discarding commit to in-memory store '{}/{}': schema changed", name, storeName);
          return;
        }
        if (working.size() > maxEntriesPerStore) {
          throw new QuotaExceededException(
              String.format(
                  "Store '%s/%s' would hold %d entries, limit is %d",
                  name, storeName, working.size(), maxEntriesPerStore));
        }
        stores.put(storeName, working);
        committedWrites++;
      }
    } finally {
      writer.release();
    }
  }

  void abortWrite() {
    writer.release();
  }

  // ==================== Private Methods ====================

  private NavigableMap<String, Object> checkUsable(
      final InMemoryConnection connection, final String storeName) {
    if (deleted) {
      throw new StaleConnectionException(Reason.CLOSED, "Database '" + name + "' was deleted");
    }
    if (connection.getVersion() != version) {
      throw new StaleConnectionException(
          Reason.VERSION_CHANGED,
          String.format(
              "Database '%s' was upgraded from version %d to %d",
              name, connection.getVersion(), version));
    }
    if (!connection.isOpen()) {
      throw new StaleConnectionException(Reason.CLOSED, "Connection to '" + name + "' is closed");
    }
    final var store = stores.get(storeName);
    if (store == null) {
      throw new StaleConnectionException(
          Reason.STORE_NOT_FOUND, "Store '" + storeName + "' not found in '" + name + "'");
    }
    return store;
  }

  private void checkNotDowngrade(final int target) {
    if (target < version) {
      throw new BackendException(
          String.format(
              "Requested version %d of '%s' is lower than existing version %d",
              target, name, version));
    }
  }

  private InMemoryConnection connect() {
    final var connection = new InMemoryConnection(this, version, Set.copyOf(stores.keySet()));
    connections.add(connection);
    return connection;
  }

  private void upgrade(final int target, final SchemaUpgrade upgrade) {
    final var working = new HashMap<String, NavigableMap<String, Object>>();
    stores.forEach((store, entries) -> working.put(store, new TreeMap<>(entries)));

    upgrade.upgrade(new WorkingSchema(working), version, target);

    for (final var connection : connections) {
      connection.invalidate();
    }
    connections.clear();

    if (log.isDebugEnabled()) {
      log.debug("Upgraded in-memory database '{}' from version {} to {}", name, version, target);
    }
    stores = working;
    version = target;
  }

  private void acquireWriter() {
    try {
      writer.acquire();
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BackendException("Interrupted while waiting for writer on '" + name + "'", e);
    }
  }

  /** Schema editor over the working copy of an upgrade. */
  private static final class WorkingSchema implements SchemaEditor {

    private final Map<String, NavigableMap<String, Object>> working;

    private WorkingSchema(final Map<String, NavigableMap<String, Object>> working) {
      this.working = working;
    }

    @Override
    public boolean containsStore(final String storeName) {
      return working.containsKey(storeName);
    }

    @Override
    public Set<String> storeNames() {
      return Set.copyOf(working.keySet());
    }

    @Override
    public void createStore(final String storeName) {
      working.putIfAbsent(storeName, new TreeMap<>());
    }

    @Override
    public void deleteStore(final String storeName) {
      working.remove(storeName);
    }
  }
}
