/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.redis;

import java.util.Set;

import com.macstab.oss.kvspace.backend.BackendConnection;
import com.macstab.oss.kvspace.backend.BackendTransaction;
import com.macstab.oss.kvspace.backend.DurabilityHint;
import com.macstab.oss.kvspace.backend.StaleConnectionException;
import com.macstab.oss.kvspace.backend.StaleConnectionException.Reason;
import com.macstab.oss.kvspace.backend.TransactionMode;

import lombok.Getter;

/**
 * Connection to one Redis database, pinned to the version and stores it observed when opened.
 *
 * <p>Holds no Redis resources of its own. Staleness is detected against the version key on every
 * {@link #begin}.
 */
final class RedisDatabaseConnection implements BackendConnection {

  private final RedisBackendAdapter adapter;
  private final RedisNamespace namespace;
  @Getter private final int version;
  private final Set<String> storeNames;
  private volatile boolean open = true;

  RedisDatabaseConnection(
      final RedisBackendAdapter adapter,
      final RedisNamespace namespace,
      final int version,
      final Set<String> storeNames) {
    this.adapter = adapter;
    this.namespace = namespace;
    this.version = version;
    this.storeNames = storeNames;
  }

  @Override
  public String getDatabaseName() {
    return namespace.getDatabaseName();
  }

  @Override
  public boolean containsStore(final String storeName) {
    return storeNames.contains(storeName);
  }

  @Override
  public Set<String> storeNames() {
    return storeNames;
  }

  @Override
  public boolean isOpen() {
    return open;
  }

  @Override
  public BackendTransaction begin(
      final String storeName, final TransactionMode mode, final DurabilityHint durabilityHint) {
    checkOpen();
    if (mode == TransactionMode.READ_ONLY) {
      return open(storeName, mode);
    }

    adapter.acquireWriter(namespace.getDatabaseName());
    try {
      checkOpen();
      return open(storeName, mode);
    } catch (final RuntimeException e) {
      adapter.releaseWriter(namespace.getDatabaseName());
      throw e;
    }
  }

  @Override
  public void close() {
    open = false;
  }

  @Override
  public String toString() {
    return "RedisDatabaseConnection["
        + namespace.getDatabaseName()
        + " v"
        + version
        + (open ? "" : ", closed")
        + "]";
  }

  // ==================== Private Methods ====================

  private RedisTransaction open(final String storeName, final TransactionMode mode) {
    final var entries = adapter.readStore(namespace, version, storeName);
    return new RedisTransaction(adapter, namespace, version, storeName, mode, entries);
  }

  private void checkOpen() {
    if (!open) {
      throw new StaleConnectionException(
          Reason.CLOSED, "Connection to '" + namespace.getDatabaseName() + "' is closed");
    }
  }
}
