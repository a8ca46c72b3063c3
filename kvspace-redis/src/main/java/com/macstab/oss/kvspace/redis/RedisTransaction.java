/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.redis;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;

import com.macstab.oss.kvspace.backend.BackendException;
import com.macstab.oss.kvspace.backend.BackendTransaction;
import com.macstab.oss.kvspace.backend.TransactionMode;

import lombok.Getter;

/**
 * Transaction over a snapshot of one Redis hash.
 *
 * <p>Reads see the snapshot taken at begin plus this transaction's own writes. Read-write
 * transactions hold the adapter's writer permit for the database until they end; their writes reach
 * Redis only on {@link #commit()}.
 */
final class RedisTransaction implements BackendTransaction {

  private final RedisBackendAdapter adapter;
  private final RedisNamespace namespace;
  private final int version;
  private final String storeName;
  @Getter private final TransactionMode mode;
  private final NavigableMap<String, Object> entries;
  private final RedisWriteSet writes = new RedisWriteSet();
  private boolean finished;

  RedisTransaction(
      final RedisBackendAdapter adapter,
      final RedisNamespace namespace,
      final int version,
      final String storeName,
      final TransactionMode mode,
      final NavigableMap<String, Object> entries) {
    this.adapter = adapter;
    this.namespace = namespace;
    this.version = version;
    this.storeName = storeName;
    this.mode = mode;
    this.entries = entries;
  }

  @Override
  public Object get(final String key) {
    checkActive();
    return entries.get(key);
  }

  @Override
  public void put(final String key, final Object value) {
    checkWritable();
    adapter.checkEncodable(value);
    entries.put(key, value);
    writes.put(key, value);
  }

  @Override
  public void delete(final String key) {
    checkWritable();
    entries.remove(key);
    writes.delete(key);
  }

  @Override
  public void clear() {
    checkWritable();
    entries.clear();
    writes.clear();
  }

  @Override
  public int count() {
    checkActive();
    return entries.size();
  }

  @Override
  public List<String> keys() {
    checkActive();
    return new ArrayList<>(entries.keySet());
  }

  @Override
  public void forEach(final EntryVisitor visitor) {
    checkActive();
    for (final var entry : entries.entrySet()) {
      if (!visitor.visit(entry.getKey(), entry.getValue())) {
        return;
      }
    }
  }

  @Override
  public void commit() {
    checkActive();
    finished = true;
    if (mode != TransactionMode.READ_WRITE) {
      return;
    }
    try {
      if (!writes.isEmpty()) {
        adapter.commit(namespace, version, storeName, writes);
      }
    } finally {
      adapter.releaseWriter(namespace.getDatabaseName());
    }
  }

  @Override
  public void abort() {
    if (finished) {
      return;
    }
    finished = true;
    if (mode == TransactionMode.READ_WRITE) {
      adapter.releaseWriter(namespace.getDatabaseName());
    }
  }

  // ==================== Private Methods ====================

  private void checkActive() {
    if (finished) {
      throw new IllegalStateException("Transaction on '" + storeName + "' already finished");
    }
  }

  private void checkWritable() {
    checkActive();
    if (mode == TransactionMode.READ_ONLY) {
      throw new BackendException("Read-only transaction on '" + storeName + "' cannot write");
    }
  }
}
