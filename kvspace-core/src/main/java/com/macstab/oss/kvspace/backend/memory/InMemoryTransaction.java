/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.backend.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;

import com.macstab.oss.kvspace.backend.BackendException;
import com.macstab.oss.kvspace.backend.BackendTransaction;
import com.macstab.oss.kvspace.backend.TransactionMode;

import lombok.Getter;

/**
 * Transaction over a private copy of one store.
 *
 * <p>Read-write transactions own the database's writer permit until they end.
 */
final class InMemoryTransaction implements BackendTransaction {

  private final InMemoryDatabase database;
  private final int version;
  private final String storeName;
  @Getter private final TransactionMode mode;
  private final NavigableMap<String, Object> entries;
  private boolean finished;

  InMemoryTransaction(
      final InMemoryDatabase database,
      final int version,
      final String storeName,
      final TransactionMode mode,
      final NavigableMap<String, Object> entries) {
    this.database = database;
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
    entries.put(key, value);
  }

  @Override
  public void delete(final String key) {
    checkWritable();
    entries.remove(key);
  }

  @Override
  public void clear() {
    checkWritable();
    entries.clear();
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
    if (mode == TransactionMode.READ_WRITE) {
      database.commitWrite(version, storeName, entries);
    }
  }

  @Override
  public void abort() {
    if (finished) {
      return;
    }
    finished = true;
    if (mode == TransactionMode.READ_WRITE) {
      database.abortWrite();
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
