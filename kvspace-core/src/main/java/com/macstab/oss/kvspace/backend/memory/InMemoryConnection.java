/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.backend.memory;

import java.util.Set;

import com.macstab.oss.kvspace.backend.BackendConnection;
import com.macstab.oss.kvspace.backend.BackendTransaction;
import com.macstab.oss.kvspace.backend.DurabilityHint;
import com.macstab.oss.kvspace.backend.TransactionMode;

import lombok.Getter;

/** Connection to an {@link InMemoryDatabase}, pinned to the schema it observed when opened. */
final class InMemoryConnection implements BackendConnection {

  private final InMemoryDatabase database;
  @Getter private final int version;
  private final Set<String> storeNames;
  private volatile boolean open = true;

  InMemoryConnection(
      final InMemoryDatabase database, final int version, final Set<String> storeNames) {
    this.database = database;
    this.version = version;
    this.storeNames = storeNames;
  }

  @Override
  public String getDatabaseName() {
    return database.getName();
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
    if (mode == TransactionMode.READ_ONLY) {
      return new InMemoryTransaction(
          database, version, storeName, mode, database.snapshot(this, storeName));
    }
    return new InMemoryTransaction(
        database, version, storeName, mode, database.beginWrite(this, storeName));
  }

  @Override
  public void close() {
    open = false;
    database.disconnect(this);
  }

  void invalidate() {
    open = false;
  }

  @Override
  public String toString() {
    return "InMemoryConnection["
        + database.getName()
        + " v"
        + version
        + (open ? "" : ", closed")
        + "]";
  }
}
