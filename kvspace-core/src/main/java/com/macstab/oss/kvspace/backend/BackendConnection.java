/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.backend;

import java.util.Set;

/** Open connection to one backend database at one schema version. */
public interface BackendConnection extends AutoCloseable {

  String getDatabaseName();

  /** Schema version this connection observes. */
  int getVersion();

  boolean containsStore(String storeName);

  Set<String> storeNames();

  boolean isOpen();

  /**
   * Starts a transaction on one store.
   *
   * <p>Read-write transactions may block until the database's current writer finishes.
   *
   * @throws StaleConnectionException if the connection is closed, the store does not exist in
   *     this connection's schema, or the database was upgraded by another connection
   */
  BackendTransaction begin(String storeName, TransactionMode mode, DurabilityHint durabilityHint);

  /** Closes the connection. Idempotent. */
  @Override
  void close();
}
