/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.backend;

import java.util.Set;

/**
 * Storage engine plugged underneath kvspace.
 *
 * <p><strong>Contract:</strong> a backend stores named databases. Each database has a positive
 * integer version and a set of named stores; each store maps string keys to values. Schema changes
 * (creating or deleting stores) only happen inside a {@link SchemaUpgrade} run by {@link #open}
 * while the version increases. Read-write transactions on one database are serialized by the
 * backend (single writer); read-only transactions observe committed state.
 *
 * <p><strong>Threading:</strong> all methods are blocking. The core calls them on its worker
 * executor, never while holding its own locks.
 *
 * <p><strong>Capabilities:</strong> optional features are declared through {@link
 * #capabilities()} instead of being discovered by probing the implementation.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
public interface BackendAdapter {

  /** Driver name used for registration and in error details (e.g. {@code "memory"}). */
  String getName();

  /** Whether this backend can be used in the current process. */
  default boolean isSupported() {
    return true;
  }

  default Set<BackendCapability> capabilities() {
    return Set.of();
  }

  default boolean supports(final BackendCapability capability) {
    return capabilities().contains(capability);
  }

  /**
   * Opens a connection to a database, creating the database at version 1 if it does not exist.
   *
   * @param databaseName physical database name
   * @param version requested version, or {@code null} to open whatever version is on disk
   * @param upgrade callback run when {@code version} is greater than the on-disk version
   * @return open connection
   * @throws BackendException if {@code version} is lower than the on-disk version, the upgrade
   *     fails or the backend is unreachable
   */
  BackendConnection open(String databaseName, Integer version, SchemaUpgrade upgrade);

  /**
   * Deletes a database with all its stores. Open connections to it become stale. No-op if the
   * database does not exist.
   *
   * @throws UnsupportedOperationException if {@link BackendCapability#DROP_DATABASE} is not
   *     declared
   */
  default void deleteDatabase(final String databaseName) {
    throw new UnsupportedOperationException(getName() + " cannot delete databases");
  }
}
