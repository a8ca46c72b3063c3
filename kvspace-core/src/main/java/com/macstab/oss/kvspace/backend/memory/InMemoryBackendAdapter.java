/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.backend.memory;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import com.macstab.oss.kvspace.backend.BackendAdapter;
import com.macstab.oss.kvspace.backend.BackendCapability;
import com.macstab.oss.kvspace.backend.BackendConnection;
import com.macstab.oss.kvspace.backend.BackendException;
import com.macstab.oss.kvspace.backend.SchemaUpgrade;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Heap-backed {@link BackendAdapter} honouring the versioned single-writer contract.
 *
 * <p><strong>Semantics:</strong>
 *
 * <ul>
 *   <li>Databases are created at version 1 with no stores on first open.
 *   <li>Opening with a higher version runs the {@link SchemaUpgrade} on a copy of the schema while
 *       holding the database's writer permit; every other open connection becomes stale ({@code
 *       VERSION_CHANGED}).
 *   <li>Opening with a lower version fails, as a real versioned engine would.
 *   <li>Read-write transactions hold the writer permit from {@code begin} to {@code
 *       commit}/{@code abort} and stage their writes on a private copy of the store.
 *   <li>Read-only transactions read a snapshot of committed state taken at {@code begin}.
 * </ul>
 *
 * <p>Values are stored by reference. An optional per-store entry limit makes commits fail with
 * {@link com.macstab.oss.kvspace.backend.QuotaExceededException}.
 *
 * <p><strong>Thread Safety:</strong> fully thread-safe; one instance may back any number of kvspace
 * runtimes.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class InMemoryBackendAdapter implements BackendAdapter {

  public static final String DRIVER_NAME = "memory";

  private final ConcurrentMap<String, InMemoryDatabase> databases = new ConcurrentHashMap<>();
  private final String name;
  private final int maxEntriesPerStore;

  public InMemoryBackendAdapter() {
    this(DRIVER_NAME, Integer.MAX_VALUE);
  }

  /**
   * Creates an adapter.
   *
   * @param name driver name (must not be null)
   * @param maxEntriesPerStore commit fails once a store would exceed this many entries (&gt;= 1)
   */
  public InMemoryBackendAdapter(@NonNull final String name, final int maxEntriesPerStore) {
    if (maxEntriesPerStore < 1) {
      throw new IllegalArgumentException(
          "maxEntriesPerStore must be >= 1, got: " + maxEntriesPerStore);
    }
    this.name = name;
    this.maxEntriesPerStore = maxEntriesPerStore;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public Set<BackendCapability> capabilities() {
    return EnumSet.allOf(BackendCapability.class);
  }

  @Override
  public BackendConnection open(
      @NonNull final String databaseName, final Integer version, final SchemaUpgrade upgrade) {
    if (version != null && version < 1) {
      throw new BackendException("Database version must be >= 1, got: " + version);
    }
    final var schemaUpgrade = upgrade != null ? upgrade : SchemaUpgrade.NONE;

    while (true) {
      final var database =
          databases.computeIfAbsent(
              databaseName, key -> new InMemoryDatabase(key, maxEntriesPerStore));
      final var connection = database.open(version, schemaUpgrade);
      if (connection != null) {
        return connection;
      }
      // deleted between lookup and open
      databases.remove(databaseName, database);
    }
  }

  @Override
  public void deleteDatabase(@NonNull final String databaseName) {
    final var database = databases.remove(databaseName);
    if (database != null) {
      database.markDeleted();
      if (log.isDebugEnabled()) {
        log.debug("Deleted in-memory database '{}'", databaseName);
      }
    }
  }

  /** On-disk version of a database, empty if it does not exist. */
  public Optional<Integer> getDatabaseVersion(final String databaseName) {
    return Optional.ofNullable(databases.get(databaseName)).map(InMemoryDatabase::getVersion);
  }

  /** Store names of a database, empty if it does not exist. */
  public Set<String> getStoreNames(final String databaseName) {
    final var database = databases.get(databaseName);
    return database != null ? database.storeNames() : Set.of();
  }

  /** Number of read-write transactions committed against a database since it was created. */
  public long getCommittedWriteTransactions(final String databaseName) {
    final var database = databases.get(databaseName);
    return database != null ? database.getCommittedWrites() : 0L;
  }
}
