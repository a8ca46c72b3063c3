/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.redis;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import com.macstab.oss.kvspace.backend.BackendAdapter;
import com.macstab.oss.kvspace.backend.BackendCapability;
import com.macstab.oss.kvspace.backend.BackendConnection;
import com.macstab.oss.kvspace.backend.BackendException;
import com.macstab.oss.kvspace.backend.SchemaEditor;
import com.macstab.oss.kvspace.backend.SchemaUpgrade;
import com.macstab.oss.kvspace.backend.StaleConnectionException;
import com.macstab.oss.kvspace.backend.StaleConnectionException.Reason;

import io.lettuce.core.KeyScanCursor;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.ScanArgs;
import io.lettuce.core.ScanCursor;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link BackendAdapter} storing kvspace databases in Redis through Lettuce.
 *
 * <p><strong>Storage Layout:</strong> see {@link RedisNamespace}. Values are written by a {@link
 * ValueCodec}, JSON by default.
 *
 * <p><strong>Connection:</strong> one {@code StatefulRedisConnection} serves every command. A
 * lock keeps MULTI/EXEC and WATCH sequences from interleaving, because that state lives on the
 * connection. It is opened lazily from the {@link RedisClient} and closed by {@link #close()}; the
 * client itself is owned by the caller.
 *
 * <p><strong>Consistency:</strong>
 *
 * <ul>
 *   <li>Reads fetch the schema version and the store hash in one MULTI/EXEC, so a transaction
 *       never observes a store of a different version than it checked.
 *   <li>Commits WATCH the version key. A schema change by another process between begin and commit
 *       discards the commit and surfaces as {@link StaleConnectionException} ({@code
 *       VERSION_CHANGED}).
 *   <li>Read-write transactions of one database are serialized inside this process by a writer
 *       permit. Writers in other processes are only detected for schema changes: concurrent data
 *       writes to the same keys are last-writer-wins.
 * </ul>
 *
 * <p><strong>Capabilities:</strong> {@code DROP_DATABASE} (SCAN + DEL of the namespace) and
 * {@code DROP_STORE}. Durability hints are not supported; Redis persistence is server
 * configuration.
 *
 * <p><strong>Thread Safety:</strong> thread-safe. All methods block on Redis round trips.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class RedisBackendAdapter implements BackendAdapter, AutoCloseable {

  public static final String DRIVER_NAME = "redis";

  private static final int SCAN_BATCH = 500;

  private final String name;
  private final RedisClient client;
  private final ValueCodec codec;

  private final ReentrantLock commandLock = new ReentrantLock();
  private final ConcurrentMap<String, Semaphore> writers = new ConcurrentHashMap<>();
  private final Object connectLock = new Object();

  private volatile StatefulRedisConnection<String, String> connection;
  private volatile boolean closed;

  public RedisBackendAdapter(@NonNull final RedisClient client) {
    this(DRIVER_NAME, client, new JacksonValueCodec());
  }

  /**
   * Creates an adapter.
   *
   * @param name driver name (must not be null)
   * @param client Lettuce client, owned by the caller
   * @param codec value codec
   */
  public RedisBackendAdapter(
      @NonNull final String name,
      @NonNull final RedisClient client,
      @NonNull final ValueCodec codec) {
    this.name = name;
    this.client = client;
    this.codec = codec;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public boolean isSupported() {
    return !closed;
  }

  @Override
  public Set<BackendCapability> capabilities() {
    return EnumSet.of(BackendCapability.DROP_DATABASE, BackendCapability.DROP_STORE);
  }

  @Override
  public BackendConnection open(
      @NonNull final String databaseName, final Integer version, final SchemaUpgrade upgrade) {
    if (version != null && version < 1) {
      throw new BackendException("Database version must be >= 1, got: " + version);
    }
    final var namespace = new RedisNamespace(databaseName);
    final var schemaUpgrade = upgrade != null ? upgrade : SchemaUpgrade.NONE;

    final int onDisk = execute(commands -> parseVersion(commands.get(namespace.getVersionKey())));
    final int target = requestedOrCurrent(version, onDisk);
    checkNotDowngrade(namespace, target, onDisk);
    if (target == onDisk) {
      return connect(namespace, onDisk, readStoreNames(namespace));
    }

    acquireWriter(databaseName);
    try {
      return upgrade(namespace, version, schemaUpgrade);
    } finally {
      releaseWriter(databaseName);
    }
  }

  @Override
  public void deleteDatabase(@NonNull final String databaseName) {
    final var namespace = new RedisNamespace(databaseName);
    final int deleted =
        execute(
            commands -> {
              final var args = ScanArgs.Builder.matches(namespace.scanPattern()).limit(SCAN_BATCH);
              int count = 0;
              KeyScanCursor<String> cursor = commands.scan(ScanCursor.INITIAL, args);
              while (true) {
                if (!cursor.getKeys().isEmpty()) {
                  count += commands.del(cursor.getKeys().toArray(String[]::new)).intValue();
                }
                if (cursor.isFinished()) {
                  return count;
                }
                cursor = commands.scan(cursor, args);
              }
            });
    if (log.isDebugEnabled()) {
      log.debug("Deleted Redis database '{}' ({} keys)", databaseName, deleted);
    }
  }

  /** Closes the Redis connection. The adapter reports itself unsupported afterwards. */
  @Override
  public void close() {
    synchronized (connectLock) {
      closed = true;
      if (connection != null) {
        connection.close();
        connection = null;
      }
    }
    log.info("Redis backend adapter '{}' closed", name);
  }

  // ==================== Package-Private (connections and transactions) ====================

  /**
   * Reads version and store contents atomically and verifies they still match a connection.
   *
   * @return decoded store entries, sorted by key
   * @throws StaleConnectionException if the database was deleted or upgraded, or the store is gone
   */
  NavigableMap<String, Object> readStore(
      final RedisNamespace namespace, final int expectedVersion, final String storeName) {
    final var result =
        execute(
            commands -> {
              commands.multi();
              commands.get(namespace.getVersionKey());
              commands.sismember(namespace.getStoresKey(), storeName);
              commands.hgetall(namespace.storeKey(storeName));
              return commands.exec();
            });
    checkVersion(namespace, expectedVersion, parseVersion(result.get(0)));
    if (!Boolean.TRUE.equals(result.get(1))) {
      throw new StaleConnectionException(
          Reason.STORE_NOT_FOUND,
          "Store '" + storeName + "' not found in '" + namespace.getDatabaseName() + "'");
    }
    final Map<String, String> raw = result.get(2);
    final var entries = new TreeMap<String, Object>();
    raw.forEach((key, encoded) -> entries.put(key, codec.decode(encoded)));
    return entries;
  }

  /**
   * Applies staged writes in one MULTI/EXEC guarded by WATCH on the version key.
   *
   * @throws StaleConnectionException if the schema changed since the transaction began
   */
  void commit(
      final RedisNamespace namespace,
      final int expectedVersion,
      final String storeName,
      final RedisWriteSet writes) {
    final var storeKey = namespace.storeKey(storeName);
    final var encoded = new TreeMap<String, String>();
    writes.getPuts().forEach((key, value) -> encoded.put(key, codec.encode(value)));

    final boolean applied =
        execute(
            commands -> {
              commands.watch(namespace.getVersionKey());
              final int current = parseVersion(commands.get(namespace.getVersionKey()));
              if (current != expectedVersion) {
                commands.unwatch();
                checkVersion(namespace, expectedVersion, current);
              }
              commands.multi();
              if (writes.isCleared()) {
                commands.del(storeKey);
              }
              if (!writes.getDeletes().isEmpty()) {
                commands.hdel(storeKey, writes.getDeletes().toArray(String[]::new));
              }
              if (!encoded.isEmpty()) {
                commands.hset(storeKey, encoded);
              }
              return !commands.exec().wasDiscarded();
            });
    if (!applied) {
      throw new StaleConnectionException(
          Reason.VERSION_CHANGED,
          "Schema of '" + namespace.getDatabaseName() + "' changed during the transaction");
    }
    if (log.isTraceEnabled()) {
      log.trace(
          "Committed {} puts and {} deletes to {}",
          encoded.size(),
          writes.getDeletes().size(),
          storeKey);
    }
  }

  /** Fails early if a value cannot be stored. */
  void checkEncodable(final Object value) {
    codec.encode(value);
  }

  void acquireWriter(final String databaseName) {
    final var writer = writers.computeIfAbsent(databaseName, key -> new Semaphore(1, true));
    try {
      writer.acquire();
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BackendException(
          "Interrupted while waiting for writer on '" + databaseName + "'", e);
    }
  }

  void releaseWriter(final String databaseName) {
    final var writer = writers.get(databaseName);
    if (writer != null) {
      writer.release();
    }
  }

  // ==================== Private Methods ====================

  private RedisDatabaseConnection upgrade(
      final RedisNamespace namespace, final Integer requested, final SchemaUpgrade upgrade) {
    return execute(
        commands -> {
          commands.watch(namespace.getVersionKey(), namespace.getStoresKey());
          final int current = parseVersion(commands.get(namespace.getVersionKey()));
          final int target = requestedOrCurrent(requested, current);
          final Set<String> before = commands.smembers(namespace.getStoresKey());
          if (target <= current) {
            commands.unwatch();
            checkNotDowngrade(namespace, target, current);
            return connect(namespace, current, before);
          }

          final var schema = new StagedSchema(before);
          try {
            upgrade.upgrade(schema, current, target);
          } catch (final RuntimeException e) {
            commands.unwatch();
            throw e;
          }

          commands.multi();
          commands.set(namespace.getVersionKey(), Integer.toString(target));
          for (final var dropped : schema.dropped) {
            commands.del(namespace.storeKey(dropped));
          }
          final var removed = new HashSet<>(before);
          removed.removeAll(schema.stores);
          if (!removed.isEmpty()) {
            commands.srem(namespace.getStoresKey(), removed.toArray(String[]::new));
          }
          final var added = new HashSet<>(schema.stores);
          added.removeAll(before);
          if (!added.isEmpty()) {
            commands.sadd(namespace.getStoresKey(), added.toArray(String[]::new));
          }
          if (commands.exec().wasDiscarded()) {
            throw new BackendException(
                "Concurrent schema change on '" + namespace.getDatabaseName() + "'");
          }
          if (log.isDebugEnabled()) {
            log.debug(
                "Upgraded Redis database '{}' from version {} to {}",
                namespace.getDatabaseName(),
                current,
                target);
          }
          return connect(namespace, target, schema.stores);
        });
  }

  private RedisDatabaseConnection connect(
      final RedisNamespace namespace, final int version, final Set<String> storeNames) {
    return new RedisDatabaseConnection(this, namespace, version, Set.copyOf(storeNames));
  }

  private Set<String> readStoreNames(final RedisNamespace namespace) {
    return execute(commands -> commands.smembers(namespace.getStoresKey()));
  }

  /**
   * Runs a command sequence on the shared connection while holding the command lock.
   *
   * <p>Lettuce failures become {@link BackendException}; backend exceptions pass through.
   */
  private <T> T execute(final Function<RedisCommands<String, String>, T> sequence) {
    commandLock.lock();
    try {
      final var commands = connection().sync();
      try {
        return sequence.apply(commands);
      } catch (final RuntimeException e) {
        discardQuietly(commands);
        throw e;
      }
    } catch (final RedisException e) {
      throw new BackendException("Redis command failed: " + e.getMessage(), e);
    } finally {
      commandLock.unlock();
    }
  }

  private StatefulRedisConnection<String, String> connection() {
    var current = connection;
    if (current != null) {
      return current;
    }
    synchronized (connectLock) {
      if (closed) {
        throw new BackendException("Redis backend adapter '" + name + "' is closed");
      }
      if (connection == null) {
        connection = client.connect();
        log.info("Redis backend adapter '{}' connected", name);
      }
      return connection;
    }
  }

  /** Leaves no MULTI or WATCH state behind on the shared connection after a failed sequence. */
  private static void discardQuietly(final RedisCommands<String, String> commands) {
    try {
      if (commands.getStatefulConnection().isMulti()) {
        commands.discard();
      } else {
        commands.unwatch();
      }
    } catch (final RedisException e) {
      log.warn("Could not reset Redis connection state: {}", e.getMessage());
    }
  }

  private static int requestedOrCurrent(final Integer requested, final int current) {
    return requested != null ? requested : Math.max(current, 1);
  }

  private static int parseVersion(final String stored) {
    if (stored == null) {
      return 0;
    }
    try {
      return Integer.parseInt(stored);
    } catch (final NumberFormatException e) {
      throw new BackendException("Corrupt schema version '" + stored + "'", e);
    }
  }

  private static void checkNotDowngrade(
      final RedisNamespace namespace, final int target, final int current) {
    if (target < current) {
      throw new BackendException(
          String.format(
              "Requested version %d of '%s' is lower than existing version %d",
              target, namespace.getDatabaseName(), current));
    }
  }

  private static void checkVersion(
      final RedisNamespace namespace, final int expected, final int current) {
    if (current == 0) {
      throw new StaleConnectionException(
          Reason.CLOSED, "Database '" + namespace.getDatabaseName() + "' was deleted");
    }
    if (current != expected) {
      throw new StaleConnectionException(
          Reason.VERSION_CHANGED,
          String.format(
              "Database '%s' was upgraded from version %d to %d",
              namespace.getDatabaseName(), expected, current));
    }
  }

  /** Schema editor staging store changes until the upgrade's MULTI/EXEC. */
  private static final class StagedSchema implements SchemaEditor {

    private final Set<String> stores;
    private final Set<String> existing;
    private final Set<String> dropped = new LinkedHashSet<>();

    private StagedSchema(final Set<String> existing) {
      this.existing = Set.copyOf(existing);
      this.stores = new LinkedHashSet<>(existing);
    }

    @Override
    public boolean containsStore(final String storeName) {
      return stores.contains(storeName);
    }

    @Override
    public Set<String> storeNames() {
      return Set.copyOf(stores);
    }

    @Override
    public void createStore(final String storeName) {
      stores.add(storeName);
    }

    @Override
    public void deleteStore(final String storeName) {
      if (stores.remove(storeName) && existing.contains(storeName)) {
        dropped.add(storeName);
      }
    }
  }
}
