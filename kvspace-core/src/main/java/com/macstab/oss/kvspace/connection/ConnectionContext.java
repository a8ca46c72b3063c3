/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.connection;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import com.macstab.oss.kvspace.KvSpaceConfig;
import com.macstab.oss.kvspace.backend.BackendAdapter;
import com.macstab.oss.kvspace.backend.BackendConnection;
import com.macstab.oss.kvspace.backend.SchemaUpgrade;
import com.macstab.oss.kvspace.coalesce.WriteCoalescer;
import com.macstab.oss.kvspace.error.KvSpaceException;
import com.macstab.oss.kvspace.metrics.KvSpaceMetrics;
import com.macstab.oss.kvspace.transaction.AdmissionController;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Shared coordination state for one physical database identity.
 *
 * <p><strong>What it owns:</strong> the live {@link BackendConnection}, the registered {@link
 * StoreBinding}s of every handle pointing at the database, the {@link ReadinessQueue}, and the
 * per-database {@link AdmissionController} and {@link WriteCoalescer}.
 *
 * <p><strong>Schema steps (serialized):</strong> upgrades, reconnects and drops run as <em>schema
 * steps</em>. A step pushes a readiness gate, waits until the previous step has finished, runs on
 * the worker executor, then resolves its own gate (or rejects all gates on failure). A failed step
 * never lets later steps overlap. Operations call {@link #connectionFor(StoreBinding)}, which
 * first waits for the readiness chain, so nothing runs against a connection that a pending step is
 * about to replace.
 *
 * <p><strong>Version resolution:</strong>
 *
 * <ul>
 *   <li>Store missing from the schema: requested version becomes {@code max(requested, onDisk +
 *       1)} and the store is created in the upgrade.
 *   <li>Requested version above on-disk: upgrade.
 *   <li>Requested version below on-disk: not an error. A warning is logged (unless the request was
 *       the default version) and the binding is pinned to the on-disk version.
 * </ul>
 *
 * <p><strong>Locking:</strong> one {@link ReentrantLock} guards the connection field, the state,
 * and the admission and coalescing counters and queues. It is never held across a backend call or
 * while waiting on a future.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class ConnectionContext {

  @Getter private final DatabaseIdentity identity;
  @Getter private final BackendAdapter adapter;
  @Getter private final Executor executor;
  @Getter private final ScheduledExecutorService scheduler;
  @Getter private final KvSpaceMetrics metrics;
  @Getter private final ReentrantLock lock = new ReentrantLock();
  @Getter private final ReadinessQueue readiness = new ReadinessQueue();
  @Getter private final AdmissionController admission;
  @Getter private final WriteCoalescer coalescer;

  private final List<StoreBinding> bindings = new CopyOnWriteArrayList<>();

  // guarded by lock
  private BackendConnection connection;
  private ConnectionState state = ConnectionState.CLOSED;
  private CompletableFuture<BackendConnection> pendingOpen;
  private CompletableFuture<BackendConnection> pendingReconnect;

  public ConnectionContext(
      @NonNull final DatabaseIdentity identity,
      @NonNull final BackendAdapter adapter,
      @NonNull final Executor executor,
      @NonNull final ScheduledExecutorService scheduler,
      @NonNull final KvSpaceMetrics metrics) {
    this.identity = identity;
    this.adapter = adapter;
    this.executor = executor;
    this.scheduler = scheduler;
    this.metrics = metrics;
    this.admission = new AdmissionController(this);
    this.coalescer = new WriteCoalescer(this);
  }

  /**
   * Registers a binding and brings it to a usable, correctly versioned connection.
   *
   * <p>Opens the database if needed, upgrades when the binding's store is missing or its version
   * is ahead of the on-disk version, then propagates the connection and effective version to every
   * co-resident binding.
   *
   * @param binding binding to initialize (must not be null)
   * @return future completing when the binding holds a live connection
   */
  public CompletableFuture<Void> initialize(@NonNull final StoreBinding binding) {
    if (!bindings.contains(binding)) {
      bindings.add(binding);
    }

    return connectionFor(binding)
        .thenComposeAsync(
            current ->
                isUpgradeNeeded(binding, current)
                    ? open(binding, true)
                    : CompletableFuture.completedFuture(current),
            executor)
        .thenAccept(
            current -> {
              lock.lock();
              try {
                // a later schema step may already have installed a newer connection
                final var latest = connection != null && connection.isOpen() ? connection : current;
                binding.setConnection(latest);
                binding.setVersion(latest.getVersion());
              } finally {
                lock.unlock();
              }
              if (log.isDebugEnabled()) {
                log.debug("Initialized {} on {}", binding, identity);
              }
            });
  }

  /**
   * Waits for readiness, then returns the binding's live connection, opening one if needed.
   *
   * @param binding registered binding
   * @return live connection
   */
  public CompletableFuture<BackendConnection> connectionFor(@NonNull final StoreBinding binding) {
    return readiness.whenReady().thenComposeAsync(ready -> open(binding, false), executor);
  }

  /**
   * Opens (or reuses) the shared connection.
   *
   * <p>Without {@code upgradeRequested} a live cached connection is returned as-is and concurrent
   * opens are de-duplicated. With {@code upgradeRequested} a schema step re-checks the version
   * against the current connection and, if still needed, closes it and reopens at the binding's
   * version; every operation submitted meanwhile waits for the step's gate.
   *
   * @param binding binding whose store and version drive the open
   * @param upgradeRequested whether a schema change is requested
   * @return live connection
   */
  public CompletableFuture<BackendConnection> open(
      @NonNull final StoreBinding binding, final boolean upgradeRequested) {
    if (upgradeRequested) {
      return schemaStep(() -> reopen(binding, false));
    }

    lock.lock();
    try {
      final var cached = binding.getConnection();
      if (cached != null && cached.isOpen()) {
        return CompletableFuture.completedFuture(cached);
      }
      if (connection != null && connection.isOpen()) {
        binding.setConnection(connection);
        return CompletableFuture.completedFuture(connection);
      }
      if (pendingOpen == null) {
        state = ConnectionState.OPENING;
        final var opening = schemaStep(() -> reopen(binding, false));
        pendingOpen = opening;
        opening.whenComplete((ignored, error) -> clearPendingOpen(opening));
      }
      return pendingOpen;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Closes every co-resident handle and reopens from scratch after a stale-connection error.
   *
   * <p>Concurrent reconnect requests share one attempt. The caller retries its transaction once
   * the returned future completes.
   *
   * @param binding binding that observed the stale connection
   * @return fresh connection
   */
  public CompletableFuture<BackendConnection> reconnect(@NonNull final StoreBinding binding) {
    lock.lock();
    try {
      if (pendingReconnect != null) {
        return pendingReconnect;
      }
      final var reconnecting =
          schemaStep(
              () -> {
                if (log.isInfoEnabled()) {
                  log.info("Reconnecting {} after stale connection ({})", identity, binding);
                }
                metrics.recordReconnect(identity.toString());
                return reopen(binding, true);
              });
      pendingReconnect = reconnecting;
      reconnecting.whenComplete((ignored, error) -> clearPendingReconnect(reconnecting));
      return reconnecting;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Deletes one store through a version bump. No-op if the store does not exist. Handles of the
   * store are detached, so their next operation recreates it empty.
   *
   * @param storeName store to delete
   * @return future completing once the new schema is installed
   */
  public CompletableFuture<Void> dropStore(@NonNull final String storeName) {
    return schemaStep(
            () -> {
              var current = currentConnection();
              if (current == null || !current.isOpen()) {
                current = adapter.open(identity.physicalName(), null, SchemaUpgrade.NONE);
              }
              if (!current.containsStore(storeName)) {
                install(current);
                return current;
              }

              final int nextVersion = current.getVersion() + 1;
              detachBindings(storeName);
              detachConnection(ConnectionState.UPGRADING);
              current.close();

              final var upgraded =
                  adapter.open(
                      identity.physicalName(),
                      nextVersion,
                      (editor, oldVersion, newVersion) -> editor.deleteStore(storeName));
              install(upgraded);
              if (log.isInfoEnabled()) {
                log.info(
                    "Dropped store '{}' from {} (version {})", storeName, identity, nextVersion);
              }
              return upgraded;
            })
        .thenApply(ignored -> null);
  }

  /**
   * Deletes the whole database. Every binding is detached; owners must acquire a new context.
   *
   * @return future completing once the database is deleted
   */
  public CompletableFuture<Void> dropDatabase() {
    return schemaStep(
            () -> {
              final BackendConnection current;
              lock.lock();
              try {
                current = connection;
                connection = null;
                state = ConnectionState.CLOSED;
                for (final var binding : bindings) {
                  binding.detach();
                }
                bindings.clear();
              } finally {
                lock.unlock();
              }

              if (current != null) {
                current.close();
              }
              adapter.deleteDatabase(identity.physicalName());
              if (log.isInfoEnabled()) {
                log.info("Dropped database {}", identity);
              }
              return current;
            })
        .thenApply(ignored -> null);
  }

  /**
   * Clears the shared connection and every binding's cached handle.
   *
   * @param newState state to enter
   * @return the previous connection (caller closes it outside the lock), may be null
   */
  public BackendConnection detachConnection(@NonNull final ConnectionState newState) {
    lock.lock();
    try {
      final var previous = connection;
      connection = null;
      state = newState;
      for (final var binding : bindings) {
        binding.setConnection(null);
      }
      return previous;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Whether schema work or buffered writes are outstanding.
   *
   * <p>Used by the idle timer to defer closing.
   */
  public boolean hasPendingWork() {
    lock.lock();
    try {
      return pendingOpen != null
          || pendingReconnect != null
          || readiness.hasPending()
          || coalescer.hasPendingWrites();
    } finally {
      lock.unlock();
    }
  }

  public ConnectionState getState() {
    lock.lock();
    try {
      return state;
    } finally {
      lock.unlock();
    }
  }

  /** Snapshot of registered bindings in registration order. */
  public List<StoreBinding> getBindings() {
    return List.copyOf(bindings);
  }

  /**
   * Removes a binding (its handle was destroyed).
   *
   * @param binding binding to remove
   */
  public void unregister(final StoreBinding binding) {
    bindings.remove(binding);
  }

  /** Closes the connection and cancels timers. Used when the owning runtime shuts down. */
  public void close() {
    coalescer.cancelScheduledFlush();
    admission.cancelIdleClose();
    final var previous = detachConnection(ConnectionState.CLOSED);
    if (previous != null) {
      previous.close();
    }
  }

  @Override
  public String toString() {
    return "ConnectionContext[" + identity + ", " + getState() + "]";
  }

  // ==================== Private Methods ====================

  /**
   * Runs a schema step after every earlier step has finished, holding a gate of its own.
   *
   * <p>On success the step's own gate resolves; on failure every queued gate is rejected and the
   * state becomes {@link ConnectionState#FAILED}. Either way the next step's turn starts only once
   * this one has finished.
   */
  private CompletableFuture<BackendConnection> schemaStep(
      final Supplier<BackendConnection> step) {
    final var turn = readiness.enter();

    return turn.getPrevious()
        .thenApplyAsync(ignored -> step.get(), executor)
        .whenComplete(
            (result, error) -> {
              try {
                if (error == null) {
                  readiness.resolve(turn.getGate());
                  return;
                }
                final var cause = KvSpaceException.unwrap(error);
                lock.lock();
                try {
                  state = ConnectionState.FAILED;
                } finally {
                  lock.unlock();
                }
                log.warn("Schema step on {} failed: {}", identity, cause.toString());
                readiness.rejectAll(cause);
              } finally {
                turn.getDone().complete(null);
              }
            });
  }

  /**
   * Opens (optionally from scratch) and upgrades if the binding needs it. Runs inside a schema
   * step on a worker thread.
   */
  private BackendConnection reopen(final StoreBinding binding, final boolean forceClose) {
    var current = forceClose ? detachConnection(ConnectionState.OPENING) : currentConnection();
    if (forceClose && current != null) {
      current.close();
      current = null;
    }

    if (current == null || !current.isOpen()) {
      current = adapter.open(identity.physicalName(), null, SchemaUpgrade.NONE);
    }

    if (isUpgradeNeeded(binding, current)) {
      final int targetVersion = binding.getVersion();
      final int fromVersion = current.getVersion();
      detachConnection(ConnectionState.UPGRADING);
      current.close();

      final var storeName = binding.getStoreName();
      current =
          adapter.open(
              identity.physicalName(),
              targetVersion,
              (editor, oldVersion, newVersion) -> editor.createStore(storeName));
      if (log.isInfoEnabled()) {
        log.info(
            "Upgraded {} from version {} to {} for store '{}'",
            identity,
            fromVersion,
            current.getVersion(),
            storeName);
      }
    }

    install(current);
    return current;
  }

  /**
   * Decides whether {@code binding} needs a schema upgrade on {@code current}, adjusting the
   * binding's requested version (downgrade pin, new-store bump) as a side effect.
   */
  private boolean isUpgradeNeeded(final StoreBinding binding, final BackendConnection current) {
    if (current == null) {
      return true;
    }

    final boolean newStore = !current.containsStore(binding.getStoreName());
    final int onDisk = current.getVersion();
    final int requested = binding.getVersion();

    if (requested < onDisk) {
      if (requested != KvSpaceConfig.DEFAULT_VERSION) {
        log.warn(
            "Database {} cannot be downgraded from version {} to {}; using version {}",
            identity,
            onDisk,
            requested,
            onDisk);
      }
      binding.setVersion(onDisk);
    }

    if (newStore) {
      binding.setVersion(Math.max(binding.getVersion(), onDisk + 1));
      return true;
    }
    return binding.getVersion() > onDisk;
  }

  /** Installs a connection and propagates it with its version to every binding. */
  private void install(final BackendConnection current) {
    lock.lock();
    try {
      connection = current;
      state = ConnectionState.OPEN;
      for (final var binding : bindings) {
        binding.setConnection(current);
        binding.setVersion(current.getVersion());
      }
    } finally {
      lock.unlock();
    }
  }

  /** Detaches the handles of a dropped store; their next operation recreates it. */
  private void detachBindings(final String storeName) {
    lock.lock();
    try {
      for (final var binding : bindings) {
        if (binding.getStoreName().equals(storeName)) {
          binding.detach();
          bindings.remove(binding);
        }
      }
    } finally {
      lock.unlock();
    }
  }

  private BackendConnection currentConnection() {
    lock.lock();
    try {
      return connection;
    } finally {
      lock.unlock();
    }
  }

  private void clearPendingOpen(final CompletableFuture<BackendConnection> opening) {
    lock.lock();
    try {
      if (pendingOpen == opening) {
        pendingOpen = null;
      }
    } finally {
      lock.unlock();
    }
  }

  private void clearPendingReconnect(final CompletableFuture<BackendConnection> reconnecting) {
    lock.lock();
    try {
      if (pendingReconnect == reconnecting) {
        pendingReconnect = null;
      }
    } finally {
      lock.unlock();
    }
  }
}
