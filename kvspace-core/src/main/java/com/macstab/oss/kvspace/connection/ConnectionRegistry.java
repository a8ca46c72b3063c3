/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.connection;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;

import com.macstab.oss.kvspace.backend.BackendAdapter;
import com.macstab.oss.kvspace.metrics.KvSpaceMetrics;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Table of {@link ConnectionContext}s keyed by {@link DatabaseIdentity}.
 *
 * <p>Contexts are created lazily by {@link #acquire} and removed only by {@link #dropDatabase}
 * (the database no longer exists) or {@link #closeAll()} (runtime shutdown).
 *
 * <p><strong>Thread Safety:</strong> {@link ConcurrentHashMap#computeIfAbsent} guarantees one
 * context per identity under concurrent acquisition.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class ConnectionRegistry {

  private final ConcurrentMap<DatabaseIdentity, ConnectionContext> contexts =
      new ConcurrentHashMap<>();
  private final Executor executor;
  private final ScheduledExecutorService scheduler;
  private final KvSpaceMetrics metrics;

  public ConnectionRegistry(
      @NonNull final Executor executor,
      @NonNull final ScheduledExecutorService scheduler,
      @NonNull final KvSpaceMetrics metrics) {
    this.executor = executor;
    this.scheduler = scheduler;
    this.metrics = metrics;
  }

  /**
   * Returns the context for {@code identity}, creating it on first use. Never fails.
   *
   * @param identity database identity
   * @param adapter backend used if the context is created
   * @return shared context
   */
  public ConnectionContext acquire(
      @NonNull final DatabaseIdentity identity, @NonNull final BackendAdapter adapter) {
    return contexts.computeIfAbsent(
        identity,
        key -> {
          if (log.isInfoEnabled()) {
            log.info("Created connection context for {}", key);
          }
          return new ConnectionContext(key, adapter, executor, scheduler, metrics);
        });
  }

  public Optional<ConnectionContext> find(final DatabaseIdentity identity) {
    return Optional.ofNullable(contexts.get(identity));
  }

  /**
   * Deletes a database and forgets its context.
   *
   * @param identity database identity
   * @param adapter backend owning the database
   * @return future completing once the database is deleted
   */
  public CompletableFuture<Void> dropDatabase(
      @NonNull final DatabaseIdentity identity, @NonNull final BackendAdapter adapter) {
    final var context = acquire(identity, adapter);
    return context
        .dropDatabase()
        .thenRun(
            () -> {
              contexts.remove(identity, context);
              metrics.close(identity.toString());
            });
  }

  public int size() {
    return contexts.size();
  }

  /** Closes every context. Errors are logged per context so one failure does not stop the rest. */
  public void closeAll() {
    for (final var context : contexts.values()) {
      try {
        context.close();
        metrics.close(context.getIdentity().toString());
      } catch (final RuntimeException e) {
        log.error("Error closing connection context {}", context.getIdentity(), e);
      }
    }
    contexts.clear();
  }
}
