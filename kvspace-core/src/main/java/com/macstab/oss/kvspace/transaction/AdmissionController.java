/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.transaction;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Function;

import com.macstab.oss.kvspace.backend.BackendCapability;
import com.macstab.oss.kvspace.backend.BackendConnection;
import com.macstab.oss.kvspace.backend.DurabilityHint;
import com.macstab.oss.kvspace.backend.QuotaExceededException;
import com.macstab.oss.kvspace.backend.StaleConnectionException;
import com.macstab.oss.kvspace.backend.TransactionMode;
import com.macstab.oss.kvspace.connection.ConnectionContext;
import com.macstab.oss.kvspace.connection.ConnectionState;
import com.macstab.oss.kvspace.connection.StoreBinding;
import com.macstab.oss.kvspace.error.ErrorCode;
import com.macstab.oss.kvspace.error.ErrorDetails;
import com.macstab.oss.kvspace.error.KvSpaceException;
import com.macstab.oss.kvspace.internal.Futures;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounds concurrently open transactions per connection context and closes idle connections.
 *
 * <p><strong>Admission:</strong> a transaction starts immediately while fewer than {@code
 * maxConcurrentTransactions} are active (or no maximum is configured); otherwise its start is
 * queued FIFO. When a transaction ends (commit, abort or internal error) its slot is handed to the
 * oldest queued start, or the active count drops.
 *
 * <pre>
 *  execute ──▶ admit ──▶ connectionFor ──▶ begin/work/commit ──▶ release
 *                │                              │ stale
 *                └─ queued (FIFO)               └─▶ reconnect ──▶ retry (transactionRetries)
 * </pre>
 *
 * <p><strong>Idle close:</strong> when the last transaction ends and {@code idleCloseAfter} is
 * configured, a timer is scheduled. New admissions cancel it. A timer that fires while
 * transactions, buffered writes or schema steps are outstanding reschedules itself instead of
 * closing. Otherwise the connection is closed and every co-resident binding's cached handle is
 * marked stale, so the next operation opens again.
 *
 * <p><strong>Failures:</strong> stale connections are retried after a reconnect, then surface as
 * {@code DRIVER_UNAVAILABLE}. Backend quota errors surface as {@code QUOTA_EXCEEDED}, everything
 * else not already structured as {@code OPERATION_FAILED}.
 *
 * <p><strong>Thread Safety:</strong> counters, queue and timer are guarded by the context lock.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class AdmissionController {

  private final ConnectionContext context;

  // guarded by context lock
  private final Deque<CompletableFuture<Void>> pending = new ArrayDeque<>();
  private int active;
  private ScheduledFuture<?> idleTask;
  private long idleGeneration;

  public AdmissionController(@NonNull final ConnectionContext context) {
    this.context = context;
  }

  /**
   * Runs {@code work} inside one admitted transaction.
   *
   * @param binding store binding to run against
   * @param mode transaction mode
   * @param operation operation name for error details
   * @param work transaction body
   * @return future with the work's result, failing with a {@link KvSpaceException}
   */
  public <T> CompletableFuture<T> execute(
      @NonNull final StoreBinding binding,
      @NonNull final TransactionMode mode,
      @NonNull final String operation,
      @NonNull final TransactionWork<T> work) {
    final long startNanos = System.nanoTime();

    final CompletableFuture<T> result =
        admit()
            .thenComposeAsync(
                admitted -> attempt(binding, mode, operation, work, 0), context.getExecutor())
            .whenComplete(
                (value, error) -> {
                  release(binding);
                  context
                      .getMetrics()
                      .recordTransaction(
                          context.getIdentity().toString(),
                          mode == TransactionMode.READ_WRITE,
                          Duration.ofNanos(System.nanoTime() - startNanos),
                          error == null);
                });

    return Futures.mapFailure(result, error -> translate(error, binding, mode, operation));
  }

  public int getActiveCount() {
    context.getLock().lock();
    try {
      return active;
    } finally {
      context.getLock().unlock();
    }
  }

  public int getPendingCount() {
    context.getLock().lock();
    try {
      return pending.size();
    } finally {
      context.getLock().unlock();
    }
  }

  /** Whether an idle-close timer is currently scheduled. */
  public boolean isIdleCloseScheduled() {
    context.getLock().lock();
    try {
      return idleTask != null;
    } finally {
      context.getLock().unlock();
    }
  }

  /** Cancels a scheduled idle close. */
  public void cancelIdleClose() {
    context.getLock().lock();
    try {
      cancelIdle();
    } finally {
      context.getLock().unlock();
    }
  }

  // ==================== Private Methods ====================

  private CompletableFuture<Void> admit() {
    context.getLock().lock();
    try {
      cancelIdle();
      final var max = maxConcurrent();
      if (max == null || active < max) {
        active++;
        publishGauges();
        return Futures.done();
      }
      final var slot = new CompletableFuture<Void>();
      pending.addLast(slot);
      publishGauges();
      if (log.isDebugEnabled()) {
        log.debug(
            "Queued transaction on {} ({} active, {} pending)",
            context.getIdentity(),
            active,
            pending.size());
      }
      return slot;
    } finally {
      context.getLock().unlock();
    }
  }

  private void release(final StoreBinding binding) {
    final CompletableFuture<Void> next;
    context.getLock().lock();
    try {
      next = pending.pollFirst();
      if (next == null) {
        active--;
        if (active == 0) {
          scheduleIdle(binding.getConfig().getIdleCloseAfter());
        }
      }
      publishGauges();
    } finally {
      context.getLock().unlock();
    }

    if (next != null) {
      next.complete(null);
    }
  }

  private <T> CompletableFuture<T> attempt(
      final StoreBinding binding,
      final TransactionMode mode,
      final String operation,
      final TransactionWork<T> work,
      final int attempt) {
    return context
        .connectionFor(binding)
        .thenApplyAsync(
            connection -> runOnce(connection, binding, mode, work), context.getExecutor())
        .handle(
            (value, error) -> {
              if (error == null) {
                return CompletableFuture.completedFuture(value);
              }
              final var cause = KvSpaceException.unwrap(error);
              if (!(cause instanceof StaleConnectionException stale)) {
                return CompletableFuture.<T>failedFuture(cause);
              }
              if (attempt >= binding.getConfig().getTransactionRetries()) {
                return CompletableFuture.<T>failedFuture(
                    KvSpaceException.wrap(
                        stale,
                        ErrorCode.DRIVER_UNAVAILABLE,
                        "Connection to " + context.getIdentity() + " is unavailable",
                        details(binding, mode, operation)));
              }
              if (log.isDebugEnabled()) {
                log.debug(
                    "Stale connection on {} during {} ({}), reconnecting",
                    context.getIdentity(),
                    operation,
                    stale.getReason());
              }
              return retryAfterReconnect(binding, mode, operation, work, attempt);
            })
        .thenCompose(Function.identity());
  }

  private <T> CompletableFuture<T> retryAfterReconnect(
      final StoreBinding binding,
      final TransactionMode mode,
      final String operation,
      final TransactionWork<T> work,
      final int attempt) {
    final var reconnected =
        Futures.mapFailure(
            context.reconnect(binding),
            error ->
                KvSpaceException.wrap(
                    error,
                    ErrorCode.DRIVER_UNAVAILABLE,
                    "Reconnect to " + context.getIdentity() + " failed",
                    details(binding, mode, operation)));
    return reconnected.thenComposeAsync(
        connection -> attempt(binding, mode, operation, work, attempt + 1), context.getExecutor());
  }

  private <T> T runOnce(
      final BackendConnection connection,
      final StoreBinding binding,
      final TransactionMode mode,
      final TransactionWork<T> work) {
    final var hint =
        context.getAdapter().supports(BackendCapability.DURABILITY_HINT)
            ? binding.getConfig().getDurabilityHint()
            : DurabilityHint.DEFAULT;
    final var transaction = connection.begin(binding.getStoreName(), mode, hint);
    try {
      final var value = work.apply(transaction);
      transaction.commit();
      return value;
    } catch (final Exception e) {
      try {
        transaction.abort();
      } catch (final RuntimeException abortError) {
        e.addSuppressed(abortError);
      }
      throw Futures.sneaky(e);
    }
  }

  private KvSpaceException translate(
      final Throwable error,
      final StoreBinding binding,
      final TransactionMode mode,
      final String operation) {
    final var details = details(binding, mode, operation);
    if (error instanceof QuotaExceededException) {
      return KvSpaceException.wrap(
          error, ErrorCode.QUOTA_EXCEEDED, "Storage quota exceeded during " + operation, details);
    }
    if (error instanceof StaleConnectionException) {
      return KvSpaceException.wrap(
          error,
          ErrorCode.DRIVER_UNAVAILABLE,
          "Connection to " + context.getIdentity() + " is unavailable",
          details);
    }
    return KvSpaceException.wrap(
        error, ErrorCode.OPERATION_FAILED, operation + " failed: " + error.getMessage(), details);
  }

  private Map<String, Object> details(
      final StoreBinding binding, final TransactionMode mode, final String operation) {
    final var identity = context.getIdentity();
    return ErrorDetails.of(
        ErrorDetails.OPERATION, operation,
        ErrorDetails.DRIVER, identity.getDriver(),
        ErrorDetails.DB_NAME, identity.getName(),
        ErrorDetails.STORE_NAME, binding.getStoreName(),
        ErrorDetails.TRANSACTION_MODE, mode.name());
  }

  private Integer maxConcurrent() {
    // the most restrictive limit of any co-resident handle applies
    Integer max = null;
    for (final var binding : context.getBindings()) {
      final var limit = binding.getConfig().getMaxConcurrentTransactions();
      if (limit != null && (max == null || limit < max)) {
        max = limit;
      }
    }
    return max;
  }

  private void scheduleIdle(final Duration delay) {
    cancelIdle();
    if (delay == null) {
      return;
    }
    final long generation = idleGeneration;
    try {
      idleTask =
          context
              .getScheduler()
              .schedule(() -> onIdle(generation, delay), delay.toMillis(), MILLISECONDS);
    } catch (final RejectedExecutionException e) {
      if (log.isDebugEnabled()) {
        log.debug("Idle close for {} not scheduled: scheduler shut down", context.getIdentity());
      }
    }
  }

  private void cancelIdle() {
    idleGeneration++;
    if (idleTask != null) {
      idleTask.cancel(false);
      idleTask = null;
    }
  }

  private void onIdle(final long generation, final Duration delay) {
    final BackendConnection closing;
    context.getLock().lock();
    try {
      if (generation != idleGeneration) {
        return;
      }
      idleTask = null;
      if (active > 0 || !pending.isEmpty() || context.hasPendingWork()) {
        scheduleIdle(delay);
        return;
      }
      closing = context.detachConnection(ConnectionState.CLOSED);
    } finally {
      context.getLock().unlock();
    }

    if (closing != null) {
      if (log.isInfoEnabled()) {
        log.info("Closing idle connection to {} after {}", context.getIdentity(), delay);
      }
      context.getMetrics().recordIdleClose(context.getIdentity().toString());
      closing.close();
    }
  }

  private void publishGauges() {
    final var database = context.getIdentity().toString();
    context.getMetrics().setActiveTransactions(database, active);
    context.getMetrics().setPendingTransactions(database, pending.size());
  }
}
