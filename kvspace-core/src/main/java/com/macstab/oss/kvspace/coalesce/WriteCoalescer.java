/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.coalesce;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

import com.macstab.oss.kvspace.backend.TransactionMode;
import com.macstab.oss.kvspace.connection.ConnectionContext;
import com.macstab.oss.kvspace.connection.StoreBinding;
import com.macstab.oss.kvspace.error.ErrorDetails;
import com.macstab.oss.kvspace.error.KvSpaceException;
import com.macstab.oss.kvspace.internal.Futures;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Buffers rapid writes of one database and applies them in fewer transactions.
 *
 * <p><strong>Flush triggers:</strong> the first write of an empty buffer schedules a flush after
 * {@code coalesceWindow}; reaching {@code coalesceMaxBatchSize} buffered writes flushes at once.
 *
 * <p><strong>Flush:</strong> the buffer is swapped out atomically (writes arriving during a flush
 * start a new buffer), grouped per store in submission order, and each group is cut into chunks of
 * at most {@code coalesceMaxBatchSize}. Every chunk runs in one admitted read-write transaction;
 * its writes resolve on commit or all reject with the transaction's error.
 *
 * <p><strong>Ordering:</strong> within a chunk writes apply in submission order. Chunks run as
 * separate transactions, so for the same key across chunks the last <em>committed</em> chunk wins,
 * not the last submitted write.
 *
 * <p><strong>Consistency:</strong> {@link #drain()} flushes the buffer and waits for every flush in
 * flight; strong reads call it first. Fire-and-forget writes (eventual consistency only) complete
 * to the caller at once and report failures as warning logs.
 *
 * <p><strong>Thread Safety:</strong> buffer, timer, in-flight set and counters are guarded by the
 * context lock; transactions run outside it.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class WriteCoalescer {

  private final ConnectionContext context;

  // guarded by context lock
  private List<QueuedWrite> buffer = new ArrayList<>();
  private final Set<CompletableFuture<Void>> inFlight = new HashSet<>();
  private ScheduledFuture<?> flushTask;
  private long totalWrites;
  private long coalescedWrites;
  private long transactionsSaved;

  public WriteCoalescer(@NonNull final ConnectionContext context) {
    this.context = context;
  }

  /**
   * Buffers a write.
   *
   * @param write queued write
   * @return completion of the write, or an already completed future for fire-and-forget writes
   */
  public CompletableFuture<Void> enqueue(@NonNull final QueuedWrite write) {
    final var config = write.getBinding().getConfig();
    final boolean flushNow;

    context.getLock().lock();
    try {
      buffer.add(write);
      totalWrites++;
      final var maxBatch = config.getCoalesceMaxBatchSize();
      flushNow = maxBatch != null && buffer.size() >= maxBatch;
      if (!flushNow && flushTask == null) {
        scheduleFlush(config.getCoalesceWindow().toMillis());
      }
    } finally {
      context.getLock().unlock();
    }

    if (flushNow) {
      flush();
    }

    if (config.isCoalesceFireAndForget()) {
      write
          .getCompletion()
          .whenComplete(
              (ignored, error) -> {
                if (error != null) {
                  log.warn(
                      "Fire-and-forget write of key '{}' to {} failed: {}",
                      write.getKey(),
                      context.getIdentity(),
                      KvSpaceException.unwrap(error).toString());
                }
              });
      return Futures.done();
    }
    return write.getCompletion();
  }

  /**
   * Applies every buffered write.
   *
   * @return future completing when every chunk of this flush has settled; it never fails, errors
   *     are delivered to the individual writes
   */
  public CompletableFuture<Void> flush() {
    final List<QueuedWrite> batch;
    // registered with the swap, so a drain never misses writes that already left the buffer
    final var flushing = new CompletableFuture<Void>();
    context.getLock().lock();
    try {
      cancelFlushTask();
      if (buffer.isEmpty()) {
        return Futures.done();
      }
      batch = buffer;
      buffer = new ArrayList<>();
      inFlight.add(flushing);
    } finally {
      context.getLock().unlock();
    }

    final var groups = new LinkedHashMap<String, List<QueuedWrite>>();
    for (final var write : batch) {
      groups
          .computeIfAbsent(write.getBinding().getStoreName(), store -> new ArrayList<>())
          .add(write);
    }

    final var chunks = new ArrayList<CompletableFuture<Void>>();
    for (final var group : groups.values()) {
      final var binding = group.get(0).getBinding();
      final var maxBatch = binding.getConfig().getCoalesceMaxBatchSize();
      final int chunkSize = maxBatch != null ? maxBatch : group.size();
      for (int from = 0; from < group.size(); from += chunkSize) {
        final var chunk =
            new ArrayList<>(group.subList(from, Math.min(from + chunkSize, group.size())));
        chunks.add(applyChunk(binding, chunk));
      }
    }

    if (log.isDebugEnabled()) {
      log.debug(
          "Flushing {} buffered writes to {} in {} transactions",
          batch.size(),
          context.getIdentity(),
          chunks.size());
    }

    CompletableFuture.allOf(chunks.toArray(new CompletableFuture<?>[0]))
        .whenComplete(
            (ignored, error) -> {
              removeInFlight(flushing);
              flushing.complete(null);
            });
    return flushing;
  }

  /**
   * Flushes the buffer and waits for every flush in flight.
   *
   * @return future completing once all writes submitted before the call have settled
   */
  public CompletableFuture<Void> drain() {
    final var flushing = flush();
    final List<CompletableFuture<Void>> waiting;
    context.getLock().lock();
    try {
      waiting = new ArrayList<>(inFlight);
    } finally {
      context.getLock().unlock();
    }
    waiting.add(flushing);
    return Futures.settled(CompletableFuture.allOf(waiting.toArray(new CompletableFuture<?>[0])));
  }

  public WriteStatistics getStatistics() {
    context.getLock().lock();
    try {
      return new WriteStatistics(totalWrites, coalescedWrites, transactionsSaved);
    } finally {
      context.getLock().unlock();
    }
  }

  /** Whether writes are buffered or being flushed. */
  public boolean hasPendingWrites() {
    context.getLock().lock();
    try {
      return !buffer.isEmpty() || !inFlight.isEmpty();
    } finally {
      context.getLock().unlock();
    }
  }

  /** Cancels a scheduled window flush; buffered writes stay buffered. */
  public void cancelScheduledFlush() {
    context.getLock().lock();
    try {
      cancelFlushTask();
    } finally {
      context.getLock().unlock();
    }
  }

  // ==================== Private Methods ====================

  private CompletableFuture<Void> applyChunk(
      final StoreBinding binding, final List<QueuedWrite> chunk) {
    CompletableFuture<Object> transaction;
    try {
      transaction =
          context
              .getAdmission()
              .execute(
                  binding,
                  TransactionMode.READ_WRITE,
                  "coalescedWrite",
                  scope -> {
                    for (final var write : chunk) {
                      write.apply(scope);
                    }
                    return null;
                  });
    } catch (final RuntimeException e) {
      transaction = CompletableFuture.failedFuture(e);
    }
    return transaction
        .handle(
            (ignored, error) -> {
              if (error == null) {
                recordCommitted(chunk.size());
                chunk.forEach(QueuedWrite::resolve);
              } else {
                final var cause = KvSpaceException.unwrap(error);
                for (final var write : chunk) {
                  write.reject(withKey(cause, write.getKey()));
                }
              }
              return null;
            });
  }

  private void recordCommitted(final int size) {
    context.getLock().lock();
    try {
      coalescedWrites += size;
      transactionsSaved += size - 1;
    } finally {
      context.getLock().unlock();
    }
    context.getMetrics().recordCoalescedFlush(context.getIdentity().toString(), size);
  }

  private static Throwable withKey(final Throwable error, final String key) {
    if (error instanceof KvSpaceException structured) {
      return structured.withDetails(ErrorDetails.of(ErrorDetails.KEY, key));
    }
    return error;
  }

  private void scheduleFlush(final long delayMillis) {
    try {
      flushTask = context.getScheduler().schedule(this::flush, delayMillis, MILLISECONDS);
    } catch (final RejectedExecutionException e) {
      log.warn("Coalesced flush for {} not scheduled: scheduler shut down", context.getIdentity());
    }
  }

  private void cancelFlushTask() {
    if (flushTask != null) {
      flushTask.cancel(false);
      flushTask = null;
    }
  }

  private void removeInFlight(final CompletableFuture<Void> flushing) {
    context.getLock().lock();
    try {
      inFlight.remove(flushing);
    } finally {
      context.getLock().unlock();
    }
  }
}
