/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import com.macstab.oss.kvspace.backend.TransactionMode;
import com.macstab.oss.kvspace.coalesce.QueuedWrite;
import com.macstab.oss.kvspace.connection.ConnectionContext;
import com.macstab.oss.kvspace.connection.StoreBinding;
import com.macstab.oss.kvspace.error.ErrorCode;
import com.macstab.oss.kvspace.error.ErrorDetails;
import com.macstab.oss.kvspace.error.KvSpaceException;
import com.macstab.oss.kvspace.internal.Futures;
import com.macstab.oss.kvspace.transaction.DefaultTransactionScope;
import com.macstab.oss.kvspace.transaction.TransactionScope;
import com.macstab.oss.kvspace.transaction.TransactionWork;

import lombok.Getter;

/**
 * Plugin-free store operations of one initialized handle.
 *
 * <p>Reads drain the context's coalesced writes first under {@link ReadConsistency#STRONG}.
 * Single-item writes go through the coalescer when {@code coalesceWrites} is on; every other
 * write drains it first so it cannot overtake a buffered write of the same handle.
 */
@Getter
final class StoreOperations {

  private final String driverName;
  private final ConnectionContext context;
  private final StoreBinding binding;

  StoreOperations(
      final String driverName, final ConnectionContext context, final StoreBinding binding) {
    this.driverName = driverName;
    this.context = context;
    this.binding = binding;
  }

  KvSpaceConfig getConfig() {
    return binding.getConfig();
  }

  CompletableFuture<Object> get(final String key) {
    return read("getItem", key, transaction -> transaction.get(key));
  }

  CompletableFuture<Void> set(final String key, final Object value) {
    if (getConfig().isCoalesceWrites()) {
      return withKey(context.getCoalescer().enqueue(QueuedWrite.set(binding, key, value)), key);
    }
    return write(
        "setItem",
        key,
        transaction -> {
          transaction.put(key, value);
          return null;
        });
  }

  CompletableFuture<Void> remove(final String key) {
    if (getConfig().isCoalesceWrites()) {
      return withKey(context.getCoalescer().enqueue(QueuedWrite.remove(binding, key)), key);
    }
    return write(
        "removeItem",
        key,
        transaction -> {
          transaction.delete(key);
          return null;
        });
  }

  /** Writes every entry in one transaction. */
  CompletableFuture<Void> setAll(final List<BatchEntry> entries) {
    return write(
        "setItems",
        null,
        transaction -> {
          for (final var entry : entries) {
            transaction.put(entry.getKey(), entry.getValue());
          }
          return null;
        });
  }

  /** Reads every key in one transaction, preserving order and duplicates. */
  CompletableFuture<List<BatchEntry>> getAll(final List<String> keys) {
    return read(
        "getItems",
        null,
        transaction -> {
          final var entries = new ArrayList<BatchEntry>(keys.size());
          for (final var key : keys) {
            entries.add(BatchEntry.of(key, transaction.get(key)));
          }
          return entries;
        });
  }

  CompletableFuture<Void> removeAll(final List<String> keys) {
    return write(
        "removeItems",
        null,
        transaction -> {
          for (final var key : keys) {
            transaction.delete(key);
          }
          return null;
        });
  }

  CompletableFuture<Void> clear() {
    return write(
        "clear",
        null,
        transaction -> {
          transaction.clear();
          return null;
        });
  }

  CompletableFuture<Integer> length() {
    return read("length", null, transaction -> transaction.count());
  }

  CompletableFuture<List<String>> keys() {
    return read("keys", null, transaction -> transaction.keys());
  }

  CompletableFuture<String> key(final int index) {
    if (index < 0) {
      return CompletableFuture.completedFuture(null);
    }
    return read(
        "key",
        null,
        transaction -> {
          final var keys = transaction.keys();
          return index < keys.size() ? keys.get(index) : null;
        });
  }

  <T> CompletableFuture<T> iterate(final ItemVisitor<T> visitor) {
    return read(
        "iterate", null, transaction -> new DefaultTransactionScope(transaction).iterate(visitor));
  }

  /** Runs {@code body} in one transaction after draining buffered writes. */
  <T> CompletableFuture<T> runTransaction(
      final TransactionMode mode, final Function<TransactionScope, T> body) {
    return drain()
        .thenCompose(
            drained ->
                context
                    .getAdmission()
                    .execute(
                        binding,
                        mode,
                        "runTransaction",
                        transaction -> body.apply(new DefaultTransactionScope(transaction))));
  }

  /** Waits for every buffered and in-flight coalesced write of the context. */
  CompletableFuture<Void> drain() {
    return context.getCoalescer().drain();
  }

  // ==================== Private Methods ====================

  private <T> CompletableFuture<T> read(
      final String operation, final String key, final TransactionWork<T> work) {
    final var before =
        getConfig().getReadConsistency() == ReadConsistency.STRONG ? drain() : Futures.done();
    return withKey(
        before.thenCompose(
            drained ->
                context
                    .getAdmission()
                    .execute(binding, TransactionMode.READ_ONLY, operation, work)),
        key);
  }

  private <T> CompletableFuture<T> write(
      final String operation, final String key, final TransactionWork<T> work) {
    final var before = getConfig().isCoalesceWrites() ? drain() : Futures.done();
    return withKey(
        before.thenCompose(
            drained ->
                context
                    .getAdmission()
                    .execute(binding, TransactionMode.READ_WRITE, operation, work)),
        key);
  }

  private static <T> CompletableFuture<T> withKey(
      final CompletableFuture<T> future, final String key) {
    if (key == null) {
      return future;
    }
    return Futures.mapFailure(
        future,
        error ->
            KvSpaceException.wrap(
                error,
                ErrorCode.OPERATION_FAILED,
                "Operation on key '" + key + "' failed",
                ErrorDetails.of(ErrorDetails.KEY, key)));
  }
}
