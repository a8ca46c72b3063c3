/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.coalesce;

import java.util.concurrent.CompletableFuture;

import com.macstab.oss.kvspace.backend.BackendTransaction;
import com.macstab.oss.kvspace.connection.StoreBinding;

import lombok.Getter;
import lombok.NonNull;

/**
 * Write buffered by the {@link WriteCoalescer}: either {@link SetItem} or {@link RemoveItem}.
 *
 * <p>Each write carries its own completion. Once flushed it resolves or rejects exactly once; the
 * return values of {@link #resolve()} and {@link #reject(Throwable)} report whether this call was
 * the one that settled it.
 */
@Getter
public abstract class QueuedWrite {

  private final StoreBinding binding;
  private final String key;
  private final CompletableFuture<Void> completion = new CompletableFuture<>();

  private QueuedWrite(@NonNull final StoreBinding binding, @NonNull final String key) {
    this.binding = binding;
    this.key = key;
  }

  public static QueuedWrite set(final StoreBinding binding, final String key, final Object value) {
    return new SetItem(binding, key, value);
  }

  public static QueuedWrite remove(final StoreBinding binding, final String key) {
    return new RemoveItem(binding, key);
  }

  /** Applies this write to an open read-write transaction. */
  abstract void apply(BackendTransaction transaction);

  boolean resolve() {
    return completion.complete(null);
  }

  boolean reject(final Throwable error) {
    return completion.completeExceptionally(error);
  }

  /** Buffered {@code set(key, value)}. */
  @Getter
  public static final class SetItem extends QueuedWrite {

    private final Object value;

    private SetItem(final StoreBinding binding, final String key, final Object value) {
      super(binding, key);
      this.value = value;
    }

    @Override
    void apply(final BackendTransaction transaction) {
      transaction.put(getKey(), value);
    }
  }

  /** Buffered {@code remove(key)}. */
  public static final class RemoveItem extends QueuedWrite {

    private RemoveItem(final StoreBinding binding, final String key) {
      super(binding, key);
    }

    @Override
    void apply(final BackendTransaction transaction) {
      transaction.delete(getKey());
    }
  }
}
