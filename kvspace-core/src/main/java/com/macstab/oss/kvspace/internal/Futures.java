/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.internal;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;

import com.macstab.oss.kvspace.error.KvSpaceException;

import lombok.experimental.UtilityClass;

/** {@link CompletableFuture} helpers shared by the core packages. */
@UtilityClass
public class Futures {

  private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

  /** Already completed {@code Void} future. */
  public static CompletableFuture<Void> done() {
    return DONE;
  }

  /**
   * Runs a task that may throw checked exceptions on {@code executor}.
   *
   * <p>Checked exceptions are carried as the cause of a {@link CompletionException}; unchecked ones
   * complete the future directly.
   */
  public static <T> CompletableFuture<T> callAsync(
      final Callable<T> task, final Executor executor) {
    return CompletableFuture.supplyAsync(
        () -> {
          try {
            return task.call();
          } catch (final RuntimeException e) {
            throw e;
          } catch (final Exception e) {
            throw new CompletionException(e);
          }
        },
        executor);
  }

  /** Completes normally once {@code future} settles, whatever its outcome. */
  public static CompletableFuture<Void> settled(final CompletableFuture<?> future) {
    return future.handle((value, error) -> null);
  }

  /** Maps a failure through {@code mapper}; successful values pass unchanged. */
  public static <T> CompletableFuture<T> mapFailure(
      final CompletableFuture<T> future, final Function<Throwable, Throwable> mapper) {
    return future
        .handle(
            (value, error) ->
                error == null
                    ? CompletableFuture.completedFuture(value)
                    : CompletableFuture.<T>failedFuture(
                        mapper.apply(KvSpaceException.unwrap(error))))
        .thenCompose(Function.identity());
  }

  /** Rethrows {@code error} unchecked, wrapping checked exceptions. */
  public static RuntimeException sneaky(final Throwable error) {
    if (error instanceof RuntimeException runtime) {
      return runtime;
    }
    if (error instanceof Error fatal) {
      throw fatal;
    }
    return new CompletionException(error);
  }
}
