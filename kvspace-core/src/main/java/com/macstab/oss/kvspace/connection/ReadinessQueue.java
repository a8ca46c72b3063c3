/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.connection;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * FIFO chain of readiness gates for one connection context, plus the turn order of the schema
 * steps that own them.
 *
 * <p><strong>Model:</strong> each {@link #defer()} pushes a gate and extends the chain so that
 * {@link #whenReady()} completes only after every gate pushed so far has completed. Schema changes
 * push a gate before touching the connection, so any operation that asks for readiness afterwards
 * waits for them.
 *
 * <pre>
 * whenReady():  done ──▶ gate1 ──▶ gate2
 * steps:        done ──▶ turn1 ──▶ turn2     (never fails)
 * </pre>
 *
 * <p><strong>Turns:</strong> {@link #enter()} hands out a {@link Turn} holding the step's own gate
 * and the completion of the previous step. Turns complete normally whatever the step's outcome, so
 * a failed step never lets the steps queued behind it overlap. A step resolves exactly its own gate
 * with {@link #resolve(CompletableFuture)}.
 *
 * <p><strong>Failure:</strong> {@link #rejectAll(Throwable)} rejects every queued gate (so all
 * current waiters fail) and resets the chain to the step order. The next operation does not see the
 * error, but still waits for steps that were queued before the failure.
 *
 * <p><strong>Thread Safety:</strong> all methods are synchronized; gates are completed outside the
 * monitor so dependent stages never run while it is held.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
public final class ReadinessQueue {

  private final Deque<CompletableFuture<Void>> gates = new ArrayDeque<>();
  private CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
  private CompletableFuture<Void> steps = CompletableFuture.completedFuture(null);

  /** Current readiness chain. */
  public synchronized CompletableFuture<Void> whenReady() {
    return chain;
  }

  /**
   * Pushes a new gate at the end of the chain.
   *
   * @return the gate (completed by {@link #resolve(CompletableFuture)} or {@link
   *     #rejectAll(Throwable)})
   */
  public synchronized CompletableFuture<Void> defer() {
    final var gate = new CompletableFuture<Void>();
    gates.addLast(gate);
    chain = chain.thenCompose(ignored -> gate);
    return gate;
  }

  /**
   * Pushes a gate and takes the next schema-step turn.
   *
   * @return turn; its owner runs after {@link Turn#getPrevious()} and must complete {@link
   *     Turn#getDone()} when finished
   */
  public synchronized Turn enter() {
    final var previous = steps;
    final var done = new CompletableFuture<Void>();
    steps = done;
    return new Turn(defer(), previous, done);
  }

  /**
   * Resolves one gate. A gate already rejected by {@link #rejectAll(Throwable)} stays rejected.
   *
   * @return {@code true} if the gate was pending and is now resolved
   */
  public boolean resolve(final CompletableFuture<Void> gate) {
    final boolean pending;
    synchronized (this) {
      pending = gates.remove(gate);
    }
    return pending && gate.complete(null);
  }

  /**
   * Rejects every pending gate with {@code error} and resets the chain to the step order.
   *
   * @return number of gates rejected
   */
  public int rejectAll(final Throwable error) {
    final var rejected = new ArrayList<CompletableFuture<Void>>();
    synchronized (this) {
      rejected.addAll(gates);
      gates.clear();
      chain = steps;
    }
    for (final var gate : rejected) {
      gate.completeExceptionally(error);
    }
    return rejected.size();
  }

  /** Whether a gate is pending or a schema step has not finished. */
  public synchronized boolean hasPending() {
    return !gates.isEmpty() || !steps.isDone();
  }

  public synchronized int pendingCount() {
    return gates.size();
  }

  /** One schema step's place in line. */
  @Getter
  @AllArgsConstructor(access = AccessLevel.PRIVATE)
  public static final class Turn {
    private final CompletableFuture<Void> gate;
    private final CompletableFuture<Void> previous;
    private final CompletableFuture<Void> done;
  }
}
