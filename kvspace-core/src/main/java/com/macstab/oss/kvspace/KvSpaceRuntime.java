/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.macstab.oss.kvspace.connection.ConnectionRegistry;
import com.macstab.oss.kvspace.metrics.KvSpaceMetrics;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Process-scoped services shared by {@link KvSpace} handles.
 *
 * <p><strong>What it owns:</strong>
 *
 * <ul>
 *   <li>{@link DriverRegistry}: named backend adapters;
 *   <li>{@link ConnectionRegistry}: one connection context per database identity;
 *   <li>worker executor (cached daemon pool, threads {@code kvspace-worker-N}) running backend
 *       calls and continuations;
 *   <li>scheduler (one daemon thread, {@code kvspace-timer}) for coalescing windows, idle close
 *       and plugin timers.
 * </ul>
 *
 * <p>Handles only share connections when they share a runtime. {@link #shared()} is the default
 * for {@link KvSpace#create(KvSpaceConfig)}; separate runtimes give test isolation.
 *
 * <p><strong>Metrics:</strong> the {@link KvSpaceMetrics} sink is owned by the caller and not
 * closed by {@link #close()}.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
@Getter
public final class KvSpaceRuntime implements AutoCloseable {

  private static final Object SHARED_LOCK = new Object();
  private static KvSpaceRuntime shared;

  private final DriverRegistry drivers;
  private final ConnectionRegistry connections;
  private final ExecutorService executor;
  private final ScheduledExecutorService scheduler;
  private final KvSpaceMetrics metrics;

  private volatile boolean closed;

  private KvSpaceRuntime(final KvSpaceMetrics metrics) {
    this.metrics = metrics;
    this.drivers = new DriverRegistry();
    this.executor =
        Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setNameFormat("kvspace-worker-%d").setDaemon(true).build());
    this.scheduler =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("kvspace-timer").setDaemon(true).build());
    this.connections = new ConnectionRegistry(executor, scheduler, metrics);
  }

  /** Runtime without metrics. */
  public static KvSpaceRuntime create() {
    return create(KvSpaceMetrics.NOOP);
  }

  public static KvSpaceRuntime create(@NonNull final KvSpaceMetrics metrics) {
    return new KvSpaceRuntime(metrics);
  }

  /** Process-wide runtime, created on first use and re-created if it was closed. */
  public static KvSpaceRuntime shared() {
    synchronized (SHARED_LOCK) {
      if (shared == null || shared.isClosed()) {
        shared = new KvSpaceRuntime(KvSpaceMetrics.NOOP);
      }
      return shared;
    }
  }

  /**
   * Closes every connection context and stops the threads. Idempotent.
   *
   * <p>Operations still running fail; buffered coalesced writes not yet flushed are lost.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;

    connections.closeAll();
    scheduler.shutdownNow();
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("kvspace worker threads still running after shutdown");
        executor.shutdownNow();
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
    if (log.isInfoEnabled()) {
      log.info("kvspace runtime closed");
    }
  }
}
