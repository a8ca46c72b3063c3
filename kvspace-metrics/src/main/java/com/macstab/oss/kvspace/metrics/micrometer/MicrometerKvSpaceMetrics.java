/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.metrics.micrometer;

import static com.macstab.oss.kvspace.metrics.micrometer.MetricsConfiguration.*;

import java.time.Duration;
import java.util.Objects;

import com.macstab.oss.kvspace.metrics.KvSpaceMetrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Micrometer implementation of {@link KvSpaceMetrics} with one {@code database} dimension per
 * connection context.
 *
 * <p><strong>Metrics Published:</strong>
 *
 * <table>
 *   <caption>Metric Summary</caption>
 *   <thead>
 *     <tr><th>Metric</th><th>Type</th><th>Tags</th></tr>
 *   </thead>
 *   <tbody>
 *     <tr><td>{@code kvspace.transactions}</td><td>Timer</td>
 *         <td>database, mode, outcome</td></tr>
 *     <tr><td>{@code kvspace.transactions.active}</td><td>Gauge</td><td>database</td></tr>
 *     <tr><td>{@code kvspace.transactions.pending}</td><td>Gauge</td><td>database</td></tr>
 *     <tr><td>{@code kvspace.coalesce.flushes}</td><td>Counter</td><td>database</td></tr>
 *     <tr><td>{@code kvspace.coalesce.writes}</td><td>Counter</td><td>database</td></tr>
 *     <tr><td>{@code kvspace.reconnects}</td><td>Counter</td><td>database</td></tr>
 *     <tr><td>{@code kvspace.idle.closes}</td><td>Counter</td><td>database</td></tr>
 *     <tr><td>{@code kvspace.plugin.errors}</td><td>Counter</td>
 *         <td>database, plugin, stage</td></tr>
 *   </tbody>
 * </table>
 *
 * <p><strong>Memory Management:</strong> gauges are removed by {@link #close(String)} when a
 * database context is discarded, and all at once by {@link #close()}.
 *
 * <p><strong>Thread Safety:</strong> all recording methods are thread-safe through {@link
 * MetricCache}.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class MicrometerKvSpaceMetrics implements KvSpaceMetrics {

  private static final String READ_ONLY = "read_only";
  private static final String READ_WRITE = "read_write";
  private static final String COMMITTED = "committed";
  private static final String FAILED = "failed";

  private final MetricCache cache;

  private volatile boolean closed;

  /**
   * Creates a Micrometer metrics collector.
   *
   * @param registry Micrometer meter registry
   * @param maxCacheSize maximum cached meters
   * @throws IllegalArgumentException if maxCacheSize &lt;= 0
   */
  public MicrometerKvSpaceMetrics(@NonNull final MeterRegistry registry, final int maxCacheSize) {
    this.cache =
        new MetricCache(
            Objects.requireNonNull(registry, "MeterRegistry must not be null"), maxCacheSize);

    if (log.isDebugEnabled()) {
      log.debug("Created MicrometerKvSpaceMetrics (maxCacheSize: {})", maxCacheSize);
    }
  }

  public MicrometerKvSpaceMetrics(@NonNull final MeterRegistry registry) {
    this(registry, DEFAULT_MAX_CACHE_SIZE);
  }

  @Override
  public void recordTransaction(
      final String database,
      final boolean readWrite,
      final Duration duration,
      final boolean committed) {
    if (closed) {
      return;
    }
    cache
        .getOrCreateTimer(
            TRANSACTIONS,
            "Transaction duration from admission to commit or abort",
            TAG_DATABASE,
            database,
            TAG_MODE,
            readWrite ? READ_WRITE : READ_ONLY,
            TAG_OUTCOME,
            committed ? COMMITTED : FAILED)
        .record(duration);
  }

  @Override
  public void setActiveTransactions(final String database, final int count) {
    if (closed) {
      return;
    }
    cache
        .getOrCreateGaugeValue(
            TRANSACTIONS_ACTIVE, "Currently admitted transactions", TAG_DATABASE, database)
        .set(count);
  }

  @Override
  public void setPendingTransactions(final String database, final int count) {
    if (closed) {
      return;
    }
    cache
        .getOrCreateGaugeValue(
            TRANSACTIONS_PENDING, "Transactions waiting for admission", TAG_DATABASE, database)
        .set(count);
  }

  @Override
  public void recordCoalescedFlush(final String database, final int batchSize) {
    if (closed) {
      return;
    }
    if (batchSize <= 0) {
      log.warn("Invalid coalesced batch size: {}, skipping metric", batchSize);
      return;
    }
    cache
        .getOrCreateCounter(
            COALESCE_FLUSHES, "Coalesced write transactions", TAG_DATABASE, database)
        .increment();
    cache
        .getOrCreateCounter(
            COALESCE_WRITES, "Writes applied by coalesced transactions", TAG_DATABASE, database)
        .increment(batchSize);
  }

  @Override
  public void recordReconnect(final String database) {
    if (closed) {
      return;
    }
    cache
        .getOrCreateCounter(
            RECONNECTS, "Reconnects after stale connections", TAG_DATABASE, database)
        .increment();
  }

  @Override
  public void recordIdleClose(final String database) {
    if (closed) {
      return;
    }
    cache
        .getOrCreateCounter(IDLE_CLOSES, "Connections closed while idle", TAG_DATABASE, database)
        .increment();
  }

  @Override
  public void recordPluginError(final String database, final String plugin, final String stage) {
    if (closed) {
      return;
    }
    cache
        .getOrCreateCounter(
            PLUGIN_ERRORS,
            "Plugin hook failures",
            TAG_DATABASE,
            database,
            TAG_PLUGIN,
            plugin,
            TAG_STAGE,
            stage)
        .increment();
  }

  @Override
  public void close(final String database) {
    if (closed || database == null) {
      return;
    }
    try {
      final int removed = cache.removeGauges(TAG_DATABASE, database);
      if (log.isDebugEnabled()) {
        log.debug("Removed {} gauges of database '{}'", removed, database);
      }
    } catch (final RuntimeException e) {
      // called from context cleanup paths that must not fail
      log.error("Error during metrics cleanup for database '{}'", database, e);
    }
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      cache.removeAllGauges();
      log.info("Closed MicrometerKvSpaceMetrics");
    } catch (final RuntimeException e) {
      log.error("Error during metrics cleanup", e);
    }
  }

  int getCacheSize() {
    return cache.getCacheSize();
  }
}
