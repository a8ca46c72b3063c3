/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.metrics;

import java.time.Duration;

/**
 * Framework-agnostic metrics interface for kvspace connection contexts.
 *
 * <p><strong>Design Pattern:</strong> Interface with default no-op methods. Implementations
 * override only the methods they need, the core calls all methods safely (no null checks).
 *
 * <p><strong>Implementations:</strong>
 *
 * <ul>
 *   <li>{@link #NOOP} - Zero-overhead singleton (uses default methods)
 *   <li>{@code MicrometerKvSpaceMetrics} - Micrometer integration (Spring Boot Actuator)
 * </ul>
 *
 * <p><strong>Dimensions:</strong> every method receives the database identity ({@code
 * driver/name[/bucket]}) so one registry can serve many databases.
 *
 * <p><strong>Thread Safety:</strong> Implementations MUST be thread-safe. Recording methods are
 * called from worker threads, the timer thread and application threads concurrently.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
public interface KvSpaceMetrics extends AutoCloseable {

  /** No-op singleton instance (uses default methods). */
  KvSpaceMetrics NOOP = new KvSpaceMetrics() {};

  /**
   * Records a finished transaction.
   *
   * <p><strong>Metric Type:</strong> Timer
   *
   * <p><strong>Expected Metric Name:</strong> {@code kvspace.transactions}
   *
   * <p><strong>Expected Tags:</strong> {@code database}, {@code mode} ({@code read_only}/{@code
   * read_write}), {@code outcome} ({@code committed}/{@code failed})
   *
   * @param database database identity
   * @param readWrite whether the transaction was read-write
   * @param duration time from admission to commit or abort
   * @param committed whether it committed
   */
  default void recordTransaction(
      String database, boolean readWrite, Duration duration, boolean committed) {
    // No-op by default
  }

  /**
   * Reports the number of currently admitted transactions.
   *
   * <p><strong>Metric Type:</strong> Gauge, {@code kvspace.transactions.active}
   */
  default void setActiveTransactions(String database, int count) {
    // No-op by default
  }

  /**
   * Reports the number of transactions waiting for admission.
   *
   * <p><strong>Metric Type:</strong> Gauge, {@code kvspace.transactions.pending}
   */
  default void setPendingTransactions(String database, int count) {
    // No-op by default
  }

  /**
   * Records one coalesced transaction applying {@code batchSize} buffered writes.
   *
   * <p><strong>Metric Type:</strong> Counters {@code kvspace.coalesce.flushes} and {@code
   * kvspace.coalesce.writes}
   */
  default void recordCoalescedFlush(String database, int batchSize) {
    // No-op by default
  }

  /**
   * Records a reconnect after a stale connection.
   *
   * <p><strong>Metric Type:</strong> Counter, {@code kvspace.reconnects}
   */
  default void recordReconnect(String database) {
    // No-op by default
  }

  /**
   * Records a connection closed by the idle timer.
   *
   * <p><strong>Metric Type:</strong> Counter, {@code kvspace.idle.closes}
   */
  default void recordIdleClose(String database) {
    // No-op by default
  }

  /**
   * Records a plugin hook failure that was handled or propagated.
   *
   * <p><strong>Metric Type:</strong> Counter, {@code kvspace.plugin.errors}, tags {@code plugin},
   * {@code stage}
   */
  default void recordPluginError(String database, String plugin, String stage) {
    // No-op by default
  }

  /**
   * Removes per-database gauges.
   *
   * <p><strong>When called:</strong> when a database is dropped and its context discarded, or when
   * the owning runtime closes.
   *
   * <p><strong>Idempotency:</strong> MUST be safe to call multiple times.
   *
   * @param database database identity to clean up gauges for
   */
  default void close(String database) {
    // No-op by default
  }

  /** Closes all metrics. Default: no-op. */
  @Override
  default void close() {
    // No-op by default
  }
}
