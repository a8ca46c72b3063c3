/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.metrics.micrometer;

import lombok.experimental.UtilityClass;

/**
 * Metric names and tag keys of the Micrometer integration.
 *
 * <p><strong>Naming Convention:</strong> {@code kvspace.*}. Micrometer's naming conventions
 * translate the dots per monitoring system:
 *
 * <pre>
 * kvspace.transactions        → kvspace_transactions_seconds_count (Prometheus)
 * kvspace.transactions.active → kvspace_transactions_active
 * </pre>
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@UtilityClass
public class MetricsConfiguration {

  public static final String PREFIX = "kvspace";

  /**
   * Transaction duration from admission to commit or abort.
   *
   * <p><strong>Type:</strong> Timer
   *
   * <p><strong>Tags:</strong> {@code database}, {@code mode}, {@code outcome}
   */
  public static final String TRANSACTIONS = PREFIX + ".transactions";

  /** Admitted transactions. Gauge, tag {@code database}. */
  public static final String TRANSACTIONS_ACTIVE = PREFIX + ".transactions.active";

  /** Transactions waiting for admission. Gauge, tag {@code database}. */
  public static final String TRANSACTIONS_PENDING = PREFIX + ".transactions.pending";

  /** Coalesced transactions committed. Counter, tag {@code database}. */
  public static final String COALESCE_FLUSHES = PREFIX + ".coalesce.flushes";

  /**
   * Writes applied through coalesced transactions.
   *
   * <p>{@code writes - flushes} is the number of transactions saved by coalescing.
   */
  public static final String COALESCE_WRITES = PREFIX + ".coalesce.writes";

  /** Reconnects after stale connections. Counter, tag {@code database}. */
  public static final String RECONNECTS = PREFIX + ".reconnects";

  /** Connections closed by the idle timer. Counter, tag {@code database}. */
  public static final String IDLE_CLOSES = PREFIX + ".idle.closes";

  /** Plugin hook failures. Counter, tags {@code database}, {@code plugin}, {@code stage}. */
  public static final String PLUGIN_ERRORS = PREFIX + ".plugin.errors";

  // ==================== Tags ====================

  /** Database identity ({@code driver:name[/bucket]}). */
  public static final String TAG_DATABASE = "database";

  /** {@code read_only} or {@code read_write}. */
  public static final String TAG_MODE = "mode";

  /** {@code committed} or {@code failed}. */
  public static final String TAG_OUTCOME = "outcome";

  public static final String TAG_PLUGIN = "plugin";

  /** Lifecycle or hook stage ({@code init}, {@code before}, {@code after}, {@code destroy}). */
  public static final String TAG_STAGE = "stage";

  /** Default bound of {@link MetricCache}. */
  public static final int DEFAULT_MAX_CACHE_SIZE = 1000;
}
