/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace;

import java.time.Duration;
import java.util.List;
import java.util.regex.Pattern;

import com.macstab.oss.kvspace.backend.DurabilityHint;
import com.macstab.oss.kvspace.backend.memory.InMemoryBackendAdapter;
import com.macstab.oss.kvspace.error.ErrorCode;
import com.macstab.oss.kvspace.error.ErrorDetails;
import com.macstab.oss.kvspace.error.KvSpaceException;
import com.macstab.oss.kvspace.plugin.PluginErrorPolicy;
import com.macstab.oss.kvspace.plugin.PluginInitPolicy;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Immutable configuration of a {@link KvSpace} handle.
 *
 * <p><strong>Identity:</strong> {@code drivers} (the one selected), {@code name} and {@code
 * bucket} identify the physical database; every handle with the same identity shares one
 * connection context. {@code storeName} and {@code version} are per handle.
 *
 * <p><strong>Defaults:</strong>
 *
 * <table>
 *   <caption>Default values</caption>
 *   <tr><th>Property</th><th>Default</th></tr>
 *   <tr><td>name</td><td>{@code kvspace}</td></tr>
 *   <tr><td>storeName</td><td>{@code keyvaluepairs}</td></tr>
 *   <tr><td>version</td><td>1</td></tr>
 *   <tr><td>drivers</td><td>{@code [memory]}</td></tr>
 *   <tr><td>coalesceWrites</td><td>false</td></tr>
 *   <tr><td>coalesceWindow</td><td>8 ms</td></tr>
 *   <tr><td>coalesceMaxBatchSize</td><td>unbounded</td></tr>
 *   <tr><td>readConsistency</td><td>STRONG</td></tr>
 *   <tr><td>maxConcurrentTransactions</td><td>unbounded</td></tr>
 *   <tr><td>idleCloseAfter</td><td>disabled</td></tr>
 *   <tr><td>transactionRetries</td><td>1</td></tr>
 *   <tr><td>pluginInitPolicy</td><td>FAIL</td></tr>
 *   <tr><td>pluginErrorPolicy</td><td>LENIENT</td></tr>
 * </table>
 *
 * <p>Store names are sanitized on build: every non-word character becomes {@code _}.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Value
@Builder(toBuilder = true)
public class KvSpaceConfig {

  public static final int DEFAULT_VERSION = 1;
  public static final String DEFAULT_NAME = "kvspace";
  public static final String DEFAULT_STORE_NAME = "keyvaluepairs";
  public static final Duration DEFAULT_COALESCE_WINDOW = Duration.ofMillis(8);

  private static final Pattern NON_WORD = Pattern.compile("\\W");

  @NonNull @Builder.Default String name = DEFAULT_NAME;

  @NonNull @Builder.Default String storeName = DEFAULT_STORE_NAME;

  @Builder.Default int version = DEFAULT_VERSION;

  @NonNull @Builder.Default String description = "";

  /** Optional sub-bucket of the database; part of the database identity. */
  String bucket;

  /** Driver preference order; the first supported driver that initializes wins. */
  @Singular List<String> drivers;

  @Builder.Default boolean coalesceWrites = false;

  @NonNull @Builder.Default Duration coalesceWindow = DEFAULT_COALESCE_WINDOW;

  /** Maximum writes per coalesced transaction; {@code null} means unbounded. */
  Integer coalesceMaxBatchSize;

  @NonNull @Builder.Default ReadConsistency readConsistency = ReadConsistency.STRONG;

  /** Resolve coalesced writes before commit. Requires {@link ReadConsistency#EVENTUAL}. */
  @Builder.Default boolean coalesceFireAndForget = false;

  /** Maximum concurrently open transactions per database; {@code null} means unbounded. */
  Integer maxConcurrentTransactions;

  /** Close the connection after this much inactivity; {@code null} disables idle close. */
  Duration idleCloseAfter;

  /** Reconnect-and-retry attempts after a stale connection. */
  @Builder.Default int transactionRetries = 1;

  @NonNull @Builder.Default DurabilityHint durabilityHint = DurabilityHint.DEFAULT;

  @NonNull @Builder.Default PluginInitPolicy pluginInitPolicy = PluginInitPolicy.FAIL;

  @NonNull @Builder.Default PluginErrorPolicy pluginErrorPolicy = PluginErrorPolicy.LENIENT;

  /** Configuration with all defaults. */
  public static KvSpaceConfig defaults() {
    return builder().build();
  }

  /** Driver preference list, defaulting to the in-memory driver. */
  public List<String> getDrivers() {
    return drivers.isEmpty() ? List.of(InMemoryBackendAdapter.DRIVER_NAME) : drivers;
  }

  /**
   * Validates and normalizes this configuration.
   *
   * @return copy with the store name sanitized
   * @throws KvSpaceException {@code INVALID_CONFIG} naming the offending {@code configKey}
   */
  public KvSpaceConfig validate() {
    if (name.isBlank()) {
      throw invalid("name", "Database name must not be blank");
    }
    if (storeName.isBlank()) {
      throw invalid("storeName", "Store name must not be blank");
    }
    if (version < 1) {
      throw invalid("version", "Database version must be >= 1, got: " + version);
    }
    if (coalesceWindow.isNegative()) {
      throw invalid("coalesceWindow", "Coalesce window must not be negative: " + coalesceWindow);
    }
    if (coalesceMaxBatchSize != null && coalesceMaxBatchSize < 1) {
      throw invalid(
          "coalesceMaxBatchSize", "Coalesce batch size must be >= 1, got: " + coalesceMaxBatchSize);
    }
    if (maxConcurrentTransactions != null && maxConcurrentTransactions < 1) {
      throw invalid(
          "maxConcurrentTransactions",
          "Max concurrent transactions must be >= 1, got: " + maxConcurrentTransactions);
    }
    if (idleCloseAfter != null && (idleCloseAfter.isNegative() || idleCloseAfter.isZero())) {
      throw invalid("idleCloseAfter", "Idle close interval must be positive: " + idleCloseAfter);
    }
    if (transactionRetries < 0) {
      throw invalid(
          "transactionRetries", "Transaction retries must be >= 0, got: " + transactionRetries);
    }
    if (coalesceFireAndForget && readConsistency == ReadConsistency.STRONG) {
      throw invalid(
          "coalesceFireAndForget", "Fire-and-forget writes require EVENTUAL read consistency");
    }

    final var sanitized = NON_WORD.matcher(storeName).replaceAll("_");
    return sanitized.equals(storeName) ? this : toBuilder().storeName(sanitized).build();
  }

  private static KvSpaceException invalid(final String configKey, final String message) {
    return KvSpaceException.of(
        ErrorCode.INVALID_CONFIG, message, ErrorDetails.of(ErrorDetails.CONFIG_KEY, configKey));
  }
}
