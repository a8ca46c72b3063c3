/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.metrics.autoconfigure;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.macstab.oss.kvspace.metrics.micrometer.MetricsConfiguration;

import lombok.Data;

/**
 * Configuration properties for kvspace metrics.
 *
 * <p><strong>Configuration Example:</strong>
 *
 * <pre>{@code
 * management:
 *   metrics:
 *     kvspace:
 *       enabled: true
 *       max-cache-size: 1000
 * }</pre>
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Data
@ConfigurationProperties(prefix = "management.metrics.kvspace")
public class KvSpaceMetricsProperties {

  /**
   * Enable kvspace metrics collection.
   *
   * <p><strong>When disabled:</strong> {@code KvSpaceMetrics.NOOP} is used.
   */
  private boolean enabled = true;

  /**
   * Maximum cached meter instances.
   *
   * <p>One database needs about ten meters plus one per plugin and stage that failed. When the
   * cache is full, meters are still registered, just not cached.
   */
  private int maxCacheSize = MetricsConfiguration.DEFAULT_MAX_CACHE_SIZE;
}
