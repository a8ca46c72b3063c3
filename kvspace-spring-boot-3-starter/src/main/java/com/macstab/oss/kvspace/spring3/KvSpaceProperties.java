/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.spring3;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.macstab.oss.kvspace.KvSpaceConfig;
import com.macstab.oss.kvspace.ReadConsistency;
import com.macstab.oss.kvspace.backend.DurabilityHint;
import com.macstab.oss.kvspace.plugin.PluginErrorPolicy;
import com.macstab.oss.kvspace.plugin.PluginInitPolicy;

import lombok.Getter;
import lombok.Setter;

/**
 * Configuration of the auto-configured {@code KvSpace} handle.
 *
 * <pre>{@code
 * kvspace:
 *   name: app
 *   store-name: settings
 *   version: 2
 *   drivers: [redis, memory]      # preference order, first usable wins
 *   coalesce-writes: true
 *   coalesce-window: 8ms
 *   read-consistency: eventual
 *   max-concurrent-transactions: 16
 *   idle-close-after: 5m
 *   redis:
 *     enabled: true                # uses spring.data.redis.* for the connection
 * }</pre>
 *
 * <p>Unset values keep the {@link KvSpaceConfig} defaults. Validation happens when the handle is
 * created, so an invalid combination fails application startup with {@code INVALID_CONFIG}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "kvspace")
public class KvSpaceProperties {

  private String name = KvSpaceConfig.DEFAULT_NAME;

  private String storeName = KvSpaceConfig.DEFAULT_STORE_NAME;

  private int version = KvSpaceConfig.DEFAULT_VERSION;

  private String description = "";

  private String bucket;

  /** Driver preference order. Empty means the in-memory driver. */
  private List<String> drivers = new ArrayList<>();

  private boolean coalesceWrites;

  private Duration coalesceWindow = KvSpaceConfig.DEFAULT_COALESCE_WINDOW;

  private Integer coalesceMaxBatchSize;

  private ReadConsistency readConsistency = ReadConsistency.STRONG;

  private boolean coalesceFireAndForget;

  private Integer maxConcurrentTransactions;

  private Duration idleCloseAfter;

  private int transactionRetries = 1;

  private DurabilityHint durabilityHint = DurabilityHint.DEFAULT;

  private PluginInitPolicy pluginInitPolicy = PluginInitPolicy.FAIL;

  private PluginErrorPolicy pluginErrorPolicy = PluginErrorPolicy.LENIENT;

  private final Redis redis = new Redis();

  /** Converts the bound values into an (unvalidated) handle configuration. */
  public KvSpaceConfig toConfig() {
    return KvSpaceConfig.builder()
        .name(name)
        .storeName(storeName)
        .version(version)
        .description(description)
        .bucket(bucket)
        .drivers(drivers)
        .coalesceWrites(coalesceWrites)
        .coalesceWindow(coalesceWindow)
        .coalesceMaxBatchSize(coalesceMaxBatchSize)
        .readConsistency(readConsistency)
        .coalesceFireAndForget(coalesceFireAndForget)
        .maxConcurrentTransactions(maxConcurrentTransactions)
        .idleCloseAfter(idleCloseAfter)
        .transactionRetries(transactionRetries)
        .durabilityHint(durabilityHint)
        .pluginInitPolicy(pluginInitPolicy)
        .pluginErrorPolicy(pluginErrorPolicy)
        .build();
  }

  /** Redis driver registration. */
  @Getter
  @Setter
  public static class Redis {

    /** Registers the Redis driver, connecting with {@code spring.data.redis.*}. */
    private boolean enabled;
  }
}
