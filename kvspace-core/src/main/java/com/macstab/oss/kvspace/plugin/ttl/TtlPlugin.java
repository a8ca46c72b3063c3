/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.plugin.ttl;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;

import com.macstab.oss.kvspace.KvSpace;
import com.macstab.oss.kvspace.internal.Futures;
import com.macstab.oss.kvspace.plugin.KvSpacePlugin;
import com.macstab.oss.kvspace.plugin.PluginContext;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;

/**
 * Expires entries after a time-to-live.
 *
 * <p><strong>Envelope:</strong> values written with a TTL are stored as a map
 *
 * <pre>
 * { "__ls_ttl": true, "data": &lt;value&gt;, "expiresAt": &lt;epoch millis&gt; }
 * </pre>
 *
 * and unwrapped on read. Values without the marker pass through untouched, so data written before
 * the plugin was added stays readable. Other plugins' envelopes nest inside or around this one.
 *
 * <p><strong>Expiry:</strong> a read of an expired entry returns {@code null}, removes the entry
 * in the background and calls {@code onExpire}. With a {@code cleanupInterval}, a timer on the
 * runtime scheduler periodically reads every key so expired entries are removed without being
 * read by the application. The timer is kept in the pipeline's shared metadata and cancelled on
 * destroy.
 *
 * <p><strong>Priority:</strong> 10, so it wraps values before lower-priority plugins (compression,
 * encryption) transform them.
 *
 * <pre>{@code
 * space.use(TtlPlugin.builder()
 *     .defaultTtl(Duration.ofMinutes(5))
 *     .keyTtl("session", Duration.ofSeconds(30))
 *     .cleanupInterval(Duration.ofMinutes(1))
 *     .build());
 * }</pre>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
@Getter
@Builder
public final class TtlPlugin implements KvSpacePlugin {

  public static final String NAME = "ttl";
  public static final int PRIORITY = 10;

  public static final String MARKER = "__ls_ttl";
  public static final String DATA = "data";
  public static final String EXPIRES_AT = "expiresAt";

  /** Shared-metadata key of the cleanup state. */
  public static final String METADATA_KEY = "__kvspace_ttl_metadata";

  /** TTL for keys without an entry in {@link #keyTtls}; {@code null} means no expiry. */
  private final Duration defaultTtl;

  @Singular private final Map<String, Duration> keyTtls;

  /** Period of the background cleanup; {@code null} disables it. */
  private final Duration cleanupInterval;

  /** Called with key and unwrapped value when an expired entry is read. */
  private final BiConsumer<String, Object> onExpire;

  @Builder.Default private final Clock clock = Clock.systemUTC();

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public int getPriority() {
    return PRIORITY;
  }

  @Override
  public void onInit(final PluginContext context) {
    if (cleanupInterval == null || cleanupInterval.isZero() || cleanupInterval.isNegative()) {
      return;
    }
    final var instance = context.getInstance();
    if (instance == null) {
      return;
    }

    final var state = state(context);
    synchronized (state) {
      if (state.timer != null) {
        return;
      }
      final long period = cleanupInterval.toMillis();
      state.timer =
          instance
              .getRuntime()
              .getScheduler()
              .scheduleAtFixedRate(() -> cleanup(instance, state), period, period, MILLISECONDS);
    }
    if (log.isDebugEnabled()) {
      log.debug("TTL cleanup scheduled every {}", cleanupInterval);
    }
  }

  @Override
  public void onDestroy(final PluginContext context) {
    final var state = state(context);
    synchronized (state) {
      if (state.timer != null) {
        state.timer.cancel(false);
        state.timer = null;
      }
    }
  }

  @Override
  public Object beforeSet(final String key, final Object value, final PluginContext context) {
    final var ttl = keyTtls.getOrDefault(key, defaultTtl);
    if (ttl == null || ttl.isZero() || ttl.isNegative()) {
      return value;
    }
    final var envelope = new HashMap<String, Object>();
    envelope.put(MARKER, Boolean.TRUE);
    envelope.put(DATA, value);
    envelope.put(EXPIRES_AT, clock.millis() + ttl.toMillis());
    return envelope;
  }

  @Override
  public Object afterGet(final String key, final Object value, final PluginContext context) {
    if (!isEnvelope(value)) {
      return value;
    }
    final var envelope = (Map<?, ?>) value;
    final var data = envelope.get(DATA);
    if (expiresAt(envelope) > clock.millis()) {
      return data;
    }

    final var instance = context.getInstance();
    if (instance != null) {
      instance
          .removeItem(key)
          .whenComplete(
              (removed, error) -> {
                if (error != null && log.isDebugEnabled()) {
                  log.debug("Removing expired key '{}' failed: {}", key, error.toString());
                }
              });
    }
    if (onExpire != null) {
      onExpire.accept(key, data);
    }
    return null;
  }

  /** Whether {@code value} is a TTL envelope. */
  public static boolean isEnvelope(final Object value) {
    return value instanceof Map<?, ?> map && Boolean.TRUE.equals(map.get(MARKER));
  }

  // ==================== Private Methods ====================

  private static long expiresAt(final Map<?, ?> envelope) {
    return envelope.get(EXPIRES_AT) instanceof Number number ? number.longValue() : 0L;
  }

  private static CleanupState state(final PluginContext context) {
    return (CleanupState)
        context.getMetadata().computeIfAbsent(METADATA_KEY, key -> new CleanupState());
  }

  private void cleanup(final KvSpace instance, final CleanupState state) {
    if (!state.running.compareAndSet(false, true)) {
      return;
    }
    instance
        .keys()
        .thenCompose(keys -> readAll(instance, keys, 0))
        .whenComplete(
            (done, error) -> {
              state.running.set(false);
              if (error != null) {
                log.warn("TTL cleanup failed: {}", error.toString());
              }
            });
  }

  /** Reads keys one after another through the plugin-aware path, so expiry applies. */
  private static CompletableFuture<Void> readAll(
      final KvSpace instance, final List<String> keys, final int index) {
    if (index >= keys.size()) {
      return Futures.done();
    }
    return Futures.settled(instance.getItem(keys.get(index)))
        .thenCompose(read -> readAll(instance, keys, index + 1));
  }

  /** Cleanup timer shared by every context of one pipeline. */
  private static final class CleanupState {
    private final AtomicBoolean running = new AtomicBoolean();
    private ScheduledFuture<?> timer;
  }
}
