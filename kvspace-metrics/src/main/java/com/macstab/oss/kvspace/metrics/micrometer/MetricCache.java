/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.metrics.micrometer;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Thread-safe cache for Micrometer meters.
 *
 * <p><strong>Problem:</strong> registry lookup with tag matching costs far more than an increment,
 * and the recording methods run once per transaction.
 *
 * <p><strong>Solution:</strong> {@code Counter}, {@code Timer} and gauge values ({@code
 * AtomicInteger}) are cached in {@code ConcurrentHashMap}s keyed by name and tags. The first access
 * registers the meter, later accesses hit the cache.
 *
 * <p><strong>Graceful Degradation:</strong> once {@code maxCacheSize} meters are cached, further
 * meters are registered directly without caching. A warning is logged per such access.
 *
 * <p><strong>Key Format:</strong> {@code metric.name:tag1=value1:tag2=value2} (tags in call
 * order).
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
final class MetricCache {

  private final MeterRegistry registry;
  private final int maxCacheSize;

  private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>(64);
  private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>(64);
  private final ConcurrentHashMap<String, AtomicInteger> gaugeValues = new ConcurrentHashMap<>(64);
  private final ConcurrentHashMap<String, Gauge> gauges = new ConcurrentHashMap<>(64);
  private final AtomicInteger cacheSize = new AtomicInteger();

  /**
   * Creates a metric cache.
   *
   * @param registry Micrometer meter registry
   * @param maxCacheSize maximum cached meters
   * @throws IllegalArgumentException if maxCacheSize &lt;= 0
   */
  MetricCache(@NonNull final MeterRegistry registry, final int maxCacheSize) {
    this.registry = Objects.requireNonNull(registry, "MeterRegistry must not be null");

    if (maxCacheSize <= 0) {
      throw new IllegalArgumentException("maxCacheSize must be > 0, got: " + maxCacheSize);
    }
    this.maxCacheSize = maxCacheSize;
  }

  Counter getOrCreateCounter(
      final String name, final String description, final String... tagPairs) {
    validateTagPairs(tagPairs);

    final var key = buildKey(name, tagPairs);
    final var cached = counters.get(key);
    if (cached != null) {
      return cached;
    }

    if (cacheSize.get() < maxCacheSize) {
      return counters.computeIfAbsent(
          key,
          k -> {
            cacheSize.incrementAndGet();
            return Counter.builder(name)
                .description(description)
                .tags(tagPairs)
                .register(registry);
          });
    }
    log.warn(
        "Metric cache full at {} entries. Direct registry used for counter: {}", maxCacheSize, key);
    return Counter.builder(name).description(description).tags(tagPairs).register(registry);
  }

  Timer getOrCreateTimer(final String name, final String description, final String... tagPairs) {
    validateTagPairs(tagPairs);

    final var key = buildKey(name, tagPairs);
    final var cached = timers.get(key);
    if (cached != null) {
      return cached;
    }

    if (cacheSize.get() < maxCacheSize) {
      return timers.computeIfAbsent(
          key,
          k -> {
            cacheSize.incrementAndGet();
            return Timer.builder(name).description(description).tags(tagPairs).register(registry);
          });
    }
    log.warn(
        "Metric cache full at {} entries. Direct registry used for timer: {}", maxCacheSize, key);
    return Timer.builder(name).description(description).tags(tagPairs).register(registry);
  }

  /**
   * Gets or creates the value holder of a gauge.
   *
   * <p><strong>Memory Management:</strong> gauges hold strong references in the registry; {@link
   * #removeGauges(String, String)} unregisters them.
   */
  AtomicInteger getOrCreateGaugeValue(
      final String name, final String description, final String... tagPairs) {
    validateTagPairs(tagPairs);

    final var key = buildKey(name, tagPairs);
    final var cached = gaugeValues.get(key);
    if (cached != null) {
      return cached;
    }

    if (cacheSize.get() < maxCacheSize) {
      return gaugeValues.computeIfAbsent(
          key,
          k -> {
            cacheSize.incrementAndGet();
            final var value = new AtomicInteger();
            gauges.put(k, registerGauge(name, description, value, tagPairs));
            return value;
          });
    }
    log.warn(
        "Metric cache full at {} entries. Direct registry used for gauge: {}", maxCacheSize, key);
    final var value = new AtomicInteger();
    registerGauge(name, description, value, tagPairs);
    return value;
  }

  /**
   * Unregisters every cached gauge carrying {@code tagKey=tagValue}.
   *
   * @return number of removed gauges
   */
  int removeGauges(final String tagKey, final String tagValue) {
    final var removed = new AtomicInteger();
    gauges.forEach(
        (key, gauge) -> {
          if (!tagValue.equals(gauge.getId().getTag(tagKey))) {
            return;
          }
          if (gauges.remove(key, gauge)) {
            gaugeValues.remove(key);
            registry.remove(gauge);
            cacheSize.decrementAndGet();
            removed.incrementAndGet();
            if (log.isDebugEnabled()) {
              log.debug("Removed gauge {}", key);
            }
          }
        });
    return removed.get();
  }

  /** Unregisters every cached gauge. */
  void removeAllGauges() {
    gauges.forEach(
        (key, gauge) -> {
          if (gauges.remove(key, gauge)) {
            gaugeValues.remove(key);
            registry.remove(gauge);
            cacheSize.decrementAndGet();
          }
        });
  }

  int getCacheSize() {
    return cacheSize.get();
  }

  int getMaxCacheSize() {
    return maxCacheSize;
  }

  // ==================== Private Methods ====================

  private Gauge registerGauge(
      final String name,
      final String description,
      final AtomicInteger value,
      final String... tagPairs) {
    return Gauge.builder(name, value, AtomicInteger::get)
        .description(description)
        .tags(tagPairs)
        .register(registry);
  }

  private static String buildKey(final String name, final String... tagPairs) {
    final var key = new StringBuilder(32 + tagPairs.length / 2 * 25);
    key.append(name);
    for (int i = 0; i < tagPairs.length; i += 2) {
      key.append(':').append(tagPairs[i]).append('=').append(tagPairs[i + 1]);
    }
    return key.toString();
  }

  private static void validateTagPairs(final String... tagPairs) {
    if (tagPairs.length % 2 != 0) {
      throw new IllegalArgumentException(
          "Tag pairs must have even length (key-value pairs), got: " + tagPairs.length);
    }
  }
}
