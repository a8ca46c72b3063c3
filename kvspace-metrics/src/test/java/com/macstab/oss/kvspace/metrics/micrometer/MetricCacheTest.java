/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.metrics.micrometer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Tests for {@link MetricCache}.
 *
 * <p><strong>Test Strategy:</strong>
 *
 * <ul>
 *   <li>{@link SimpleMeterRegistry} for isolation
 *   <li>Identity checks prove cache hits
 *   <li>Bounded cache falls back to direct registration
 * </ul>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("MetricCache")
class MetricCacheTest {

  private SimpleMeterRegistry registry;
  private MetricCache cache;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    cache = new MetricCache(registry, 10);
  }

  @Nested
  @DisplayName("Caching")
  class Caching {

    @Test
    @DisplayName("should return the same counter for the same name and tags")
    void shouldReturnSameCounter() {
      // Act
      final var first = cache.getOrCreateCounter("c", "d", "database", "a");
      final var second = cache.getOrCreateCounter("c", "d", "database", "a");
      final var other = cache.getOrCreateCounter("c", "d", "database", "b");

      // Assert
      assertThat(second).isSameAs(first);
      assertThat(other).isNotSameAs(first);
      assertThat(cache.getCacheSize()).isEqualTo(2);
    }

    @Test
    @DisplayName("should register gauges backed by the returned value")
    void shouldRegisterGaugeBackedByValue() {
      // Act
      cache.getOrCreateGaugeValue("g", "d", "database", "a").set(7);

      // Assert
      assertThat(registry.get("g").tag("database", "a").gauge().value()).isEqualTo(7.0);
      assertThat(cache.getOrCreateGaugeValue("g", "d", "database", "a").get()).isEqualTo(7);
    }

    @Test
    @DisplayName("should register directly once the cache is full")
    void shouldRegisterDirectlyWhenFull() {
      // Arrange
      final var small = new MetricCache(registry, 1);
      small.getOrCreateCounter("c", "d", "database", "a");

      // Act
      small.getOrCreateCounter("c", "d", "database", "b").increment();
      small.getOrCreateCounter("c", "d", "database", "b").increment();

      // Assert
      assertThat(small.getCacheSize()).isEqualTo(1);
      assertThat(registry.counter("c", "database", "b").count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("should reject odd tag arrays and non-positive sizes")
    void shouldRejectInvalidArguments() {
      // Act & Assert
      assertThatIllegalArgumentException()
          .isThrownBy(() -> cache.getOrCreateTimer("t", "d", "database"))
          .withMessageContaining("even length");
      assertThatIllegalArgumentException()
          .isThrownBy(() -> new MetricCache(registry, 0))
          .withMessageContaining("maxCacheSize must be > 0");
    }
  }

  @Nested
  @DisplayName("Gauge Removal")
  class GaugeRemoval {

    @Test
    @DisplayName("should remove only gauges carrying the tag value")
    void shouldRemoveMatchingGauges() {
      // Arrange
      cache.getOrCreateGaugeValue("g1", "d", "database", "a");
      cache.getOrCreateGaugeValue("g2", "d", "database", "a");
      cache.getOrCreateGaugeValue("g1", "d", "database", "b");

      // Act
      final int removed = cache.removeGauges("database", "a");

      // Assert
      assertThat(removed).isEqualTo(2);
      assertThat(registry.find("g1").tag("database", "a").gauge()).isNull();
      assertThat(registry.find("g1").tag("database", "b").gauge()).isNotNull();
      assertThat(cache.getCacheSize()).isEqualTo(1);
    }

    @Test
    @DisplayName("should remove every gauge and keep counters")
    void shouldRemoveAllGauges() {
      // Arrange
      cache.getOrCreateGaugeValue("g", "d", "database", "a");
      cache.getOrCreateCounter("c", "d", "database", "a");

      // Act
      cache.removeAllGauges();

      // Assert
      assertThat(registry.find("g").gauge()).isNull();
      assertThat(registry.find("c").counter()).isNotNull();
      assertThat(cache.getCacheSize()).isEqualTo(1);
    }
  }
}
