/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.plugin.ttl;

import static com.macstab.oss.kvspace.FutureAssertions.result;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.macstab.oss.kvspace.KvSpace;
import com.macstab.oss.kvspace.KvSpaceConfig;
import com.macstab.oss.kvspace.KvSpaceRuntime;

/**
 * Tests for {@link TtlPlugin}.
 *
 * <p><strong>Test Strategy:</strong> envelope handling is tested on the plugin directly; expiry
 * and cleanup run through {@link KvSpace} handles on the in-memory driver with a {@link
 * ManualClock}, so no test waits for a TTL to pass.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("TtlPlugin")
class TtlPluginTest {

  private static final String DATABASE = "ttl";

  private KvSpaceRuntime runtime;
  private ManualClock clock;
  private Map<String, Object> expired;

  @BeforeEach
  void setUp() {
    runtime = KvSpaceRuntime.create();
    clock = new ManualClock(1_000_000L);
    expired = new ConcurrentHashMap<>();
  }

  @AfterEach
  void tearDown() {
    runtime.close();
  }

  private KvSpace space() {
    return KvSpace.create(
        KvSpaceConfig.builder().name(DATABASE).storeName("sessions").build(), runtime);
  }

  private TtlPlugin.TtlPluginBuilder ttl() {
    return TtlPlugin.builder().clock(clock).onExpire(expired::put);
  }

  @Nested
  @DisplayName("Envelope")
  class Envelope {

    @Test
    @DisplayName("should wrap values with the default TTL")
    void shouldWrapWithDefaultTtl() {
      // Arrange
      final var plugin = ttl().defaultTtl(Duration.ofSeconds(30)).build();

      // Act
      final var stored = plugin.beforeSet("user", "alice", null);

      // Assert
      assertThat(TtlPlugin.isEnvelope(stored)).isTrue();
      assertThat(stored)
          .asInstanceOf(InstanceOfAssertFactories.MAP)
          .containsEntry(TtlPlugin.DATA, "alice")
          .containsEntry(TtlPlugin.EXPIRES_AT, 1_030_000L);
    }

    @Test
    @DisplayName("should prefer a per-key TTL over the default")
    void shouldPreferPerKeyTtl() {
      // Arrange
      final var plugin =
          ttl().defaultTtl(Duration.ofMinutes(5)).keyTtl("session", Duration.ofSeconds(1)).build();

      // Act
      final var stored = plugin.beforeSet("session", "token", null);

      // Assert
      assertThat(stored)
          .asInstanceOf(InstanceOfAssertFactories.MAP)
          .containsEntry(TtlPlugin.EXPIRES_AT, 1_001_000L);
    }

    @Test
    @DisplayName("should pass values through when no TTL applies")
    void shouldPassThroughWithoutTtl() {
      // Arrange
      final var plugin = ttl().keyTtl("session", Duration.ofSeconds(1)).build();

      // Act
      final var stored = plugin.beforeSet("other", "value", null);

      // Assert
      assertThat(stored).isEqualTo("value");
    }

    @Test
    @DisplayName("should pass plain values through on read")
    void shouldPassPlainValuesThroughOnRead() {
      // Arrange
      final var plugin = ttl().defaultTtl(Duration.ofSeconds(1)).build();
      final var plain = Map.of("data", "not an envelope");

      // Act
      final var read = plugin.afterGet("legacy", plain, null);

      // Assert
      assertThat(read).isSameAs(plain);
    }
  }

  @Nested
  @DisplayName("Expiry")
  class Expiry {

    @Test
    @DisplayName("should return the value before expiry and store an envelope")
    void shouldReturnValueBeforeExpiry() {
      // Arrange
      final var space = space().use(ttl().defaultTtl(Duration.ofMinutes(1)).build());
      result(space.setItem("user", "alice"));

      // Act
      final var read = result(space.getItem("user"));

      // Assert
      assertThat(read).isEqualTo("alice");
      assertThat(TtlPlugin.isEnvelope(result(space().getItem("user")))).isTrue();
      assertThat(expired).isEmpty();
    }

    @Test
    @DisplayName("should return null, remove the entry and notify after expiry")
    void shouldExpireOnRead() {
      // Arrange
      final var space = space().use(ttl().defaultTtl(Duration.ofMinutes(1)).build());
      result(space.setItem("user", "alice"));
      clock.advance(Duration.ofMinutes(2));

      // Act
      final var read = result(space.getItem("user"));

      // Assert
      assertThat(read).isNull();
      assertThat(expired).containsEntry("user", "alice");
      await()
          .atMost(Duration.ofSeconds(5))
          .untilAsserted(() -> assertThat(result(space.keys())).isEmpty());
    }

    @Test
    @DisplayName("should keep reading values written before the plugin was added")
    void shouldReadValuesWrittenWithoutPlugin() {
      // Arrange
      result(space().setItem("legacy", 42));
      final var space = space().use(ttl().defaultTtl(Duration.ofSeconds(1)).build());
      clock.advance(Duration.ofHours(1));

      // Act
      final var read = result(space.getItem("legacy"));

      // Assert
      assertThat(read).isEqualTo(42);
      assertThat(expired).isEmpty();
    }
  }

  @Nested
  @DisplayName("Cleanup")
  class Cleanup {

    @Test
    @DisplayName("should remove expired entries in the background without reads")
    void shouldRemoveExpiredEntriesInBackground() {
      // Arrange
      final var space =
          space()
              .use(
                  ttl()
                      .keyTtl("short", Duration.ofSeconds(1))
                      .cleanupInterval(Duration.ofMillis(50))
                      .build());
      result(space.setItem("short", "gone soon"));
      result(space.setItem("durable", "kept"));

      // Act
      clock.advance(Duration.ofSeconds(5));

      // Assert
      await()
          .atMost(Duration.ofSeconds(5))
          .untilAsserted(() -> assertThat(result(space().keys())).containsExactly("durable"));
      assertThat(expired).containsOnlyKeys("short");
    }

    @Test
    @DisplayName("should stop the cleanup timer on destroy")
    void shouldStopCleanupOnDestroy() {
      // Arrange
      final var space =
          space()
              .use(
                  ttl()
                      .keyTtl("short", Duration.ofSeconds(1))
                      .cleanupInterval(Duration.ofMillis(50))
                      .build());
      result(space.setItem("short", "stays"));

      // Act
      result(space.destroy());
      clock.advance(Duration.ofSeconds(5));

      // Assert
      await()
          .during(Duration.ofMillis(300))
          .atMost(Duration.ofSeconds(2))
          .untilAsserted(() -> assertThat(result(space().keys())).containsExactly("short"));
      assertThat(expired).isEmpty();
    }
  }

  /** Clock that only moves when told to. */
  private static final class ManualClock extends Clock {

    private final AtomicLong millis;

    private ManualClock(final long startMillis) {
      this.millis = new AtomicLong(startMillis);
    }

    void advance(final Duration duration) {
      millis.addAndGet(duration.toMillis());
    }

    @Override
    public long millis() {
      return millis.get();
    }

    @Override
    public Instant instant() {
      return Instant.ofEpochMilli(millis.get());
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(final ZoneId zone) {
      return this;
    }
  }
}
