/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.redis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import com.macstab.oss.kvspace.KvSpace;
import com.macstab.oss.kvspace.KvSpaceConfig;
import com.macstab.oss.kvspace.KvSpaceRuntime;
import com.macstab.oss.kvspace.backend.BackendConnection;
import com.macstab.oss.kvspace.backend.BackendException;
import com.macstab.oss.kvspace.backend.BackendTransaction;
import com.macstab.oss.kvspace.backend.DurabilityHint;
import com.macstab.oss.kvspace.backend.SchemaUpgrade;
import com.macstab.oss.kvspace.backend.StaleConnectionException;
import com.macstab.oss.kvspace.backend.StaleConnectionException.Reason;
import com.macstab.oss.kvspace.backend.TransactionMode;

import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;

/**
 * Integration tests for {@link RedisBackendAdapter} against a real Redis (Testcontainers).
 *
 * <p><strong>Test Strategy:</strong>
 *
 * <ul>
 *   <li>One container per class, flushed before every test
 *   <li>A raw Lettuce connection inspects the key layout the adapter writes
 *   <li>A second adapter instance plays another process changing the schema
 *   <li>Skipped when no Docker daemon is available
 * </ul>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("RedisBackendAdapter (Real Redis)")
class RedisBackendAdapterIntegrationTest {

  private static final String DATABASE = "shop";

  @Container
  private static final GenericContainer<?> REDIS =
      new GenericContainer<>(DockerImageName.parse("redis:7.4-alpine"))
          .withExposedPorts(6379)
          .withStartupTimeout(Duration.ofSeconds(30));

  private RedisClient client;
  private StatefulRedisConnection<String, String> raw;
  private RedisCommands<String, String> redis;
  private RedisBackendAdapter adapter;
  private RedisBackendAdapter otherProcess;

  @BeforeEach
  void setUp() {
    client =
        RedisClient.create(
            String.format("redis://%s:%d", REDIS.getHost(), REDIS.getFirstMappedPort()));
    raw = client.connect();
    redis = raw.sync();
    redis.flushall();
    adapter = new RedisBackendAdapter(client);
    otherProcess = new RedisBackendAdapter(client);
  }

  @AfterEach
  void tearDown() {
    adapter.close();
    otherProcess.close();
    raw.close();
    client.shutdown();
  }

  private static SchemaUpgrade createStore(final String storeName) {
    return (editor, oldVersion, newVersion) -> editor.createStore(storeName);
  }

  private BackendConnection openWithItems() {
    return adapter.open(DATABASE, 2, createStore("items"));
  }

  private static BackendTransaction write(final BackendConnection connection) {
    return connection.begin("items", TransactionMode.READ_WRITE, DurabilityHint.DEFAULT);
  }

  private static BackendTransaction read(
      final BackendConnection connection, final String storeName) {
    return connection.begin(storeName, TransactionMode.READ_ONLY, DurabilityHint.DEFAULT);
  }

  @Nested
  @DisplayName("Schema")
  class Schema {

    @Test
    @DisplayName("should create a database at version 1 on first open")
    void shouldCreateDatabase() {
      // Act
      final var connection = adapter.open(DATABASE, null, null);

      // Assert
      assertThat(connection.getVersion()).isEqualTo(1);
      assertThat(connection.storeNames()).isEmpty();
      assertThat(redis.get("kvspace:{shop}:version")).isEqualTo("1");
    }

    @Test
    @DisplayName("should run the upgrade with old and new version and persist the stores")
    void shouldUpgradeSchema() {
      // Arrange
      adapter.open(DATABASE, 1, null);
      final var seen = new int[2];

      // Act
      final var connection =
          adapter.open(
              DATABASE,
              3,
              (editor, oldVersion, newVersion) -> {
                seen[0] = oldVersion;
                seen[1] = newVersion;
                editor.createStore("items");
                editor.createStore("orders");
              });

      // Assert
      assertThat(seen).containsExactly(1, 3);
      assertThat(connection.storeNames()).containsExactlyInAnyOrder("items", "orders");
      assertThat(redis.smembers("kvspace:{shop}:stores"))
          .containsExactlyInAnyOrder("items", "orders");
      assertThat(redis.get("kvspace:{shop}:version")).isEqualTo("3");
    }

    @Test
    @DisplayName("should reject a downgrade")
    void shouldRejectDowngrade() {
      // Arrange
      openWithItems();

      // Act + Assert
      assertThatThrownBy(() -> adapter.open(DATABASE, 1, null))
          .isInstanceOf(BackendException.class)
          .hasMessageContaining("lower than existing version 2");
    }

    @Test
    @DisplayName("should keep the schema when an upgrade fails")
    void shouldKeepSchemaOnFailedUpgrade() {
      // Arrange
      openWithItems();

      // Act
      assertThatThrownBy(
              () ->
                  adapter.open(
                      DATABASE,
                      3,
                      (editor, oldVersion, newVersion) -> {
                        editor.deleteStore("items");
                        throw new IllegalStateException("migration failed");
                      }))
          .hasMessage("migration failed");

      // Assert
      assertThat(redis.get("kvspace:{shop}:version")).isEqualTo("2");
      assertThat(adapter.open(DATABASE, null, null).storeNames()).containsExactly("items");
    }

    @Test
    @DisplayName("should delete the data of a dropped store")
    void shouldDeleteDroppedStoreData() {
      // Arrange
      final var transaction = write(openWithItems());
      transaction.put("a", 1);
      transaction.commit();

      // Act
      final var connection =
          adapter.open(
              DATABASE, 3, (editor, oldVersion, newVersion) -> editor.deleteStore("items"));

      // Assert
      assertThat(connection.storeNames()).isEmpty();
      assertThat(redis.exists("kvspace:{shop}:store:items")).isZero();
    }
  }

  @Nested
  @DisplayName("Transactions")
  class Transactions {

    @Test
    @DisplayName("should make committed writes visible as JSON hash fields")
    void shouldCommitWrites() {
      // Arrange
      final var connection = openWithItems();
      final var write = write(connection);

      // Act
      write.put("user", Map.of("name", "alice"));
      write.put("count", 2);
      write.commit();

      // Assert
      assertThat(redis.hget("kvspace:{shop}:store:items", "user"))
          .isEqualTo("{\"name\":\"alice\"}");
      final var read = read(connection, "items");
      assertThat(read.get("user")).isEqualTo(Map.of("name", "alice"));
      assertThat(read.keys()).containsExactly("count", "user");
      assertThat(read.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("should discard writes of an aborted transaction")
    void shouldDiscardAbortedWrites() {
      // Arrange
      final var connection = openWithItems();
      final var write = write(connection);
      write.put("a", 1);

      // Act
      write.abort();

      // Assert
      assertThat(redis.hlen("kvspace:{shop}:store:items")).isZero();
      final var next = write(connection);
      assertThat(next.get("a")).isNull();
      next.abort();
    }

    @Test
    @DisplayName("should apply clear and deletes before new puts")
    void shouldApplyClearAndDeletes() {
      // Arrange
      final var connection = openWithItems();
      final var seed = write(connection);
      seed.put("a", 1);
      seed.put("b", 2);
      seed.commit();

      // Act
      final var write = write(connection);
      write.clear();
      write.put("c", 3);
      write.commit();

      // Assert
      assertThat(redis.hkeys("kvspace:{shop}:store:items")).containsExactly("c");
    }

    @Test
    @DisplayName("should reject writes in read-only transactions")
    void shouldRejectReadOnlyWrites() {
      // Arrange
      final var read = read(openWithItems(), "items");

      // Act + Assert
      assertThatThrownBy(() -> read.put("a", 1))
          .isInstanceOf(BackendException.class)
          .hasMessageContaining("Read-only");
    }
  }

  @Nested
  @DisplayName("Staleness")
  class Staleness {

    @Test
    @DisplayName("should report VERSION_CHANGED after another process upgraded")
    void shouldDetectForeignUpgrade() {
      // Arrange
      final var connection = openWithItems();
      otherProcess.open(DATABASE, 3, createStore("orders"));

      // Act + Assert
      assertThatThrownBy(() -> read(connection, "items"))
          .isInstanceOfSatisfying(
              StaleConnectionException.class,
              error -> assertThat(error.getReason()).isEqualTo(Reason.VERSION_CHANGED));
    }

    @Test
    @DisplayName("should discard a commit when the schema changed during the transaction")
    void shouldDiscardCommitAfterForeignUpgrade() {
      // Arrange
      final var connection = openWithItems();
      final var write = write(connection);
      write.put("a", 1);
      otherProcess.open(DATABASE, 3, createStore("orders"));

      // Act + Assert
      assertThatThrownBy(write::commit)
          .isInstanceOfSatisfying(
              StaleConnectionException.class,
              error -> assertThat(error.getReason()).isEqualTo(Reason.VERSION_CHANGED));
      assertThat(redis.hexists("kvspace:{shop}:store:items", "a")).isFalse();
    }

    @Test
    @DisplayName("should report STORE_NOT_FOUND for unknown stores")
    void shouldReportMissingStore() {
      // Arrange
      final var connection = openWithItems();

      // Act + Assert
      assertThatThrownBy(() -> read(connection, "missing"))
          .isInstanceOfSatisfying(
              StaleConnectionException.class,
              error -> assertThat(error.getReason()).isEqualTo(Reason.STORE_NOT_FOUND));
    }

    @Test
    @DisplayName("should delete only the dropped database and close its connections")
    void shouldDeleteDatabase() {
      // Arrange
      final var connection = openWithItems();
      adapter.open("other", 1, null);

      // Act
      adapter.deleteDatabase(DATABASE);

      // Assert
      assertThat(redis.keys("kvspace:{shop}:*")).isEmpty();
      assertThat(redis.get("kvspace:{other}:version")).isEqualTo("1");
      assertThatThrownBy(() -> read(connection, "items"))
          .isInstanceOfSatisfying(
              StaleConnectionException.class,
              error -> assertThat(error.getReason()).isEqualTo(Reason.CLOSED));
    }
  }

  @Nested
  @DisplayName("KvSpace on Redis")
  class OnKvSpace {

    @Test
    @DisplayName("should store and read items through the redis driver")
    void shouldRoundTripThroughKvSpace() {
      // Arrange
      try (var runtime = KvSpaceRuntime.create()) {
        runtime.getDrivers().define(adapter);
        final var space =
            KvSpace.create(
                KvSpaceConfig.builder()
                    .name("app")
                    .storeName("settings")
                    .driver(RedisBackendAdapter.DRIVER_NAME)
                    .build(),
                runtime);

        // Act
        space.setItem("theme", "dark").join();
        space.setItem("limits", Map.of("max", 10)).join();

        // Assert
        assertThat(space.driver()).isEqualTo(RedisBackendAdapter.DRIVER_NAME);
        assertThat(space.getItem("theme").join()).isEqualTo("dark");
        assertThat(space.getItem("limits", Map.class).join()).isEqualTo(Map.of("max", 10));
        assertThat(space.keys().join()).containsExactly("limits", "theme");
        assertThat(redis.hget("kvspace:{app}:store:settings", "theme")).isEqualTo("\"dark\"");
      }
    }
  }
}
