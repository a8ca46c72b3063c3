/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.redis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.macstab.oss.kvspace.backend.BackendCapability;
import com.macstab.oss.kvspace.backend.BackendException;

import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisConnectionException;

/**
 * Unit tests for {@link RedisBackendAdapter} without a Redis server.
 *
 * <p><strong>Test Strategy:</strong> a mocked {@link RedisClient} covers connection failures and
 * lifecycle. Behavior against a real server lives in {@link RedisBackendAdapterIntegrationTest}.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("RedisBackendAdapter")
class RedisBackendAdapterTest {

  @Mock private RedisClient client;

  private AutoCloseable mocks;
  private RedisBackendAdapter adapter;

  @BeforeEach
  void setUp() {
    mocks = MockitoAnnotations.openMocks(this);
    adapter = new RedisBackendAdapter(client);
  }

  @AfterEach
  void tearDown() throws Exception {
    mocks.close();
  }

  @Test
  @DisplayName("should declare drop capabilities but no durability hint")
  void shouldDeclareCapabilities() {
    // Act + Assert
    assertThat(adapter.getName()).isEqualTo(RedisBackendAdapter.DRIVER_NAME);
    assertThat(adapter.supports(BackendCapability.DROP_DATABASE)).isTrue();
    assertThat(adapter.supports(BackendCapability.DROP_STORE)).isTrue();
    assertThat(adapter.supports(BackendCapability.DURABILITY_HINT)).isFalse();
  }

  @Test
  @DisplayName("should report an unreachable server as a backend error")
  void shouldWrapConnectionFailure() {
    // Arrange
    when(client.connect()).thenThrow(new RedisConnectionException("Connection refused"));

    // Act + Assert
    assertThatThrownBy(() -> adapter.open("users", 1, null))
        .isInstanceOf(BackendException.class)
        .hasMessageContaining("Connection refused")
        .hasCauseInstanceOf(RedisConnectionException.class);
  }

  @Test
  @DisplayName("should reject versions below one before contacting Redis")
  void shouldRejectInvalidVersion() {
    // Act + Assert
    assertThatThrownBy(() -> adapter.open("users", 0, null))
        .isInstanceOf(BackendException.class)
        .hasMessageContaining("must be >= 1");
    verify(client, never()).connect();
  }

  @Test
  @DisplayName("should become unsupported and refuse to connect after close")
  void shouldRefuseAfterClose() {
    // Act
    adapter.close();

    // Assert
    assertThat(adapter.isSupported()).isFalse();
    assertThatThrownBy(() -> adapter.open("users", 1, null))
        .isInstanceOf(BackendException.class)
        .hasMessageContaining("closed");
    verify(client, never()).connect();
  }
}
