/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.macstab.oss.kvspace.backend.BackendAdapter;
import com.macstab.oss.kvspace.backend.BackendCapability;
import com.macstab.oss.kvspace.backend.BackendConnection;
import com.macstab.oss.kvspace.backend.SchemaUpgrade;
import com.macstab.oss.kvspace.backend.memory.InMemoryBackendAdapter;
import com.macstab.oss.kvspace.error.ErrorCode;
import com.macstab.oss.kvspace.error.ErrorDetails;
import com.macstab.oss.kvspace.error.KvSpaceException;

/**
 * Tests for {@link DriverRegistry}.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("DriverRegistry")
class DriverRegistryTest {

  private DriverRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new DriverRegistry();
  }

  @Test
  @DisplayName("should define the in-memory driver on creation")
  void shouldDefineInMemoryDriver() {
    // Act + Assert
    assertThat(registry.getDriverNames()).containsExactly(InMemoryBackendAdapter.DRIVER_NAME);
    assertThat(registry.supports(InMemoryBackendAdapter.DRIVER_NAME)).isTrue();
  }

  @Test
  @DisplayName("should replace a driver defined under the same name")
  void shouldReplaceDriverWithSameName() {
    // Arrange
    final var replacement = new InMemoryBackendAdapter();

    // Act
    registry.define(replacement);

    // Assert
    assertThat(registry.getDriver(InMemoryBackendAdapter.DRIVER_NAME)).isSameAs(replacement);
  }

  @Test
  @DisplayName("should report DRIVER_NOT_FOUND for unknown names")
  void shouldReportDriverNotFound() {
    // Act + Assert
    assertThatThrownBy(() -> registry.getDriver("nosuch"))
        .isInstanceOfSatisfying(
            KvSpaceException.class,
            error -> {
              assertThat(error.getCode()).isEqualTo(ErrorCode.DRIVER_NOT_FOUND);
              assertThat(error.getDetail(ErrorDetails.DRIVER)).isEqualTo("nosuch");
            });
    assertThat(registry.supports("nosuch")).isFalse();
    assertThat(registry.supports(null)).isFalse();
  }

  @Test
  @DisplayName("should reject drivers without a name or capability set")
  void shouldRejectNonCompliantDrivers() {
    // Act + Assert
    assertThatThrownBy(() -> registry.define(new StubAdapter(" ", Set.of(), true)))
        .isInstanceOfSatisfying(
            KvSpaceException.class,
            error -> assertThat(error.getCode()).isEqualTo(ErrorCode.DRIVER_COMPLIANCE));
    assertThatThrownBy(() -> registry.define(new StubAdapter("stub", null, true)))
        .isInstanceOfSatisfying(
            KvSpaceException.class,
            error -> assertThat(error.getCode()).isEqualTo(ErrorCode.DRIVER_COMPLIANCE));
  }

  @Test
  @DisplayName("should not support a defined driver that is unusable here")
  void shouldNotSupportUnusableDriver() {
    // Arrange
    registry.define(new StubAdapter("offline", Set.of(), false));

    // Act + Assert
    assertThat(registry.getDriverNames()).contains("offline");
    assertThat(registry.supports("offline")).isFalse();
    assertThat(registry.unregister("offline")).isTrue();
    assertThat(registry.unregister("offline")).isFalse();
  }

  /** Adapter with a configurable name, capability set and support flag. */
  private static final class StubAdapter implements BackendAdapter {

    private final String name;
    private final Set<BackendCapability> capabilities;
    private final boolean supported;

    private StubAdapter(
        final String name, final Set<BackendCapability> capabilities, final boolean supported) {
      this.name = name;
      this.capabilities = capabilities;
      this.supported = supported;
    }

    @Override
    public String getName() {
      return name;
    }

    @Override
    public boolean isSupported() {
      return supported;
    }

    @Override
    public Set<BackendCapability> capabilities() {
      return capabilities;
    }

    @Override
    public BackendConnection open(
        final String databaseName, final Integer version, final SchemaUpgrade upgrade) {
      throw new UnsupportedOperationException("stub");
    }
  }
}
