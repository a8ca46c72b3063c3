/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.redis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.macstab.oss.kvspace.backend.BackendException;

/**
 * Tests for {@link JacksonValueCodec}.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("JacksonValueCodec")
class JacksonValueCodecTest {

  private final JacksonValueCodec codec = new JacksonValueCodec();

  @Test
  @DisplayName("should write values as JSON")
  void shouldWriteJson() {
    // Act + Assert
    assertThat(codec.encode("alice")).isEqualTo("\"alice\"");
    assertThat(codec.encode(42)).isEqualTo("42");
    assertThat(codec.encode(List.of(1, 2))).isEqualTo("[1,2]");
    assertThat(codec.encode(null)).isEqualTo("null");
  }

  @Test
  @DisplayName("should read JSON objects back as maps")
  void shouldReadObjectsAsMaps() {
    // Arrange
    final var encoded = codec.encode(new Profile("alice", 7));

    // Act
    final var decoded = codec.decode(encoded);

    // Assert
    assertThat(decoded).isEqualTo(Map.of("name", "alice", "level", 7));
  }

  @Test
  @DisplayName("should decode null and JSON null to null")
  void shouldDecodeNull() {
    // Act + Assert
    assertThat(codec.decode(null)).isNull();
    assertThat(codec.decode("null")).isNull();
  }

  @Test
  @DisplayName("should report unreadable and unwritable values as backend errors")
  void shouldReportCodecFailures() {
    // Act + Assert
    assertThatThrownBy(() -> codec.decode("{broken"))
        .isInstanceOf(BackendException.class)
        .hasMessageContaining("not valid JSON");
    assertThatThrownBy(() -> codec.encode(new Object()))
        .isInstanceOf(BackendException.class)
        .hasMessageContaining("java.lang.Object");
  }

  /** JSON-serializable sample value. */
  public record Profile(String name, int level) {}
}
