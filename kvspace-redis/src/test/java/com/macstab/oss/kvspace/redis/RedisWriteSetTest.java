/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.redis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link RedisWriteSet}.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("RedisWriteSet")
class RedisWriteSetTest {

  @Test
  @DisplayName("should keep only the last write per key")
  void shouldKeepLastWritePerKey() {
    // Arrange
    final var writes = new RedisWriteSet();

    // Act
    writes.put("a", 1);
    writes.delete("a");
    writes.delete("b");
    writes.put("b", 2);

    // Assert
    assertThat(writes.getPuts()).containsExactly(entry("b", 2));
    assertThat(writes.getDeletes()).containsExactly("a");
    assertThat(writes.isEmpty()).isFalse();
  }

  @Test
  @DisplayName("should drop earlier writes on clear and skip deletes after it")
  void shouldResetOnClear() {
    // Arrange
    final var writes = new RedisWriteSet();
    writes.put("a", 1);
    writes.delete("b");

    // Act
    writes.clear();
    writes.delete("c");
    writes.put("d", 4);

    // Assert
    assertThat(writes.isCleared()).isTrue();
    assertThat(writes.getDeletes()).isEmpty();
    assertThat(writes.getPuts()).containsOnlyKeys("d");
  }

  @Test
  @DisplayName("should be empty before any write")
  void shouldStartEmpty() {
    // Act + Assert
    assertThat(new RedisWriteSet().isEmpty()).isTrue();
  }
}
