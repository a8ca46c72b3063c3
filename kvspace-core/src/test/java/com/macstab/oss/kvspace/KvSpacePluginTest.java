/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace;

import static com.macstab.oss.kvspace.FutureAssertions.result;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.macstab.oss.kvspace.plugin.KvSpacePlugin;
import com.macstab.oss.kvspace.plugin.PluginAbortException;
import com.macstab.oss.kvspace.plugin.PluginContext;

/**
 * Tests for plugin hooks wired through {@link KvSpace} operations.
 *
 * <p><strong>Test Strategy:</strong> a plugin-free handle on the same store reads what was
 * physically stored, so value transformations are visible end to end.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("KvSpace plugins")
class KvSpacePluginTest {

  private static final String DATABASE = "plugged";

  private KvSpaceRuntime runtime;
  private List<String> calls;

  @BeforeEach
  void setUp() {
    runtime = KvSpaceRuntime.create();
    calls = new CopyOnWriteArrayList<>();
  }

  @AfterEach
  void tearDown() {
    runtime.close();
  }

  private KvSpace space() {
    return KvSpace.create(
        KvSpaceConfig.builder().name(DATABASE).storeName("items").build(), runtime);
  }

  /** Prefixes stored values and strips the prefix on read. */
  private KvSpacePlugin envelope() {
    return new KvSpacePlugin() {
      @Override
      public String getName() {
        return "envelope";
      }

      @Override
      public Object beforeSet(final String key, final Object value, final PluginContext context) {
        calls.add("beforeSet:" + key + ":" + context.isBatch() + ":" + context.getBatchSize());
        return "enc:" + value;
      }

      @Override
      public Object afterGet(final String key, final Object value, final PluginContext context) {
        return value instanceof String text && text.startsWith("enc:")
            ? text.substring("enc:".length())
            : value;
      }

      @Override
      public List<BatchEntry> beforeSetItems(
          final List<BatchEntry> entries, final PluginContext context) {
        calls.add("beforeSetItems:" + entries.size());
        return entries;
      }
    };
  }

  /** Maps every key into a tenant namespace. */
  private static KvSpacePlugin tenant() {
    return new KvSpacePlugin() {
      @Override
      public String getName() {
        return "tenant";
      }

      @Override
      public String beforeGet(final String key, final PluginContext context) {
        return "t1:" + key;
      }

      @Override
      public String beforeRemove(final String key, final PluginContext context) {
        return "t1:" + key;
      }
    };
  }

  @Nested
  @DisplayName("Single Items")
  class SingleItems {

    @Test
    @DisplayName("should transform values on write and restore them on read")
    void shouldTransformValues() {
      // Arrange
      final var space = space().use(envelope());

      // Act
      final var returned = result(space.setItem("a", "secret"));

      // Assert
      assertThat(returned).isEqualTo("secret");
      assertThat(result(space.getItem("a"))).isEqualTo("secret");
      assertThat(result(space().getItem("a"))).isEqualTo("enc:secret");
      assertThat(calls).containsExactly("beforeSet:a:false:1");
    }

    @Test
    @DisplayName("should return the value a plugin placed in the operation state")
    void shouldReturnPluginReturnValue() {
      // Arrange
      final var space =
          space()
              .use(
                  new KvSpacePlugin() {
                    @Override
                    public String getName() {
                      return "receipt";
                    }

                    @Override
                    public void afterSet(
                        final String key, final Object value, final PluginContext context) {
                      context.getOperationState().put(PluginContext.RETURN_VALUE, "receipt");
                    }
                  });

      // Act
      final var returned = result(space.setItem("a", 1));

      // Assert
      assertThat(returned).isEqualTo("receipt");
    }

    @Test
    @DisplayName("should fail the operation with the plugin's abort")
    void shouldFailWithAbort() {
      // Arrange
      final var abort = new PluginAbortException("read-only tenant");
      final var space =
          space()
              .use(
                  new KvSpacePlugin() {
                    @Override
                    public String getName() {
                      return "guard";
                    }

                    @Override
                    public Object beforeSet(
                        final String key, final Object value, final PluginContext context) {
                      throw abort;
                    }
                  });
      final var write = space.setItem("a", 1);

      // Act + Assert
      assertThatThrownBy(write::join)
          .isInstanceOf(CompletionException.class)
          .satisfies(error -> assertThat(error.getCause()).isSameAs(abort));
      assertThat(result(space().getItem("a"))).isNull();
    }

    @Test
    @DisplayName("should rewrite keys for reads and removals")
    void shouldRewriteKeys() {
      // Arrange
      result(space().setItem("t1:user", "alice"));
      final var space = space().use(tenant());

      // Act
      final var read = result(space.getItem("user"));
      result(space.removeItem("user"));

      // Assert
      assertThat(read).isEqualTo("alice");
      assertThat(result(space().keys())).isEmpty();
    }
  }

  @Nested
  @DisplayName("Batches")
  class Batches {

    @Test
    @DisplayName("should run the batch hook once and item hooks per entry")
    void shouldRunBatchAndItemHooks() {
      // Arrange
      final var space = space().use(envelope());

      // Act
      final var returned = result(space.setItems(Map.of("a", "1")));
      result(space.setItems(List.of(BatchEntry.of("b", "2"), BatchEntry.of("c", "3"))));

      // Assert
      assertThat(returned).containsExactly(BatchEntry.of("a", "1"));
      assertThat(calls)
          .containsExactly(
              "beforeSetItems:1",
              "beforeSet:a:true:1",
              "beforeSetItems:2",
              "beforeSet:b:true:2",
              "beforeSet:c:true:2");
      assertThat(result(space().getItem("b"))).isEqualTo("enc:2");
    }

    @Test
    @DisplayName("should report batch reads under the requested keys")
    void shouldReportBatchReadsUnderRequestedKeys() {
      // Arrange
      result(space().setItems(Map.of("t1:a", 1, "t1:b", 2)));
      final var space = space().use(tenant());

      // Act
      final var read = result(space.getItems(List.of("b", "missing", "a")));

      // Assert
      assertThat(read)
          .containsExactly(
              BatchEntry.of("b", 2), BatchEntry.of("missing", null), BatchEntry.of("a", 1));
    }

    @Test
    @DisplayName("should remove rewritten keys in one batch")
    void shouldRemoveRewrittenKeys() {
      // Arrange
      result(space().setItems(Map.of("t1:a", 1, "t1:b", 2, "other", 3)));
      final var space = space().use(tenant());

      // Act
      result(space.removeItems(List.of("a", "b")));

      // Assert
      assertThat(result(space().keys())).containsExactly("other");
    }
  }
}
