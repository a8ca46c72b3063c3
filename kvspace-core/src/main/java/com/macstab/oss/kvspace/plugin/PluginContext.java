/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.plugin;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentMap;

import com.macstab.oss.kvspace.KvSpace;
import com.macstab.oss.kvspace.KvSpaceConfig;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * Per-operation context handed to every plugin hook.
 *
 * <p><strong>Two bags:</strong>
 *
 * <ul>
 *   <li>{@link #getMetadata()}: shared by every context of one pipeline for the lifetime of the
 *       owning {@link KvSpace}. For persistent plugin state such as timers. Does not accept {@code
 *       null} values.
 *   <li>{@link #getOperationState()}: fresh per context. Carries values between the before and
 *       after hooks of one operation, and batch markers ({@link #IS_BATCH}, {@link #BATCH_SIZE}).
 * </ul>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Getter
@Builder
public final class PluginContext {

  /** Value passed by the caller to {@code setItem}, before any plugin ran. */
  public static final String ORIGINAL_VALUE = "originalValue";

  /** When set by a plugin, returned to the caller of {@code setItem} instead of the original. */
  public static final String RETURN_VALUE = "returnValue";

  /** Present and {@code true} in contexts created for batch operations and their items. */
  public static final String IS_BATCH = "isBatch";

  /** Number of items of the enclosing batch operation. */
  public static final String BATCH_SIZE = "batchSize";

  @NonNull private final PluginOperation operation;
  private final KvSpace instance;
  /** Active driver name, {@code null} before a driver was selected. */
  private final String driver;
  @NonNull private final KvSpaceConfig config;
  @NonNull private final ConcurrentMap<String, Object> metadata;
  @Builder.Default private final Map<String, Object> operationState = new HashMap<>();

  public boolean isBatch() {
    return Boolean.TRUE.equals(operationState.get(IS_BATCH));
  }

  /** Batch size, or 1 for standalone operations. */
  public int getBatchSize() {
    final var size = operationState.get(BATCH_SIZE);
    return size instanceof Integer value ? value : 1;
  }

  /** Marks this context as belonging to a batch of {@code size} items. */
  public void markBatch(final int size) {
    operationState.put(IS_BATCH, Boolean.TRUE);
    operationState.put(BATCH_SIZE, size);
  }
}
