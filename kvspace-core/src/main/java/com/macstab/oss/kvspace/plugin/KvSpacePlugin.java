/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.plugin;

import java.util.List;
import java.util.Set;

import com.macstab.oss.kvspace.BatchEntry;

/**
 * Extension wrapping every key/value operation of a {@code KvSpace} handle.
 *
 * <p><strong>Ordering:</strong> plugins run in priority order (higher first, ties by registration
 * order) in the {@code before*} phase and in the reverse order in the {@code after*} phase, like a
 * stack: the plugin that transformed a value last on write is the first to untransform it on read.
 *
 * <pre>
 * setItem: beforeSet(P1) ─▶ beforeSet(P2) ─▶ store ─▶ afterSet(P2) ─▶ afterSet(P1)
 * getItem: beforeGet(P1) ─▶ beforeGet(P2) ─▶ load  ─▶ afterGet(P2) ─▶ afterGet(P1)
 * </pre>
 *
 * <p><strong>Value hooks</strong> return the (possibly transformed) value or key handed to the next
 * plugin. The defaults pass their input through, so a plugin overrides only what it needs.
 *
 * <p><strong>Batches:</strong> {@code setItems}/{@code getItems}/{@code removeItems} run the batch
 * hooks once, then the single-item hooks once per item. Item contexts are marked with {@link
 * PluginContext#IS_BATCH} and {@link PluginContext#BATCH_SIZE}.
 *
 * <p><strong>Errors:</strong> hook exceptions are handled per {@link PluginErrorPolicy}. Throw
 * {@link PluginAbortException} to abort the operation regardless of policy.
 *
 * <p><strong>Threading:</strong> hooks run on kvspace worker threads and may block briefly. One
 * plugin instance may see concurrent calls from concurrent operations.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
public interface KvSpacePlugin {

  String getName();

  /** Higher runs earlier in the before phase. Default 0. */
  default int getPriority() {
    return 0;
  }

  /** Declared characteristics used for configuration warnings. */
  default Set<PluginTrait> getTraits() {
    return Set.of();
  }

  /**
   * Whether the plugin participates in the current operation. Returning {@code false} skips it for
   * this operation only; throwing disables it permanently for the pipeline.
   */
  default boolean isEnabled(final PluginContext context) throws Exception {
    return true;
  }

  /** Called once before the first operation that uses this plugin. */
  default void onInit(final PluginContext context) throws Exception {}

  /** Called once when the owning handle is destroyed. */
  default void onDestroy(final PluginContext context) throws Exception {}

  default Object beforeSet(final String key, final Object value, final PluginContext context)
      throws Exception {
    return value;
  }

  /**
   * Observes a completed set.
   *
   * @param value the value as stored, after every {@code beforeSet}
   */
  default void afterSet(final String key, final Object value, final PluginContext context)
      throws Exception {}

  /** Returns the key to load; {@code null} keeps the input key. */
  default String beforeGet(final String key, final PluginContext context) throws Exception {
    return key;
  }

  default Object afterGet(final String key, final Object value, final PluginContext context)
      throws Exception {
    return value;
  }

  /** Returns the key to remove; {@code null} keeps the input key. */
  default String beforeRemove(final String key, final PluginContext context) throws Exception {
    return key;
  }

  default void afterRemove(final String key, final PluginContext context) throws Exception {}

  default List<BatchEntry> beforeSetItems(
      final List<BatchEntry> entries, final PluginContext context) throws Exception {
    return entries;
  }

  default List<BatchEntry> afterSetItems(
      final List<BatchEntry> entries, final PluginContext context) throws Exception {
    return entries;
  }

  default List<String> beforeGetItems(final List<String> keys, final PluginContext context)
      throws Exception {
    return keys;
  }

  default List<BatchEntry> afterGetItems(
      final List<BatchEntry> entries, final PluginContext context) throws Exception {
    return entries;
  }

  default List<String> beforeRemoveItems(final List<String> keys, final PluginContext context)
      throws Exception {
    return keys;
  }

  default void afterRemoveItems(final List<String> keys, final PluginContext context)
      throws Exception {}

  /**
   * Receives errors of this plugin's hooks that the pipeline does not propagate, and every init and
   * destroy error.
   *
   * @return {@code true} if handled; {@code false} lets the pipeline log a warning
   */
  default boolean onError(final Throwable error, final PluginErrorInfo info) {
    return false;
  }
}
