/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.plugin;

import java.util.Comparator;

import lombok.Value;

/**
 * A plugin registered in a {@link PluginPipeline}.
 *
 * <p>{@code id} is stable for the pipeline's lifetime and keys the pipeline's lifecycle table.
 * {@code priority} is captured at registration.
 */
@Value
public class PluginRegistration {

  /** Priority descending, then registration order ascending. */
  public static final Comparator<PluginRegistration> EXECUTION_ORDER =
      Comparator.comparingInt(PluginRegistration::getPriority)
          .reversed()
          .thenComparingInt(PluginRegistration::getOrder);

  String id;
  int order;
  int priority;
  KvSpacePlugin plugin;

  public String getName() {
    return plugin.getName();
  }
}
