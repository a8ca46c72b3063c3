/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.plugin;

import lombok.Value;

/** Where a plugin error happened; passed to {@link KvSpacePlugin#onError}. */
@Value
public class PluginErrorInfo {
  String plugin;
  PluginOperation operation;
  PluginStage stage;
  /** Key of a single-item operation, {@code null} for batch and lifecycle hooks. */
  String key;
  PluginContext context;
  Throwable error;
}
