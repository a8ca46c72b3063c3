/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.plugin;

/** What the pipeline does when a plugin hook throws. */
public enum PluginErrorPolicy {
  /** Rethrow every hook error. */
  STRICT,
  /**
   * Report the error through {@link KvSpacePlugin#onError} (or a warning log) and continue with the
   * value the hook received. Structured errors and {@link PluginAbortException} still propagate.
   */
  LENIENT
}
