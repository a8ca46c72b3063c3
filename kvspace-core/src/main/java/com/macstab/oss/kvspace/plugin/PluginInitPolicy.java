/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.plugin;

/** What the pipeline does when {@link KvSpacePlugin#onInit} throws. */
public enum PluginInitPolicy {
  /** Propagate the error; the operation that triggered initialization fails. */
  FAIL,
  /** Disable the plugin permanently for this pipeline and continue without it. */
  DISABLE_AND_CONTINUE
}
