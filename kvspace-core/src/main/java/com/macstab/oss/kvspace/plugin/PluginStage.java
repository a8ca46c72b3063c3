/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.plugin;

/** Hook phase in which a plugin error occurred. */
public enum PluginStage {
  INIT,
  DESTROY,
  BEFORE,
  AFTER
}
