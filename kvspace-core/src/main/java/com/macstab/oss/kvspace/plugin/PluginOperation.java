/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.plugin;

/** Operation a {@link PluginContext} was created for. */
public enum PluginOperation {
  SET_ITEM,
  GET_ITEM,
  REMOVE_ITEM,
  SET_ITEMS,
  GET_ITEMS,
  REMOVE_ITEMS,
  /** {@code onInit} / {@code onDestroy}. */
  LIFECYCLE
}
