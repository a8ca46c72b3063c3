/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.plugin;

/**
 * Thrown by a plugin hook to abort the current operation.
 *
 * <p>Always propagates to the caller regardless of {@link PluginErrorPolicy}.
 */
public class PluginAbortException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public PluginAbortException() {
    this("Plugin aborted the operation");
  }

  public PluginAbortException(final String message) {
    super(message);
  }

  public PluginAbortException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
