/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.connection;

/**
 * Lifecycle state of a {@link ConnectionContext}.
 *
 * <pre>
 * CLOSED -&gt; OPENING -&gt; OPEN
 * OPEN -&gt; UPGRADING -&gt; OPEN
 * OPEN -&gt; CLOSED          (idle timer, drop)
 * any  -&gt; FAILED          (open failure; next operation re-attempts OPENING)
 * </pre>
 */
public enum ConnectionState {
  CLOSED,
  OPENING,
  OPEN,
  UPGRADING,
  FAILED
}
