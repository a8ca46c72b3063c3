/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.backend;

import lombok.Getter;

/**
 * A {@link BackendConnection} can no longer start transactions.
 *
 * <p>Thrown from {@link BackendConnection#begin(String, TransactionMode, DurabilityHint)}. The core
 * reacts by reconnecting once and retrying the transaction.
 */
@Getter
public class StaleConnectionException extends BackendException {

  private static final long serialVersionUID = 1L;

  /** Why the connection went stale. */
  public enum Reason {
    /** Connection closed locally or by the backend. */
    CLOSED,
    /** Store does not exist in the schema this connection observes. */
    STORE_NOT_FOUND,
    /** Another connection upgraded the database past this connection's version. */
    VERSION_CHANGED
  }

  private final Reason reason;

  public StaleConnectionException(final Reason reason, final String message) {
    super(message);
    this.reason = reason;
  }
}
