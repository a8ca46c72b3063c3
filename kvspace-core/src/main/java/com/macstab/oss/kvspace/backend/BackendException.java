/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.backend;

/**
 * Failure raised by a {@link BackendAdapter} implementation.
 *
 * <p>Never reaches application code directly: the core maps it onto a {@code KvSpaceException}
 * with {@code OPERATION_FAILED} (or a more specific code for the subclasses).
 */
public class BackendException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public BackendException(final String message) {
    super(message);
  }

  public BackendException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
