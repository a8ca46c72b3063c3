/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.backend;

/** The backend refused a write because its storage quota is exhausted. */
public class QuotaExceededException extends BackendException {

  private static final long serialVersionUID = 1L;

  public QuotaExceededException(final String message) {
    super(message);
  }
}
