/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.backend;

/**
 * Durability preference passed to read-write transactions.
 *
 * <p>Only honoured by backends declaring {@link BackendCapability#DURABILITY_HINT}; other backends
 * always receive {@link #DEFAULT}.
 */
public enum DurabilityHint {
  DEFAULT,
  /** Commit returns only once data is flushed to durable storage. */
  STRICT,
  /** Commit may return before data reaches durable storage. */
  RELAXED
}
