/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.error;

/**
 * Kinds of failure surfaced by kvspace.
 *
 * <p>Codes describe the <em>kind</em> of failure, never the Java type that caused it. Backend
 * failures are mapped onto one of these codes before they reach a caller or a plugin hook.
 */
public enum ErrorCode {
  /** {@code config(...)} called after the handle started initializing. */
  CONFIG_LOCKED,
  /** A configuration value is invalid (negative window, fire-and-forget with strong reads...). */
  INVALID_CONFIG,
  /** A defined driver does not satisfy the adapter contract. */
  DRIVER_COMPLIANCE,
  /** No driver registered under the requested name. */
  DRIVER_NOT_FOUND,
  /** No configured driver could be initialized, or the backend is gone after a retry. */
  DRIVER_UNAVAILABLE,
  /** Operation attempted on a handle whose driver never initialized. */
  DRIVER_NOT_INITIALIZED,
  /** The active backend lacks the capability the operation needs. */
  UNSUPPORTED_OPERATION,
  /** A caller supplied an illegal argument (null key, empty name...). */
  INVALID_ARGUMENT,
  /** Mutation attempted inside a read-only transaction scope. */
  TRANSACTION_READONLY,
  SERIALIZATION_FAILED,
  DESERIALIZATION_FAILED,
  /** Generic operation failure wrapping a backend error. */
  OPERATION_FAILED,
  /** The backend (or a quota plugin) refused a write because storage is exhausted. */
  QUOTA_EXCEEDED,
  UNKNOWN
}
