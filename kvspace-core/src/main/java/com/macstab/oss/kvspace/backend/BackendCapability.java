/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.backend;

/**
 * Optional features a {@link BackendAdapter} may declare.
 *
 * <p>Operations requiring a capability the active backend does not declare fail with {@code
 * UNSUPPORTED_OPERATION}; capabilities are never probed reflectively.
 */
public enum BackendCapability {
  /** {@link BackendAdapter#deleteDatabase(String)} is implemented. */
  DROP_DATABASE,
  /** {@link SchemaEditor#deleteStore(String)} is implemented during upgrades. */
  DROP_STORE,
  /** {@link DurabilityHint} values other than {@code DEFAULT} are honoured. */
  DURABILITY_HINT
}
