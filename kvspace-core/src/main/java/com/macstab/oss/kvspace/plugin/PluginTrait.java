/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.plugin;

/**
 * Declared characteristics of a plugin, used for registration-time configuration warnings.
 *
 * @see KvSpacePlugin#getTraits()
 */
public enum PluginTrait {
  /** Transforms values into ciphertext. */
  ENCRYPTS,
  /** Transforms values into a compressed representation. */
  COMPRESSES,
  /** Rejects writes exceeding a storage budget. */
  ENFORCES_QUOTA,
  /** Verifies value integrity (signatures, checksums). */
  VERIFIES_INTEGRITY;

  /** Whether silently ignoring this plugin's errors weakens security or integrity. */
  public boolean isSecuritySensitive() {
    return this != COMPRESSES;
  }
}
