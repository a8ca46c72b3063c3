/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.backend;

/**
 * Callback run by {@link BackendAdapter#open(String, Integer, SchemaUpgrade)} when the requested
 * version is greater than the version on disk.
 *
 * <p>Runs exclusively: no other transaction on the database is active while it executes. If it
 * throws, the version change is rolled back and {@code open} fails.
 */
@FunctionalInterface
public interface SchemaUpgrade {

  /** Upgrade that performs no schema change. */
  SchemaUpgrade NONE = (editor, oldVersion, newVersion) -> {};

  void upgrade(SchemaEditor editor, int oldVersion, int newVersion);
}
