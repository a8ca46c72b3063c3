/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.backend;

/** Access mode of a backend transaction. */
public enum TransactionMode {
  READ_ONLY,
  READ_WRITE
}
