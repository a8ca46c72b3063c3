/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace;

/** How reads interact with writes still buffered by write coalescing. */
public enum ReadConsistency {
  /** Reads first drain pending and in-flight coalesced writes of the database. */
  STRONG,
  /** Reads never wait; they may observe state older than recently submitted writes. */
  EVENTUAL
}
