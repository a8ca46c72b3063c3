/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.coalesce;

import lombok.Value;

/**
 * Snapshot of write-coalescing statistics for one database.
 *
 * <ul>
 *   <li>{@code totalWrites}: writes submitted to the coalescing buffer
 *   <li>{@code coalescedWrites}: writes applied through a coalesced transaction
 *   <li>{@code transactionsSaved}: for each coalesced transaction of {@code n} writes, {@code n -
 *       1}
 * </ul>
 */
@Value
public class WriteStatistics {

  public static final WriteStatistics EMPTY = new WriteStatistics(0, 0, 0);

  long totalWrites;
  long coalescedWrites;
  long transactionsSaved;
}
