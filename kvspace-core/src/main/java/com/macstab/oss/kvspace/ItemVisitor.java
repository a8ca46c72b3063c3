/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace;

/**
 * Visitor for {@link KvSpace#iterate(ItemVisitor)}.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface ItemVisitor<T> {

  /**
   * Visits one entry.
   *
   * @param value stored value (may be {@code null})
   * @param key entry key
   * @param iterationNumber 1-based position of the entry
   * @return {@code null} to continue, any other value stops iteration and becomes its result
   */
  T visit(Object value, String key, int iterationNumber);
}
