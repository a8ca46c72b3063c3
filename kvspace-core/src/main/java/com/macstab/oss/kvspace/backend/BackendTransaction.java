/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.backend;

import java.util.List;

/**
 * Single backend transaction on one store.
 *
 * <p>Exactly one of {@link #commit()} or {@link #abort()} ends it. Data calls and {@code commit()}
 * after that throw {@link IllegalStateException}. Mutations on a {@link TransactionMode#READ_ONLY}
 * transaction throw {@link BackendException}. Values are opaque to the backend; {@code null} is a
 * legal value and indistinguishable from an absent key on {@link #get(String)}.
 */
public interface BackendTransaction {

  TransactionMode getMode();

  Object get(String key);

  void put(String key, Object value);

  void delete(String key);

  void clear();

  int count();

  /** Keys in the backend's iteration order. */
  List<String> keys();

  /**
   * Visits entries in key order until the visitor returns {@code false}.
   *
   * @param visitor entry visitor
   */
  void forEach(EntryVisitor visitor);

  /** Makes staged writes visible atomically. */
  void commit();

  /** Discards staged writes. Idempotent once the transaction has ended. */
  void abort();

  /** Visitor for {@link #forEach(EntryVisitor)}. */
  @FunctionalInterface
  interface EntryVisitor {

    /**
     * @return {@code true} to continue, {@code false} to stop
     */
    boolean visit(String key, Object value);
  }
}
