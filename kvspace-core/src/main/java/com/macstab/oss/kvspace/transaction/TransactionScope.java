/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.transaction;

import java.util.List;

import com.macstab.oss.kvspace.ItemVisitor;
import com.macstab.oss.kvspace.backend.TransactionMode;

/**
 * Key/value operations bound to one underlying transaction.
 *
 * <p>Handed to the function passed to {@code KvSpace.runTransaction}. Valid only while that
 * function runs. Read-only scopes reject {@link #set}, {@link #remove} and {@link #clear} with
 * {@code TRANSACTION_READONLY} and leave state unchanged. Plugins do not run inside a scope.
 */
public interface TransactionScope {

  TransactionMode getMode();

  Object get(String key);

  void set(String key, Object value);

  void remove(String key);

  List<String> keys();

  /**
   * Iterates entries in key order.
   *
   * @return the first non-null visitor result, or {@code null}
   */
  <T> T iterate(ItemVisitor<T> visitor);

  void clear();

  int length();
}
