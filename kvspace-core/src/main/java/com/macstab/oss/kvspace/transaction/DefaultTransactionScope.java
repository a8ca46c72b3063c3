/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.transaction;

import java.util.List;

import com.macstab.oss.kvspace.ItemVisitor;
import com.macstab.oss.kvspace.backend.BackendTransaction;
import com.macstab.oss.kvspace.backend.TransactionMode;
import com.macstab.oss.kvspace.error.ErrorCode;
import com.macstab.oss.kvspace.error.ErrorDetails;
import com.macstab.oss.kvspace.error.KvSpaceException;

import lombok.NonNull;

/** {@link TransactionScope} over a {@link BackendTransaction}. */
public final class DefaultTransactionScope implements TransactionScope {

  private final BackendTransaction transaction;

  public DefaultTransactionScope(@NonNull final BackendTransaction transaction) {
    this.transaction = transaction;
  }

  @Override
  public TransactionMode getMode() {
    return transaction.getMode();
  }

  @Override
  public Object get(final String key) {
    return transaction.get(requireKey(key, "get"));
  }

  @Override
  public void set(final String key, final Object value) {
    checkWritable("set", key);
    transaction.put(requireKey(key, "set"), value);
  }

  @Override
  public void remove(final String key) {
    checkWritable("remove", key);
    transaction.delete(requireKey(key, "remove"));
  }

  @Override
  public List<String> keys() {
    return transaction.keys();
  }

  @Override
  public <T> T iterate(@NonNull final ItemVisitor<T> visitor) {
    final Object[] result = new Object[1];
    final int[] iteration = {0};
    transaction.forEach(
        (key, value) -> {
          result[0] = visitor.visit(value, key, ++iteration[0]);
          return result[0] == null;
        });
    @SuppressWarnings("unchecked")
    final T typed = (T) result[0];
    return typed;
  }

  @Override
  public void clear() {
    checkWritable("clear", null);
    transaction.clear();
  }

  @Override
  public int length() {
    return transaction.count();
  }

  // ==================== Private Methods ====================

  private void checkWritable(final String operation, final String key) {
    if (transaction.getMode() == TransactionMode.READ_ONLY) {
      throw KvSpaceException.of(
          ErrorCode.TRANSACTION_READONLY,
          "Cannot " + operation + " inside a read-only transaction",
          ErrorDetails.of(
              ErrorDetails.OPERATION, operation,
              ErrorDetails.KEY, key,
              ErrorDetails.TRANSACTION_MODE, TransactionMode.READ_ONLY.name()));
    }
  }

  private static String requireKey(final String key, final String operation) {
    if (key == null) {
      throw KvSpaceException.of(
          ErrorCode.INVALID_ARGUMENT,
          "Key must not be null",
          ErrorDetails.of(ErrorDetails.OPERATION, operation));
    }
    return key;
  }
}
