/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.transaction;

import com.macstab.oss.kvspace.backend.BackendTransaction;

/**
 * Work executed inside one admitted backend transaction.
 *
 * <p>Returning normally commits; throwing aborts.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface TransactionWork<T> {

  T apply(BackendTransaction transaction) throws Exception;
}
