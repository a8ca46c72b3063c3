/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.backend;

import java.util.Set;

/** Schema mutations available inside a {@link SchemaUpgrade} callback. */
public interface SchemaEditor {

  boolean containsStore(String storeName);

  Set<String> storeNames();

  /** Creates {@code storeName}; no-op if it already exists. */
  void createStore(String storeName);

  /** Deletes {@code storeName} and all its entries; no-op if it does not exist. */
  void deleteStore(String storeName);
}
