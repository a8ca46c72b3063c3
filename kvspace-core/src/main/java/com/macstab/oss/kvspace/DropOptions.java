/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace;

import lombok.Builder;
import lombok.Value;

/**
 * Target of {@link KvSpace#dropInstance(DropOptions)}.
 *
 * <p>Without a name the handle's own database is targeted and, only in that case, the handle's own
 * store. A name without a store name drops the whole database.
 */
@Value
@Builder
public class DropOptions {

  /** Database name; {@code null} means the handle's database. */
  String name;

  /** Store name; {@code null} drops the whole database unless {@link #name} is also null. */
  String storeName;

  /** Drops the handle's own store. */
  public static DropOptions current() {
    return builder().build();
  }

  public static DropOptions database(final String name) {
    return builder().name(name).build();
  }

  public static DropOptions store(final String name, final String storeName) {
    return builder().name(name).storeName(storeName).build();
  }
}
