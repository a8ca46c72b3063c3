/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.error;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.experimental.UtilityClass;

/** Detail keys used in {@link KvSpaceException#getDetails()}. */
@UtilityClass
public class ErrorDetails {

  public static final String OPERATION = "operation";
  public static final String KEY = "key";
  public static final String DRIVER = "driver";
  public static final String DB_NAME = "dbName";
  public static final String STORE_NAME = "storeName";
  public static final String TRANSACTION_MODE = "transactionMode";
  public static final String CONFIG_KEY = "configKey";
  public static final String ATTEMPTED_DRIVERS = "attemptedDrivers";
  public static final String PLUGIN = "plugin";
  public static final String CAUSE_NAME = "causeName";
  public static final String CAUSE_MESSAGE = "causeMessage";

  /**
   * Builds a details map from alternating key/value pairs, skipping {@code null} values.
   *
   * @throws IllegalArgumentException if {@code pairs} has odd length
   */
  public static Map<String, Object> of(final Object... pairs) {
    if (pairs.length % 2 != 0) {
      throw new IllegalArgumentException(
          "Detail pairs must have even length (key-value pairs), got: " + pairs.length);
    }
    final var details = new LinkedHashMap<String, Object>();
    for (int i = 0; i < pairs.length; i += 2) {
      if (pairs[i + 1] != null) {
        details.put(String.valueOf(pairs[i]), pairs[i + 1]);
      }
    }
    return details;
  }
}
