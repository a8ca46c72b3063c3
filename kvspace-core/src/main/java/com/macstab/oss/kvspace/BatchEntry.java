/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace;

import lombok.Value;

/** Key/value pair used by batch operations and batch plugin hooks. */
@Value(staticConstructor = "of")
public class BatchEntry {
  String key;
  Object value;

  public BatchEntry withValue(final Object newValue) {
    return of(key, newValue);
  }
}
