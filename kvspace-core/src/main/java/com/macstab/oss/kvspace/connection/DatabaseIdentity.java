/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.connection;

import lombok.NonNull;
import lombok.Value;

/**
 * Physical database identity: every handle with an equal identity shares one {@link
 * ConnectionContext}.
 */
@Value
public class DatabaseIdentity {

  @NonNull String driver;
  @NonNull String name;
  String bucket;

  /** Name passed to the backend: {@code name} or {@code name/bucket}. */
  public String physicalName() {
    return bucket == null || bucket.isEmpty() ? name : name + "/" + bucket;
  }

  @Override
  public String toString() {
    return driver + ":" + physicalName();
  }
}
