/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.connection;

import com.macstab.oss.kvspace.KvSpaceConfig;
import com.macstab.oss.kvspace.backend.BackendConnection;

import lombok.Getter;
import lombok.NonNull;

/**
 * Registration of one store handle inside a {@link ConnectionContext}.
 *
 * <p>{@code version} starts at the configured version and is updated to the effective on-disk
 * version whenever the context installs a connection (downgrades are pinned to the higher value).
 * A {@code null} or closed {@code connection} means the cached handle is stale. A detached binding
 * belongs to a context whose database was dropped; its owner must acquire a fresh context.
 */
@Getter
public final class StoreBinding {

  private final KvSpaceConfig config;
  private volatile int version;
  private volatile BackendConnection connection;
  private volatile boolean detached;

  public StoreBinding(@NonNull final KvSpaceConfig config) {
    this.config = config;
    this.version = config.getVersion();
  }

  public String getStoreName() {
    return config.getStoreName();
  }

  /** Whether the cached connection is missing or closed. */
  public boolean isStale() {
    final var current = connection;
    return current == null || !current.isOpen();
  }

  void setVersion(final int version) {
    this.version = version;
  }

  void setConnection(final BackendConnection connection) {
    this.connection = connection;
  }

  void detach() {
    this.detached = true;
    this.connection = null;
  }

  @Override
  public String toString() {
    return "StoreBinding[" + getStoreName() + " v" + version + (detached ? ", detached" : "") + "]";
  }
}
