/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace;

import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import com.macstab.oss.kvspace.backend.BackendAdapter;
import com.macstab.oss.kvspace.backend.memory.InMemoryBackendAdapter;
import com.macstab.oss.kvspace.error.ErrorCode;
import com.macstab.oss.kvspace.error.ErrorDetails;
import com.macstab.oss.kvspace.error.KvSpaceException;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Named {@link BackendAdapter}s available to a {@link KvSpaceRuntime}.
 *
 * <p>The in-memory driver ({@value InMemoryBackendAdapter#DRIVER_NAME}) is defined on creation.
 * Defining a name twice replaces the earlier adapter; handles already bound to it keep using the
 * old one.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class DriverRegistry {

  private final ConcurrentMap<String, BackendAdapter> drivers = new ConcurrentHashMap<>();

  public DriverRegistry() {
    drivers.put(InMemoryBackendAdapter.DRIVER_NAME, new InMemoryBackendAdapter());
  }

  /**
   * Defines (or redefines) a driver under its {@link BackendAdapter#getName() name}.
   *
   * @param adapter backend adapter
   * @throws KvSpaceException {@code DRIVER_COMPLIANCE} if the adapter has no usable name or
   *     capability set
   */
  public void define(@NonNull final BackendAdapter adapter) {
    final var name = adapter.getName();
    if (name == null || name.isBlank()) {
      throw KvSpaceException.of(
          ErrorCode.DRIVER_COMPLIANCE,
          "Driver " + adapter.getClass().getName() + " has no name");
    }
    if (adapter.capabilities() == null) {
      throw KvSpaceException.of(
          ErrorCode.DRIVER_COMPLIANCE,
          "Driver '" + name + "' returned null capabilities",
          ErrorDetails.of(ErrorDetails.DRIVER, name));
    }

    final var previous = drivers.put(name, adapter);
    if (log.isInfoEnabled()) {
      if (previous != null && previous != adapter) {
        log.info("Redefined driver '{}' ({})", name, adapter.getClass().getSimpleName());
      } else {
        log.info("Defined driver '{}' ({})", name, adapter.getClass().getSimpleName());
      }
    }
  }

  /**
   * Looks a driver up.
   *
   * @throws KvSpaceException {@code DRIVER_NOT_FOUND} if no driver has that name
   */
  public BackendAdapter getDriver(@NonNull final String name) {
    final var adapter = drivers.get(name);
    if (adapter == null) {
      throw KvSpaceException.of(
          ErrorCode.DRIVER_NOT_FOUND,
          "No driver named '" + name + "' is defined",
          ErrorDetails.of(ErrorDetails.DRIVER, name));
    }
    return adapter;
  }

  /** Whether {@code name} is defined and usable in this environment. */
  public boolean supports(final String name) {
    final var adapter = name == null ? null : drivers.get(name);
    return adapter != null && adapter.isSupported();
  }

  /**
   * Removes a driver.
   *
   * @return {@code true} if it was defined
   */
  public boolean unregister(final String name) {
    return name != null && drivers.remove(name) != null;
  }

  /** Defined driver names, sorted. */
  public Set<String> getDriverNames() {
    return new TreeSet<>(drivers.keySet());
  }
}
