/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;

import com.macstab.oss.kvspace.backend.BackendAdapter;
import com.macstab.oss.kvspace.backend.BackendCapability;
import com.macstab.oss.kvspace.backend.TransactionMode;
import com.macstab.oss.kvspace.coalesce.WriteStatistics;
import com.macstab.oss.kvspace.connection.DatabaseIdentity;
import com.macstab.oss.kvspace.connection.StoreBinding;
import com.macstab.oss.kvspace.error.ErrorCode;
import com.macstab.oss.kvspace.error.ErrorDetails;
import com.macstab.oss.kvspace.error.KvSpaceException;
import com.macstab.oss.kvspace.internal.Futures;
import com.macstab.oss.kvspace.plugin.KvSpacePlugin;
import com.macstab.oss.kvspace.plugin.PluginContext;
import com.macstab.oss.kvspace.plugin.PluginOperation;
import com.macstab.oss.kvspace.plugin.PluginPipeline;
import com.macstab.oss.kvspace.transaction.TransactionScope;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Asynchronous key/value store handle bound to one store of one database.
 *
 * <p><strong>Lifecycle:</strong>
 *
 * <pre>
 * create ──▶ (config / use) ──▶ ready() ──▶ operations ... ──▶ destroy()
 *                                  │
 *                                  └─ driver fallback: first configured driver that initializes
 * </pre>
 *
 * <p>Every operation calls {@link #ready()} first, so explicit calls are optional. {@code ready()}
 * is memoized; it runs again after a failure or after the handle's database was dropped. Once it
 * has started the configuration is locked.
 *
 * <p><strong>Sharing:</strong> handles of one {@link KvSpaceRuntime} with the same driver, name
 * and bucket share one connection, one admission queue and one write coalescer. Each handle has
 * its own store, version and plugins.
 *
 * <p><strong>Plugins:</strong> {@code setItem}, {@code getItem}, {@code removeItem} and their batch
 * forms run the {@link PluginPipeline}. {@code iterate}, {@code keys}, {@code key}, {@code length},
 * {@code clear} and {@link #runTransaction} see raw stored values.
 *
 * <p><strong>Errors:</strong> futures fail with {@link KvSpaceException}; callers blocking with
 * {@code join()} or {@code get()} see it as the cause of the wrapping exception.
 *
 * <p><strong>Example:</strong>
 *
 * <pre>{@code
 * KvSpace space =
 *     KvSpace.create(KvSpaceConfig.builder().name("app").storeName("settings").build());
 * space.setItem("theme", "dark").join();
 * Object theme = space.getItem("theme").join();
 * }</pre>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class KvSpace {

  @Getter private final KvSpaceRuntime runtime;
  private final PluginPipeline plugins;
  private final Object monitor = new Object();

  // guarded by monitor
  private KvSpaceConfig config;
  private boolean configLocked;
  private CompletableFuture<StoreOperations> ready;
  private CompletableFuture<Void> destroying;

  private KvSpace(final KvSpaceConfig config, final KvSpaceRuntime runtime) {
    this.config = config;
    this.runtime = runtime;
    this.plugins =
        new PluginPipeline(
            this, this::config, this::driver, runtime.getExecutor(), runtime.getMetrics());
  }

  /** Handle with default configuration on the shared runtime. */
  public static KvSpace create() {
    return create(KvSpaceConfig.defaults());
  }

  public static KvSpace create(@NonNull final KvSpaceConfig config) {
    return create(config, KvSpaceRuntime.shared());
  }

  /**
   * Creates a handle. No connection is opened until the first operation or {@link #ready()}.
   *
   * @param config handle configuration
   * @param runtime runtime providing drivers, connections and threads
   * @throws KvSpaceException {@code INVALID_CONFIG} if the configuration is invalid
   */
  public static KvSpace create(
      @NonNull final KvSpaceConfig config, @NonNull final KvSpaceRuntime runtime) {
    return new KvSpace(config.validate(), runtime);
  }

  /** Creates another handle on this handle's runtime. */
  public KvSpace createInstance(@NonNull final KvSpaceConfig config) {
    return create(config, runtime);
  }

  // ==================== Lifecycle ====================

  /**
   * Selects a driver, opens the database and brings the store to its effective version.
   *
   * @return future failing with {@code DRIVER_UNAVAILABLE} when no configured driver initializes
   */
  public CompletableFuture<Void> ready() {
    return store().thenApply(operations -> null);
  }

  /** Current configuration. */
  public KvSpaceConfig config() {
    synchronized (monitor) {
      return config;
    }
  }

  /**
   * Replaces the configuration.
   *
   * @throws KvSpaceException {@code CONFIG_LOCKED} once {@link #ready()} has started, {@code
   *     INVALID_CONFIG} if {@code newConfig} is invalid
   */
  public void config(@NonNull final KvSpaceConfig newConfig) {
    synchronized (monitor) {
      if (configLocked) {
        throw KvSpaceException.of(
            ErrorCode.CONFIG_LOCKED,
            "Configuration of '" + config.getName() + "' cannot change after ready() was called",
            ErrorDetails.of(
                ErrorDetails.DB_NAME, config.getName(),
                ErrorDetails.STORE_NAME, config.getStoreName()));
      }
      config = newConfig.validate();
    }
  }

  /**
   * Registers plugins; they run from the next operation on.
   *
   * @return this handle
   */
  public KvSpace use(final KvSpacePlugin... plugins) {
    this.plugins.register(Arrays.asList(plugins));
    return this;
  }

  /** Warnings about risky plugin setups emitted so far. */
  public List<String> getPluginWarnings() {
    return plugins.getConfigurationWarnings();
  }

  /** Name of the selected driver, {@code null} before {@link #ready()} completed. */
  public String driver() {
    final var current = currentStore();
    return current == null ? null : current.getDriverName();
  }

  /** Whether {@code driverName} is defined in this handle's runtime and usable. */
  public boolean supports(final String driverName) {
    return runtime.getDrivers().supports(driverName);
  }

  /** Defines a driver in this handle's runtime. */
  public void defineDriver(@NonNull final BackendAdapter adapter) {
    runtime.getDrivers().define(adapter);
  }

  /**
   * Version the store actually runs at. Higher than the configured version when the database was
   * already upgraded by someone else.
   */
  public int getEffectiveVersion() {
    final var current = currentStore();
    return current == null ? config().getVersion() : current.getBinding().getVersion();
  }

  /** Coalescing statistics of this handle's database; empty before {@link #ready()}. */
  public WriteStatistics getWriteStatistics() {
    final var current = currentStore();
    return current == null
        ? WriteStatistics.EMPTY
        : current.getContext().getCoalescer().getStatistics();
  }

  /**
   * Flushes buffered writes, destroys plugins and releases this handle's store registration.
   * Idempotent. Later operations fail with {@code DRIVER_NOT_INITIALIZED}.
   */
  public CompletableFuture<Void> destroy() {
    synchronized (monitor) {
      if (destroying != null) {
        return destroying;
      }
      final var previous = ready;
      final CompletableFuture<Void> drained =
          previous == null
              ? Futures.done()
              : Futures.settled(previous.thenCompose(StoreOperations::drain));
      destroying =
          drained.thenRunAsync(
              () -> {
                plugins.destroy();
                final var current = completedStore(previous);
                if (current != null) {
                  current.getContext().unregister(current.getBinding());
                }
                if (log.isDebugEnabled()) {
                  log.debug("Destroyed handle for store '{}'", config().getStoreName());
                }
              },
              executor());
      return destroying;
    }
  }

  // ==================== Plugin-aware Operations ====================

  /**
   * Stores a value. {@code null} is stored as {@code null}.
   *
   * @return the caller's value, or the value a plugin placed in {@link PluginContext#RETURN_VALUE}
   */
  public CompletableFuture<Object> setItem(final String key, final Object value) {
    requireKey(key, "setItem");
    return store()
        .thenCompose(
            operations -> {
              if (!plugins.hasPlugins()) {
                return operations.set(key, value).thenApply(stored -> value);
              }
              return plugins
                  .ensureInitialized()
                  .thenComposeAsync(
                      initialized -> {
                        final var context = plugins.createContext(PluginOperation.SET_ITEM);
                        context.getOperationState().put(PluginContext.ORIGINAL_VALUE, value);
                        final var processed = plugins.beforeSet(key, value, context);
                        return operations
                            .set(key, processed)
                            .thenApplyAsync(
                                stored -> {
                                  plugins.afterSet(key, processed, context);
                                  return returnValue(context, value);
                                },
                                executor());
                      },
                      executor());
            });
  }

  /** Loads a value; {@code null} for absent keys. */
  public CompletableFuture<Object> getItem(final String key) {
    requireKey(key, "getItem");
    return store()
        .thenCompose(
            operations -> {
              if (!plugins.hasPlugins()) {
                return operations.get(key);
              }
              return plugins
                  .ensureInitialized()
                  .thenComposeAsync(
                      initialized -> {
                        final var context = plugins.createContext(PluginOperation.GET_ITEM);
                        final var target = plugins.beforeGet(key, context);
                        return operations
                            .get(target)
                            .thenApplyAsync(
                                value -> plugins.afterGet(target, value, context), executor());
                      },
                      executor());
            });
  }

  /**
   * Loads a value of a known type.
   *
   * @throws KvSpaceException {@code DESERIALIZATION_FAILED} (as the future's failure) if the stored
   *     value is not a {@code type}
   */
  public <T> CompletableFuture<T> getItem(final String key, @NonNull final Class<T> type) {
    return getItem(key)
        .thenApply(
            value -> {
              if (value == null || type.isInstance(value)) {
                return type.cast(value);
              }
              throw KvSpaceException.of(
                  ErrorCode.DESERIALIZATION_FAILED,
                  "Value of key '"
                      + key
                      + "' is a "
                      + value.getClass().getName()
                      + ", not a "
                      + type.getName(),
                  ErrorDetails.of(ErrorDetails.OPERATION, "getItem", ErrorDetails.KEY, key));
            });
  }

  public CompletableFuture<Void> removeItem(final String key) {
    requireKey(key, "removeItem");
    return store()
        .thenCompose(
            operations -> {
              if (!plugins.hasPlugins()) {
                return operations.remove(key);
              }
              return plugins
                  .ensureInitialized()
                  .thenComposeAsync(
                      initialized -> {
                        final var context = plugins.createContext(PluginOperation.REMOVE_ITEM);
                        final var target = plugins.beforeRemove(key, context);
                        return operations
                            .remove(target)
                            .thenRunAsync(() -> plugins.afterRemove(target, context), executor());
                      },
                      executor());
            });
  }

  /** Stores entries of a map in iteration order; see {@link #setItems(List)}. */
  public CompletableFuture<List<BatchEntry>> setItems(@NonNull final Map<String, ?> entries) {
    final var list = new ArrayList<BatchEntry>(entries.size());
    entries.forEach((key, value) -> list.add(BatchEntry.of(key, value)));
    return setItems(list);
  }

  /**
   * Stores every entry in one transaction.
   *
   * @return one entry per stored key with the caller's value (or a plugin's return value)
   */
  public CompletableFuture<List<BatchEntry>> setItems(@NonNull final List<BatchEntry> entries) {
    for (final var entry : entries) {
      requireKey(entry == null ? null : entry.getKey(), "setItems");
    }
    final var input = List.copyOf(entries);
    return store()
        .thenCompose(
            operations -> {
              if (!plugins.hasPlugins()) {
                return operations.setAll(input).thenApply(stored -> input);
              }
              return plugins
                  .ensureInitialized()
                  .thenComposeAsync(
                      initialized -> setItemsWithPlugins(operations, input), executor());
            });
  }

  /**
   * Loads keys in one transaction.
   *
   * @return one entry per requested key, in request order, {@code null} values for absent keys
   */
  public CompletableFuture<List<BatchEntry>> getItems(@NonNull final List<String> keys) {
    keys.forEach(key -> requireKey(key, "getItems"));
    final var input = List.copyOf(keys);
    return store()
        .thenCompose(
            operations -> {
              if (!plugins.hasPlugins()) {
                return operations.getAll(input);
              }
              return plugins
                  .ensureInitialized()
                  .thenComposeAsync(
                      initialized -> getItemsWithPlugins(operations, input), executor());
            });
  }

  /** Removes keys in one transaction. */
  public CompletableFuture<Void> removeItems(@NonNull final List<String> keys) {
    keys.forEach(key -> requireKey(key, "removeItems"));
    final var input = List.copyOf(keys);
    return store()
        .thenCompose(
            operations -> {
              if (!plugins.hasPlugins()) {
                return operations.removeAll(input);
              }
              return plugins
                  .ensureInitialized()
                  .thenComposeAsync(
                      initialized -> removeItemsWithPlugins(operations, input), executor());
            });
  }

  // ==================== Raw Operations ====================

  /**
   * Visits stored entries in key order. Iteration numbers start at 1.
   *
   * @return the first non-null visitor result, or {@code null} after visiting every entry
   */
  public <T> CompletableFuture<T> iterate(@NonNull final ItemVisitor<T> visitor) {
    return store().thenCompose(operations -> operations.iterate(visitor));
  }

  public CompletableFuture<List<String>> keys() {
    return store().thenCompose(StoreOperations::keys);
  }

  /** Key at {@code index} in key order; {@code null} when the index is negative or too large. */
  public CompletableFuture<String> key(final int index) {
    return store().thenCompose(operations -> operations.key(index));
  }

  public CompletableFuture<Integer> length() {
    return store().thenCompose(StoreOperations::length);
  }

  /** Removes every entry of this handle's store. */
  public CompletableFuture<Void> clear() {
    return store().thenCompose(StoreOperations::clear);
  }

  /**
   * Runs {@code body} inside one transaction of this handle's store. Buffered coalesced writes are
   * flushed first; plugins do not run.
   *
   * @param mode transaction mode; read-only scopes reject writes with {@code TRANSACTION_READONLY}
   * @param body transaction body, must not block on other kvspace futures
   * @return the body's result once the transaction committed
   */
  public <T> CompletableFuture<T> runTransaction(
      @NonNull final TransactionMode mode, @NonNull final Function<TransactionScope, T> body) {
    return store().thenCompose(operations -> operations.runTransaction(mode, body));
  }

  /** Drops this handle's store. */
  public CompletableFuture<Void> dropInstance() {
    return dropInstance(DropOptions.current());
  }

  /**
   * Drops a store or a whole database of this handle's driver.
   *
   * <p>Without a name this handle's database and store are targeted. A name without a store name
   * drops that whole database. Dropping a store bumps the database version; a missing store is a
   * no-op. Buffered writes of the target database are flushed first.
   *
   * @throws KvSpaceException {@code UNSUPPORTED_OPERATION} (as the future's failure) if the driver
   *     lacks the needed capability
   */
  public CompletableFuture<Void> dropInstance(@NonNull final DropOptions options) {
    return store().thenCompose(operations -> drop(operations, options));
  }

  @Override
  public String toString() {
    final var current = config();
    return "KvSpace[" + current.getName() + "/" + current.getStoreName() + "]";
  }

  // ==================== Private Methods ====================

  private Executor executor() {
    return runtime.getExecutor();
  }

  private CompletableFuture<StoreOperations> store() {
    synchronized (monitor) {
      if (destroying != null) {
        return CompletableFuture.failedFuture(
            KvSpaceException.of(
                ErrorCode.DRIVER_NOT_INITIALIZED,
                "Handle for '" + config.getName() + "' was destroyed",
                ErrorDetails.of(
                    ErrorDetails.DB_NAME, config.getName(),
                    ErrorDetails.STORE_NAME, config.getStoreName())));
      }
      configLocked = true;
      if (ready == null || isUnusable(ready)) {
        ready = connect(config);
      }
      return ready;
    }
  }

  private StoreOperations currentStore() {
    synchronized (monitor) {
      return completedStore(ready);
    }
  }

  private static StoreOperations completedStore(final CompletableFuture<StoreOperations> future) {
    return future != null && future.isDone() && !future.isCompletedExceptionally()
        ? future.join()
        : null;
  }

  private static boolean isUnusable(final CompletableFuture<StoreOperations> future) {
    if (!future.isDone()) {
      return false;
    }
    final var current = completedStore(future);
    return current == null || current.getBinding().isDetached();
  }

  private CompletableFuture<StoreOperations> connect(final KvSpaceConfig target) {
    return connect(target, target.getDrivers(), 0, new ArrayList<>(), null);
  }

  private CompletableFuture<StoreOperations> connect(
      final KvSpaceConfig target,
      final List<String> names,
      final int index,
      final List<String> attempted,
      final Throwable lastError) {
    if (index >= names.size()) {
      return CompletableFuture.failedFuture(noUsableDriver(target, attempted, lastError));
    }

    final var name = names.get(index);
    attempted.add(name);
    final var drivers = runtime.getDrivers();
    if (!drivers.supports(name)) {
      if (log.isDebugEnabled()) {
        log.debug("Driver '{}' is not available, trying next", name);
      }
      return connect(target, names, index + 1, attempted, lastError);
    }

    final var adapter = drivers.getDriver(name);
    final var identity = new DatabaseIdentity(name, target.getName(), target.getBucket());
    final var context = runtime.getConnections().acquire(identity, adapter);
    final var binding = new StoreBinding(target);

    return context
        .initialize(binding)
        .handle(
            (initialized, error) -> {
              if (error == null) {
                if (log.isInfoEnabled()) {
                  log.info(
                      "Store '{}' ready on {} (version {})",
                      binding.getStoreName(),
                      identity,
                      binding.getVersion());
                }
                return CompletableFuture.completedFuture(
                    new StoreOperations(name, context, binding));
              }
              context.unregister(binding);
              final var cause = KvSpaceException.unwrap(error);
              log.warn("Driver '{}' failed to open {}: {}", name, identity, cause.toString());
              return connect(target, names, index + 1, attempted, cause);
            })
        .thenCompose(Function.identity());
  }

  private static KvSpaceException noUsableDriver(
      final KvSpaceConfig target, final List<String> attempted, final Throwable lastError) {
    final var details =
        new LinkedHashMap<>(
            ErrorDetails.of(
                ErrorDetails.DB_NAME, target.getName(),
                ErrorDetails.STORE_NAME, target.getStoreName(),
                ErrorDetails.ATTEMPTED_DRIVERS, List.copyOf(attempted)));
    if (lastError != null) {
      details.put(ErrorDetails.CAUSE_NAME, lastError.getClass().getName());
      details.put(ErrorDetails.CAUSE_MESSAGE, String.valueOf(lastError.getMessage()));
    }
    return new KvSpaceException(
        ErrorCode.DRIVER_UNAVAILABLE,
        "No usable driver for '" + target.getName() + "' among " + attempted,
        details,
        lastError);
  }

  private CompletableFuture<Void> drop(
      final StoreOperations operations, final DropOptions options) {
    final var current = operations.getConfig();
    final var name = options.getName() != null ? options.getName() : current.getName();
    final var storeName =
        options.getName() == null ? current.getStoreName() : options.getStoreName();
    final var identity =
        new DatabaseIdentity(operations.getDriverName(), name, current.getBucket());
    final var adapter = operations.getContext().getAdapter();

    final var capability =
        storeName == null ? BackendCapability.DROP_DATABASE : BackendCapability.DROP_STORE;
    if (!adapter.supports(capability)) {
      return CompletableFuture.failedFuture(
          KvSpaceException.of(
              ErrorCode.UNSUPPORTED_OPERATION,
              "Driver '" + operations.getDriverName() + "' does not support " + capability,
              ErrorDetails.of(
                  ErrorDetails.OPERATION, "dropInstance",
                  ErrorDetails.DRIVER, operations.getDriverName(),
                  ErrorDetails.DB_NAME, name,
                  ErrorDetails.STORE_NAME, storeName)));
    }

    final var connections = runtime.getConnections();
    final var drained =
        connections
            .find(identity)
            .map(context -> context.getCoalescer().drain())
            .orElseGet(Futures::done);

    final var dropped =
        drained.thenCompose(
            flushed ->
                storeName == null
                    ? connections.dropDatabase(identity, adapter)
                    : connections.acquire(identity, adapter).dropStore(storeName));

    return Futures.mapFailure(
        dropped,
        error ->
            KvSpaceException.wrap(
                error,
                ErrorCode.OPERATION_FAILED,
                "Dropping " + identity + (storeName == null ? "" : "/" + storeName) + " failed",
                ErrorDetails.of(
                    ErrorDetails.OPERATION, "dropInstance",
                    ErrorDetails.DRIVER, identity.getDriver(),
                    ErrorDetails.DB_NAME, name,
                    ErrorDetails.STORE_NAME, storeName)));
  }

  private CompletableFuture<List<BatchEntry>> setItemsWithPlugins(
      final StoreOperations operations, final List<BatchEntry> entries) {
    final var batchContext = plugins.createContext(PluginOperation.SET_ITEMS);
    batchContext.markBatch(entries.size());
    final var prepared = plugins.beforeSetItems(entries, batchContext);
    batchContext.markBatch(prepared.size());

    final var processed = new ArrayList<BatchEntry>(prepared.size());
    final var contexts = new ArrayList<PluginContext>(prepared.size());
    final var contextByKey = new HashMap<String, PluginContext>();
    for (final var entry : prepared) {
      final var context = plugins.createContext(PluginOperation.SET_ITEM);
      context.getOperationState().put(PluginContext.ORIGINAL_VALUE, entry.getValue());
      context.markBatch(prepared.size());
      processed.add(entry.withValue(plugins.beforeSet(entry.getKey(), entry.getValue(), context)));
      contexts.add(context);
      contextByKey.put(entry.getKey(), context);
    }

    return operations
        .setAll(processed)
        .thenApplyAsync(
            stored -> {
              final var finalized = plugins.afterSetItems(processed, batchContext);
              for (int i = 0; i < processed.size(); i++) {
                final var entry = processed.get(i);
                plugins.afterSet(entry.getKey(), entry.getValue(), contexts.get(i));
              }

              final var results = new ArrayList<BatchEntry>(finalized.size());
              for (final var entry : finalized) {
                final var context = contextByKey.get(entry.getKey());
                final var value =
                    context == null
                        ? entry.getValue()
                        : returnValue(
                            context, context.getOperationState().get(PluginContext.ORIGINAL_VALUE));
                results.add(BatchEntry.of(entry.getKey(), value));
              }
              return results;
            },
            executor());
  }

  private CompletableFuture<List<BatchEntry>> getItemsWithPlugins(
      final StoreOperations operations, final List<String> keys) {
    final var batchContext = plugins.createContext(PluginOperation.GET_ITEMS);
    batchContext.markBatch(keys.size());
    final var requested = plugins.beforeGetItems(keys, batchContext);

    final var targets = new ArrayList<String>(requested.size());
    final var contexts = new ArrayList<PluginContext>(requested.size());
    final var requestedByTarget = new HashMap<String, String>();
    for (final var key : requested) {
      final var context = plugins.createContext(PluginOperation.GET_ITEM);
      context.markBatch(requested.size());
      final var target = plugins.beforeGet(key, context);
      targets.add(target);
      contexts.add(context);
      requestedByTarget.put(target, key);
    }

    return operations
        .getAll(targets)
        .thenApplyAsync(
            loaded -> {
              final var processed = new ArrayList<BatchEntry>(loaded.size());
              for (int i = 0; i < loaded.size(); i++) {
                final var entry = loaded.get(i);
                processed.add(
                    entry.withValue(
                        plugins.afterGet(entry.getKey(), entry.getValue(), contexts.get(i))));
              }
              final var finalized = plugins.afterGetItems(processed, batchContext);
              final var results = new ArrayList<BatchEntry>(finalized.size());
              for (final var entry : finalized) {
                results.add(
                    BatchEntry.of(
                        requestedByTarget.getOrDefault(entry.getKey(), entry.getKey()),
                        entry.getValue()));
              }
              return results;
            },
            executor());
  }

  private CompletableFuture<Void> removeItemsWithPlugins(
      final StoreOperations operations, final List<String> keys) {
    final var batchContext = plugins.createContext(PluginOperation.REMOVE_ITEMS);
    batchContext.markBatch(keys.size());
    final var requested = plugins.beforeRemoveItems(keys, batchContext);

    final var targets = new ArrayList<String>(requested.size());
    final var contexts = new ArrayList<PluginContext>(requested.size());
    for (final var key : requested) {
      final var context = plugins.createContext(PluginOperation.REMOVE_ITEM);
      context.markBatch(requested.size());
      targets.add(plugins.beforeRemove(key, context));
      contexts.add(context);
    }

    return operations
        .removeAll(targets)
        .thenRunAsync(
            () -> {
              plugins.afterRemoveItems(targets, batchContext);
              for (int i = 0; i < targets.size(); i++) {
                plugins.afterRemove(targets.get(i), contexts.get(i));
              }
            },
            executor());
  }

  private static Object returnValue(final PluginContext context, final Object fallback) {
    final var override = context.getOperationState().get(PluginContext.RETURN_VALUE);
    return override != null ? override : fallback;
  }

  private static void requireKey(final String key, final String operation) {
    if (key == null) {
      throw KvSpaceException.of(
          ErrorCode.INVALID_ARGUMENT,
          "Key must not be null",
          ErrorDetails.of(ErrorDetails.OPERATION, operation));
    }
  }
}
