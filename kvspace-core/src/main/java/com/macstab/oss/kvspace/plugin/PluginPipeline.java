/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.plugin;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import com.macstab.oss.kvspace.BatchEntry;
import com.macstab.oss.kvspace.KvSpace;
import com.macstab.oss.kvspace.KvSpaceConfig;
import com.macstab.oss.kvspace.error.ErrorCode;
import com.macstab.oss.kvspace.error.ErrorDetails;
import com.macstab.oss.kvspace.error.KvSpaceException;
import com.macstab.oss.kvspace.internal.Futures;
import com.macstab.oss.kvspace.metrics.KvSpaceMetrics;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Ordered plugin chain of one {@link KvSpace} handle.
 *
 * <p><strong>Execution order:</strong> registrations sorted by {@link
 * PluginRegistration#EXECUTION_ORDER}. {@code before*} hooks run in that order, each result
 * feeding the next; {@code after*} hooks run in reverse order.
 *
 * <p><strong>Lifecycle table:</strong> initialized, disabled and destroyed state is kept per
 * registration id, so registering the same plugin instance twice yields two independent entries.
 *
 * <ul>
 *   <li><strong>Init:</strong> {@link #ensureInitialized()} runs {@code onInit} sequentially in
 *       execution order, once per registration. Concurrent callers await the in-flight init.
 *       A failed init is reported through {@code onError}; under {@link PluginInitPolicy#FAIL} the
 *       error propagates (and init is retried by the next operation), under {@link
 *       PluginInitPolicy#DISABLE_AND_CONTINUE} the plugin is disabled for good.
 *   <li><strong>Enabled:</strong> {@code isEnabled} is asked per phase. An exception disables the
 *       plugin permanently after a warning log.
 *   <li><strong>Destroy:</strong> {@code onDestroy} in reverse registration order, skipping
 *       disabled and destroyed plugins. Idempotent.
 * </ul>
 *
 * <p><strong>Hook errors:</strong> {@link PluginAbortException} and {@link KvSpaceException}
 * always propagate. Other exceptions propagate as {@code OPERATION_FAILED} under {@link
 * PluginErrorPolicy#STRICT}; under {@link PluginErrorPolicy#LENIENT} they go to the plugin's
 * {@code onError} (or a warning log) and the hook's input passes on unchanged.
 *
 * <p><strong>Thread Safety:</strong> hooks may run concurrently for concurrent operations.
 * Registration is serialized and swaps in a new immutable registration list.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class PluginPipeline {

  private final KvSpace owner;
  private final Supplier<KvSpaceConfig> config;
  private final Supplier<String> driver;
  private final Executor executor;
  private final KvSpaceMetrics metrics;

  private volatile List<PluginRegistration> registrations = List.of();
  private final AtomicInteger order = new AtomicInteger();
  private final ConcurrentMap<String, Object> metadata = new ConcurrentHashMap<>();
  private final PluginConfigurationValidator validator = new PluginConfigurationValidator();

  private final Set<String> initialized = ConcurrentHashMap.newKeySet();
  private final Set<String> disabled = ConcurrentHashMap.newKeySet();
  private final Set<String> destroyed = ConcurrentHashMap.newKeySet();
  private final Map<String, CompletableFuture<Void>> initializing = new ConcurrentHashMap<>();

  /**
   * Creates an empty pipeline.
   *
   * @param owner handle exposed to plugins through {@link PluginContext#getInstance()}
   * @param config current configuration of the owner
   * @param driver current driver name of the owner, may supply {@code null}
   * @param executor executor running plugin initialization
   * @param metrics plugin error counter sink
   */
  public PluginPipeline(
      final KvSpace owner,
      @NonNull final Supplier<KvSpaceConfig> config,
      @NonNull final Supplier<String> driver,
      @NonNull final Executor executor,
      @NonNull final KvSpaceMetrics metrics) {
    this.owner = owner;
    this.config = config;
    this.driver = driver;
    this.executor = executor;
    this.metrics = metrics;
  }

  /**
   * Registers plugins. They are initialized by the next {@link #ensureInitialized()}.
   *
   * @param plugins plugins to add
   * @return configuration warnings emitted by this registration
   */
  public synchronized List<String> register(@NonNull final Collection<KvSpacePlugin> plugins) {
    final var added = new ArrayList<PluginRegistration>();
    for (final var plugin : plugins) {
      if (plugin == null) {
        throw KvSpaceException.of(ErrorCode.INVALID_ARGUMENT, "Plugin must not be null");
      }
      added.add(
          new PluginRegistration(
              UUID.randomUUID().toString(),
              order.getAndIncrement(),
              plugin.getPriority(),
              plugin));
    }

    final var merged = new ArrayList<>(registrations);
    merged.addAll(added);
    merged.sort(PluginRegistration.EXECUTION_ORDER);
    registrations = List.copyOf(merged);

    if (log.isDebugEnabled()) {
      log.debug(
          "Registered plugins {} on '{}'",
          added.stream().map(PluginRegistration::getName).toList(),
          config.get().getName());
    }
    return validator.validate(merged, config.get().getPluginErrorPolicy());
  }

  public boolean hasPlugins() {
    return !registrations.isEmpty();
  }

  /** Registrations in execution order. */
  public List<PluginRegistration> getRegistrations() {
    return registrations;
  }

  /** Every configuration warning emitted so far. */
  public List<String> getConfigurationWarnings() {
    return validator.getWarnings();
  }

  public boolean isDisabled(final PluginRegistration registration) {
    return disabled.contains(registration.getId());
  }

  public PluginContext createContext(@NonNull final PluginOperation operation) {
    return PluginContext.builder()
        .operation(operation)
        .instance(owner)
        .driver(driver.get())
        .config(config.get())
        .metadata(metadata)
        .build();
  }

  /**
   * Initializes every active registration not initialized yet, in execution order.
   *
   * @return future failing with the first propagated init error
   */
  public CompletableFuture<Void> ensureInitialized() {
    CompletableFuture<Void> chain = Futures.done();
    for (final var registration : registrations) {
      chain = chain.thenCompose(ignored -> initialize(registration));
    }
    return chain;
  }

  /**
   * Runs {@code onDestroy} of every registration that is neither disabled nor destroyed, in reverse
   * registration order. Errors are reported, never thrown.
   */
  public synchronized void destroy() {
    final var reverse = new ArrayList<>(registrations);
    reverse.sort(Comparator.comparingInt(PluginRegistration::getOrder).reversed());

    for (final var registration : reverse) {
      final var id = registration.getId();
      if (destroyed.contains(id) || disabled.contains(id)) {
        continue;
      }
      final var context = createContext(PluginOperation.LIFECYCLE);
      try {
        registration.getPlugin().onDestroy(context);
      } catch (final Exception e) {
        recordError(registration, PluginStage.DESTROY);
        dispatchError(registration, e, PluginStage.DESTROY, null, context);
      } finally {
        destroyed.add(id);
      }
    }
  }

  // ==================== Hooks ====================

  public Object beforeSet(final String key, final Object value, final PluginContext context) {
    Object current = value;
    for (final var registration : active(context, false)) {
      final var input = current;
      current =
          invoke(
              registration,
              PluginStage.BEFORE,
              key,
              context,
              input,
              () -> registration.getPlugin().beforeSet(key, input, context));
    }
    return current;
  }

  public void afterSet(final String key, final Object value, final PluginContext context) {
    for (final var registration : active(context, true)) {
      invoke(
          registration,
          PluginStage.AFTER,
          key,
          context,
          null,
          () -> {
            registration.getPlugin().afterSet(key, value, context);
            return null;
          });
    }
  }

  public String beforeGet(final String key, final PluginContext context) {
    String current = key;
    for (final var registration : active(context, false)) {
      final var input = current;
      current =
          keyOrInput(
              invoke(
                  registration,
                  PluginStage.BEFORE,
                  input,
                  context,
                  input,
                  () -> registration.getPlugin().beforeGet(input, context)),
              input);
    }
    return current;
  }

  public Object afterGet(final String key, final Object value, final PluginContext context) {
    Object current = value;
    for (final var registration : active(context, true)) {
      final var input = current;
      current =
          invoke(
              registration,
              PluginStage.AFTER,
              key,
              context,
              input,
              () -> registration.getPlugin().afterGet(key, input, context));
    }
    return current;
  }

  public String beforeRemove(final String key, final PluginContext context) {
    String current = key;
    for (final var registration : active(context, false)) {
      final var input = current;
      current =
          keyOrInput(
              invoke(
                  registration,
                  PluginStage.BEFORE,
                  input,
                  context,
                  input,
                  () -> registration.getPlugin().beforeRemove(input, context)),
              input);
    }
    return current;
  }

  public void afterRemove(final String key, final PluginContext context) {
    for (final var registration : active(context, true)) {
      invoke(
          registration,
          PluginStage.AFTER,
          key,
          context,
          null,
          () -> {
            registration.getPlugin().afterRemove(key, context);
            return null;
          });
    }
  }

  public List<BatchEntry> beforeSetItems(
      final List<BatchEntry> entries, final PluginContext context) {
    return runListHook(
        entries,
        context,
        false,
        PluginStage.BEFORE,
        (plugin, input) -> plugin.beforeSetItems(input, context));
  }

  public List<BatchEntry> afterSetItems(
      final List<BatchEntry> entries, final PluginContext context) {
    return runListHook(
        entries,
        context,
        true,
        PluginStage.AFTER,
        (plugin, input) -> plugin.afterSetItems(input, context));
  }

  public List<String> beforeGetItems(final List<String> keys, final PluginContext context) {
    return runListHook(
        keys,
        context,
        false,
        PluginStage.BEFORE,
        (plugin, input) -> plugin.beforeGetItems(input, context));
  }

  public List<BatchEntry> afterGetItems(
      final List<BatchEntry> entries, final PluginContext context) {
    return runListHook(
        entries,
        context,
        true,
        PluginStage.AFTER,
        (plugin, input) -> plugin.afterGetItems(input, context));
  }

  public List<String> beforeRemoveItems(final List<String> keys, final PluginContext context) {
    return runListHook(
        keys,
        context,
        false,
        PluginStage.BEFORE,
        (plugin, input) -> plugin.beforeRemoveItems(input, context));
  }

  public void afterRemoveItems(final List<String> keys, final PluginContext context) {
    runListHook(
        keys,
        context,
        true,
        PluginStage.AFTER,
        (plugin, input) -> {
          plugin.afterRemoveItems(input, context);
          return input;
        });
  }

  // ==================== Private Methods ====================

  @FunctionalInterface
  private interface ListHook<T> {
    List<T> apply(KvSpacePlugin plugin, List<T> input) throws Exception;
  }

  private <T> List<T> runListHook(
      final List<T> items,
      final PluginContext context,
      final boolean reverse,
      final PluginStage stage,
      final ListHook<T> hook) {
    List<T> current = items;
    for (final var registration : active(context, reverse)) {
      final var input = current;
      final var result =
          invoke(
              registration,
              stage,
              null,
              context,
              input,
              () -> hook.apply(registration.getPlugin(), input));
      current = result != null ? result : input;
    }
    return current;
  }

  private CompletableFuture<Void> initialize(final PluginRegistration registration) {
    final var id = registration.getId();
    if (initialized.contains(id) || disabled.contains(id) || destroyed.contains(id)) {
      return Futures.done();
    }

    final var claim = new CompletableFuture<Void>();
    final var inFlight = initializing.putIfAbsent(id, claim);
    if (inFlight != null) {
      return inFlight;
    }
    if (initialized.contains(id) || disabled.contains(id)) {
      initializing.remove(id, claim);
      claim.complete(null);
      return claim;
    }

    executor.execute(() -> runInit(registration, claim));
    return claim;
  }

  private void runInit(
      final PluginRegistration registration, final CompletableFuture<Void> claim) {
    final var id = registration.getId();
    final var context = createContext(PluginOperation.LIFECYCLE);
    Throwable failure = null;
    try {
      registration.getPlugin().onInit(context);
      initialized.add(id);
      if (log.isDebugEnabled()) {
        log.debug("Initialized plugin '{}'", registration.getName());
      }
    } catch (final Exception e) {
      recordError(registration, PluginStage.INIT);
      dispatchError(registration, e, PluginStage.INIT, null, context);
      if (context.getConfig().getPluginInitPolicy() == PluginInitPolicy.DISABLE_AND_CONTINUE) {
        disabled.add(id);
        log.warn("Plugin '{}' disabled after failed initialization", registration.getName());
      } else {
        failure = propagated(registration, e, PluginStage.INIT, null, context);
      }
    } finally {
      initializing.remove(id, claim);
    }

    if (failure == null) {
      claim.complete(null);
    } else {
      claim.completeExceptionally(failure);
    }
  }

  private List<PluginRegistration> active(final PluginContext context, final boolean reverse) {
    final var result = new ArrayList<PluginRegistration>(registrations.size());
    for (final var registration : registrations) {
      final var id = registration.getId();
      if (!disabled.contains(id) && !destroyed.contains(id) && isEnabled(registration, context)) {
        result.add(registration);
      }
    }
    if (reverse) {
      Collections.reverse(result);
    }
    return result;
  }

  private boolean isEnabled(final PluginRegistration registration, final PluginContext context) {
    try {
      return registration.getPlugin().isEnabled(context);
    } catch (final Exception e) {
      disabled.add(registration.getId());
      log.warn(
          "Plugin '{}' disabled: enabled check failed: {}", registration.getName(), e.toString());
      return false;
    }
  }

  private <T> T invoke(
      final PluginRegistration registration,
      final PluginStage stage,
      final String key,
      final PluginContext context,
      final T fallback,
      final Callable<T> hook) {
    try {
      return hook.call();
    } catch (final Exception e) {
      recordError(registration, stage);
      if (e instanceof PluginAbortException
          || e instanceof KvSpaceException
          || context.getConfig().getPluginErrorPolicy() == PluginErrorPolicy.STRICT) {
        throw propagated(registration, e, stage, key, context);
      }
      dispatchError(registration, e, stage, key, context);
      return fallback;
    }
  }

  private RuntimeException propagated(
      final PluginRegistration registration,
      final Exception error,
      final PluginStage stage,
      final String key,
      final PluginContext context) {
    if (error instanceof PluginAbortException abort) {
      return abort;
    }
    return KvSpaceException.wrap(
        error,
        ErrorCode.OPERATION_FAILED,
        "Plugin '"
            + registration.getName()
            + "' failed in "
            + stageName(stage)
            + " stage of "
            + context.getOperation(),
        ErrorDetails.of(
            ErrorDetails.PLUGIN, registration.getName(),
            ErrorDetails.OPERATION, context.getOperation().name(),
            ErrorDetails.KEY, key));
  }

  private void dispatchError(
      final PluginRegistration registration,
      final Exception error,
      final PluginStage stage,
      final String key,
      final PluginContext context) {
    final var info =
        new PluginErrorInfo(
            registration.getName(), context.getOperation(), stage, key, context, error);
    try {
      if (registration.getPlugin().onError(error, info)) {
        return;
      }
    } catch (final RuntimeException handlerError) {
      log.error("onError handler of plugin '{}' failed", registration.getName(), handlerError);
    }
    log.warn(
        "Plugin '{}' failed in {} stage of {}: {}",
        registration.getName(),
        stageName(stage),
        context.getOperation(),
        error.toString());
  }

  private void recordError(final PluginRegistration registration, final PluginStage stage) {
    metrics.recordPluginError(
        config.get().getName(), registration.getName(), stageName(stage));
  }

  private static String stageName(final PluginStage stage) {
    return stage.name().toLowerCase(Locale.ROOT);
  }

  private static String keyOrInput(final String result, final String input) {
    return result != null ? result : input;
  }
}
