/* (C)2026 Christian Schnapka / Macstab GmbH */

/**
 * Coordination layer for versioned, transactional key-value storage backends (no Spring
 * dependencies).
 *
 * <h2>Purpose</h2>
 *
 * <p>Applications talk to a {@link com.macstab.oss.kvspace.KvSpace} handle: an asynchronous,
 * localStorage-like key/value API. Underneath, a pluggable {@link
 * com.macstab.oss.kvspace.backend.BackendAdapter} provides named, versioned databases made of
 * named stores with read-only and read-write transactions. kvspace coordinates what the backend
 * does not: sharing one connection between handles, ordering schema upgrades, bounding concurrent
 * transactions, batching writes and running plugins.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * ┌──────────────────────────────────────────────────────────┐
 * │ KvSpace (one per store handle)                           │
 * │   PluginPipeline: before* ─▶ operation ─▶ after*         │
 * └────────────────┬─────────────────────────────────────────┘
 *                  ↓
 * ┌──────────────────────────────────────────────────────────┐
 * │ ConnectionContext (one per driver + database + bucket)   │
 * │   ReadinessQueue      serialized schema steps            │
 * │   AdmissionController maxConcurrentTransactions, idle    │
 * │   WriteCoalescer      window / batch flushes             │
 * └────────────────┬─────────────────────────────────────────┘
 *                  ↓
 * ┌──────────────────────────────────────────────────────────┐
 * │ BackendAdapter ─▶ BackendConnection ─▶ BackendTransaction│
 * │   memory (built in), redis (kvspace-redis)               │
 * └──────────────────────────────────────────────────────────┘
 * </pre>
 *
 * <h2>Threading</h2>
 *
 * <p>Every operation returns a {@link java.util.concurrent.CompletableFuture}. Backend calls are
 * blocking and run on the worker pool of the {@link com.macstab.oss.kvspace.KvSpaceRuntime};
 * timers run on its scheduler thread.
 *
 * <h2>Errors</h2>
 *
 * <p>Futures fail with {@link com.macstab.oss.kvspace.error.KvSpaceException}, carrying an {@link
 * com.macstab.oss.kvspace.error.ErrorCode} and a details map.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
package com.macstab.oss.kvspace;
