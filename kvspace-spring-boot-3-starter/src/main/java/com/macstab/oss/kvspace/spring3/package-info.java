/* (C)2026 Christian Schnapka / Macstab GmbH */

/**
 * Spring Boot 3.x auto-configuration for kvspace.
 *
 * <h2>Quick Start</h2>
 *
 * <pre>{@code
 * kvspace:
 *   name: app
 *   store-name: settings
 *   drivers: [redis, memory]
 *   redis:
 *     enabled: true
 * spring:
 *   data:
 *     redis:
 *       host: redis.example.com
 * }</pre>
 *
 * <pre>{@code
 * @Service
 * public class SettingsService {
 *   private final KvSpace space;
 *
 *   public CompletableFuture<Object> theme() {
 *     return space.getItem("theme");
 *   }
 * }
 * }</pre>
 *
 * <h2>Extension Points</h2>
 *
 * <ul>
 *   <li>{@code BackendAdapter} beans are defined as drivers of the runtime
 *   <li>{@code KvSpacePlugin} beans are registered on the handle
 *   <li>A {@code KvSpaceMetrics} bean (from {@code kvspace-metrics}) receives runtime metrics
 * </ul>
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 * @see com.macstab.oss.kvspace.spring3.KvSpaceAutoConfiguration
 */
package com.macstab.oss.kvspace.spring3;
