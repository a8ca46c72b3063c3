/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.spring3;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import com.macstab.oss.kvspace.KvSpace;
import com.macstab.oss.kvspace.KvSpaceConfig;
import com.macstab.oss.kvspace.KvSpaceRuntime;
import com.macstab.oss.kvspace.backend.BackendAdapter;
import com.macstab.oss.kvspace.metrics.KvSpaceMetrics;
import com.macstab.oss.kvspace.metrics.autoconfigure.KvSpaceMetricsAutoConfiguration;
import com.macstab.oss.kvspace.plugin.KvSpacePlugin;
import com.macstab.oss.kvspace.redis.RedisBackendAdapter;

import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import lombok.extern.slf4j.Slf4j;

/**
 * Auto-configuration exposing a {@link KvSpace} handle.
 *
 * <p><strong>Beans:</strong>
 *
 * <ul>
 *   <li>{@link KvSpaceRuntime} - owns drivers, connection contexts and threads. Every {@link
 *       BackendAdapter} bean is defined as a driver; the {@link KvSpaceMetrics} bean (NOOP when the
 *       metrics auto-configuration is absent) is wired in. Closed with the context.
 *   <li>{@link KvSpaceConfig} - built from {@link KvSpaceProperties} and validated.
 *   <li>{@link KvSpace} - the handle, with every {@link KvSpacePlugin} bean registered.
 * </ul>
 *
 * <p><strong>Redis driver:</strong> with {@code kvspace-redis} on the classpath and {@code
 * kvspace.redis.enabled=true}, a {@link RedisBackendAdapter} is created from {@code
 * spring.data.redis.*} ({@code url} overrides host, port, credentials and database). Add {@code
 * redis} to {@code kvspace.drivers} to select it.
 *
 * <p>All beans back off when the application defines its own.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
@AutoConfiguration(after = KvSpaceMetricsAutoConfiguration.class)
@ConditionalOnClass(KvSpace.class)
@EnableConfigurationProperties(KvSpaceProperties.class)
public class KvSpaceAutoConfiguration {

  /**
   * Creates the runtime and defines every adapter bean as a driver.
   *
   * @param metricsProvider metrics collector provider (optional)
   * @param adapters backend adapter beans, in bean order
   * @return runtime closed on context shutdown
   */
  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public KvSpaceRuntime kvSpaceRuntime(
      final ObjectProvider<KvSpaceMetrics> metricsProvider,
      final ObjectProvider<BackendAdapter> adapters) {
    final var metrics = metricsProvider.getIfAvailable(() -> KvSpaceMetrics.NOOP);
    final var runtime = KvSpaceRuntime.create(metrics);
    adapters.orderedStream().forEach(adapter -> runtime.getDrivers().define(adapter));

    if (log.isInfoEnabled()) {
      log.info(
          "kvspace runtime: drivers={}, metrics={}",
          runtime.getDrivers().getDriverNames(),
          metrics == KvSpaceMetrics.NOOP ? "disabled" : "enabled");
    }
    return runtime;
  }

  @Bean
  @ConditionalOnMissingBean
  public KvSpaceConfig kvSpaceConfig(final KvSpaceProperties properties) {
    return properties.toConfig().validate();
  }

  /**
   * Creates the handle. No connection is opened until its first operation.
   *
   * @param config handle configuration
   * @param runtime runtime
   * @param plugins plugin beans, in bean order
   * @return handle
   */
  @Bean
  @ConditionalOnMissingBean
  public KvSpace kvSpace(
      final KvSpaceConfig config,
      final KvSpaceRuntime runtime,
      final ObjectProvider<KvSpacePlugin> plugins) {
    final var space = KvSpace.create(config, runtime);
    plugins.orderedStream().forEach(space::use);
    return space;
  }

  /** Redis driver, opt-in through {@code kvspace.redis.enabled}. */
  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass({RedisBackendAdapter.class, RedisClient.class})
  @ConditionalOnProperty(prefix = "kvspace.redis", name = "enabled", havingValue = "true")
  @EnableConfigurationProperties(RedisProperties.class)
  static class RedisDriverConfiguration {

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    RedisClient kvSpaceRedisClient(final RedisProperties properties) {
      final var uri = buildRedisUri(properties);
      if (log.isInfoEnabled()) {
        log.info("kvspace Redis driver: host={}:{}", uri.getHost(), uri.getPort());
      }
      return RedisClient.create(uri);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    RedisBackendAdapter redisBackendAdapter(final RedisClient kvSpaceRedisClient) {
      return new RedisBackendAdapter(kvSpaceRedisClient);
    }

    /** {@code url} overrides all individual connection properties. */
    static RedisURI buildRedisUri(final RedisProperties props) {
      final RedisURI uri;
      if (StringUtils.hasText(props.getUrl())) {
        uri = RedisURI.create(props.getUrl());
      } else {
        uri = RedisURI.create(props.getHost(), props.getPort());
        uri.setDatabase(props.getDatabase());
        if (StringUtils.hasText(props.getUsername())) {
          uri.setUsername(props.getUsername());
        }
        if (StringUtils.hasText(props.getPassword())) {
          uri.setPassword(props.getPassword().toCharArray());
        }
        if (props.getSsl() != null && props.getSsl().isEnabled()) {
          uri.setSsl(true);
        }
      }
      if (props.getTimeout() != null) {
        uri.setTimeout(props.getTimeout());
      }
      if (StringUtils.hasText(props.getClientName())) {
        uri.setClientName(props.getClientName());
      }
      return uri;
    }
  }
}
