/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.metrics.autoconfigure;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import com.macstab.oss.kvspace.metrics.KvSpaceMetrics;
import com.macstab.oss.kvspace.metrics.micrometer.MicrometerKvSpaceMetrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Spring Boot auto-configuration for kvspace metrics.
 *
 * <p><strong>Activation Conditions:</strong>
 *
 * <ol>
 *   <li>{@code MeterRegistry.class} on classpath
 *   <li>{@code MeterRegistry} bean exists (Spring Boot Actuator configured)
 *   <li>{@code management.metrics.kvspace.enabled=true} (default: true)
 * </ol>
 *
 * <p>Otherwise {@link KvSpaceMetrics#NOOP} is exposed, so the kvspace starter can always inject a
 * metrics bean.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
@AutoConfiguration(
    afterName =
        "org.springframework.boot.actuate.autoconfigure.metrics."
            + "CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass(MeterRegistry.class)
@EnableConfigurationProperties(KvSpaceMetricsProperties.class)
public class KvSpaceMetricsAutoConfiguration {

  /**
   * Creates the Micrometer-based collector.
   *
   * @param registry Micrometer meter registry
   * @param properties metrics configuration properties
   * @return Micrometer metrics collector
   */
  @Bean
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnProperty(
      prefix = "management.metrics.kvspace",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean(KvSpaceMetrics.class)
  public KvSpaceMetrics micrometerKvSpaceMetrics(
      final MeterRegistry registry, final KvSpaceMetricsProperties properties) {
    log.info(
        "Activating kvspace metrics (Micrometer) - maxCacheSize: {}", properties.getMaxCacheSize());
    return new MicrometerKvSpaceMetrics(registry, properties.getMaxCacheSize());
  }

  /**
   * Creates the no-op collector when metrics are disabled or no registry exists.
   *
   * @return {@link KvSpaceMetrics#NOOP}
   */
  @Bean
  @ConditionalOnMissingBean(KvSpaceMetrics.class)
  public KvSpaceMetrics noOpKvSpaceMetrics() {
    log.debug("kvspace metrics disabled - using NOOP singleton");
    return KvSpaceMetrics.NOOP;
  }
}
