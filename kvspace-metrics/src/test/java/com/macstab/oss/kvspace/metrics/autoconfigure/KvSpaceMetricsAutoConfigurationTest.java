/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.metrics.autoconfigure;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.macstab.oss.kvspace.metrics.KvSpaceMetrics;
import com.macstab.oss.kvspace.metrics.micrometer.MicrometerKvSpaceMetrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Tests for {@link KvSpaceMetricsAutoConfiguration}.
 *
 * <p><strong>Test Strategy:</strong>
 *
 * <ul>
 *   <li>Use {@link ApplicationContextRunner} for Spring Boot auto-configuration testing
 *   <li>Test conditional bean creation (enabled/disabled/missing MeterRegistry)
 *   <li>Test user-defined bean takes precedence
 * </ul>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("KvSpaceMetricsAutoConfiguration")
class KvSpaceMetricsAutoConfigurationTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(AutoConfigurations.of(KvSpaceMetricsAutoConfiguration.class));

  @Test
  @DisplayName("Should create MicrometerKvSpaceMetrics by default")
  void shouldCreateMicrometerMetricsByDefault() {
    // Arrange & Act
    contextRunner
        .withUserConfiguration(MeterRegistryConfiguration.class)
        .run(
            context -> {
              // Assert
              assertThat(context).hasSingleBean(KvSpaceMetrics.class);
              assertThat(context.getBean(KvSpaceMetrics.class))
                  .isInstanceOf(MicrometerKvSpaceMetrics.class);
            });
  }

  @Test
  @DisplayName("Should create NOOP metrics when explicitly disabled")
  void shouldCreateNoOpMetricsWhenDisabled() {
    // Arrange & Act
    contextRunner
        .withUserConfiguration(MeterRegistryConfiguration.class)
        .withPropertyValues("management.metrics.kvspace.enabled=false")
        .run(
            context -> {
              // Assert
              assertThat(context).hasSingleBean(KvSpaceMetrics.class);
              assertThat(context.getBean(KvSpaceMetrics.class)).isSameAs(KvSpaceMetrics.NOOP);
            });
  }

  @Test
  @DisplayName("Should create NOOP metrics when MeterRegistry missing")
  void shouldCreateNoOpMetricsWhenMeterRegistryMissing() {
    // Arrange & Act
    contextRunner.run(
        context -> {
          // Assert
          assertThat(context).hasSingleBean(KvSpaceMetrics.class);
          assertThat(context.getBean(KvSpaceMetrics.class)).isSameAs(KvSpaceMetrics.NOOP);
        });
  }

  @Test
  @DisplayName("Should keep a user-defined KvSpaceMetrics")
  void shouldKeepUserDefinedMetrics() {
    // Arrange & Act
    contextRunner
        .withUserConfiguration(MeterRegistryConfiguration.class, CustomMetricsConfiguration.class)
        .run(
            context -> {
              // Assert
              assertThat(context).hasSingleBean(KvSpaceMetrics.class);
              assertThat(context.getBean(KvSpaceMetrics.class))
                  .isSameAs(CustomMetricsConfiguration.CUSTOM);
            });
  }

  @Test
  @DisplayName("Should bind properties")
  void shouldBindProperties() {
    // Arrange & Act
    contextRunner
        .withUserConfiguration(MeterRegistryConfiguration.class)
        .withPropertyValues("management.metrics.kvspace.max-cache-size=50")
        .run(
            context -> {
              // Assert
              final var props = context.getBean(KvSpaceMetricsProperties.class);
              assertThat(props.isEnabled()).isTrue();
              assertThat(props.getMaxCacheSize()).isEqualTo(50);
            });
  }

  /** Provides {@link SimpleMeterRegistry} bean for testing. */
  @Configuration
  static class MeterRegistryConfiguration {
    @Bean
    SimpleMeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }

  /** Provides a custom metrics bean. */
  @Configuration
  static class CustomMetricsConfiguration {
    static final KvSpaceMetrics CUSTOM = new KvSpaceMetrics() {};

    @Bean
    KvSpaceMetrics customMetrics() {
      return CUSTOM;
    }
  }
}
