/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.libdaac.dropwizard;

import com.axonops.libdaac.cache.DaacConfig;
import com.axonops.libdaac.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Convenience factory for {@link DaacConfig} with Dropwizard Metrics integration.
 *
 * <p>Wires a {@link DropwizardMetricsAdapter} into the configuration and, unless told otherwise,
 * exposes the registry over JMX.
 *
 * <p><strong>Usage Examples:</strong>
 *
 * <pre>{@code
 * // Application already owning a registry:
 * DaacConfig config = DaacMetricsConfig.withMetrics(appRegistry, "com.myapp.keywords");
 * Daac.setGlobalCache(new AutomatonCache(config));
 *
 * // Keep custom cache settings:
 * DaacConfig base = DaacConfig.builder().maxCacheSize(10_000).build();
 * DaacConfig config = DaacMetricsConfig.withMetrics(registry, "com.myapp.keywords", true, base);
 * }</pre>
 *
 * <p><strong>JMX Exposure:</strong> one {@link JmxReporter} is started for the first registry
 * seen (if not already configured), making every libdaac metric visible under the {@code metrics}
 * JMX domain.
 *
 * @since 1.0.0
 */
public final class DaacMetricsConfig {
  private static final Logger logger = LoggerFactory.getLogger(DaacMetricsConfig.class);
  private static volatile JmxReporter jmxReporter;

  private DaacMetricsConfig() {
    // Utility class
  }

  /**
   * Creates DaacConfig with Dropwizard Metrics integration and the default prefix {@code
   * com.axonops.libdaac}, with JMX.
   *
   * @param registry the Dropwizard MetricRegistry to use
   * @return configured DaacConfig with metrics enabled
   */
  public static DaacConfig withMetrics(MetricRegistry registry) {
    return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
  }

  /**
   * Creates DaacConfig with Dropwizard Metrics integration and automatic JMX.
   *
   * @param registry the Dropwizard MetricRegistry to use
   * @param metricPrefix the metric namespace prefix
   * @return configured DaacConfig with metrics enabled
   */
  public static DaacConfig withMetrics(MetricRegistry registry, String metricPrefix) {
    return withMetrics(registry, metricPrefix, true);
  }

  /**
   * Creates DaacConfig with Dropwizard Metrics integration.
   *
   * @param registry the Dropwizard MetricRegistry to use
   * @param metricPrefix the metric namespace prefix
   * @param enableJmx whether to set up JMX exposure
   * @return configured DaacConfig with metrics enabled, all other settings default
   */
  public static DaacConfig withMetrics(
      MetricRegistry registry, String metricPrefix, boolean enableJmx) {
    return withMetrics(registry, metricPrefix, enableJmx, DaacConfig.DEFAULT);
  }

  /**
   * Copies {@code base} with its metrics registry replaced by a Dropwizard adapter.
   *
   * @param registry the Dropwizard MetricRegistry to use
   * @param metricPrefix the metric namespace prefix
   * @param enableJmx whether to set up JMX exposure
   * @param base cache and limit settings to keep
   * @return configured DaacConfig with metrics enabled
   */
  public static DaacConfig withMetrics(
      MetricRegistry registry, String metricPrefix, boolean enableJmx, DaacConfig base) {
    Objects.requireNonNull(registry, "registry cannot be null");
    Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");
    Objects.requireNonNull(base, "base cannot be null");

    if (enableJmx) {
      ensureJmxReporter(registry);
    }

    return DaacConfig.builder()
        .cacheEnabled(base.cacheEnabled())
        .maxCacheSize(base.maxCacheSize())
        .evictionProtectionMs(base.evictionProtectionMs())
        .maxPatterns(base.maxPatterns())
        .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix))
        .build();
  }

  /** True while a reporter started by this class is running. */
  public static boolean isJmxReporterRunning() {
    return jmxReporter != null;
  }

  /**
   * Idempotent: only one reporter is created; later registries are not reported.
   *
   * @param registry the MetricRegistry to expose via JMX
   */
  private static synchronized void ensureJmxReporter(MetricRegistry registry) {
    if (jmxReporter != null) {
      return;
    }
    try {
      logger.info("DAAC: Registering JmxReporter for metrics");
      JmxReporter reporter = JmxReporter.forRegistry(registry).build();
      reporter.start();
      jmxReporter = reporter;
      logger.info("DAAC: JmxReporter started - metrics available via JMX");
    } catch (RuntimeException e) {
      // Not fatal: the registry may already be exposed by the host application
      logger.warn("DAAC: Failed to start JmxReporter (may already be configured)", e);
    }
  }

  /** Stops the JMX reporter started by this class, if any. */
  public static synchronized void shutdown() {
    if (jmxReporter != null) {
      logger.info("DAAC: Stopping JmxReporter");
      jmxReporter.stop();
      jmxReporter = null;
    }
  }
}
