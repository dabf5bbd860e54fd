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

package com.axonops.libdaac.metrics;

import java.util.function.Supplier;

/**
 * Abstract metrics registry interface for libdaac-java.
 *
 * <p>Allows the library to work with or without the Dropwizard Metrics dependency. Implementations
 * can use Dropwizard Metrics, a custom metrics system, or nothing at all.
 *
 * <p><strong>Metric Types (following Dropwizard patterns):</strong>
 *
 * <ul>
 *   <li><strong>Counter:</strong> atomic long counter (incrementing values)
 *   <li><strong>Timer:</strong> duration in nanoseconds with histogram
 *   <li><strong>Gauge:</strong> instantaneous value computed on demand via supplier
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> all implementations must be thread-safe.
 *
 * <p>{@link #NOOP} discards everything and is the default in
 * {@link com.axonops.libdaac.cache.DaacConfig#DEFAULT}.
 *
 * @since 1.0.0
 */
public interface DaacMetricsRegistry {

  /** Records nothing. */
  DaacMetricsRegistry NOOP =
      new DaacMetricsRegistry() {
        @Override
        public void incrementCounter(String name) {}

        @Override
        public void incrementCounter(String name, long delta) {}

        @Override
        public void recordTimer(String name, long durationNanos) {}

        @Override
        public void registerGauge(String name, Supplier<Number> valueSupplier) {}

        @Override
        public void removeGauge(String name) {}

        @Override
        public String toString() {
          return "DaacMetricsRegistry.NOOP";
        }
      };

  /**
   * Increment a counter by 1.
   *
   * @param name metric name (e.g., "automata.built.total.count")
   */
  void incrementCounter(String name);

  /**
   * Increment a counter by a specific delta.
   *
   * @param name metric name (e.g., "matching.matches.total.count")
   * @param delta amount to increment (must be non-negative)
   */
  void incrementCounter(String name, long delta);

  /**
   * Record a timer measurement in nanoseconds.
   *
   * <p>Timers maintain histograms of duration measurements, allowing calculation of percentiles
   * (P50, P99, etc.).
   *
   * @param name metric name (e.g., "automata.build.latency")
   * @param durationNanos duration in nanoseconds
   */
  void recordTimer(String name, long durationNanos);

  /**
   * Register a gauge that computes its value on demand.
   *
   * <p>The supplier is called each time the gauge is read (e.g., via JMX) and must not block. An
   * existing gauge with the same name is replaced.
   *
   * @param name metric name (e.g., "cache.automata.current.count")
   * @param valueSupplier function that returns the current value
   */
  void registerGauge(String name, Supplier<Number> valueSupplier);

  /**
   * Remove a previously registered gauge. No-op if no gauge exists with this name.
   *
   * @param name metric name to remove
   */
  void removeGauge(String name);
}
