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

package com.axonops.libdaac.cache;

import com.axonops.libdaac.metrics.DaacMetricsRegistry;
import java.util.Objects;

/**
 * Configuration for the libdaac automaton cache, resource limits and metrics.
 *
 * <p>Immutable configuration using Java 17 records.
 *
 * <h2>Automaton Cache</h2>
 *
 * <p>{@link com.axonops.libdaac.api.Daac#compile} caches built automata keyed by the pattern list
 * and match kind. When the cache exceeds {@code maxCacheSize}, the least-recently-used entries are
 * evicted by a background thread. Automata are plain heap objects, so an evicted automaton stays
 * fully usable by callers that still hold it; eviction only drops the cache's reference.
 *
 * <h3>Eviction Protection</h3>
 *
 * <p>{@code evictionProtectionMs} keeps an automaton that was just built or used out of the LRU
 * sweep for this duration (default: 1 second), so that bursts of distinct pattern lists do not
 * evict each other before they are reused.
 *
 * <h3>Resource Limits</h3>
 *
 * <p>{@code maxPatterns} bounds the size of a single pattern list. Larger lists are rejected with
 * {@link com.axonops.libdaac.api.ResourceException} before anything is built.
 *
 * <h2>Configuration Examples</h2>
 *
 * <pre>{@code
 * // Defaults (1K cached automata, metrics disabled)
 * Daac.setGlobalCache(new AutomatonCache(DaacConfig.DEFAULT));
 *
 * // Larger cache with Dropwizard metrics
 * DaacConfig config = DaacConfig.builder()
 *     .maxCacheSize(10_000)
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.daac"))
 *     .build();
 *
 * // No caching: every compile builds a fresh automaton
 * DaacConfig config = DaacConfig.NO_CACHE;
 * }</pre>
 *
 * @param cacheEnabled enable automaton caching
 * @param maxCacheSize maximum automata in cache before LRU eviction (must be > 0 if cache enabled)
 * @param evictionProtectionMs protect recently used automata from eviction for this duration
 * @param maxPatterns maximum patterns in one automaton (must be > 0)
 * @param metricsRegistry metrics implementation ({@link DaacMetricsRegistry#NOOP} for zero
 *     overhead)
 * @since 1.0.0
 * @see com.axonops.libdaac.cache.AutomatonCache
 * @see com.axonops.libdaac.metrics.MetricNames
 */
public record DaacConfig(
    boolean cacheEnabled,
    int maxCacheSize,
    long evictionProtectionMs,
    int maxPatterns,
    DaacMetricsRegistry metricsRegistry) {

  /**
   * Default configuration: cache of 1,000 automata, 1 second eviction protection, at most 1,000,000
   * patterns per automaton, metrics disabled.
   */
  public static final DaacConfig DEFAULT =
      new DaacConfig(
          true, // Cache enabled
          1000, // Max 1K cached automata
          1000, // 1 second eviction protection
          1_000_000, // Max 1M patterns per automaton
          DaacMetricsRegistry.NOOP // Metrics disabled
          );

  /** Configuration with caching disabled. Every compile builds a new automaton. */
  public static final DaacConfig NO_CACHE =
      new DaacConfig(
          false, // Cache disabled
          0, // Ignored when cache disabled
          0, // Ignored when cache disabled
          1_000_000, // Still enforce pattern limit
          DaacMetricsRegistry.NOOP // Metrics disabled
          );

  /** Compact constructor with validation. */
  public DaacConfig {
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");

    // Always validate resource limits (even if cache disabled)
    if (maxPatterns <= 0) {
      throw new IllegalArgumentException("maxPatterns must be positive");
    }

    if (cacheEnabled) {
      if (maxCacheSize <= 0) {
        throw new IllegalArgumentException("maxCacheSize must be positive when cache enabled");
      }
      if (evictionProtectionMs < 0) {
        throw new IllegalArgumentException(
            "evictionProtectionMs must be non-negative when cache enabled");
      }
    }
  }

  /**
   * Creates a builder for custom configuration.
   *
   * <pre>{@code
   * DaacConfig config = DaacConfig.builder()
   *     .maxCacheSize(10_000)
   *     .build();
   * }</pre>
   *
   * @return new builder with default values
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for custom configuration.
   *
   * <p>All fields start with the defaults of {@link #DEFAULT}.
   */
  public static class Builder {
    private boolean cacheEnabled = true;
    private int maxCacheSize = 1000;
    private long evictionProtectionMs = 1000;
    private int maxPatterns = 1_000_000;
    private DaacMetricsRegistry metricsRegistry = DaacMetricsRegistry.NOOP;

    /**
     * Enable or disable automaton caching.
     *
     * @param enabled true to enable caching (default)
     * @return this builder
     */
    public Builder cacheEnabled(boolean enabled) {
      this.cacheEnabled = enabled;
      return this;
    }

    /**
     * Set maximum number of automata in cache before LRU eviction.
     *
     * <p><b>Default: 1,000</b>
     *
     * <p>Monitor {@code cache.heap_memory.current.bytes} to tune; an automaton over a few thousand
     * keywords typically takes tens to hundreds of KB.
     *
     * @param size maximum cached automata (must be > 0)
     * @return this builder
     */
    public Builder maxCacheSize(int size) {
      this.maxCacheSize = size;
      return this;
    }

    /**
     * Set eviction protection period for recently used automata.
     *
     * <p><b>Default: 1000ms</b>
     *
     * @param ms protection period in milliseconds (must be ≥ 0)
     * @return this builder
     */
    public Builder evictionProtectionMs(long ms) {
      this.evictionProtectionMs = ms;
      return this;
    }

    /**
     * Set maximum number of patterns in one automaton.
     *
     * <p><b>Default: 1,000,000</b>
     *
     * <p>Increase if hitting the {@code errors.resource.exhausted.total.count} metric.
     *
     * @param max maximum patterns (must be > 0)
     * @return this builder
     */
    public Builder maxPatterns(int max) {
      this.maxPatterns = max;
      return this;
    }

    /**
     * Set metrics registry for instrumentation.
     *
     * <p><b>Default: {@link DaacMetricsRegistry#NOOP}</b>
     *
     * @param metricsRegistry metrics implementation (must not be null)
     * @return this builder
     * @throws NullPointerException if metricsRegistry is null
     */
    public Builder metricsRegistry(DaacMetricsRegistry metricsRegistry) {
      this.metricsRegistry =
          Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
      return this;
    }

    /**
     * Build immutable configuration.
     *
     * @return validated immutable configuration
     * @throws IllegalArgumentException if configuration is invalid
     */
    public DaacConfig build() {
      return new DaacConfig(
          cacheEnabled, maxCacheSize, evictionProtectionMs, maxPatterns, metricsRegistry);
    }
  }
}
