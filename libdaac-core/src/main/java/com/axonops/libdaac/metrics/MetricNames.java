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

/**
 * Metric name constants for libdaac instrumentation.
 *
 * <h2>Architecture Overview</h2>
 *
 * <h3>Automaton Cache</h3>
 *
 * <p>Building an automaton is linear in the total pattern length but still orders of magnitude
 * slower than a single scan, so {@link com.axonops.libdaac.api.Daac#compile} caches automata keyed
 * by (pattern list, match kind):
 *
 * <ol>
 *   <li><b>Cache Hit</b> - automaton found in cache, returned immediately
 *   <li><b>Cache Miss</b> - automaton built, stored in cache for reuse
 * </ol>
 *
 * <p>When the cache exceeds {@code maxCacheSize} the least-recently-used entries are evicted
 * asynchronously. Entries younger than {@code evictionProtectionMs} are never evicted.
 *
 * <h3>Heap Accounting</h3>
 *
 * <p>Automata live entirely on the JVM heap as int arrays. {@link
 * com.axonops.libdaac.api.Automaton#memoryBytes()} reports the size of those arrays, and the cache
 * sums it over its entries.
 *
 * <h2>Metric Categories</h2>
 *
 * <ul>
 *   <li><b>Automaton Construction (3 metrics)</b> - build counts, latency and state counts
 *   <li><b>Cache (6 metrics)</b> - hits, misses, evictions, size and memory
 *   <li><b>Matching (6 metrics)</b> - search counts, latencies per kind of search, matches found
 *   <li><b>Errors (3 metrics)</b> - invalid patterns, unsupported searches, resource limits
 * </ul>
 *
 * <h2>Metric Types</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - monotonically increasing count (suffix: {@code .total.count})
 *   <li><b>Timer</b> - latency histogram with percentiles (suffix: {@code .latency})
 *   <li><b>Gauge</b> - current or peak value (suffix: {@code .current.*} or {@code .peak.*})
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * DaacConfig config = DaacMetricsConfig.withMetrics(registry, "myapp.daac", true);
 * Daac.setGlobalCache(new AutomatonCache(config));
 *
 * Automaton automaton = Daac.compile(List.of("error", "warn"));
 * automaton.find(line); // latency recorded in MATCHING_FIND_LATENCY
 *
 * Counter builds = registry.counter(
 *     MetricRegistry.name("myapp.daac", MetricNames.AUTOMATA_BUILT));
 * }</pre>
 *
 * <h2>Monitoring Recommendations</h2>
 *
 * <ul>
 *   <li><b>Cache Hit Rate:</b> AUTOMATA_CACHE_HITS / (AUTOMATA_CACHE_HITS + AUTOMATA_CACHE_MISSES)
 *       - should approach 100% once the working set of pattern lists is warm
 *   <li><b>Memory Growth:</b> CACHE_HEAP_MEMORY should stabilize after warmup
 *   <li><b>Errors:</b> ERRORS_UNSUPPORTED_SEARCH is always a caller bug
 * </ul>
 *
 * @since 1.0.0
 * @see com.axonops.libdaac.cache.AutomatonCache
 * @see com.axonops.libdaac.api.Automaton
 */
public final class MetricNames {
  private MetricNames() {}

  // ========================================
  // Automaton Construction Metrics (3)
  // ========================================

  /**
   * Total automata built.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Incremented:</b> Each time {@code Automaton.build} completes, cached or not
   */
  public static final String AUTOMATA_BUILT = "automata.built.total.count";

  /**
   * Automaton construction latency histogram.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   *
   * <p><b>Recorded:</b> For each successful build (trie, failure links, outputs, double array)
   *
   * <p><b>Interpretation:</b> Grows linearly with total pattern length
   */
  public static final String AUTOMATA_BUILD_LATENCY = "automata.build.latency";

  /**
   * Total states created across all builds.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Incremented:</b> By the state count of each built automaton
   */
  public static final String AUTOMATA_STATES = "automata.states.total.count";

  // ========================================
  // Cache Metrics (6)
  // ========================================

  /**
   * Total cache hits (automaton found in cache).
   *
   * <p><b>Type:</b> Counter
   */
  public static final String AUTOMATA_CACHE_HITS = "automata.cache.hits.total.count";

  /**
   * Total cache misses (automaton built and inserted).
   *
   * <p><b>Type:</b> Counter
   */
  public static final String AUTOMATA_CACHE_MISSES = "automata.cache.misses.total.count";

  /**
   * Automata evicted due to LRU cache overflow.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Interpretation:</b> High values indicate the cache is smaller than the working set
   */
  public static final String CACHE_EVICTIONS_LRU = "cache.evictions.lru.total.count";

  /**
   * Current number of automata in cache.
   *
   * <p><b>Type:</b> Gauge (count)
   */
  public static final String CACHE_AUTOMATA_COUNT = "cache.automata.current.count";

  /**
   * Current heap memory held by cached automata.
   *
   * <p><b>Type:</b> Gauge (bytes)
   */
  public static final String CACHE_HEAP_MEMORY = "cache.heap_memory.current.bytes";

  /**
   * Peak heap memory held by cached automata (high water mark).
   *
   * <p><b>Type:</b> Gauge (bytes)
   */
  public static final String CACHE_HEAP_MEMORY_PEAK = "cache.heap_memory.peak.bytes";

  // ========================================
  // Matching Metrics (6)
  // ========================================

  /**
   * Total search operations of every kind.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHING_OPERATIONS = "matching.operations.total.count";

  /**
   * Latency of {@code find} (non-overlapping, any match kind).
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String MATCHING_FIND_LATENCY = "matching.find.latency";

  /**
   * Latency of {@code findOverlapping}.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String MATCHING_OVERLAPPING_LATENCY = "matching.overlapping.latency";

  /**
   * Latency of {@code findOverlappingNoSuffix}.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String MATCHING_OVERLAPPING_NO_SUFFIX_LATENCY =
      "matching.overlapping_no_suffix.latency";

  /**
   * Latency of every search operation combined.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   *
   * <p><b>Interpretation:</b> Linear in input length plus number of matches reported
   */
  public static final String MATCHING_LATENCY = "matching.latency";

  /**
   * Total matches reported across all searches.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHING_MATCHES = "matching.matches.total.count";

  // ========================================
  // Error Metrics (3)
  // ========================================

  /**
   * Builds rejected because of an empty or null pattern.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String ERRORS_INVALID_PATTERN = "errors.invalid_pattern.total.count";

  /**
   * Overlapping searches attempted on a leftmost automaton.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String ERRORS_UNSUPPORTED_SEARCH = "errors.unsupported_search.total.count";

  /**
   * Builds rejected because the pattern list exceeded {@code maxPatterns}.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String ERRORS_RESOURCE_EXHAUSTED = "errors.resource.exhausted.total.count";
}
