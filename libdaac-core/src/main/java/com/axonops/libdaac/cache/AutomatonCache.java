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

import com.axonops.libdaac.api.Automaton;
import com.axonops.libdaac.api.MatchKind;
import com.axonops.libdaac.metrics.DaacMetricsRegistry;
import com.axonops.libdaac.metrics.MetricNames;
import com.axonops.libdaac.util.PatternHasher;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe cache of built automata keyed by pattern list and match kind.
 *
 * <p>Performance characteristics: lock-free reads (ConcurrentHashMap), lock-free timestamp
 * updates (AtomicLong), non-blocking eviction (async sampled LRU). The limit is soft: the cache can
 * temporarily exceed {@code maxCacheSize} while eviction runs in the background.
 *
 * <p>Evicting an automaton only drops the cache's reference. Automata are immutable heap objects,
 * so callers holding one keep using it unaffected.
 *
 * @since 1.0.0
 */
public final class AutomatonCache {
  private static final Logger logger = LoggerFactory.getLogger(AutomatonCache.class);

  private static final int LRU_SAMPLE_SIZE = 500;

  private final DaacConfig config;

  // null when caching is disabled
  private final ConcurrentHashMap<CacheKey, CachedAutomaton> cache;

  // Single-thread executor for async LRU eviction (doesn't block cache access)
  private final ExecutorService lruEvictionExecutor;

  // Statistics (all atomic, lock-free)
  private final AtomicLong hits = new AtomicLong(0);
  private final AtomicLong misses = new AtomicLong(0);
  private final AtomicLong evictionsLRU = new AtomicLong(0);

  private final AtomicLong totalHeapMemoryBytes = new AtomicLong(0);
  private final AtomicLong peakHeapMemoryBytes = new AtomicLong(0);

  /**
   * Creates a new automaton cache with the given configuration.
   *
   * @param config the cache configuration
   */
  public AutomatonCache(DaacConfig config) {
    this.config = config;

    if (config.cacheEnabled()) {
      this.cache = new ConcurrentHashMap<>(Math.min(config.maxCacheSize(), 1024));
      this.lruEvictionExecutor =
          Executors.newSingleThreadExecutor(
              r -> {
                Thread t = new Thread(r, "DAAC-LRU-Eviction");
                t.setDaemon(true);
                t.setPriority(Thread.MIN_PRIORITY);
                return t;
              });

      logger.debug(
          "DAAC: Automaton cache initialized - maxSize: {}, evictionProtection: {}ms",
          config.maxCacheSize(),
          config.evictionProtectionMs());

      registerCacheMetrics();
    } else {
      this.cache = null;
      this.lruEvictionExecutor = null;
      logger.info("DAAC: Automaton caching disabled");
    }
  }

  public DaacConfig getConfig() {
    return config;
  }

  /**
   * Gets or builds an automaton.
   *
   * <p>Lock-free for cache hits. On a miss {@code builder} runs inside {@code computeIfAbsent}, so
   * only one thread builds each distinct key. If the builder throws, nothing is cached and the
   * exception reaches the caller.
   *
   * @param patterns pattern list; copied into the key
   * @param kind match kind
   * @param builder builds the automaton on a cache miss
   * @return cached or newly built automaton
   */
  public Automaton getOrBuild(List<String> patterns, MatchKind kind, Supplier<Automaton> builder) {
    DaacMetricsRegistry metrics = config.metricsRegistry();

    if (!config.cacheEnabled()) {
      misses.incrementAndGet();
      metrics.incrementCounter(MetricNames.AUTOMATA_CACHE_MISSES);
      return builder.get();
    }

    CacheKey key = new CacheKey(List.copyOf(patterns), kind);

    CachedAutomaton cached = cache.get(key);
    if (cached != null) {
      cached.touch();
      hits.incrementAndGet();
      metrics.incrementCounter(MetricNames.AUTOMATA_CACHE_HITS);
      logger.trace("DAAC: Cache hit - {}", key);
      return cached.automaton();
    }

    misses.incrementAndGet();
    metrics.incrementCounter(MetricNames.AUTOMATA_CACHE_MISSES);
    logger.trace("DAAC: Cache miss - {}, building", key);

    // Track whether this thread built a new automaton
    final long[] addedMemory = {0};

    CachedAutomaton entry =
        cache.computeIfAbsent(
            key,
            k -> {
              CachedAutomaton created = new CachedAutomaton(builder.get());
              addedMemory[0] = created.memoryBytes();
              return created;
            });

    if (addedMemory[0] > 0) {
      totalHeapMemoryBytes.addAndGet(addedMemory[0]);
      updatePeakMemory();
    }

    int currentSize = cache.size();
    if (currentSize > config.maxCacheSize()) {
      triggerAsyncLRUEviction(currentSize - config.maxCacheSize());
    }

    return entry.automaton();
  }

  private void triggerAsyncLRUEviction(int toEvict) {
    if (toEvict <= 0) {
      return;
    }

    lruEvictionExecutor.submit(
        () -> {
          try {
            evictLRUBatch(toEvict);
          } catch (RuntimeException e) {
            logger.warn("DAAC: Error during async LRU eviction", e);
          }
        });
  }

  /**
   * Evicts least-recently-used automata.
   *
   * <p>Sample-based LRU: takes up to {@value #LRU_SAMPLE_SIZE} entries older than the eviction
   * protection window and evicts the oldest of them.
   *
   * @return number of automata evicted
   */
  int evictLRUBatch(int toEvict) {
    int actualToEvict = Math.min(toEvict, cache.size() - config.maxCacheSize());
    if (actualToEvict <= 0) {
      return 0;
    }

    long cutoffTime = System.nanoTime() - config.evictionProtectionMs() * 1_000_000L;

    List<Map.Entry<CacheKey, CachedAutomaton>> candidates =
        cache.entrySet().stream()
            .filter(e -> e.getValue().lastAccessTimeNanos() <= cutoffTime)
            .limit(LRU_SAMPLE_SIZE)
            .sorted(Comparator.comparingLong(e -> e.getValue().lastAccessTimeNanos()))
            .limit(actualToEvict)
            .collect(Collectors.toList());

    int evicted = 0;
    for (Map.Entry<CacheKey, CachedAutomaton> entry : candidates) {
      CachedAutomaton cached = entry.getValue();
      if (cache.remove(entry.getKey(), cached)) {
        totalHeapMemoryBytes.addAndGet(-cached.memoryBytes());
        evictionsLRU.incrementAndGet();
        config.metricsRegistry().incrementCounter(MetricNames.CACHE_EVICTIONS_LRU);
        logger.trace("DAAC: LRU evicting automaton: {}", entry.getKey());
        evicted++;
      }
    }

    if (evicted > 0) {
      logger.debug(
          "DAAC: LRU eviction completed - evicted: {}, cacheSize: {}/{}",
          evicted,
          cache.size(),
          config.maxCacheSize());
    }
    return evicted;
  }

  /** Gets cache statistics snapshot. */
  public CacheStatistics getStatistics() {
    int currentSize = config.cacheEnabled() ? cache.size() : 0;

    return new CacheStatistics(
        hits.get(),
        misses.get(),
        evictionsLRU.get(),
        currentSize,
        config.maxCacheSize(),
        totalHeapMemoryBytes.get(),
        peakHeapMemoryBytes.get());
  }

  /** Removes every cached automaton. Statistics are kept. */
  public void clear() {
    if (!config.cacheEnabled()) {
      return;
    }

    logger.debug("DAAC: Clearing cache - {} cached automata", cache.size());
    cache.clear();
    totalHeapMemoryBytes.set(0);
  }

  /** Resets cache statistics (for testing only). */
  public void resetStatistics() {
    hits.set(0);
    misses.set(0);
    evictionsLRU.set(0);
    peakHeapMemoryBytes.set(totalHeapMemoryBytes.get());
    logger.trace("DAAC: Cache statistics reset");
  }

  /** Full reset for testing (clears cache and resets statistics). */
  public void reset() {
    clear();
    resetStatistics();
  }

  /** Shuts down the cache (stops the eviction thread, clears cache, removes gauges). */
  public void shutdown() {
    logger.info("DAAC: Shutting down cache");

    if (lruEvictionExecutor != null) {
      lruEvictionExecutor.shutdown();
      try {
        if (!lruEvictionExecutor.awaitTermination(1, TimeUnit.SECONDS)) {
          lruEvictionExecutor.shutdownNow();
        }
      } catch (InterruptedException e) {
        lruEvictionExecutor.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }

    clear();

    if (config.cacheEnabled()) {
      DaacMetricsRegistry metrics = config.metricsRegistry();
      metrics.removeGauge(MetricNames.CACHE_AUTOMATA_COUNT);
      metrics.removeGauge(MetricNames.CACHE_HEAP_MEMORY);
      metrics.removeGauge(MetricNames.CACHE_HEAP_MEMORY_PEAK);
    }
  }

  private void registerCacheMetrics() {
    DaacMetricsRegistry metrics = config.metricsRegistry();

    metrics.registerGauge(MetricNames.CACHE_AUTOMATA_COUNT, cache::size);
    metrics.registerGauge(MetricNames.CACHE_HEAP_MEMORY, totalHeapMemoryBytes::get);
    metrics.registerGauge(MetricNames.CACHE_HEAP_MEMORY_PEAK, peakHeapMemoryBytes::get);

    logger.debug("DAAC: Metrics registered - cache gauges");
  }

  private void updatePeakMemory() {
    long current = totalHeapMemoryBytes.get();
    long peak;
    do {
      peak = peakHeapMemoryBytes.get();
    } while (current > peak && !peakHeapMemoryBytes.compareAndSet(peak, current));
  }

  /** Cache key combining the ordered pattern list and match kind. */
  private record CacheKey(List<String> patterns, MatchKind kind) {
    @Override
    public String toString() {
      return PatternHasher.describe(patterns) + " (kind=" + kind + ")";
    }
  }

  /** Cached automaton with atomic access time tracking. */
  private static final class CachedAutomaton {
    private final Automaton automaton;
    private final AtomicLong lastAccessTimeNanos;
    private final long memoryBytes;

    CachedAutomaton(Automaton automaton) {
      this.automaton = automaton;
      this.lastAccessTimeNanos = new AtomicLong(System.nanoTime());
      this.memoryBytes = automaton.memoryBytes();
    }

    Automaton automaton() {
      return automaton;
    }

    long lastAccessTimeNanos() {
      return lastAccessTimeNanos.get();
    }

    long memoryBytes() {
      return memoryBytes;
    }

    void touch() {
      lastAccessTimeNanos.set(System.nanoTime());
    }
  }
}
