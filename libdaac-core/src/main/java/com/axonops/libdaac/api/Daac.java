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

package com.axonops.libdaac.api;

import com.axonops.libdaac.cache.AutomatonCache;
import com.axonops.libdaac.cache.CacheStatistics;
import com.axonops.libdaac.cache.DaacConfig;
import java.util.List;
import java.util.Objects;

/**
 * Main entry point for cached multi-pattern matching.
 *
 * <p>{@link #compile} builds an {@link Automaton} once per distinct (pattern list, match kind) and
 * serves later calls from the global {@link AutomatonCache}.
 *
 * <p>Thread-safe: all methods can be called concurrently from multiple threads.
 *
 * @since 1.0.0
 */
public final class Daac {

  // Global automaton cache (mutable for testing only)
  private static volatile AutomatonCache cache = new AutomatonCache(DaacConfig.DEFAULT);

  private Daac() {
    // Utility class
  }

  public static Automaton compile(List<String> patterns) {
    return compile(patterns, MatchKind.STANDARD);
  }

  /**
   * Returns the cached automaton for {@code patterns} and {@code kind}, building it on first use.
   *
   * @param patterns non-empty pattern strings
   * @param kind match semantics
   * @return shared automaton
   * @throws InvalidPatternException if a pattern is empty or null
   * @throws ResourceException if the list exceeds the configured maximum
   */
  public static Automaton compile(List<String> patterns, MatchKind kind) {
    Objects.requireNonNull(patterns, "patterns cannot be null");
    Objects.requireNonNull(kind, "kind cannot be null");

    AutomatonCache current = cache;
    DaacConfig config = current.getConfig();
    Automaton.checkPatterns(patterns, config);
    return current.getOrBuild(patterns, kind, () -> Automaton.build(patterns, kind, config));
  }

  /**
   * Non-overlapping standard search with a cached automaton.
   *
   * @param patterns non-empty pattern strings
   * @param haystack text to search
   * @return matches in ascending start order
   */
  public static List<Match> find(List<String> patterns, CharSequence haystack) {
    return compile(patterns).find(haystack);
  }

  /**
   * Overlapping search with a cached standard automaton.
   *
   * @param patterns non-empty pattern strings
   * @param haystack text to search
   * @return every occurrence, ordered by end offset then pattern index
   */
  public static List<Match> findOverlapping(List<String> patterns, CharSequence haystack) {
    return compile(patterns).findOverlapping(haystack);
  }

  /** Gets the global automaton cache. */
  public static AutomatonCache getGlobalCache() {
    return cache;
  }

  /**
   * Sets a new global cache.
   *
   * <p>The previous cache is not shut down; callers that own it should do so.
   *
   * @param newCache the new cache to use globally
   */
  public static void setGlobalCache(AutomatonCache newCache) {
    cache = Objects.requireNonNull(newCache, "cache cannot be null");
  }

  /** Gets cache statistics (for monitoring). */
  public static CacheStatistics getCacheStatistics() {
    return cache.getStatistics();
  }

  /** Clears the automaton cache (for maintenance). */
  public static void clearCache() {
    cache.clear();
  }

  /** Fully resets the cache including statistics (for testing only). */
  public static void resetCache() {
    cache.reset();
  }
}
