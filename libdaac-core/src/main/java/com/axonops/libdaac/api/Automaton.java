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

import com.axonops.libdaac.automaton.CompiledAutomaton;
import com.axonops.libdaac.automaton.Scanner;
import com.axonops.libdaac.automaton.SearchMode;
import com.axonops.libdaac.cache.DaacConfig;
import com.axonops.libdaac.metrics.DaacMetricsRegistry;
import com.axonops.libdaac.metrics.MetricNames;
import com.axonops.libdaac.util.PatternHasher;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An immutable multi-pattern matcher over a fixed list of literal patterns.
 *
 * <p>Patterns are identified by their position in the list passed to {@link #build}. All offsets
 * reported by searches count Unicode code points of the haystack.
 *
 * <pre>{@code
 * Automaton automaton = Automaton.build(List.of("he", "she", "his", "hers"));
 * List<Match> matches = automaton.findOverlapping("ushers");
 * // [Match[start=2, end=4, patternIndex=0], Match[start=1, end=4, patternIndex=1],
 * //  Match[start=2, end=6, patternIndex=3]]
 * }</pre>
 *
 * <p>Thread-safe: any number of threads may search the same instance concurrently. For repeated
 * use of the same pattern list prefer {@link Daac#compile}, which caches built automata.
 *
 * @since 1.0.0
 */
public final class Automaton {
  private static final Logger logger = LoggerFactory.getLogger(Automaton.class);

  private final List<String> patterns;
  private final MatchKind matchKind;
  private final CompiledAutomaton compiled;
  private final DaacMetricsRegistry metrics;

  private Automaton(
      List<String> patterns,
      MatchKind matchKind,
      CompiledAutomaton compiled,
      DaacMetricsRegistry metrics) {
    this.patterns = patterns;
    this.matchKind = matchKind;
    this.compiled = compiled;
    this.metrics = metrics;
  }

  /**
   * Builds a {@link MatchKind#STANDARD} automaton.
   *
   * @param patterns non-empty pattern strings; an empty list builds an automaton that never matches
   * @return the automaton
   * @throws InvalidPatternException if a pattern is empty or null
   */
  public static Automaton build(List<String> patterns) {
    return build(patterns, MatchKind.STANDARD);
  }

  /**
   * Builds an automaton with the given match kind, using the global cache's configuration for
   * metrics and limits. The automaton itself is not cached; use {@link Daac#compile} for that.
   *
   * @param patterns non-empty pattern strings
   * @param kind match semantics
   * @return the automaton
   * @throws InvalidPatternException if a pattern is empty or null
   * @throws ResourceException if the list exceeds the configured maximum
   */
  public static Automaton build(List<String> patterns, MatchKind kind) {
    return build(patterns, kind, Daac.getGlobalCache().getConfig());
  }

  /**
   * Builds an automaton with explicit configuration.
   *
   * @param patterns non-empty pattern strings
   * @param kind match semantics
   * @param config supplies the metrics registry and {@code maxPatterns}
   * @return the automaton
   * @throws InvalidPatternException if a pattern is empty or null
   * @throws ResourceException if the list exceeds {@code config.maxPatterns()}
   */
  public static Automaton build(List<String> patterns, MatchKind kind, DaacConfig config) {
    Objects.requireNonNull(patterns, "patterns cannot be null");
    Objects.requireNonNull(kind, "kind cannot be null");
    Objects.requireNonNull(config, "config cannot be null");

    checkPatterns(patterns, config);
    List<String> copy = List.copyOf(patterns);
    DaacMetricsRegistry metrics = config.metricsRegistry();

    long startNanos = System.nanoTime();
    // Leftmost searches read the input right to left over the reversed patterns
    CompiledAutomaton compiled =
        kind.isLeftmost()
            ? CompiledAutomaton.compileReversed(copy)
            : CompiledAutomaton.compile(copy);
    long durationNanos = System.nanoTime() - startNanos;

    metrics.incrementCounter(MetricNames.AUTOMATA_BUILT);
    metrics.recordTimer(MetricNames.AUTOMATA_BUILD_LATENCY, durationNanos);
    metrics.incrementCounter(MetricNames.AUTOMATA_STATES, compiled.stateCount());

    if (logger.isDebugEnabled()) {
      logger.debug(
          "DAAC: Automaton built - patterns: {}, kind: {}, states: {}, alphabet: {}, bytes: {}, timeNs: {}",
          PatternHasher.describe(copy),
          kind,
          compiled.stateCount(),
          compiled.alphabetSize(),
          compiled.memoryBytes(),
          durationNanos);
    }

    return new Automaton(copy, kind, compiled, metrics);
  }

  /**
   * Rejects pattern lists that cannot be built, counting the failure.
   *
   * <p>Runs before anything is allocated so that a failed build leaves nothing behind.
   */
  static void checkPatterns(List<String> patterns, DaacConfig config) {
    DaacMetricsRegistry metrics = config.metricsRegistry();

    if (patterns.size() > config.maxPatterns()) {
      metrics.incrementCounter(MetricNames.ERRORS_RESOURCE_EXHAUSTED);
      throw new ResourceException(
          "pattern count " + patterns.size() + " exceeds maxPatterns " + config.maxPatterns());
    }

    int index = 0;
    for (String pattern : patterns) {
      if (pattern == null || pattern.isEmpty()) {
        metrics.incrementCounter(MetricNames.ERRORS_INVALID_PATTERN);
        logger.debug(
            "DAAC: Rejected pattern list {} - {} pattern at index {}",
            PatternHasher.describe(patterns),
            pattern == null ? "null" : "empty",
            index);
        throw new InvalidPatternException(
            index, pattern == null ? "pattern is null" : "pattern is empty");
      }
      index++;
    }
  }

  /**
   * Non-overlapping search under this automaton's {@link MatchKind}.
   *
   * @param haystack text to search
   * @return matches in ascending start order, never overlapping
   */
  public List<Match> find(CharSequence haystack) {
    return search(haystack, findMode(), MetricNames.MATCHING_FIND_LATENCY);
  }

  /**
   * Every occurrence of every pattern.
   *
   * @param haystack text to search
   * @return matches ordered by end offset, then pattern index
   * @throws UnsupportedSearchException unless this automaton is {@link MatchKind#STANDARD}
   */
  public List<Match> findOverlapping(CharSequence haystack) {
    requireStandard("findOverlapping");
    return search(haystack, SearchMode.OVERLAPPING, MetricNames.MATCHING_OVERLAPPING_LATENCY);
  }

  /**
   * Like {@link #findOverlapping} but reports at each end offset only the longest pattern ending
   * there (the lowest index among equal patterns).
   *
   * @param haystack text to search
   * @return matches in ascending end order, at most one per end offset
   * @throws UnsupportedSearchException unless this automaton is {@link MatchKind#STANDARD}
   */
  public List<Match> findOverlappingNoSuffix(CharSequence haystack) {
    requireStandard("findOverlappingNoSuffix");
    return search(
        haystack,
        SearchMode.OVERLAPPING_NO_SUFFIX,
        MetricNames.MATCHING_OVERLAPPING_NO_SUFFIX_LATENCY);
  }

  /** {@link #find} returning the matched pattern strings. */
  public List<String> findAsStrings(CharSequence haystack) {
    return toStrings(find(haystack));
  }

  /** {@link #findOverlapping} returning the matched pattern strings. */
  public List<String> findOverlappingAsStrings(CharSequence haystack) {
    return toStrings(findOverlapping(haystack));
  }

  /** {@link #findOverlappingNoSuffix} returning the matched pattern strings. */
  public List<String> findOverlappingNoSuffixAsStrings(CharSequence haystack) {
    return toStrings(findOverlappingNoSuffix(haystack));
  }

  public MatchKind matchKind() {
    return matchKind;
  }

  public int patternCount() {
    return patterns.size();
  }

  /**
   * Pattern registered at {@code index}.
   *
   * @throws IndexOutOfBoundsException if there is no such pattern
   */
  public String pattern(int index) {
    return patterns.get(index);
  }

  /** Immutable view of all patterns in registration order. */
  public List<String> patterns() {
    return patterns;
  }

  /** Number of automaton states, root included. */
  public int stateCount() {
    return compiled.stateCount();
  }

  /** Approximate heap held by the automaton's tables, in bytes. */
  public long memoryBytes() {
    return compiled.memoryBytes();
  }

  @Override
  public String toString() {
    return "Automaton[kind="
        + matchKind
        + ", patterns="
        + PatternHasher.describe(patterns)
        + ", states="
        + compiled.stateCount()
        + "]";
  }

  private SearchMode findMode() {
    return switch (matchKind) {
      case STANDARD -> SearchMode.STANDARD;
      case LEFTMOST_LONGEST -> SearchMode.LEFTMOST_LONGEST;
      case LEFTMOST_FIRST -> SearchMode.LEFTMOST_FIRST;
    };
  }

  private void requireStandard(String search) {
    if (matchKind != MatchKind.STANDARD) {
      metrics.incrementCounter(MetricNames.ERRORS_UNSUPPORTED_SEARCH);
      throw new UnsupportedSearchException(search, matchKind);
    }
  }

  private List<Match> search(CharSequence haystack, SearchMode mode, String latencyMetric) {
    Objects.requireNonNull(haystack, "haystack cannot be null");

    long startNanos = System.nanoTime();
    List<Match> matches = new ArrayList<>();
    Scanner.scan(
        compiled, haystack, mode, (start, end, index) -> matches.add(new Match(start, end, index)));
    long durationNanos = System.nanoTime() - startNanos;

    metrics.incrementCounter(MetricNames.MATCHING_OPERATIONS);
    metrics.recordTimer(MetricNames.MATCHING_LATENCY, durationNanos);
    metrics.recordTimer(latencyMetric, durationNanos);
    if (!matches.isEmpty()) {
      metrics.incrementCounter(MetricNames.MATCHING_MATCHES, matches.size());
    }

    logger.trace(
        "DAAC: Search completed - mode: {}, haystackChars: {}, matches: {}, timeNs: {}",
        mode,
        haystack.length(),
        matches.size(),
        durationNanos);

    return Collections.unmodifiableList(matches);
  }

  private List<String> toStrings(List<Match> matches) {
    List<String> result = new ArrayList<>(matches.size());
    for (Match match : matches) {
      result.add(patterns.get(match.patternIndex()));
    }
    return result;
  }
}
