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

package com.axonops.libdaac.automaton;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable double-array Aho-Corasick automaton.
 *
 * <p>Built once from a pattern list through the construction pipeline
 * {@link SymbolTable} → {@link Trie} → {@link FailureLinks} → {@link OutputTable} →
 * {@link DoubleArrayCompiler}, then only read. All state is held in final int arrays indexed by
 * slot; instances can be shared freely between threads.
 *
 * <p>States are identified by their double-array slot. The root is slot {@link #ROOT}.
 *
 * <p>A {@linkplain #compileReversed reversed} automaton is built over the patterns spelled
 * backwards and is read right to left; leftmost searches use it to learn, for every start
 * offset, which patterns begin there.
 *
 * @since 1.0.0
 */
public final class CompiledAutomaton {

  /** Slot of the root state. */
  public static final int ROOT = 0;

  /** Returned by {@link #transition(int, int)} when a state has no direct edge. */
  public static final int NO_TRANSITION = -1;

  /** Returned by {@link #primaryOutput(int)} for states that report nothing. */
  public static final int NO_OUTPUT = -1;

  private final SymbolTable symbols;
  private final int[] base;
  private final int[] check;
  private final int[] fail;
  private final int[] depth;
  private final int[] primary;
  private final int[] outputOffset;
  private final int[] outputCount;
  private final int[] outputPool;
  private final int[] patternLengths;
  private final int stateCount;
  private final boolean reversed;

  CompiledAutomaton(SymbolTable symbols, int[] base, int[] check, int[] fail, int[] depth,
      int[] primary, int[] outputOffset, int[] outputCount, int[] outputPool,
      int[] patternLengths, int stateCount, boolean reversed) {
    this.symbols = symbols;
    this.base = base;
    this.check = check;
    this.fail = fail;
    this.depth = depth;
    this.primary = primary;
    this.outputOffset = outputOffset;
    this.outputCount = outputCount;
    this.outputPool = outputPool;
    this.patternLengths = patternLengths;
    this.stateCount = stateCount;
    this.reversed = reversed;
  }

  /**
   * Runs the full construction pipeline.
   *
   * @param patterns non-null, non-empty patterns; list position is the registration index
   * @return compiled automaton
   * @throws IllegalArgumentException if a pattern is empty
   */
  public static CompiledAutomaton compile(List<String> patterns) {
    Objects.requireNonNull(patterns, "patterns cannot be null");
    return build(patterns, false);
  }

  /**
   * Compiles the patterns spelled backwards, code point by code point.
   *
   * <p>Pattern indices and lengths are unchanged. Reading an input right to left, the state
   * reached at offset {@code i} has in its output set exactly the patterns that start at {@code
   * i}.
   *
   * @param patterns non-null, non-empty patterns; list position is the registration index
   * @return compiled reversed automaton
   * @throws IllegalArgumentException if a pattern is empty
   */
  public static CompiledAutomaton compileReversed(List<String> patterns) {
    Objects.requireNonNull(patterns, "patterns cannot be null");
    List<String> backwards = new ArrayList<>(patterns.size());
    for (String pattern : patterns) {
      // StringBuilder.reverse keeps surrogate pairs intact
      backwards.add(new StringBuilder(pattern).reverse().toString());
    }
    return build(backwards, true);
  }

  private static CompiledAutomaton build(List<String> patterns, boolean reversed) {
    SymbolTable symbols = SymbolTable.build(patterns);
    Trie trie = Trie.build(patterns, symbols);
    FailureLinks links = FailureLinks.compute(trie);
    OutputTable outputs = OutputTable.aggregate(trie, links);
    return DoubleArrayCompiler.compile(symbols, trie, links, outputs, reversed);
  }

  /**
   * Advances {@code state} over one code point, following failure links on missing edges.
   *
   * <p>Code points outside the pattern alphabet lead straight to the root. Otherwise at most
   * {@code depth(state) + 1} lookups are made.
   *
   * @param state current state
   * @param codePoint next input code point
   * @return next state
   */
  public int next(int state, int codePoint) {
    int code = symbols.code(codePoint);
    if (code == SymbolTable.NO_SYMBOL) {
      return ROOT;
    }
    int s = state;
    while (true) {
      int t = base[s] + code;
      if (t < check.length && check[t] == s) {
        return t;
      }
      if (s == ROOT) {
        return ROOT;
      }
      s = fail[s];
    }
  }

  /**
   * Direct edge lookup without failure fallback.
   *
   * @param state current state
   * @param codePoint input code point
   * @return child state, or {@link #NO_TRANSITION}
   */
  public int transition(int state, int codePoint) {
    int code = symbols.code(codePoint);
    if (code == SymbolTable.NO_SYMBOL) {
      return NO_TRANSITION;
    }
    int t = base[state] + code;
    return t < check.length && check[t] == state ? t : NO_TRANSITION;
  }

  /** Failure state of {@code state}; the root fails to itself. */
  public int fail(int state) {
    return fail[state];
  }

  /** Length in code points of the path spelling {@code state}. */
  public int depth(int state) {
    return depth[state];
  }

  /**
   * Longest pattern ending at {@code state}, lowest index among duplicates.
   *
   * @return pattern index, or {@link #NO_OUTPUT}
   */
  public int primaryOutput(int state) {
    return primary[state];
  }

  /** Size of the aggregated output set of {@code state}. */
  public int outputCount(int state) {
    return outputCount[state];
  }

  /**
   * Entry {@code i} of the output set of {@code state}; entries ascend by pattern index.
   */
  public int output(int state, int i) {
    return outputPool[outputOffset[state] + i];
  }

  public int patternLength(int patternIndex) {
    return patternLengths[patternIndex];
  }

  public int patternCount() {
    return patternLengths.length;
  }

  /** True if built by {@link #compileReversed}. */
  public boolean isReversed() {
    return reversed;
  }

  /** Number of states (trie nodes, root included). */
  public int stateCount() {
    return stateCount;
  }

  /** Length of the double array, occupied and unused slots alike. */
  public int slotCount() {
    return check.length;
  }

  /** Number of distinct code points across all patterns. */
  public int alphabetSize() {
    return symbols.alphabetSize();
  }

  /**
   * Approximate heap footprint of the automaton's arrays.
   *
   * @return bytes
   */
  public long memoryBytes() {
    long slots = check.length;
    return 4L * (7 * slots + outputPool.length + patternLengths.length) + symbols.memoryBytes();
  }

  /** Check entry of a slot: owning parent state, {@code ROOT_CHECK} for the root, negative if unused. */
  int checkAt(int slot) {
    return check[slot];
  }
}
