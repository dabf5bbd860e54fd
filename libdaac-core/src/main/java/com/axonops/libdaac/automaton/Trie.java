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

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Prefix trie over symbol codes, the first stage of automaton construction.
 *
 * <p>Nodes are plain integer ids backed by parallel arrays. Edges are kept twice: in a hash map
 * keyed by (node, label) for O(1) lookup during insertion and failure-link computation, and as
 * first-child / next-sibling lists for enumeration.
 *
 * <p>Patterns ending on a node are chained through {@code patternNext} in registration order, so
 * the head of a node's chain is always its lowest pattern index.
 */
final class Trie {

  static final int ROOT = 0;
  static final int NONE = -1;

  private static final int INITIAL_CAPACITY = 64;

  private final Map<Long, Integer> edges = new HashMap<>();

  private int[] parent = new int[INITIAL_CAPACITY];
  private int[] label = new int[INITIAL_CAPACITY];
  private int[] depth = new int[INITIAL_CAPACITY];
  private int[] firstChild = new int[INITIAL_CAPACITY];
  private int[] nextSibling = new int[INITIAL_CAPACITY];
  private int[] childCount = new int[INITIAL_CAPACITY];
  private int[] ownHead = new int[INITIAL_CAPACITY];
  private int[] ownTail = new int[INITIAL_CAPACITY];
  private int size;

  private final int[] patternNext;
  private final int[] patternLength;

  private Trie(int patternCount) {
    this.patternNext = new int[patternCount];
    this.patternLength = new int[patternCount];
    Arrays.fill(patternNext, NONE);
    addNode(NONE, 0, 0);
  }

  /**
   * Inserts every pattern, in registration order.
   *
   * @param patterns non-null, non-empty patterns
   * @param symbols symbol table covering the patterns
   * @return the populated trie
   * @throws IllegalArgumentException if a pattern is empty
   */
  static Trie build(List<String> patterns, SymbolTable symbols) {
    Trie trie = new Trie(patterns.size());
    for (int i = 0; i < patterns.size(); i++) {
      trie.insert(i, patterns.get(i), symbols);
    }
    return trie;
  }

  private void insert(int patternIndex, String pattern, SymbolTable symbols) {
    if (pattern.isEmpty()) {
      throw new IllegalArgumentException("Empty pattern at index " + patternIndex);
    }

    int node = ROOT;
    int length = 0;
    for (int offset = 0; offset < pattern.length(); ) {
      int cp = pattern.codePointAt(offset);
      offset += Character.charCount(cp);
      length++;

      int code = symbols.code(cp);
      int next = child(node, code);
      if (next == NONE) {
        next = addNode(node, code, length);
        edges.put(key(node, code), next);
      }
      node = next;
    }

    patternLength[patternIndex] = length;
    if (ownHead[node] == NONE) {
      ownHead[node] = patternIndex;
    } else {
      patternNext[ownTail[node]] = patternIndex;
    }
    ownTail[node] = patternIndex;
  }

  private int addNode(int parentNode, int code, int nodeDepth) {
    if (size == parent.length) {
      int capacity = size + (size >> 1);
      parent = Arrays.copyOf(parent, capacity);
      label = Arrays.copyOf(label, capacity);
      depth = Arrays.copyOf(depth, capacity);
      firstChild = Arrays.copyOf(firstChild, capacity);
      nextSibling = Arrays.copyOf(nextSibling, capacity);
      childCount = Arrays.copyOf(childCount, capacity);
      ownHead = Arrays.copyOf(ownHead, capacity);
      ownTail = Arrays.copyOf(ownTail, capacity);
    }

    int node = size++;
    parent[node] = parentNode;
    label[node] = code;
    depth[node] = nodeDepth;
    firstChild[node] = NONE;
    childCount[node] = 0;
    ownHead[node] = NONE;
    ownTail[node] = NONE;

    if (parentNode == NONE) {
      nextSibling[node] = NONE;
    } else {
      nextSibling[node] = firstChild[parentNode];
      firstChild[parentNode] = node;
      childCount[parentNode]++;
    }
    return node;
  }

  private static long key(int node, int code) {
    return ((long) node << 32) | (code & 0xffffffffL);
  }

  /** Child of {@code node} on {@code code}, or {@link #NONE}. */
  int child(int node, int code) {
    Integer next = edges.get(key(node, code));
    return next == null ? NONE : next;
  }

  /** Children of {@code node}, ordered by ascending label. */
  int[] children(int node) {
    int[] result = new int[childCount[node]];
    int i = 0;
    for (int c = firstChild[node]; c != NONE; c = nextSibling[c]) {
      result[i++] = c;
    }
    if (result.length > 1) {
      sortByLabel(result);
    }
    return result;
  }

  private void sortByLabel(int[] nodes) {
    long[] keyed = new long[nodes.length];
    for (int i = 0; i < nodes.length; i++) {
      keyed[i] = ((long) label[nodes[i]] << 32) | nodes[i];
    }
    Arrays.sort(keyed);
    for (int i = 0; i < nodes.length; i++) {
      nodes[i] = (int) keyed[i];
    }
  }

  int size() {
    return size;
  }

  int parent(int node) {
    return parent[node];
  }

  int label(int node) {
    return label[node];
  }

  int depth(int node) {
    return depth[node];
  }

  int childCount(int node) {
    return childCount[node];
  }

  /** Lowest index of the patterns ending exactly on {@code node}, or {@link #NONE}. */
  int firstPattern(int node) {
    return ownHead[node];
  }

  /** Next pattern ending on the same node as {@code patternIndex}, or {@link #NONE}. */
  int nextPattern(int patternIndex) {
    return patternNext[patternIndex];
  }

  int patternCount() {
    return patternLength.length;
  }

  /** Pattern lengths in code points, indexed by registration index. */
  int[] patternLengths() {
    return patternLength;
  }
}
