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

/**
 * Aggregated output sets of every trie node.
 *
 * <p>The output set of a node is the union of the patterns ending on it and the output set of its
 * failure node, sorted by ascending pattern index. All sets live in one shared pool as contiguous
 * slices: a node without patterns of its own reuses the slice of its failure node, and only nodes
 * that do end a pattern pay for a merged copy.
 *
 * <p>Each node also records a <em>primary</em> output: its own lowest pattern index when it ends
 * a pattern, otherwise the primary output of its failure node. That is the longest pattern ending
 * at the node (lowest index among duplicates) and is what non-overlapping searches report.
 */
final class OutputTable {

  private final int[] pool;
  private final int[] offset;
  private final int[] count;
  private final int[] primary;

  private OutputTable(int[] pool, int[] offset, int[] count, int[] primary) {
    this.pool = pool;
    this.offset = offset;
    this.count = count;
    this.primary = primary;
  }

  static OutputTable aggregate(Trie trie, FailureLinks links) {
    int size = trie.size();
    int[] offset = new int[size];
    int[] count = new int[size];
    int[] primary = new int[size];
    int[] pool = new int[Math.max(16, trie.patternCount())];
    int used = 0;

    for (int node : links.bfsOrder()) {
      if (node == Trie.ROOT) {
        primary[node] = Trie.NONE;
        continue;
      }

      int f = links.fail(node);
      int own = trie.firstPattern(node);
      if (own == Trie.NONE) {
        offset[node] = offset[f];
        count[node] = count[f];
        primary[node] = primary[f];
        continue;
      }

      int ownCount = 0;
      for (int p = own; p != Trie.NONE; p = trie.nextPattern(p)) {
        ownCount++;
      }

      int merged = ownCount + count[f];
      if (used + merged > pool.length) {
        pool = Arrays.copyOf(pool, Math.max(used + merged, pool.length + (pool.length >> 1)));
      }

      // own chain and the failure slice are both ascending
      int out = used;
      int p = own;
      int i = offset[f];
      int end = offset[f] + count[f];
      while (p != Trie.NONE && i < end) {
        if (p < pool[i]) {
          pool[out++] = p;
          p = trie.nextPattern(p);
        } else {
          pool[out++] = pool[i++];
        }
      }
      for (; p != Trie.NONE; p = trie.nextPattern(p)) {
        pool[out++] = p;
      }
      while (i < end) {
        pool[out++] = pool[i++];
      }

      offset[node] = used;
      count[node] = merged;
      primary[node] = own;
      used = out;
    }

    return new OutputTable(Arrays.copyOf(pool, used), offset, count, primary);
  }

  int offset(int node) {
    return offset[node];
  }

  int count(int node) {
    return count[node];
  }

  int primary(int node) {
    return primary[node];
  }

  int[] pool() {
    return pool;
  }
}
