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

/**
 * Aho-Corasick failure links over a {@link Trie}, computed breadth-first.
 *
 * <p>The failure link of a node points to the node spelling the longest proper suffix of its path
 * that is also a trie path; the root links to itself. Nodes are visited in BFS order so the link
 * of every shallower node is final before it is followed, which keeps the total work linear in the
 * size of the trie.
 *
 * <p>The BFS order itself is kept: output aggregation and double-array placement both walk it.
 */
final class FailureLinks {

  private final int[] fail;
  private final int[] bfsOrder;

  private FailureLinks(int[] fail, int[] bfsOrder) {
    this.fail = fail;
    this.bfsOrder = bfsOrder;
  }

  static FailureLinks compute(Trie trie) {
    int size = trie.size();
    int[] fail = new int[size];
    int[] order = new int[size];

    fail[Trie.ROOT] = Trie.ROOT;
    order[0] = Trie.ROOT;
    int head = 0;
    int tail = 1;

    while (head < tail) {
      int node = order[head++];
      for (int child : trie.children(node)) {
        fail[child] = node == Trie.ROOT ? Trie.ROOT : fallback(trie, fail, node, trie.label(child));
        order[tail++] = child;
      }
    }

    return new FailureLinks(fail, order);
  }

  private static int fallback(Trie trie, int[] fail, int parent, int code) {
    int f = fail[parent];
    while (true) {
      int next = trie.child(f, code);
      if (next != Trie.NONE) {
        return next;
      }
      if (f == Trie.ROOT) {
        return Trie.ROOT;
      }
      f = fail[f];
    }
  }

  int fail(int node) {
    return fail[node];
  }

  /** All node ids, root first, by non-decreasing depth. */
  int[] bfsOrder() {
    return bfsOrder;
  }
}
