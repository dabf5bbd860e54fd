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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compacts a trie with failure links and outputs into a double array.
 *
 * <p>Every state occupies one slot. A state {@code s} with base {@code b} reaches its child on
 * symbol code {@code c} at slot {@code b + c}, and that slot's check entry holds {@code s}. States
 * are placed in BFS order: when a state is visited its own slot is already known and the compiler
 * searches a base for which every child slot is free.
 *
 * <p>Slots are allocated in blocks of {@link #BLOCK_LEN}. Free slots of the most recent {@link
 * #OPEN_BLOCKS} blocks are kept in a circular doubly-linked list and the base search is first-fit
 * over that list. When a block falls out of the window its remaining free slots are dropped from
 * the list and stay unused; this bounds the cost of a single search regardless of how many states
 * have been placed.
 *
 * <p>Instances are single-use and not thread-safe.
 */
final class DoubleArrayCompiler {
  private static final Logger logger = LoggerFactory.getLogger(DoubleArrayCompiler.class);

  static final int BLOCK_LEN = 256;
  static final int OPEN_BLOCKS = 16;

  /** Check value of a slot no state owns. */
  static final int EMPTY = -1;

  /** Check value of the root slot; never equal to a state id. */
  static final int ROOT_CHECK = Integer.MAX_VALUE;

  private static final int NIL = -1;

  private int[] base = new int[0];
  private int[] check = new int[0];
  private int[] nextFree = new int[0];
  private int[] prevFree = new int[0];
  private int freeHead = NIL;
  private int capacity;
  private int openFrom;
  private int lastUsed;
  private int closedUnused;

  private DoubleArrayCompiler() {
  }

  static CompiledAutomaton compile(
      SymbolTable symbols, Trie trie, FailureLinks links, OutputTable outputs, boolean reversed) {
    return new DoubleArrayCompiler().run(symbols, trie, links, outputs, reversed);
  }

  private CompiledAutomaton run(
      SymbolTable symbols, Trie trie, FailureLinks links, OutputTable outputs, boolean reversed) {
    int[] slotOf = new int[trie.size()];

    ensureCapacity(0);
    occupy(CompiledAutomaton.ROOT, ROOT_CHECK);
    slotOf[Trie.ROOT] = CompiledAutomaton.ROOT;

    int[] labels = new int[0];
    for (int node : links.bfsOrder()) {
      int[] children = trie.children(node);
      int slot = slotOf[node];
      if (children.length == 0) {
        base[slot] = 0;
        continue;
      }

      if (labels.length < children.length) {
        labels = new int[Math.max(children.length, labels.length * 2)];
      }
      for (int i = 0; i < children.length; i++) {
        labels[i] = trie.label(children[i]);
      }

      int b = findBase(labels, children.length);
      ensureCapacity(b + labels[children.length - 1]);
      base[slot] = b;
      for (int i = 0; i < children.length; i++) {
        int target = b + labels[i];
        occupy(target, slot);
        slotOf[children[i]] = target;
      }
    }

    int length = lastUsed + 1;
    int[] finalBase = Arrays.copyOf(base, length);
    int[] finalCheck = Arrays.copyOf(check, length);
    int[] fail = new int[length];
    int[] depth = new int[length];
    int[] primary = new int[length];
    int[] outputOffset = new int[length];
    int[] outputCount = new int[length];
    Arrays.fill(primary, CompiledAutomaton.NO_OUTPUT);

    for (int node = 0; node < trie.size(); node++) {
      int slot = slotOf[node];
      fail[slot] = slotOf[links.fail(node)];
      depth[slot] = trie.depth(node);
      primary[slot] = outputs.primary(node);
      outputOffset[slot] = outputs.offset(node);
      outputCount[slot] = outputs.count(node);
    }

    logger.trace("DAAC: Double array compacted - states: {}, slots: {}, blocks: {}, abandonedSlots: {}",
        trie.size(), length, capacity / BLOCK_LEN, closedUnused);

    return new CompiledAutomaton(symbols, finalBase, finalCheck, fail, depth, primary,
        outputOffset, outputCount, outputs.pool(), trie.patternLengths(), trie.size(),
        reversed);
  }

  /**
   * First-fit search for a base under which every label lands on a free slot.
   *
   * @param labels ascending symbol codes (all {@code >= 1})
   * @param n number of labels in use
   * @return non-negative base
   */
  private int findBase(int[] labels, int n) {
    int first = labels[0];
    if (freeHead != NIL) {
      int f = freeHead;
      do {
        int b = f - first;
        if (b >= 0 && fits(b, labels, n)) {
          return b;
        }
        f = nextFree[f];
      } while (f != freeHead);
    }
    return Math.max(capacity, first) - first;
  }

  private boolean fits(int b, int[] labels, int n) {
    for (int i = 1; i < n; i++) {
      int t = b + labels[i];
      if (t >= capacity) {
        return true;
      }
      if (t < openFrom || check[t] != EMPTY) {
        return false;
      }
    }
    return true;
  }

  private void occupy(int slot, int owner) {
    if (check[slot] != EMPTY) {
      throw new IllegalStateException("Double-array slot collision at " + slot
            + " (owner " + check[slot] + ", claimant " + owner + ")");
    }
    if (slot >= openFrom) {
      unlink(slot);
    } else {
      closedUnused--;
    }
    check[slot] = owner;
    lastUsed = Math.max(lastUsed, slot);
  }

  private void ensureCapacity(int slot) {
    while (slot >= capacity) {
      addBlock();
    }
  }

  private void addBlock() {
    int start = capacity;
    int end = start + BLOCK_LEN;
    if (end > check.length) {
      int length = Math.max(end, check.length + (check.length >> 1));
      base = Arrays.copyOf(base, length);
      check = Arrays.copyOf(check, length);
      nextFree = Arrays.copyOf(nextFree, length);
      prevFree = Arrays.copyOf(prevFree, length);
    }
    for (int slot = start; slot < end; slot++) {
      check[slot] = EMPTY;
      base[slot] = 0;
      link(slot);
    }
    capacity = end;

    if ((capacity - openFrom) / BLOCK_LEN > OPEN_BLOCKS) {
      closeOldestBlock();
    }
  }

  private void closeOldestBlock() {
    int end = openFrom + BLOCK_LEN;
    for (int slot = openFrom; slot < end; slot++) {
      if (check[slot] == EMPTY) {
        unlink(slot);
        closedUnused++;
      }
    }
    openFrom = end;
  }

  private void link(int slot) {
    if (freeHead == NIL) {
      nextFree[slot] = slot;
      prevFree[slot] = slot;
      freeHead = slot;
      return;
    }
    int tail = prevFree[freeHead];
    nextFree[tail] = slot;
    prevFree[slot] = tail;
    nextFree[slot] = freeHead;
    prevFree[freeHead] = slot;
  }

  private void unlink(int slot) {
    int next = nextFree[slot];
    if (next == slot) {
      freeHead = NIL;
      return;
    }
    int prev = prevFree[slot];
    nextFree[prev] = next;
    prevFree[next] = prev;
    if (freeHead == slot) {
      freeHead = next;
    }
  }
}
