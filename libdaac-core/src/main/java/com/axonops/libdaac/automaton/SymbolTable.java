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
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps code points to dense symbol codes used as double-array offsets.
 *
 * <p>Only code points that occur in at least one pattern receive a code. Codes start at 1 and are
 * handed out by descending frequency (ties by ascending code point), so that the most common
 * symbols produce the smallest offsets and the densest packing. Every other code point maps to
 * {@link #NO_SYMBOL}: no state has a transition on it.
 *
 * <p>BMP code points are resolved through a flat table sized to the largest BMP code point seen;
 * supplementary code points through a sorted array and binary search.
 */
final class SymbolTable {

  /** Code returned for code points that do not occur in any pattern. */
  static final int NO_SYMBOL = 0;

  private static final int BMP_LIMIT = 0x10000;

  private final int[] bmpCodes;
  private final int[] supplementaryPoints;
  private final int[] supplementaryCodes;
  private final int alphabetSize;

  private SymbolTable(int[] bmpCodes, int[] supplementaryPoints, int[] supplementaryCodes, int alphabetSize) {
    this.bmpCodes = bmpCodes;
    this.supplementaryPoints = supplementaryPoints;
    this.supplementaryCodes = supplementaryCodes;
    this.alphabetSize = alphabetSize;
  }

  /**
   * Counts code point frequencies over all patterns and assigns codes.
   *
   * @param patterns non-null patterns
   * @return symbol table covering every code point of every pattern
   */
  static SymbolTable build(List<String> patterns) {
    Map<Integer, Integer> frequencies = new HashMap<>();
    for (String pattern : patterns) {
      pattern.codePoints().forEach(cp -> frequencies.merge(cp, 1, Integer::sum));
    }

    List<Map.Entry<Integer, Integer>> ranked = new ArrayList<>(frequencies.entrySet());
    ranked.sort((a, b) -> {
      int byFrequency = Integer.compare(b.getValue(), a.getValue());
      return byFrequency != 0 ? byFrequency : Integer.compare(a.getKey(), b.getKey());
    });

    int maxBmp = -1;
    int supplementaryCount = 0;
    for (Map.Entry<Integer, Integer> entry : ranked) {
      int cp = entry.getKey();
      if (cp < BMP_LIMIT) {
        maxBmp = Math.max(maxBmp, cp);
      } else {
        supplementaryCount++;
      }
    }

    int[] bmpCodes = new int[maxBmp + 1];
    int[][] supplementary = new int[supplementaryCount][];
    int next = 0;
    int code = 1;
    for (Map.Entry<Integer, Integer> entry : ranked) {
      int cp = entry.getKey();
      if (cp < BMP_LIMIT) {
        bmpCodes[cp] = code;
      } else {
        supplementary[next++] = new int[] {cp, code};
      }
      code++;
    }

    Arrays.sort(supplementary, (a, b) -> Integer.compare(a[0], b[0]));
    int[] points = new int[supplementaryCount];
    int[] codes = new int[supplementaryCount];
    for (int i = 0; i < supplementaryCount; i++) {
      points[i] = supplementary[i][0];
      codes[i] = supplementary[i][1];
    }

    return new SymbolTable(bmpCodes, points, codes, ranked.size());
  }

  /**
   * Returns the symbol code of a code point.
   *
   * @param codePoint any code point
   * @return code in {@code 1..alphabetSize()}, or {@link #NO_SYMBOL}
   */
  int code(int codePoint) {
    if (codePoint < bmpCodes.length) {
      return codePoint < 0 ? NO_SYMBOL : bmpCodes[codePoint];
    }
    if (codePoint < BMP_LIMIT || supplementaryPoints.length == 0) {
      return NO_SYMBOL;
    }
    int i = Arrays.binarySearch(supplementaryPoints, codePoint);
    return i >= 0 ? supplementaryCodes[i] : NO_SYMBOL;
  }

  /** Number of distinct code points across the pattern set. */
  int alphabetSize() {
    return alphabetSize;
  }

  long memoryBytes() {
    return 4L * (bmpCodes.length + supplementaryPoints.length + supplementaryCodes.length);
  }
}
