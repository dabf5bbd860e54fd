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
 * How a scan reports matches.
 *
 * <p>The forward modes run the same traversal; they differ only in what is emitted at each state
 * and whether the scan restarts from the root afterwards. The leftmost modes read a reversed
 * automaton instead.
 *
 * @since 1.0.0
 */
public enum SearchMode {
  /** Non-overlapping: first match to complete wins, scanning resumes after it. */
  STANDARD,
  /** Every occurrence of every pattern. */
  OVERLAPPING,
  /** At each end position only the longest pattern ending there. */
  OVERLAPPING_NO_SUFFIX,
  /** Non-overlapping: earliest start, then longest. */
  LEFTMOST_LONGEST,
  /** Non-overlapping: earliest start, then lowest pattern index. */
  LEFTMOST_FIRST;

  EmissionPolicy newPolicy(CompiledAutomaton automaton) {
    return switch (this) {
      case STANDARD -> new EmissionPolicy.FirstFound(automaton);
      case OVERLAPPING -> new EmissionPolicy.AllOutputs(automaton);
      case OVERLAPPING_NO_SUFFIX -> new EmissionPolicy.LongestSuffix(automaton);
      case LEFTMOST_LONGEST, LEFTMOST_FIRST ->
          throw new IllegalStateException(this + " has no forward emission policy");
    };
  }

  /** True for the modes served by a reversed automaton. */
  public boolean isLeftmost() {
    return this == LEFTMOST_LONGEST || this == LEFTMOST_FIRST;
  }

  /** True for the modes that may report overlapping occurrences. */
  public boolean isOverlapping() {
    return this == OVERLAPPING || this == OVERLAPPING_NO_SUFFIX;
  }
}
