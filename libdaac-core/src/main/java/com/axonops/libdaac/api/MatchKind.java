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

/**
 * Match semantics of an {@link Automaton}, fixed when it is built.
 *
 * <ul>
 *   <li>{@link #STANDARD} - {@code find} reports the first match to complete, then resumes after
 *       it. The only kind that supports overlapping searches.
 *   <li>{@link #LEFTMOST_LONGEST} - among matches starting at the leftmost position, the longest.
 *   <li>{@link #LEFTMOST_FIRST} - among matches starting at the leftmost position, the one
 *       registered first.
 * </ul>
 *
 * @since 1.0.0
 */
public enum MatchKind {
  STANDARD(0),
  LEFTMOST_LONGEST(1),
  LEFTMOST_FIRST(2);

  private final int code;

  MatchKind(int code) {
    this.code = code;
  }

  /** Stable integer code, for configuration formats that carry the kind as a number. */
  public int code() {
    return code;
  }

  public boolean isLeftmost() {
    return this != STANDARD;
  }

  /**
   * Resolves an integer code.
   *
   * @param code 0, 1 or 2
   * @return the match kind
   * @throws IllegalArgumentException for any other code
   */
  public static MatchKind fromCode(int code) {
    for (MatchKind kind : values()) {
      if (kind.code == code) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown match kind code: " + code);
  }
}
