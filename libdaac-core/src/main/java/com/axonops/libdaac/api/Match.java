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
 * One occurrence of a pattern in a haystack.
 *
 * <p>Offsets count Unicode code points, not UTF-16 chars: {@code start} is the index of the first
 * matched code point, {@code end} is exclusive.
 *
 * @param start start offset, inclusive
 * @param end end offset, exclusive
 * @param patternIndex registration index of the matched pattern
 * @since 1.0.0
 */
public record Match(int start, int end, int patternIndex) {

  public Match {
    if (start < 0 || end <= start) {
      throw new IllegalArgumentException("Invalid match span [" + start + ", " + end + ")");
    }
    if (patternIndex < 0) {
      throw new IllegalArgumentException("patternIndex must be non-negative: " + patternIndex);
    }
  }

  /** Length in code points. */
  public int length() {
    return end - start;
  }
}
