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
 * Receives matches as a scan produces them.
 *
 * <p>Offsets are in code points over the scanned input.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface MatchSink {

  /**
   * Called once per reported match, in report order.
   *
   * @param start inclusive start offset
   * @param end exclusive end offset
   * @param patternIndex registration index of the matched pattern
   */
  void accept(int start, int end, int patternIndex);
}
