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
 * Per-scan position: current state plus how much input has been consumed.
 *
 * <p>{@code position} counts code points, {@code offset} counts chars of the underlying
 * {@link CharSequence}; both point just past the last consumed symbol.
 */
final class ScanCursor {

  int state = CompiledAutomaton.ROOT;
  int position;
  int offset;

  /** Returns to the root; the input position is kept, so nothing is read twice. */
  void restart() {
    this.state = CompiledAutomaton.ROOT;
  }
}
