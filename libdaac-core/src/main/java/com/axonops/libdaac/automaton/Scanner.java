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

import java.util.Objects;

/**
 * The matching loop.
 *
 * <p>Forward modes walk the input one code point at a time, advancing through the automaton and
 * handing every state reached to the {@link EmissionPolicy} of the requested {@link SearchMode}.
 * Leftmost modes run {@link LeftmostScan} over a reversed automaton. Offsets passed to the sink
 * are in code points. The automaton is never written, so any number of scans may run
 * concurrently over one instance.
 *
 * @since 1.0.0
 */
public final class Scanner {

  private Scanner() {
  }

  /**
   * Scans {@code input} and reports every match of {@code mode} to {@code sink} in order.
   *
   * @param automaton compiled automaton
   * @param input text to scan
   * @param mode matching semantics
   * @param sink receives {@code (start, end, patternIndex)} per match
   * @throws IllegalArgumentException if {@code mode} is leftmost and the automaton is not
   *     {@linkplain CompiledAutomaton#isReversed reversed}, or the other way round
   */
  public static void scan(
      CompiledAutomaton automaton, CharSequence input, SearchMode mode, MatchSink sink) {
    Objects.requireNonNull(automaton, "automaton cannot be null");
    Objects.requireNonNull(input, "input cannot be null");
    Objects.requireNonNull(mode, "mode cannot be null");
    Objects.requireNonNull(sink, "sink cannot be null");

    if (mode.isLeftmost() != automaton.isReversed()) {
      throw new IllegalArgumentException(
          mode + " needs a " + (mode.isLeftmost() ? "reversed" : "forward") + " automaton");
    }
    if (automaton.patternCount() == 0) {
      return;
    }

    if (mode.isLeftmost()) {
      LeftmostScan.run(automaton, input, mode == SearchMode.LEFTMOST_LONGEST, sink);
      return;
    }

    EmissionPolicy policy = mode.newPolicy(automaton);
    ScanCursor cursor = new ScanCursor();
    int length = input.length();
    while (cursor.offset < length) {
      int cp = Character.codePointAt(input, cursor.offset);
      cursor.offset += Character.charCount(cp);
      cursor.position++;
      cursor.state = automaton.next(cursor.state, cp);
      policy.onState(cursor, sink);
    }
  }
}
