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
 * Leftmost searches in two passes over the input, each reading every code point once.
 *
 * <p>A right-to-left pass over a {@linkplain CompiledAutomaton#compileReversed reversed}
 * automaton records, for every start offset, the pattern a leftmost search would pick there: the
 * longest (lowest index among equal strings) or the lowest index. A left-to-right pass then takes
 * the first recorded start, reports it, jumps past its end and repeats. A match starting at a
 * given offset does not depend on anything before it, so no input is ever read again, however
 * many matches there are.
 */
final class LeftmostScan {

  private LeftmostScan() {
  }

  static void run(
      CompiledAutomaton automaton, CharSequence input, boolean preferLongest, MatchSink sink) {
    int length = input.length();
    // Indexed by char offset; slots inside a surrogate pair are never written or read
    int[] startingAt = new int[length];

    int state = CompiledAutomaton.ROOT;
    int offset = length;
    while (offset > 0) {
      int cp = Character.codePointBefore(input, offset);
      offset -= Character.charCount(cp);
      state = automaton.next(state, cp);
      startingAt[offset] =
          preferLongest ? automaton.primaryOutput(state) : lowestIndex(automaton, state);
    }

    int position = 0;
    offset = 0;
    while (offset < length) {
      int p = startingAt[offset];
      if (p == CompiledAutomaton.NO_OUTPUT) {
        offset += Character.charCount(Character.codePointAt(input, offset));
        position++;
      } else {
        int patternLength = automaton.patternLength(p);
        sink.accept(position, position + patternLength, p);
        offset = Character.offsetByCodePoints(input, offset, patternLength);
        position += patternLength;
      }
    }
  }

  /** Output sets ascend by pattern index, so the first entry is the lowest. */
  private static int lowestIndex(CompiledAutomaton automaton, int state) {
    return automaton.outputCount(state) == 0
        ? CompiledAutomaton.NO_OUTPUT
        : automaton.output(state, 0);
  }
}
