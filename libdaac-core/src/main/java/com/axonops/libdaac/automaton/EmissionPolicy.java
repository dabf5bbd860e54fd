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
 * Decides what a forward scan reports after each transition and whether it restarts.
 *
 * <p>The traversal is identical for the forward search modes; only this policy differs. A fresh
 * instance is created for every scan.
 */
abstract class EmissionPolicy {

  final CompiledAutomaton automaton;

  EmissionPolicy(CompiledAutomaton automaton) {
    this.automaton = automaton;
  }

  /**
   * Called after the cursor has consumed one code point and moved to its new state.
   *
   * <p>May report matches and may {@link ScanCursor#restart restart} the cursor.
   */
  abstract void onState(ScanCursor cursor, MatchSink sink);

  final void report(int end, int patternIndex, MatchSink sink) {
    sink.accept(end - automaton.patternLength(patternIndex), end, patternIndex);
  }

  /** Reports the first pattern found, then resumes from the root right after it. */
  static final class FirstFound extends EmissionPolicy {

    FirstFound(CompiledAutomaton automaton) {
      super(automaton);
    }

    @Override
    void onState(ScanCursor cursor, MatchSink sink) {
      int p = automaton.primaryOutput(cursor.state);
      if (p != CompiledAutomaton.NO_OUTPUT) {
        report(cursor.position, p, sink);
        cursor.restart();
      }
    }
  }

  /** Reports every pattern ending at every position, ascending pattern index. */
  static final class AllOutputs extends EmissionPolicy {

    AllOutputs(CompiledAutomaton automaton) {
      super(automaton);
    }

    @Override
    void onState(ScanCursor cursor, MatchSink sink) {
      int state = cursor.state;
      int n = automaton.outputCount(state);
      for (int i = 0; i < n; i++) {
        report(cursor.position, automaton.output(state, i), sink);
      }
    }
  }

  /** Reports only the longest pattern ending at each position; never restarts. */
  static final class LongestSuffix extends EmissionPolicy {

    LongestSuffix(CompiledAutomaton automaton) {
      super(automaton);
    }

    @Override
    void onState(ScanCursor cursor, MatchSink sink) {
      int p = automaton.primaryOutput(cursor.state);
      if (p != CompiledAutomaton.NO_OUTPUT) {
        report(cursor.position, p, sink);
      }
    }
  }
}
