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
 * Thrown when a search is not defined for the automaton's match kind, i.e. an overlapping search
 * on a leftmost automaton. Raised before any input is scanned.
 *
 * @since 1.0.0
 */
public final class UnsupportedSearchException extends DaacException {

  private final MatchKind matchKind;

  public UnsupportedSearchException(String search, MatchKind matchKind) {
    super("DAAC: " + search + " is only supported for "
        + MatchKind.STANDARD + " automata, this automaton uses " + matchKind);
    this.matchKind = matchKind;
  }

  public MatchKind getMatchKind() {
    return matchKind;
  }
}
