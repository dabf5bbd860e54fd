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
 * Thrown when a pattern list contains a pattern that cannot be matched: an empty string or a
 * {@code null} element.
 *
 * @since 1.0.0
 */
public final class InvalidPatternException extends DaacException {

  private final int patternIndex;

  public InvalidPatternException(int patternIndex, String message) {
    super("DAAC: Invalid pattern at index " + patternIndex + ": " + message);
    this.patternIndex = patternIndex;
  }

  /** Registration index of the offending pattern. */
  public int getPatternIndex() {
    return patternIndex;
  }
}
