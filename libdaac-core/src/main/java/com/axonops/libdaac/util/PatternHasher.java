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

package com.axonops.libdaac.util;

import java.util.List;

/**
 * Utility for hashing pattern lists for logging purposes.
 *
 * <p>Keyword lists often contain user data (names, account ids, blocked terms), so they are never
 * logged verbatim. A short deterministic hash still lets the same list be traced through the logs.
 *
 * <p>Example: {@code ["error", "warn"]} is logged as something like {@code "5c2a91e0[2]"}.
 *
 * @since 1.0.0
 */
public final class PatternHasher {

  private PatternHasher() {
    // Utility class
  }

  /**
   * Creates a compact hex hash of a single pattern.
   *
   * @param pattern the pattern string
   * @return hex string, or {@code "null"}
   */
  public static String hash(String pattern) {
    if (pattern == null) {
      return "null";
    }
    return Integer.toHexString(pattern.hashCode());
  }

  /**
   * Creates a compact hex hash of an ordered pattern list.
   *
   * <p>Order matters: the same patterns in a different order get different indices and therefore a
   * different hash.
   *
   * @param patterns the pattern list
   * @return hex string, or {@code "null"}
   */
  public static String hash(List<String> patterns) {
    if (patterns == null) {
      return "null";
    }
    return Integer.toHexString(patterns.hashCode());
  }

  /**
   * Hash with the pattern count appended, the form used in log lines.
   *
   * @param patterns the pattern list
   * @return e.g. {@code "5c2a91e0[2]"}
   */
  public static String describe(List<String> patterns) {
    if (patterns == null) {
      return "null";
    }
    return hash(patterns) + "[" + patterns.size() + "]";
  }
}
