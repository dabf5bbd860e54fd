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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Search semantics of the four match kinds on fixed inputs.
 */
class AutomatonTest {

    private static final List<String> MIXED = List.of("t", "hi", "h", "this", "テス");
    private static final String MIXED_HAYSTACK = "this is a テスト";

    @Test
    void testStandardFind() {
        Automaton automaton = Automaton.build(MIXED);

        assertThat(automaton.find(MIXED_HAYSTACK)).containsExactly(
            new Match(0, 1, 0),
            new Match(1, 2, 2),
            new Match(10, 12, 4));
    }

    @Test
    void testOverlappingFind() {
        Automaton automaton = Automaton.build(MIXED);

        assertThat(automaton.findOverlapping(MIXED_HAYSTACK)).containsExactly(
            new Match(0, 1, 0),
            new Match(1, 2, 2),
            new Match(1, 3, 1),
            new Match(0, 4, 3),
            new Match(10, 12, 4));
    }

    @Test
    void testLeftmostLongestFind() {
        Automaton automaton = Automaton.build(MIXED, MatchKind.LEFTMOST_LONGEST);

        assertThat(automaton.find(MIXED_HAYSTACK)).containsExactly(
            new Match(0, 4, 3),
            new Match(10, 12, 4));
    }

    @Test
    void testLeftmostFirstFind() {
        Automaton automaton = Automaton.build(MIXED, MatchKind.LEFTMOST_FIRST);

        assertThat(automaton.find(MIXED_HAYSTACK)).containsExactly(
            new Match(0, 1, 0),
            new Match(1, 3, 1),
            new Match(10, 12, 4));
    }

    @Test
    void testOverlappingNoSuffix() {
        Automaton automaton = Automaton.build(List.of("bcd", "cd", "abc"));

        assertThat(automaton.findOverlappingNoSuffix("abcd")).containsExactly(
            new Match(0, 3, 2),
            new Match(1, 4, 0));
        assertThat(automaton.findOverlapping("abcd")).containsExactly(
            new Match(0, 3, 2),
            new Match(1, 4, 0),
            new Match(2, 4, 1));
    }

    @Test
    void testAsStrings() {
        Automaton automaton = Automaton.build(List.of("bcd", "ab", "a"));

        assertThat(automaton.findAsStrings("abcd")).containsExactly("a", "bcd");
        assertThat(automaton.findOverlappingAsStrings("abcd")).containsExactly("a", "ab", "bcd");
        assertThat(automaton.findOverlappingNoSuffixAsStrings("abcde"))
            .containsExactly("a", "ab", "bcd");
    }

    @Test
    void testLeftmostKindsOnNestedPatterns() {
        List<String> patterns = List.of("ab", "a", "abcd");

        assertThat(Automaton.build(patterns, MatchKind.LEFTMOST_LONGEST).find("abcd"))
            .containsExactly(new Match(0, 4, 2));
        assertThat(Automaton.build(patterns, MatchKind.LEFTMOST_FIRST).find("abcd"))
            .containsExactly(new Match(0, 2, 0));
        assertThat(Automaton.build(patterns).find("abcd"))
            .containsExactly(new Match(0, 1, 1));
    }

    @Test
    void testClassicDictionary() {
        Automaton automaton = Automaton.build(List.of("he", "she", "his", "hers"));

        assertThat(automaton.findOverlapping("ushers")).containsExactly(
            new Match(2, 4, 0),
            new Match(1, 4, 1),
            new Match(2, 6, 3));
        assertThat(automaton.find("ushers")).containsExactly(new Match(1, 4, 1));
    }

    @Test
    void testMatchedTextEqualsPattern() {
        List<String> patterns = List.of("na", "ana", "banana", "nan");
        String haystack = "bananarama banana";
        int[] codePoints = haystack.codePoints().toArray();
        Automaton automaton = Automaton.build(patterns);

        List<Match> matches = automaton.findOverlapping(haystack);
        assertThat(matches).isNotEmpty();
        for (Match m : matches) {
            String text = new String(codePoints, m.start(), m.length());
            assertThat(text).isEqualTo(automaton.pattern(m.patternIndex()));
        }
    }

    @Test
    void testUnsupportedOverlappingOnLeftmost() {
        Automaton longest = Automaton.build(List.of("a"), MatchKind.LEFTMOST_LONGEST);
        Automaton first = Automaton.build(List.of("a"), MatchKind.LEFTMOST_FIRST);

        assertThatThrownBy(() -> longest.findOverlapping("a"))
            .isInstanceOf(UnsupportedSearchException.class)
            .satisfies(e -> assertThat(((UnsupportedSearchException) e).getMatchKind())
                .isEqualTo(MatchKind.LEFTMOST_LONGEST));
        assertThatThrownBy(() -> first.findOverlappingNoSuffix("a"))
            .isInstanceOf(UnsupportedSearchException.class);
        assertThatThrownBy(() -> first.findOverlappingAsStrings("a"))
            .isInstanceOf(DaacException.class);
    }

    @Test
    void testIntrospection() {
        Automaton automaton = Automaton.build(List.of("he", "she"), MatchKind.LEFTMOST_FIRST);

        assertThat(automaton.matchKind()).isEqualTo(MatchKind.LEFTMOST_FIRST);
        assertThat(automaton.patternCount()).isEqualTo(2);
        assertThat(automaton.pattern(1)).isEqualTo("she");
        assertThat(automaton.patterns()).containsExactly("he", "she");
        // leftmost automata hold the reversed patterns: root, e, eh, ehs
        assertThat(automaton.stateCount()).isEqualTo(4);
        // root, h, he, s, sh, she
        assertThat(Automaton.build(List.of("he", "she")).stateCount()).isEqualTo(6);
        assertThat(automaton.memoryBytes()).isPositive();
        assertThat(automaton.toString()).contains("LEFTMOST_FIRST").doesNotContain("she");
        assertThatThrownBy(() -> automaton.pattern(2)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void testSearchesAreRepeatable() {
        Automaton automaton = Automaton.build(MIXED, MatchKind.LEFTMOST_LONGEST);

        List<Match> first = automaton.find(MIXED_HAYSTACK);
        List<Match> second = automaton.find(new StringBuilder(MIXED_HAYSTACK));
        assertThat(second).isEqualTo(first);
    }
}
