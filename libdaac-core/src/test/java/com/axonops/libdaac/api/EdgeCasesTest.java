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

import com.axonops.libdaac.cache.DaacConfig;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Edge cases: invalid patterns, degenerate inputs, duplicates and argument validation.
 */
class EdgeCasesTest {

    @Test
    void testEmptyPatternRejected() {
        assertThatThrownBy(() -> Automaton.build(List.of("a", "", "b")))
            .isInstanceOf(InvalidPatternException.class)
            .hasMessageContaining("index 1")
            .satisfies(e -> assertThat(((InvalidPatternException) e).getPatternIndex()).isEqualTo(1));
    }

    @Test
    void testNullPatternRejected() {
        List<String> patterns = Arrays.asList("a", "b", null);

        assertThatThrownBy(() -> Automaton.build(patterns))
            .isInstanceOf(InvalidPatternException.class)
            .hasMessageContaining("null")
            .satisfies(e -> assertThat(((InvalidPatternException) e).getPatternIndex()).isEqualTo(2));
    }

    @Test
    void testTooManyPatternsRejected() {
        DaacConfig config = DaacConfig.builder().maxPatterns(2).build();

        assertThatThrownBy(() -> Automaton.build(List.of("a", "b", "c"), MatchKind.STANDARD, config))
            .isInstanceOf(ResourceException.class)
            .hasMessageContaining("maxPatterns 2");
        assertThat(Automaton.build(List.of("a", "b"), MatchKind.STANDARD, config).patternCount())
            .isEqualTo(2);
    }

    @Test
    void testNullArguments() {
        Automaton automaton = Automaton.build(List.of("a"));

        assertThatThrownBy(() -> Automaton.build(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> Automaton.build(List.of("a"), null))
            .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> automaton.find(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> automaton.findOverlapping(null))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void testEmptyPatternSetNeverMatches() {
        for (MatchKind kind : MatchKind.values()) {
            Automaton automaton = Automaton.build(Collections.emptyList(), kind);
            assertThat(automaton.patternCount()).isZero();
            assertThat(automaton.stateCount()).isEqualTo(1);
            assertThat(automaton.find("anything at all")).isEmpty();
        }
        assertThat(Automaton.build(List.of()).findOverlapping("abc")).isEmpty();
    }

    @Test
    void testEmptyHaystack() {
        for (MatchKind kind : MatchKind.values()) {
            assertThat(Automaton.build(List.of("a"), kind).find("")).isEmpty();
        }
        assertThat(Automaton.build(List.of("a")).findOverlappingNoSuffix("")).isEmpty();
    }

    @Test
    void testDuplicatePatternsKeepTheirIndices() {
        Automaton automaton = Automaton.build(List.of("ab", "x", "ab"));

        assertThat(automaton.findOverlapping("ab")).containsExactly(
            new Match(0, 2, 0),
            new Match(0, 2, 2));
        assertThat(automaton.find("ab")).containsExactly(new Match(0, 2, 0));
        assertThat(Automaton.build(List.of("ab", "x", "ab"), MatchKind.LEFTMOST_LONGEST).find("ab"))
            .containsExactly(new Match(0, 2, 0));
    }

    @Test
    void testPatternLongerThanHaystack() {
        Automaton automaton = Automaton.build(List.of("abcdef"));

        assertThat(automaton.find("abc")).isEmpty();
        assertThat(automaton.findOverlapping("abcde")).isEmpty();
    }

    @Test
    void testCodePointsAbsentFromPatternsResetTheScan() {
        Automaton automaton = Automaton.build(List.of("abc"));

        assertThat(automaton.find("abZabc")).containsExactly(new Match(3, 6, 0));
        assertThat(automaton.find("ab😀abc")).containsExactly(new Match(3, 6, 0));
    }

    @Test
    void testSupplementaryCodePointOffsets() {
        String smile = "😀";
        Automaton automaton = Automaton.build(List.of(smile, "x" + smile));

        assertThat(automaton.findOverlapping(smile + "x" + smile)).containsExactly(
            new Match(0, 1, 0),
            new Match(2, 3, 0),
            new Match(1, 3, 1));
    }

    @Test
    void testPatternListIsCopied() {
        List<String> patterns = new ArrayList<>(List.of("a", "b"));
        Automaton automaton = Automaton.build(patterns);

        patterns.set(0, "z");
        assertThat(automaton.pattern(0)).isEqualTo("a");
        assertThatThrownBy(() -> automaton.patterns().add("c"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testResultsAreUnmodifiable() {
        List<Match> matches = Automaton.build(List.of("a")).find("aaa");

        assertThat(matches).hasSize(3);
        assertThatThrownBy(() -> matches.add(new Match(0, 1, 0)))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testMatchValidation() {
        assertThatThrownBy(() -> new Match(-1, 1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Match(2, 2, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Match(0, 1, -1)).isInstanceOf(IllegalArgumentException.class);
        assertThat(new Match(3, 7, 0).length()).isEqualTo(4);
    }

    @Test
    void testExceptionHierarchy() {
        assertThat(new InvalidPatternException(0, "x")).isInstanceOf(DaacException.class);
        assertThat(new UnsupportedSearchException("findOverlapping", MatchKind.LEFTMOST_FIRST))
            .isInstanceOf(DaacException.class)
            .hasMessageContaining("LEFTMOST_FIRST");
        assertThat(new ResourceException("too many")).isInstanceOf(RuntimeException.class)
            .hasMessageStartingWith("DAAC: Resource error");
    }
}
