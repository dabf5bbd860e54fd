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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class MatchKindTest {

    @ParameterizedTest
    @DisplayName("Integer codes resolve to the documented kinds")
    @CsvSource({
        "0, STANDARD",
        "1, LEFTMOST_LONGEST",
        "2, LEFTMOST_FIRST"
    })
    void testCodes(int code, MatchKind expected) {
        assertThat(MatchKind.fromCode(code)).isEqualTo(expected);
        assertThat(expected.code()).isEqualTo(code);
    }

    @Test
    void testUnknownCodeRejected() {
        assertThatThrownBy(() -> MatchKind.fromCode(3))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unknown match kind code: 3");
        assertThatThrownBy(() -> MatchKind.fromCode(-1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testIsLeftmost() {
        assertThat(MatchKind.STANDARD.isLeftmost()).isFalse();
        assertThat(MatchKind.LEFTMOST_LONGEST.isLeftmost()).isTrue();
        assertThat(MatchKind.LEFTMOST_FIRST.isLeftmost()).isTrue();
    }
}
