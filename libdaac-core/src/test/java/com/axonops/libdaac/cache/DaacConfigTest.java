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

package com.axonops.libdaac.cache;

import com.axonops.libdaac.metrics.DaacMetricsRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DaacConfigTest {

    @Test
    void testDefaults() {
        DaacConfig config = DaacConfig.DEFAULT;

        assertThat(config.cacheEnabled()).isTrue();
        assertThat(config.maxCacheSize()).isEqualTo(1000);
        assertThat(config.evictionProtectionMs()).isEqualTo(1000);
        assertThat(config.maxPatterns()).isEqualTo(1_000_000);
        assertThat(config.metricsRegistry()).isSameAs(DaacMetricsRegistry.NOOP);
        assertThat(DaacConfig.builder().build()).isEqualTo(DaacConfig.DEFAULT);
    }

    @Test
    void testNoCache() {
        assertThat(DaacConfig.NO_CACHE.cacheEnabled()).isFalse();
        assertThat(DaacConfig.NO_CACHE.maxCacheSize()).isZero();
    }

    @Test
    void testBuilderOverrides() {
        DaacConfig config = DaacConfig.builder()
            .maxCacheSize(10)
            .evictionProtectionMs(0)
            .maxPatterns(5)
            .build();

        assertThat(config.maxCacheSize()).isEqualTo(10);
        assertThat(config.evictionProtectionMs()).isZero();
        assertThat(config.maxPatterns()).isEqualTo(5);
    }

    @Test
    void testValidation() {
        assertThatThrownBy(() -> DaacConfig.builder().maxPatterns(0).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxPatterns");
        assertThatThrownBy(() -> DaacConfig.builder().maxCacheSize(0).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxCacheSize");
        assertThatThrownBy(() -> DaacConfig.builder().evictionProtectionMs(-1).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("evictionProtectionMs");
        assertThatThrownBy(() -> DaacConfig.builder().metricsRegistry(null))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void testCacheLimitsIgnoredWhenDisabled() {
        DaacConfig config = DaacConfig.builder()
            .cacheEnabled(false)
            .maxCacheSize(0)
            .evictionProtectionMs(-1)
            .build();

        assertThat(config.cacheEnabled()).isFalse();
        assertThatThrownBy(() -> DaacConfig.builder().cacheEnabled(false).maxPatterns(-1).build())
            .isInstanceOf(IllegalArgumentException.class);
    }
}
