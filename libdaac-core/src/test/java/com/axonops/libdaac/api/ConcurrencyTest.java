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

import com.axonops.libdaac.cache.AutomatonCache;
import com.axonops.libdaac.cache.CacheStatistics;
import com.axonops.libdaac.test.TestUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Concurrent searches on shared automata and concurrent access to the global cache.
 */
class ConcurrencyTest {

    private AutomatonCache originalCache;

    @BeforeEach
    void setup() {
        originalCache = TestUtils.replaceGlobalCache(TestUtils.testConfigBuilder().build());
    }

    @AfterEach
    void cleanup() {
        TestUtils.restoreGlobalCache(originalCache);
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void testConcurrentSearchesOnSharedAutomaton_50Threads() throws InterruptedException {
        Automaton automaton = Automaton.build(List.of("t", "hi", "h", "this", "テス"),
            MatchKind.LEFTMOST_LONGEST);
        String haystack = "this is a テスト ".repeat(50);
        List<Match> expected = automaton.find(haystack);

        int threadCount = 50;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger errors = new AtomicInteger(0);
        AtomicInteger mismatches = new AtomicInteger(0);

        for (int i = 0; i < threadCount; i++) {
            new Thread(() -> {
                try {
                    start.await();
                    for (int j = 0; j < 100; j++) {
                        if (!automaton.find(haystack).equals(expected)) {
                            mismatches.incrementAndGet();
                        }
                    }
                } catch (Exception e) {
                    errors.incrementAndGet();
                } finally {
                    done.countDown();
                }
            }).start();
        }

        start.countDown();
        done.await();

        assertThat(errors.get()).isEqualTo(0);
        assertThat(mismatches.get()).isEqualTo(0);
        assertThat(expected).hasSize(100);
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void testConcurrentCompileBuildsOnce_100Threads() throws InterruptedException {
        List<String> patterns = List.of("alpha", "beta", "gamma");
        int threadCount = 100;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger errors = new AtomicInteger(0);
        ConcurrentHashMap<Automaton, Boolean> instances = new ConcurrentHashMap<>();

        for (int i = 0; i < threadCount; i++) {
            new Thread(() -> {
                try {
                    start.await();
                    instances.put(Daac.compile(patterns), Boolean.TRUE);
                } catch (Exception e) {
                    errors.incrementAndGet();
                } finally {
                    done.countDown();
                }
            }).start();
        }

        start.countDown();
        done.await();

        assertThat(errors.get()).isEqualTo(0);
        assertThat(instances).hasSize(1);
        assertThat(Daac.getCacheStatistics().totalRequests()).isEqualTo(threadCount);
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void testConcurrentStatisticsAreAccurate_100Threads() throws InterruptedException {
        int threadCount = 100;
        int opsPerThread = 100;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger errors = new AtomicInteger(0);

        for (int i = 0; i < threadCount; i++) {
            new Thread(() -> {
                try {
                    start.await();
                    for (int j = 0; j < opsPerThread; j++) {
                        Daac.compile(List.of("pattern" + (j % 10))); // Some hits, some misses
                    }
                } catch (Exception e) {
                    errors.incrementAndGet();
                } finally {
                    done.countDown();
                }
            }).start();
        }

        start.countDown();
        done.await();

        assertThat(errors.get()).isEqualTo(0);

        // No lost increments
        CacheStatistics stats = Daac.getCacheStatistics();
        assertThat(stats.totalRequests()).isEqualTo(threadCount * opsPerThread);
        assertThat(stats.currentSize()).isEqualTo(10);
    }
}
