package com.logsampler.test;

import com.logsampler.core.ExactMessageCounter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ExactMessageCounterTest {

    private ExactMessageCounter counter;

    @BeforeEach
    void setUp() {
        counter = new ExactMessageCounter();
    }

    @Test
    void testFirstIncrementCreatesEntry() {
        assertEquals(0, counter.size());
        assertEquals(1, counter.increment("foo"));
        assertEquals(1, counter.size());
        assertEquals(2, counter.increment("foo"));
        assertEquals(1, counter.size());
    }

    @Test
    void testShortKeysDoNotCollide() {
        counter.increment("foo");
        counter.increment("foo");
        counter.increment("bar");

        assertEquals(2, counter.get("foo"));
        assertEquals(1, counter.get("bar"));
    }

    @Test
    void testResetKeepsEntryAtZero() {
        counter.increment("foo");
        counter.increment("foo");

        counter.reset("foo");

        assertEquals(0, counter.get("foo"));
        assertEquals(1, counter.size());
        assertEquals(1, counter.increment("foo"));
    }

    @Test
    void testResetUnseenKeyIsNoOp() {
        counter.reset("never logged");

        assertEquals(0, counter.size());
        assertEquals(0, counter.get("never logged"));
        assertEquals(1, counter.increment("never logged"));
    }

    @Test
    void testConcurrentIncrementsOnOneKey() throws Exception {
        int threads = 32;
        int perThread = 2_000;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        counter.increment("hot message");
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals((long) threads * perThread, counter.get("hot message"));
        assertEquals(1, counter.size());
    }

    @Test
    void testConcurrentFirstIncrementsCreateOneEntry() throws Exception {
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int k = 0; k < 100; k++) {
                        counter.increment("key-" + k);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(100, counter.size());
        for (int k = 0; k < 100; k++) {
            assertEquals(threads, counter.get("key-" + k));
        }
    }
}
