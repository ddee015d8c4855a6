package com.demo.instrument.context;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class PropagatedHeadersTest {

    @AfterEach
    void reset() {
        PropagatedHeaders.set(List.of());
    }

    @Test
    void testSetKeepsOrderAndDropsDuplicates() {
        PropagatedHeaders.set(Arrays.asList("X-Request-Id", "x-tenant", "x-request-id"));

        assertEquals(List.of("X-Request-Id", "x-tenant"), PropagatedHeaders.keys());
        assertEquals(2, PropagatedHeaders.size());
    }

    @Test
    void testSnapshotIsImmutable() {
        PropagatedHeaders.set(List.of("x-tenant"));

        assertThrows(UnsupportedOperationException.class, () -> PropagatedHeaders.keys().add("x-other"));
    }

    @Test
    void testBlankNameRejected() {
        PropagatedHeaders.set(List.of("x-tenant"));

        assertThrows(IllegalArgumentException.class, () -> PropagatedHeaders.set(List.of("x-ok", " ")));
        assertEquals(List.of("x-tenant"), PropagatedHeaders.keys(), "failed update must leave the old set");
    }

    @Test
    void testRegisteredSpellingIsKept() {
        PropagatedHeaders.set(List.of(" X-EGO-Test "));

        assertEquals(List.of("X-EGO-Test"), PropagatedHeaders.keys());
    }

    @Test
    void testBinaryHeaderRejected() {
        assertThrows(IllegalArgumentException.class, () -> PropagatedHeaders.set(List.of("X-Trace-Bin")));
    }

    @Test
    void testConcurrentReadersSeeWholeSnapshots() throws Exception {
        List<String> before = List.of("a-1", "a-2", "a-3", "a-4");
        List<String> after = List.of("b-1", "b-2", "b-3", "b-4", "b-5");
        PropagatedHeaders.set(before);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        AtomicBoolean running = new AtomicBoolean(true);
        CountDownLatch started = new CountDownLatch(4);
        List<Future<Boolean>> readers = new ArrayList<>();
        try {
            for (int i = 0; i < 4; i++) {
                readers.add(pool.submit(() -> {
                    started.countDown();
                    while (running.get()) {
                        List<String> seen = PropagatedHeaders.keys();
                        if (!seen.equals(before) && !seen.equals(after)) {
                            return false;
                        }
                    }
                    return true;
                }));
            }
            assertTrue(started.await(5, TimeUnit.SECONDS));
            for (int i = 0; i < 2_000; i++) {
                PropagatedHeaders.set(i % 2 == 0 ? after : before);
            }
            running.set(false);
            for (Future<Boolean> reader : readers) {
                assertTrue(reader.get(5, TimeUnit.SECONDS), "reader observed a torn header set");
            }
        } finally {
            running.set(false);
            pool.shutdownNow();
        }
    }
}
