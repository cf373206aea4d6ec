package com.queryscope.platform.id;

import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class IdGeneratorTest {

    @Test
    void idsAre32LowerHexChars() {
        String id = IdGenerator.getInstance().generateOperationId();

        assertEquals(32, id.length());
        assertTrue(id.matches("[0-9a-f]{32}"), id);
    }

    @Test
    void idsAreUniqueAcrossThreads() throws Exception {
        int threads = 8;
        int perThread = 5_000;
        Set<String> ids = ConcurrentHashMap.newKeySet();
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            for (int t = 0; t < threads; t++) {
                pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < perThread; i++) {
                        ids.add(IdGenerator.getInstance().generateOperationId());
                    }
                    return null;
                });
            }
            go.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertEquals(threads * perThread, ids.size());
    }
}
