package com.example.hitcounter.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HitBucket 테스트")
class HitBucketTest {

    private static final Instant SLOT_TIME = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    @DisplayName("생성 방식에 따라 초기 hit 수가 달라야 함")
    void testInitialHits() {
        assertEquals(0, HitBucket.empty(SLOT_TIME).getHits());
        assertEquals(1, HitBucket.withFirstHit(SLOT_TIME).getHits());
        assertEquals(SLOT_TIME, HitBucket.empty(SLOT_TIME).getTime());
    }

    @Test
    @DisplayName("동시에 증가시켜도 유실되는 hit 이 없어야 함")
    void testConcurrentAddHit() throws InterruptedException {
        HitBucket bucket = HitBucket.empty(SLOT_TIME);
        int threadCount = 8;
        int hitsPerThread = 10_000;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch start = new CountDownLatch(1);

        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                start.await();
                for (int j = 0; j < hitsPerThread; j++) {
                    bucket.addHit();
                }
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));

        assertEquals((long) threadCount * hitsPerThread, bucket.getHits());
    }

    @Test
    @DisplayName("스냅샷은 이후 증가의 영향을 받지 않아야 함")
    void testSnapshot() {
        HitBucket bucket = HitBucket.withFirstHit(SLOT_TIME);
        BucketSnapshot snapshot = bucket.snapshot();
        bucket.addHit();

        assertEquals(BucketSnapshot.of(SLOT_TIME, 1), snapshot);
        assertEquals(2, bucket.getHits());
        assertTrue(bucket.toString().startsWith("2 hits at "));
    }
}
