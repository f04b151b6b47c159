package com.example.hitcounter.model;

import com.example.hitcounter.util.TimeUtil;
import lombok.Getter;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 하나의 resolution 구간에 기록된 hit 수를 담는 슬롯
 * 시각은 윈도우에 설치된 이후 변경되지 않으며, 카운트는 락 없이 원자적으로 증가합니다.
 */
public class HitBucket {

    @Getter
    private final Instant time; // resolution 단위로 내림된 슬롯 시각
    private final AtomicLong hits; // 슬롯에 기록된 hit 수

    private HitBucket(Instant time, long initialHits) {
        this.time = Objects.requireNonNull(time, "time");
        this.hits = new AtomicLong(initialHits);
    }

    //hit 이 없는 빈 슬롯 생성 (윈도우 초기화용)
    public static HitBucket empty(Instant time) {
        return new HitBucket(time, 0);
    }

    //첫 hit 이 이미 반영된 슬롯 생성
    public static HitBucket withFirstHit(Instant time) {
        return new HitBucket(time, 1);
    }

    public void addHit() {
        hits.incrementAndGet();
    }

    public long getHits() {
        return hits.get();
    }

    public BucketSnapshot snapshot() {
        return BucketSnapshot.of(time, hits.get());
    }

    @Override
    public String toString() {
        return String.format("%d hits at %s", hits.get(), TimeUtil.formatTimestamp(time));
    }
}
