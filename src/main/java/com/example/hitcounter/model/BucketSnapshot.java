package com.example.hitcounter.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 특정 시점의 슬롯 상태를 담는 불변 객체
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class BucketSnapshot {

    private final Instant time; // 슬롯 시각
    private final long hits; // 스냅샷 시점의 hit 수

    public static BucketSnapshot of(Instant time, long hits) {
        return BucketSnapshot.builder()
                .time(time)
                .hits(hits)
                .build();
    }
}
