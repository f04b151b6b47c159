package com.example.hitcounter.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * 롤링 윈도우 hit 카운터의 공통 인터페이스
 */
public interface HitCounter {

    /**
     * 현재 시각에 hit 을 하나 기록합니다.
     */
    void addHit();

    /**
     * 주어진 시각에 hit 을 하나 기록합니다.
     * 윈도우가 보관하는 범위보다 오래된 시각이면 아무 것도 기록하지 않습니다.
     *
     * @param time hit 발생 시각
     */
    void addHitAtTime(Instant time);

    /**
     * 현재 윈도우 안에 기록된 전체 hit 수를 반환합니다.
     *
     * @return 윈도우 내 hit 합계
     */
    long getHits();

    /**
     * 카운터에 설정된 윈도우 길이를 반환합니다.
     *
     * @return 슬롯 개수 × resolution
     */
    Duration getDuration();

    /**
     * 카운터의 현재 상태 정보를 반환합니다.
     *
     * @return 상태 정보 Map
     */
    Map<String, Object> getStats();

    /**
     * 카운터 이름을 반환합니다.
     *
     * @return 카운터 이름
     */
    String getCounterName();
}
