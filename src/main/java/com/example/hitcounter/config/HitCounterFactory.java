package com.example.hitcounter.config;

import com.example.hitcounter.core.HitCounter;
import com.example.hitcounter.core.RollingHitCounter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hit Counter 인스턴스를 생성하고 관리하는 팩토리 클래스
 * 이름마다 하나의 카운터를 만들어 재사용합니다.
 */
@Slf4j
@RequiredArgsConstructor
public class HitCounterFactory {

    private final HitCounterProperties properties;
    private final Clock clock;
    private final ConcurrentHashMap<String, HitCounter> counterCache = new ConcurrentHashMap<>();

    //기본 카운터 반환
    public HitCounter getCounter() {
        return getCounter(RollingHitCounter.DEFAULT_COUNTER_NAME);
    }

    //이름에 해당하는 카운터 반환, 없으면 설정에 따라 생성
    public HitCounter getCounter(String counterName) {
        return counterCache.computeIfAbsent(counterName, this::createCounter);
    }

    //지금까지 생성된 카운터 목록
    public Map<String, HitCounter> getCounters() {
        return Collections.unmodifiableMap(counterCache);
    }

    private HitCounter createCounter(String counterName) {
        if (!properties.isConfigured(counterName) && !RollingHitCounter.DEFAULT_COUNTER_NAME.equals(counterName)) {
            log.warn("No configuration for counter: {}, using defaults", counterName);
        }

        HitCounterProperties.CounterConfig config = properties.getCounterConfig(counterName);

        log.info("Creating RollingHitCounter '{}' with duration: {}, resolution: {}",
                counterName, config.getDuration(), config.getResolution());

        return new RollingHitCounter(counterName, config.getDuration(), config.getResolution(), clock);
    }
}
