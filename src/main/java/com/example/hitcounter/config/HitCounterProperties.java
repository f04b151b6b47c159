package com.example.hitcounter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Hit Counter 설정 프로퍼티
 */
@Data
@ConfigurationProperties(prefix = "hit-counter")
public class HitCounterProperties {

    private boolean enabled = true; // Hit Counter 활성화
    private Duration defaultDuration = Duration.ofSeconds(60); // 기본 윈도우 길이
    private Duration defaultResolution = Duration.ofSeconds(1); // 기본 슬롯 간격
    private Map<String, CounterConfig> counters = new HashMap<>(); // 카운터 이름별 설정

    @Data
    public static class CounterConfig {
        private Duration duration;
        private Duration resolution;
    }

    /**
     * 이름에 해당하는 카운터 설정 반환, 비어 있는 항목은 기본값으로 채움
     */
    public CounterConfig getCounterConfig(String counterName) {
        CounterConfig configured = counters.get(counterName);
        CounterConfig config = new CounterConfig();
        config.setDuration(configured != null && configured.getDuration() != null
                ? configured.getDuration() : defaultDuration);
        config.setResolution(configured != null && configured.getResolution() != null
                ? configured.getResolution() : defaultResolution);
        return config;
    }

    public boolean isConfigured(String counterName) {
        return counters.containsKey(counterName);
    }
}
