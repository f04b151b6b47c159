package com.example.hitcounter.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TimeUtil 테스트")
class TimeUtilTest {

    @Test
    @DisplayName("resolution 단위로 내림되어야 함")
    void testTruncate() {
        Instant time = Instant.parse("2024-01-01T00:00:07.900Z");

        assertEquals(Instant.parse("2024-01-01T00:00:07Z"), TimeUtil.truncate(time, Duration.ofSeconds(1)));
        assertEquals(Instant.parse("2024-01-01T00:00:05Z"), TimeUtil.truncate(time, Duration.ofSeconds(5)));
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), TimeUtil.truncate(time, Duration.ofMinutes(1)));
        assertEquals(Instant.parse("2024-01-01T00:00:07.750Z"), TimeUtil.truncate(time, Duration.ofMillis(250)));
    }

    @Test
    @DisplayName("이미 경계에 있는 시각은 그대로 유지되어야 함")
    void testTruncateOnBoundary() {
        Instant time = Instant.parse("2024-01-01T00:00:10Z");

        assertEquals(time, TimeUtil.truncate(time, Duration.ofSeconds(2)));
    }

    @Test
    @DisplayName("epoch 이전 시각도 내림(floor)으로 처리되어야 함")
    void testTruncateBeforeEpoch() {
        Instant time = Instant.EPOCH.minusMillis(1500);

        assertEquals(Instant.EPOCH.minusSeconds(2), TimeUtil.truncate(time, Duration.ofSeconds(1)));
    }

    @Test
    @DisplayName("나노초가 long 범위를 넘는 먼 과거/미래 시각도 내림되어야 함")
    void testTruncateWideRange() {
        assertEquals(Instant.parse("1500-01-01T00:00:00Z"),
                TimeUtil.truncate(Instant.parse("1500-01-01T00:00:00.700Z"), Duration.ofSeconds(1)));
        assertEquals(Instant.parse("1499-12-31T23:59:59Z"),
                TimeUtil.truncate(Instant.parse("1499-12-31T23:59:59.999Z"), Duration.ofSeconds(1)));
        assertEquals(Instant.parse("3000-01-01T00:00:00Z"),
                TimeUtil.truncate(Instant.parse("3000-01-01T00:00:42Z"), Duration.ofMinutes(1)));
    }

    @Test
    @DisplayName("수백 년 단위 resolution 은 epoch 기준으로 내림되어야 함")
    void testTruncateCenturyResolution() {
        Duration resolution = Duration.ofDays(365 * 300);

        assertEquals(Instant.EPOCH, TimeUtil.truncate(Instant.parse("2024-01-01T00:00:00Z"), resolution));
        assertEquals(Instant.EPOCH.minus(resolution), TimeUtil.truncate(Instant.parse("1969-12-31T23:59:59Z"), resolution));
    }

    @Test
    @DisplayName("정수배 여부 판단")
    void testIsMultipleOf() {
        assertTrue(TimeUtil.isMultipleOf(Duration.ofSeconds(10), Duration.ofSeconds(2)));
        assertTrue(TimeUtil.isMultipleOf(Duration.ofMinutes(5), Duration.ofSeconds(1)));
        assertFalse(TimeUtil.isMultipleOf(Duration.ofSeconds(10), Duration.ofSeconds(7)));
        assertFalse(TimeUtil.isMultipleOf(Duration.ofMillis(1500), Duration.ofSeconds(1)));
    }
}
