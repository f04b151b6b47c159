package com.example.hitcounter.util;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * 시간 관련 유틸리티 클래스
 */
public class TimeUtil {

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");
    private static final long NANOS_PER_SECOND = 1_000_000_000L;
    private static final BigInteger BIG_NANOS_PER_SECOND = BigInteger.valueOf(NANOS_PER_SECOND);
    // 이 범위 안의 초 값은 나노초로 바꿔도 long 을 넘지 않음
    private static final long MAX_EXACT_SECONDS = Long.MAX_VALUE / NANOS_PER_SECOND - 1;

    private TimeUtil() {
    }

    /**
     * 주어진 시각을 resolution 단위로 내림합니다.
     * epoch 기준으로 time 이하인 resolution 배수 중 가장 큰 값을 반환하며, epoch 이전 시각도 내림으로 처리합니다.
     *
     * @param time 내림할 시각
     * @param resolution 0보다 큰 단위 시간
     * @return resolution 배수로 내림된 시각
     * @throws java.time.DateTimeException 내림 결과가 Instant.MIN 보다 이전인 경우
     */
    public static Instant truncate(Instant time, Duration resolution) {
        if (Math.abs(time.getEpochSecond()) < MAX_EXACT_SECONDS && resolution.getSeconds() < MAX_EXACT_SECONDS) {
            long resolutionNanos = resolution.toNanos();
            long epochNanos = time.getEpochSecond() * NANOS_PER_SECOND + time.getNano();
            long floored = epochNanos - Math.floorMod(epochNanos, resolutionNanos);
            return Instant.ofEpochSecond(0, floored);
        }

        // 1677년 이전, 2262년 이후 시각이나 약 292년 이상의 resolution
        BigInteger epochNanos = toNanos(time.getEpochSecond(), time.getNano());
        BigInteger floored = epochNanos.subtract(epochNanos.mod(toNanos(resolution.getSeconds(), resolution.getNano())));
        BigInteger[] secondsAndNanos = floored.divideAndRemainder(BIG_NANOS_PER_SECOND);
        return Instant.ofEpochSecond(secondsAndNanos[0].longValueExact(), secondsAndNanos[1].longValue());
    }

    private static BigInteger toNanos(long seconds, int nanos) {
        return BigInteger.valueOf(seconds).multiply(BIG_NANOS_PER_SECOND).add(BigInteger.valueOf(nanos));
    }

    //duration 이 resolution 으로 정확히 나누어 떨어지는지 확인
    public static boolean isMultipleOf(Duration duration, Duration resolution) {
        long quotient = duration.dividedBy(resolution);
        return resolution.multipliedBy(quotient).equals(duration);
    }

    //디버그 출력용 시각 포맷
    public static String formatTimestamp(Instant time) {
        LocalDateTime dateTime = LocalDateTime.ofInstant(time, ZoneId.systemDefault());
        return dateTime.format(FORMATTER);
    }
}
