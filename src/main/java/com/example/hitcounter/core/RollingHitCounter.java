package com.example.hitcounter.core;

import com.example.hitcounter.exception.InvalidDurationException;
import com.example.hitcounter.model.BucketSnapshot;
import com.example.hitcounter.model.HitBucket;
import com.example.hitcounter.util.TimeUtil;
import com.example.hitcounter.window.SlotWindow;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 고정 메모리 롤링 윈도우 hit 카운터
 *
 * 동작 원리:
 * - 윈도우를 duration / resolution 개의 슬롯으로 나누고, 각 슬롯은 resolution 구간의 hit 수를 보관
 * - 시간이 흐르면 hit 기록 시점에 윈도우를 한 칸씩 밀어 가장 오래된 슬롯을 버림 (백그라운드 타이머 없음)
 * - 순서가 뒤바뀐 시각의 hit 도 윈도우 범위 안이면 해당 슬롯에 반영
 *
 * 동시성:
 * - 현재 슬롯에 대한 hit 은 읽기 락 + 원자적 증가로 처리하여 서로 경합하지 않음
 * - 슬롯 이동/삽입은 쓰기 락 아래에서 대상 슬롯 증가까지 한 번에 처리
 * - 조회는 읽기 락을 잡으므로 이동 중인 윈도우를 보지 않음
 */
@Slf4j
public class RollingHitCounter implements HitCounter {

    public static final String DEFAULT_COUNTER_NAME = "default";
    private static final int MAX_SLOTS = Integer.MAX_VALUE - 8;
    // 윈도우 길이를 밀리초로 표현할 수 있는 범위
    private static final long MAX_DURATION_SECONDS = Long.MAX_VALUE / 1000;

    private final String counterName;
    private final Duration resolution;
    private final Clock clock;
    private final SlotWindow window;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public RollingHitCounter(Duration duration, Duration resolution) {
        this(DEFAULT_COUNTER_NAME, duration, resolution, Clock.systemUTC());
    }

    public RollingHitCounter(Duration duration, Duration resolution, Clock clock) {
        this(DEFAULT_COUNTER_NAME, duration, resolution, clock);
    }

    /**
     * 사용자 정의 설정으로 RollingHitCounter 생성
     *
     * @param counterName 카운터 이름 (로그 및 통계용)
     * @param duration 윈도우 길이, resolution 의 2배 이상 정수배여야 함
     * @param resolution 슬롯 하나가 담당하는 시간 간격
     * @param clock 현재 시각 공급원
     * @throws InvalidDurationException duration 이 resolution 보다 길지 않거나 정수배가 아닌 경우
     */
    public RollingHitCounter(String counterName, Duration duration, Duration resolution, Clock clock) {
        int numSlots = validate(duration, resolution);
        this.counterName = Objects.requireNonNull(counterName, "counterName");
        this.resolution = resolution;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.window = SlotWindow.preAged(numSlots, now(), resolution);

        log.info("RollingHitCounter initialized - name: {}, duration: {}, resolution: {}, slots: {}",
                counterName, duration, resolution, numSlots);
    }

    //설정 검증 후 슬롯 개수 반환
    private static int validate(Duration duration, Duration resolution) {
        if (duration == null || resolution == null) {
            throw new InvalidDurationException(duration, resolution, "duration and resolution are required");
        }
        if (resolution.isNegative() || resolution.isZero()) {
            throw new InvalidDurationException(duration, resolution, "resolution must be positive");
        }
        if (duration.compareTo(resolution) <= 0) {
            throw new InvalidDurationException(duration, resolution, "duration must be longer than resolution");
        }
        if (duration.getSeconds() > MAX_DURATION_SECONDS) {
            throw new InvalidDurationException(duration, resolution, "duration exceeds supported range");
        }
        // 몫이 long 을 넘기 전에 슬롯 개수 상한을 먼저 확인
        if (duration.dividedBy(MAX_SLOTS).compareTo(resolution) > 0) {
            throw new InvalidDurationException(duration, resolution, "too many slots");
        }
        if (!TimeUtil.isMultipleOf(duration, resolution)) {
            throw new InvalidDurationException(duration, resolution, "duration is not divisible by resolution");
        }
        long numSlots = duration.dividedBy(resolution);
        if (numSlots > MAX_SLOTS) {
            throw new InvalidDurationException(duration, resolution, "too many slots: " + numSlots);
        }
        return (int) numSlots;
    }

    private Instant now() {
        return TimeUtil.truncate(clock.instant(), resolution);
    }

    @Override
    public void addHit() {
        addHitAtTime(clock.instant());
    }

    @Override
    public void addHitAtTime(Instant time) {
        Objects.requireNonNull(time, "time");
        Instant slotTime;

        lock.readLock().lock();
        try {
            // 보관 범위보다 오래된 시각은 내림 계산 없이 버림
            if (time.isBefore(window.tail().getTime())) {
                log.debug("Hit discarded, older than retained window - counter: {}, time: {}, oldest: {}",
                        counterName, time, window.tail().getTime());
                return;
            }

            // 현재 슬롯이면 구조 변경 없이 증가
            slotTime = TimeUtil.truncate(time, resolution);
            HitBucket front = window.front();
            if (front.getTime().equals(slotTime)) {
                front.addHit();
                log.trace("Hit recorded in current slot - counter: {}, slot: {}", counterName, slotTime);
                return;
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            recordWithShift(slotTime);
        } finally {
            lock.writeLock().unlock();
        }
    }

    //쓰기 락 아래에서 호출, 락을 놓는 사이 윈도우가 바뀌었을 수 있으므로 처음부터 다시 판단
    private void recordWithShift(Instant slotTime) {
        HitBucket front = window.front();

        if (front.getTime().equals(slotTime)) {
            front.addHit();
            return;
        }

        if (slotTime.isAfter(front.getTime())) {
            // 윈도우 전진: 만료 여부와 무관하게 가장 오래된 슬롯을 버림
            HitBucket evicted = window.pushFront(HitBucket.withFirstHit(slotTime));
            log.debug("Window advanced - counter: {}, new slot: {}, evicted: {}", counterName, slotTime, evicted);
            return;
        }

        if (slotTime.isBefore(window.tail().getTime())) {
            log.debug("Hit discarded, older than retained window - counter: {}, slot: {}, oldest: {}",
                    counterName, slotTime, window.tail().getTime());
            return;
        }

        int position = window.indexOfFirstNotAfter(slotTime);
        HitBucket target = window.get(position);
        if (target.getTime().equals(slotTime)) {
            target.addHit();
            return;
        }

        HitBucket evicted = window.insertAt(position, HitBucket.withFirstHit(slotTime));
        log.debug("Slot inserted - counter: {}, slot: {}, position: {}, evicted: {}",
                counterName, slotTime, position, evicted);
    }

    @Override
    public long getHits() {
        lock.readLock().lock();
        try {
            return sumHits(expiryCutoff());
        } finally {
            lock.readLock().unlock();
        }
    }

    // 이 시각 이전 슬롯은 만료, 가장 오래 보관되는 슬롯 시각(now - (slots - 1) × resolution)까지 포함
    private Instant expiryCutoff() {
        return now().minus(getDuration()).plus(resolution);
    }

    //윈도우는 내림차순이므로 첫 만료 슬롯에서 중단
    private long sumHits(Instant cutoff) {
        long total = 0;
        for (int i = 0; i < window.size(); i++) {
            HitBucket bucket = window.get(i);
            if (bucket.getTime().isBefore(cutoff)) {
                break;
            }
            total += bucket.getHits();
        }
        return total;
    }

    @Override
    public Duration getDuration() {
        return resolution.multipliedBy(window.size());
    }

    public Duration getResolution() {
        return resolution;
    }

    public int getSlotCount() {
        return window.size();
    }

    /**
     * 가장 최근 슬롯부터 오래된 순서로 슬롯 스냅샷을 반환합니다. 만료된 슬롯도 포함됩니다.
     */
    public List<BucketSnapshot> snapshot() {
        lock.readLock().lock();
        try {
            return window.snapshot();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        lock.readLock().lock();
        try {
            List<BucketSnapshot> buckets = window.snapshot();

            stats.put("counterName", counterName);
            stats.put("totalHits", sumHits(expiryCutoff()));
            stats.put("durationMillis", getDuration().toMillis());
            stats.put("resolutionMillis", resolution.toMillis());
            stats.put("slotCount", buckets.size());
            stats.put("newestRetained", buckets.get(0).getTime());
            stats.put("oldestRetained", buckets.get(buckets.size() - 1).getTime());

            // 슬롯 세부 정보 (디버깅용)
            Map<String, Long> bucketCounts = new LinkedHashMap<>();
            for (BucketSnapshot bucket : buckets) {
                bucketCounts.put(bucket.getTime().toString(), bucket.getHits());
            }
            stats.put("bucketCounts", bucketCounts);
        } finally {
            lock.readLock().unlock();
        }
        return stats;
    }

    @Override
    public String getCounterName() {
        return counterName;
    }

    @Override
    public String toString() {
        lock.readLock().lock();
        try {
            return window.toString();
        } finally {
            lock.readLock().unlock();
        }
    }
}
