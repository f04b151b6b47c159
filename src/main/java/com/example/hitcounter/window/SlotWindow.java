package com.example.hitcounter.window;

import com.example.hitcounter.model.BucketSnapshot;
import com.example.hitcounter.model.HitBucket;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 고정 길이 슬롯 링
 *
 * 동작 원리:
 * - 인덱스 0 이 가장 최근 슬롯, size-1 이 가장 오래된 슬롯 (시각 기준 엄격한 내림차순)
 * - 용량은 생성 시점에 고정되며 늘거나 줄지 않음
 * - 새 슬롯이 들어오면 항상 가장 오래된 슬롯이 밀려남 (만료 여부와 무관)
 * - 앞쪽 삽입은 head 포인터 이동만으로 O(1), 중간 삽입은 뒤쪽 슬롯 이동으로 O(n)
 *
 * 스레드 안전하지 않습니다. 호출자가 구조 변경은 쓰기 락, 조회는 읽기 락 아래에서 수행해야 합니다.
 */
public class SlotWindow {

    private final HitBucket[] slots;
    private int head; // 가장 최근 슬롯의 물리 인덱스

    private SlotWindow(int numSlots) {
        if (numSlots < 2) {
            throw new IllegalArgumentException("Slot window needs at least 2 slots: " + numSlots);
        }
        this.slots = new HitBucket[numSlots];
        this.head = 0;
    }

    /**
     * now, now - resolution, now - 2 * resolution ... 시각의 빈 슬롯으로 채워진 윈도우를 생성합니다.
     *
     * @param numSlots 슬롯 개수
     * @param now resolution 단위로 내림된 현재 시각
     * @param resolution 슬롯 간 시간 간격
     * @return 초기화된 윈도우
     */
    public static SlotWindow preAged(int numSlots, Instant now, Duration resolution) {
        SlotWindow window = new SlotWindow(numSlots);
        Instant fillTime = now;
        for (int i = 0; i < numSlots; i++) {
            window.slots[i] = HitBucket.empty(fillTime);
            fillTime = fillTime.minus(resolution);
        }
        return window;
    }

    public int size() {
        return slots.length;
    }

    public HitBucket get(int position) {
        if (position < 0 || position >= slots.length) {
            throw new IndexOutOfBoundsException("position " + position + " out of " + slots.length + " slots");
        }
        return slots[physical(position)];
    }

    public HitBucket front() {
        return slots[head];
    }

    public HitBucket tail() {
        return slots[physical(slots.length - 1)];
    }

    /**
     * 가장 최근 슬롯으로 bucket 을 넣고 가장 오래된 슬롯을 제거합니다.
     *
     * @return 제거된 슬롯
     */
    public HitBucket pushFront(HitBucket bucket) {
        head = physical(slots.length - 1);
        HitBucket evicted = slots[head];
        slots[head] = bucket;
        return evicted;
    }

    /**
     * position 위치에 bucket 을 넣습니다. position 이후 슬롯은 한 칸씩 뒤로 밀리고 가장 오래된 슬롯은 제거됩니다.
     *
     * @return 제거된 슬롯
     */
    public HitBucket insertAt(int position, HitBucket bucket) {
        if (position == 0) {
            return pushFront(bucket);
        }
        if (position < 0 || position >= slots.length) {
            throw new IndexOutOfBoundsException("position " + position + " out of " + slots.length + " slots");
        }
        // position 이 마지막이면 이동 없이 tail 자리를 덮어씀
        HitBucket evicted = tail();
        for (int i = slots.length - 1; i > position; i--) {
            slots[physical(i)] = slots[physical(i - 1)];
        }
        slots[physical(position)] = bucket;
        return evicted;
    }

    //time 보다 이후가 아닌 첫 번째 슬롯 위치 (없으면 size)
    public int indexOfFirstNotAfter(Instant time) {
        for (int i = 0; i < slots.length; i++) {
            if (!get(i).getTime().isAfter(time)) {
                return i;
            }
        }
        return slots.length;
    }

    public List<BucketSnapshot> snapshot() {
        List<BucketSnapshot> snapshots = new ArrayList<>(slots.length);
        for (int i = 0; i < slots.length; i++) {
            snapshots.add(get(i).snapshot());
        }
        return Collections.unmodifiableList(snapshots);
    }

    private int physical(int position) {
        return (head + position) % slots.length;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[ ");
        for (int i = 0; i < slots.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(get(i));
        }
        return sb.append(" ]").toString();
    }
}
