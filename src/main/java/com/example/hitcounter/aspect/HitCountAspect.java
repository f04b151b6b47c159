package com.example.hitcounter.aspect;

import com.example.hitcounter.annotation.CountHit;
import com.example.hitcounter.config.HitCounterFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hit Count AOP Aspect
 * @CountHit 어노테이션이 적용된 메서드의 호출을 가로채서 카운터에 hit 을 기록합니다.
 */
@Slf4j
@Aspect
@RequiredArgsConstructor
public class HitCountAspect {

    private final HitCounterFactory hitCounterFactory;
    private final Set<String> invalidCounters = ConcurrentHashMap.newKeySet(); // 생성에 실패한 카운터 이름

    /**
     * hit 을 기록한 뒤 원래 메서드를 호출합니다.
     * 카운터 설정이 잘못된 경우에도 메서드 호출은 막지 않으며, 오류는 카운터마다 한 번만 기록합니다.
     */
    @Around("@annotation(countHit)")
    public Object around(ProceedingJoinPoint joinPoint, CountHit countHit) throws Throwable {
        String counterName = countHit.counter();

        if (!invalidCounters.contains(counterName)) {
            try {
                hitCounterFactory.getCounter(counterName).addHit();
            } catch (IllegalArgumentException e) {
                if (invalidCounters.add(counterName)) {
                    log.error("Failed to create counter: {} for {}, hits will not be recorded",
                            counterName, joinPoint.getSignature().toShortString(), e);
                }
            }
        }

        return joinPoint.proceed();
    }

    //설정 오류로 hit 을 기록하지 못하는 카운터 목록
    public Set<String> getInvalidCounters() {
        return Set.copyOf(invalidCounters);
    }
}
