package com.example.hitcounter.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Hit 기록 어노테이션
 * 메서드에 적용하면 호출될 때마다 지정한 카운터에 hit 이 하나 기록됩니다.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface CountHit {

    /**
     * hit 을 기록할 카운터 이름
     * hit-counter.counters 에 설정된 이름, 없으면 기본 설정으로 생성됩니다.
     */
    String counter() default "default";
}
