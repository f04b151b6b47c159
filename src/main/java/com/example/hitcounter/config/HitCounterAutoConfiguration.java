package com.example.hitcounter.config;

import com.example.hitcounter.aspect.HitCountAspect;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Hit Counter 자동 설정 클래스
 *
 * Clock, HitCounterFactory, HitCountAspect Bean 을 등록합니다.
 * 테스트에서는 Clock Bean 을 교체하여 시간을 고정할 수 있습니다.
 */
@AutoConfiguration
@EnableConfigurationProperties(HitCounterProperties.class)
@ConditionalOnProperty(prefix = "hit-counter", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HitCounterAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock hitCounterClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public HitCounterFactory hitCounterFactory(HitCounterProperties properties, Clock clock) {
        return new HitCounterFactory(properties, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnClass(name = "org.aspectj.lang.annotation.Aspect")
    public HitCountAspect hitCountAspect(HitCounterFactory hitCounterFactory) {
        return new HitCountAspect(hitCounterFactory);
    }
}
