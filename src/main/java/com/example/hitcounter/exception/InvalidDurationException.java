package com.example.hitcounter.exception;

import java.time.Duration;

/**
 * 카운터 윈도우 길이가 resolution 의 2배 이상 정수배가 아닐 때 발생하는 예외
 */
public class InvalidDurationException extends IllegalArgumentException {

    private final Duration duration;
    private final Duration resolution;

    public InvalidDurationException(Duration duration, Duration resolution, String reason) {
        super(String.format("Counter duration must be a multiple of its resolution (duration: %s, resolution: %s): %s",
                duration, resolution, reason));
        this.duration = duration;
        this.resolution = resolution;
    }

    public Duration getDuration() {
        return duration;
    }

    public Duration getResolution() {
        return resolution;
    }
}
