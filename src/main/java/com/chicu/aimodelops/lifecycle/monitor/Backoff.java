package com.chicu.aimodelops.lifecycle.monitor;

import lombok.experimental.UtilityClass;

import java.time.Duration;

@UtilityClass
public class Backoff {

    /**
     * interval · 2^failures, но не больше max(maxBackoff, interval).
     */
    public Duration nextDelay(Duration interval, int failures, Duration maxBackoff) {
        if (failures <= 0) return interval;

        Duration cap = maxBackoff.compareTo(interval) > 0 ? maxBackoff : interval;
        int shift = Math.min(failures, 30);
        long millis = interval.toMillis();

        if (millis > cap.toMillis() >> shift) {
            return cap;
        }
        Duration delay = Duration.ofMillis(millis << shift);
        return delay.compareTo(cap) > 0 ? cap : delay;
    }
}
