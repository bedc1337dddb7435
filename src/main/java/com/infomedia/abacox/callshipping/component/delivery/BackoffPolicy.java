package com.infomedia.abacox.callshipping.component.delivery;

import com.infomedia.abacox.callshipping.component.engine.EngineConfigService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Exponential backoff: the initial delay doubled per failure, capped at the configured maximum.
 * A shipment failing continuously for longer than the retry deadline is given up.
 */
@Component
@RequiredArgsConstructor
public class BackoffPolicy {

    private final EngineConfigService engineConfig;

    /**
     * Delay before the next attempt.
     *
     * @param failures consecutive failures so far, starting at 1
     */
    public Duration delayAfter(int failures) {
        Duration initial = engineConfig.getRetryInitialBackoff();
        Duration max = engineConfig.getRetryMaxBackoff();
        int exponent = Math.max(0, failures - 1);
        // 2^30 seconds is far beyond any sensible cap
        if (exponent >= 30) {
            return max;
        }
        Duration delay = initial.multipliedBy(1L << exponent);
        return delay.compareTo(max) > 0 ? max : delay;
    }

    public boolean isDeadlineExceeded(Instant firstFailureAt, Instant now) {
        if (firstFailureAt == null) {
            return false;
        }
        return Duration.between(firstFailureAt, now).compareTo(engineConfig.getRetryDeadline()) >= 0;
    }
}
