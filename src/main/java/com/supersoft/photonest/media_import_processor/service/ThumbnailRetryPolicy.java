package com.supersoft.photonest.media_import_processor.service;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Decides whether another thumbnail retry is allowed and how long to wait before it.
 */
@Component
public class ThumbnailRetryPolicy {

    @Value("${thumbnail.retry.max-attempts:5}")
    private int maxAttempts;

    @Value("${thumbnail.retry.countdown-seconds:300}")
    private long countdownSeconds;

    @Value("${thumbnail.retry.mode:FIXED}")
    private Mode mode;

    @Value("${thumbnail.retry.max-countdown-seconds:3600}")
    private long maxCountdownSeconds;

    public Decision decide(int attempts) {
        if (attempts >= maxAttempts) {
            return new Decision(false, Duration.ZERO);
        }
        return new Decision(true, countdownFor(attempts));
    }

    Duration countdownFor(int attempts) {
        if (mode == Mode.FIXED) {
            return Duration.ofSeconds(countdownSeconds);
        }
        // Exponential backoff: countdown * 2^attempts, capped
        long seconds = (long) (countdownSeconds * Math.pow(2, attempts));
        return Duration.ofSeconds(Math.min(seconds, maxCountdownSeconds));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    @Getter
    @AllArgsConstructor
    public static class Decision {
        private final boolean allowed;
        private final Duration countdown;
    }

    public enum Mode {
        FIXED, BACKOFF
    }
}
