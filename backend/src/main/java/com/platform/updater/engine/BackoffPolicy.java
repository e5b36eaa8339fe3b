package com.platform.updater.engine;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded retry schedule for applying a single manifest.
 * Stateless: every manifest apply starts counting attempts from one.
 *
 * @param maxAttempts  attempts per manifest and pass, at least one
 * @param initialDelay delay after the first failed attempt
 * @param factor       growth of the delay per failed attempt
 * @param cap          upper bound of any delay, jitter included
 * @param jitter       fraction of the base delay added at random, in [0, 1)
 */
public record BackoffPolicy(int maxAttempts, Duration initialDelay, double factor, Duration cap, double jitter) {
    
    public BackoffPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be >= 0");
        }
        if (factor < 1.0) {
            throw new IllegalArgumentException("factor must be >= 1.0");
        }
        if (cap == null || cap.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("cap must be >= initialDelay");
        }
        if (jitter < 0.0 || jitter >= 1.0) {
            throw new IllegalArgumentException("jitter must be in [0, 1)");
        }
    }
    
    public static BackoffPolicy of(int maxAttempts, Duration initialDelay, double factor, Duration cap) {
        return new BackoffPolicy(maxAttempts, initialDelay, factor, cap, 0.0);
    }
    
    /**
     * Delay to wait after the given (1-based) failed attempt before the next one.
     */
    public Duration delayAfter(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        double exponential = initialDelay.toMillis() * Math.pow(factor, attempt - 1);
        long base = (long) Math.min(exponential, cap.toMillis());
        
        if (jitter == 0.0 || base == 0) {
            return Duration.ofMillis(base);
        }
        long jittered = base + (long) (base * jitter * ThreadLocalRandom.current().nextDouble());
        return Duration.ofMillis(Math.min(jittered, cap.toMillis()));
    }
}
