package com.platform.updater.engine;

import com.platform.updater.error.ApplyCancelledException;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal for one payload apply.
 * Checked at the start of every attempt; wakes up backoff sleeps immediately.
 */
public class CancellationToken {
    
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private volatile String reason;
    
    public void cancel(String reason) {
        this.reason = reason;
        cancelled.countDown();
    }
    
    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }
    
    public String getReason() {
        return reason;
    }
    
    /**
     * @throws ApplyCancelledException if cancellation was requested or the thread was interrupted
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new ApplyCancelledException("Apply cancelled: " + reason);
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new ApplyCancelledException("Apply interrupted");
        }
    }
    
    /**
     * Sleep for the given delay unless cancelled first.
     *
     * @throws ApplyCancelledException if cancelled before or during the sleep
     */
    public void sleep(Duration delay) {
        throwIfCancelled();
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            if (cancelled.await(delay.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new ApplyCancelledException("Apply cancelled: " + reason);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApplyCancelledException("Apply interrupted during backoff", e);
        }
    }
}
