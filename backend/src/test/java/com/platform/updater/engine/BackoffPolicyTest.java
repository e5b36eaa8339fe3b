package com.platform.updater.engine;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BackoffPolicyTest {
    
    @Test
    void delayGrowsExponentially() {
        BackoffPolicy policy = BackoffPolicy.of(5, Duration.ofMillis(100), 2.0, Duration.ofSeconds(10));
        
        assertEquals(Duration.ofMillis(100), policy.delayAfter(1));
        assertEquals(Duration.ofMillis(200), policy.delayAfter(2));
        assertEquals(Duration.ofMillis(400), policy.delayAfter(3));
        assertEquals(Duration.ofMillis(800), policy.delayAfter(4));
    }
    
    @Test
    void delayIsCapped() {
        BackoffPolicy policy = BackoffPolicy.of(10, Duration.ofMillis(100), 10.0, Duration.ofMillis(500));
        
        assertEquals(Duration.ofMillis(500), policy.delayAfter(3));
        assertEquals(Duration.ofMillis(500), policy.delayAfter(9));
    }
    
    @Test
    void jitterStaysWithinBounds() {
        BackoffPolicy policy = new BackoffPolicy(3, Duration.ofMillis(1000), 2.0, Duration.ofMillis(1500), 0.5);
        
        for (int i = 0; i < 100; i++) {
            long first = policy.delayAfter(1).toMillis();
            assertTrue(first >= 1000 && first <= 1500, "delay " + first);
            assertEquals(1500, policy.delayAfter(2).toMillis());
        }
    }
    
    @Test
    void zeroDelayStaysZero() {
        BackoffPolicy policy = new BackoffPolicy(3, Duration.ZERO, 2.0, Duration.ZERO, 0.5);
        
        assertEquals(Duration.ZERO, policy.delayAfter(1));
        assertEquals(Duration.ZERO, policy.delayAfter(2));
    }
    
    @Test
    void rejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class,
            () -> BackoffPolicy.of(0, Duration.ZERO, 2.0, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> BackoffPolicy.of(1, Duration.ofMillis(-1), 2.0, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> BackoffPolicy.of(1, Duration.ZERO, 0.5, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> BackoffPolicy.of(1, Duration.ofSeconds(2), 2.0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
            () -> new BackoffPolicy(1, Duration.ZERO, 2.0, Duration.ZERO, 1.0));
        assertThrows(IllegalArgumentException.class,
            () -> BackoffPolicy.of(3, Duration.ZERO, 2.0, Duration.ZERO).delayAfter(0));
    }
}
