package com.delta.propertytracker.crawl.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FailureRateGuardTest {

    @Test
    void idleGuardIsNotTripped() {
        FailureRateGuard guard = new FailureRateGuard(0.30);

        assertFalse(guard.tripped());
        assertEquals(0.0, guard.failureRate());
    }

    @Test
    void firstAttemptFailingTripsImmediately() {
        FailureRateGuard guard = new FailureRateGuard(0.30);
        guard.recordFailure();

        assertTrue(guard.tripped());
    }

    @Test
    void tripsOnceTheRunningRateExceedsTheLimit() {
        FailureRateGuard guard = new FailureRateGuard(0.30);
        for (int i = 0; i < 4; i++) {
            guard.recordSuccess();
        }
        guard.recordFailure();
        assertFalse(guard.tripped());

        guard.recordFailure();
        assertTrue(guard.tripped());
        assertEquals(6, guard.attempts());
        assertEquals(4, guard.successes());
    }

    @Test
    void rateEqualToTheLimitDoesNotTrip() {
        FailureRateGuard guard = new FailureRateGuard(0.30);
        for (int i = 0; i < 7; i++) {
            guard.recordSuccess();
        }
        for (int i = 0; i < 3; i++) {
            guard.recordFailure();
        }

        assertEquals(0.3, guard.failureRate(), 1e-9);
        assertFalse(guard.tripped());
    }

    @Test
    void limitAboveOneNeverTrips() {
        FailureRateGuard guard = new FailureRateGuard(5.0);
        guard.recordFailure();
        guard.recordFailure();

        assertFalse(guard.tripped());
    }
}
