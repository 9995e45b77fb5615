package com.delta.propertytracker.crawl.service;

/**
 * Circuit breaker over detail-page attempts: trips once failures divided by attempts so far
 * exceeds the configured rate.
 */
public class FailureRateGuard {
    private final double maxFailureRate;
    private int attempts;
    private int failures;

    public FailureRateGuard(double maxFailureRate) {
        this.maxFailureRate = Math.min(1.0, Math.max(0.0, maxFailureRate));
    }

    public void recordSuccess() {
        attempts++;
    }

    public void recordFailure() {
        attempts++;
        failures++;
    }

    public boolean tripped() {
        return attempts > 0 && failureRate() > maxFailureRate;
    }

    public double failureRate() {
        return attempts == 0 ? 0.0 : (double) failures / attempts;
    }

    public int attempts() {
        return attempts;
    }

    public int failures() {
        return failures;
    }

    public int successes() {
        return attempts - failures;
    }
}
