package com.delta.propertytracker.crawl.pacing;

import com.delta.propertytracker.config.ScrapeConfig;
import com.delta.propertytracker.config.ScraperProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class PacingSchedulerTest {

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void firstRequestGoesOutImmediately() {
        FakeClock clock = FakeClock.at("2024-06-15T21:00:00Z");
        PacingScheduler scheduler = new PacingScheduler(config(3, 3, 10, false), clock, clock.sleeper());

        scheduler.awaitTurn();

        assertThat(clock.sleeps()).isEmpty();
        assertThat(scheduler.recordedRequests()).containsExactly(Instant.parse("2024-06-15T21:00:00Z"));
    }

    @Test
    void waitsOutTheMinimumGapSinceThePreviousRequest() {
        FakeClock clock = FakeClock.at("2024-06-15T21:00:00Z");
        PacingScheduler scheduler = new PacingScheduler(config(3, 3, 10, false), clock, clock.sleeper());

        scheduler.awaitTurn();
        clock.advance(Duration.ofSeconds(1));
        scheduler.awaitTurn();

        assertThat(clock.sleeps()).containsExactly(Duration.ofSeconds(2));
    }

    @Test
    void gapIsSampledBetweenMinAndMaxDelay() {
        FakeClock clock = FakeClock.at("2024-06-15T21:00:00Z");
        PacingScheduler scheduler = new PacingScheduler(config(2, 4, 10, false), clock, clock.sleeper(), new Random(42));

        for (int i = 0; i < 5; i++) {
            scheduler.awaitTurn();
        }

        assertThat(clock.sleeps()).hasSize(4)
            .allSatisfy(sleep -> assertThat(sleep).isBetween(Duration.ofSeconds(2), Duration.ofSeconds(4)));
    }

    @Test
    void neverExceedsTheRequestsPerMinuteCap() {
        FakeClock clock = FakeClock.at("2024-06-15T21:00:00Z");
        PacingScheduler scheduler = new PacingScheduler(config(0, 0, 5, false), clock, clock.sleeper());

        List<Instant> fired = new ArrayList<>();
        for (int i = 0; i < 23; i++) {
            scheduler.awaitTurn();
            fired.add(clock.instant());
        }

        for (Instant start : fired) {
            Instant windowEnd = start.plus(Duration.ofMinutes(1));
            long inWindow = fired.stream()
                .filter(at -> !at.isBefore(start) && at.isBefore(windowEnd))
                .count();
            assertThat(inWindow).isLessThanOrEqualTo(5);
        }
        assertThat(clock.sleeps()).contains(Duration.ofMinutes(1));
    }

    @Test
    void peakHoursAddOneCooldownPerRequest() {
        FakeClock clock = FakeClock.at("2024-06-15T10:30:00Z");
        PacingScheduler scheduler = new PacingScheduler(config(0, 0, 10, true), clock, clock.sleeper());

        scheduler.awaitTurn();

        assertThat(clock.sleeps()).containsExactly(Duration.ofSeconds(60));
    }

    @Test
    void offPeakHoursSkipTheCooldown() {
        FakeClock clock = FakeClock.at("2024-06-15T19:30:00Z");
        PacingScheduler scheduler = new PacingScheduler(config(0, 0, 10, true), clock, clock.sleeper());

        scheduler.awaitTurn();

        assertThat(clock.sleeps()).isEmpty();
    }

    @Test
    void interruptedWaitRestoresFlagAndRecordsNothing() {
        FakeClock clock = FakeClock.at("2024-06-15T10:30:00Z");
        Sleeper interrupting = duration -> {
            throw new InterruptedException("stop");
        };
        PacingScheduler scheduler = new PacingScheduler(config(0, 0, 10, true), clock, interrupting);

        scheduler.awaitTurn();

        assertThat(Thread.currentThread().isInterrupted()).isTrue();
        assertThat(scheduler.recordedRequests()).isEmpty();
    }

    private ScrapeConfig config(double minDelay, double maxDelay, int perMinute, boolean avoidPeak) {
        ScraperProperties properties = new ScraperProperties();
        properties.setMinDelaySeconds(minDelay);
        properties.setMaxDelaySeconds(maxDelay);
        properties.setMaxRequestsPerMinute(perMinute);
        properties.setAvoidPeakHours(avoidPeak);
        properties.setPeakStartHour(9);
        properties.setPeakEndHour(18);
        properties.setPeakCooldownSeconds(60);
        return properties.toScrapeConfig();
    }
}
