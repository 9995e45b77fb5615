package com.delta.propertytracker.crawl.pacing;

import com.delta.propertytracker.config.ScrapeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Random;

/**
 * Gates every outbound page request of a crawl run against one target host.
 * <p>
 * A call to {@link #awaitTurn()} waits out the peak-hour cooldown (once per call), the
 * rolling one-minute request window and a randomized minimum gap since the previous
 * request, then records the request. Calls are serialized; concurrent callers queue on
 * the scheduler's monitor so the rate holds across threads.
 */
public class PacingScheduler {
    private static final Logger log = LoggerFactory.getLogger(PacingScheduler.class);
    private static final Duration WINDOW = Duration.ofMinutes(1);

    private final ScrapeConfig config;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Random random;
    private final Deque<Instant> window = new ArrayDeque<>();
    private Instant lastRequestAt;

    public PacingScheduler(ScrapeConfig config, Clock clock, Sleeper sleeper) {
        this(config, clock, sleeper, new Random());
    }

    public PacingScheduler(ScrapeConfig config, Clock clock, Sleeper sleeper, Random random) {
        this.config = config;
        this.clock = clock;
        this.sleeper = sleeper;
        this.random = random;
    }

    /**
     * Blocks until the next request may fire and records it. If the thread is interrupted
     * while waiting the interrupt flag is restored and no request is recorded.
     */
    public synchronized void awaitTurn() {
        try {
            if (config.avoidPeakHours() && config.isPeakHour(ZonedDateTime.now(clock).getHour())) {
                Duration cooldown = Duration.ofSeconds(config.peakCooldownSeconds());
                log.info("Peak hours, cooling down for {}s", cooldown.toSeconds());
                sleeper.sleep(cooldown);
            }

            prune(clock.instant());
            while (window.size() >= config.maxRequestsPerMinute()) {
                Instant oldest = window.peekFirst();
                Duration wait = Duration.between(clock.instant(), oldest.plus(WINDOW));
                if (!wait.isNegative() && !wait.isZero()) {
                    log.debug("Request window full, waiting {} ms", wait.toMillis());
                    sleeper.sleep(wait);
                }
                prune(clock.instant());
            }

            if (lastRequestAt != null) {
                Duration gap = sampleGap();
                Duration elapsed = Duration.between(lastRequestAt, clock.instant());
                Duration remaining = gap.minus(elapsed);
                if (!remaining.isNegative() && !remaining.isZero()) {
                    sleeper.sleep(remaining);
                }
            }

            Instant now = clock.instant();
            window.addLast(now);
            lastRequestAt = now;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Pacing wait interrupted");
        }
    }

    public synchronized List<Instant> recordedRequests() {
        return new ArrayList<>(window);
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(WINDOW);
        while (!window.isEmpty() && !window.peekFirst().isAfter(cutoff)) {
            window.pollFirst();
        }
    }

    private Duration sampleGap() {
        double min = config.minDelaySeconds();
        double max = config.maxDelaySeconds();
        double seconds = max > min ? min + random.nextDouble() * (max - min) : min;
        return Duration.ofMillis(Math.round(seconds * 1000.0));
    }
}
