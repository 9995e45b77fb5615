package com.delta.propertytracker.crawl.pacing;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/** Clock that only moves when told to; {@link #sleeper()} advances it instead of blocking. */
public class FakeClock extends Clock {
    private final ZoneId zone;
    private Instant now;
    private final List<Duration> sleeps = new ArrayList<>();

    public FakeClock(Instant start, ZoneId zone) {
        this.now = start;
        this.zone = zone;
    }

    public static FakeClock at(String isoInstant) {
        return new FakeClock(Instant.parse(isoInstant), ZoneId.of("UTC"));
    }

    public synchronized void advance(Duration duration) {
        now = now.plus(duration);
    }

    public Sleeper sleeper() {
        return duration -> {
            synchronized (this) {
                sleeps.add(duration);
            }
            advance(duration);
        };
    }

    public synchronized List<Duration> sleeps() {
        return List.copyOf(sleeps);
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new FakeClock(now, zone);
    }

    @Override
    public synchronized Instant instant() {
        return now;
    }
}
